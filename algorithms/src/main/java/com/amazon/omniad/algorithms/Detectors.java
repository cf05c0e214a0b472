/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.omniad.algorithms;

import java.io.IOException;
import java.nio.file.Path;

import com.amazon.omniad.Detector;
import com.amazon.omniad.Hyperparameters;
import com.amazon.omniad.registry.DetectorRegistry;

/**
 * Entry point for applications: creates and loads detectors by algorithm id.
 *
 * <pre>
 * Detector&lt;?&gt; detector = Detectors.create("IsolationForest",
 *         Hyperparameters.builder().contamination(0.05).randomSeed(42).build());
 * detector.fit(trainingData);
 * int[] labels = detector.predict(newData);
 * detector.save(Paths.get("detector.zip"));
 * </pre>
 *
 * The default registry holds the {@link BuiltinAlgorithms} and is frozen when
 * this class is initialized. Applications that add their own algorithms start
 * from {@link #newRegistry()} and use {@link Detector#load} with it.
 */
public final class Detectors {

    private static final DetectorRegistry DEFAULT_REGISTRY = newRegistry();

    static {
        DEFAULT_REGISTRY.freeze();
    }

    private Detectors() {
    }

    /**
     * @return the process wide registry of built-in algorithms, read-only
     */
    public static DetectorRegistry registry() {
        return DEFAULT_REGISTRY;
    }

    /**
     * @return a new, unfrozen registry holding the built-in algorithms
     */
    public static DetectorRegistry newRegistry() {
        DetectorRegistry registry = new DetectorRegistry();
        for (BuiltinAlgorithms algorithm : BuiltinAlgorithms.values()) {
            registry.register(algorithm.getAlgorithmId(), algorithm);
        }
        return registry;
    }

    public static Detector<?> create(String algorithmId) {
        return DEFAULT_REGISTRY.resolve(algorithmId);
    }

    /**
     * @param algorithmId     a built-in algorithm id
     * @param hyperparameters construction parameters
     * @return an unfitted detector
     * @throws com.amazon.omniad.common.exception.UnknownAlgorithmException if
     *         the id is not built in
     * @throws com.amazon.omniad.common.exception.ConfigException if a
     *         parameter is unknown or invalid
     */
    public static Detector<?> create(String algorithmId, Hyperparameters hyperparameters) {
        return DEFAULT_REGISTRY.resolve(algorithmId, hyperparameters);
    }

    public static Detector<?> load(Path source) throws IOException {
        return Detector.load(source, DEFAULT_REGISTRY);
    }
}
