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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

import com.amazon.omniad.Detector;
import com.amazon.omniad.Hyperparameters;
import com.amazon.omniad.algorithms.isolationforest.IsolationForestBackend;
import com.amazon.omniad.algorithms.pca.PcaBackend;
import com.amazon.omniad.common.exception.ConfigException;
import com.amazon.omniad.registry.DetectorFactory;

/**
 * The algorithms that ship with the library, each with the hyperparameters it
 * accepts.
 */
public enum BuiltinAlgorithms implements DetectorFactory {

    ISOLATION_FOREST("IsolationForest", Detector.CONTAMINATION, Detector.RANDOM_SEED, "numberOfTrees", "sampleSize",
            "parallelExecutionEnabled", "threadPoolSize") {
        @Override
        public Detector<?> create(String algorithmId, Hyperparameters hyperparameters) {
            hyperparameters.checkKnown(algorithmId, getParameterNames());
            IsolationForestBackend.Builder<?> builder = IsolationForestBackend.builder()
                    .numberOfTrees(
                            hyperparameters.getInt("numberOfTrees", IsolationForestBackend.DEFAULT_NUMBER_OF_TREES))
                    .sampleSize(hyperparameters.getInt("sampleSize", IsolationForestBackend.DEFAULT_SAMPLE_SIZE))
                    .parallelExecutionEnabled(hyperparameters.getBoolean("parallelExecutionEnabled",
                            IsolationForestBackend.DEFAULT_PARALLEL_EXECUTION_ENABLED));
            hyperparameters.findLong(Detector.RANDOM_SEED).ifPresent(builder::randomSeed);
            if (hyperparameters.contains("threadPoolSize")) {
                builder.threadPoolSize(hyperparameters.getInt("threadPoolSize", 1));
            }
            return new Detector<>(algorithmId, buildBackend(algorithmId, builder::build), hyperparameters);
        }
    },

    PCA("PCA", Detector.CONTAMINATION, "numberOfComponents", "standardize") {
        @Override
        public Detector<?> create(String algorithmId, Hyperparameters hyperparameters) {
            hyperparameters.checkKnown(algorithmId, getParameterNames());
            PcaBackend.Builder<?> builder = PcaBackend.builder().algorithmId(algorithmId)
                    .standardize(hyperparameters.getBoolean("standardize", PcaBackend.DEFAULT_STANDARDIZE));
            if (hyperparameters.contains("numberOfComponents")) {
                builder.numberOfComponents(hyperparameters.getInt("numberOfComponents", 1));
            }
            return new Detector<>(algorithmId, buildBackend(algorithmId, builder::build), hyperparameters);
        }
    };

    private final String algorithmId;
    private final List<String> parameterNames;

    BuiltinAlgorithms(String algorithmId, String... parameterNames) {
        this.algorithmId = algorithmId;
        this.parameterNames = Collections.unmodifiableList(Arrays.asList(parameterNames));
    }

    public String getAlgorithmId() {
        return algorithmId;
    }

    public List<String> getParameterNames() {
        return parameterNames;
    }

    /**
     * Builder preconditions fail with {@link IllegalArgumentException}; to a
     * caller configuring through hyperparameters that is a configuration error.
     */
    private static <B> B buildBackend(String algorithmId, Supplier<B> constructor) {
        try {
            return constructor.get();
        } catch (IllegalArgumentException e) {
            throw new ConfigException(algorithmId, e.getMessage());
        }
    }
}
