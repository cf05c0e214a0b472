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

package com.amazon.omniad.registry;

import static com.amazon.omniad.CommonUtils.checkArgument;
import static com.amazon.omniad.CommonUtils.checkNotNull;
import static com.amazon.omniad.CommonUtils.checkState;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.omniad.Detector;
import com.amazon.omniad.Hyperparameters;
import com.amazon.omniad.common.exception.DuplicateRegistrationException;
import com.amazon.omniad.common.exception.UnknownAlgorithmException;

/**
 * Maps algorithm ids to the factories that build their detectors. Loading an
 * archive goes through a registry to turn the id stored in the archive back
 * into a detector of the right kind.
 *
 * <p>
 * A registry is populated once and then frozen; after {@link #freeze()} it is
 * read-only and can be shared by any number of threads.
 */
public class DetectorRegistry {

    private static final Logger LOG = LogManager.getLogger(DetectorRegistry.class);

    private final ConcurrentMap<String, DetectorFactory> factories = new ConcurrentHashMap<>();

    private volatile boolean frozen = false;

    /**
     * Binds an id to a factory. Registering the same factory again is a no-op.
     *
     * @param algorithmId the id
     * @param factory     the factory
     * @throws DuplicateRegistrationException if a different factory is bound to
     *                                        the id
     * @throws IllegalStateException          if the registry is frozen
     */
    public synchronized void register(String algorithmId, DetectorFactory factory) {
        checkNotNull(algorithmId, "algorithmId must not be null");
        checkArgument(!algorithmId.isEmpty(), "algorithmId must not be empty");
        checkNotNull(factory, "factory must not be null");
        checkState(!frozen, "registry is frozen, cannot register " + algorithmId);

        DetectorFactory existing = factories.putIfAbsent(algorithmId, factory);
        if (existing == null) {
            LOG.debug("registered algorithm {}", algorithmId);
        } else if (!existing.equals(factory)) {
            throw new DuplicateRegistrationException(algorithmId);
        }
    }

    /**
     * Builds an unfitted detector.
     *
     * @param algorithmId     the id
     * @param hyperparameters construction parameters
     * @return the detector shell
     * @throws UnknownAlgorithmException if nothing is bound to the id
     */
    public Detector<?> resolve(String algorithmId, Hyperparameters hyperparameters) {
        checkNotNull(algorithmId, "algorithmId must not be null");
        checkNotNull(hyperparameters, "hyperparameters must not be null");
        DetectorFactory factory = factories.get(algorithmId);
        if (factory == null) {
            throw new UnknownAlgorithmException(algorithmId, getAlgorithmIds());
        }
        Detector<?> detector = factory.create(algorithmId, hyperparameters);
        checkState(detector != null && algorithmId.equals(detector.getAlgorithmId()),
                "factory for " + algorithmId + " must return a detector carrying that id");
        return detector;
    }

    public Detector<?> resolve(String algorithmId) {
        return resolve(algorithmId, Hyperparameters.EMPTY);
    }

    public boolean isRegistered(String algorithmId) {
        return factories.containsKey(algorithmId);
    }

    public SortedSet<String> getAlgorithmIds() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(factories.keySet()));
    }

    /**
     * Ends the initialization phase; later registrations fail.
     */
    public synchronized void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }
}
