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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.omniad.CentroidDistanceBackend;
import com.amazon.omniad.Detector;
import com.amazon.omniad.FirstColumnBackend;
import com.amazon.omniad.Hyperparameters;
import com.amazon.omniad.common.exception.ConfigException;
import com.amazon.omniad.common.exception.DuplicateRegistrationException;
import com.amazon.omniad.common.exception.UnknownAlgorithmException;

public class DetectorRegistryTest {

    private static final DetectorFactory FIRST_COLUMN = (id, hyperparameters) -> new Detector<>(id,
            new FirstColumnBackend(), hyperparameters);

    private static final DetectorFactory CENTROID = (id, hyperparameters) -> new Detector<>(id,
            new CentroidDistanceBackend(), hyperparameters);

    private DetectorRegistry registry;

    @BeforeEach
    public void setUp() {
        registry = new DetectorRegistry();
        registry.register("FirstColumn", FIRST_COLUMN);
    }

    @Test
    public void testResolveBuildsUnfittedDetector() {
        Detector<?> detector = registry.resolve("FirstColumn",
                Hyperparameters.builder().contamination(0.3).build());

        assertEquals("FirstColumn", detector.getAlgorithmId());
        assertEquals(0.3, detector.getContamination());
        assertFalse(detector.isFitted());
        assertEquals(Detector.DEFAULT_CONTAMINATION, registry.resolve("FirstColumn").getContamination());
    }

    @Test
    public void testSameFactoryTwiceIsNoop() {
        registry.register("FirstColumn", FIRST_COLUMN);
        assertThat(registry.getAlgorithmIds(), contains("FirstColumn"));
    }

    @Test
    public void testDifferentFactoryIsRejected() {
        DuplicateRegistrationException exception = assertThrows(DuplicateRegistrationException.class,
                () -> registry.register("FirstColumn", CENTROID));
        assertEquals("FirstColumn", exception.getAlgorithmId());
        assertTrue(exception instanceof ConfigException);
    }

    @Test
    public void testUnknownAlgorithmListsAvailableIds() {
        registry.register("Centroid", CENTROID);

        UnknownAlgorithmException exception = assertThrows(UnknownAlgorithmException.class,
                () -> registry.resolve("Missing"));
        assertThat(exception.getMessage(), containsString("[Centroid, FirstColumn]"));
        assertFalse(registry.isRegistered("Missing"));
    }

    @Test
    public void testFrozenRegistryIsReadOnly() {
        registry.freeze();

        assertTrue(registry.isFrozen());
        assertThrows(IllegalStateException.class, () -> registry.register("Centroid", CENTROID));
        assertEquals("FirstColumn", registry.resolve("FirstColumn").getAlgorithmId());
    }

    @Test
    public void testFactoryMustKeepTheId() {
        registry.register("Renamed", (id, hyperparameters) -> new Detector<>("Other", new FirstColumnBackend()));
        assertThrows(IllegalStateException.class, () -> registry.resolve("Renamed"));
    }

    @Test
    public void testAlgorithmIdsAreSortedAndUnmodifiable() {
        registry.register("Centroid", CENTROID);

        assertThat(registry.getAlgorithmIds(), contains("Centroid", "FirstColumn"));
        assertThrows(UnsupportedOperationException.class, () -> registry.getAlgorithmIds().add("x"));
    }
}
