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

package com.amazon.omniad.algorithms.isolationforest;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.omniad.Attributes;
import com.amazon.omniad.Detector;
import com.amazon.omniad.capability.IFeatureImportance;
import com.amazon.omniad.capability.IReconstruction;
import com.amazon.omniad.common.exception.FitCancelledException;
import com.amazon.omniad.testutils.LabeledDataset;
import com.amazon.omniad.testutils.OutlierTestData;

public class IsolationForestBackendTest {

    private LabeledDataset dataset;

    @BeforeEach
    public void setUp() {
        dataset = new OutlierTestData().generate(380, 20, 4, 99L);
    }

    @Test
    public void testDefaults() {
        IsolationForestBackend backend = IsolationForestBackend.builder().build();

        assertEquals(IsolationForestBackend.DEFAULT_NUMBER_OF_TREES, backend.getNumberOfTrees());
        assertEquals(IsolationForestBackend.DEFAULT_SAMPLE_SIZE, backend.getSampleSize());
        assertFalse(backend.getRandomSeed().isPresent());
        assertFalse(backend.isParallelExecutionEnabled());
        assertEquals(0, backend.getThreadPoolSize());

        IsolationForestBackend parallel = IsolationForestBackend.builder().parallelExecutionEnabled(true).build();
        assertThat(parallel.getThreadPoolSize(), greaterThanOrEqualTo(1));
    }

    @Test
    public void testInvalidBuilderArguments() {
        assertThrows(IllegalArgumentException.class, () -> IsolationForestBackend.builder().numberOfTrees(0).build());
        assertThrows(IllegalArgumentException.class, () -> IsolationForestBackend.builder().sampleSize(-3).build());
        assertThrows(IllegalArgumentException.class,
                () -> IsolationForestBackend.builder().parallelExecutionEnabled(true).threadPoolSize(0).build());
    }

    @Test
    public void testSameSeedSameForest() {
        IsolationForestBackend first = IsolationForestBackend.builder().numberOfTrees(30).randomSeed(42).build();
        IsolationForestBackend second = IsolationForestBackend.builder().numberOfTrees(30).randomSeed(42).build();
        IsolationForestBackend other = IsolationForestBackend.builder().numberOfTrees(30).randomSeed(43).build();

        IsolationForestModel model = first.fit(dataset.getData(), Attributes.builder());
        IsolationForestModel sameModel = second.fit(dataset.getData(), Attributes.builder());
        IsolationForestModel otherModel = other.fit(dataset.getData(), Attributes.builder());

        assertEquals(model, sameModel);
        assertArrayEquals(first.serialize(model), second.serialize(sameModel));
        assertArrayEquals(first.score(model, Attributes.empty(), dataset.getData()),
                second.score(sameModel, Attributes.empty(), dataset.getData()));
        assertNotEquals(model, otherModel);
    }

    @Test
    public void testParallelMatchesSequential() {
        IsolationForestBackend sequential = IsolationForestBackend.builder().numberOfTrees(40).randomSeed(7).build();
        IsolationForestBackend parallel = IsolationForestBackend.builder().numberOfTrees(40).randomSeed(7)
                .parallelExecutionEnabled(true).threadPoolSize(3).build();

        assertEquals(sequential.fit(dataset.getData(), Attributes.builder()),
                parallel.fit(dataset.getData(), Attributes.builder()));
    }

    @Test
    public void testScores() {
        IsolationForestBackend backend = IsolationForestBackend.builder().numberOfTrees(50).randomSeed(1).build();
        IsolationForestModel model = backend.fit(dataset.getData(), Attributes.builder());

        double[] scores = backend.score(model, Attributes.empty(), dataset.getData());

        for (double score : scores) {
            assertThat(score, allOf(greaterThan(0.0), lessThanOrEqualTo(1.0)));
        }
        double[] means = dataset.meanScoreByLabel(scores);
        assertThat(means[1], greaterThan(means[0] + 0.1));
    }

    @Test
    public void testAttributes() {
        IsolationForestBackend backend = IsolationForestBackend.builder().numberOfTrees(12).sampleSize(1000)
                .randomSeed(2).build();
        Attributes.Builder attributes = Attributes.builder();

        IsolationForestModel model = backend.fit(dataset.getData(), attributes);

        Attributes built = attributes.build();
        assertEquals(12, built.getInt(IsolationForestBackend.NUMBER_OF_TREES_ATTRIBUTE));
        assertEquals(dataset.size(), built.getInt(IsolationForestBackend.SAMPLE_SIZE_ATTRIBUTE));
        assertEquals(dataset.size(), model.getSampleSize());
        assertEquals(4, model.getDimensions());
        assertEquals(12, model.getTrees().size());
    }

    @Test
    public void testFeatureImportances() {
        double[][] data = new double[200][];
        Arrays.setAll(data, i -> new double[] { i % 17, 5, -1 });
        Detector<IsolationForestModel> detector = new Detector<>("IsolationForest",
                IsolationForestBackend.builder().numberOfTrees(20).randomSeed(3).build());

        detector.fit(data);
        double[] importances = detector.getCapability(IFeatureImportance.class).get().getFeatureImportances();

        assertArrayEquals(new double[] { 1, 0, 0 }, importances, 1e-12);
        assertFalse(detector.hasCapability(IReconstruction.class));

        detector.fit(dataset.getData());
        importances = detector.getCapability(IFeatureImportance.class).get().getFeatureImportances();
        assertEquals(4, importances.length);
        assertEquals(1.0, Arrays.stream(importances).sum(), 1e-9);
        for (double importance : importances) {
            assertThat(importance, greaterThan(0.0));
        }
    }

    @Test
    public void testConstantData() {
        double[][] data = new double[10][];
        Arrays.setAll(data, i -> new double[] { 2, 2 });
        Detector<IsolationForestModel> detector = new Detector<>("IsolationForest",
                IsolationForestBackend.builder().numberOfTrees(5).randomSeed(4).build());

        detector.fit(data);

        assertArrayEquals(new double[] { 0.5, 0.5 }, detector.predictScore(new double[][] { { 2, 2 }, { 9, 9 } }));
        assertArrayEquals(new double[] { 0.5, 0.5 },
                detector.getCapability(IFeatureImportance.class).get().getFeatureImportances());
    }

    @Test
    public void testSingleRow() {
        Detector<IsolationForestModel> detector = new Detector<>("IsolationForest",
                IsolationForestBackend.builder().numberOfTrees(3).randomSeed(5).build());

        detector.fit(new double[][] { { 1, 2, 3 } });

        assertEquals(1.0, detector.getThreshold().getAsDouble());
        assertArrayEquals(new int[] { 1 }, detector.predict(new double[][] { { 4, 5, 6 } }));
    }

    @Test
    public void testInterruptedFit() {
        Detector<IsolationForestModel> detector = new Detector<>("IsolationForest",
                IsolationForestBackend.builder().numberOfTrees(10).randomSeed(6).build());
        Thread.currentThread().interrupt();
        try {
            FitCancelledException exception = assertThrows(FitCancelledException.class,
                    () -> detector.fit(dataset.getData()));
            assertEquals("IsolationForest", exception.getAlgorithmId());
        } finally {
            assertTrue(Thread.interrupted());
        }
        assertFalse(detector.isFitted());

        detector.fit(dataset.getData());
        assertTrue(detector.isFitted());
    }

    @Test
    public void testSerialization() {
        IsolationForestBackend backend = IsolationForestBackend.builder().numberOfTrees(8).randomSeed(8).build();
        IsolationForestModel model = backend.fit(dataset.getData(), Attributes.builder());

        IsolationForestModel copy = backend.deserialize(backend.serialize(model));

        assertEquals(model, copy);
        assertArrayEquals(model.score(dataset.getData()), copy.score(dataset.getData()));
        assertThrows(IllegalArgumentException.class, () -> backend.deserialize(new byte[0]));
    }
}
