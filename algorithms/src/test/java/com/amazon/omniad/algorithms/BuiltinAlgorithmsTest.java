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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.oneOf;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.amazon.omniad.Attributes;
import com.amazon.omniad.Detector;
import com.amazon.omniad.FeatureMatrix;
import com.amazon.omniad.Hyperparameters;
import com.amazon.omniad.common.exception.ConfigException;
import com.amazon.omniad.common.exception.NotFittedException;
import com.amazon.omniad.common.exception.ShapeMismatchException;
import com.amazon.omniad.common.exception.ValidationException;
import com.amazon.omniad.testutils.LabeledDataset;
import com.amazon.omniad.testutils.OutlierTestData;

/**
 * The contract every built-in algorithm has to honor.
 */
public class BuiltinAlgorithmsTest {

    private static final int DIMENSIONS = 3;

    private static LabeledDataset train;
    private static LabeledDataset test;

    @TempDir
    Path directory;

    @BeforeAll
    public static void setUpData() {
        LabeledDataset[] split = new OutlierTestData().generate(900, 100, DIMENSIONS, 2024L).split(0.5);
        train = split[0];
        test = split[1];
    }

    private static Detector<?> create(BuiltinAlgorithms algorithm) {
        Hyperparameters.Builder builder = Hyperparameters.builder().contamination(0.1);
        if (algorithm.getParameterNames().contains(Detector.RANDOM_SEED)) {
            builder.randomSeed(17L);
        }
        return Detectors.create(algorithm.getAlgorithmId(), builder.build());
    }

    @ParameterizedTest
    @EnumSource(BuiltinAlgorithms.class)
    public void testUnfittedDetector(BuiltinAlgorithms algorithm) {
        Detector<?> detector = create(algorithm);

        assertEquals(algorithm.getAlgorithmId(), detector.getAlgorithmId());
        assertFalse(detector.isFitted());
        assertThrows(NotFittedException.class, () -> detector.predictScore(test.getData()));
        assertThrows(NotFittedException.class, () -> detector.predict(test.getData()));
        assertThrows(NotFittedException.class, () -> detector.save(directory.resolve("unfitted.zip")));
    }

    @ParameterizedTest
    @EnumSource(BuiltinAlgorithms.class)
    public void testFitAndPredict(BuiltinAlgorithms algorithm) {
        Detector<?> detector = create(algorithm);
        detector.fit(train.getData());

        assertTrue(detector.getThreshold().isPresent());
        assertEquals(DIMENSIONS, detector.getAttributes().getInt(Attributes.DIMENSIONS));
        assertEquals(train.size(), detector.getAttributes().getInt(Attributes.TRAINING_ROWS));

        int[] trainingLabels = detector.predict(train.getData());
        double flagged = Arrays.stream(trainingLabels).sum() / (double) train.size();
        assertThat(flagged, allOf(greaterThanOrEqualTo(0.05), lessThanOrEqualTo(0.15)));

        double[] scores = detector.predictScore(test.getData());
        int[] labels = detector.predict(test.getData());
        assertEquals(test.size(), scores.length);
        assertEquals(test.size(), labels.length);
        List<Integer> labelList = Arrays.stream(labels).boxed().collect(Collectors.toList());
        assertThat(labelList, everyItem(oneOf(0, 1)));
    }

    @ParameterizedTest
    @EnumSource(BuiltinAlgorithms.class)
    public void testOutliersScoreHigher(BuiltinAlgorithms algorithm) {
        Detector<?> detector = create(algorithm);
        detector.fit(train.getData());

        double[] means = test.meanScoreByLabel(detector.predictScore(test.getData()));

        assertThat(means[1], greaterThan(means[0]));
    }

    @ParameterizedTest
    @EnumSource(BuiltinAlgorithms.class)
    public void testInputChecks(BuiltinAlgorithms algorithm) {
        Detector<?> detector = create(algorithm);
        assertThrows(ValidationException.class, () -> detector.fit(new double[][] { { 1, 2 }, { 3 } }));
        assertFalse(detector.isFitted());

        detector.fit(train.getData());
        assertThrows(ShapeMismatchException.class, () -> detector.predictScore(new double[][] { { 1, 2 } }));
        assertThrows(ValidationException.class,
                () -> detector.predict(new double[][] { { 1, Double.NaN, 3 } }));
    }

    @ParameterizedTest
    @EnumSource(BuiltinAlgorithms.class)
    public void testSaveAndLoad(BuiltinAlgorithms algorithm) throws IOException {
        Detector<?> detector = create(algorithm);
        detector.fit(FeatureMatrix.of(train.getData(), List.of("a", "b", "c")));
        Path path = directory.resolve(algorithm.name() + ".zip");

        detector.save(path);
        Detector<?> loaded = Detectors.load(path);

        assertEquals(detector.getAlgorithmId(), loaded.getAlgorithmId());
        assertEquals(detector.getThreshold(), loaded.getThreshold());
        assertEquals(detector.getAttributes(), loaded.getAttributes());
        assertEquals(detector.getHyperparameters(), loaded.getHyperparameters());
        assertArrayEquals(detector.predictScore(test.getData()), loaded.predictScore(test.getData()));
        assertArrayEquals(detector.predict(test.getData()), loaded.predict(test.getData()));
    }

    @ParameterizedTest
    @EnumSource(BuiltinAlgorithms.class)
    public void testRefit(BuiltinAlgorithms algorithm) {
        Detector<?> detector = create(algorithm);
        detector.fit(train.getData());

        double[][] wider = new double[50][];
        for (int i = 0; i < wider.length; i++) {
            wider[i] = new double[] { i, i % 7, i % 3, i % 2 };
        }
        detector.fit(wider);

        assertEquals(4, detector.getAttributes().getInt(Attributes.DIMENSIONS));
        assertThrows(ShapeMismatchException.class, () -> detector.predictScore(train.getData()));
        assertEquals(50, detector.predictScore(wider).length);
    }

    @ParameterizedTest
    @EnumSource(BuiltinAlgorithms.class)
    public void testRefitMatchesFreshFit(BuiltinAlgorithms algorithm) {
        Detector<?> refitted = create(algorithm);
        refitted.fit(FeatureMatrix.of(test.getData(), List.of("a", "b", "c")));
        refitted.fit(train.getData());

        Detector<?> fresh = create(algorithm);
        fresh.fit(train.getData());

        assertEquals(fresh.getThreshold(), refitted.getThreshold());
        assertEquals(fresh.getAttributes(), refitted.getAttributes());
        assertArrayEquals(fresh.predictScore(test.getData()), refitted.predictScore(test.getData()));
        assertArrayEquals(fresh.predict(train.getData()), refitted.predict(train.getData()));
    }

    @ParameterizedTest
    @EnumSource(BuiltinAlgorithms.class)
    public void testUnknownParameter(BuiltinAlgorithms algorithm) {
        Hyperparameters hyperparameters = Hyperparameters.builder().put("noSuchParameter", 1).build();
        ConfigException exception = assertThrows(ConfigException.class,
                () -> Detectors.create(algorithm.getAlgorithmId(), hyperparameters));
        assertEquals(algorithm.getAlgorithmId(), exception.getAlgorithmId());
    }
}
