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

package com.amazon.omniad.testutils;

import java.util.Arrays;

/**
 * Rows together with their ground truth, 1 for an outlier and 0 for an
 * inlier.
 */
public class LabeledDataset {

    private final double[][] data;
    private final int[] labels;

    public LabeledDataset(double[][] data, int[] labels) {
        if (data.length != labels.length) {
            throw new IllegalArgumentException("one label per row is required");
        }
        this.data = data;
        this.labels = labels;
    }

    public double[][] getData() {
        return data;
    }

    public int[] getLabels() {
        return labels;
    }

    public int size() {
        return data.length;
    }

    public int getNumberOfOutliers() {
        return Arrays.stream(labels).sum();
    }

    /**
     * Splits the rows in order; the data is already shuffled by the generator.
     *
     * @param trainFraction fraction of the rows that go to the first part
     * @return the training part and the test part
     */
    public LabeledDataset[] split(double trainFraction) {
        int cut = (int) Math.round(data.length * trainFraction);
        return new LabeledDataset[] {
                new LabeledDataset(Arrays.copyOfRange(data, 0, cut), Arrays.copyOfRange(labels, 0, cut)),
                new LabeledDataset(Arrays.copyOfRange(data, cut, data.length),
                        Arrays.copyOfRange(labels, cut, labels.length)) };
    }

    /**
     * @param scores one score per row
     * @return mean score of the inliers and mean score of the outliers
     */
    public double[] meanScoreByLabel(double[] scores) {
        double[] sums = new double[2];
        int[] counts = new int[2];
        for (int i = 0; i < scores.length; i++) {
            sums[labels[i]] += scores[i];
            counts[labels[i]]++;
        }
        return new double[] { sums[0] / Math.max(1, counts[0]), sums[1] / Math.max(1, counts[1]) };
    }
}
