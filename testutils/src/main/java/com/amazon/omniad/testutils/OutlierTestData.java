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

import java.util.Random;

/**
 * Generates inliers from a multivariate normal distribution with covariance
 * {@code sigma * I} and outliers uniformly from a shell that lies well outside
 * it. Rows are shuffled so that any prefix holds both kinds.
 */
public class OutlierTestData {

    private final double mu;
    private final double sigma;
    private final double outlierMinDistance;
    private final double outlierMaxDistance;

    public OutlierTestData(double mu, double sigma, double outlierMinDistance, double outlierMaxDistance) {
        this.mu = mu;
        this.sigma = sigma;
        this.outlierMinDistance = outlierMinDistance;
        this.outlierMaxDistance = outlierMaxDistance;
    }

    public OutlierTestData() {
        this(0.0, 1.0, 5.0, 8.0);
    }

    public LabeledDataset generate(int numberOfInliers, int numberOfOutliers, int dimensions, long seed) {
        Random random = new Random(seed);
        NormalDistribution normal = new NormalDistribution(random);
        int total = numberOfInliers + numberOfOutliers;
        double[][] data = new double[total][dimensions];
        int[] labels = new int[total];

        for (int i = 0; i < numberOfInliers; i++) {
            for (int j = 0; j < dimensions; j++) {
                data[i][j] = normal.nextDouble(mu, sigma);
            }
        }
        for (int i = numberOfInliers; i < total; i++) {
            for (int j = 0; j < dimensions; j++) {
                double distance = outlierMinDistance + random.nextDouble() * (outlierMaxDistance - outlierMinDistance);
                data[i][j] = mu + (random.nextBoolean() ? distance : -distance) * sigma;
            }
            labels[i] = 1;
        }

        for (int i = total - 1; i > 0; i--) {
            int k = random.nextInt(i + 1);
            double[] row = data[i];
            data[i] = data[k];
            data[k] = row;
            int label = labels[i];
            labels[i] = labels[k];
            labels[k] = label;
        }
        return new LabeledDataset(data, labels);
    }

    /**
     * Points on a line through {@code origin} along {@code direction}, for
     * models that look for low dimensional structure.
     *
     * @param numberOfRows number of points
     * @param origin       a point on the line
     * @param direction    the direction of the line
     * @param seed         random seed
     * @return the points
     */
    public static double[][] generateOnLine(int numberOfRows, double[] origin, double[] direction, long seed) {
        Random random = new Random(seed);
        double[][] data = new double[numberOfRows][origin.length];
        for (int i = 0; i < numberOfRows; i++) {
            double t = 10 * random.nextDouble() - 5;
            for (int j = 0; j < origin.length; j++) {
                data[i][j] = origin[j] + t * direction[j];
            }
        }
        return data;
    }
}
