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

package com.amazon.omniad;

import java.io.IOException;
import java.nio.file.Path;
import java.util.OptionalDouble;

/**
 * The scoring contract shared by every detector.
 */
public interface IDetector {

    /**
     * @return the registry id of the algorithm
     */
    String getAlgorithmId();

    /**
     * @return the expected fraction of outliers in the training data
     */
    double getContamination();

    /**
     * @return true once a fit has completed
     */
    boolean isFitted();

    /**
     * @return the decision threshold, empty until fitted
     */
    OptionalDouble getThreshold();

    /**
     * Fits the detector and derives its threshold.
     *
     * @param input training data
     * @return this detector
     */
    IDetector fit(FeatureMatrix input);

    /**
     * @param input rows to score
     * @return one anomaly score per row, higher is more anomalous
     */
    double[] predictScore(FeatureMatrix input);

    /**
     * @param input rows to label
     * @return 1 for rows scoring at or above the threshold, 0 otherwise
     */
    int[] predict(FeatureMatrix input);

    /**
     * @param input     rows to label
     * @param threshold threshold to use instead of the fitted one
     * @return 1 for rows scoring at or above {@code threshold}, 0 otherwise
     */
    int[] predict(FeatureMatrix input, double threshold);

    /**
     * Writes the fitted detector to a single archive file.
     *
     * @param destination the archive path
     * @throws IOException if the file cannot be written
     */
    void save(Path destination) throws IOException;

    default IDetector fit(double[][] input) {
        return fit(FeatureMatrix.of(input));
    }

    default double[] predictScore(double[][] input) {
        return predictScore(FeatureMatrix.of(input));
    }

    default int[] predict(double[][] input) {
        return predict(FeatureMatrix.of(input));
    }

    default int[] predict(double[][] input, double threshold) {
        return predict(FeatureMatrix.of(input), threshold);
    }
}
