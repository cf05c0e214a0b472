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

package com.amazon.omniad.threshold;

import static com.amazon.omniad.CommonUtils.checkArgument;
import static com.amazon.omniad.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * Derives a decision threshold from a vector of scores so that, on that
 * vector, roughly a {@code contamination} fraction of the scores lie at or
 * above the threshold.
 */
public class QuantileThresholder {

    private final double contamination;

    /**
     * @param contamination the expected fraction of outliers, in (0, 1)
     */
    public QuantileThresholder(double contamination) {
        checkArgument(contamination > 0 && contamination < 1, "contamination must be in (0, 1)");
        this.contamination = contamination;
    }

    public double getContamination() {
        return contamination;
    }

    /**
     * @param scores in-sample scores, finite and non-empty
     * @return the {@code (1 - contamination)} quantile of the scores
     */
    public double getThreshold(double[] scores) {
        return quantile(scores, 1 - contamination);
    }

    /**
     * Computes a quantile with linear interpolation between the two nearest
     * order statistics. With the scores sorted as {@code x[0..n-1]} and
     * {@code h = (n - 1) * q}, the result is
     * {@code x[floor(h)] + (h - floor(h)) * (x[floor(h) + 1] - x[floor(h)])}.
     *
     * @param values the sample; not modified
     * @param q      the quantile, in [0, 1]
     * @return the interpolated quantile
     */
    public static double quantile(double[] values, double q) {
        checkNotNull(values, "values must not be null");
        checkArgument(values.length > 0, "values must not be empty");
        checkArgument(q >= 0 && q <= 1, "q must be in [0, 1]");

        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double h = (sorted.length - 1) * q;
        int lower = (int) Math.floor(h);
        if (lower >= sorted.length - 1) {
            return sorted[sorted.length - 1];
        }
        double fraction = h - lower;
        return sorted[lower] + fraction * (sorted[lower + 1] - sorted[lower]);
    }
}
