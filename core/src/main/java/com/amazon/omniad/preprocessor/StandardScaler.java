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

package com.amazon.omniad.preprocessor;

import static com.amazon.omniad.CommonUtils.checkArgument;
import static com.amazon.omniad.CommonUtils.checkNotNull;

import java.util.Arrays;

import com.amazon.omniad.Attributes;

/**
 * Per-column standardization, {@code (x - mean) / scale}. A column without
 * variance gets a scale of one, so it is centered but not blown up. The fitted
 * mean and scale are recorded as attributes under a prefix and rebuilt from
 * them at scoring time.
 */
public class StandardScaler {

    public static final String DEFAULT_PREFIX = "scaler";

    private final double[] mean;
    private final double[] scale;

    public StandardScaler(double[] mean, double[] scale) {
        checkNotNull(mean, "mean must not be null");
        checkNotNull(scale, "scale must not be null");
        checkArgument(mean.length == scale.length, "mean and scale must have the same length");
        for (double value : scale) {
            checkArgument(value > 0 && Double.isFinite(value), "scale entries must be positive and finite");
        }
        this.mean = mean.clone();
        this.scale = scale.clone();
    }

    /**
     * Estimates mean and population standard deviation of every column.
     *
     * @param data non empty rectangular data
     * @return the fitted scaler
     */
    public static StandardScaler fit(double[][] data) {
        return fit(data, true);
    }

    /**
     * @param data        non empty rectangular data
     * @param withScaling false to only center, leaving every scale at one
     * @return the fitted scaler
     */
    public static StandardScaler fit(double[][] data, boolean withScaling) {
        checkArgument(data != null && data.length > 0, "data must not be empty");
        int dimensions = data[0].length;
        double[] mean = new double[dimensions];
        double[] scale = new double[dimensions];
        for (double[] row : data) {
            for (int j = 0; j < dimensions; j++) {
                mean[j] += row[j];
            }
        }
        for (int j = 0; j < dimensions; j++) {
            mean[j] /= data.length;
        }
        if (!withScaling) {
            Arrays.fill(scale, 1.0);
            return new StandardScaler(mean, scale);
        }
        for (double[] row : data) {
            for (int j = 0; j < dimensions; j++) {
                double delta = row[j] - mean[j];
                scale[j] += delta * delta;
            }
        }
        for (int j = 0; j < dimensions; j++) {
            double deviation = Math.sqrt(scale[j] / data.length);
            scale[j] = deviation > 0 && Double.isFinite(deviation) ? deviation : 1.0;
        }
        return new StandardScaler(mean, scale);
    }

    public int getDimensions() {
        return mean.length;
    }

    public double[] getMean() {
        return mean.clone();
    }

    public double[] getScale() {
        return scale.clone();
    }

    public double[][] transform(double[][] data) {
        double[][] result = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            result[i] = transform(data[i]);
        }
        return result;
    }

    public double[] transform(double[] point) {
        checkArgument(point.length == mean.length, "point has the wrong number of columns");
        double[] result = new double[point.length];
        for (int j = 0; j < point.length; j++) {
            result[j] = (point[j] - mean[j]) / scale[j];
        }
        return result;
    }

    public double[] inverseTransform(double[] point) {
        checkArgument(point.length == mean.length, "point has the wrong number of columns");
        double[] result = new double[point.length];
        for (int j = 0; j < point.length; j++) {
            result[j] = point[j] * scale[j] + mean[j];
        }
        return result;
    }

    /**
     * Records the scaler as {@code <prefix>.mean} and {@code <prefix>.scale}.
     *
     * @param prefix  attribute name prefix
     * @param builder the attributes being assembled
     */
    public void toAttributes(String prefix, Attributes.Builder builder) {
        builder.put(prefix + ".mean", mean).put(prefix + ".scale", scale);
    }

    public static StandardScaler fromAttributes(String prefix, Attributes attributes) {
        return new StandardScaler(attributes.getDoubleArray(prefix + ".mean"),
                attributes.getDoubleArray(prefix + ".scale"));
    }
}
