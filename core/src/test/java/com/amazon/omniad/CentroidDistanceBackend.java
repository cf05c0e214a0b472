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

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Optional;

import com.amazon.omniad.capability.IFeatureImportance;

/**
 * Scores a row by its Euclidean distance to the training centroid.
 */
public class CentroidDistanceBackend implements IBackend<double[]> {

    public static final String CENTROID = "centroid";

    @Override
    public double[] fit(double[][] data, Attributes.Builder attributes) {
        double[] centroid = new double[data[0].length];
        for (double[] row : data) {
            for (int j = 0; j < row.length; j++) {
                centroid[j] += row[j] / data.length;
            }
        }
        attributes.put(CENTROID, centroid);
        return centroid;
    }

    @Override
    public double[] score(double[] centroid, Attributes attributes, double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            double sum = 0;
            for (int j = 0; j < centroid.length; j++) {
                double delta = data[i][j] - centroid[j];
                sum += delta * delta;
            }
            scores[i] = Math.sqrt(sum);
        }
        return scores;
    }

    @Override
    public byte[] serialize(double[] centroid) {
        ByteBuffer buffer = ByteBuffer.allocate(centroid.length * Double.BYTES);
        for (double value : centroid) {
            buffer.putDouble(value);
        }
        return buffer.array();
    }

    @Override
    public double[] deserialize(byte[] bytes) {
        if (bytes.length == 0 || bytes.length % Double.BYTES != 0) {
            throw new IllegalArgumentException("not a centroid: " + bytes.length + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        double[] centroid = new double[bytes.length / Double.BYTES];
        for (int i = 0; i < centroid.length; i++) {
            centroid[i] = buffer.getDouble();
        }
        return centroid;
    }

    @Override
    public <T> Optional<T> getCapability(Class<T> type, double[] centroid, Attributes attributes) {
        if (type != IFeatureImportance.class) {
            return Optional.empty();
        }
        double[] weights = new double[centroid.length];
        Arrays.fill(weights, 1.0 / centroid.length);
        IFeatureImportance importance = () -> weights.clone();
        return Optional.of(type.cast(importance));
    }
}
