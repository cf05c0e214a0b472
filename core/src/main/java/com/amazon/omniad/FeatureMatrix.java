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

import static com.amazon.omniad.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.amazon.omniad.common.exception.ValidationException;

/**
 * A feature matrix handed to a detector: one row per observation, with optional
 * column names. The matrix is not checked here; that happens when a detector
 * validates it, so that every failure surfaces as a
 * {@link ValidationException} from the operation that was called.
 */
public class FeatureMatrix {

    private final double[][] rows;
    private final List<String> featureNames;

    private FeatureMatrix(double[][] rows, List<String> featureNames) {
        this.rows = rows;
        this.featureNames = featureNames;
    }

    public static FeatureMatrix of(double[][] rows) {
        return new FeatureMatrix(rows, null);
    }

    /**
     * @param rows         the observations
     * @param featureNames one name per column
     * @return a named feature matrix
     */
    public static FeatureMatrix of(double[][] rows, List<String> featureNames) {
        checkNotNull(featureNames, "featureNames must not be null");
        return new FeatureMatrix(rows, Collections.unmodifiableList(new ArrayList<>(featureNames)));
    }

    /**
     * A one dimensional vector is treated as a single feature, i.e. reshaped to
     * {@code n x 1}.
     *
     * @param values one value per observation
     * @return an {@code n x 1} feature matrix
     */
    public static FeatureMatrix ofColumn(double[] values) {
        if (values == null) {
            throw new ValidationException("input must not be null");
        }
        double[][] rows = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            rows[i] = new double[] { values[i] };
        }
        return new FeatureMatrix(rows, null);
    }

    /**
     * Converts boxed rows, for example rows read from a CSV reader or a JSON
     * payload.
     *
     * @param rows observations as lists of numbers
     * @return the feature matrix
     * @throws ValidationException if a row or a value is null
     */
    public static FeatureMatrix fromRows(List<? extends List<? extends Number>> rows) {
        if (rows == null) {
            throw new ValidationException("input must not be null");
        }
        double[][] result = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            List<? extends Number> row = rows.get(i);
            if (row == null) {
                throw new ValidationException(String.format("row %d is null", i));
            }
            result[i] = new double[row.size()];
            for (int j = 0; j < row.size(); j++) {
                Number value = row.get(j);
                if (value == null) {
                    throw new ValidationException(String.format("non-numeric value at row %d, column %d", i, j));
                }
                result[i][j] = value.doubleValue();
            }
        }
        return new FeatureMatrix(result, null);
    }

    /**
     * @return the raw rows, not copied
     */
    public double[][] getRows() {
        return rows;
    }

    public Optional<List<String>> getFeatureNames() {
        return Optional.ofNullable(featureNames);
    }

    public int getNumberOfRows() {
        return rows == null ? 0 : rows.length;
    }
}
