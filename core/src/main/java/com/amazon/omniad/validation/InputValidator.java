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

package com.amazon.omniad.validation;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.amazon.omniad.Attributes;
import com.amazon.omniad.CommonUtils;
import com.amazon.omniad.FeatureMatrix;
import com.amazon.omniad.common.exception.ShapeMismatchException;
import com.amazon.omniad.common.exception.ValidationException;

/**
 * Checks feature matrices before they reach a backend. A valid matrix is non
 * empty, rectangular, has at least one column and holds finite values only.
 */
public class InputValidator {

    private InputValidator() {
    }

    /**
     * Validates the matrix and returns a clean copy that the caller owns.
     *
     * @param matrix the input
     * @return a copy of the rows with negative zeros normalized
     * @throws ValidationException if the matrix is malformed
     */
    public static double[][] validate(FeatureMatrix matrix) {
        if (matrix == null || matrix.getRows() == null) {
            throw new ValidationException("input must not be null");
        }
        double[][] rows = matrix.getRows();
        if (rows.length == 0) {
            throw new ValidationException("input must contain at least one row");
        }
        if (rows[0] == null) {
            throw new ValidationException("row 0 is null");
        }
        int columns = rows[0].length;
        if (columns == 0) {
            throw new ValidationException("input must contain at least one column");
        }
        double[][] result = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            double[] row = rows[i];
            if (row == null) {
                throw new ValidationException(String.format("row %d is null", i));
            }
            if (row.length != columns) {
                throw new ValidationException(
                        String.format("input is not rectangular: row %d has %d columns, expected %d", i, row.length,
                                columns));
            }
            if (!CommonUtils.allFinite(row)) {
                throw new ValidationException(String.format("input contains NaN or infinity in row %d", i));
            }
            result[i] = CommonUtils.cleanCopy(row);
        }
        Optional<List<String>> names = matrix.getFeatureNames();
        if (names.isPresent() && names.get().size() != columns) {
            throw new ValidationException(String.format("%d feature names given for %d columns",
                    names.get().size(), columns));
        }
        return result;
    }

    /**
     * Checks a validated scoring input against what was recorded at fit time.
     *
     * @param algorithmId the detector, for error messages
     * @param matrix      the scoring input
     * @param data        the validated rows of {@code matrix}
     * @param attributes  attributes recorded at fit time
     * @throws ShapeMismatchException if the column count or the feature names
     *                                disagree
     */
    public static void checkShape(String algorithmId, FeatureMatrix matrix, double[][] data, Attributes attributes) {
        int expected = attributes.getInt(Attributes.DIMENSIONS);
        int actual = data[0].length;
        if (expected != actual) {
            throw new ShapeMismatchException(algorithmId, expected, actual);
        }
        Optional<List<String>> names = matrix.getFeatureNames();
        if (names.isPresent() && attributes.contains(Attributes.FEATURE_NAMES)) {
            String[] fitted = attributes.getStringArray(Attributes.FEATURE_NAMES);
            String[] given = names.get().toArray(new String[0]);
            if (!Arrays.equals(fitted, given)) {
                throw new ShapeMismatchException(algorithmId, String.format(
                        "feature names %s differ from the names seen at fit time %s", Arrays.toString(given),
                        Arrays.toString(fitted)));
            }
        }
    }

    /**
     * Validates a scoring input and checks it against the fit time shape in one
     * step.
     *
     * @param algorithmId the detector, for error messages
     * @param matrix      the scoring input
     * @param attributes  attributes recorded at fit time
     * @return a clean copy of the rows
     */
    public static double[][] validateForScoring(String algorithmId, FeatureMatrix matrix, Attributes attributes) {
        double[][] data = validate(matrix);
        checkShape(algorithmId, matrix, data, attributes);
        return data;
    }
}
