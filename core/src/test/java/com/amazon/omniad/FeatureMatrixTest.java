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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.amazon.omniad.common.exception.ValidationException;

public class FeatureMatrixTest {

    @Test
    public void testOfColumnReshapesVector() {
        FeatureMatrix matrix = FeatureMatrix.ofColumn(new double[] { 1, 2, 3 });

        assertEquals(3, matrix.getNumberOfRows());
        assertArrayEquals(new double[][] { { 1 }, { 2 }, { 3 } }, matrix.getRows());
        assertFalse(matrix.getFeatureNames().isPresent());
    }

    @Test
    public void testFeatureNamesAreCopied() {
        List<String> names = new ArrayList<>(List.of("a", "b"));
        FeatureMatrix matrix = FeatureMatrix.of(new double[][] { { 1, 2 } }, names);
        names.set(0, "changed");

        assertEquals(List.of("a", "b"), matrix.getFeatureNames().get());
        assertThrows(UnsupportedOperationException.class, () -> matrix.getFeatureNames().get().add("c"));
    }

    @Test
    public void testFromRows() {
        FeatureMatrix matrix = FeatureMatrix.fromRows(List.of(List.of(1, 2.5), List.of(3L, 4.0f)));
        assertArrayEquals(new double[][] { { 1, 2.5 }, { 3, 4 } }, matrix.getRows());
    }

    @Test
    public void testFromRowsRejectsNulls() {
        assertThrows(ValidationException.class, () -> FeatureMatrix.fromRows(null));
        assertThrows(ValidationException.class, () -> FeatureMatrix.fromRows(Arrays.asList(List.of(1.0), null)));
        assertThrows(ValidationException.class,
                () -> FeatureMatrix.fromRows(List.of(Arrays.asList(1.0, null))));
        assertThrows(ValidationException.class, () -> FeatureMatrix.ofColumn(null));
    }
}
