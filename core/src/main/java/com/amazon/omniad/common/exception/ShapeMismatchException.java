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

package com.amazon.omniad.common.exception;

/**
 * The columns of a scoring input disagree with what the detector was fitted
 * on.
 */
public class ShapeMismatchException extends OmniadException {

    private final int expectedDimensions;
    private final int actualDimensions;

    public ShapeMismatchException(String algorithmId, int expectedDimensions, int actualDimensions) {
        super(algorithmId, String.format("detector %s was fitted on %d features but the input has %d", algorithmId,
                expectedDimensions, actualDimensions));
        this.expectedDimensions = expectedDimensions;
        this.actualDimensions = actualDimensions;
    }

    public ShapeMismatchException(String algorithmId, String message) {
        super(algorithmId, message);
        this.expectedDimensions = -1;
        this.actualDimensions = -1;
    }

    public int getExpectedDimensions() {
        return expectedDimensions;
    }

    public int getActualDimensions() {
        return actualDimensions;
    }
}
