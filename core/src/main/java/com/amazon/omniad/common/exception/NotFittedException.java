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
 * Raised when an operation that needs a fitted detector is called before
 * {@code fit}. This is a programming error and is never retried.
 */
public class NotFittedException extends OmniadException {

    public NotFittedException(String algorithmId, String operation) {
        super(algorithmId, String.format("detector %s is not fitted, call fit() before %s()", algorithmId, operation));
    }
}
