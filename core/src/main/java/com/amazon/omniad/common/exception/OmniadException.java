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
 * Base exception for the errors raised by detectors, the registry and the
 * archive codec.
 */
public class OmniadException extends RuntimeException {

    private String algorithmId;

    public OmniadException(String message) {
        super(message);
    }

    public OmniadException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructor with an algorithm id and a message.
     *
     * @param algorithmId registry id of the detector involved
     * @param message     message of the exception
     */
    public OmniadException(String algorithmId, String message) {
        super(message);
        this.algorithmId = algorithmId;
    }

    public OmniadException(String algorithmId, String message, Throwable cause) {
        super(message, cause);
        this.algorithmId = algorithmId;
    }

    /**
     * Returns the registry id of the detector involved, if known.
     *
     * @return algorithm id or null
     */
    public String getAlgorithmId() {
        return algorithmId;
    }
}
