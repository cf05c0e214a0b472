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
 * The archive declares a format version this codec does not understand.
 */
public class UnsupportedVersionException extends OmniadException {

    private final int foundVersion;
    private final int supportedVersion;

    public UnsupportedVersionException(int foundVersion, int supportedVersion) {
        super(String.format("archive format version %d is not supported, this codec reads version %d",
                foundVersion, supportedVersion));
        this.foundVersion = foundVersion;
        this.supportedVersion = supportedVersion;
    }

    public int getFoundVersion() {
        return foundVersion;
    }

    public int getSupportedVersion() {
        return supportedVersion;
    }
}
