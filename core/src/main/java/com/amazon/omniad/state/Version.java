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

package com.amazon.omniad.state;

/**
 * Version markers written into persisted state.
 */
public class Version {

    private Version() {
    }

    /**
     * Layout version of the archive container. Incremented on any incompatible
     * change of the segment layout or the metadata record.
     */
    public static final int FORMAT_VERSION = 1;

    /**
     * Version of the attributes segment encoding.
     */
    public static final String ATTRIBUTES_V1_0 = "1.0";

    /**
     * Version string for backend state objects at their first layout.
     */
    public static final String V1_0 = "1.0";

    /**
     * The library release writing an archive.
     */
    public static final String LIBRARY_VERSION = "1.0";
}
