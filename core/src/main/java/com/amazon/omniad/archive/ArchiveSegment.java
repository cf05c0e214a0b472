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

package com.amazon.omniad.archive;

/**
 * The named entries of a detector archive. Readers look segments up by name;
 * their order in the container carries no meaning.
 */
public enum ArchiveSegment {

    /**
     * format version, algorithm id, threshold and construction parameters, as
     * JSON
     */
    METADATA("metadata"),
    /**
     * the detector's attributes, as typed JSON
     */
    ATTRIBUTES("attributes"),
    /**
     * the backend's own serialization of its model, copied verbatim
     */
    BACKEND("backend");

    private final String entryName;

    ArchiveSegment(String entryName) {
        this.entryName = entryName;
    }

    public String getEntryName() {
        return entryName;
    }
}
