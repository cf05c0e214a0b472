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

import com.amazon.omniad.archive.ArchiveSegment;

/**
 * A segment of a detector archive is missing or cannot be decoded.
 */
public class CorruptArchiveException extends OmniadException {

    private final ArchiveSegment segment;

    public CorruptArchiveException(String message, Throwable cause) {
        super(message, cause);
        this.segment = null;
    }

    public CorruptArchiveException(ArchiveSegment segment, String message) {
        super(String.format("%s segment: %s", segment.getEntryName(), message));
        this.segment = segment;
    }

    public CorruptArchiveException(ArchiveSegment segment, String message, Throwable cause) {
        super(String.format("%s segment: %s", segment.getEntryName(), message), cause);
        this.segment = segment;
    }

    /**
     * Returns the segment that failed, or null when the container itself is
     * unreadable.
     *
     * @return the failing segment
     */
    public ArchiveSegment getSegment() {
        return segment;
    }
}
