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

import java.util.Map;

import lombok.Data;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The metadata segment of an archive. It is the first segment a reader
 * consults, since it says how to interpret the other two.
 */
@Data
public class DetectorMetadata {

    @JsonProperty("format_version")
    private int formatVersion = Version.FORMAT_VERSION;

    @JsonProperty("algorithm_id")
    private String algorithmId;

    @JsonProperty("threshold")
    private double threshold;

    @JsonProperty("class_name")
    private String className;

    @JsonProperty("contamination")
    private double contamination;

    @JsonProperty("hyperparameters")
    private Map<String, Object> hyperparameters;

    @JsonProperty("library_version")
    private String libraryVersion = Version.LIBRARY_VERSION;
}
