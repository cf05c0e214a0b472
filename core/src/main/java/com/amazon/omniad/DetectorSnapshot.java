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

import lombok.Getter;

/**
 * An immutable copy of everything needed to persist a fitted detector, taken
 * in one read of its fitted state.
 */
@Getter
public class DetectorSnapshot {

    private final String algorithmId;
    private final String className;
    private final double contamination;
    private final Hyperparameters hyperparameters;
    private final double threshold;
    private final Attributes attributes;
    private final byte[] backendArtifact;

    DetectorSnapshot(String algorithmId, String className, double contamination, Hyperparameters hyperparameters,
            double threshold, Attributes attributes, byte[] backendArtifact) {
        this.algorithmId = algorithmId;
        this.className = className;
        this.contamination = contamination;
        this.hyperparameters = hyperparameters;
        this.threshold = threshold;
        this.attributes = attributes;
        this.backendArtifact = backendArtifact;
    }
}
