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

/**
 * Steps of the detector lifecycle, used to say where a backend failed.
 */
public enum LifecyclePhase {

    /**
     * checking and copying the input matrix
     */
    VALIDATE,
    /**
     * the backend builds its model from the training data
     */
    BACKEND_FIT,
    /**
     * scoring the training data with the freshly built model
     */
    IN_SAMPLE_SCORE,
    /**
     * deriving the decision threshold from the in-sample scores
     */
    THRESHOLD,
    /**
     * scoring on behalf of a caller
     */
    SCORE,
    /**
     * the backend writes its model to bytes
     */
    SERIALIZE,
    /**
     * the backend rebuilds its model from bytes
     */
    DESERIALIZE;
}
