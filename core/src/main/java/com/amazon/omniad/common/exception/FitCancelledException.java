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

import com.amazon.omniad.LifecyclePhase;

/**
 * Training was interrupted. The interrupt flag of the calling thread is left
 * set.
 */
public class FitCancelledException extends BackendException {

    private final String reason;

    public FitCancelledException(String reason) {
        super(null, LifecyclePhase.BACKEND_FIT, reason);
        this.reason = reason;
    }

    /**
     * Attaches the id of the detector whose fit was cancelled to a
     * cancellation raised inside a backend, which does not know that id.
     *
     * @param algorithmId registry id of the detector
     * @param cause       the cancellation raised by the backend
     */
    public FitCancelledException(String algorithmId, FitCancelledException cause) {
        super(algorithmId, cause.getPhase(), cause.reason, cause);
        this.reason = cause.reason;
    }
}
