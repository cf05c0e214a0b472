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
 * A backend failed, or returned something unusable, during a lifecycle phase.
 * The original failure is kept as the cause.
 */
public class BackendException extends OmniadException {

    private final LifecyclePhase phase;

    public BackendException(String algorithmId, LifecyclePhase phase, String message) {
        super(algorithmId, describe(algorithmId, phase, message));
        this.phase = phase;
    }

    public BackendException(String algorithmId, LifecyclePhase phase, Throwable cause) {
        super(algorithmId, describe(algorithmId, phase, cause.getMessage()), cause);
        this.phase = phase;
    }

    public BackendException(String algorithmId, LifecyclePhase phase, String message, Throwable cause) {
        super(algorithmId, describe(algorithmId, phase, message), cause);
        this.phase = phase;
    }

    private static String describe(String algorithmId, LifecyclePhase phase, String message) {
        if (algorithmId == null) {
            return String.format("backend failed during %s: %s", phase, message);
        }
        return String.format("%s failed during %s: %s", algorithmId, phase, message);
    }

    public LifecyclePhase getPhase() {
        return phase;
    }
}
