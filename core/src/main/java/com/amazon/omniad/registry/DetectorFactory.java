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

package com.amazon.omniad.registry;

import com.amazon.omniad.Detector;
import com.amazon.omniad.Hyperparameters;

/**
 * Builds unfitted detectors of one algorithm. Factories are compared with
 * {@code equals} when registered twice, so implementations should be
 * singletons (an enum constant, for example) or define equality.
 */
@FunctionalInterface
public interface DetectorFactory {

    /**
     * @param algorithmId     the id the factory was registered under
     * @param hyperparameters construction parameters
     * @return an unfitted detector carrying {@code algorithmId}
     */
    Detector<?> create(String algorithmId, Hyperparameters hyperparameters);
}
