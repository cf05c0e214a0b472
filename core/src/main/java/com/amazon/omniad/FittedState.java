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
 * Everything a fit produces. A detector holds either none of it or all of it.
 *
 * @param <M> the fitted model type
 */
@Getter
final class FittedState<M> {

    private final M model;
    private final Attributes attributes;
    private final double threshold;

    FittedState(M model, Attributes attributes, double threshold) {
        this.model = model;
        this.attributes = attributes;
        this.threshold = threshold;
    }
}
