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
 * Converts a model to a plain state object, which can be handed to a
 * serialization library, and back.
 *
 * @param <Model> the model type
 * @param <State> the state type
 */
public interface IStateMapper<Model, State> {

    /**
     * @param model a model
     * @return a state object holding everything needed to rebuild the model
     */
    State toState(Model model);

    /**
     * @param state a state object produced by {@link #toState}
     * @return the rebuilt model
     * @throws IllegalArgumentException if the state is inconsistent or of an
     *                                  unknown version
     */
    Model toModel(State state);
}
