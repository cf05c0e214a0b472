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

import java.util.Optional;

/**
 * The numerical engine behind a detector. A backend turns validated training
 * data into a model of type {@code M}, scores rows with that model, and owns
 * the binary format of the model. Backends hold configuration only; every
 * model they produce is handed to the caller, so a backend instance can be
 * reused across fits.
 *
 * @param <M> the fitted model type
 */
public interface IBackend<M> {

    /**
     * Builds a model from the training data. The data has already been
     * validated and copied. Anything the backend needs again at scoring time
     * that should remain readable without the backend (scalers, for example) is
     * added to {@code attributes}.
     *
     * @param data       training rows, non-empty and rectangular
     * @param attributes builder that already holds the lifecycle attributes
     * @return the fitted model
     */
    M fit(double[][] data, Attributes.Builder attributes);

    /**
     * Scores rows. Higher scores are more anomalous. Must not modify the model.
     *
     * @param model      a model produced by {@link #fit} or {@link #deserialize}
     * @param attributes the attributes recorded when the model was fitted
     * @param data       validated rows with the fit time dimensionality
     * @return one finite score per row
     */
    double[] score(M model, Attributes attributes, double[][] data);

    /**
     * @param model a fitted model
     * @return the model in the backend's own binary format
     */
    byte[] serialize(M model);

    /**
     * @param bytes bytes produced by {@link #serialize}
     * @return the model
     * @throws IllegalArgumentException if the bytes cannot be decoded or were
     *                                  written by an incompatible version
     */
    M deserialize(byte[] bytes);

    /**
     * Looks up an optional capability of a fitted model.
     *
     * @param type       the capability interface
     * @param model      the fitted model
     * @param attributes the attributes recorded with the model
     * @param <T>        the capability type
     * @return the capability bound to the model, or empty if not supported
     */
    default <T> Optional<T> getCapability(Class<T> type, M model, Attributes attributes) {
        return Optional.empty();
    }
}
