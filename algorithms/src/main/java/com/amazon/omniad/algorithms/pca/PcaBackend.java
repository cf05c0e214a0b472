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

package com.amazon.omniad.algorithms.pca;

import static com.amazon.omniad.CommonUtils.checkArgument;

import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.omniad.Attributes;
import com.amazon.omniad.IBackend;
import com.amazon.omniad.algorithms.state.PcaMapper;
import com.amazon.omniad.algorithms.state.PcaState;
import com.amazon.omniad.capability.IReconstruction;
import com.amazon.omniad.preprocessor.StandardScaler;
import com.amazon.omniad.state.ProtostuffStateSerializer;

/**
 * Principal component analysis as an outlier detector: a row scores by how
 * badly it is reconstructed from its projection onto the leading principal
 * axes of the (optionally standardized) training data.
 *
 * <p>
 * The scaler is recorded as attributes ({@code scaler.mean},
 * {@code scaler.scale}) rather than in the model, so it can be inspected from
 * an archive without this backend.
 */
public class PcaBackend implements IBackend<PcaModel> {

    private static final Logger LOG = LogManager.getLogger(PcaBackend.class);

    public static final boolean DEFAULT_STANDARDIZE = true;

    private final String algorithmId;
    private final Optional<Integer> numberOfComponents;
    private final boolean standardize;

    private final PcaMapper mapper = new PcaMapper();
    private final ProtostuffStateSerializer<PcaState> serializer = new ProtostuffStateSerializer<>(PcaState.class);

    protected PcaBackend(Builder<?> builder) {
        builder.numberOfComponents
                .ifPresent(value -> checkArgument(value > 0, "numberOfComponents must be greater than 0"));
        this.algorithmId = builder.algorithmId;
        this.numberOfComponents = builder.numberOfComponents;
        this.standardize = builder.standardize;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public Optional<Integer> getNumberOfComponents() {
        return numberOfComponents;
    }

    public boolean isStandardize() {
        return standardize;
    }

    @Override
    public PcaModel fit(double[][] data, Attributes.Builder attributes) {
        int dimensions = data[0].length;
        StandardScaler scaler = StandardScaler.fit(data, standardize);
        double[][] centered = scaler.transform(data);

        double[][] covariance = new double[dimensions][dimensions];
        double denominator = Math.max(1, centered.length - 1);
        for (double[] row : centered) {
            for (int i = 0; i < dimensions; i++) {
                for (int j = i; j < dimensions; j++) {
                    covariance[i][j] += row[i] * row[j] / denominator;
                }
            }
        }
        for (int i = 0; i < dimensions; i++) {
            for (int j = 0; j < i; j++) {
                covariance[i][j] = covariance[j][i];
            }
        }

        JacobiEigenDecomposition decomposition = new JacobiEigenDecomposition(covariance);
        int kept = Math.min(dimensions, numberOfComponents.orElse(Math.max(1, dimensions / 2)));
        double[][] eigenvectors = decomposition.getEigenvectors();
        double[] eigenvalues = decomposition.getEigenvalues();
        double[][] components = new double[kept][];
        double[] explainedVariance = new double[kept];
        for (int k = 0; k < kept; k++) {
            components[k] = eigenvectors[k];
            explainedVariance[k] = Math.max(0, eigenvalues[k]);
        }

        scaler.toAttributes(StandardScaler.DEFAULT_PREFIX, attributes);
        LOG.debug("kept {} of {} principal components", kept, dimensions);
        return new PcaModel(dimensions, components, explainedVariance);
    }

    /**
     * The scaler always centers, with or without standardization, so the
     * principal axes pass through the training mean.
     */
    @Override
    public double[] score(PcaModel model, Attributes attributes, double[][] data) {
        StandardScaler scaler = StandardScaler.fromAttributes(StandardScaler.DEFAULT_PREFIX, attributes);
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = model.reconstructionError(scaler.transform(data[i]));
        }
        return scores;
    }

    @Override
    public byte[] serialize(PcaModel model) {
        return serializer.toBytes(mapper.toState(model));
    }

    @Override
    public PcaModel deserialize(byte[] bytes) {
        return mapper.toModel(serializer.fromBytes(bytes));
    }

    @Override
    public <T> Optional<T> getCapability(Class<T> type, PcaModel model, Attributes attributes) {
        if (type == IReconstruction.class) {
            return Optional.of(type.cast(new PcaReconstruction(algorithmId, model, attributes)));
        }
        return Optional.empty();
    }

    public static class Builder<T extends Builder<T>> {

        private String algorithmId = "PCA";
        private Optional<Integer> numberOfComponents = Optional.empty();
        private boolean standardize = DEFAULT_STANDARDIZE;

        /**
         * Id used in errors raised by the reconstruction capability.
         */
        public T algorithmId(String algorithmId) {
            this.algorithmId = algorithmId;
            return (T) this;
        }

        public T numberOfComponents(int numberOfComponents) {
            this.numberOfComponents = Optional.of(numberOfComponents);
            return (T) this;
        }

        public T standardize(boolean standardize) {
            this.standardize = standardize;
            return (T) this;
        }

        public PcaBackend build() {
            return new PcaBackend(this);
        }
    }
}
