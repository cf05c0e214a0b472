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

import com.amazon.omniad.Attributes;
import com.amazon.omniad.FeatureMatrix;
import com.amazon.omniad.capability.IReconstruction;
import com.amazon.omniad.preprocessor.StandardScaler;
import com.amazon.omniad.validation.InputValidator;

/**
 * Rebuilds rows from their projection onto the principal axes, in the units of
 * the input.
 */
public class PcaReconstruction implements IReconstruction {

    private final String algorithmId;
    private final PcaModel model;
    private final StandardScaler scaler;
    private final Attributes attributes;

    public PcaReconstruction(String algorithmId, PcaModel model, Attributes attributes) {
        this.algorithmId = algorithmId;
        this.model = model;
        this.attributes = attributes;
        this.scaler = StandardScaler.fromAttributes(StandardScaler.DEFAULT_PREFIX, attributes);
    }

    @Override
    public double[][] reconstruct(FeatureMatrix input) {
        double[][] data = InputValidator.validateForScoring(algorithmId, input, attributes);
        double[][] result = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            result[i] = scaler.inverseTransform(model.reconstruct(scaler.transform(data[i])));
        }
        return result;
    }
}
