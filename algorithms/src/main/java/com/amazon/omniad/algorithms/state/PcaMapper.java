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

package com.amazon.omniad.algorithms.state;

import static com.amazon.omniad.CommonUtils.checkArgument;
import static com.amazon.omniad.CommonUtils.checkNotNull;

import com.amazon.omniad.algorithms.pca.PcaModel;
import com.amazon.omniad.state.IStateMapper;
import com.amazon.omniad.state.Version;

public class PcaMapper implements IStateMapper<PcaModel, PcaState> {

    @Override
    public PcaState toState(PcaModel model) {
        PcaState state = new PcaState();
        state.setVersion(Version.V1_0);
        state.setDimensions(model.getDimensions());
        state.setNumberOfComponents(model.getNumberOfComponents());
        double[][] components = model.getComponents();
        double[] flattened = new double[components.length * model.getDimensions()];
        for (int i = 0; i < components.length; i++) {
            System.arraycopy(components[i], 0, flattened, i * model.getDimensions(), model.getDimensions());
        }
        state.setComponents(flattened);
        state.setExplainedVariance(model.getExplainedVariance());
        return state;
    }

    @Override
    public PcaModel toModel(PcaState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported PCA state version " + state.getVersion());
        int dimensions = state.getDimensions();
        int numberOfComponents = state.getNumberOfComponents();
        checkArgument(dimensions > 0 && numberOfComponents > 0, "state has no components");
        checkArgument(state.getComponents() != null && state.getComponents().length == dimensions * numberOfComponents,
                "component array does not match the recorded shape");
        double[][] components = new double[numberOfComponents][dimensions];
        for (int i = 0; i < numberOfComponents; i++) {
            System.arraycopy(state.getComponents(), i * dimensions, components[i], 0, dimensions);
        }
        double[] explainedVariance = state.getExplainedVariance() == null ? new double[0]
                : state.getExplainedVariance();
        return new PcaModel(dimensions, components, explainedVariance);
    }
}
