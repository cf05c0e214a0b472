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
import static com.amazon.omniad.CommonUtils.checkNotNull;

import java.util.Arrays;

import com.amazon.omniad.CommonUtils;

/**
 * The principal axes kept by a PCA fit, in the scaled coordinates the model
 * was fitted in. Rows of {@code components} are orthonormal.
 */
public class PcaModel {

    private final int dimensions;
    private final double[][] components;
    private final double[] explainedVariance;

    public PcaModel(int dimensions, double[][] components, double[] explainedVariance) {
        checkArgument(dimensions > 0, "dimensions must be positive");
        checkNotNull(components, "components must not be null");
        checkNotNull(explainedVariance, "explainedVariance must not be null");
        checkArgument(components.length > 0 && components.length <= dimensions,
                "number of components must be in [1, dimensions]");
        checkArgument(explainedVariance.length == components.length, "one explained variance per component");
        for (double[] component : components) {
            checkArgument(component != null && component.length == dimensions, "component has the wrong length");
            checkArgument(CommonUtils.allFinite(component), "component must be finite");
        }
        this.dimensions = dimensions;
        this.components = CommonUtils.deepCopy(components);
        this.explainedVariance = explainedVariance.clone();
    }

    public int getDimensions() {
        return dimensions;
    }

    public int getNumberOfComponents() {
        return components.length;
    }

    public double[][] getComponents() {
        return CommonUtils.deepCopy(components);
    }

    public double[] getExplainedVariance() {
        return explainedVariance.clone();
    }

    /**
     * Projects a scaled point onto the kept axes and maps it back.
     *
     * @param scaled a point in scaled coordinates
     * @return its reconstruction in scaled coordinates
     */
    public double[] reconstruct(double[] scaled) {
        double[] result = new double[dimensions];
        for (double[] component : components) {
            double projection = 0;
            for (int j = 0; j < dimensions; j++) {
                projection += component[j] * scaled[j];
            }
            for (int j = 0; j < dimensions; j++) {
                result[j] += projection * component[j];
            }
        }
        return result;
    }

    /**
     * @param scaled a point in scaled coordinates
     * @return the squared distance between the point and its reconstruction
     */
    public double reconstructionError(double[] scaled) {
        double[] reconstruction = reconstruct(scaled);
        double error = 0;
        for (int j = 0; j < dimensions; j++) {
            double delta = scaled[j] - reconstruction[j];
            error += delta * delta;
        }
        return error;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PcaModel)) {
            return false;
        }
        PcaModel model = (PcaModel) other;
        return dimensions == model.dimensions && Arrays.deepEquals(components, model.components)
                && Arrays.equals(explainedVariance, model.explainedVariance);
    }

    @Override
    public int hashCode() {
        return 31 * dimensions + Arrays.deepHashCode(components);
    }
}
