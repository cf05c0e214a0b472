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

package com.amazon.omniad.algorithms.isolationforest;

import static com.amazon.omniad.CommonUtils.checkArgument;
import static com.amazon.omniad.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.amazon.omniad.algorithms.tree.IsolationTree;
import com.amazon.omniad.capability.IFeatureImportance;

/**
 * A fitted isolation forest. The score of a point is
 * {@code 2^(-E[h(x)] / c(sampleSize))}, where {@code h} is the path length in
 * a tree and {@code c} the average path length of a subsample of that size.
 * Scores lie in (0, 1]; points that are isolated quickly score close to one.
 */
public class IsolationForestModel implements IFeatureImportance {

    private final int dimensions;
    private final int sampleSize;
    private final List<IsolationTree> trees;
    private final double normalizer;

    public IsolationForestModel(int dimensions, int sampleSize, List<IsolationTree> trees) {
        checkArgument(dimensions > 0, "dimensions must be positive");
        checkArgument(sampleSize > 0, "sampleSize must be positive");
        checkNotNull(trees, "trees must not be null");
        checkArgument(!trees.isEmpty(), "a forest needs at least one tree");
        for (IsolationTree tree : trees) {
            checkArgument(tree.getMaxSplitFeature() < dimensions, "tree splits on a feature beyond dimensions");
        }
        this.dimensions = dimensions;
        this.sampleSize = sampleSize;
        this.trees = Collections.unmodifiableList(trees);
        double averagePathLength = IsolationTree.averagePathLength(sampleSize);
        // a single row subsample isolates nothing; every point then scores 1
        this.normalizer = averagePathLength > 0 ? averagePathLength : 1.0;
    }

    public int getDimensions() {
        return dimensions;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public List<IsolationTree> getTrees() {
        return trees;
    }

    public double score(double[] point) {
        double total = 0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        return Math.pow(2, -(total / trees.size()) / normalizer);
    }

    public double[] score(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = score(data[i]);
        }
        return scores;
    }

    /**
     * The share of split mass each feature accounts for across the forest. A
     * forest that never split weighs all features equally.
     */
    @Override
    public double[] getFeatureImportances() {
        double[] weights = new double[dimensions];
        for (IsolationTree tree : trees) {
            tree.accumulateSplitMass(weights);
        }
        double sum = Arrays.stream(weights).sum();
        if (sum <= 0) {
            Arrays.fill(weights, 1.0 / dimensions);
            return weights;
        }
        for (int j = 0; j < dimensions; j++) {
            weights[j] /= sum;
        }
        return weights;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof IsolationForestModel)) {
            return false;
        }
        IsolationForestModel model = (IsolationForestModel) other;
        return dimensions == model.dimensions && sampleSize == model.sampleSize && trees.equals(model.trees);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * dimensions + sampleSize) + trees.hashCode();
    }
}
