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

package com.amazon.omniad.algorithms.tree;

import static com.amazon.omniad.CommonUtils.checkArgument;
import static com.amazon.omniad.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Random;

/**
 * A binary isolation tree stored as parallel arrays indexed by node. Node 0 is
 * the root and every internal node has a smaller index than its children.
 * Leaves have {@link #LEAF} as their split feature. The mass of a node is the
 * number of sampled rows that reached it.
 */
public class IsolationTree {

    public static final int LEAF = -1;

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final int[] splitFeature;
    private final double[] splitValue;
    private final int[] leftChild;
    private final int[] rightChild;
    private final int[] mass;

    public IsolationTree(int[] splitFeature, double[] splitValue, int[] leftChild, int[] rightChild, int[] mass) {
        checkNotNull(splitFeature, "splitFeature must not be null");
        checkNotNull(splitValue, "splitValue must not be null");
        checkNotNull(leftChild, "leftChild must not be null");
        checkNotNull(rightChild, "rightChild must not be null");
        checkNotNull(mass, "mass must not be null");
        int size = splitFeature.length;
        checkArgument(size > 0, "a tree has at least one node");
        checkArgument(splitValue.length == size && leftChild.length == size && rightChild.length == size
                && mass.length == size, "node arrays must have the same length");
        for (int node = 0; node < size; node++) {
            checkArgument(mass[node] >= 0, "node mass must be non-negative");
            if (splitFeature[node] != LEAF) {
                checkArgument(splitFeature[node] >= 0, "invalid split feature " + splitFeature[node]);
                checkArgument(leftChild[node] > node && leftChild[node] < size, "invalid left child of " + node);
                checkArgument(rightChild[node] > node && rightChild[node] < size, "invalid right child of " + node);
            }
        }
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.leftChild = leftChild;
        this.rightChild = rightChild;
        this.mass = mass;
    }

    /**
     * Grows a tree on a subsample. At every node a feature is chosen uniformly
     * among those that are not constant on the node's rows, and the split value
     * is drawn uniformly from {@code [min, max)} of that feature. Rows with a
     * value at or below the split go left.
     *
     * @param data     the training rows
     * @param sample   indexes of the rows in the subsample; reordered in place
     * @param maxDepth depth at which growth stops
     * @param random   source of randomness for this tree only
     * @return the grown tree
     */
    public static IsolationTree grow(double[][] data, int[] sample, int maxDepth, Random random) {
        checkArgument(sample.length > 0, "sample must not be empty");
        Grower grower = new Grower(data, sample.length, maxDepth, random);
        grower.grow(sample, 0, sample.length, 0);
        return grower.toTree();
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree
     * with {@code n} entries, used to normalize path lengths.
     *
     * @param n number of entries
     * @return {@code 2 (ln(n - 1) + gamma) - 2 (n - 1) / n}; 1 for n = 2 and 0
     *         below
     */
    public static double averagePathLength(double n) {
        if (n <= 1) {
            return 0;
        }
        if (n <= 2) {
            return 1;
        }
        return 2 * (Math.log(n - 1) + EULER_GAMMA) - 2 * (n - 1) / n;
    }

    /**
     * @param point a row with at least as many columns as the tree splits on
     * @return depth of the leaf the point falls into, plus the expected depth
     *         of the rest of the leaf's mass
     */
    public double pathLength(double[] point) {
        int node = 0;
        int depth = 0;
        while (splitFeature[node] != LEAF) {
            node = point[splitFeature[node]] <= splitValue[node] ? leftChild[node] : rightChild[node];
            depth++;
        }
        return depth + averagePathLength(mass[node]);
    }

    /**
     * Adds the mass of every internal node to the weight of its split feature.
     *
     * @param weights one weight per feature
     */
    public void accumulateSplitMass(double[] weights) {
        for (int node = 0; node < splitFeature.length; node++) {
            if (splitFeature[node] != LEAF) {
                weights[splitFeature[node]] += mass[node];
            }
        }
    }

    public int getNumberOfNodes() {
        return splitFeature.length;
    }

    public int getMaxSplitFeature() {
        return Arrays.stream(splitFeature).max().orElse(LEAF);
    }

    public int[] getSplitFeature() {
        return splitFeature.clone();
    }

    public double[] getSplitValue() {
        return splitValue.clone();
    }

    public int[] getLeftChild() {
        return leftChild.clone();
    }

    public int[] getRightChild() {
        return rightChild.clone();
    }

    public int[] getMass() {
        return mass.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof IsolationTree)) {
            return false;
        }
        IsolationTree tree = (IsolationTree) other;
        return Arrays.equals(splitFeature, tree.splitFeature) && Arrays.equals(splitValue, tree.splitValue)
                && Arrays.equals(leftChild, tree.leftChild) && Arrays.equals(rightChild, tree.rightChild)
                && Arrays.equals(mass, tree.mass);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(splitFeature) + Arrays.hashCode(splitValue);
    }

    private static final class Grower {

        private final double[][] data;
        private final int maxDepth;
        private final Random random;
        private final int[] splitFeature;
        private final double[] splitValue;
        private final int[] leftChild;
        private final int[] rightChild;
        private final int[] mass;
        private int size;

        Grower(double[][] data, int sampleSize, int maxDepth, Random random) {
            this.data = data;
            this.maxDepth = maxDepth;
            this.random = random;
            // a binary tree with at most sampleSize non-empty leaves
            int capacity = 2 * sampleSize - 1;
            splitFeature = new int[capacity];
            splitValue = new double[capacity];
            leftChild = new int[capacity];
            rightChild = new int[capacity];
            mass = new int[capacity];
        }

        int grow(int[] rows, int from, int to, int depth) {
            int node = size++;
            mass[node] = to - from;
            splitFeature[node] = LEAF;
            leftChild[node] = LEAF;
            rightChild[node] = LEAF;
            if (depth >= maxDepth || to - from <= 1) {
                return node;
            }

            int dimensions = data[rows[from]].length;
            double[] min = new double[dimensions];
            double[] max = new double[dimensions];
            Arrays.fill(min, Double.POSITIVE_INFINITY);
            Arrays.fill(max, Double.NEGATIVE_INFINITY);
            for (int i = from; i < to; i++) {
                double[] row = data[rows[i]];
                for (int j = 0; j < dimensions; j++) {
                    min[j] = Math.min(min[j], row[j]);
                    max[j] = Math.max(max[j], row[j]);
                }
            }
            int[] candidates = new int[dimensions];
            int numberOfCandidates = 0;
            for (int j = 0; j < dimensions; j++) {
                if (max[j] > min[j]) {
                    candidates[numberOfCandidates++] = j;
                }
            }
            if (numberOfCandidates == 0) {
                return node;
            }

            int feature = candidates[random.nextInt(numberOfCandidates)];
            double value = min[feature] + random.nextDouble() * (max[feature] - min[feature]);
            if (value >= max[feature]) {
                value = min[feature];
            }

            int middle = partition(rows, from, to, feature, value);
            splitFeature[node] = feature;
            splitValue[node] = value;
            leftChild[node] = grow(rows, from, middle, depth + 1);
            rightChild[node] = grow(rows, middle, to, depth + 1);
            return node;
        }

        /**
         * Moves rows at or below the split value to the front of the range.
         *
         * @return the index of the first row above the split value
         */
        private int partition(int[] rows, int from, int to, int feature, double value) {
            int lower = from;
            int upper = to - 1;
            while (lower <= upper) {
                if (data[rows[lower]][feature] <= value) {
                    lower++;
                } else {
                    int swap = rows[lower];
                    rows[lower] = rows[upper];
                    rows[upper] = swap;
                    upper--;
                }
            }
            return lower;
        }

        IsolationTree toTree() {
            return new IsolationTree(Arrays.copyOf(splitFeature, size), Arrays.copyOf(splitValue, size),
                    Arrays.copyOf(leftChild, size), Arrays.copyOf(rightChild, size), Arrays.copyOf(mass, size));
        }
    }
}
