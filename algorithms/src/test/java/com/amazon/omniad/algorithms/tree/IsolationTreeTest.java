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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;

public class IsolationTreeTest {

    private static int[] allRows(double[][] data) {
        int[] rows = new int[data.length];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = i;
        }
        return rows;
    }

    private static double[][] line(int n) {
        double[][] data = new double[n][];
        for (int i = 0; i < n; i++) {
            data[i] = new double[] { i };
        }
        return data;
    }

    @Test
    public void testAveragePathLength() {
        assertEquals(0.0, IsolationTree.averagePathLength(0));
        assertEquals(0.0, IsolationTree.averagePathLength(1));
        assertEquals(1.0, IsolationTree.averagePathLength(2));
        assertEquals(2 * (Math.log(2) + 0.5772156649015329) - 4.0 / 3, IsolationTree.averagePathLength(3), 1e-12);
        assertEquals(10.2448, IsolationTree.averagePathLength(256), 1e-4);
    }

    @Test
    public void testFullyGrownTreeIsolatesEveryRow() {
        double[][] data = line(8);
        IsolationTree tree = IsolationTree.grow(data, allRows(data), 10, new Random(42));

        assertEquals(15, tree.getNumberOfNodes());
        int[] splitFeature = tree.getSplitFeature();
        int[] mass = tree.getMass();
        assertEquals(8, mass[0]);
        int leafMass = 0;
        for (int node = 0; node < splitFeature.length; node++) {
            if (splitFeature[node] == IsolationTree.LEAF) {
                assertEquals(1, mass[node]);
                leafMass += mass[node];
            }
        }
        assertEquals(8, leafMass);
        for (double[] point : data) {
            assertThat(tree.pathLength(point), greaterThanOrEqualTo(1.0));
        }
    }

    @Test
    public void testDepthLimit() {
        double[][] data = line(8);
        IsolationTree tree = IsolationTree.grow(data, allRows(data), 0, new Random(1));

        assertEquals(1, tree.getNumberOfNodes());
        assertEquals(IsolationTree.LEAF, tree.getMaxSplitFeature());
        assertEquals(IsolationTree.averagePathLength(8), tree.pathLength(new double[] { 100 }));
    }

    @Test
    public void testConstantRowsAreNotSplit() {
        double[][] data = new double[5][];
        Arrays.setAll(data, i -> new double[] { 3, -1 });
        IsolationTree tree = IsolationTree.grow(data, allRows(data), 8, new Random(7));

        assertEquals(1, tree.getNumberOfNodes());
        assertArrayEquals(new int[] { 5 }, tree.getMass());
    }

    @Test
    public void testOnlyVaryingFeaturesAreSplit() {
        double[][] data = new double[32][];
        Arrays.setAll(data, i -> new double[] { 1, i * 0.5, -2 });
        IsolationTree tree = IsolationTree.grow(data, allRows(data), 6, new Random(3));

        double[] weights = new double[3];
        tree.accumulateSplitMass(weights);

        assertEquals(0.0, weights[0]);
        assertThat(weights[1], greaterThan(0.0));
        assertEquals(0.0, weights[2]);
        assertEquals(1, tree.getMaxSplitFeature());
    }

    @Test
    public void testIsolatedPointHasShortPath() {
        double[][] data = new double[64][];
        Arrays.setAll(data, i -> new double[] { i < 63 ? (i % 8) * 0.01 : 1000 });
        double inlierPath = 0;
        double outlierPath = 0;
        for (int seed = 0; seed < 50; seed++) {
            IsolationTree tree = IsolationTree.grow(data, allRows(data), 6, new Random(seed));
            inlierPath += tree.pathLength(data[0]);
            outlierPath += tree.pathLength(data[63]);
        }
        assertThat(inlierPath, greaterThan(outlierPath));
    }

    @Test
    public void testSameRandomSameTree() {
        double[][] data = line(20);
        IsolationTree first = IsolationTree.grow(data, allRows(data), 5, new Random(11));
        IsolationTree second = IsolationTree.grow(data, allRows(data), 5, new Random(11));
        IsolationTree third = IsolationTree.grow(data, allRows(data), 5, new Random(12));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, third);
    }

    @Test
    public void testGettersReturnCopies() {
        double[][] data = line(4);
        IsolationTree tree = IsolationTree.grow(data, allRows(data), 4, new Random(0));
        tree.getMass()[0] = -5;
        assertEquals(4, tree.getMass()[0]);
    }

    @Test
    public void testInvalidArrays() {
        int[] leaf = { IsolationTree.LEAF };
        assertThrows(IllegalArgumentException.class,
                () -> new IsolationTree(new int[0], new double[0], new int[0], new int[0], new int[0]));
        assertThrows(IllegalArgumentException.class,
                () -> new IsolationTree(leaf, new double[2], leaf, leaf, new int[] { 1 }));
        assertThrows(IllegalArgumentException.class,
                () -> new IsolationTree(leaf, new double[1], leaf, leaf, new int[] { -1 }));
        // a split node whose children point back at the root
        assertThrows(IllegalArgumentException.class, () -> new IsolationTree(new int[] { 0, -1, -1 },
                new double[3], new int[] { 0, -1, -1 }, new int[] { 2, -1, -1 }, new int[] { 2, 1, 1 }));
        assertThrows(NullPointerException.class, () -> new IsolationTree(null, new double[1], leaf, leaf, leaf));
    }
}
