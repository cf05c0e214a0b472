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
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Eigen decomposition of a real symmetric matrix with the cyclic Jacobi
 * method. Each sweep rotates away every off-diagonal entry in turn; the
 * product of the rotations converges to the eigenvectors.
 *
 * <p>
 * Eigenvalues are sorted in decreasing order. Each eigenvector is signed so
 * that its entry of largest magnitude is positive, which makes the result
 * independent of rotation order.
 */
public class JacobiEigenDecomposition {

    private static final int MAX_SWEEPS = 100;

    private static final double TOLERANCE = 1e-15;

    private final double[] eigenvalues;

    /**
     * eigenvectors[i] is the unit eigenvector of eigenvalues[i]
     */
    private final double[][] eigenvectors;

    public JacobiEigenDecomposition(double[][] symmetric) {
        checkNotNull(symmetric, "matrix must not be null");
        int n = symmetric.length;
        checkArgument(n > 0, "matrix must not be empty");
        double[][] a = new double[n][];
        for (int i = 0; i < n; i++) {
            checkArgument(symmetric[i].length == n, "matrix must be square");
            a[i] = Arrays.copyOf(symmetric[i], n);
        }
        double[][] v = new double[n][n];
        for (int i = 0; i < n; i++) {
            v[i][i] = 1.0;
        }

        double scale = 0;
        for (double[] row : a) {
            for (double value : row) {
                scale += value * value;
            }
        }
        for (int sweep = 0; sweep < MAX_SWEEPS; sweep++) {
            if (offDiagonal(a) <= TOLERANCE * TOLERANCE * scale) {
                break;
            }
            for (int p = 0; p < n - 1; p++) {
                for (int q = p + 1; q < n; q++) {
                    if (a[p][q] != 0) {
                        rotate(a, v, p, q);
                    }
                }
            }
        }

        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> -a[i][i]).thenComparingInt(i -> i));
        eigenvalues = new double[n];
        eigenvectors = new double[n][n];
        for (int k = 0; k < n; k++) {
            int column = order[k];
            eigenvalues[k] = a[column][column];
            for (int i = 0; i < n; i++) {
                eigenvectors[k][i] = v[i][column];
            }
            normalizeSign(eigenvectors[k]);
        }
    }

    private static double offDiagonal(double[][] a) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            for (int j = 0; j < a.length; j++) {
                if (i != j) {
                    sum += a[i][j] * a[i][j];
                }
            }
        }
        return sum;
    }

    /**
     * Applies the rotation that zeroes {@code a[p][q]}: {@code a = J' a J} and
     * {@code v = v J}.
     */
    private static void rotate(double[][] a, double[][] v, int p, int q) {
        double theta = (a[q][q] - a[p][p]) / (2 * a[p][q]);
        double t = (theta >= 0 ? 1.0 : -1.0) / (Math.abs(theta) + Math.sqrt(theta * theta + 1));
        double c = 1 / Math.sqrt(t * t + 1);
        double s = t * c;
        int n = a.length;
        for (int k = 0; k < n; k++) {
            double akp = a[k][p];
            double akq = a[k][q];
            a[k][p] = c * akp - s * akq;
            a[k][q] = s * akp + c * akq;
        }
        for (int k = 0; k < n; k++) {
            double apk = a[p][k];
            double aqk = a[q][k];
            a[p][k] = c * apk - s * aqk;
            a[q][k] = s * apk + c * aqk;
        }
        a[p][q] = 0;
        a[q][p] = 0;
        for (int k = 0; k < n; k++) {
            double vkp = v[k][p];
            double vkq = v[k][q];
            v[k][p] = c * vkp - s * vkq;
            v[k][q] = s * vkp + c * vkq;
        }
    }

    private static void normalizeSign(double[] vector) {
        int largest = 0;
        for (int i = 1; i < vector.length; i++) {
            if (Math.abs(vector[i]) > Math.abs(vector[largest])) {
                largest = i;
            }
        }
        if (vector[largest] < 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] = -vector[i];
            }
        }
    }

    public double[] getEigenvalues() {
        return eigenvalues.clone();
    }

    public double[][] getEigenvectors() {
        double[][] copy = new double[eigenvectors.length][];
        for (int i = 0; i < eigenvectors.length; i++) {
            copy[i] = eigenvectors[i].clone();
        }
        return copy;
    }
}
