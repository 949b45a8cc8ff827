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

package com.amazon.thermalguard.svm;

import static com.amazon.thermalguard.CommonUtils.checkArgument;
import static com.amazon.thermalguard.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.extern.slf4j.Slf4j;

/**
 * Sequential minimal optimization for the dual of the one-class SVM:
 *
 * minimize 0.5 * alpha' Q alpha subject to 0 <= alpha_i <= 1 and
 * sum(alpha) = nu * n
 *
 * where Q is the kernel matrix of the training points. Every step moves weight
 * between the pair of points that violates optimality the most, chosen with
 * second order information. The solver stops once the largest violation falls
 * below the tolerance.
 */
@Slf4j
public class OneClassSolver {

    private static final double TAU = 1e-12;

    private static final double UPPER_BOUND = 1.0;

    public static final double DEFAULT_TOLERANCE = 1e-3;

    private final double tolerance;

    private final int maxIterations;

    public OneClassSolver(double tolerance, int maxIterations) {
        checkArgument(tolerance > 0, "tolerance should be positive");
        checkArgument(maxIterations > 0, "iterations should be positive");
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
    }

    public OneClassSolver() {
        this(DEFAULT_TOLERANCE, 10_000_000);
    }

    /**
     * @param q  kernel matrix, square and symmetric
     * @param nu fraction in (0, 1]
     * @return the dual weights and the offset of the decision function
     */
    public Solution solve(double[][] q, double nu) {
        checkNotNull(q, "kernel matrix must not be null");
        checkArgument(nu > 0 && nu <= 1, "nu should be in (0, 1]");
        int n = q.length;
        checkArgument(n > 0, "cannot solve over no points");

        double[] alpha = new double[n];
        double total = nu * n;
        int whole = (int) total;
        for (int i = 0; i < whole; i++) {
            alpha[i] = UPPER_BOUND;
        }
        if (whole < n) {
            alpha[whole] = total - whole;
        }

        double[] gradient = new double[n];
        for (int i = 0; i < n; i++) {
            if (alpha[i] > 0) {
                for (int k = 0; k < n; k++) {
                    gradient[k] += q[k][i] * alpha[i];
                }
            }
        }

        int iteration = 0;
        while (iteration < maxIterations) {
            int[] pair = selectWorkingSet(q, alpha, gradient);
            if (pair == null) {
                break;
            }
            update(q, alpha, gradient, pair[0], pair[1]);
            ++iteration;
        }
        if (iteration >= maxIterations) {
            log.warn("one-class solver stopped after {} iterations without reaching tolerance {}", iteration,
                    tolerance);
        }
        return new Solution(alpha, computeOffset(alpha, gradient), iteration);
    }

    /**
     * @return the indices {i, j} to optimize next; null once optimal within the
     *         tolerance
     */
    int[] selectWorkingSet(double[][] q, double[] alpha, double[] gradient) {
        double maxUp = Double.NEGATIVE_INFINITY;
        int i = -1;
        for (int t = 0; t < alpha.length; t++) {
            if (alpha[t] < UPPER_BOUND && -gradient[t] >= maxUp) {
                maxUp = -gradient[t];
                i = t;
            }
        }
        if (i == -1) {
            return null;
        }

        double maxLow = Double.NEGATIVE_INFINITY;
        double minObjective = Double.POSITIVE_INFINITY;
        int j = -1;
        for (int t = 0; t < alpha.length; t++) {
            if (alpha[t] > 0) {
                double gradientDifference = maxUp + gradient[t];
                if (gradient[t] >= maxLow) {
                    maxLow = gradient[t];
                }
                if (gradientDifference > 0) {
                    double quadratic = q[i][i] + q[t][t] - 2.0 * q[i][t];
                    double objective = -(gradientDifference * gradientDifference) / ((quadratic > 0) ? quadratic : TAU);
                    if (objective <= minObjective) {
                        minObjective = objective;
                        j = t;
                    }
                }
            }
        }

        if (j == -1 || maxUp + maxLow < tolerance) {
            return null;
        }
        return new int[] { i, j };
    }

    void update(double[][] q, double[] alpha, double[] gradient, int i, int j) {
        double oldI = alpha[i];
        double oldJ = alpha[j];
        double quadratic = q[i][i] + q[j][j] - 2.0 * q[i][j];
        if (quadratic <= 0) {
            quadratic = TAU;
        }
        double delta = (gradient[i] - gradient[j]) / quadratic;
        double sum = alpha[i] + alpha[j];
        alpha[i] -= delta;
        alpha[j] += delta;

        // project back onto the box, keeping alpha[i] + alpha[j] fixed
        if (sum > UPPER_BOUND) {
            if (alpha[i] > UPPER_BOUND) {
                alpha[i] = UPPER_BOUND;
                alpha[j] = sum - UPPER_BOUND;
            }
        } else {
            if (alpha[j] < 0) {
                alpha[j] = 0;
                alpha[i] = sum;
            }
        }
        if (sum > UPPER_BOUND) {
            if (alpha[j] > UPPER_BOUND) {
                alpha[j] = UPPER_BOUND;
                alpha[i] = sum - UPPER_BOUND;
            }
        } else {
            if (alpha[i] < 0) {
                alpha[i] = 0;
                alpha[j] = sum;
            }
        }

        double deltaI = alpha[i] - oldI;
        double deltaJ = alpha[j] - oldJ;
        for (int k = 0; k < alpha.length; k++) {
            gradient[k] += q[k][i] * deltaI + q[k][j] * deltaJ;
        }
    }

    /**
     * The offset rho is the mean gradient over the free support vectors; without
     * free vectors it is the midpoint of the feasible interval.
     */
    double computeOffset(double[] alpha, double[] gradient) {
        double upper = Double.POSITIVE_INFINITY;
        double lower = Double.NEGATIVE_INFINITY;
        double sumFree = 0;
        int free = 0;
        for (int t = 0; t < alpha.length; t++) {
            if (alpha[t] >= UPPER_BOUND) {
                lower = Math.max(lower, gradient[t]);
            } else if (alpha[t] <= 0) {
                upper = Math.min(upper, gradient[t]);
            } else {
                ++free;
                sumFree += gradient[t];
            }
        }
        if (free > 0) {
            return sumFree / free;
        } else if (Double.isInfinite(upper)) {
            return lower;
        } else if (Double.isInfinite(lower)) {
            return upper;
        }
        return (upper + lower) / 2;
    }

    public double getTolerance() {
        return tolerance;
    }

    public static class Solution {

        private final double[] alpha;

        private final double rho;

        private final int iterations;

        public Solution(double[] alpha, double rho, int iterations) {
            this.alpha = alpha;
            this.rho = rho;
            this.iterations = iterations;
        }

        public double[] getAlpha() {
            return Arrays.copyOf(alpha, alpha.length);
        }

        public double getRho() {
            return rho;
        }

        public int getIterations() {
            return iterations;
        }

        /**
         * @param kernelRow kernel values between a point and every training point
         * @return the decision value; negative outside the boundary
         */
        public double decision(double[] kernelRow) {
            checkArgument(kernelRow.length == alpha.length, "incorrect length");
            double sum = 0;
            for (int k = 0; k < alpha.length; k++) {
                sum += alpha[k] * kernelRow[k];
            }
            return sum - rho;
        }
    }
}
