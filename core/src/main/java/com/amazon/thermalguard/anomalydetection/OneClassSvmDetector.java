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

package com.amazon.thermalguard.anomalydetection;

import static com.amazon.thermalguard.CommonUtils.checkArgument;
import static com.amazon.thermalguard.CommonUtils.checkNotNull;

import java.util.Optional;

import com.amazon.thermalguard.svm.OneClassSolver;
import com.amazon.thermalguard.svm.RbfKernel;

/**
 * One-class SVM outlier detection with a radial basis kernel. The fitted
 * boundary encloses the bulk of the points; nu bounds the fraction of points
 * left outside it. A point is an outlier unless its decision value is strictly
 * positive.
 */
public class OneClassSvmDetector implements IOutlierDetector {

    public static final double DEFAULT_NU = 0.05;

    private final double nu;

    private final Optional<Double> gamma;

    private final OneClassSolver solver;

    protected OneClassSvmDetector(Builder builder) {
        checkArgument(builder.nu > 0 && builder.nu <= 1, "nu should be in (0, 1]");
        builder.gamma.ifPresent(g -> checkArgument(g > 0, "gamma should be positive"));
        nu = builder.nu;
        gamma = builder.gamma;
        solver = new OneClassSolver(builder.tolerance, builder.maxIterations);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fits the boundary and returns the decision value of every training point.
     *
     * @param points rows of equal length
     * @return decision values; negative values are outside the boundary
     */
    public double[] getDecisionValues(double[][] points) {
        checkNotNull(points, "points must not be null");
        checkArgument(points.length > 0, "at least one point is required");
        // default scale is 1 / number of features
        RbfKernel kernel = new RbfKernel(gamma.orElse(1.0 / points[0].length));
        double[][] q = kernel.gram(points);
        OneClassSolver.Solution solution = solver.solve(q, nu);
        double[] answer = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            answer[i] = solution.decision(q[i]);
        }
        return answer;
    }

    @Override
    public boolean[] detect(double[][] points) {
        double[] decisions = getDecisionValues(points);
        boolean[] answer = new boolean[decisions.length];
        for (int i = 0; i < decisions.length; i++) {
            answer[i] = decisions[i] <= 0;
        }
        return answer;
    }

    public double getNu() {
        return nu;
    }

    public Optional<Double> getGamma() {
        return gamma;
    }

    public static class Builder {

        private double nu = DEFAULT_NU;
        private Optional<Double> gamma = Optional.empty();
        private double tolerance = OneClassSolver.DEFAULT_TOLERANCE;
        private int maxIterations = 10_000_000;

        public Builder nu(double nu) {
            this.nu = nu;
            return this;
        }

        public Builder gamma(double gamma) {
            this.gamma = Optional.of(gamma);
            return this;
        }

        public Builder tolerance(double tolerance) {
            this.tolerance = tolerance;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public OneClassSvmDetector build() {
            return new OneClassSvmDetector(this);
        }
    }
}
