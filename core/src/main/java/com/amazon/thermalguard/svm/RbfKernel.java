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
import static com.amazon.thermalguard.CommonUtils.squaredDistance;

/**
 * Radial basis function kernel, exp(-gamma * |a - b|^2).
 */
public class RbfKernel {

    private final double gamma;

    public RbfKernel(double gamma) {
        checkArgument(gamma > 0, "gamma should be positive");
        this.gamma = gamma;
    }

    public double compute(double[] a, double[] b) {
        return Math.exp(-gamma * squaredDistance(a, b));
    }

    /**
     * @param points rows of equal length
     * @return the symmetric matrix of pairwise kernel values
     */
    public double[][] gram(double[][] points) {
        int n = points.length;
        double[][] answer = new double[n][n];
        for (int i = 0; i < n; i++) {
            answer[i][i] = 1.0;
            for (int j = 0; j < i; j++) {
                answer[i][j] = answer[j][i] = compute(points[i], points[j]);
            }
        }
        return answer;
    }

    public double getGamma() {
        return gamma;
    }
}
