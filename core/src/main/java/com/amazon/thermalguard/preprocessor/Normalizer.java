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

package com.amazon.thermalguard.preprocessor;

import static com.amazon.thermalguard.CommonUtils.checkArgument;
import static com.amazon.thermalguard.CommonUtils.checkNotNull;

import java.util.Arrays;

import com.amazon.thermalguard.statistics.Deviation;

/**
 * Column standardization: every column is shifted by its mean and divided by
 * its population standard deviation. A normalizer is fitted on one matrix and
 * is meant to be discarded with it; a constant column maps to 0.
 */
public class Normalizer {

    private final double[] shift;

    private final double[] scale;

    protected Normalizer(double[] shift, double[] scale) {
        this.shift = shift;
        this.scale = scale;
    }

    /**
     * @param matrix rows of equal length, at least one row
     * @return a normalizer holding the column means and deviations of the matrix
     */
    public static Normalizer fit(double[][] matrix) {
        checkNotNull(matrix, "matrix must not be null");
        checkArgument(matrix.length > 0, "cannot fit an empty matrix");
        int dimensions = matrix[0].length;
        double[] shift = new double[dimensions];
        double[] scale = new double[dimensions];
        double[] column = new double[matrix.length];
        for (int j = 0; j < dimensions; j++) {
            for (int i = 0; i < matrix.length; i++) {
                checkArgument(matrix[i].length == dimensions, "incorrect dimensions");
                column[i] = matrix[i][j];
            }
            Deviation deviation = new Deviation(column);
            shift[j] = deviation.getMean();
            scale[j] = deviation.isConstant() ? 0 : deviation.getDeviation();
        }
        return new Normalizer(shift, scale);
    }

    public double[] transform(double[] point) {
        checkArgument(point.length == shift.length, "incorrect dimensions");
        double[] answer = new double[point.length];
        for (int j = 0; j < point.length; j++) {
            answer[j] = (scale[j] > 0) ? (point[j] - shift[j]) / scale[j] : 0;
        }
        return answer;
    }

    public double[][] transform(double[][] matrix) {
        double[][] answer = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            answer[i] = transform(matrix[i]);
        }
        return answer;
    }

    public static double[][] fitTransform(double[][] matrix) {
        return fit(matrix).transform(matrix);
    }

    public double[] getShift() {
        return Arrays.copyOf(shift, shift.length);
    }

    public double[] getScale() {
        return Arrays.copyOf(scale, scale.length);
    }
}
