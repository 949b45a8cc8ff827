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

package com.amazon.thermalguard.heatmap;

import static com.amazon.thermalguard.CommonUtils.checkArgument;

import java.util.Arrays;

/**
 * A regular grid of interpolated temperatures over the x-z plane. Row 0 is the
 * lowest z, column 0 the lowest x.
 */
public class HeatmapGrid {

    private final double[] xs;

    private final double[] zs;

    private final double[][] values;

    public HeatmapGrid(double[] xs, double[] zs, double[][] values) {
        checkArgument(values.length == zs.length, "one row per z coordinate");
        for (double[] row : values) {
            checkArgument(row.length == xs.length, "one column per x coordinate");
        }
        this.xs = xs;
        this.zs = zs;
        this.values = values;
    }

    /**
     * num evenly spaced values from start to stop, both included
     */
    public static double[] linspace(double start, double stop, int num) {
        checkArgument(num > 1, "at least two values are required");
        double[] answer = new double[num];
        double step = (stop - start) / (num - 1);
        for (int i = 0; i < num; i++) {
            answer[i] = start + i * step;
        }
        answer[num - 1] = stop;
        return answer;
    }

    public int getColumns() {
        return xs.length;
    }

    public int getRows() {
        return zs.length;
    }

    public double getX(int column) {
        return xs[column];
    }

    public double getZ(int row) {
        return zs[row];
    }

    public double getValue(int row, int column) {
        return values[row][column];
    }

    public double getMinValue() {
        return Arrays.stream(values).flatMapToDouble(Arrays::stream).min().orElse(Double.NaN);
    }

    public double getMaxValue() {
        return Arrays.stream(values).flatMapToDouble(Arrays::stream).max().orElse(Double.NaN);
    }
}
