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

package com.amazon.thermalguard.tree;

import static com.amazon.thermalguard.CommonUtils.checkArgument;
import static com.amazon.thermalguard.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * An axis-aligned box enclosing a set of points. Boxes are grown by merging
 * points into them and are used to choose where a random cut can separate the
 * enclosed points.
 */
public class BoundingBox {

    private final double[] minValues;
    private final double[] maxValues;
    private double rangeSum;

    public BoundingBox(double[] point) {
        checkNotNull(point, "point must not be null");
        minValues = Arrays.copyOf(point, point.length);
        maxValues = Arrays.copyOf(point, point.length);
        rangeSum = 0;
    }

    /**
     * Extends this box, in place, so that it contains the given point.
     *
     * @param point a point of the same dimension as the box
     * @return this box
     */
    public BoundingBox addPoint(double[] point) {
        checkArgument(point.length == minValues.length, "incorrect dimensions");
        double sum = 0;
        for (int i = 0; i < point.length; i++) {
            minValues[i] = Math.min(minValues[i], point[i]);
            maxValues[i] = Math.max(maxValues[i], point[i]);
            sum += maxValues[i] - minValues[i];
        }
        rangeSum = sum;
        return this;
    }

    public int getDimensions() {
        return minValues.length;
    }

    public double getMinValue(int dimension) {
        return minValues[dimension];
    }

    public double getMaxValue(int dimension) {
        return maxValues[dimension];
    }

    public double getRange(int dimension) {
        return maxValues[dimension] - minValues[dimension];
    }

    public double getRangeSum() {
        return rangeSum;
    }

    public boolean contains(double[] point) {
        for (int i = 0; i < point.length; i++) {
            if (point[i] < minValues[i] || point[i] > maxValues[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("BoundingBox(%s, %s)", Arrays.toString(minValues), Arrays.toString(maxValues));
    }
}
