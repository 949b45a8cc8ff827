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

package com.amazon.thermalguard.statistics;

import static com.amazon.thermalguard.CommonUtils.checkArgument;
import static com.amazon.thermalguard.CommonUtils.checkNotNull;

/**
 * Mean and population standard deviation of a fixed batch of values. The
 * deviation is computed in a second pass around the mean, so a batch of equal
 * values has a deviation of exactly 0.
 */
public class Deviation {

    protected final int count;

    protected final double mean;

    protected final double deviation;

    protected final double min;

    protected final double max;

    public Deviation(double[] values) {
        checkNotNull(values, "values must not be null");
        count = values.length;
        if (count == 0) {
            mean = 0;
            deviation = 0;
            min = 0;
            max = 0;
            return;
        }
        double sum = 0;
        double low = values[0];
        double high = values[0];
        for (double value : values) {
            sum += value;
            low = Math.min(low, value);
            high = Math.max(high, value);
        }
        min = low;
        max = high;
        if (low == high) {
            mean = low;
            deviation = 0;
            return;
        }
        mean = sum / count;
        double sumSquared = 0;
        for (double value : values) {
            double t = value - mean;
            sumSquared += t * t;
        }
        deviation = Math.sqrt(sumSquared / count);
    }

    public double getMean() {
        checkArgument(count > 0, "incorrect invocation for mean");
        return mean;
    }

    public double getDeviation() {
        checkArgument(count > 0, "incorrect invocation for standard deviation");
        return deviation;
    }

    public double getMin() {
        checkArgument(count > 0, "incorrect invocation for minimum");
        return min;
    }

    public double getMax() {
        checkArgument(count > 0, "incorrect invocation for maximum");
        return max;
    }

    public int getCount() {
        return count;
    }

    /**
     * @return true if every value is identical, including the empty batch
     */
    public boolean isConstant() {
        return min == max;
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
