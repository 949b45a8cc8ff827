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

package com.amazon.thermalguard.config;

/**
 * Direction of the mean calibration drift over the online sensors.
 */
public enum DriftTrend {

    RISING("Rising"), FALLING("Falling"), STABLE("Stable");

    /**
     * mean drift strictly above this value is rising
     */
    public static final double DEFAULT_RISING_THRESHOLD = 0.5;

    /**
     * mean drift strictly below this value is falling
     */
    public static final double DEFAULT_FALLING_THRESHOLD = -0.5;

    private final String label;

    DriftTrend(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static DriftTrend classify(double meanDrift) {
        if (meanDrift > DEFAULT_RISING_THRESHOLD) {
            return RISING;
        } else if (meanDrift < DEFAULT_FALLING_THRESHOLD) {
            return FALLING;
        }
        return STABLE;
    }
}
