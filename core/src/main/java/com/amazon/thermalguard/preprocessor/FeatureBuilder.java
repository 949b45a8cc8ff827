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

import static com.amazon.thermalguard.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import com.amazon.thermalguard.model.SensorReading;

/**
 * Turns sensor readings into the feature rows the detectors work on. Only
 * online sensors contribute rows, and the row order follows the order of the
 * online sensors in the snapshot so that a row index identifies its sensor.
 */
public class FeatureBuilder {

    public static final int TEMPERATURE = 0;
    public static final int HUMIDITY = 1;
    public static final int X = 2;
    public static final int Y = 3;
    public static final int Z = 4;
    public static final int DRIFT = 5;

    public static final int NUMBER_OF_FEATURES = 6;

    public List<SensorReading> selectOnline(List<SensorReading> sensors) {
        checkNotNull(sensors, "sensors must not be null");
        List<SensorReading> online = new ArrayList<>();
        for (SensorReading reading : sensors) {
            if (reading.isOnline()) {
                online.add(reading);
            }
        }
        return online;
    }

    public double[] toFeatures(SensorReading reading) {
        double[] features = new double[NUMBER_OF_FEATURES];
        features[TEMPERATURE] = reading.getTemperature();
        features[HUMIDITY] = reading.getHumidity();
        features[X] = reading.getX();
        features[Y] = reading.getY();
        features[Z] = reading.getZ();
        features[DRIFT] = reading.getDrift();
        return features;
    }

    /**
     * @param online the online sensors, in snapshot order
     * @return one row per sensor, in the same order
     */
    public double[][] build(List<SensorReading> online) {
        checkNotNull(online, "sensors must not be null");
        double[][] matrix = new double[online.size()][];
        for (int i = 0; i < online.size(); i++) {
            matrix[i] = toFeatures(online.get(i));
        }
        return matrix;
    }
}
