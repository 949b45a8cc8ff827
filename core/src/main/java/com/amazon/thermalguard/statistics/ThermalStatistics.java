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

import java.util.List;

import lombok.Getter;

import com.amazon.thermalguard.config.DriftTrend;
import com.amazon.thermalguard.model.SensorReading;

/**
 * Descriptive statistics of the online sensors of one snapshot. These depend
 * only on the raw readings and are computed whatever the detectors decide.
 */
@Getter
public class ThermalStatistics {

    private final int count;

    private final double meanTemperature;

    private final double maxTemperature;

    private final double minTemperature;

    private final double temperatureRange;

    private final double temperatureDeviation;

    private final double meanDrift;

    private final DriftTrend trend;

    public ThermalStatistics(double meanTemperature, double maxTemperature, double minTemperature,
            double temperatureDeviation, double meanDrift, int count) {
        checkArgument(count > 0, "statistics need at least one sensor");
        this.count = count;
        this.meanTemperature = meanTemperature;
        this.maxTemperature = maxTemperature;
        this.minTemperature = minTemperature;
        this.temperatureRange = maxTemperature - minTemperature;
        this.temperatureDeviation = temperatureDeviation;
        this.meanDrift = meanDrift;
        this.trend = DriftTrend.classify(meanDrift);
    }

    /**
     * @param online a non-empty list of online sensors
     * @return the statistics of their temperatures and drifts
     */
    public static ThermalStatistics of(List<SensorReading> online) {
        checkNotNull(online, "sensors must not be null");
        checkArgument(online.size() > 0, "statistics need at least one sensor");
        double[] temperatures = new double[online.size()];
        double[] drifts = new double[online.size()];
        for (int i = 0; i < online.size(); i++) {
            temperatures[i] = online.get(i).getTemperature();
            drifts[i] = online.get(i).getDrift();
        }
        Deviation temperature = new Deviation(temperatures);
        Deviation drift = new Deviation(drifts);
        return new ThermalStatistics(temperature.getMean(), temperature.getMax(), temperature.getMin(),
                temperature.getDeviation(), drift.getMean(), online.size());
    }
}
