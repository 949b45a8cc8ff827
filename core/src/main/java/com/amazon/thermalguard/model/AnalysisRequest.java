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

package com.amazon.thermalguard.model;

import static com.amazon.thermalguard.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.amazon.thermalguard.config.AnalysisFocus;

/**
 * One telemetry snapshot together with the focus the report should take.
 */
@Getter
public class AnalysisRequest {

    private final List<SensorReading> sensors;

    private final AnalysisFocus focus;

    public AnalysisRequest(List<SensorReading> sensors, AnalysisFocus focus) {
        checkNotNull(sensors, "sensors must not be null");
        checkNotNull(focus, "focus must not be null");
        for (SensorReading reading : sensors) {
            checkNotNull(reading, "sensor readings must not be null");
        }
        this.sensors = Collections.unmodifiableList(new ArrayList<>(sensors));
        this.focus = focus;
    }

    public AnalysisRequest(List<SensorReading> sensors) {
        this(sensors, AnalysisFocus.DEFAULT);
    }

    /**
     * @param focus a different focus
     * @return a request over the same sensors with the given focus
     */
    public AnalysisRequest withFocus(AnalysisFocus focus) {
        return new AnalysisRequest(sensors, focus);
    }

    public int getOfflineCount() {
        int count = 0;
        for (SensorReading reading : sensors) {
            if (reading.isOffline()) {
                ++count;
            }
        }
        return count;
    }
}
