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

import static com.amazon.thermalguard.TestUtils.offline;
import static com.amazon.thermalguard.TestUtils.online;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.amazon.thermalguard.config.AnalysisFocus;

public class AnalysisRequestTest {

    @Test
    public void testDefaultFocus() {
        AnalysisRequest request = new AnalysisRequest(Arrays.asList(online(20, 0, 0, 0)));
        assertEquals(AnalysisFocus.HSE, request.getFocus());
        assertEquals(AnalysisFocus.MAINTENANCE, request.withFocus(AnalysisFocus.MAINTENANCE).getFocus());
    }

    @Test
    public void testOfflineCount() {
        SensorReading standby = SensorReading.builder().status("standby").temperature(20).humidity(40)
                .position(0, 0, 0).build();
        AnalysisRequest request = new AnalysisRequest(
                Arrays.asList(online(20, 0, 0, 0), offline(20), offline(21), standby));
        assertEquals(2, request.getOfflineCount());
    }

    @Test
    public void testSensorsAreCopied() {
        List<SensorReading> sensors = new ArrayList<>();
        sensors.add(online(20, 0, 0, 0));
        AnalysisRequest request = new AnalysisRequest(sensors, AnalysisFocus.HSE);
        sensors.add(online(21, 1, 0, 0));
        assertEquals(1, request.getSensors().size());
        assertThrows(UnsupportedOperationException.class, () -> request.getSensors().add(online(22, 0, 0, 0)));
    }

    @Test
    public void testNulls() {
        assertThrows(NullPointerException.class, () -> new AnalysisRequest(null));
        assertThrows(NullPointerException.class, () -> new AnalysisRequest(new ArrayList<>(), null));
        assertThrows(NullPointerException.class, () -> new AnalysisRequest(Arrays.asList((SensorReading) null)));
    }
}
