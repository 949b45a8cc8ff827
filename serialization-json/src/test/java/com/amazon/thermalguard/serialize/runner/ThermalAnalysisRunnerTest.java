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

package com.amazon.thermalguard.serialize.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.amazon.thermalguard.serialize.MalformedInputException;
import com.amazon.thermalguard.testutils.SensorSnapshotGenerator;

@ExtendWith(MockitoExtension.class)
public class ThermalAnalysisRunnerTest {

    private ThermalAnalysisRunner runner;

    @Mock
    private BufferedReader in;
    @Mock
    private PrintWriter out;

    @BeforeEach
    public void setUp() {
        runner = new ThermalAnalysisRunner();
    }

    @Test
    public void testRun() throws IOException {
        when(in.readLine()).thenReturn("{\"sensors\": [").thenReturn("],").thenReturn("\"status\": {}}")
                .thenReturn(null);
        runner.run(in, out);
        verify(out).println("[SYSTEM] No online sensors available for analysis.");
        verify(out).flush();
    }

    @Test
    public void testIdenticalSensors() throws IOException {
        String json = SensorSnapshotGenerator.toJson(SensorSnapshotGenerator.identical(4, 22.0), null);
        when(in.readLine()).thenReturn(json).thenReturn(null);
        runner.run(in, out);
        verify(out).println("[HSE_NOMINAL] Perimeter nominal. Avg Temp: 22.0°C.");
    }

    @Test
    public void testFocusOverride() throws IOException {
        runner.parse("--focus", "ENERGY");
        String json = SensorSnapshotGenerator.toJson(SensorSnapshotGenerator.identical(4, 22.0), "MAINTENANCE");
        when(in.readLine()).thenReturn(json).thenReturn(null);
        runner.run(in, out);
        verify(out).println("[SYSTEM] Energy analytics disabled. Use HSE or MAINTENANCE for relevant diagnostics.");
    }

    @Test
    public void testRequestFocus() throws IOException {
        String json = SensorSnapshotGenerator.toJson(SensorSnapshotGenerator.identical(3, 22.0), "MAINTENANCE");
        StringWriter writer = new StringWriter();
        runner.run(new BufferedReader(new StringReader(json)), new PrintWriter(writer));
        assertEquals("[MAINT_REPORT] Health Score: 100%. Issues: None. Anomalies: 0. Schedule maintenance if score < 70.",
                writer.toString().trim());
    }

    @Test
    public void testConfiguredAnalyzer() {
        runner.parse("--number-of-trees", "10", "--cluster-distance", "2.5", "--random-seed", "3");
        assertEquals(2.5, runner.getAnalyzer().getSpatialConsensus().getDistanceThreshold());
    }

    @Test
    public void testMalformedInput() throws IOException {
        when(in.readLine()).thenReturn("{\"sensors\": [{\"status\": \"online\"}]}").thenReturn(null);
        assertThrows(MalformedInputException.class, () -> runner.run(in, out));
        verify(out, never()).println(anyString());
    }

    @Test
    public void testExecuteReportsMalformedInput() throws IOException {
        when(in.readLine()).thenReturn("not json").thenReturn(null);
        assertEquals(SnapshotRunner.EXIT_MALFORMED_INPUT, runner.execute(in, out));
        verify(out, never()).println(anyString());
    }

    @Test
    public void testExecute() throws IOException {
        when(in.readLine()).thenReturn("{\"sensors\": []}").thenReturn(null);
        assertEquals(0, runner.execute(in, out));
        verify(out).println("[SYSTEM] No online sensors available for analysis.");
    }
}
