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
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Base64;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.amazon.thermalguard.heatmap.IHeatmapRenderer;
import com.amazon.thermalguard.testutils.SensorSnapshotGenerator;

@ExtendWith(MockitoExtension.class)
public class HeatmapRunnerTest {

    @Mock
    private BufferedReader in;
    @Mock
    private PrintWriter out;
    @Mock
    private IHeatmapRenderer renderer;

    @Test
    public void testRunWithRenderer() throws IOException {
        when(renderer.render(anyList())).thenReturn(Optional.of("aGVhdG1hcA=="));
        when(in.readLine()).thenReturn(SensorSnapshotGenerator.toJson(SensorSnapshotGenerator.identical(2, 20), null))
                .thenReturn(null);
        new HeatmapRunner(renderer).run(in, out);
        verify(out).println("aGVhdG1hcA==");
    }

    @Test
    public void testMissingSensorsPrintEmptyLine() throws IOException {
        when(in.readLine()).thenReturn("{\"status\": {\"analysisFocus\": \"HSE\"}}").thenReturn(null);
        new HeatmapRunner().run(in, out);
        verify(out).println("");
    }

    @Test
    public void testSensorsNeedOnlyPlacement() throws IOException {
        when(renderer.render(anyList())).thenReturn(Optional.of("cGxhY2Vk"));
        when(in.readLine()).thenReturn("{\"sensors\": [{\"temperature\": 30, \"x\": 1, \"z\": 2},")
                .thenReturn("{\"temperature\": 60, \"x\": 5, \"z\": 7, \"status\": \"offline\"}]}").thenReturn(null);
        new HeatmapRunner(renderer).run(in, out);
        verify(renderer).render(argThat(sensors -> sensors.size() == 2 && sensors.get(1).getTemperature() == 60.0));
        verify(out).println("cGxhY2Vk");
    }

    @Test
    public void testPngOutput() throws IOException {
        double[][] rows = new SensorSnapshotGenerator(2).grid(2, 2, 4.0, 25.0, 3.0);
        StringWriter writer = new StringWriter();
        new HeatmapRunner().run(new BufferedReader(new StringReader(SensorSnapshotGenerator.toJson(rows, null))),
                new PrintWriter(writer));
        byte[] png = Base64.getDecoder().decode(writer.toString().trim());
        // PNG signature
        assertEquals((byte) 0x89, png[0]);
        assertEquals('P', png[1]);
        assertEquals('N', png[2]);
        assertEquals('G', png[3]);
        assertTrue(png.length > 100);
    }
}
