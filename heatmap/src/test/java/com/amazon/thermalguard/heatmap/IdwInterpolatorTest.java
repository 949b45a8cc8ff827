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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.amazon.thermalguard.model.SensorReading;

public class IdwInterpolatorTest {

    private static SensorReading sensor(double temperature, double x, double z) {
        return SensorReading.builder().status("offline").temperature(temperature).humidity(45).position(x, 3, z)
                .build();
    }

    @Test
    public void testInterpolateAtSensor() {
        List<SensorReading> sensors = Arrays.asList(sensor(20, 0, 0), sensor(40, 10, 0), sensor(30, 0, 10));
        assertEquals(20.0, IdwInterpolator.interpolate(0, 0, sensors), 1e-5);
        assertEquals(40.0, IdwInterpolator.interpolate(10, 0, sensors), 1e-5);
    }

    @Test
    public void testInterpolateMidpoint() {
        List<SensorReading> sensors = Arrays.asList(sensor(20, 0, 0), sensor(40, 10, 0));
        assertEquals(30.0, IdwInterpolator.interpolate(5, 0, sensors), 1e-9);
        double value = IdwInterpolator.interpolate(2, 7, sensors);
        assertTrue(value > 20 && value < 40);
    }

    @Test
    public void testSingleSensorGivesConstantGrid() {
        HeatmapGrid grid = new IdwInterpolator().grid(Collections.singletonList(sensor(33.3, 4, 5)));
        assertEquals(IdwInterpolator.DEFAULT_COLUMNS, grid.getColumns());
        assertEquals(IdwInterpolator.DEFAULT_ROWS, grid.getRows());
        assertEquals(33.3, grid.getMinValue(), 1e-12);
        assertEquals(33.3, grid.getMaxValue(), 1e-12);
        assertEquals(3.0, grid.getX(0));
        assertEquals(5.0, grid.getX(grid.getColumns() - 1));
        assertEquals(4.0, grid.getZ(0));
        assertEquals(6.0, grid.getZ(grid.getRows() - 1));
    }

    @Test
    public void testGridBounds() {
        List<SensorReading> sensors = Arrays.asList(sensor(20, -2, 1), sensor(40, 8, 11), sensor(25, 3, 4));
        HeatmapGrid grid = new IdwInterpolator(11, 6).grid(sensors);
        assertEquals(11, grid.getColumns());
        assertEquals(6, grid.getRows());
        assertEquals(-3.0, grid.getX(0));
        assertEquals(9.0, grid.getX(10));
        assertEquals(0.0, grid.getZ(0));
        assertEquals(12.0, grid.getZ(5));
        assertEquals(IdwInterpolator.interpolate(grid.getX(4), grid.getZ(2), sensors), grid.getValue(2, 4));
        assertTrue(grid.getMinValue() >= 20 && grid.getMaxValue() <= 40);
    }

    @Test
    public void testInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> new IdwInterpolator(1, 10));
        assertThrows(IllegalArgumentException.class, () -> new IdwInterpolator().grid(Collections.emptyList()));
        assertThrows(NullPointerException.class, () -> new IdwInterpolator().grid(null));
    }
}
