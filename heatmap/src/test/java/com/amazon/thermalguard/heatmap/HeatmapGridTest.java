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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class HeatmapGridTest {

    @Test
    public void testLinspace() {
        assertArrayEquals(new double[] { 0, 0.25, 0.5, 0.75, 1 }, HeatmapGrid.linspace(0, 1, 5), 1e-15);
        double[] values = HeatmapGrid.linspace(-1.1, 2.3, 80);
        assertEquals(-1.1, values[0]);
        assertEquals(2.3, values[79]);
        assertThrows(IllegalArgumentException.class, () -> HeatmapGrid.linspace(0, 1, 1));
    }

    @Test
    public void testAccessors() {
        double[][] values = new double[][] { { 1, 2, 3 }, { 4, 5, 6 } };
        HeatmapGrid grid = new HeatmapGrid(new double[] { 0, 1, 2 }, new double[] { 10, 20 }, values);
        assertEquals(3, grid.getColumns());
        assertEquals(2, grid.getRows());
        assertEquals(6.0, grid.getValue(1, 2));
        assertEquals(2.0, grid.getX(2));
        assertEquals(20.0, grid.getZ(1));
        assertEquals(1.0, grid.getMinValue());
        assertEquals(6.0, grid.getMaxValue());
    }

    @Test
    public void testShapeMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> new HeatmapGrid(new double[] { 0, 1 }, new double[] { 0 }, new double[][] { { 1, 2, 3 } }));
        assertThrows(IllegalArgumentException.class,
                () -> new HeatmapGrid(new double[] { 0, 1 }, new double[] { 0, 1 }, new double[][] { { 1, 2 } }));
    }
}
