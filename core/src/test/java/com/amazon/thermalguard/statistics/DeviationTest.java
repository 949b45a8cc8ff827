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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class DeviationTest {

    @Test
    public void testValues() {
        Deviation deviation = new Deviation(new double[] { 2, 4, 4, 4, 5, 5, 7, 9 });
        assertEquals(8, deviation.getCount());
        assertEquals(5.0, deviation.getMean());
        // population deviation
        assertEquals(2.0, deviation.getDeviation(), 1e-12);
        assertEquals(2.0, deviation.getMin());
        assertEquals(9.0, deviation.getMax());
        assertFalse(deviation.isConstant());
        assertFalse(deviation.isEmpty());
    }

    @Test
    public void testConstant() {
        Deviation deviation = new Deviation(new double[] { 0.1, 0.1, 0.1 });
        assertTrue(deviation.isConstant());
        assertEquals(0.1, deviation.getMean());
        assertEquals(0.0, deviation.getDeviation());
    }

    @Test
    public void testEmpty() {
        Deviation deviation = new Deviation(new double[0]);
        assertTrue(deviation.isEmpty());
        assertEquals(0, deviation.getCount());
        assertThrows(IllegalArgumentException.class, deviation::getMean);
        assertThrows(IllegalArgumentException.class, deviation::getDeviation);
        assertThrows(IllegalArgumentException.class, deviation::getMin);
        assertThrows(IllegalArgumentException.class, deviation::getMax);
    }
}
