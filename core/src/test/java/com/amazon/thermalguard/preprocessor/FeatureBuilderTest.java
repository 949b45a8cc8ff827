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

import static com.amazon.thermalguard.TestUtils.offline;
import static com.amazon.thermalguard.TestUtils.online;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.amazon.thermalguard.model.SensorReading;

public class FeatureBuilderTest {

    private final FeatureBuilder featureBuilder = new FeatureBuilder();

    @Test
    public void testSelectOnline() {
        SensorReading first = online(20, 0, 0, 0);
        SensorReading second = online(21, 1, 0, 0);
        SensorReading standby = SensorReading.builder().status("standby").temperature(20).humidity(40)
                .position(0, 0, 0).build();
        List<SensorReading> online = featureBuilder
                .selectOnline(Arrays.asList(offline(50), first, standby, second));
        assertEquals(2, online.size());
        assertSame(first, online.get(0));
        assertSame(second, online.get(1));
    }

    @Test
    public void testToFeatures() {
        SensorReading reading = SensorReading.builder().status("online").temperature(22.5).humidity(41)
                .position(1, 2, 3).drift(-0.3).build();
        double[] features = featureBuilder.toFeatures(reading);
        assertEquals(FeatureBuilder.NUMBER_OF_FEATURES, features.length);
        assertArrayEquals(new double[] { 22.5, 41, 1, 2, 3, -0.3 }, features);
        assertEquals(22.5, features[FeatureBuilder.TEMPERATURE]);
        assertEquals(-0.3, features[FeatureBuilder.DRIFT]);
    }

    @Test
    public void testBuild() {
        double[][] matrix = featureBuilder.build(Arrays.asList(online(20, 0, 0, 0), online(21, 1, 2, 3)));
        assertEquals(2, matrix.length);
        assertArrayEquals(new double[] { 21, 45, 1, 2, 3, 0 }, matrix[1]);
    }
}
