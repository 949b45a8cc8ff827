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

package com.amazon.thermalguard.anomalydetection;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class OneClassSvmDetectorTest {

    private double[][] points;
    private int outlier;

    @BeforeEach
    public void setUp() {
        Random random = new Random(1);
        points = new double[21][2];
        for (int i = 0; i < 20; i++) {
            points[i][0] = 0.3 * random.nextGaussian();
            points[i][1] = 0.3 * random.nextGaussian();
        }
        outlier = 20;
        points[outlier] = new double[] { 8.0, -8.0 };
    }

    @Test
    public void testDefaults() {
        OneClassSvmDetector detector = OneClassSvmDetector.builder().build();
        assertEquals(OneClassSvmDetector.DEFAULT_NU, detector.getNu());
        assertFalse(detector.getGamma().isPresent());
        assertEquals(0.5, OneClassSvmDetector.builder().gamma(0.5).build().getGamma().get());
    }

    @Test
    public void testInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> OneClassSvmDetector.builder().nu(0).build());
        assertThrows(IllegalArgumentException.class, () -> OneClassSvmDetector.builder().nu(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> OneClassSvmDetector.builder().gamma(-1).build());
        assertThrows(IllegalArgumentException.class, () -> OneClassSvmDetector.builder().tolerance(0).build());
    }

    @Test
    public void testDetectFlagsOutlier() {
        OneClassSvmDetector detector = OneClassSvmDetector.builder().nu(0.2).build();
        assertTrue(detector.detect(points)[outlier]);
        assertTrue(detector.getDecisionValues(points)[outlier] < 0);
    }

    @Test
    public void testVerdictFollowsSignOfDecision() {
        OneClassSvmDetector detector = spy(OneClassSvmDetector.builder().build());
        double[][] input = new double[][] { { 0 }, { 1 }, { 2 }, { 3 } };
        doReturn(new double[] { 5e-4, 0.0, -5e-4, 2.0 }).when(detector).getDecisionValues(input);
        assertArrayEquals(new boolean[] { false, true, true, false }, detector.detect(input));
    }

    @Test
    public void testOutsideFractionBoundedByNu() {
        double nu = 0.2;
        OneClassSvmDetector detector = OneClassSvmDetector.builder().nu(nu).build();
        boolean[] flags = detector.detect(points);
        double[] decisions = detector.getDecisionValues(points);
        int count = 0;
        for (int i = 0; i < flags.length; i++) {
            assertEquals(decisions[i] <= 0, flags[i]);
            count += flags[i] ? 1 : 0;
        }
        assertTrue(flags[outlier]);
        assertTrue(count <= nu * points.length);
    }
}
