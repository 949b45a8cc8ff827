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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class IsolationForestDetectorTest {

    private double[][] points;
    private int outlier;

    @BeforeEach
    public void setUp() {
        Random random = new Random(0);
        points = new double[21][2];
        for (int i = 0; i < 20; i++) {
            points[i][0] = random.nextDouble();
            points[i][1] = random.nextDouble();
        }
        outlier = 20;
        points[outlier] = new double[] { 10.0, 10.0 };
    }

    @Test
    public void testDefaults() {
        IsolationForestDetector detector = IsolationForestDetector.builder().build();
        assertEquals(IsolationForestDetector.DEFAULT_NUMBER_OF_TREES, detector.getNumberOfTrees());
        assertEquals(IsolationForestDetector.DEFAULT_SAMPLE_SIZE, detector.getSampleSize());
        assertEquals(IsolationForestDetector.DEFAULT_CONTAMINATION, detector.getContamination());
        assertEquals(IsolationForestDetector.DEFAULT_RANDOM_SEED, detector.getRandomSeed());
    }

    @Test
    public void testInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> IsolationForestDetector.builder().numberOfTrees(0).build());
        assertThrows(IllegalArgumentException.class, () -> IsolationForestDetector.builder().sampleSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> IsolationForestDetector.builder().contamination(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> IsolationForestDetector.builder().contamination(0.6).build());
    }

    @Test
    public void testPercentile() {
        double[] values = new double[] { 5, 3, 1, 4, 2 };
        assertEquals(2.0, IsolationForestDetector.percentile(values, 0.25));
        assertEquals(1.2, IsolationForestDetector.percentile(values, 0.05), 1e-12);
        assertEquals(3.0, IsolationForestDetector.percentile(values, 0.5));
        // the input is left unsorted
        assertArrayEquals(new double[] { 5, 3, 1, 4, 2 }, values);
    }

    @Test
    public void testSampleIndices() {
        List<Integer> sample = IsolationForestDetector.sampleIndices(50, 20, new Random(3));
        assertEquals(20, sample.size());
        assertEquals(20, new HashSet<>(sample).size());
        sample.forEach(i -> assertTrue(i >= 0 && i < 50));
        assertEquals(50, new HashSet<>(IsolationForestDetector.sampleIndices(50, 50, new Random(3))).size());
    }

    @Test
    public void testScores() {
        double[] scores = IsolationForestDetector.builder().build().getScores(points);
        for (int i = 0; i < scores.length; i++) {
            assertTrue(scores[i] < 0 && scores[i] >= -1);
            if (i != outlier) {
                assertTrue(scores[outlier] < scores[i]);
            }
        }
    }

    @Test
    public void testDetectFlagsOutlier() {
        boolean[] flags = IsolationForestDetector.builder().build().detect(points);
        int count = 0;
        for (boolean flag : flags) {
            count += flag ? 1 : 0;
        }
        assertTrue(flags[outlier]);
        assertEquals(1, count);
    }

    @Test
    public void testDeterministic() {
        assertArrayEquals(IsolationForestDetector.builder().randomSeed(7).build().getScores(points),
                IsolationForestDetector.builder().randomSeed(7).build().getScores(points));
    }

    @Test
    public void testTooFewPoints() {
        assertThrows(IllegalArgumentException.class,
                () -> IsolationForestDetector.builder().build().getScores(new double[][] { { 1.0 } }));
    }
}
