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

package com.amazon.thermalguard.svm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class RbfKernelTest {

    @Test
    public void testCompute() {
        RbfKernel kernel = new RbfKernel(0.5);
        assertEquals(1.0, kernel.compute(new double[] { 1, 2 }, new double[] { 1, 2 }));
        assertEquals(Math.exp(-0.5 * 5), kernel.compute(new double[] { 0, 0 }, new double[] { 1, 2 }), 1e-15);
        assertThrows(IllegalArgumentException.class, () -> new RbfKernel(0));
    }

    @Test
    public void testGram() {
        RbfKernel kernel = new RbfKernel(1.0);
        double[][] points = new double[][] { { 0 }, { 1 }, { 3 } };
        double[][] gram = kernel.gram(points);
        for (int i = 0; i < points.length; i++) {
            assertEquals(1.0, gram[i][i]);
            for (int j = 0; j < points.length; j++) {
                assertEquals(gram[i][j], gram[j][i]);
                assertEquals(kernel.compute(points[i], points[j]), gram[i][j]);
            }
        }
    }
}
