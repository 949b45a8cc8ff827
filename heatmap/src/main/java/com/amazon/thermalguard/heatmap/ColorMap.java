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

import static com.amazon.thermalguard.CommonUtils.checkArgument;

import java.awt.Color;

/**
 * A piecewise linear color ramp through evenly spaced anchor colors.
 */
public class ColorMap {

    /**
     * black through purple and orange to pale yellow
     */
    public static final ColorMap INFERNO = new ColorMap(new int[][] { { 0, 0, 4 }, { 31, 12, 72 }, { 85, 15, 109 },
            { 136, 34, 106 }, { 186, 54, 85 }, { 227, 89, 51 }, { 249, 140, 10 }, { 249, 201, 50 },
            { 252, 255, 164 } });

    private final int[][] anchors;

    public ColorMap(int[][] anchors) {
        checkArgument(anchors.length > 1, "at least two anchor colors are required");
        this.anchors = anchors;
    }

    /**
     * @param fraction position on the ramp; clipped to [0, 1]
     * @return the color at that position
     */
    public Color getColor(double fraction) {
        double clipped = Double.isNaN(fraction) ? 0 : Math.max(0, Math.min(1, fraction));
        double position = clipped * (anchors.length - 1);
        int low = Math.min((int) Math.floor(position), anchors.length - 2);
        double t = position - low;
        int[] a = anchors[low];
        int[] b = anchors[low + 1];
        return new Color((int) Math.round(a[0] + (b[0] - a[0]) * t), (int) Math.round(a[1] + (b[1] - a[1]) * t),
                (int) Math.round(a[2] + (b[2] - a[2]) * t));
    }

    /**
     * @return the color of value on a ramp stretched from min to max; a flat
     *         range maps to the start of the ramp
     */
    public Color getColor(double value, double min, double max) {
        return (max > min) ? getColor((value - min) / (max - min)) : getColor(0);
    }
}
