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
import static com.amazon.thermalguard.CommonUtils.checkNotNull;

import java.util.List;

import com.amazon.thermalguard.model.SensorReading;

/**
 * Inverse distance weighting over the x-z plane. The temperature at a point is
 * the average of the sensor temperatures weighted by 1 / (distance + epsilon),
 * so a point on top of a sensor takes that sensor's temperature.
 */
public class IdwInterpolator {

    public static final double EPSILON = 1e-6;

    public static final int DEFAULT_COLUMNS = 100;

    public static final int DEFAULT_ROWS = 80;

    /**
     * margin added on every side of the bounding box of the sensors
     */
    public static final double MARGIN = 1.0;

    private final int columns;

    private final int rows;

    public IdwInterpolator(int columns, int rows) {
        checkArgument(columns > 1 && rows > 1, "grid needs at least two rows and columns");
        this.columns = columns;
        this.rows = rows;
    }

    public IdwInterpolator() {
        this(DEFAULT_COLUMNS, DEFAULT_ROWS);
    }

    public static double interpolate(double x, double z, List<SensorReading> sensors) {
        checkArgument(!sensors.isEmpty(), "cannot interpolate without sensors");
        double weightedSum = 0;
        double weightSum = 0;
        for (SensorReading sensor : sensors) {
            double dx = sensor.getX() - x;
            double dz = sensor.getZ() - z;
            double weight = 1.0 / (Math.sqrt(dx * dx + dz * dz) + EPSILON);
            weightedSum += weight * sensor.getTemperature();
            weightSum += weight;
        }
        return weightedSum / weightSum;
    }

    /**
     * @param sensors a non-empty list of sensors
     * @return the grid over their expanded bounding box
     */
    public HeatmapGrid grid(List<SensorReading> sensors) {
        checkNotNull(sensors, "sensors must not be null");
        checkArgument(!sensors.isEmpty(), "cannot interpolate without sensors");
        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double minZ = Double.POSITIVE_INFINITY;
        double maxZ = Double.NEGATIVE_INFINITY;
        for (SensorReading sensor : sensors) {
            minX = Math.min(minX, sensor.getX());
            maxX = Math.max(maxX, sensor.getX());
            minZ = Math.min(minZ, sensor.getZ());
            maxZ = Math.max(maxZ, sensor.getZ());
        }
        double[] xs = HeatmapGrid.linspace(minX - MARGIN, maxX + MARGIN, columns);
        double[] zs = HeatmapGrid.linspace(minZ - MARGIN, maxZ + MARGIN, rows);
        double[][] values = new double[rows][columns];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                values[i][j] = interpolate(xs[j], zs[i], sensors);
            }
        }
        return new HeatmapGrid(xs, zs, values);
    }

    public int getColumns() {
        return columns;
    }

    public int getRows() {
        return rows;
    }
}
