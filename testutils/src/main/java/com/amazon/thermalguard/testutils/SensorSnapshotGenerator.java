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

package com.amazon.thermalguard.testutils;

import java.util.Arrays;
import java.util.Locale;
import java.util.Random;
import java.util.StringJoiner;

/**
 * Generates deterministic sensor snapshots as rows of raw fields, one row per
 * sensor in the column order given by the constants below. Noise is Gaussian
 * and drawn from the seed given at construction.
 */
public class SensorSnapshotGenerator {

    public static final int TEMPERATURE = 0;
    public static final int HUMIDITY = 1;
    public static final int X = 2;
    public static final int Y = 3;
    public static final int Z = 4;
    public static final int DRIFT = 5;
    public static final int NUMBER_OF_FIELDS = 6;

    public static final double DEFAULT_HUMIDITY = 45.0;
    public static final double DEFAULT_HEIGHT = 3.0;

    private final Random random;

    public SensorSnapshotGenerator(long seed) {
        random = new Random(seed);
    }

    /**
     * Sensors evenly spaced along the x axis; temperatures vary around the given
     * mean, every other field is shared.
     */
    public double[][] line(int count, double spacing, double temperature, double temperatureNoise) {
        double[][] rows = new double[count][];
        for (int i = 0; i < count; i++) {
            rows[i] = row(temperature + temperatureNoise * random.nextGaussian(), DEFAULT_HUMIDITY, i * spacing,
                    DEFAULT_HEIGHT, 0, 0);
        }
        return rows;
    }

    /**
     * Sensors on a rows by columns grid in the x-z plane with noise on
     * temperature, humidity and drift.
     */
    public double[][] grid(int rows, int columns, double spacing, double temperature, double temperatureNoise) {
        double[][] answer = new double[rows * columns][];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                answer[i * columns + j] = row(temperature + temperatureNoise * random.nextGaussian(),
                        DEFAULT_HUMIDITY + 2 * random.nextGaussian(), j * spacing, DEFAULT_HEIGHT, i * spacing,
                        0.1 * random.nextGaussian());
            }
        }
        return answer;
    }

    public static double[][] identical(int count, double temperature) {
        double[][] rows = new double[count][];
        for (int i = 0; i < count; i++) {
            rows[i] = row(temperature, DEFAULT_HUMIDITY, 0, DEFAULT_HEIGHT, 0, 0);
        }
        return rows;
    }

    /**
     * @return a copy of rows in which one sensor reads the given temperature
     */
    public static double[][] withTemperature(double[][] rows, int index, double temperature) {
        double[][] copy = copy(rows);
        copy[index][TEMPERATURE] = temperature;
        return copy;
    }

    /**
     * @return a copy of rows in which one sensor is moved to (x, y, z)
     */
    public static double[][] withPosition(double[][] rows, int index, double x, double y, double z) {
        double[][] copy = copy(rows);
        copy[index][X] = x;
        copy[index][Y] = y;
        copy[index][Z] = z;
        return copy;
    }

    public static double[] row(double temperature, double humidity, double x, double y, double z, double drift) {
        double[] row = new double[NUMBER_OF_FIELDS];
        row[TEMPERATURE] = temperature;
        row[HUMIDITY] = humidity;
        row[X] = x;
        row[Y] = y;
        row[Z] = z;
        row[DRIFT] = drift;
        return row;
    }

    /**
     * Writes the rows as a JSON snapshot in the form read by the command-line
     * runners. Every sensor is online.
     *
     * @param rows  sensor rows
     * @param focus the analysis focus, or null to leave the status out
     * @return the snapshot
     */
    public static String toJson(double[][] rows, String focus) {
        StringJoiner sensors = new StringJoiner(",", "[", "]");
        for (int i = 0; i < rows.length; i++) {
            double[] row = rows[i];
            sensors.add(String.format(Locale.ROOT,
                    "{\"id\":\"s%d\",\"type\":\"thermal\",\"status\":\"online\",\"temperature\":%s,"
                            + "\"humidity\":%s,\"x\":%s,\"y\":%s,\"z\":%s,\"drift\":%s}",
                    i, row[TEMPERATURE], row[HUMIDITY], row[X], row[Y], row[Z], row[DRIFT]));
        }
        String status = (focus == null) ? "" : ",\"status\":{\"analysisFocus\":\"" + focus + "\"}";
        return "{\"sensors\":" + sensors + status + "}";
    }

    private static double[][] copy(double[][] rows) {
        return Arrays.stream(rows).map(double[]::clone).toArray(double[][]::new);
    }
}
