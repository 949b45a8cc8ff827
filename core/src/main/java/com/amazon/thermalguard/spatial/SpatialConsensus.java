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

package com.amazon.thermalguard.spatial;

import static com.amazon.thermalguard.CommonUtils.checkArgument;
import static com.amazon.thermalguard.CommonUtils.checkNotNull;
import static com.amazon.thermalguard.CommonUtils.distance;

import java.util.ArrayList;
import java.util.List;

import com.amazon.thermalguard.model.SensorReading;

/**
 * Spatial corroboration of anomalies. A real thermal event shows on sensors
 * that are physically close, whereas independent sensor faults are scattered.
 * The anomalies are clustered if at least two of them are closer to each other
 * than the distance threshold.
 */
public class SpatialConsensus {

    public static final double DEFAULT_DISTANCE_THRESHOLD = 6.0;

    private final double distanceThreshold;

    public SpatialConsensus(double distanceThreshold) {
        checkArgument(distanceThreshold > 0, "distance threshold should be positive");
        this.distanceThreshold = distanceThreshold;
    }

    public SpatialConsensus() {
        this(DEFAULT_DISTANCE_THRESHOLD);
    }

    /**
     * @param positions 3-D positions; a position is never compared with itself
     * @return true if some pair of distinct entries is strictly closer than the
     *         threshold
     */
    public boolean isClustered(List<double[]> positions) {
        checkNotNull(positions, "positions must not be null");
        for (int i = 0; i < positions.size(); i++) {
            for (int j = i + 1; j < positions.size(); j++) {
                if (distance(positions.get(i), positions.get(j)) < distanceThreshold) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * @param online         the online sensors, in the order the detectors saw
     * @param anomalyIndices indices into online of the anomalous sensors
     * @return true if at least two anomalies exist and two of them are close
     */
    public boolean confirm(List<SensorReading> online, int[] anomalyIndices) {
        checkNotNull(online, "sensors must not be null");
        checkNotNull(anomalyIndices, "indices must not be null");
        if (anomalyIndices.length < 2) {
            return false;
        }
        List<double[]> positions = new ArrayList<>(anomalyIndices.length);
        for (int index : anomalyIndices) {
            positions.add(online.get(index).getPosition());
        }
        return isClustered(positions);
    }

    public double getDistanceThreshold() {
        return distanceThreshold;
    }
}
