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

package com.amazon.thermalguard.returntypes;

import java.util.Arrays;

/**
 * Verdicts of the detector ensemble over the online sensors. Indices refer to
 * positions in the online-sensor ordering.
 */
public class EnsembleResult {

    private final boolean[] anomalies;

    private final int[] anomalyIndices;

    public EnsembleResult(boolean[] anomalies) {
        this.anomalies = Arrays.copyOf(anomalies, anomalies.length);
        int count = 0;
        for (boolean anomaly : anomalies) {
            if (anomaly) {
                ++count;
            }
        }
        anomalyIndices = new int[count];
        int next = 0;
        for (int i = 0; i < anomalies.length; i++) {
            if (anomalies[i]) {
                anomalyIndices[next++] = i;
            }
        }
    }

    /**
     * @param size number of judged points
     * @return a result in which no point is anomalous
     */
    public static EnsembleResult none(int size) {
        return new EnsembleResult(new boolean[size]);
    }

    public boolean isAnomaly(int index) {
        return anomalies[index];
    }

    public int[] getAnomalyIndices() {
        return Arrays.copyOf(anomalyIndices, anomalyIndices.length);
    }

    public int getAnomalyCount() {
        return anomalyIndices.length;
    }

    public int size() {
        return anomalies.length;
    }
}
