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

package com.amazon.thermalguard.report;

import static com.amazon.thermalguard.CommonUtils.checkArgument;
import static com.amazon.thermalguard.CommonUtils.checkNotNull;

import lombok.Getter;

import com.amazon.thermalguard.statistics.ThermalStatistics;

/**
 * Everything a report policy may look at: the ensemble verdict, the spatial
 * confirmation, the descriptive statistics and the sensor counts.
 */
@Getter
public class ReportContext {

    private final int anomalyCount;

    private final boolean clusterConfirmed;

    private final ThermalStatistics statistics;

    private final int onlineCount;

    private final int offlineCount;

    public ReportContext(int anomalyCount, boolean clusterConfirmed, ThermalStatistics statistics, int onlineCount,
            int offlineCount) {
        checkArgument(anomalyCount >= 0 && anomalyCount <= onlineCount, "incorrect number of anomalies");
        checkArgument(offlineCount >= 0, "incorrect number of offline sensors");
        checkArgument(!clusterConfirmed || anomalyCount >= 2, "a cluster needs at least two anomalies");
        this.anomalyCount = anomalyCount;
        this.clusterConfirmed = clusterConfirmed;
        this.statistics = checkNotNull(statistics, "statistics must not be null");
        this.onlineCount = onlineCount;
        this.offlineCount = offlineCount;
    }
}
