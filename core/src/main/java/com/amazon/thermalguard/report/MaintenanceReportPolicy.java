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

import java.util.ArrayList;
import java.util.List;

/**
 * Fleet health scoring. Every anomaly and every offline sensor costs a fixed
 * number of points out of 100; the score never drops below 0.
 */
public class MaintenanceReportPolicy implements IReportPolicy {

    public static final int ANOMALY_PENALTY = 15;

    public static final int OFFLINE_PENALTY = 20;

    /**
     * temperature standard deviation above which thermal variance is an issue
     */
    public static final double VARIANCE_LIMIT = 5.0;

    public static int healthScore(int anomalyCount, int offlineCount) {
        return Math.max(0, 100 - anomalyCount * ANOMALY_PENALTY - offlineCount * OFFLINE_PENALTY);
    }

    public static List<String> issues(ReportContext context) {
        List<String> issues = new ArrayList<>();
        if (context.getAnomalyCount() > 0) {
            issues.add("calibration drift");
        }
        if (context.getOfflineCount() > 0) {
            issues.add("sensor failures");
        }
        if (context.getStatistics().getTemperatureDeviation() > VARIANCE_LIMIT) {
            issues.add("thermal variance");
        }
        return issues;
    }

    @Override
    public String report(ReportContext context) {
        List<String> issues = issues(context);
        return ReportTag.MAINT_REPORT.format(String.format(
                "Health Score: %d%%. Issues: %s. Anomalies: %d. Schedule maintenance if score < 70.",
                healthScore(context.getAnomalyCount(), context.getOfflineCount()),
                issues.isEmpty() ? "None" : String.join(", ", issues), context.getAnomalyCount()));
    }
}
