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

/**
 * Diagnostic view of the detectors: a confidence that grows with the number
 * of online sensors and shrinks with every anomaly, capped at 95.
 */
public class DiagnosticReportPolicy implements IReportPolicy {

    public static final int MAX_CONFIDENCE = 95;

    /**
     * temperature standard deviation below which the distribution is uniform
     */
    public static final double UNIFORM_LIMIT = 3.0;

    public static int confidence(int onlineCount, int anomalyCount) {
        return Math.min(MAX_CONFIDENCE, 50 + onlineCount * 2 - anomalyCount * 5);
    }

    @Override
    public String report(ReportContext context) {
        int anomalies = context.getAnomalyCount();
        String distribution = (context.getStatistics().getTemperatureDeviation() < UNIFORM_LIMIT) ? "Uniform"
                : "Variable";
        return ReportTag.DIAG_ML.format(String.format(
                "Confidence: %d%%. Thermal distribution: %s. Anomalies: %d/%d. Trend: %s. Combined ML detection active. System integrity: %s.",
                confidence(context.getOnlineCount(), anomalies), distribution, anomalies, context.getOnlineCount(),
                context.getStatistics().getTrend().getLabel(), (anomalies == 0) ? "Nominal" : "Compromised"));
    }
}
