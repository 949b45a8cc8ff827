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

import static com.amazon.thermalguard.report.ReportFormat.oneDecimal;

import com.amazon.thermalguard.statistics.ThermalStatistics;

/**
 * Safety reporting. Critical reports require either a spatially clustered set
 * of anomalies or several anomalies together with a very high peak
 * temperature; a hot peak on its own only yields an advisory. The first rule
 * that matches decides the report.
 */
public class HseReportPolicy implements IReportPolicy {

    /**
     * peak temperature above which multiple scattered anomalies become critical
     */
    public static final double CRITICAL_TEMPERATURE = 85.0;

    /**
     * peak temperature above which an advisory is raised without anomalies
     */
    public static final double ADVISORY_TEMPERATURE = 70.0;

    @Override
    public String report(ReportContext context) {
        ThermalStatistics statistics = context.getStatistics();
        int anomalies = context.getAnomalyCount();
        String deltaT = oneDecimal(statistics.getTemperatureRange());
        String trend = statistics.getTrend().getLabel();

        if (context.isClusterConfirmed()) {
            return ReportTag.HSE_CRITICAL.format(String.format(
                    "Risk Level: HIGH. %d clustered anomalous signatures detected. Delta T: %s°C. Trend: %s. Immediate investigation required.",
                    anomalies, deltaT, trend));
        }
        if (anomalies >= 2 && statistics.getMaxTemperature() > CRITICAL_TEMPERATURE) {
            return ReportTag.HSE_CRITICAL.format(String.format(
                    "Risk Level: HIGH. Multiple anomalies detected across sensors. Delta T: %s°C. Trend: %s. Immediate investigation required.",
                    deltaT, trend));
        }
        if (anomalies > 0 || statistics.getMaxTemperature() > ADVISORY_TEMPERATURE) {
            return ReportTag.HSE_ADVISORY.format(String.format(
                    "Risk Level: MEDIUM. %d anomalous signatures detected (no spatial consensus). Delta T: %s°C. Check affected nodes before escalation.",
                    anomalies, deltaT));
        }
        return ReportTag.HSE_NOMINAL
                .format(String.format("Perimeter nominal. Avg Temp: %s°C.", oneDecimal(statistics.getMeanTemperature())));
    }
}
