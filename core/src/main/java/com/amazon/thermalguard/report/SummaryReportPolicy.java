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

/**
 * Generic summary, used for any focus without rules of its own.
 */
public class SummaryReportPolicy implements IReportPolicy {

    @Override
    public String report(ReportContext context) {
        int anomalies = context.getAnomalyCount();
        return ReportTag.SYSTEM.format(String.format("ML Analysis Complete. Anomalies: %d. Avg Temp: %s°C. Status: %s.",
                anomalies, oneDecimal(context.getStatistics().getMeanTemperature()),
                (anomalies == 0) ? "Normal" : "Alert"));
    }
}
