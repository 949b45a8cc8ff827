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

import static com.amazon.thermalguard.CommonUtils.checkNotNull;

import java.util.EnumMap;
import java.util.Map;

import com.amazon.thermalguard.config.AnalysisFocus;

/**
 * Dispatches a report to the policy registered for the requested focus.
 */
public class ReportGenerator {

    public static final String NO_ONLINE_SENSORS = ReportTag.SYSTEM
            .format("No online sensors available for analysis.");

    private final Map<AnalysisFocus, IReportPolicy> policies;

    private final IReportPolicy fallback;

    public ReportGenerator() {
        policies = new EnumMap<>(AnalysisFocus.class);
        policies.put(AnalysisFocus.HSE, new HseReportPolicy());
        policies.put(AnalysisFocus.ENERGY, new EnergyReportPolicy());
        policies.put(AnalysisFocus.MAINTENANCE, new MaintenanceReportPolicy());
        policies.put(AnalysisFocus.DIAGNOSTIC, new DiagnosticReportPolicy());
        fallback = new SummaryReportPolicy();
    }

    /**
     * Replaces the policy of one focus.
     *
     * @param focus  the focus
     * @param policy its new policy
     * @return this generator
     */
    public ReportGenerator register(AnalysisFocus focus, IReportPolicy policy) {
        policies.put(checkNotNull(focus, "focus must not be null"), checkNotNull(policy, "policy must not be null"));
        return this;
    }

    public IReportPolicy getPolicy(AnalysisFocus focus) {
        return policies.getOrDefault(focus, fallback);
    }

    public String generate(AnalysisFocus focus, ReportContext context) {
        checkNotNull(focus, "focus must not be null");
        checkNotNull(context, "context must not be null");
        return getPolicy(focus).report(context);
    }
}
