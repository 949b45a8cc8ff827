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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.amazon.thermalguard.statistics.ThermalStatistics;

public class MaintenanceReportPolicyTest {

    private final MaintenanceReportPolicy policy = new MaintenanceReportPolicy();

    @Test
    public void testHealthScore() {
        assertEquals(100, MaintenanceReportPolicy.healthScore(0, 0));
        assertEquals(50, MaintenanceReportPolicy.healthScore(2, 1));
        assertEquals(5, MaintenanceReportPolicy.healthScore(5, 1));
        assertEquals(0, MaintenanceReportPolicy.healthScore(6, 3));
        assertEquals(0, MaintenanceReportPolicy.healthScore(0, 5));
    }

    @Test
    public void testIssues() {
        ReportContext context = new ReportContext(2, false, new ThermalStatistics(30, 50, 20, 5.1, 0, 8), 8, 1);
        assertEquals(Arrays.asList("calibration drift", "sensor failures", "thermal variance"),
                MaintenanceReportPolicy.issues(context));
        ReportContext quiet = new ReportContext(0, false, new ThermalStatistics(25, 30, 20, 5.0, 0, 8), 8, 0);
        assertTrue(MaintenanceReportPolicy.issues(quiet).isEmpty());
    }

    @Test
    public void testReport() {
        ReportContext context = new ReportContext(2, false, new ThermalStatistics(25, 27, 23, 1.0, 0, 6), 6, 1);
        assertEquals(
                "[MAINT_REPORT] Health Score: 50%. Issues: calibration drift, sensor failures. Anomalies: 2. Schedule maintenance if score < 70.",
                policy.report(context));
    }

    @Test
    public void testReportWithoutIssues() {
        ReportContext context = new ReportContext(0, false, new ThermalStatistics(25, 27, 23, 1.0, 0, 6), 6, 0);
        assertEquals(
                "[MAINT_REPORT] Health Score: 100%. Issues: None. Anomalies: 0. Schedule maintenance if score < 70.",
                policy.report(context));
    }

    @Test
    public void testScoreIsClamped() {
        ReportContext context = new ReportContext(6, false, new ThermalStatistics(25, 27, 23, 1.0, 0, 6), 6, 3);
        assertTrue(policy.report(context).startsWith("[MAINT_REPORT] Health Score: 0%."));
    }
}
