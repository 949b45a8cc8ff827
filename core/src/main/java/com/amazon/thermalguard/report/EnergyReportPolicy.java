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
 * Energy analytics are switched off; the report only says so.
 */
public class EnergyReportPolicy implements IReportPolicy {

    public static final String DISABLED_MESSAGE = ReportTag.SYSTEM
            .format("Energy analytics disabled. Use HSE or MAINTENANCE for relevant diagnostics.");

    @Override
    public String report(ReportContext context) {
        return DISABLED_MESSAGE;
    }
}
