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
 * Tags that open every report line.
 */
public enum ReportTag {

    SYSTEM, HSE_CRITICAL, HSE_ADVISORY, HSE_NOMINAL, MAINT_REPORT, DIAG_ML;

    /**
     * @param body the message following the tag
     * @return the line "[TAG] body"
     */
    public String format(String body) {
        return "[" + name() + "] " + body;
    }

    /**
     * @param line a report line
     * @return the tag the line starts with
     * @throws IllegalArgumentException if the line does not start with a known tag
     */
    public static ReportTag of(String line) {
        for (ReportTag tag : values()) {
            if (line.startsWith("[" + tag.name() + "]")) {
                return tag;
            }
        }
        throw new IllegalArgumentException("not a report line: " + line);
    }
}
