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

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Number rendering shared by the report policies.
 */
public class ReportFormat {

    private ReportFormat() {
    }

    /**
     * Renders a value with one decimal. The exact binary value is rounded, with
     * ties to even, so 0.25 renders as 0.2 and 0.35 (stored as
     * 0.34999999999999997...) as 0.3. Negative values that round to zero keep
     * their sign.
     *
     * @param value any double
     * @return the rendered value
     */
    public static String oneDecimal(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        } else if (Double.isInfinite(value)) {
            return (value > 0) ? "inf" : "-inf";
        }
        BigDecimal rounded = new BigDecimal(value).setScale(1, RoundingMode.HALF_EVEN);
        String text = rounded.toPlainString();
        if (rounded.signum() == 0 && (value < 0 || Double.doubleToRawLongBits(value) == Long.MIN_VALUE)) {
            return "-" + text;
        }
        return text;
    }
}
