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

package com.amazon.thermalguard.config;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class AnalysisFocusTest {

    @Test
    public void testParse() {
        assertEquals(AnalysisFocus.HSE, AnalysisFocus.parse(null));
        assertEquals(AnalysisFocus.HSE, AnalysisFocus.parse("HSE"));
        assertEquals(AnalysisFocus.ENERGY, AnalysisFocus.parse("ENERGY"));
        assertEquals(AnalysisFocus.MAINTENANCE, AnalysisFocus.parse("MAINTENANCE"));
        assertEquals(AnalysisFocus.DIAGNOSTIC, AnalysisFocus.parse("DIAGNOSTIC"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "hse", "Maintenance", "GENERIC", "SECURITY", " HSE" })
    public void testUnrecognizedFocus(String value) {
        assertEquals(AnalysisFocus.GENERIC, AnalysisFocus.parse(value));
    }
}
