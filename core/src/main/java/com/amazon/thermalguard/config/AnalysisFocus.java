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

/**
 * The operator-chosen analysis focus. It selects the reporting policy applied
 * to the detector outputs; the detection pipeline itself is identical for
 * every focus.
 */
public enum AnalysisFocus {

    /**
     * health, safety and environment; the default
     */
    HSE,
    /**
     * energy analytics, which are disabled
     */
    ENERGY,
    /**
     * sensor fleet health scoring
     */
    MAINTENANCE,
    /**
     * detector confidence and integrity
     */
    DIAGNOSTIC,
    /**
     * any focus string that is not one of the above; produces a generic summary
     */
    GENERIC;

    public static final AnalysisFocus DEFAULT = HSE;

    /**
     * Maps a focus string onto a focus. Matching is exact and case-sensitive, an
     * absent value selects the default, and unrecognized values are not an error
     * but select GENERIC.
     *
     * @param value the focus as supplied by the caller, possibly null
     * @return the corresponding focus
     */
    public static AnalysisFocus parse(String value) {
        if (value == null) {
            return DEFAULT;
        }
        for (AnalysisFocus focus : values()) {
            if (focus != GENERIC && focus.name().equals(value)) {
                return focus;
            }
        }
        return GENERIC;
    }
}
