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

package com.amazon.thermalguard.returntypes;

import java.util.Arrays;
import java.util.Optional;

import lombok.Getter;
import lombok.Setter;

import com.amazon.thermalguard.config.AnalysisFocus;
import com.amazon.thermalguard.statistics.ThermalStatistics;

/**
 * The outcome of analyzing one snapshot: the intermediate results of the
 * pipeline and the report line built from them. When no sensor is online the
 * detectors never run, the anomaly fields stay empty and there are no
 * statistics.
 */
@Getter
@Setter
public class AnalysisDescriptor {

    private AnalysisFocus focus;

    private int onlineCount;

    private int offlineCount;

    private int[] anomalyIndices = new int[0];

    private boolean clusterConfirmed;

    private ThermalStatistics statistics;

    private String report;

    public AnalysisDescriptor(AnalysisFocus focus) {
        this.focus = focus;
    }

    public int getAnomalyCount() {
        return anomalyIndices.length;
    }

    public int[] getAnomalyIndices() {
        return Arrays.copyOf(anomalyIndices, anomalyIndices.length);
    }

    public Optional<ThermalStatistics> getStatistics() {
        return Optional.ofNullable(statistics);
    }

    public boolean isAnalyzed() {
        return onlineCount > 0;
    }
}
