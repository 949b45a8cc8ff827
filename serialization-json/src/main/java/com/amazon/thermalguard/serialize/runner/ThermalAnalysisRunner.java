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

package com.amazon.thermalguard.serialize.runner;

import java.io.IOException;

import com.amazon.thermalguard.ThermalAnalyzer;
import com.amazon.thermalguard.model.AnalysisRequest;
import com.amazon.thermalguard.runner.ArgumentParser;
import com.amazon.thermalguard.serialize.AnalysisRequestMapper;

public class ThermalAnalysisRunner extends SnapshotRunner {

    private ThermalAnalyzer analyzer;

    public ThermalAnalysisRunner() {
        super(new ArgumentParser(ThermalAnalysisRunner.class.getName(),
                "Detect thermal anomalies in a sensor snapshot and write a one-line status report."),
                new AnalysisRequestMapper());
    }

    public static void main(String... args) throws IOException {
        System.exit(runMain(new ThermalAnalysisRunner(), args));
    }

    @Override
    protected String process(AnalysisRequest request) {
        AnalysisRequest effective = argumentParser.getFocus().map(request::withFocus).orElse(request);
        return getAnalyzer().analyze(effective);
    }

    /**
     * @return the analyzer configured from the parsed arguments, built on first
     *         use
     */
    ThermalAnalyzer getAnalyzer() {
        if (analyzer == null) {
            analyzer = ThermalAnalyzer.builder().numberOfTrees(argumentParser.getNumberOfTrees())
                    .sampleSize(argumentParser.getSampleSize()).contamination(argumentParser.getContamination())
                    .randomSeed(argumentParser.getRandomSeed()).nu(argumentParser.getNu())
                    .clusterDistance(argumentParser.getClusterDistance()).build();
        }
        return analyzer;
    }
}
