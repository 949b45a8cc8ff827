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

package com.amazon.thermalguard;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.thermalguard.config.AnalysisFocus;
import com.amazon.thermalguard.model.AnalysisRequest;
import com.amazon.thermalguard.serialize.AnalysisRequestMapper;
import com.amazon.thermalguard.testutils.SensorSnapshotGenerator;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class ThermalAnalyzerBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "4", "8", "16" })
        int gridSide;

        @Param({ "100" })
        int numberOfTrees;

        @Param({ "HSE", "MAINTENANCE", "DIAGNOSTIC" })
        String focus;

        String json;
        AnalysisRequest request;
        ThermalAnalyzer analyzer;

        @Setup(Level.Trial)
        public void setUpData() {
            SensorSnapshotGenerator generator = new SensorSnapshotGenerator(17);
            double[][] rows = generator.grid(gridSide, gridSide, 5.0, 25.0, 0.5);
            rows = SensorSnapshotGenerator.withTemperature(rows, rows.length / 2, 90.0);
            json = SensorSnapshotGenerator.toJson(rows, focus);
            request = new AnalysisRequestMapper().parse(json);
            analyzer = ThermalAnalyzer.builder().numberOfTrees(numberOfTrees).build();
        }
    }

    @Benchmark
    public String analyze(BenchmarkState state) {
        return state.analyzer.analyze(state.request);
    }

    @Benchmark
    public void parseAndAnalyze(BenchmarkState state, Blackhole blackhole) {
        AnalysisRequest request = new AnalysisRequestMapper().parse(state.json);
        blackhole.consume(state.analyzer.analyze(request.withFocus(AnalysisFocus.parse(state.focus))));
    }
}
