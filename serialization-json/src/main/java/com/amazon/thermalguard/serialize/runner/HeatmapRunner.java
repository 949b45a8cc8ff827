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

import com.amazon.thermalguard.heatmap.IHeatmapRenderer;
import com.amazon.thermalguard.heatmap.PngHeatmapRenderer;
import com.amazon.thermalguard.model.AnalysisRequest;
import com.amazon.thermalguard.runner.ArgumentParser;
import com.amazon.thermalguard.serialize.AnalysisRequestMapper;
import com.amazon.thermalguard.serialize.SnapshotMode;

/**
 * Writes the Base64 encoded PNG heatmap of a snapshot, or an empty line when
 * the snapshot has no sensors. A snapshot without a sensor list is treated as
 * having none, and sensors need only a temperature and an x, z position.
 */
public class HeatmapRunner extends SnapshotRunner {

    private final IHeatmapRenderer renderer;

    public HeatmapRunner(IHeatmapRenderer renderer) {
        super(new ArgumentParser(HeatmapRunner.class.getName(),
                "Render the temperature field of a sensor snapshot as a Base64 encoded PNG."),
                new AnalysisRequestMapper(SnapshotMode.HEATMAP));
        this.renderer = renderer;
    }

    public HeatmapRunner() {
        this(new PngHeatmapRenderer());
    }

    public static void main(String... args) throws IOException {
        System.exit(runMain(new HeatmapRunner(), args));
    }

    @Override
    protected String process(AnalysisRequest request) {
        return renderer.render(request.getSensors()).orElse("");
    }
}
