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

package com.amazon.thermalguard.heatmap;

import java.util.List;
import java.util.Optional;

import com.amazon.thermalguard.model.SensorReading;

/**
 * Renders the temperature field of a snapshot as an image. Renderers look at
 * positions and temperatures only; sensor status and analysis focus play no
 * part.
 */
public interface IHeatmapRenderer {

    /**
     * @param sensors the sensors of a snapshot
     * @return the encoded image, or empty if there are no sensors
     */
    Optional<String> render(List<SensorReading> sensors);
}
