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

package com.amazon.thermalguard.serialize;

import static com.amazon.thermalguard.CommonUtils.checkNotNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.amazon.thermalguard.config.AnalysisFocus;
import com.amazon.thermalguard.model.AnalysisRequest;
import com.amazon.thermalguard.model.SensorReading;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Maps the JSON snapshot {@code {"sensors": [...], "status": {"analysisFocus":
 * "..."}}} onto an {@link AnalysisRequest}. Unknown fields are ignored at every
 * level. Numeric fields must be JSON numbers; a quoted number is rejected.
 * Which fields are required depends on the {@link SnapshotMode}.
 */
public class AnalysisRequestMapper {

    public static final String SENSORS = "sensors";
    public static final String STATUS = "status";
    public static final String ANALYSIS_FOCUS = "analysisFocus";

    private final ObjectMapper mapper = new ObjectMapper();

    private final SnapshotMode mode;

    public AnalysisRequestMapper(SnapshotMode mode) {
        this.mode = checkNotNull(mode, "mode must not be null");
    }

    public AnalysisRequestMapper() {
        this(SnapshotMode.ANALYSIS);
    }

    public AnalysisRequest parse(String json) {
        checkNotNull(json, "json must not be null");
        try {
            return toRequest(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new MalformedInputException("invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public AnalysisRequest parse(Reader reader) throws IOException {
        checkNotNull(reader, "reader must not be null");
        try {
            return toRequest(mapper.readTree(reader));
        } catch (JsonProcessingException e) {
            throw new MalformedInputException("invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public AnalysisRequest parse(InputStream stream) throws IOException {
        checkNotNull(stream, "stream must not be null");
        try {
            return toRequest(mapper.readTree(stream));
        } catch (JsonProcessingException e) {
            throw new MalformedInputException("invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @param root the parsed document; null or a missing node for empty input
     * @return the request it describes
     */
    public AnalysisRequest toRequest(JsonNode root) {
        if (root == null || root.isMissingNode() || !root.isObject()) {
            throw new MalformedInputException("snapshot must be a JSON object");
        }
        return new AnalysisRequest(toSensors(root.get(SENSORS)), toFocus(root.get(STATUS)));
    }

    List<SensorReading> toSensors(JsonNode node) {
        if (isAbsent(node)) {
            if (mode == SnapshotMode.ANALYSIS) {
                throw new MalformedInputException("missing required field: " + SENSORS);
            }
            return Collections.emptyList();
        }
        if (!node.isArray()) {
            throw new MalformedInputException(SENSORS + " must be an array");
        }
        List<SensorReading> sensors = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            sensors.add(toSensor(node.get(i), i));
        }
        return sensors;
    }

    SensorReading toSensor(JsonNode node, int index) {
        if (!node.isObject()) {
            throw new MalformedInputException(String.format("sensor %d must be a JSON object", index));
        }
        if (mode == SnapshotMode.HEATMAP) {
            return toPlacedSensor(node, index);
        }
        JsonNode status = node.get("status");
        if (status == null || !status.isTextual()) {
            throw new MalformedInputException(String.format("sensor %d: status must be a string", index));
        }
        SensorReading.Builder builder = SensorReading.builder().id(optionalText(node.get("id")))
                .type(optionalText(node.get("type"))).status(status.asText())
                .temperature(requiredNumber(node, "temperature", index))
                .humidity(requiredNumber(node, "humidity", index)).x(requiredNumber(node, "x", index))
                .y(requiredNumber(node, "y", index)).z(requiredNumber(node, "z", index));

        JsonNode drift = node.get("drift");
        if (!isAbsent(drift)) {
            if (!drift.isNumber()) {
                throw new MalformedInputException(String.format("sensor %d: drift must be a number", index));
            }
            builder.drift(drift.asDouble());
        }
        return builder.build();
    }

    /**
     * Reads a sensor for drawing: temperature and the x, z position are required,
     * every other field is taken when usable and defaulted otherwise.
     */
    SensorReading toPlacedSensor(JsonNode node, int index) {
        JsonNode status = node.get("status");
        return SensorReading.builder().id(optionalText(node.get("id"))).type(optionalText(node.get("type")))
                .status((status != null && status.isTextual()) ? status.asText() : SensorReading.STATUS_UNKNOWN)
                .temperature(requiredNumber(node, "temperature", index))
                .humidity(optionalNumber(node.get("humidity"), 0)).x(requiredNumber(node, "x", index))
                .y(optionalNumber(node.get("y"), 0)).z(requiredNumber(node, "z", index))
                .drift(optionalNumber(node.get("drift"), SensorReading.DEFAULT_DRIFT)).build();
    }

    AnalysisFocus toFocus(JsonNode status) {
        if (isAbsent(status)) {
            return AnalysisFocus.DEFAULT;
        }
        if (!status.isObject()) {
            throw new MalformedInputException(STATUS + " must be a JSON object");
        }
        JsonNode focus = status.get(ANALYSIS_FOCUS);
        if (isAbsent(focus)) {
            return AnalysisFocus.DEFAULT;
        }
        return focus.isTextual() ? AnalysisFocus.parse(focus.asText()) : AnalysisFocus.GENERIC;
    }

    private static double requiredNumber(JsonNode sensor, String field, int index) {
        JsonNode value = sensor.get(field);
        if (isAbsent(value)) {
            throw new MalformedInputException(String.format("sensor %d: missing required field %s", index, field));
        }
        if (!value.isNumber()) {
            throw new MalformedInputException(String.format("sensor %d: %s must be a number", index, field));
        }
        return value.asDouble();
    }

    private static double optionalNumber(JsonNode node, double defaultValue) {
        return (node != null && node.isNumber()) ? node.asDouble() : defaultValue;
    }

    private static String optionalText(JsonNode node) {
        return isAbsent(node) ? null : node.asText();
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }
}
