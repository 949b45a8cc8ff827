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

package com.amazon.thermalguard.model;

import static com.amazon.thermalguard.CommonUtils.checkArgument;
import static com.amazon.thermalguard.CommonUtils.checkNotNull;

import java.util.Optional;

import lombok.Getter;

/**
 * A single sensor record of a telemetry snapshot. Readings are immutable and
 * are supplied wholesale by the caller; nothing in the analysis modifies them.
 */
@Getter
public class SensorReading {

    public static final String STATUS_ONLINE = "online";

    public static final String STATUS_OFFLINE = "offline";

    /**
     * placeholder for records read without a status; never counted as online or
     * offline
     */
    public static final String STATUS_UNKNOWN = "unknown";

    /**
     * calibration drift used when the record does not carry one
     */
    public static final double DEFAULT_DRIFT = 0.0;

    private final String id;

    private final String type;

    private final String status;

    private final double temperature;

    private final double humidity;

    private final double x;

    private final double y;

    private final double z;

    private final double drift;

    protected SensorReading(Builder builder) {
        checkNotNull(builder.status, "status must not be null");
        checkArgument(builder.temperature.isPresent(), "temperature is required");
        checkArgument(builder.humidity.isPresent(), "humidity is required");
        checkArgument(builder.x.isPresent() && builder.y.isPresent() && builder.z.isPresent(),
                "x, y and z are required");
        id = builder.id;
        type = builder.type;
        status = builder.status;
        temperature = builder.temperature.get();
        humidity = builder.humidity.get();
        x = builder.x.get();
        y = builder.y.get();
        z = builder.z.get();
        drift = builder.drift;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isOnline() {
        return STATUS_ONLINE.equals(status);
    }

    /**
     * only the exact offline status counts as a failed sensor; other non-online
     * states are neither analyzed nor counted as failures
     */
    public boolean isOffline() {
        return STATUS_OFFLINE.equals(status);
    }

    /**
     * @return the position as a new array {x, y, z}
     */
    public double[] getPosition() {
        return new double[] { x, y, z };
    }

    @Override
    public String toString() {
        return String.format("SensorReading(%s, %s, t=%f, h=%f, [%f, %f, %f], drift=%f)", id, status, temperature,
                humidity, x, y, z, drift);
    }

    public static class Builder {

        private String id;
        private String type;
        private String status;
        private Optional<Double> temperature = Optional.empty();
        private Optional<Double> humidity = Optional.empty();
        private Optional<Double> x = Optional.empty();
        private Optional<Double> y = Optional.empty();
        private Optional<Double> z = Optional.empty();
        private double drift = DEFAULT_DRIFT;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = Optional.of(temperature);
            return this;
        }

        public Builder humidity(double humidity) {
            this.humidity = Optional.of(humidity);
            return this;
        }

        public Builder position(double x, double y, double z) {
            this.x = Optional.of(x);
            this.y = Optional.of(y);
            this.z = Optional.of(z);
            return this;
        }

        public Builder x(double x) {
            this.x = Optional.of(x);
            return this;
        }

        public Builder y(double y) {
            this.y = Optional.of(y);
            return this;
        }

        public Builder z(double z) {
            this.z = Optional.of(z);
            return this;
        }

        public Builder drift(double drift) {
            this.drift = drift;
            return this;
        }

        public SensorReading build() {
            return new SensorReading(this);
        }
    }
}
