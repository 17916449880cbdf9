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

package com.hyperdx.anomaly.config;

import static com.hyperdx.anomaly.CommonUtils.checkConfiguration;
import static com.hyperdx.anomaly.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The effective configuration of one detector: whether it runs and the numeric
 * parameters it runs with. Instances are immutable.
 */
@Getter
@EqualsAndHashCode
@ToString
public class DetectorConfig {

    private final DetectorType type;

    private final boolean enabled;

    private final Map<String, Double> params;

    public DetectorConfig(DetectorType type, boolean enabled, Map<String, Double> params) {
        this.type = checkNotNull(type, "type must not be null");
        this.enabled = enabled;
        this.params = Collections.unmodifiableMap(copyParams(type, params));
    }

    /**
     * Returns the value of a parameter, or the given default if the parameter is
     * absent.
     *
     * @param name         the parameter name
     * @param defaultValue value used when the parameter is not configured
     * @return the configured or the default value
     */
    public double getParam(String name, double defaultValue) {
        Double value = params.get(name);
        return (value == null) ? defaultValue : value;
    }

    public Optional<Double> getOptionalParam(String name) {
        return Optional.ofNullable(params.get(name));
    }

    /**
     * Produces a new configuration where the given fields replace the current
     * ones. A null {@code enabled} keeps the current flag; the overrides are
     * merged key by key into the current parameters.
     *
     * @param enabled   the new flag, or null
     * @param overrides parameters to add or replace, or null
     * @return a new configuration
     */
    public DetectorConfig withOverrides(Boolean enabled, Map<String, Double> overrides) {
        Map<String, Double> merged = new LinkedHashMap<>(params);
        if (overrides != null) {
            merged.putAll(copyParams(type, overrides));
        }
        return new DetectorConfig(type, (enabled == null) ? this.enabled : enabled, merged);
    }

    private static Map<String, Double> copyParams(DetectorType type, Map<String, Double> params) {
        Map<String, Double> copy = new LinkedHashMap<>();
        if (params == null) {
            return copy;
        }
        for (Map.Entry<String, Double> entry : params.entrySet()) {
            checkConfiguration(entry.getKey() != null, type.getConfigName() + ": parameter names must not be null");
            Double value = entry.getValue();
            checkConfiguration(value != null && Double.isFinite(value),
                    type.getConfigName() + ": parameter " + entry.getKey() + " must be a finite number");
            copy.put(entry.getKey(), value);
        }
        return copy;
    }
}
