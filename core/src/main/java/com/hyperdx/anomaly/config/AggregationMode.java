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

import com.hyperdx.anomaly.ConfigurationException;

public enum AggregationMode {

    /**
     * an observation is anomalous if at least one detector flags it; catches
     * nearly everything at the cost of more false positives
     */
    ANY("any"),

    /**
     * scores of the detectors are normalized to [0,1] and averaged; the
     * observation is anomalous if the average exceeds one half, so the detectors
     * have to somewhat agree
     */
    COMBINED("combined");

    private final String configName;

    AggregationMode(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Parses the name of a mode as it appears in configurations.
     *
     * @param name the configured name
     * @return the mode
     * @throws ConfigurationException if no mode has that name
     */
    public static AggregationMode fromConfigName(String name) {
        for (AggregationMode mode : values()) {
            if (mode.configName.equals(name)) {
                return mode;
            }
        }
        throw new ConfigurationException("unknown aggregation mode: " + name);
    }
}
