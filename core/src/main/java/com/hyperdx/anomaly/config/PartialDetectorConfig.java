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

import static com.hyperdx.anomaly.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A user override for one detector. The name is kept as a string so that
 * configurations naming detectors this version does not know can still be
 * accepted (and ignored). Fields left null keep their default.
 */
@Getter
@EqualsAndHashCode
@ToString
public class PartialDetectorConfig {

    private final String name;

    private final Boolean enabled;

    private final Map<String, Double> params;

    public PartialDetectorConfig(String name, Boolean enabled, Map<String, Double> params) {
        this.name = checkNotNull(name, "name must not be null");
        this.enabled = enabled;
        this.params = (params == null) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static PartialDetectorConfig of(DetectorConfig config) {
        return new PartialDetectorConfig(config.getType().getConfigName(), config.isEnabled(), config.getParams());
    }

    public Optional<DetectorType> getType() {
        return DetectorType.fromConfigName(name);
    }
}
