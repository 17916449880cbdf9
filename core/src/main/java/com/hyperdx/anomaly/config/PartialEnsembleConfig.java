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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A configuration as supplied by a caller: any subset of detector overrides
 * and optionally a mode. It is turned into an {@link EnsembleConfig} by
 * {@link EnsembleConfigMerger#merge(PartialEnsembleConfig)}.
 */
@EqualsAndHashCode
@ToString
public class PartialEnsembleConfig {

    private final List<PartialDetectorConfig> models;

    private final AggregationMode mode;

    public PartialEnsembleConfig(List<PartialDetectorConfig> models, AggregationMode mode) {
        this.models = (models == null) ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(models));
        this.mode = mode;
    }

    public static PartialEnsembleConfig empty() {
        return new PartialEnsembleConfig(null, null);
    }

    /**
     * Expresses a complete configuration as a partial one that overrides every
     * field.
     *
     * @param config a complete configuration
     * @return the equivalent partial configuration
     */
    public static PartialEnsembleConfig of(EnsembleConfig config) {
        checkNotNull(config, "config must not be null");
        List<PartialDetectorConfig> models = new ArrayList<>();
        for (DetectorConfig model : config.getModels()) {
            models.add(PartialDetectorConfig.of(model));
        }
        return new PartialEnsembleConfig(models, config.getMode());
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<PartialDetectorConfig> getModels() {
        return models;
    }

    public Optional<AggregationMode> getMode() {
        return Optional.ofNullable(mode);
    }

    public static class Builder {

        private final List<PartialDetectorConfig> models = new ArrayList<>();
        private AggregationMode mode;

        public Builder model(PartialDetectorConfig model) {
            models.add(checkNotNull(model, "model must not be null"));
            return this;
        }

        public Builder model(String name, Boolean enabled, Map<String, Double> params) {
            return model(new PartialDetectorConfig(name, enabled, params));
        }

        public Builder enable(DetectorType type) {
            return model(type.getConfigName(), true, null);
        }

        public Builder disable(DetectorType type) {
            return model(type.getConfigName(), false, null);
        }

        public Builder params(DetectorType type, Map<String, Double> params) {
            return model(type.getConfigName(), null, params);
        }

        public Builder mode(AggregationMode mode) {
            this.mode = mode;
            return this;
        }

        public PartialEnsembleConfig build() {
            return new PartialEnsembleConfig(models, mode);
        }
    }
}
