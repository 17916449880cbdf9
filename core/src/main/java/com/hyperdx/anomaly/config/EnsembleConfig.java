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

import static com.hyperdx.anomaly.CommonUtils.checkArgument;
import static com.hyperdx.anomaly.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.hyperdx.anomaly.detector.ChangePointDetector;
import com.hyperdx.anomaly.detector.IsolationForestDetector;
import com.hyperdx.anomaly.detector.ZScoreDetector;

/**
 * The fully populated configuration of an ensemble evaluation: exactly one
 * {@link DetectorConfig} per {@link DetectorType}, in canonical order, and the
 * aggregation mode. Instances are immutable and are produced by
 * {@link EnsembleConfigMerger}.
 */
@Getter
@EqualsAndHashCode
@ToString
public class EnsembleConfig {

    public static final AggregationMode DEFAULT_MODE = AggregationMode.ANY;

    private final List<DetectorConfig> models;

    private final AggregationMode mode;

    public EnsembleConfig(List<DetectorConfig> models, AggregationMode mode) {
        checkNotNull(models, "models must not be null");
        DetectorType[] types = DetectorType.values();
        checkArgument(models.size() == types.length, "exactly one model per detector type is required");
        for (int i = 0; i < types.length; i++) {
            checkArgument(models.get(i) != null && models.get(i).getType() == types[i],
                    "models must be listed in canonical order, expected " + types[i]);
        }
        this.models = Collections.unmodifiableList(new ArrayList<>(models));
        this.mode = checkNotNull(mode, "mode must not be null");
    }

    /**
     * Builds the canonical default configuration. A new value is returned on each
     * call.
     *
     * @return z-score enabled, change point and isolation forest disabled, mode
     *         any
     */
    public static EnsembleConfig defaultConfig() {
        List<DetectorConfig> models = new ArrayList<>();
        models.add(new DetectorConfig(DetectorType.ZSCORE, true,
                Collections.singletonMap(ZScoreDetector.THRESHOLD, ZScoreDetector.DEFAULT_THRESHOLD)));
        models.add(new DetectorConfig(DetectorType.CHANGE_POINT, false,
                Collections.singletonMap(ChangePointDetector.PENALTY, ChangePointDetector.DEFAULT_PENALTY)));
        models.add(new DetectorConfig(DetectorType.ISOLATION_FOREST, false, Collections
                .singletonMap(IsolationForestDetector.CONTAMINATION, IsolationForestDetector.DEFAULT_CONTAMINATION)));
        return new EnsembleConfig(models, DEFAULT_MODE);
    }

    public DetectorConfig getModel(DetectorType type) {
        checkNotNull(type, "type must not be null");
        return models.get(type.ordinal());
    }

    public List<DetectorConfig> getEnabledModels() {
        return models.stream().filter(DetectorConfig::isEnabled).collect(Collectors.toList());
    }

    public EnsembleConfig withMode(AggregationMode newMode) {
        return new EnsembleConfig(models, newMode);
    }

    public EnsembleConfig withModel(DetectorConfig model) {
        checkNotNull(model, "model must not be null");
        List<DetectorConfig> copy = new ArrayList<>(models);
        copy.set(model.getType().ordinal(), model);
        return new EnsembleConfig(copy, mode);
    }
}
