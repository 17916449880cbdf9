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

package com.hyperdx.anomaly.serialize.state;

import static com.hyperdx.anomaly.CommonUtils.checkConfiguration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hyperdx.anomaly.config.AggregationMode;
import com.hyperdx.anomaly.config.PartialDetectorConfig;
import com.hyperdx.anomaly.config.PartialEnsembleConfig;

/**
 * Maps the user supplied configuration. Every field of the state may be
 * missing; parameter values must be JSON numbers.
 */
public class PartialEnsembleConfigMapper implements IStateMapper<PartialEnsembleConfig, EnsembleConfigState> {

    @Override
    public EnsembleConfigState toState(PartialEnsembleConfig model) {
        EnsembleConfigState state = new EnsembleConfigState();
        List<DetectorConfigState> models = new ArrayList<>();
        for (PartialDetectorConfig config : model.getModels()) {
            DetectorConfigState detectorState = new DetectorConfigState();
            detectorState.setName(config.getName());
            detectorState.setEnabled(config.getEnabled());
            if (config.getParams() != null) {
                detectorState.setParams(new LinkedHashMap<>(config.getParams()));
            }
            models.add(detectorState);
        }
        state.setModels(models);
        state.setMode(model.getMode().map(AggregationMode::getConfigName).orElse(null));
        return state;
    }

    @Override
    public PartialEnsembleConfig toModel(EnsembleConfigState state) {
        if (state == null) {
            return PartialEnsembleConfig.empty();
        }
        List<PartialDetectorConfig> models = new ArrayList<>();
        if (state.getModels() != null) {
            for (DetectorConfigState detectorState : state.getModels()) {
                checkConfiguration(detectorState != null, "models must not contain null");
                checkConfiguration(detectorState.getName() != null, "every model needs a name");
                models.add(new PartialDetectorConfig(detectorState.getName(), detectorState.getEnabled(),
                        toParams(detectorState.getName(), detectorState.getParams())));
            }
        }
        AggregationMode mode = (state.getMode() == null) ? null : AggregationMode.fromConfigName(state.getMode());
        return new PartialEnsembleConfig(models, mode);
    }

    private static Map<String, Double> toParams(String name, Map<String, Object> params) {
        if (params == null) {
            return null;
        }
        Map<String, Double> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            checkConfiguration(entry.getValue() instanceof Number,
                    name + ": parameter " + entry.getKey() + " must be a number");
            result.put(entry.getKey(), ((Number) entry.getValue()).doubleValue());
        }
        return result;
    }
}
