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

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Layers a partial user configuration over the canonical defaults.
 *
 * For every user entry naming a known detector, {@code enabled} replaces the
 * default flag when present and {@code params} are merged key by key, so
 * parameters the user leaves out keep their defaults. Entries naming unknown
 * detectors are ignored. When several entries name the same detector only the
 * last one is applied; earlier entries for that detector are discarded whole.
 * A mode, when present, replaces the default mode. The merge is idempotent:
 * merging the result of a merge yields the same value.
 */
public class EnsembleConfigMerger {

    private static final Logger LOG = LogManager.getLogger(EnsembleConfigMerger.class);

    private EnsembleConfigMerger() {
    }

    /**
     * @param userConfig the partial configuration, may be null
     * @return the effective configuration
     */
    public static EnsembleConfig merge(PartialEnsembleConfig userConfig) {
        EnsembleConfig merged = EnsembleConfig.defaultConfig();
        if (userConfig == null) {
            return merged;
        }

        Map<DetectorType, PartialDetectorConfig> overrides = new EnumMap<>(DetectorType.class);
        for (PartialDetectorConfig model : userConfig.getModels()) {
            Optional<DetectorType> type = model.getType();
            if (!type.isPresent()) {
                LOG.debug("Ignoring configuration for unknown detector {}", model.getName());
                continue;
            }
            if (overrides.put(type.get(), model) != null) {
                LOG.debug("Replacing earlier configuration for detector {}", model.getName());
            }
        }
        for (Map.Entry<DetectorType, PartialDetectorConfig> entry : overrides.entrySet()) {
            DetectorConfig current = merged.getModel(entry.getKey());
            PartialDetectorConfig model = entry.getValue();
            merged = merged.withModel(current.withOverrides(model.getEnabled(), model.getParams()));
        }

        if (userConfig.getMode().isPresent()) {
            merged = merged.withMode(userConfig.getMode().get());
        }
        return merged;
    }

    /**
     * Re-merges a complete configuration, for callers that hold an
     * {@link EnsembleConfig} rather than a partial one.
     *
     * @param config a complete configuration
     * @return a configuration equal to {@code config}
     */
    public static EnsembleConfig merge(EnsembleConfig config) {
        return merge((config == null) ? null : PartialEnsembleConfig.of(config));
    }
}
