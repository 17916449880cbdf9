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

import java.util.Optional;

/**
 * The closed set of detector kinds known to the ensemble. The declaration order
 * is the canonical order of the models in an {@link EnsembleConfig} and of the
 * entries in the details of a result.
 */
public enum DetectorType {

    /**
     * distance of a count from the mean of the window, in standard deviations
     */
    ZSCORE("zscore", "zscore"),

    /**
     * breakpoints of a kernel based segmentation of the series
     */
    CHANGE_POINT("change_point", "changepoint"),

    /**
     * outlier decision of an isolation forest fit on the counts
     */
    ISOLATION_FOREST("isolation_forest", "isolation");

    private final String configName;

    private final String detailsKey;

    DetectorType(String configName, String detailsKey) {
        this.configName = configName;
        this.detailsKey = detailsKey;
    }

    /**
     * @return the name used for this detector in configurations
     */
    public String getConfigName() {
        return configName;
    }

    /**
     * @return the key used for the evidence of this detector in serialized
     *         results
     */
    public String getDetailsKey() {
        return detailsKey;
    }

    public static Optional<DetectorType> fromConfigName(String name) {
        for (DetectorType type : values()) {
            if (type.configName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static Optional<DetectorType> fromDetailsKey(String key) {
        for (DetectorType type : values()) {
            if (type.detailsKey.equals(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
