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

package com.hyperdx.anomaly.returntypes;

import static com.hyperdx.anomaly.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import com.hyperdx.anomaly.Observation;
import com.hyperdx.anomaly.config.DetectorType;

/**
 * The ensemble decision for one observation. The details hold the verdict of
 * every detector that ran in the evaluation, keyed by detector kind.
 */
@EqualsAndHashCode
@ToString
public class AnomalyResult {

    private final boolean anomalous;

    private final long count;

    private final Long timeBucket;

    private final Map<DetectorType, DetectorVerdict> details;

    public AnomalyResult(boolean anomalous, long count, Long timeBucket, Map<DetectorType, DetectorVerdict> details) {
        this.anomalous = anomalous;
        this.count = count;
        this.timeBucket = timeBucket;
        checkNotNull(details, "details must not be null");
        Map<DetectorType, DetectorVerdict> copy = new EnumMap<>(DetectorType.class);
        copy.putAll(details);
        this.details = Collections.unmodifiableMap(copy);
    }

    public AnomalyResult(boolean anomalous, Observation observation, Map<DetectorType, DetectorVerdict> details) {
        this(anomalous, observation.getCount(), observation.getTimeBucket().orElse(null), details);
    }

    public boolean isAnomalous() {
        return anomalous;
    }

    public long getCount() {
        return count;
    }

    public Optional<Long> getTimeBucket() {
        return Optional.ofNullable(timeBucket);
    }

    public Map<DetectorType, DetectorVerdict> getDetails() {
        return details;
    }

    public Optional<DetectorVerdict> getVerdict(DetectorType type) {
        return Optional.ofNullable(details.get(type));
    }

    /**
     * Typed access to the verdict of one detector.
     *
     * @param type  the detector kind
     * @param clazz the verdict class that detector produces
     * @param <V>   the verdict type
     * @return the verdict, if the detector ran
     */
    public <V extends DetectorVerdict> Optional<V> getVerdict(DetectorType type, Class<V> clazz) {
        return getVerdict(type).map(clazz::cast);
    }
}
