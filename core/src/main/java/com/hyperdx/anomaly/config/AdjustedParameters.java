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

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.hyperdx.anomaly.detector.ChangePointDetector;
import com.hyperdx.anomaly.detector.IsolationForestDetector;
import com.hyperdx.anomaly.detector.ZScoreDetector;

/**
 * Detector parameters derived from a single sensitivity value. A strength of 0
 * is the least sensitive (most likely to miss anomalies) and 1 the most
 * sensitive (most likely to raise false positives).
 *
 * The ensemble entry points accept a strength but do not apply these values
 * yet; detectors run with their configured parameters.
 */
@Getter
@EqualsAndHashCode
@ToString
public class AdjustedParameters {

    public static final double MINIMUM_CONTAMINATION = 0.01;

    private final double zscoreThreshold;

    private final double changePointPenalty;

    private final double isolationForestContamination;

    private AdjustedParameters(double zscoreThreshold, double changePointPenalty,
            double isolationForestContamination) {
        this.zscoreThreshold = zscoreThreshold;
        this.changePointPenalty = changePointPenalty;
        this.isolationForestContamination = isolationForestContamination;
    }

    /**
     * @param strength sensitivity in [0, 1]
     * @return the parameters for that sensitivity
     */
    public static AdjustedParameters forStrength(double strength) {
        checkConfiguration(strength >= 0 && strength <= 1, "strength must be in [0, 1]");
        return new AdjustedParameters(5.0 - 4.0 * strength, 10 * (1.0 - strength),
                Math.max(0.1 * strength, MINIMUM_CONTAMINATION));
    }

    /**
     * @param type a detector kind
     * @return the parameter overrides for that detector
     */
    public Map<String, Double> getParams(DetectorType type) {
        Map<String, Double> params = new LinkedHashMap<>();
        switch (type) {
        case ZSCORE:
            params.put(ZScoreDetector.THRESHOLD, zscoreThreshold);
            break;
        case CHANGE_POINT:
            params.put(ChangePointDetector.PENALTY, changePointPenalty);
            break;
        case ISOLATION_FOREST:
            params.put(IsolationForestDetector.CONTAMINATION, isolationForestContamination);
            break;
        default:
            break;
        }
        return params;
    }
}
