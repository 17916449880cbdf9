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

package com.hyperdx.anomaly.detector;

import java.util.List;

import com.hyperdx.anomaly.config.DetectorConfig;
import com.hyperdx.anomaly.config.DetectorType;
import com.hyperdx.anomaly.returntypes.DetectorVerdict;

/**
 * A detector evaluates a whole series of counts at once and returns one verdict
 * per position. Implementations hold no state between calls and may be shared
 * across threads.
 *
 * @param <V> the verdict type produced by the detector
 */
public interface IDetector<V extends DetectorVerdict> {

    DetectorType getType();

    /**
     * @return how scores of this detector are normalized in the combined mode
     */
    ScoreNormalization getScoreNormalization();

    /**
     * @return the shortest series this detector can evaluate; the ensemble skips
     *         the detector for shorter series
     */
    default int getMinimumObservations() {
        return 1;
    }

    /**
     * Evaluates a series.
     *
     * @param counts      the series, in time order
     * @param config      the configuration of this detector
     * @param excludeLast if true, and the detector supports it, the last value is
     *                    kept out of the baseline it is scored against
     * @return a list of verdicts with one entry per element of {@code counts}
     */
    List<V> detect(double[] counts, DetectorConfig config, boolean excludeLast);
}
