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

import static com.hyperdx.anomaly.CommonUtils.checkConfiguration;
import static com.hyperdx.anomaly.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.hyperdx.anomaly.changepoint.Pelt;
import com.hyperdx.anomaly.config.DetectorConfig;
import com.hyperdx.anomaly.config.DetectorType;
import com.hyperdx.anomaly.returntypes.ChangePointVerdict;

/**
 * Flags the positions where the distribution of the series shifts, as found by
 * a {@link Pelt} segmentation with an RBF kernel cost. Every verdict carries the
 * full list of breakpoints; the terminal breakpoint equals the length of the
 * series and therefore never flags an observation.
 *
 * The whole series is always used: the detector has no notion of excluding the
 * last value.
 */
public class ChangePointDetector implements IDetector<ChangePointVerdict> {

    public static final String PENALTY = "penalty";

    public static final String MIN_SIZE = "min_size";

    public static final String JUMP = "jump";

    public static final double DEFAULT_PENALTY = 10;

    public static final int MINIMUM_OBSERVATIONS = 2;

    @Override
    public DetectorType getType() {
        return DetectorType.CHANGE_POINT;
    }

    @Override
    public ScoreNormalization getScoreNormalization() {
        return ScoreNormalization.BINARY;
    }

    @Override
    public int getMinimumObservations() {
        return MINIMUM_OBSERVATIONS;
    }

    @Override
    public List<ChangePointVerdict> detect(double[] counts, DetectorConfig config, boolean excludeLast) {
        checkNotNull(counts, "counts must not be null");
        double penalty = config.getParam(PENALTY, DEFAULT_PENALTY);
        int minSize = (int) config.getParam(MIN_SIZE, Pelt.DEFAULT_MIN_SIZE);
        int jump = (int) config.getParam(JUMP, Pelt.DEFAULT_JUMP);
        checkConfiguration(penalty >= 0, "change_point: penalty must be non-negative");
        checkConfiguration(minSize >= 1, "change_point: min_size must be at least 1");
        checkConfiguration(jump >= 1, "change_point: jump must be at least 1");

        List<Integer> changePoints = Collections.emptyList();
        if (counts.length >= MINIMUM_OBSERVATIONS) {
            changePoints = Collections.unmodifiableList(
                    Pelt.builder().minSize(minSize).jump(jump).build().predict(counts, penalty));
        }

        Set<Integer> breakpoints = new HashSet<>(changePoints);
        List<ChangePointVerdict> result = new ArrayList<>(counts.length);
        for (int i = 0; i < counts.length; i++) {
            result.add(new ChangePointVerdict(breakpoints.contains(i), changePoints, penalty));
        }
        return result;
    }
}
