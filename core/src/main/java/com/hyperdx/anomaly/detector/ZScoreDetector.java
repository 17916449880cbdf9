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

import static com.hyperdx.anomaly.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import com.hyperdx.anomaly.config.DetectorConfig;
import com.hyperdx.anomaly.config.DetectorType;
import com.hyperdx.anomaly.returntypes.ZScoreVerdict;
import com.hyperdx.anomaly.statistics.Deviation;

/**
 * Flags counts that lie more than {@code threshold} population standard
 * deviations away from the mean of the series.
 *
 * When the last value is excluded, the mean and deviation are computed from
 * every value but the last one and all values, the last included, are scored
 * against that baseline. This is how a new point is scored against its prior
 * history without inflating its own baseline.
 */
public class ZScoreDetector implements IDetector<ZScoreVerdict> {

    public static final String THRESHOLD = "threshold";

    public static final double DEFAULT_THRESHOLD = 3.0;

    @Override
    public DetectorType getType() {
        return DetectorType.ZSCORE;
    }

    @Override
    public ScoreNormalization getScoreNormalization() {
        return ScoreNormalization.MAX_SCALED;
    }

    @Override
    public List<ZScoreVerdict> detect(double[] counts, DetectorConfig config, boolean excludeLast) {
        checkNotNull(counts, "counts must not be null");
        double threshold = config.getParam(THRESHOLD, DEFAULT_THRESHOLD);

        int baselineLength = excludeLast ? Math.max(counts.length - 1, 0) : counts.length;
        Deviation baseline = Deviation.of(counts, baselineLength);
        double mean = baseline.isEmpty() ? 0 : baseline.getMean();
        double stdv = baseline.isEmpty() ? 0 : baseline.getDeviation();

        List<ZScoreVerdict> result = new ArrayList<>(counts.length);
        for (double count : counts) {
            double zscore = (stdv != 0) ? Math.abs(count - mean) / stdv : 0;
            result.add(new ZScoreVerdict(zscore > threshold, zscore, mean, stdv, threshold));
        }
        return result;
    }
}
