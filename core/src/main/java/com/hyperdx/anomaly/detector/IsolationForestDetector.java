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
import java.util.List;
import java.util.Optional;

import com.hyperdx.anomaly.config.DetectorConfig;
import com.hyperdx.anomaly.config.DetectorType;
import com.hyperdx.anomaly.isolationforest.IsolationForest;
import com.hyperdx.anomaly.returntypes.IsolationForestVerdict;

/**
 * Fits an {@link IsolationForest} on the counts of the series, each count an
 * independent sample, and reports its outlier decision. The evidence is the
 * negated decision function so that larger values are more anomalous.
 *
 * A new forest is fit on every call over the whole series. Results are only
 * reproducible when the {@code random_seed} parameter is set; it must be an
 * integer no larger than {@link #MAXIMUM_RANDOM_SEED} in magnitude.
 */
public class IsolationForestDetector implements IDetector<IsolationForestVerdict> {

    public static final String CONTAMINATION = "contamination";

    public static final String NUMBER_OF_TREES = "number_of_trees";

    public static final String MAX_SAMPLES = "max_samples";

    public static final String RANDOM_SEED = "random_seed";

    public static final double DEFAULT_CONTAMINATION = IsolationForest.DEFAULT_CONTAMINATION;

    /**
     * Largest magnitude of a seed, the range in which a double holds every
     * integer exactly.
     */
    public static final long MAXIMUM_RANDOM_SEED = 1L << 53;

    @Override
    public DetectorType getType() {
        return DetectorType.ISOLATION_FOREST;
    }

    @Override
    public ScoreNormalization getScoreNormalization() {
        return ScoreNormalization.MAX_SCALED;
    }

    @Override
    public int getMinimumObservations() {
        return IsolationForest.MINIMUM_SAMPLES;
    }

    @Override
    public List<IsolationForestVerdict> detect(double[] counts, DetectorConfig config, boolean excludeLast) {
        checkNotNull(counts, "counts must not be null");
        IsolationForest forest = newForest(config).fit(counts);

        double[] decision = forest.decisionFunction(counts);
        List<IsolationForestVerdict> result = new ArrayList<>(counts.length);
        for (double value : decision) {
            result.add(new IsolationForestVerdict(value < 0, -value, forest.getContamination()));
        }
        return result;
    }

    IsolationForest newForest(DetectorConfig config) {
        double contamination = config.getParam(CONTAMINATION, DEFAULT_CONTAMINATION);
        double numberOfTrees = config.getParam(NUMBER_OF_TREES, IsolationForest.DEFAULT_NUMBER_OF_TREES);
        double maxSamples = config.getParam(MAX_SAMPLES, IsolationForest.DEFAULT_MAX_SAMPLES);
        checkConfiguration(contamination > 0 && contamination <= IsolationForest.MAXIMUM_CONTAMINATION,
                "isolation_forest: contamination must be in (0, 0.5]");
        checkConfiguration(numberOfTrees >= 1, "isolation_forest: number_of_trees must be at least 1");
        checkConfiguration(maxSamples >= 1, "isolation_forest: max_samples must be at least 1");

        IsolationForest.Builder builder = IsolationForest.builder().contamination(contamination)
                .numberOfTrees((int) numberOfTrees).maxSamples((int) maxSamples);
        Optional<Double> seed = config.getOptionalParam(RANDOM_SEED);
        if (seed.isPresent()) {
            double value = seed.get();
            checkConfiguration(value == Math.rint(value) && Math.abs(value) <= MAXIMUM_RANDOM_SEED,
                    "isolation_forest: random_seed must be an integer between -2^53 and 2^53");
            builder.randomSeed((long) value);
        }
        return builder.build();
    }
}
