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

package com.hyperdx.anomaly;

import static com.hyperdx.anomaly.CommonUtils.checkNotNull;
import static com.hyperdx.anomaly.CommonUtils.checkState;
import static com.hyperdx.anomaly.CommonUtils.toCounts;
import static com.hyperdx.anomaly.CommonUtils.validateInternalState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.hyperdx.anomaly.config.AggregationMode;
import com.hyperdx.anomaly.config.DetectorConfig;
import com.hyperdx.anomaly.config.DetectorType;
import com.hyperdx.anomaly.config.EnsembleConfig;
import com.hyperdx.anomaly.detector.IDetector;
import com.hyperdx.anomaly.detector.ScoreNormalization;
import com.hyperdx.anomaly.returntypes.AnomalyResult;
import com.hyperdx.anomaly.returntypes.DetectorVerdict;

/**
 * Runs every enabled detector of a configuration over a series and combines
 * their verdicts into one {@link AnomalyResult} per observation.
 *
 * In {@link AggregationMode#ANY} an observation is anomalous if any detector
 * flags it. In {@link AggregationMode#COMBINED} each detector contributes a
 * score in [0,1] (scores scaled by the largest score of the detector over the
 * series, or the 0/1 flag for binary detectors), the contributions are averaged
 * over the detectors that ran, and the observation is anomalous if the average
 * exceeds {@link #COMBINED_SCORE_THRESHOLD}. With no detector running nothing
 * is anomalous.
 *
 * A detector that cannot evaluate a series this short is skipped for the call,
 * as if it were disabled.
 */
public class EnsembleAggregator {

    private static final Logger LOG = LogManager.getLogger(EnsembleAggregator.class);

    public static final double COMBINED_SCORE_THRESHOLD = 0.5;

    private final Map<DetectorType, IDetector<?>> detectors;

    public EnsembleAggregator(Map<DetectorType, IDetector<?>> detectors) {
        checkNotNull(detectors, "detectors must not be null");
        Map<DetectorType, IDetector<?>> copy = new EnumMap<>(DetectorType.class);
        copy.putAll(detectors);
        this.detectors = Collections.unmodifiableMap(copy);
    }

    /**
     * Evaluates a series.
     *
     * @param history     the observations, in time order
     * @param config      the effective configuration
     * @param excludeLast whether detectors that support it keep the last
     *                    observation out of their baseline
     * @return one result per observation
     */
    public List<AnomalyResult> aggregate(List<Observation> history, EnsembleConfig config, boolean excludeLast) {
        checkNotNull(history, "history must not be null");
        checkNotNull(config, "config must not be null");
        if (history.isEmpty()) {
            return Collections.emptyList();
        }
        double[] counts = toCounts(history);

        Map<DetectorType, List<? extends DetectorVerdict>> verdicts = new EnumMap<>(DetectorType.class);
        for (DetectorConfig model : config.getEnabledModels()) {
            List<? extends DetectorVerdict> result = run(model, counts, excludeLast);
            if (result != null) {
                validateInternalState(result.size() == counts.length,
                        model.getType().getConfigName() + " returned " + result.size() + " verdicts for "
                                + counts.length + " observations");
                verdicts.put(model.getType(), result);
            }
        }

        boolean[] anomalous = (config.getMode() == AggregationMode.COMBINED) ? combined(verdicts, counts.length)
                : any(verdicts, counts.length);

        List<AnomalyResult> results = new ArrayList<>(counts.length);
        for (int i = 0; i < counts.length; i++) {
            Map<DetectorType, DetectorVerdict> details = new EnumMap<>(DetectorType.class);
            for (Map.Entry<DetectorType, List<? extends DetectorVerdict>> entry : verdicts.entrySet()) {
                details.put(entry.getKey(), entry.getValue().get(i));
            }
            results.add(new AnomalyResult(anomalous[i], history.get(i), details));
        }
        return results;
    }

    /**
     * Runs one detector.
     *
     * @return the verdicts, or null if the detector is skipped for this series
     */
    List<? extends DetectorVerdict> run(DetectorConfig model, double[] counts, boolean excludeLast) {
        DetectorType type = model.getType();
        IDetector<?> detector = detectors.get(type);
        checkState(detector != null, "no detector registered for " + type.getConfigName());

        if (counts.length < detector.getMinimumObservations()) {
            LOG.warn("Skipping detector {}: {} observations given, at least {} required", type.getConfigName(),
                    counts.length, detector.getMinimumObservations());
            return null;
        }
        try {
            return detector.detect(counts, model, excludeLast);
        } catch (InsufficientDataException e) {
            LOG.warn("Skipping detector {}: {}", type.getConfigName(), e.getMessage());
            return null;
        } catch (ConfigurationException | DetectorFitException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DetectorFitException(type, e);
        }
    }

    static boolean[] any(Map<DetectorType, List<? extends DetectorVerdict>> verdicts, int length) {
        boolean[] result = new boolean[length];
        for (List<? extends DetectorVerdict> list : verdicts.values()) {
            for (int i = 0; i < length; i++) {
                result[i] |= list.get(i).isAnomalous();
            }
        }
        return result;
    }

    boolean[] combined(Map<DetectorType, List<? extends DetectorVerdict>> verdicts, int length) {
        double[] sum = new double[length];
        for (Map.Entry<DetectorType, List<? extends DetectorVerdict>> entry : verdicts.entrySet()) {
            List<? extends DetectorVerdict> list = entry.getValue();
            if (detectors.get(entry.getKey()).getScoreNormalization() == ScoreNormalization.BINARY) {
                for (int i = 0; i < length; i++) {
                    sum[i] += list.get(i).isAnomalous() ? 1 : 0;
                }
            } else {
                double max = list.stream().mapToDouble(DetectorVerdict::getScore).max().orElse(0);
                if (max > 0) {
                    for (int i = 0; i < length; i++) {
                        sum[i] += Math.max(0, list.get(i).getScore() / max);
                    }
                }
            }
        }

        boolean[] result = new boolean[length];
        int contributing = verdicts.size();
        if (contributing == 0) {
            return result;
        }
        for (int i = 0; i < length; i++) {
            result[i] = sum[i] / contributing > COMBINED_SCORE_THRESHOLD;
        }
        return result;
    }

    public Map<DetectorType, IDetector<?>> getDetectors() {
        return detectors;
    }
}
