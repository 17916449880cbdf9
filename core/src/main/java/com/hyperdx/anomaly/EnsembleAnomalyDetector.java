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

import static com.hyperdx.anomaly.CommonUtils.checkArgument;
import static com.hyperdx.anomaly.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.hyperdx.anomaly.config.DetectorType;
import com.hyperdx.anomaly.config.EnsembleConfig;
import com.hyperdx.anomaly.config.EnsembleConfigMerger;
import com.hyperdx.anomaly.config.PartialEnsembleConfig;
import com.hyperdx.anomaly.detector.ChangePointDetector;
import com.hyperdx.anomaly.detector.IDetector;
import com.hyperdx.anomaly.detector.IsolationForestDetector;
import com.hyperdx.anomaly.detector.ZScoreDetector;
import com.hyperdx.anomaly.executor.ISeriesExecutor;
import com.hyperdx.anomaly.executor.ParallelSeriesExecutor;
import com.hyperdx.anomaly.executor.SequentialSeriesExecutor;
import com.hyperdx.anomaly.returntypes.AnomalyResult;

/**
 * The entry point of the library. An EnsembleAnomalyDetector merges a partial
 * user configuration onto the defaults and evaluates count series with the
 * enabled detectors.
 *
 * Instances hold no per-series state and can be shared across threads.
 *
 * The {@code strength} argument of the evaluation methods is accepted and
 * ignored: detector parameters come only from the configuration. See
 * {@link com.hyperdx.anomaly.config.AdjustedParameters} for the mapping that a
 * strength would imply.
 */
public class EnsembleAnomalyDetector {

    private static final Logger LOG = LogManager.getLogger(EnsembleAnomalyDetector.class);

    /**
     * Strength used by the overloads that do not take one.
     */
    public static final double DEFAULT_STRENGTH = 0.5;

    /**
     * Default number of threads used when parallel evaluation is enabled.
     */
    public static final int DEFAULT_THREAD_POOL_SIZE = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

    private final EnsembleAggregator aggregator;

    private final ISeriesExecutor executor;

    private final boolean parallelExecutionEnabled;

    public EnsembleAnomalyDetector(Builder builder) {
        Map<DetectorType, IDetector<?>> registry = new EnumMap<>(DetectorType.class);
        registry.put(DetectorType.ZSCORE, new ZScoreDetector());
        registry.put(DetectorType.CHANGE_POINT, new ChangePointDetector());
        registry.put(DetectorType.ISOLATION_FOREST, new IsolationForestDetector());
        registry.putAll(builder.detectors);
        aggregator = new EnsembleAggregator(registry);

        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        if (parallelExecutionEnabled) {
            int threadPoolSize = builder.threadPoolSize.orElse(DEFAULT_THREAD_POOL_SIZE);
            executor = new ParallelSeriesExecutor(threadPoolSize);
        } else {
            executor = new SequentialSeriesExecutor();
        }
    }

    /**
     * @return a new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Evaluates every observation of a series.
     *
     * @param history  the observations, in time order
     * @param strength accepted for compatibility, has no effect
     * @param config   user overrides, merged onto the defaults; null means
     *                 defaults only
     * @return one result per observation, in input order
     */
    public List<AnomalyResult> evaluateSeries(List<Observation> history, double strength,
            PartialEnsembleConfig config) {
        checkNotNull(history, "history must not be null");
        EnsembleConfig effective = effectiveConfig(strength, config);
        return aggregator.aggregate(history, effective, false);
    }

    public List<AnomalyResult> evaluateSeries(List<Observation> history, PartialEnsembleConfig config) {
        return evaluateSeries(history, DEFAULT_STRENGTH, config);
    }

    public List<AnomalyResult> evaluateSeries(List<Observation> history) {
        return evaluateSeries(history, DEFAULT_STRENGTH, null);
    }

    /**
     * Evaluates several independent series with one configuration. The result
     * for each series is the same as calling
     * {@link #evaluateSeries(List, double, PartialEnsembleConfig)} on it.
     *
     * @param histories the series
     * @param strength  accepted for compatibility, has no effect
     * @param config    user overrides, merged onto the defaults
     * @return the results of each series, in input order
     */
    public List<List<AnomalyResult>> evaluateMany(List<List<Observation>> histories, double strength,
            PartialEnsembleConfig config) {
        checkNotNull(histories, "histories must not be null");
        for (List<Observation> history : histories) {
            checkNotNull(history, "histories must not contain null");
        }
        EnsembleConfig effective = effectiveConfig(strength, config);
        return executor.evaluateAll(histories, history -> aggregator.aggregate(history, effective, false));
    }

    public List<List<AnomalyResult>> evaluateMany(List<List<Observation>> histories, PartialEnsembleConfig config) {
        return evaluateMany(histories, DEFAULT_STRENGTH, config);
    }

    /**
     * Decides whether a new observation is anomalous given its history. The
     * z-score baseline is taken from the history alone; the change-point and
     * isolation-forest detectors are fit on the history with the new point
     * appended.
     *
     * @param history  prior observations, may be empty
     * @param newPoint the observation to judge
     * @param strength accepted for compatibility, has no effect
     * @param config   user overrides, merged onto the defaults
     * @return the result for the new point
     */
    public AnomalyResult evaluateNewPoint(List<Observation> history, Observation newPoint, double strength,
            PartialEnsembleConfig config) {
        checkNotNull(history, "history must not be null");
        checkNotNull(newPoint, "newPoint must not be null");
        EnsembleConfig effective = effectiveConfig(strength, config);

        List<Observation> series = new ArrayList<>(history.size() + 1);
        series.addAll(history);
        series.add(newPoint);
        List<AnomalyResult> results = aggregator.aggregate(series, effective, true);
        return results.get(results.size() - 1);
    }

    public AnomalyResult evaluateNewPoint(List<Observation> history, Observation newPoint,
            PartialEnsembleConfig config) {
        return evaluateNewPoint(history, newPoint, DEFAULT_STRENGTH, config);
    }

    public AnomalyResult evaluateNewPoint(List<Observation> history, Observation newPoint) {
        return evaluateNewPoint(history, newPoint, DEFAULT_STRENGTH, null);
    }

    EnsembleConfig effectiveConfig(double strength, PartialEnsembleConfig config) {
        LOG.debug("strength {} is accepted but not applied", strength);
        EnsembleConfig effective = EnsembleConfigMerger.merge(config);
        LOG.debug("effective configuration {}", effective);
        return effective;
    }

    public EnsembleAggregator getAggregator() {
        return aggregator;
    }

    public boolean isParallelExecutionEnabled() {
        return parallelExecutionEnabled;
    }

    public static class Builder {

        private final Map<DetectorType, IDetector<?>> detectors = new EnumMap<>(DetectorType.class);
        private boolean parallelExecutionEnabled = false;
        private Optional<Integer> threadPoolSize = Optional.empty();

        /**
         * Registers a detector, replacing the built-in one of the same type.
         *
         * @param detector the detector
         * @return this builder
         */
        public Builder detector(IDetector<?> detector) {
            checkNotNull(detector, "detector must not be null");
            detectors.put(detector.getType(), detector);
            return this;
        }

        public Builder parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return this;
        }

        public Builder threadPoolSize(int threadPoolSize) {
            checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
            this.threadPoolSize = Optional.of(threadPoolSize);
            return this;
        }

        public EnsembleAnomalyDetector build() {
            return new EnsembleAnomalyDetector(this);
        }
    }
}
