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

import java.util.ArrayList;
import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.hyperdx.anomaly.config.AggregationMode;
import com.hyperdx.anomaly.config.DetectorType;
import com.hyperdx.anomaly.config.PartialEnsembleConfig;
import com.hyperdx.anomaly.returntypes.AnomalyResult;
import com.hyperdx.anomaly.testutils.ExampleCountSeries;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class EnsembleEvaluationBenchmark {

    public final static int NUM_SERIES = 32;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "60", "240" })
        int seriesLength;

        @Param({ "ANY", "COMBINED" })
        AggregationMode mode;

        @Param({ "false", "true" })
        boolean isolationForestEnabled;

        @Param({ "false", "true" })
        boolean parallelExecutionEnabled;

        List<List<Observation>> histories;
        PartialEnsembleConfig config;
        EnsembleAnomalyDetector detector;

        @Setup(Level.Trial)
        public void setUpData() {
            histories = new ArrayList<>(NUM_SERIES);
            for (int i = 0; i < NUM_SERIES; i++) {
                long[] counts = ExampleCountSeries.noisyWithSpikes(seriesLength, 100, 10, 400, i,
                        seriesLength / 2, seriesLength - 1);
                histories.add(Observation.listOf(counts));
            }
        }

        @Setup(Level.Trial)
        public void setUpDetector() {
            PartialEnsembleConfig.Builder builder = PartialEnsembleConfig.builder().mode(mode);
            if (isolationForestEnabled) {
                builder.enable(DetectorType.ISOLATION_FOREST);
            }
            config = builder.build();
            detector = EnsembleAnomalyDetector.builder().parallelExecutionEnabled(parallelExecutionEnabled).build();
        }
    }

    @Benchmark
    @OperationsPerInvocation(NUM_SERIES)
    public List<List<AnomalyResult>> evaluateMany(BenchmarkState state) {
        return state.detector.evaluateMany(state.histories, state.config);
    }

    @Benchmark
    @OperationsPerInvocation(NUM_SERIES)
    public void evaluateSeries(BenchmarkState state, Blackhole blackhole) {
        for (List<Observation> history : state.histories) {
            blackhole.consume(state.detector.evaluateSeries(history, state.config));
        }
    }

    @Benchmark
    @OperationsPerInvocation(NUM_SERIES)
    public void evaluateNewPoint(BenchmarkState state, Blackhole blackhole) {
        for (List<Observation> history : state.histories) {
            int last = history.size() - 1;
            blackhole.consume(state.detector.evaluateNewPoint(history.subList(0, last), history.get(last),
                    state.config));
        }
    }
}
