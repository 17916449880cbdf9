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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.hyperdx.anomaly.config.AggregationMode;
import com.hyperdx.anomaly.config.DetectorConfig;
import com.hyperdx.anomaly.config.DetectorType;
import com.hyperdx.anomaly.config.EnsembleConfig;
import com.hyperdx.anomaly.detector.IDetector;
import com.hyperdx.anomaly.detector.ScoreNormalization;
import com.hyperdx.anomaly.returntypes.AnomalyResult;
import com.hyperdx.anomaly.returntypes.ChangePointVerdict;
import com.hyperdx.anomaly.returntypes.IsolationForestVerdict;
import com.hyperdx.anomaly.returntypes.ZScoreVerdict;

public class EnsembleAggregatorTest {

    private IDetector<ZScoreVerdict> zscore;
    private IDetector<ChangePointVerdict> changePoint;
    private IDetector<IsolationForestVerdict> isolationForest;
    private EnsembleAggregator aggregator;

    private final List<Observation> history = Observation.listOf(1, 2, 3);

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setUp() {
        zscore = mock(IDetector.class);
        when(zscore.getType()).thenReturn(DetectorType.ZSCORE);
        when(zscore.getScoreNormalization()).thenReturn(ScoreNormalization.MAX_SCALED);
        when(zscore.getMinimumObservations()).thenReturn(1);

        changePoint = mock(IDetector.class);
        when(changePoint.getType()).thenReturn(DetectorType.CHANGE_POINT);
        when(changePoint.getScoreNormalization()).thenReturn(ScoreNormalization.BINARY);
        when(changePoint.getMinimumObservations()).thenReturn(2);

        isolationForest = mock(IDetector.class);
        when(isolationForest.getType()).thenReturn(DetectorType.ISOLATION_FOREST);
        when(isolationForest.getScoreNormalization()).thenReturn(ScoreNormalization.MAX_SCALED);
        when(isolationForest.getMinimumObservations()).thenReturn(2);

        Map<DetectorType, IDetector<?>> detectors = new EnumMap<>(DetectorType.class);
        detectors.put(DetectorType.ZSCORE, zscore);
        detectors.put(DetectorType.CHANGE_POINT, changePoint);
        detectors.put(DetectorType.ISOLATION_FOREST, isolationForest);
        aggregator = new EnsembleAggregator(detectors);
    }

    private static EnsembleConfig config(AggregationMode mode, DetectorType... enabled) {
        EnsembleConfig config = EnsembleConfig.defaultConfig().withMode(mode);
        for (DetectorConfig model : config.getModels()) {
            boolean on = Arrays.asList(enabled).contains(model.getType());
            config = config.withModel(model.withOverrides(on, null));
        }
        return config;
    }

    private static List<ZScoreVerdict> zscores(double... values) {
        return Arrays.stream(values).mapToObj(z -> new ZScoreVerdict(z > 3, z, 0, 1, 3)).collect(Collectors.toList());
    }

    private static List<ChangePointVerdict> changePoints(int length, Integer... breakpoints) {
        List<Integer> list = Arrays.asList(breakpoints);
        List<ChangePointVerdict> result = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            result.add(new ChangePointVerdict(list.contains(i), list, 10));
        }
        return result;
    }

    private static List<IsolationForestVerdict> isolationScores(double... values) {
        return Arrays.stream(values).mapToObj(s -> new IsolationForestVerdict(s > 0, s, 0.05))
                .collect(Collectors.toList());
    }

    private static List<Boolean> flags(List<AnomalyResult> results) {
        return results.stream().map(AnomalyResult::isAnomalous).collect(Collectors.toList());
    }

    @Test
    public void testAnyMode() {
        when(zscore.detect(any(), any(), anyBoolean())).thenReturn(zscores(0, 1, 4));
        when(changePoint.detect(any(), any(), anyBoolean())).thenReturn(changePoints(3, 1, 3));

        List<AnomalyResult> results = aggregator.aggregate(history,
                config(AggregationMode.ANY, DetectorType.ZSCORE, DetectorType.CHANGE_POINT), false);
        assertThat(flags(results), contains(false, true, true));
        for (int i = 0; i < 3; i++) {
            AnomalyResult result = results.get(i);
            assertEquals(i + 1, result.getCount());
            assertThat(result.getDetails().keySet(), contains(DetectorType.ZSCORE, DetectorType.CHANGE_POINT));
        }
        verify(isolationForest, never()).detect(any(), any(), anyBoolean());
    }

    @Test
    public void testCombinedMode() {
        // z-scores scale to 0, 0.25, 1 and the change point flags index 1:
        // averages 0, 0.625, 0.5 and only the first exceeds one half
        when(zscore.detect(any(), any(), anyBoolean())).thenReturn(zscores(0, 1, 4));
        when(changePoint.detect(any(), any(), anyBoolean())).thenReturn(changePoints(3, 1, 3));

        List<AnomalyResult> results = aggregator.aggregate(history,
                config(AggregationMode.COMBINED, DetectorType.ZSCORE, DetectorType.CHANGE_POINT), false);
        assertThat(flags(results), contains(false, true, false));
        assertTrue(results.get(2).getVerdict(DetectorType.ZSCORE).get().isAnomalous());
    }

    @Test
    public void testCombinedModeWithThreeDetectors() {
        when(zscore.detect(any(), any(), anyBoolean())).thenReturn(zscores(1, 2, 2));
        when(changePoint.detect(any(), any(), anyBoolean())).thenReturn(changePoints(3, 3));
        when(isolationForest.detect(any(), any(), anyBoolean())).thenReturn(isolationScores(-0.1, 0.2, 0.1));

        // averages (0.5 + 0 + 0) / 3, (1 + 0 + 1) / 3, (1 + 0 + 0.5) / 3
        List<AnomalyResult> results = aggregator.aggregate(history, config(AggregationMode.COMBINED,
                DetectorType.ZSCORE, DetectorType.CHANGE_POINT, DetectorType.ISOLATION_FOREST), false);
        assertThat(flags(results), contains(false, true, false));
    }

    @Test
    public void testCombinedModeWithNonPositiveMaximum() {
        when(isolationForest.detect(any(), any(), anyBoolean())).thenReturn(isolationScores(-0.3, -0.1, 0));
        List<AnomalyResult> results = aggregator.aggregate(history,
                config(AggregationMode.COMBINED, DetectorType.ISOLATION_FOREST), false);
        assertThat(flags(results), contains(false, false, false));
    }

    @ParameterizedTest
    @EnumSource(AggregationMode.class)
    public void testNoDetectorNeverFlags(AggregationMode mode) {
        List<AnomalyResult> results = aggregator.aggregate(Observation.listOf(1, 1000, 1), config(mode), false);
        assertEquals(3, results.size());
        for (AnomalyResult result : results) {
            assertFalse(result.isAnomalous());
            assertTrue(result.getDetails().isEmpty());
        }
    }

    @Test
    public void testEmptyHistory() {
        assertTrue(aggregator.aggregate(Collections.emptyList(), EnsembleConfig.defaultConfig(), false).isEmpty());
        verify(zscore, never()).detect(any(), any(), anyBoolean());
    }

    @Test
    public void testShortSeriesSkipsDetector() {
        when(zscore.detect(any(), any(), anyBoolean())).thenReturn(zscores(0));
        List<AnomalyResult> results = aggregator.aggregate(Observation.listOf(5), config(AggregationMode.ANY,
                DetectorType.ZSCORE, DetectorType.CHANGE_POINT, DetectorType.ISOLATION_FOREST), true);
        assertEquals(1, results.size());
        assertThat(results.get(0).getDetails().keySet(), contains(DetectorType.ZSCORE));
        verify(changePoint, never()).detect(any(), any(), anyBoolean());
        verify(isolationForest, never()).detect(any(), any(), anyBoolean());
    }

    @Test
    public void testInsufficientDataSkipsDetector() {
        when(zscore.detect(any(), any(), anyBoolean())).thenReturn(zscores(0, 0, 5));
        when(isolationForest.detect(any(), any(), anyBoolean())).thenThrow(new InsufficientDataException(10, 3));

        List<AnomalyResult> results = aggregator.aggregate(history,
                config(AggregationMode.COMBINED, DetectorType.ZSCORE, DetectorType.ISOLATION_FOREST), false);
        assertThat(flags(results), contains(false, false, true));
        assertFalse(results.get(2).getVerdict(DetectorType.ISOLATION_FOREST).isPresent());
    }

    @Test
    public void testDetectorFailure() {
        IllegalArgumentException cause = new IllegalArgumentException("singular");
        when(isolationForest.detect(any(), any(), anyBoolean())).thenThrow(cause);
        DetectorFitException exception = assertThrows(DetectorFitException.class, () -> aggregator
                .aggregate(history, config(AggregationMode.ANY, DetectorType.ISOLATION_FOREST), false));
        assertEquals(DetectorType.ISOLATION_FOREST, exception.getDetectorType());
        assertSame(cause, exception.getCause());
    }

    @Test
    public void testConfigurationErrorPassesThrough() {
        when(changePoint.detect(any(), any(), anyBoolean())).thenThrow(new ConfigurationException("bad penalty"));
        assertThrows(ConfigurationException.class, () -> aggregator.aggregate(history,
                config(AggregationMode.ANY, DetectorType.CHANGE_POINT), false));
    }

    @Test
    public void testWrongNumberOfVerdicts() {
        when(zscore.detect(any(), any(), anyBoolean())).thenReturn(zscores(0, 1));
        assertThrows(IllegalStateException.class,
                () -> aggregator.aggregate(history, config(AggregationMode.ANY, DetectorType.ZSCORE), false));
    }

    @Test
    public void testMissingDetector() {
        EnsembleAggregator partial = new EnsembleAggregator(Collections.singletonMap(DetectorType.ZSCORE, zscore));
        assertThrows(IllegalStateException.class, () -> partial.aggregate(history,
                config(AggregationMode.ANY, DetectorType.CHANGE_POINT), false));
    }

    @Test
    public void testTimeBucketsAreCarried() {
        when(zscore.detect(any(), any(), anyBoolean())).thenReturn(zscores(0, 0));
        List<AnomalyResult> results = aggregator.aggregate(
                Arrays.asList(Observation.of(4, 1000L), Observation.of(6)),
                config(AggregationMode.ANY, DetectorType.ZSCORE), false);
        assertEquals(1000L, results.get(0).getTimeBucket().get());
        assertFalse(results.get(1).getTimeBucket().isPresent());
    }
}
