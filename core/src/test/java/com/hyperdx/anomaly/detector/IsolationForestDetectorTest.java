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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.hyperdx.anomaly.ConfigurationException;
import com.hyperdx.anomaly.InsufficientDataException;
import com.hyperdx.anomaly.config.DetectorConfig;
import com.hyperdx.anomaly.config.DetectorType;
import com.hyperdx.anomaly.isolationforest.IsolationForest;
import com.hyperdx.anomaly.returntypes.IsolationForestVerdict;
import com.hyperdx.anomaly.testutils.ExampleCountSeries;

public class IsolationForestDetectorTest {

    private final IsolationForestDetector detector = new IsolationForestDetector();

    private static DetectorConfig seeded(double contamination, long seed) {
        Map<String, Double> params = new LinkedHashMap<>();
        params.put(IsolationForestDetector.CONTAMINATION, contamination);
        params.put(IsolationForestDetector.RANDOM_SEED, (double) seed);
        return new DetectorConfig(DetectorType.ISOLATION_FOREST, true, params);
    }

    @Test
    public void testSpike() {
        double[] counts = ExampleCountSeries.toDoubles(ExampleCountSeries.spikeAtEnd(50, 10, 1000));
        List<IsolationForestVerdict> verdicts = detector.detect(counts, seeded(0.05, 42L), false);

        assertEquals(50, verdicts.size());
        for (int i = 0; i < 49; i++) {
            assertFalse(verdicts.get(i).isAnomalous());
            assertEquals(0.0, verdicts.get(i).getIsolationScore(), 1e-12);
        }
        IsolationForestVerdict last = verdicts.get(49);
        assertTrue(last.isAnomalous());
        assertTrue(last.getIsolationScore() > 0);
        assertEquals(last.getIsolationScore(), last.getScore());
        assertEquals(0.05, last.getContamination());
    }

    @Test
    public void testSeedMakesResultsReproducible() {
        double[] counts = ExampleCountSeries.toDoubles(ExampleCountSeries.noisyWithSpikes(120, 40, 6, 300, 9L, 60));
        assertEquals(detector.detect(counts, seeded(0.1, 9L), false), detector.detect(counts, seeded(0.1, 9L), false));
    }

    @Test
    public void testForestParameters() {
        Map<String, Double> params = new LinkedHashMap<>();
        params.put(IsolationForestDetector.CONTAMINATION, 0.2);
        params.put(IsolationForestDetector.NUMBER_OF_TREES, 10.0);
        params.put(IsolationForestDetector.MAX_SAMPLES, 32.0);
        params.put(IsolationForestDetector.RANDOM_SEED, 5.0);
        IsolationForest forest = detector.newForest(new DetectorConfig(DetectorType.ISOLATION_FOREST, true, params));
        assertEquals(0.2, forest.getContamination());
        assertEquals(10, forest.getNumberOfTrees());
        assertEquals(32, forest.getMaxSamples());
        assertEquals(5L, forest.getRandomSeed().get());

        IsolationForest defaults = detector
                .newForest(new DetectorConfig(DetectorType.ISOLATION_FOREST, true, Collections.emptyMap()));
        assertEquals(IsolationForestDetector.DEFAULT_CONTAMINATION, defaults.getContamination());
        assertFalse(defaults.getRandomSeed().isPresent());
    }

    @Test
    public void testInvalidContamination() {
        double[] counts = new double[] { 1, 2, 3, 4 };
        assertThrows(ConfigurationException.class, () -> detector.detect(counts, seeded(0.9, 1L), false));
        assertThrows(ConfigurationException.class, () -> detector.detect(counts, seeded(0.0, 1L), false));
    }

    @ParameterizedTest
    @ValueSource(doubles = { 1.5, -0.25, 1e17, -1e17 })
    public void testInvalidSeed(double seed) {
        Map<String, Double> params = Collections.singletonMap(IsolationForestDetector.RANDOM_SEED, seed);
        assertThrows(ConfigurationException.class,
                () -> detector.newForest(new DetectorConfig(DetectorType.ISOLATION_FOREST, true, params)));
    }

    @Test
    public void testLargestSeed() {
        Map<String, Double> params = Collections.singletonMap(IsolationForestDetector.RANDOM_SEED,
                (double) IsolationForestDetector.MAXIMUM_RANDOM_SEED);
        IsolationForest forest = detector.newForest(new DetectorConfig(DetectorType.ISOLATION_FOREST, true, params));
        assertEquals(IsolationForestDetector.MAXIMUM_RANDOM_SEED, forest.getRandomSeed().get());
    }

    @Test
    public void testSingleSample() {
        assertThrows(InsufficientDataException.class, () -> detector.detect(new double[] { 3 }, seeded(0.05, 1L),
                false));
        assertEquals(2, detector.getMinimumObservations());
        assertEquals(ScoreNormalization.MAX_SCALED, detector.getScoreNormalization());
    }
}
