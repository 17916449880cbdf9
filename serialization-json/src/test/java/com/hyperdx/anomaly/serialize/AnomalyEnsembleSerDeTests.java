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

package com.hyperdx.anomaly.serialize;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hyperdx.anomaly.ConfigurationException;
import com.hyperdx.anomaly.EnsembleAnomalyDetector;
import com.hyperdx.anomaly.Observation;
import com.hyperdx.anomaly.config.AggregationMode;
import com.hyperdx.anomaly.config.DetectorType;
import com.hyperdx.anomaly.config.EnsembleConfig;
import com.hyperdx.anomaly.config.EnsembleConfigMerger;
import com.hyperdx.anomaly.config.PartialEnsembleConfig;
import com.hyperdx.anomaly.detector.ChangePointDetector;
import com.hyperdx.anomaly.detector.ZScoreDetector;
import com.hyperdx.anomaly.returntypes.AnomalyResult;
import com.hyperdx.anomaly.testutils.ExampleCountSeries;

public class AnomalyEnsembleSerDeTests {

    private AnomalyEnsembleSerDe serDe;
    private ObjectMapper objectMapper;
    private EnsembleAnomalyDetector detector;

    @BeforeEach
    public void setUp() {
        serDe = new AnomalyEnsembleSerDe();
        objectMapper = new ObjectMapper();
        detector = EnsembleAnomalyDetector.builder().build();
    }

    @Test
    public void testObservationsFromJson() {
        List<Observation> observations = serDe
                .observationsFromJson("[{\"count\": 3, \"ts_bucket\": 1700000000}, {\"count\": 5}]");
        assertEquals(Arrays.asList(Observation.of(3, 1700000000L), Observation.of(5)), observations);
        assertEquals(Observation.of(9, 60L), serDe.observationFromJson("{\"count\": 9, \"ts_bucket\": 60}"));
    }

    @Test
    public void testSeriesFromJson() {
        List<List<Observation>> series = serDe.seriesFromJson("[[{\"count\": 1}, {\"count\": 2}], []]");
        assertEquals(2, series.size());
        assertEquals(Observation.listOf(1, 2), series.get(0));
        assertTrue(series.get(1).isEmpty());
    }

    @Test
    public void testConfigFromJson() {
        PartialEnsembleConfig config = serDe.configFromJson("{\"models\": ["
                + "{\"name\": \"zscore\", \"params\": {\"threshold\": 2}},"
                + "{\"name\": \"change_point\", \"enabled\": true},"
                + "{\"name\": \"seasonal\", \"enabled\": true, \"params\": {\"period\": 24}}],"
                + " \"mode\": \"combined\"}");
        EnsembleConfig merged = EnsembleConfigMerger.merge(config);

        assertTrue(merged.getModel(DetectorType.ZSCORE).isEnabled());
        assertEquals(2.0, merged.getModel(DetectorType.ZSCORE).getParam(ZScoreDetector.THRESHOLD, 0));
        assertTrue(merged.getModel(DetectorType.CHANGE_POINT).isEnabled());
        assertEquals(10.0, merged.getModel(DetectorType.CHANGE_POINT).getParam(ChangePointDetector.PENALTY, 0));
        assertFalse(merged.getModel(DetectorType.ISOLATION_FOREST).isEnabled());
        assertEquals(AggregationMode.COMBINED, merged.getMode());
    }

    @ParameterizedTest
    @ValueSource(strings = { "null", "{}", "{\"models\": []}", "{\"models\": null, \"mode\": null}" })
    public void testEmptyConfig(String json) {
        assertEquals(EnsembleConfig.defaultConfig(), EnsembleConfigMerger.merge(serDe.configFromJson(json)));
    }

    @ParameterizedTest
    @ValueSource(strings = { "{\"mode\": \"majority\"}",
            "{\"models\": [{\"name\": \"zscore\", \"params\": {\"threshold\": \"high\"}}]}",
            "{\"models\": [{\"name\": \"zscore\", \"params\": {\"threshold\": null}}]}",
            "{\"models\": [{\"enabled\": true}]}" })
    public void testInvalidConfig(String json) {
        assertThrows(ConfigurationException.class, () -> serDe.configFromJson(json));
    }

    @ParameterizedTest
    @ValueSource(strings = { "{\"models\": [", "[1, 2]", "{\"models\": {\"name\": \"zscore\"}}" })
    public void testMalformedConfig(String json) {
        assertThrows(UncheckedIOException.class, () -> serDe.configFromJson(json));
    }

    @Test
    public void testMalformedObservations() {
        assertThrows(UncheckedIOException.class, () -> serDe.observationsFromJson("[{\"count\": \"many\"}]"));
        assertThrows(UncheckedIOException.class, () -> serDe.observationsFromJson("{\"count\": 1}"));
        assertThrows(IllegalArgumentException.class, () -> serDe.observationsFromJson("[{\"count\": -4}]"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "{\"ts_bucket\": 5}", "{\"count\": null, \"ts_bucket\": 5}", "{}" })
    public void testObservationWithoutCount(String json) {
        assertThrows(IllegalArgumentException.class, () -> serDe.observationFromJson(json));
        assertThrows(IllegalArgumentException.class,
                () -> serDe.observationsFromJson("[{\"count\": 3}, " + json + "]"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "{\"is_anomalous\": false, \"ts_bucket\": null}",
            "{\"is_anomalous\": false, \"count\": null, \"ts_bucket\": null}" })
    public void testResultWithoutCount(String json) {
        assertThrows(IllegalArgumentException.class, () -> serDe.resultFromJson(json));
    }

    @Test
    public void testResultWireNames() throws Exception {
        PartialEnsembleConfig config = serDe.configFromJson("{\"models\": ["
                + "{\"name\": \"change_point\", \"enabled\": true},"
                + "{\"name\": \"isolation_forest\", \"enabled\": true, \"params\": {\"random_seed\": 42}}]}");
        List<AnomalyResult> results = detector
                .evaluateSeries(Observation.listOf(ExampleCountSeries.spikeAtEnd(50, 10, 1000)), config);

        JsonNode last = objectMapper.readTree(serDe.toJson(results.get(49)));
        assertThat(fieldNames(last), contains("is_anomalous", "count", "ts_bucket", "details"));
        assertTrue(last.get("is_anomalous").asBoolean());
        assertEquals(1000, last.get("count").asLong());
        assertTrue(last.get("ts_bucket").isNull());

        JsonNode details = last.get("details");
        assertThat(fieldNames(details), contains("zscore", "changepoint", "isolation"));
        assertThat(fieldNames(details.get("zscore")), contains("is_anomalous", "zscore", "mean", "threshold", "stdv"));
        assertEquals(7.0, details.get("zscore").get("zscore").asDouble(), 1e-9);
        assertThat(fieldNames(details.get("changepoint")), contains("is_anomalous", "penalty", "change_points"));
        assertTrue(details.get("changepoint").get("change_points").isArray());
        assertThat(fieldNames(details.get("isolation")),
                contains("is_anomalous", "isolation_score", "contamination"));
        assertTrue(details.get("isolation").get("is_anomalous").asBoolean());
        assertEquals(0.05, details.get("isolation").get("contamination").asDouble());
    }

    @Test
    public void testDetectorsThatDidNotRunAreOmitted() throws Exception {
        List<AnomalyResult> results = detector.evaluateSeries(Arrays.asList(Observation.of(3, 60L)));
        JsonNode array = objectMapper.readTree(serDe.toJson(results));
        assertEquals(1, array.size());
        assertEquals(60L, array.get(0).get("ts_bucket").asLong());
        assertThat(fieldNames(array.get(0).get("details")), contains("zscore"));
    }

    @Test
    public void testResultsCanBeReadBack() {
        PartialEnsembleConfig config = PartialEnsembleConfig.builder().enable(DetectorType.CHANGE_POINT).build();
        List<AnomalyResult> results = detector
                .evaluateSeries(Observation.listOf(ExampleCountSeries.levelShift(20, 1, 20, 100)), config);
        assertEquals(results, serDe.resultsFromJson(serDe.toJson(results)));
        assertEquals(results.get(20), serDe.resultFromJson(serDe.toJson(results.get(20))));
    }

    @Test
    public void testManyToJson() throws Exception {
        List<List<Observation>> series = serDe
                .seriesFromJson("[[{\"count\": 1}, {\"count\": 1}, {\"count\": 30}], [{\"count\": 4}]]");
        List<List<AnomalyResult>> results = detector.evaluateMany(series, null);
        JsonNode array = objectMapper.readTree(serDe.manyToJson(results));
        assertEquals(2, array.size());
        assertEquals(3, array.get(0).size());
        assertEquals(1, array.get(1).size());
        assertEquals(30, array.get(0).get(2).get("count").asLong());
    }

    @Test
    public void testEffectiveConfigCanBeReadBack() {
        EnsembleConfig merged = EnsembleConfigMerger
                .merge(PartialEnsembleConfig.builder().enable(DetectorType.ISOLATION_FOREST)
                        .mode(AggregationMode.COMBINED).build());
        String json = serDe.toJson(merged);
        assertEquals(merged, EnsembleConfigMerger.merge(serDe.configFromJson(json)));
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        Iterator<String> iterator = node.fieldNames();
        while (iterator.hasNext()) {
            names.add(iterator.next());
        }
        return names;
    }
}
