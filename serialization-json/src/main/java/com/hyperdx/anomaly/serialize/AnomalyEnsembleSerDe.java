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

import static com.hyperdx.anomaly.CommonUtils.checkNotNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hyperdx.anomaly.Observation;
import com.hyperdx.anomaly.config.EnsembleConfig;
import com.hyperdx.anomaly.config.PartialEnsembleConfig;
import com.hyperdx.anomaly.returntypes.AnomalyResult;
import com.hyperdx.anomaly.serialize.state.AnomalyResultMapper;
import com.hyperdx.anomaly.serialize.state.AnomalyResultState;
import com.hyperdx.anomaly.serialize.state.EnsembleConfigState;
import com.hyperdx.anomaly.serialize.state.ObservationMapper;
import com.hyperdx.anomaly.serialize.state.ObservationState;
import com.hyperdx.anomaly.serialize.state.PartialEnsembleConfigMapper;

/**
 * JSON reading and writing of the values exchanged with the ensemble:
 * observations and configurations in, results out. Internally the mappers in
 * {@link com.hyperdx.anomaly.serialize.state} convert between model objects
 * and state objects, and a Jackson {@link ObjectMapper} converts between state
 * objects and JSON. The ObjectMapper is exposed so that callers can customize
 * the output (e.g., by enabling pretty printing).
 *
 * Malformed JSON surfaces as an {@link UncheckedIOException}; a well formed
 * configuration with invalid content surfaces as a
 * {@link com.hyperdx.anomaly.ConfigurationException}.
 */
@Getter
public class AnomalyEnsembleSerDe {

    private static final TypeReference<List<ObservationState>> OBSERVATIONS =
            new TypeReference<List<ObservationState>>() {
            };

    private static final TypeReference<List<List<ObservationState>>> SERIES =
            new TypeReference<List<List<ObservationState>>>() {
            };

    private static final TypeReference<List<AnomalyResultState>> RESULTS =
            new TypeReference<List<AnomalyResultState>>() {
            };

    private final ObjectMapper objectMapper;

    private final ObservationMapper observationMapper;

    private final PartialEnsembleConfigMapper configMapper;

    private final AnomalyResultMapper resultMapper;

    /**
     * Constructor instantiating objects for default serialization.
     */
    public AnomalyEnsembleSerDe() {
        this(new ObjectMapper());
    }

    /**
     * @param objectMapper the Jackson mapper used to read and write the state
     *                     objects
     */
    public AnomalyEnsembleSerDe(ObjectMapper objectMapper) {
        this.objectMapper = checkNotNull(objectMapper, "objectMapper must not be null");
        this.observationMapper = new ObservationMapper();
        this.configMapper = new PartialEnsembleConfigMapper();
        this.resultMapper = new AnomalyResultMapper();
    }

    /**
     * Reads a series, a JSON array of {@code {"count": .., "ts_bucket": ..}}
     * objects.
     *
     * @param json the series
     * @return the observations, in order
     */
    public List<Observation> observationsFromJson(String json) {
        List<ObservationState> states = read(json, OBSERVATIONS);
        checkNotNull(states, "series must not be null");
        return states.stream().map(observationMapper::toModel).collect(Collectors.toList());
    }

    /**
     * Reads several series, a JSON array of series.
     *
     * @param json the series
     * @return the series, in order
     */
    public List<List<Observation>> seriesFromJson(String json) {
        List<List<ObservationState>> states = read(json, SERIES);
        checkNotNull(states, "series must not be null");
        List<List<Observation>> result = new ArrayList<>(states.size());
        for (List<ObservationState> series : states) {
            checkNotNull(series, "series must not be null");
            result.add(series.stream().map(observationMapper::toModel).collect(Collectors.toList()));
        }
        return result;
    }

    public Observation observationFromJson(String json) {
        return observationMapper.toModel(read(json, new TypeReference<ObservationState>() {
        }));
    }

    /**
     * Reads a user configuration, for example
     * {@code {"models": [{"name": "zscore", "params": {"threshold": 2.5}}], "mode": "any"}}.
     * A JSON {@code null} is the empty configuration.
     *
     * @param json the configuration
     * @return the partial configuration, to be merged onto the defaults
     */
    public PartialEnsembleConfig configFromJson(String json) {
        return configMapper.toModel(read(json, new TypeReference<EnsembleConfigState>() {
        }));
    }

    public String toJson(PartialEnsembleConfig config) {
        return write(configMapper.toState(config));
    }

    /**
     * Writes a complete configuration in the same shape as the user
     * configuration it was merged from.
     *
     * @param config an effective configuration
     * @return the JSON form
     */
    public String toJson(EnsembleConfig config) {
        return toJson(PartialEnsembleConfig.of(config));
    }

    public String toJson(AnomalyResult result) {
        return write(resultMapper.toState(result));
    }

    public String toJson(List<AnomalyResult> results) {
        return write(results.stream().map(resultMapper::toState).collect(Collectors.toList()));
    }

    public String manyToJson(List<List<AnomalyResult>> results) {
        List<List<AnomalyResultState>> states = new ArrayList<>(results.size());
        for (List<AnomalyResult> series : results) {
            states.add(series.stream().map(resultMapper::toState).collect(Collectors.toList()));
        }
        return write(states);
    }

    public AnomalyResult resultFromJson(String json) {
        return resultMapper.toModel(read(json, new TypeReference<AnomalyResultState>() {
        }));
    }

    public List<AnomalyResult> resultsFromJson(String json) {
        List<AnomalyResultState> states = read(json, RESULTS);
        checkNotNull(states, "results must not be null");
        return states.stream().map(resultMapper::toModel).collect(Collectors.toList());
    }

    private <T> T read(String json, TypeReference<T> type) {
        checkNotNull(json, "json must not be null");
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private String write(Object state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
