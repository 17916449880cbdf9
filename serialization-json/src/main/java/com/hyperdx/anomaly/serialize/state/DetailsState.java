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

package com.hyperdx.anomaly.serialize.state;

import lombok.Data;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The {@code details} object of a result. Detectors that did not run are
 * omitted.
 */
@Data
@JsonPropertyOrder({ "zscore", "changepoint", "isolation" })
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DetailsState {

    private ZScoreVerdictState zscore;

    @JsonProperty("changepoint")
    private ChangePointVerdictState changePoint;

    @JsonProperty("isolation")
    private IsolationForestVerdictState isolationForest;
}
