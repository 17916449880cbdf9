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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Wire form of the decision for one observation, for example
 *
 * <pre>
 * {"is_anomalous": true, "count": 50, "ts_bucket": null,
 *  "details": {"zscore": {"is_anomalous": true, "zscore": 3.16, "mean": 5.45, "threshold": 3.0, "stdv": 14.07}}}
 * </pre>
 */
@Data
@JsonPropertyOrder({ "is_anomalous", "count", "ts_bucket", "details" })
public class AnomalyResultState {

    @JsonProperty("is_anomalous")
    private boolean anomalous;

    private Long count;

    @JsonProperty("ts_bucket")
    private Long tsBucket;

    private DetailsState details;
}
