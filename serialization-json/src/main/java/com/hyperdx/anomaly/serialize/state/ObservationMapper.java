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

import static com.hyperdx.anomaly.CommonUtils.checkArgument;
import static com.hyperdx.anomaly.CommonUtils.checkNotNull;

import com.hyperdx.anomaly.Observation;

public class ObservationMapper implements IStateMapper<Observation, ObservationState> {

    @Override
    public ObservationState toState(Observation model) {
        ObservationState state = new ObservationState();
        state.setCount(model.getCount());
        state.setTsBucket(model.getTimeBucket().orElse(null));
        return state;
    }

    @Override
    public Observation toModel(ObservationState state) {
        checkNotNull(state, "observations must not be null");
        checkArgument(state.getCount() != null, "count is required");
        return new Observation(state.getCount(), state.getTsBucket());
    }
}
