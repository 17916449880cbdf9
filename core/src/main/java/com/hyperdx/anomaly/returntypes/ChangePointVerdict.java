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

package com.hyperdx.anomaly.returntypes;

import static com.hyperdx.anomaly.CommonUtils.checkNotNull;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Verdict of the change point detector. The list of breakpoints describes the
 * whole series and is shared by every verdict of one evaluation; it ends with
 * the length of the series.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ChangePointVerdict extends DetectorVerdict {

    private final List<Integer> changePoints;

    private final double penalty;

    public ChangePointVerdict(boolean anomalous, List<Integer> changePoints, double penalty) {
        super(anomalous);
        this.changePoints = checkNotNull(changePoints, "changePoints must not be null");
        this.penalty = penalty;
    }

    @Override
    public double getScore() {
        return anomalous ? 1.0 : 0.0;
    }
}
