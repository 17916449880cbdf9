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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The verdict of one detector on one observation, with the evidence the
 * detector used to reach it.
 */
@Getter
@EqualsAndHashCode
@ToString
public abstract class DetectorVerdict {

    protected final boolean anomalous;

    protected DetectorVerdict(boolean anomalous) {
        this.anomalous = anomalous;
    }

    /**
     * The raw score used when verdicts of several detectors are combined. Larger
     * values are more anomalous for every detector.
     *
     * @return the score of this observation
     */
    public abstract double getScore();
}
