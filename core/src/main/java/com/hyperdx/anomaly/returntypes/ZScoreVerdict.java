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

@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ZScoreVerdict extends DetectorVerdict {

    // absolute distance from the mean in standard deviations, 0 if stdv is 0
    private final double zscore;

    private final double mean;

    private final double stdv;

    private final double threshold;

    public ZScoreVerdict(boolean anomalous, double zscore, double mean, double stdv, double threshold) {
        super(anomalous);
        this.zscore = zscore;
        this.mean = mean;
        this.stdv = stdv;
        this.threshold = threshold;
    }

    @Override
    public double getScore() {
        return zscore;
    }
}
