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

/**
 * How the scores of a detector are brought to [0,1] before verdicts of several
 * detectors are combined.
 */
public enum ScoreNormalization {

    /**
     * each score is divided by the largest score of the detector over the series
     */
    MAX_SCALED,

    /**
     * the detector only produces flags; an anomalous verdict counts 1, otherwise
     * 0
     */
    BINARY;
}
