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

package com.hyperdx.anomaly;

import com.hyperdx.anomaly.config.DetectorType;

/**
 * A failure inside the model fitting step of a detector. Fatal for the
 * evaluation that triggered it, since a partial ensemble would misreport the
 * verdict.
 */
public class DetectorFitException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final DetectorType detectorType;

    public DetectorFitException(DetectorType detectorType, String message) {
        super(detectorType.getConfigName() + ": " + message);
        this.detectorType = detectorType;
    }

    public DetectorFitException(DetectorType detectorType, Throwable cause) {
        super(detectorType.getConfigName() + " failed to fit", cause);
        this.detectorType = detectorType;
    }

    public DetectorType getDetectorType() {
        return detectorType;
    }
}
