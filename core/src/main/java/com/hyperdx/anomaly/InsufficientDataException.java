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

/**
 * Raised by a model that cannot be fit on the number of observations it was
 * given. The ensemble treats the affected detector as disabled for the call.
 */
public class InsufficientDataException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int required;

    private final int actual;

    public InsufficientDataException(int required, int actual) {
        super("at least " + required + " observations are required, got " + actual);
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
