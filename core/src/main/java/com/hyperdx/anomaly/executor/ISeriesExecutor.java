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

package com.hyperdx.anomaly.executor;

import java.util.List;
import java.util.function.Function;

/**
 * Applies an evaluation to a batch of independent series.
 */
public interface ISeriesExecutor {

    /**
     * @param series   the inputs
     * @param function the evaluation of one input
     * @param <T>      input type
     * @param <R>      result type
     * @return the results, in the order of the inputs
     */
    <T, R> List<R> evaluateAll(List<T> series, Function<T, R> function);
}
