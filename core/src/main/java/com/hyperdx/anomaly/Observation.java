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

import static com.hyperdx.anomaly.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * One sample of monitored volume: a non-negative count, optionally tagged with
 * the time bucket it was aggregated over.
 */
@EqualsAndHashCode
@ToString
public class Observation {

    private final long count;

    // seconds or milliseconds; the engine never interprets it
    private final Long timeBucket;

    public Observation(long count, Long timeBucket) {
        checkArgument(count >= 0, "count must be non-negative");
        this.count = count;
        this.timeBucket = timeBucket;
    }

    public Observation(long count) {
        this(count, null);
    }

    public static Observation of(long count) {
        return new Observation(count);
    }

    public static Observation of(long count, long timeBucket) {
        return new Observation(count, timeBucket);
    }

    /**
     * Wraps a sequence of counts into untimed observations.
     *
     * @param counts the counts, in time order
     * @return a new list of observations
     */
    public static List<Observation> listOf(long... counts) {
        List<Observation> result = new ArrayList<>(counts.length);
        for (long count : counts) {
            result.add(new Observation(count));
        }
        return result;
    }

    public long getCount() {
        return count;
    }

    public Optional<Long> getTimeBucket() {
        return Optional.ofNullable(timeBucket);
    }
}
