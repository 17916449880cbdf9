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

package com.hyperdx.anomaly.statistics;

import static com.hyperdx.anomaly.CommonUtils.checkArgument;
import static com.hyperdx.anomaly.CommonUtils.checkNotNull;

/**
 * Population mean and standard deviation of a stream of values. The running
 * sums are kept in the centered form so that a constant stream has a deviation
 * of exactly zero.
 */
public class Deviation {

    protected long count = 0;

    protected double mean = 0;

    // sum of squared differences from the current mean
    protected double sumSquaredDifferences = 0;

    public Deviation() {
    }

    /**
     * Builds the statistics of a prefix of an array.
     *
     * @param values the values
     * @param length number of leading values to include
     * @return the statistics of {@code values[0 .. length)}
     */
    public static Deviation of(double[] values, int length) {
        checkNotNull(values, "values must not be null");
        checkArgument(length >= 0 && length <= values.length, "incorrect length");
        Deviation deviation = new Deviation();
        for (int i = 0; i < length; i++) {
            deviation.update(values[i]);
        }
        return deviation;
    }

    public static Deviation of(double[] values) {
        return of(values, values.length);
    }

    public void update(double value) {
        ++count;
        double delta = value - mean;
        mean += delta / count;
        sumSquaredDifferences += delta * (value - mean);
    }

    public double getMean() {
        checkArgument(count > 0, "incorrect invocation for mean");
        return mean;
    }

    public double getDeviation() {
        checkArgument(count > 0, "incorrect invocation for standard deviation");
        double answer = sumSquaredDifferences / count;
        return (answer > 0) ? Math.sqrt(answer) : 0;
    }

    public long getCount() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
