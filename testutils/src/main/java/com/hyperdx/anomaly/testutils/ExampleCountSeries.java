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

package com.hyperdx.anomaly.testutils;

import java.util.Arrays;
import java.util.Random;

/**
 * Count series with a known shape, such as event volume per time bucket, for
 * the tests and benchmarks of the detectors. Every generator is deterministic;
 * the noisy ones take a seed.
 */
public class ExampleCountSeries {

    private ExampleCountSeries() {
    }

    public static long[] constant(int length, long value) {
        long[] result = new long[length];
        Arrays.fill(result, value);
        return result;
    }

    /**
     * A flat series whose last value is replaced by a spike.
     */
    public static long[] spikeAtEnd(int length, long base, long spike) {
        long[] result = constant(length, base);
        if (length > 0) {
            result[length - 1] = spike;
        }
        return result;
    }

    /**
     * A series that moves from one level to another.
     *
     * @param lowLength  number of values at the first level
     * @param low        the first level
     * @param highLength number of values at the second level
     * @param high       the second level
     * @return the series; its first value at the second level is at index
     *         {@code lowLength}
     */
    public static long[] levelShift(int lowLength, long low, int highLength, long high) {
        long[] result = new long[lowLength + highLength];
        Arrays.fill(result, 0, lowLength, low);
        Arrays.fill(result, lowLength, result.length, high);
        return result;
    }

    /**
     * A linear ramp {@code 0, step, 2 * step, ...} followed by a plateau at
     * {@code rampLength * step}.
     */
    public static long[] rampThenFlat(int rampLength, long step, int flatLength) {
        long[] result = new long[rampLength + flatLength];
        for (int i = 0; i < rampLength; i++) {
            result[i] = i * step;
        }
        Arrays.fill(result, rampLength, result.length, rampLength * step);
        return result;
    }

    /**
     * Normally distributed counts around a mean, rounded and clipped at zero.
     */
    public static long[] noisy(int length, double mean, double sigma, long seed) {
        Random prg = new Random(seed);
        long[] result = new long[length];
        for (int i = 0; i < length; i++) {
            result[i] = Math.max(0, Math.round(mean + sigma * prg.nextGaussian()));
        }
        return result;
    }

    /**
     * A noisy series with spikes of the given height added at fixed positions.
     */
    public static long[] noisyWithSpikes(int length, double mean, double sigma, long spike, long seed,
            int... positions) {
        long[] result = noisy(length, mean, sigma, seed);
        for (int position : positions) {
            result[position] += spike;
        }
        return result;
    }

    public static double[] toDoubles(long[] counts) {
        double[] result = new double[counts.length];
        for (int i = 0; i < counts.length; i++) {
            result[i] = counts[i];
        }
        return result;
    }
}
