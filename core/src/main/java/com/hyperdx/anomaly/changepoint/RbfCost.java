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

package com.hyperdx.anomaly.changepoint;

import static com.hyperdx.anomaly.CommonUtils.checkArgument;
import static com.hyperdx.anomaly.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * Kernel cost of a segment of a one dimensional signal under the radial basis
 * function kernel {@code k(x, y) = exp(-gamma * (x - y)^2)}. The cost of the
 * segment {@code [start, end)} is
 * {@code (end - start) - sum(k(x_i, x_j)) / (end - start)} over all pairs of the
 * segment, that is the dispersion of the segment in the feature space of the
 * kernel.
 *
 * The bandwidth {@code gamma} is the inverse of the median of all pairwise
 * squared distances (1 when that median is 0), and scaled distances are clipped
 * to [0.01, 100] before exponentiation. The gram matrix is held as two
 * dimensional prefix sums so that each segment cost is O(1); memory is
 * quadratic in the length of the signal.
 */
public class RbfCost {

    public static final double MINIMUM_SCALED_DISTANCE = 1e-2;

    public static final double MAXIMUM_SCALED_DISTANCE = 1e2;

    /**
     * Longest signal whose prefix sums fit in one array, {@code (length + 1)^2}
     * entries.
     */
    public static final int MAXIMUM_LENGTH = 46339;

    private final int length;

    private final double gamma;

    // prefix[i * (length + 1) + j] is the sum of gram[0 .. i)[0 .. j)
    private final double[] prefix;

    public RbfCost(double[] signal) {
        checkNotNull(signal, "signal must not be null");
        checkLength(signal.length);
        this.length = signal.length;
        this.gamma = computeGamma(signal);

        int stride = length + 1;
        prefix = new double[stride * stride];
        for (int i = 0; i < length; i++) {
            double rowSum = 0;
            for (int j = 0; j < length; j++) {
                rowSum += kernel(signal[i], signal[j], i == j);
                prefix[(i + 1) * stride + j + 1] = prefix[i * stride + j + 1] + rowSum;
            }
        }
    }

    static double computeGamma(double[] signal) {
        int n = signal.length;
        if (n < 2) {
            return 1.0;
        }
        checkLength(n);
        double[] distances = new double[(int) ((long) n * (n - 1) / 2)];
        int index = 0;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double difference = signal[i] - signal[j];
                distances[index++] = difference * difference;
            }
        }
        Arrays.sort(distances);
        int middle = distances.length / 2;
        double median = (distances.length % 2 == 1) ? distances[middle]
                : (distances[middle - 1] + distances[middle]) / 2;
        return (median != 0) ? 1.0 / median : 1.0;
    }

    private static void checkLength(int n) {
        checkArgument(n <= MAXIMUM_LENGTH, "signal of length " + n + " exceeds " + MAXIMUM_LENGTH
                + ", the gram matrix of the kernel cost is quadratic in the length");
    }

    private double kernel(double x, double y, boolean diagonal) {
        if (diagonal) {
            return 1.0;
        }
        double scaled = gamma * (x - y) * (x - y);
        scaled = Math.min(Math.max(scaled, MINIMUM_SCALED_DISTANCE), MAXIMUM_SCALED_DISTANCE);
        return Math.exp(-scaled);
    }

    /**
     * @param start first index of the segment, inclusive
     * @param end   last index of the segment, exclusive
     * @return the cost of the segment
     */
    public double error(int start, int end) {
        checkArgument(0 <= start && start < end && end <= length, "incorrect segment");
        int stride = length + 1;
        double blockSum = prefix[end * stride + end] - prefix[start * stride + end] - prefix[end * stride + start]
                + prefix[start * stride + start];
        return (end - start) - blockSum / (end - start);
    }

    public int getLength() {
        return length;
    }

    public double getGamma() {
        return gamma;
    }
}
