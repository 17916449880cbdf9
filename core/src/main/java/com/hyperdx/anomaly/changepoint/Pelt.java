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
import static com.hyperdx.anomaly.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Penalized change point detection with the PELT (pruned exact linear time)
 * search. The segmentation minimizes the sum over segments of the segment cost
 * plus a fixed penalty per segment; candidate start positions that can no
 * longer be part of an optimal segmentation are pruned.
 *
 * Breakpoints are restricted to multiples of {@code jump} and segments are at
 * least {@code minSize} long (except when the series itself is shorter). The
 * returned breakpoints are sorted and end with the length of the series.
 */
public class Pelt {

    public static final int DEFAULT_MIN_SIZE = 2;

    public static final int DEFAULT_JUMP = 5;

    private final int minSize;

    private final int jump;

    protected Pelt(Builder builder) {
        checkArgument(builder.minSize >= 1, "minSize must be at least 1");
        checkArgument(builder.jump >= 1, "jump must be at least 1");
        this.minSize = builder.minSize;
        this.jump = builder.jump;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Segments a signal.
     *
     * @param signal  the series
     * @param penalty cost added for every segment; larger values give fewer
     *                breakpoints
     * @return sorted breakpoints ending with {@code signal.length}, or an empty
     *         list for an empty signal
     */
    public List<Integer> predict(double[] signal, double penalty) {
        checkNotNull(signal, "signal must not be null");
        checkArgument(penalty >= 0, "penalty must be non-negative");
        if (signal.length == 0) {
            return Collections.emptyList();
        }
        if (signal.length < minSize) {
            return Collections.singletonList(signal.length);
        }
        return segment(new RbfCost(signal), penalty);
    }

    List<Integer> segment(RbfCost cost, double penalty) {
        int n = cost.getLength();

        // best total cost and segment ends of the optimal segmentation of [0, t)
        Map<Integer, Partition> partitions = new HashMap<>();
        partitions.put(0, new Partition(0, Collections.emptyList()));

        List<Integer> candidates = new ArrayList<>();
        for (int k = 0; k < n; k += jump) {
            if (k >= minSize) {
                candidates.add(k);
            }
        }
        candidates.add(n);

        List<Integer> admissible = new ArrayList<>();
        for (int end : candidates) {
            int newStart = Math.floorDiv(end - minSize, jump) * jump;
            if (admissible.isEmpty() || admissible.get(admissible.size() - 1) != newStart) {
                admissible.add(newStart);
            }

            List<Integer> starts = new ArrayList<>();
            List<Double> totals = new ArrayList<>();
            Partition best = null;
            for (int start : admissible) {
                Partition previous = partitions.get(start);
                if (previous == null || start >= end) {
                    continue;
                }
                double total = previous.total + cost.error(start, end) + penalty;
                starts.add(start);
                totals.add(total);
                if (best == null || total < best.total) {
                    best = previous.extend(total, end);
                }
            }
            checkState(best != null, "no admissible segmentation ending at " + end);
            partitions.put(end, best);

            List<Integer> pruned = new ArrayList<>();
            for (int i = 0; i < starts.size(); i++) {
                if (totals.get(i) <= best.total + penalty) {
                    pruned.add(starts.get(i));
                }
            }
            admissible = pruned;
        }

        return partitions.get(n).ends;
    }

    private static class Partition {

        final double total;

        final List<Integer> ends;

        Partition(double total, List<Integer> ends) {
            this.total = total;
            this.ends = ends;
        }

        Partition extend(double newTotal, int end) {
            List<Integer> newEnds = new ArrayList<>(ends.size() + 1);
            newEnds.addAll(ends);
            newEnds.add(end);
            return new Partition(newTotal, Collections.unmodifiableList(newEnds));
        }
    }

    public static class Builder {

        private int minSize = DEFAULT_MIN_SIZE;
        private int jump = DEFAULT_JUMP;

        public Builder minSize(int minSize) {
            this.minSize = minSize;
            return this;
        }

        public Builder jump(int jump) {
            this.jump = jump;
            return this;
        }

        public Pelt build() {
            return new Pelt(this);
        }
    }
}
