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

package com.hyperdx.anomaly.isolationforest;

import static com.hyperdx.anomaly.CommonUtils.checkArgument;
import static com.hyperdx.anomaly.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Random;

/**
 * A single isolation tree over one dimensional samples. Each internal node
 * splits at a threshold drawn uniformly between the smallest and the largest
 * value reaching it, values at most the threshold go left. Growth stops when a
 * node holds one value, holds a single distinct value, or reaches the maximum
 * depth.
 */
public class IsolationTree {

    /**
     * Euler's constant, used in the harmonic number approximation.
     */
    public static final double EULER_GAMMA = 0.5772156649;

    private final Node root;

    private final int maxDepth;

    private IsolationTree(Node root, int maxDepth) {
        this.root = root;
        this.maxDepth = maxDepth;
    }

    /**
     * Grows a tree.
     *
     * @param samples  the values the tree is grown on; not modified
     * @param maxDepth depth at which every node becomes a leaf
     * @param random   source of the split thresholds
     * @return the tree
     */
    public static IsolationTree grow(double[] samples, int maxDepth, Random random) {
        checkNotNull(samples, "samples must not be null");
        checkNotNull(random, "random must not be null");
        checkArgument(samples.length > 0, "cannot grow a tree without samples");
        checkArgument(maxDepth >= 0, "maxDepth must be non-negative");
        double[] values = Arrays.copyOf(samples, samples.length);
        return new IsolationTree(grow(values, 0, values.length, 0, maxDepth, random), maxDepth);
    }

    private static Node grow(double[] values, int from, int to, int depth, int maxDepth, Random random) {
        int size = to - from;
        if (size <= 1 || depth >= maxDepth) {
            return new Node(size);
        }
        double min = values[from];
        double max = values[from];
        for (int i = from + 1; i < to; i++) {
            min = Math.min(min, values[i]);
            max = Math.max(max, values[i]);
        }
        if (min == max) {
            return new Node(size);
        }

        double threshold = min + random.nextDouble() * (max - min);
        if (threshold >= max) {
            threshold = min;
        }

        // partition in place, values <= threshold first
        int split = from;
        for (int i = from; i < to; i++) {
            if (values[i] <= threshold) {
                double tmp = values[split];
                values[split] = values[i];
                values[i] = tmp;
                ++split;
            }
        }
        return new Node(threshold, grow(values, from, split, depth + 1, maxDepth, random),
                grow(values, split, to, depth + 1, maxDepth, random));
    }

    /**
     * The number of edges from the root to the leaf reached by the value, plus
     * the expected path length of an unbuilt tree over the samples held in that
     * leaf.
     *
     * @param value the value to isolate
     * @return the adjusted path length
     */
    public double pathLength(double value) {
        Node node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            node = (value <= node.threshold) ? node.left : node.right;
            ++depth;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * The average path length of an unsuccessful search in a binary search tree
     * of {@code n} values, used to normalize path lengths.
     *
     * @param n number of values
     * @return the average path length, 0 for {@code n <= 1} and 1 for
     *         {@code n == 2}
     */
    public static double averagePathLength(long n) {
        if (n <= 1) {
            return 0;
        }
        if (n == 2) {
            return 1;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    private static class Node {

        final double threshold;

        final Node left;

        final Node right;

        // number of samples in a leaf
        final int size;

        Node(int size) {
            this.threshold = Double.NaN;
            this.left = null;
            this.right = null;
            this.size = size;
        }

        Node(double threshold, Node left, Node right) {
            this.threshold = threshold;
            this.left = left;
            this.right = right;
            this.size = 0;
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
