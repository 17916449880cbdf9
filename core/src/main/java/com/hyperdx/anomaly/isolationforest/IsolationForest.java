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
import static com.hyperdx.anomaly.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import com.hyperdx.anomaly.InsufficientDataException;

/**
 * An isolation forest over one dimensional samples. Anomalies are few and
 * different, so random splits isolate them after fewer steps than regular
 * values; the anomaly score of a value is derived from its average path length
 * over the trees.
 *
 * The forest is fit once on a batch of samples with {@link #fit(double[])}. The
 * scores follow the usual conventions: {@link #scoreSamples(double[])} is the
 * opposite of the anomaly score {@code 2^(-E[h(x)] / c(psi))}, and the decision
 * function subtracts an offset chosen so that a fraction {@code contamination}
 * of the training samples have a negative decision value. Negative decision
 * values are outliers.
 */
public class IsolationForest {

    public static final int DEFAULT_NUMBER_OF_TREES = 100;

    public static final int DEFAULT_MAX_SAMPLES = 256;

    public static final double DEFAULT_CONTAMINATION = 0.05;

    public static final double MAXIMUM_CONTAMINATION = 0.5;

    public static final int MINIMUM_SAMPLES = 2;

    private final int numberOfTrees;

    private final int maxSamples;

    private final double contamination;

    private final Random random;

    private final Optional<Long> randomSeed;

    private List<IsolationTree> trees = Collections.emptyList();

    // number of samples each tree was grown on
    private int subsampleSize;

    private double offset;

    protected IsolationForest(Builder builder) {
        checkArgument(builder.numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(builder.maxSamples > 0, "maxSamples must be greater than 0");
        checkArgument(builder.contamination > 0 && builder.contamination <= MAXIMUM_CONTAMINATION,
                "contamination must be in (0, 0.5]");
        this.numberOfTrees = builder.numberOfTrees;
        this.maxSamples = builder.maxSamples;
        this.contamination = builder.contamination;
        this.randomSeed = builder.randomSeed;
        this.random = builder.randomSeed.map(seed -> new Random(seed)).orElseGet(Random::new);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Grows the trees on subsamples of the given samples and calibrates the
     * decision offset on the same samples.
     *
     * @param samples the training samples
     * @return this forest
     * @throws InsufficientDataException if fewer than two samples are given
     */
    public IsolationForest fit(double[] samples) {
        checkNotNull(samples, "samples must not be null");
        if (samples.length < MINIMUM_SAMPLES) {
            throw new InsufficientDataException(MINIMUM_SAMPLES, samples.length);
        }
        for (double sample : samples) {
            checkArgument(Double.isFinite(sample), "samples must be finite");
        }

        subsampleSize = Math.min(maxSamples, samples.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(subsampleSize, 2)) / Math.log(2));
        List<IsolationTree> grown = new ArrayList<>(numberOfTrees);
        for (int i = 0; i < numberOfTrees; i++) {
            grown.add(IsolationTree.grow(subsample(samples, subsampleSize), maxDepth, random));
        }
        trees = Collections.unmodifiableList(grown);
        offset = percentile(scoreSamples(samples), 100.0 * contamination);
        return this;
    }

    /**
     * @param samples values to score
     * @return the opposite of the anomaly score of each value, in [-1, 0); lower
     *         is more anomalous
     */
    public double[] scoreSamples(double[] samples) {
        checkState(isFitted(), "forest must be fit before scoring");
        double normalizer = IsolationTree.averagePathLength(subsampleSize);
        double[] result = new double[samples.length];
        for (int i = 0; i < samples.length; i++) {
            double depth = 0;
            for (IsolationTree tree : trees) {
                depth += tree.pathLength(samples[i]);
            }
            depth /= trees.size();
            result[i] = -Math.pow(2, -depth / normalizer);
        }
        return result;
    }

    /**
     * @param samples values to score
     * @return score minus offset; negative values are outliers
     */
    public double[] decisionFunction(double[] samples) {
        double[] result = scoreSamples(samples);
        for (int i = 0; i < result.length; i++) {
            result[i] -= offset;
        }
        return result;
    }

    /**
     * @param samples values to classify
     * @return true for each value considered an outlier
     */
    public boolean[] predictOutliers(double[] samples) {
        double[] decision = decisionFunction(samples);
        boolean[] result = new boolean[decision.length];
        for (int i = 0; i < decision.length; i++) {
            result[i] = decision[i] < 0;
        }
        return result;
    }

    public boolean isFitted() {
        return !trees.isEmpty();
    }

    private double[] subsample(double[] samples, int size) {
        if (size >= samples.length) {
            return samples;
        }
        // partial Fisher-Yates over the indices
        int[] indices = new int[samples.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        double[] result = new double[size];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(samples.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            result[i] = samples[indices[i]];
        }
        return result;
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     */
    static double percentile(double[] values, double percent) {
        checkArgument(values.length > 0, "cannot take a percentile of nothing");
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double rank = percent / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = Math.min(lower + 1, sorted.length - 1);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }

    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public int getMaxSamples() {
        return maxSamples;
    }

    public double getContamination() {
        return contamination;
    }

    public Optional<Long> getRandomSeed() {
        return randomSeed;
    }

    public double getOffset() {
        return offset;
    }

    public int getSubsampleSize() {
        return subsampleSize;
    }

    public static class Builder {

        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int maxSamples = DEFAULT_MAX_SAMPLES;
        private double contamination = DEFAULT_CONTAMINATION;
        private Optional<Long> randomSeed = Optional.empty();

        public Builder numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return this;
        }

        public Builder maxSamples(int maxSamples) {
            this.maxSamples = maxSamples;
            return this;
        }

        public Builder contamination(double contamination) {
            this.contamination = contamination;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return this;
        }

        public IsolationForest build() {
            return new IsolationForest(this);
        }
    }
}
