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

package com.amazon.faultpredictor.isolation;

import static com.amazon.faultpredictor.CommonUtils.averagePathLength;
import static com.amazon.faultpredictor.CommonUtils.checkArgument;
import static com.amazon.faultpredictor.CommonUtils.checkNotNull;
import static com.amazon.faultpredictor.CommonUtils.sigmoid;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.faultpredictor.returntypes.DetectorVerdict;
import com.amazon.faultpredictor.returntypes.IsolationResult;

/**
 * An ensemble of {@link IsolationTree}s. A point that is isolated after few
 * random cuts is unusual; the raw score of a point x is
 * {@code -2^(-E[h(x)] / c(sampleSize))} where E[h(x)] is the mean path length
 * over the trees and c is the average path length of an unsuccessful search.
 * Lower raw scores are more anomalous.
 *
 * The decision offset is calibrated at training time so that a
 * {@code contamination} fraction of the training points fall below it.
 *
 * Instances are immutable: {@link #fit} returns a new forest that keeps the
 * hyperparameters of this one. A forest created by {@link Builder#build()} has
 * no trees; it scores every point at {@link #UNTRAINED_SCORE} and never flags
 * anything.
 */
@Slf4j
@Getter
public class IsolationForest {

    public static final int DEFAULT_NUMBER_OF_TREES = 100;

    public static final int DEFAULT_MAX_SAMPLES = 256;

    public static final double DEFAULT_CONTAMINATION = 0.1;

    /**
     * Raw score of every point under a forest without trees.
     */
    public static final double UNTRAINED_SCORE = -0.5;

    /**
     * Number of features of a scored vector.
     */
    private final int dimensions;

    private final int numberOfTrees;

    /**
     * Upper bound on the number of training points each tree is grown on.
     */
    private final int maxSamples;

    /**
     * Expected fraction of anomalies in the training data.
     */
    private final double contamination;

    private final long randomSeed;

    /**
     * Number of points each tree was actually grown on; 0 when untrained.
     */
    private final int sampleSize;

    /**
     * Raw score below which a point is anomalous.
     */
    private final double offset;

    @Getter(AccessLevel.NONE)
    private final List<IsolationTree> trees;

    public IsolationForest(Builder<?> builder) {
        this(builder.dimensions, builder.numberOfTrees, builder.maxSamples, builder.contamination,
                builder.randomSeed.orElseGet(() -> new Random().nextLong()), 0, UNTRAINED_SCORE,
                Collections.emptyList());
    }

    public IsolationForest(int dimensions, int numberOfTrees, int maxSamples, double contamination, long randomSeed,
            int sampleSize, double offset, List<IsolationTree> trees) {
        checkArgument(dimensions > 0, "dimensions must be greater than 0");
        checkArgument(numberOfTrees > 0, "number of trees must be greater than 0");
        checkArgument(maxSamples > 1, "max samples must be greater than 1");
        checkArgument(contamination > 0 && contamination <= 0.5, "contamination must be in (0, 0.5]");
        checkNotNull(trees, "trees must not be null");
        checkArgument(trees.isEmpty() || trees.size() == numberOfTrees, "incorrect number of trees");
        checkArgument(trees.isEmpty() || sampleSize > 1, "a trained forest needs a sample size greater than 1");
        for (IsolationTree tree : trees) {
            checkNotNull(tree, "trees must not be null");
            checkArgument(tree.getRequiredDimensions() <= dimensions, "a tree cuts on a dimension outside the forest");
        }
        this.dimensions = dimensions;
        this.numberOfTrees = numberOfTrees;
        this.maxSamples = maxSamples;
        this.contamination = contamination;
        this.randomSeed = randomSeed;
        this.sampleSize = sampleSize;
        this.offset = offset;
        this.trees = Collections.unmodifiableList(new ArrayList<>(trees));
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public boolean isTrained() {
        return !trees.isEmpty();
    }

    public List<IsolationTree> getTrees() {
        return trees;
    }

    /**
     * depth at which trees grown on a sample of the given size stop
     *
     * @param sampleSize number of points in the sample
     * @return ceil(log2(sampleSize))
     */
    public static int maxDepth(int sampleSize) {
        return (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));
    }

    public IsolationForest fit(double[][] data) {
        return fit(data, () -> false);
    }

    /**
     * Grows a new forest on the given training vectors and calibrates its offset.
     *
     * @param data      training vectors, one per row
     * @param cancelled polled between trees; fitting stops with a
     *                  {@link CancellationException} once it returns true
     * @return a trained forest with the hyperparameters of this one
     */
    public IsolationForest fit(double[][] data, BooleanSupplier cancelled) {
        checkNotNull(data, "data must not be null");
        checkNotNull(cancelled, "cancellation hook must not be null");
        checkArgument(data.length > 1, "at least two training vectors are required");
        for (double[] point : data) {
            checkArgument(point.length == dimensions, "incorrect dimensions");
        }

        int size = Math.min(maxSamples, data.length);
        int depth = maxDepth(size);
        Random random = new Random(randomSeed);
        int[] indices = new int[data.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }

        List<IsolationTree> grown = new ArrayList<>(numberOfTrees);
        double[][] sample = new double[size][];
        for (int t = 0; t < numberOfTrees; t++) {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("isolation training cancelled after " + t + " trees");
            }
            // partial Fisher-Yates: the first size entries are a sample without replacement
            for (int i = 0; i < size; i++) {
                int j = i + random.nextInt(indices.length - i);
                int swap = indices[i];
                indices[i] = indices[j];
                indices[j] = swap;
                sample[i] = data[indices[i]];
            }
            grown.add(IsolationTree.build(sample, depth, random));
        }

        IsolationForest candidate = new IsolationForest(dimensions, numberOfTrees, maxSamples, contamination,
                randomSeed, size, UNTRAINED_SCORE, grown);
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = candidate.rawScore(data[i]);
        }
        double calibrated = quantile(scores, contamination);
        log.info("grew {} isolation trees on {} vectors, offset {}", numberOfTrees, data.length, calibrated);
        return new IsolationForest(dimensions, numberOfTrees, maxSamples, contamination, randomSeed, size, calibrated,
                grown);
    }

    /**
     * @param point a vector
     * @return the raw isolation score; lower is more anomalous
     */
    public double rawScore(double[] point) {
        checkNotNull(point, "point must not be null");
        checkArgument(point.length == dimensions, "incorrect dimensions");
        if (trees.isEmpty()) {
            return UNTRAINED_SCORE;
        }
        double sum = 0;
        for (IsolationTree tree : trees) {
            sum += tree.pathLength(point);
        }
        double meanPathLength = sum / trees.size();
        return -Math.pow(2, -meanPathLength / averagePathLength(sampleSize));
    }

    public boolean isAnomaly(double rawScore) {
        return rawScore < offset;
    }

    /**
     * @param points vectors, one per row
     * @return a label and a raw score per vector
     */
    public IsolationResult detect(double[][] points) {
        checkNotNull(points, "points must not be null");
        int[] labels = new int[points.length];
        double[] scores = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            scores[i] = rawScore(points[i]);
            labels[i] = isAnomaly(scores[i]) ? IsolationResult.ANOMALOUS : IsolationResult.NORMAL;
        }
        return new IsolationResult(labels, scores);
    }

    /**
     * @param point a vector
     * @return the verdict with score sigmoid(-raw), which increases as the point
     *         gets more anomalous
     */
    public DetectorVerdict detectSingle(double[] point) {
        double raw = rawScore(point);
        return new DetectorVerdict(isAnomaly(raw), sigmoid(-raw));
    }

    // linear interpolation between closest ranks
    static double quantile(double[] values, double fraction) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double position = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double weight = position - lower;
        return sorted[lower] + weight * (sorted[upper] - sorted[lower]);
    }

    public static class Builder<T extends Builder<T>> {

        private int dimensions;
        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int maxSamples = DEFAULT_MAX_SAMPLES;
        private double contamination = DEFAULT_CONTAMINATION;
        private Optional<Long> randomSeed = Optional.empty();

        public T dimensions(int dimensions) {
            this.dimensions = dimensions;
            return (T) this;
        }

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T maxSamples(int maxSamples) {
            this.maxSamples = maxSamples;
            return (T) this;
        }

        public T contamination(double contamination) {
            this.contamination = contamination;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public IsolationForest build() {
            return new IsolationForest(this);
        }
    }
}
