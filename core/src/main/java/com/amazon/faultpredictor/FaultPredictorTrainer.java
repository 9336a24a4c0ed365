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

package com.amazon.faultpredictor;

import static com.amazon.faultpredictor.CommonUtils.checkArgument;
import static com.amazon.faultpredictor.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.faultpredictor.inputtypes.FeatureSchema;
import com.amazon.faultpredictor.inputtypes.SensorWindow;
import com.amazon.faultpredictor.isolation.IsolationForest;
import com.amazon.faultpredictor.preprocessor.NormalizedWindow;
import com.amazon.faultpredictor.preprocessor.SlidingWindows;
import com.amazon.faultpredictor.preprocessor.WindowPreprocessor;
import com.amazon.faultpredictor.reconstruction.ReconstructionModel;
import com.amazon.faultpredictor.reconstruction.ReconstructionTrainer;

/**
 * Produces a {@link ModelArtifacts} bundle from historical data. Every window
 * is normalized exactly as at serving time; the reconstruction model is fit on
 * the normalized windows and the isolation forest on the last normalized
 * timestep of each window, which is the vector it scores when serving.
 *
 * Both detectors draw their seeds from a single random source seeded with
 * {@code randomSeed}, so training is reproducible.
 */
@Slf4j
@Getter
public class FaultPredictorTrainer {

    private final FeatureSchema schema;

    private final int windowLength;

    private final int hiddenSize;

    private final int numberOfEpochs;

    private final double learningRate;

    private final int numberOfTrees;

    private final int maxSamples;

    private final double contamination;

    private final long randomSeed;

    public FaultPredictorTrainer(Builder<?> builder) {
        checkArgument(builder.windowLength > 0, "window length must be greater than 0");
        this.schema = checkNotNull(builder.schema, "schema must not be null");
        this.windowLength = builder.windowLength;
        this.hiddenSize = builder.hiddenSize;
        this.numberOfEpochs = builder.numberOfEpochs;
        this.learningRate = builder.learningRate;
        this.numberOfTrees = builder.numberOfTrees;
        this.maxSamples = builder.maxSamples;
        this.contamination = builder.contamination;
        this.randomSeed = builder.randomSeed.orElseGet(() -> new Random().nextLong());
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Cuts a series into every contiguous window of {@code windowLength}
     * timesteps and trains on them.
     *
     * @param series timesteps of the series, each as wide as the schema
     * @return trained artifacts
     */
    public ModelArtifacts train(double[][] series) {
        return train(SlidingWindows.createSequences(schema, series, windowLength), () -> false);
    }

    public ModelArtifacts train(List<SensorWindow> windows) {
        return train(windows, () -> false);
    }

    /**
     * @param windows   training windows
     * @param cancelled polled while training; once it returns true training stops
     *                  with a {@link CancellationException}
     * @return trained artifacts
     */
    public ModelArtifacts train(List<SensorWindow> windows, BooleanSupplier cancelled) {
        checkNotNull(windows, "windows must not be null");
        checkArgument(windows.size() > 1, "at least two training windows are required");
        WindowPreprocessor preprocessor = WindowPreprocessor.builder().dimensions(schema.getWidth())
                .minimumLength(windowLength).build();

        List<double[][]> normalized = new ArrayList<>(windows.size());
        double[][] lastTimesteps = new double[windows.size()][];
        for (int i = 0; i < windows.size(); i++) {
            NormalizedWindow window = preprocessor.normalize(windows.get(i));
            normalized.add(window.getValues());
            lastTimesteps[i] = window.getLastTimestep();
        }

        Random random = new Random(randomSeed);
        ReconstructionModel model = ReconstructionTrainer.builder().hiddenSize(hiddenSize)
                .numberOfEpochs(numberOfEpochs).learningRate(learningRate).randomSeed(random.nextLong()).build()
                .fit(normalized, cancelled);
        IsolationForest forest = IsolationForest.builder().dimensions(schema.getWidth()).numberOfTrees(numberOfTrees)
                .maxSamples(maxSamples).contamination(contamination).randomSeed(random.nextLong()).build()
                .fit(lastTimesteps, cancelled);

        log.info("trained artifacts for schema {} on {} windows", schema.getVersion(), windows.size());
        return new ModelArtifacts(schema.getVersion(), model, forest);
    }

    public static class Builder<T extends Builder<T>> {

        private FeatureSchema schema = FeatureSchema.tennesseeEastman();
        private int windowLength = WindowPreprocessor.DEFAULT_MINIMUM_LENGTH;
        private int hiddenSize = ReconstructionModel.DEFAULT_HIDDEN_SIZE;
        private int numberOfEpochs = ReconstructionTrainer.DEFAULT_NUMBER_OF_EPOCHS;
        private double learningRate = ReconstructionTrainer.DEFAULT_LEARNING_RATE;
        private int numberOfTrees = IsolationForest.DEFAULT_NUMBER_OF_TREES;
        private int maxSamples = IsolationForest.DEFAULT_MAX_SAMPLES;
        private double contamination = IsolationForest.DEFAULT_CONTAMINATION;
        private Optional<Long> randomSeed = Optional.empty();

        public T schema(FeatureSchema schema) {
            this.schema = schema;
            return (T) this;
        }

        public T windowLength(int windowLength) {
            this.windowLength = windowLength;
            return (T) this;
        }

        public T hiddenSize(int hiddenSize) {
            this.hiddenSize = hiddenSize;
            return (T) this;
        }

        public T numberOfEpochs(int numberOfEpochs) {
            this.numberOfEpochs = numberOfEpochs;
            return (T) this;
        }

        public T learningRate(double learningRate) {
            this.learningRate = learningRate;
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

        public FaultPredictorTrainer build() {
            return new FaultPredictorTrainer(this);
        }
    }
}
