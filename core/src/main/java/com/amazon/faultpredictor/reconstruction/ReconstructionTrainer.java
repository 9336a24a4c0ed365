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

package com.amazon.faultpredictor.reconstruction;

import static com.amazon.faultpredictor.CommonUtils.checkArgument;
import static com.amazon.faultpredictor.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Fits a {@link ReconstructionModel} to a collection of windows by stochastic
 * gradient descent on the squared reconstruction error of every timestep. All
 * randomness (initial weights and visiting order) comes from the configured
 * seed, so two trainers with the same seed and data produce identical models.
 *
 * Training is an offline operation; it never touches a model that is being
 * served and returns a fresh instance instead.
 */
@Slf4j
@Getter
public class ReconstructionTrainer {

    public static final int DEFAULT_NUMBER_OF_EPOCHS = 10;

    public static final double DEFAULT_LEARNING_RATE = 0.05;

    private final int hiddenSize;

    private final int numberOfEpochs;

    private final double learningRate;

    private final long randomSeed;

    public ReconstructionTrainer(Builder<?> builder) {
        checkArgument(builder.hiddenSize > 0, "hidden size must be greater than 0");
        checkArgument(builder.numberOfEpochs > 0, "number of epochs must be greater than 0");
        checkArgument(builder.learningRate > 0, "learning rate must be positive");
        this.hiddenSize = builder.hiddenSize;
        this.numberOfEpochs = builder.numberOfEpochs;
        this.learningRate = builder.learningRate;
        this.randomSeed = builder.randomSeed.orElseGet(() -> new Random().nextLong());
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public ReconstructionModel fit(List<double[][]> windows) {
        return fit(windows, () -> false);
    }

    /**
     * @param windows   normalized training windows, all timesteps of equal width
     * @param cancelled polled between epochs; training stops with a
     *                  {@link CancellationException} once it returns true
     * @return a trained model
     */
    public ReconstructionModel fit(List<double[][]> windows, BooleanSupplier cancelled) {
        checkNotNull(windows, "windows must not be null");
        checkNotNull(cancelled, "cancellation hook must not be null");
        checkArgument(!windows.isEmpty(), "at least one training window is required");
        int dimensions = windows.get(0)[0].length;

        List<double[]> timesteps = new ArrayList<>();
        for (double[][] window : windows) {
            for (double[] point : window) {
                checkArgument(point.length == dimensions, "all timesteps must have the same width");
                timesteps.add(point);
            }
        }

        ReconstructionModel initial = ReconstructionModel.untrained(dimensions, hiddenSize, randomSeed);
        double[][] encoder = initial.getEncoderWeights();
        double[] encoderBias = initial.getEncoderBias();
        double[][] decoder = initial.getDecoderWeights();
        double[] decoderBias = initial.getDecoderBias();

        Random random = new Random(randomSeed);
        double[] latent = new double[hiddenSize];
        double[] outputGradient = new double[dimensions];
        double[] latentGradient = new double[hiddenSize];

        for (int epoch = 0; epoch < numberOfEpochs; epoch++) {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("reconstruction training cancelled after " + epoch + " epochs");
            }
            Collections.shuffle(timesteps, random);
            double loss = 0;
            for (double[] point : timesteps) {
                // forward
                for (int k = 0; k < hiddenSize; k++) {
                    double sum = encoderBias[k];
                    for (int j = 0; j < dimensions; j++) {
                        sum += encoder[k][j] * point[j];
                    }
                    latent[k] = Math.tanh(sum);
                }
                for (int j = 0; j < dimensions; j++) {
                    double sum = decoderBias[j];
                    for (int k = 0; k < hiddenSize; k++) {
                        sum += decoder[j][k] * latent[k];
                    }
                    double difference = sum - point[j];
                    loss += difference * difference;
                    outputGradient[j] = 2 * difference / dimensions;
                }

                // backward; latent gradient uses the decoder weights before the update
                for (int k = 0; k < hiddenSize; k++) {
                    double sum = 0;
                    for (int j = 0; j < dimensions; j++) {
                        sum += decoder[j][k] * outputGradient[j];
                    }
                    latentGradient[k] = sum * (1 - latent[k] * latent[k]);
                }
                for (int j = 0; j < dimensions; j++) {
                    for (int k = 0; k < hiddenSize; k++) {
                        decoder[j][k] -= learningRate * outputGradient[j] * latent[k];
                    }
                    decoderBias[j] -= learningRate * outputGradient[j];
                }
                for (int k = 0; k < hiddenSize; k++) {
                    for (int j = 0; j < dimensions; j++) {
                        encoder[k][j] -= learningRate * latentGradient[k] * point[j];
                    }
                    encoderBias[k] -= learningRate * latentGradient[k];
                }
            }
            log.debug("epoch {}/{} mean squared error {}", epoch + 1, numberOfEpochs,
                    loss / ((double) timesteps.size() * dimensions));
        }
        log.info("trained reconstruction model on {} windows ({} timesteps, {} features)", windows.size(),
                timesteps.size(), dimensions);
        return new ReconstructionModel(encoder, encoderBias, decoder, decoderBias, true, randomSeed);
    }

    public static class Builder<T extends Builder<T>> {

        private int hiddenSize = ReconstructionModel.DEFAULT_HIDDEN_SIZE;
        private int numberOfEpochs = DEFAULT_NUMBER_OF_EPOCHS;
        private double learningRate = DEFAULT_LEARNING_RATE;
        private Optional<Long> randomSeed = Optional.empty();

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

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public ReconstructionTrainer build() {
            return new ReconstructionTrainer(this);
        }
    }
}
