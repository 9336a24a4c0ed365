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
import static com.amazon.faultpredictor.CommonUtils.deepCopy;

import java.util.Arrays;
import java.util.Random;

import lombok.Getter;

/**
 * The learned parameters of an encode-decode model over the timesteps of a
 * window. Each timestep x is encoded into a latent vector z = tanh(We x + be)
 * and decoded as Wd z + bd; the sequence of latent vectors is the latent
 * trajectory of the window.
 *
 * Instances are immutable. Training produces a new instance, so a model that
 * is being served is never modified.
 */
public class ReconstructionModel {

    /**
     * Default size of the latent vector.
     */
    public static final int DEFAULT_HIDDEN_SIZE = 16;

    @Getter
    private final int dimensions;

    @Getter
    private final int hiddenSize;

    // hiddenSize x dimensions
    private final double[][] encoderWeights;

    private final double[] encoderBias;

    // dimensions x hiddenSize
    private final double[][] decoderWeights;

    private final double[] decoderBias;

    /**
     * false for a model that only carries its random initialization
     */
    @Getter
    private final boolean trained;

    /**
     * seed of the random initialization
     */
    @Getter
    private final long randomSeed;

    public ReconstructionModel(double[][] encoderWeights, double[] encoderBias, double[][] decoderWeights,
            double[] decoderBias, boolean trained, long randomSeed) {
        checkNotNull(encoderWeights, "encoder weights must not be null");
        checkNotNull(encoderBias, "encoder bias must not be null");
        checkNotNull(decoderWeights, "decoder weights must not be null");
        checkNotNull(decoderBias, "decoder bias must not be null");
        this.hiddenSize = encoderWeights.length;
        checkArgument(hiddenSize > 0, "hidden size must be greater than 0");
        this.dimensions = encoderWeights[0].length;
        checkArgument(dimensions > 0, "dimensions must be greater than 0");
        checkArgument(encoderBias.length == hiddenSize, "incorrect encoder bias length");
        checkArgument(decoderWeights.length == dimensions, "incorrect decoder weight rows");
        checkArgument(decoderBias.length == dimensions, "incorrect decoder bias length");
        for (double[] row : encoderWeights) {
            checkArgument(row.length == dimensions, "incorrect encoder weight columns");
        }
        for (double[] row : decoderWeights) {
            checkArgument(row.length == hiddenSize, "incorrect decoder weight columns");
        }
        this.encoderWeights = deepCopy(encoderWeights);
        this.encoderBias = Arrays.copyOf(encoderBias, hiddenSize);
        this.decoderWeights = deepCopy(decoderWeights);
        this.decoderBias = Arrays.copyOf(decoderBias, dimensions);
        this.trained = trained;
        this.randomSeed = randomSeed;
    }

    /**
     * A model with Glorot-uniform random weights and zero biases. This is what
     * serving falls back to when no trained artifact is available.
     *
     * @param dimensions width of a timestep
     * @param hiddenSize width of the latent vector
     * @param seed       seed of the initialization
     * @return an untrained model
     */
    public static ReconstructionModel untrained(int dimensions, int hiddenSize, long seed) {
        checkArgument(dimensions > 0, "dimensions must be greater than 0");
        checkArgument(hiddenSize > 0, "hidden size must be greater than 0");
        Random random = new Random(seed);
        double limit = Math.sqrt(6.0 / (dimensions + hiddenSize));
        double[][] encoder = new double[hiddenSize][dimensions];
        double[][] decoder = new double[dimensions][hiddenSize];
        for (int k = 0; k < hiddenSize; k++) {
            for (int j = 0; j < dimensions; j++) {
                encoder[k][j] = (2 * random.nextDouble() - 1) * limit;
            }
        }
        for (int j = 0; j < dimensions; j++) {
            for (int k = 0; k < hiddenSize; k++) {
                decoder[j][k] = (2 * random.nextDouble() - 1) * limit;
            }
        }
        return new ReconstructionModel(encoder, new double[hiddenSize], decoder, new double[dimensions], false, seed);
    }

    /**
     * @param point a timestep
     * @return the latent vector of the timestep
     */
    public double[] encode(double[] point) {
        checkArgument(point.length == dimensions, "incorrect length");
        double[] latent = new double[hiddenSize];
        for (int k = 0; k < hiddenSize; k++) {
            double sum = encoderBias[k];
            double[] row = encoderWeights[k];
            for (int j = 0; j < dimensions; j++) {
                sum += row[j] * point[j];
            }
            latent[k] = Math.tanh(sum);
        }
        return latent;
    }

    /**
     * @param latent a latent vector
     * @return the decoded timestep
     */
    public double[] decode(double[] latent) {
        checkArgument(latent.length == hiddenSize, "incorrect length");
        double[] output = new double[dimensions];
        for (int j = 0; j < dimensions; j++) {
            double sum = decoderBias[j];
            double[] row = decoderWeights[j];
            for (int k = 0; k < hiddenSize; k++) {
                sum += row[k] * latent[k];
            }
            output[j] = sum;
        }
        return output;
    }

    /**
     * @param window timesteps of the window
     * @return the latent trajectory, one latent vector per timestep
     */
    public double[][] encodeTrajectory(double[][] window) {
        double[][] trajectory = new double[window.length][];
        for (int i = 0; i < window.length; i++) {
            trajectory[i] = encode(window[i]);
        }
        return trajectory;
    }

    /**
     * @param window timesteps of the window
     * @return the decoded window
     */
    public double[][] reconstruct(double[][] window) {
        double[][] trajectory = encodeTrajectory(window);
        double[][] output = new double[window.length][];
        for (int i = 0; i < window.length; i++) {
            output[i] = decode(trajectory[i]);
        }
        return output;
    }

    /**
     * mean squared difference between a window and its reconstruction, averaged
     * over timesteps and features
     *
     * @param window timesteps of the window
     * @return a non negative error
     */
    public double reconstructionError(double[][] window) {
        checkArgument(window.length > 0, "empty window");
        double[][] output = reconstruct(window);
        double sum = 0;
        for (int i = 0; i < window.length; i++) {
            for (int j = 0; j < dimensions; j++) {
                double difference = output[i][j] - window[i][j];
                sum += difference * difference;
            }
        }
        return sum / ((double) window.length * dimensions);
    }

    public double[][] getEncoderWeights() {
        return deepCopy(encoderWeights);
    }

    public double[] getEncoderBias() {
        return Arrays.copyOf(encoderBias, encoderBias.length);
    }

    public double[][] getDecoderWeights() {
        return deepCopy(decoderWeights);
    }

    public double[] getDecoderBias() {
        return Arrays.copyOf(decoderBias, decoderBias.length);
    }
}
