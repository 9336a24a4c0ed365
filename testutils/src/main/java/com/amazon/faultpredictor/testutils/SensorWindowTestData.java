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

package com.amazon.faultpredictor.testutils;

import java.util.Arrays;
import java.util.Random;

/**
 * Synthetic multivariate process data. Each channel oscillates slowly around
 * its own level with Gaussian measurement noise; a fault is a step change
 * added to chosen channels from a given row onwards. All generators are
 * seeded.
 */
public class SensorWindowTestData {

    private final double noiseSigma;
    private final double amplitude;
    private final double period;

    public SensorWindowTestData(double noiseSigma, double amplitude, double period) {
        this.noiseSigma = noiseSigma;
        this.amplitude = amplitude;
        this.period = period;
    }

    public SensorWindowTestData() {
        this(0.1, 1.0, 50.0);
    }

    /**
     * @param numberOfRows    number of timesteps
     * @param numberOfColumns number of channels
     * @param seed            seed of the noise, levels and phases
     * @return rows of readings under normal operation
     */
    public double[][] generateSeries(int numberOfRows, int numberOfColumns, long seed) {
        Random random = new Random(seed);
        NormalDistribution noise = new NormalDistribution(random);
        double[] level = new double[numberOfColumns];
        double[] phase = new double[numberOfColumns];
        for (int j = 0; j < numberOfColumns; j++) {
            level[j] = 10 * random.nextDouble();
            phase[j] = 2 * Math.PI * random.nextDouble();
        }
        double[][] result = new double[numberOfRows][numberOfColumns];
        for (int i = 0; i < numberOfRows; i++) {
            for (int j = 0; j < numberOfColumns; j++) {
                result[i][j] = level[j] + amplitude * Math.sin(2 * Math.PI * i / period + phase[j])
                        + noise.nextDouble(0, noiseSigma);
            }
        }
        return result;
    }

    /**
     * @return a copy of the series with {@code shift} added to the given columns
     *         from {@code fromRow} onwards
     */
    public static double[][] injectFault(double[][] series, int fromRow, int[] columns, double shift) {
        double[][] result = new double[series.length][];
        for (int i = 0; i < series.length; i++) {
            result[i] = series[i].clone();
            if (i >= fromRow) {
                for (int column : columns) {
                    result[i][column] += shift;
                }
            }
        }
        return result;
    }

    /**
     * independent standard normal rows, the data the isolation forest is
     * calibrated against in tests
     */
    public static double[][] standardNormal(int numberOfRows, int numberOfColumns, long seed) {
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        double[][] result = new double[numberOfRows][numberOfColumns];
        for (int i = 0; i < numberOfRows; i++) {
            for (int j = 0; j < numberOfColumns; j++) {
                result[i][j] = dist.nextDouble();
            }
        }
        return result;
    }

    public static double[][] constant(int numberOfRows, int numberOfColumns, double value) {
        double[][] result = new double[numberOfRows][numberOfColumns];
        for (double[] row : result) {
            Arrays.fill(row, value);
        }
        return result;
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // Box-Muller; 1 - u keeps the logarithm finite
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }
            double result = buffer[index];
            index = (index + 1) % 2;
            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
