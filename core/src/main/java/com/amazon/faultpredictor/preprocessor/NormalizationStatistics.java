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

package com.amazon.faultpredictor.preprocessor;

import static com.amazon.faultpredictor.CommonUtils.checkArgument;
import static com.amazon.faultpredictor.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * Per-feature mean and standard deviation computed over one window, together
 * with the epsilon used in the denominator.
 */
public class NormalizationStatistics {

    private final double[] mean;
    private final double[] deviation;
    private final double epsilon;

    public NormalizationStatistics(double[] mean, double[] deviation, double epsilon) {
        checkNotNull(mean, "mean must not be null");
        checkNotNull(deviation, "deviation must not be null");
        checkArgument(mean.length == deviation.length, "incorrect lengths");
        checkArgument(epsilon >= 0, "epsilon cannot be negative");
        this.mean = Arrays.copyOf(mean, mean.length);
        this.deviation = Arrays.copyOf(deviation, deviation.length);
        this.epsilon = epsilon;
    }

    public double[] getMean() {
        return Arrays.copyOf(mean, mean.length);
    }

    public double[] getDeviation() {
        return Arrays.copyOf(deviation, deviation.length);
    }

    public double getEpsilon() {
        return epsilon;
    }

    public int getDimensions() {
        return mean.length;
    }

    /**
     * applies the statistics to a single vector, for example a reading that
     * arrives after the window was summarized
     *
     * @param point a vector of the same width as the statistics
     * @return (point - mean) / (deviation + epsilon)
     */
    public double[] normalize(double[] point) {
        checkArgument(point.length == mean.length, "incorrect length");
        double[] result = new double[point.length];
        for (int i = 0; i < point.length; i++) {
            result[i] = (point[i] - mean[i]) / (deviation[i] + epsilon);
        }
        return result;
    }

    /**
     * inverse of {@link #normalize(double[])}
     *
     * @param point a normalized vector
     * @return the vector in the original units
     */
    public double[] denormalize(double[] point) {
        checkArgument(point.length == mean.length, "incorrect length");
        double[] result = new double[point.length];
        for (int i = 0; i < point.length; i++) {
            result[i] = point[i] * (deviation[i] + epsilon) + mean[i];
        }
        return result;
    }
}
