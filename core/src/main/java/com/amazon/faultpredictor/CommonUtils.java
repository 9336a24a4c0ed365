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

import java.util.Objects;

/**
 * A collection of common utility functions.
 */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Restricts a value to the closed interval [lower, upper].
     *
     * @param value the value
     * @param lower the lower end of the interval
     * @param upper the upper end of the interval
     * @return the clamped value
     */
    public static double clamp(double value, double lower, double upper) {
        return Math.max(lower, Math.min(upper, value));
    }

    /**
     * The logistic function, mapping the real line onto (0,1).
     *
     * @param x the argument
     * @return 1/(1 + exp(-x))
     */
    public static double sigmoid(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree built
     * from n points. This is the normalizer used by isolation scoring; for n
     * greater than 2 it equals 2H(n-1) - 2(n-1)/n with the harmonic number
     * approximated by ln(i) + Euler's constant.
     *
     * @param n number of points
     * @return the expected path length
     */
    public static double averagePathLength(double n) {
        if (n <= 1) {
            return 0;
        }
        if (n <= 2) {
            return 1;
        }
        return 2.0 * (Math.log(n - 1.0) + 0.5772156649015329) - 2.0 * (n - 1.0) / n;
    }

    /**
     * Population mean and standard deviation of one column of a matrix.
     *
     * @param values the rows of the matrix
     * @param column the column index
     * @return a two element array {mean, standard deviation}
     */
    public static double[] columnMeanAndDeviation(double[][] values, int column) {
        double sum = 0;
        for (double[] row : values) {
            sum += row[column];
        }
        double mean = sum / values.length;
        double sumSquared = 0;
        for (double[] row : values) {
            double difference = row[column] - mean;
            sumSquared += difference * difference;
        }
        return new double[] { mean, Math.sqrt(sumSquared / values.length) };
    }

    public static double[][] deepCopy(double[][] values) {
        checkNotNull(values, "values must not be null");
        double[][] result = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i].clone();
        }
        return result;
    }
}
