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
import static com.amazon.faultpredictor.CommonUtils.columnMeanAndDeviation;

import lombok.Getter;

import com.amazon.faultpredictor.inputtypes.SensorWindow;

/**
 * Validates a raw sensor window against the configured width and minimum
 * length, and standardizes every feature with the mean and standard deviation
 * observed in the window. The transform is pure; the same preprocessor can be
 * used from any number of threads.
 */
@Getter
public class WindowPreprocessor {

    /**
     * Default minimum number of timesteps in a window.
     */
    public static final int DEFAULT_MINIMUM_LENGTH = 60;

    /**
     * Added to the standard deviation so that constant features map to 0 instead
     * of dividing by zero.
     */
    public static final double DEFAULT_EPSILON = 1e-8;

    private final int dimensions;

    private final int minimumLength;

    private final double epsilon;

    public WindowPreprocessor(Builder<?> builder) {
        checkArgument(builder.dimensions > 0, "dimensions must be greater than 0");
        checkArgument(builder.minimumLength > 0, "minimum length must be greater than 0");
        checkArgument(builder.epsilon > 0, "epsilon must be positive");
        this.dimensions = builder.dimensions;
        this.minimumLength = builder.minimumLength;
        this.epsilon = builder.epsilon;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Checks the length and width of a window without transforming it.
     *
     * @param window a raw window
     * @throws WindowValidationException if the window is too short, has the wrong
     *                                   width anywhere, or contains a non finite
     *                                   reading
     */
    public void validate(SensorWindow window) {
        checkNotNull(window, "window must not be null");
        if (window.getWidth() != dimensions) {
            throw new WindowValidationException(String.format(
                    "window schema has %d features but the predictor expects %d", window.getWidth(), dimensions));
        }
        if (window.getLength() < minimumLength) {
            throw new WindowValidationException(String.format("window has %d timesteps, at least %d are required",
                    window.getLength(), minimumLength));
        }
        double[][] values = window.getValues();
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != dimensions) {
                throw new WindowValidationException(String.format("timestep %d has %d values but %d are expected", i,
                        values[i].length, dimensions));
            }
            for (int j = 0; j < dimensions; j++) {
                if (!Double.isFinite(values[i][j])) {
                    throw new WindowValidationException(String.format(
                            "timestep %d has a non finite value for %s", i, window.getSchema().getName(j)));
                }
            }
        }
    }

    /**
     * Validates and standardizes a window.
     *
     * @param window a raw window
     * @return the normalized values and the statistics used
     * @throws WindowValidationException if the window fails
     *                                   {@link #validate(SensorWindow)}
     */
    public NormalizedWindow normalize(SensorWindow window) {
        validate(window);
        double[][] values = window.getValues();
        double[] mean = new double[dimensions];
        double[] deviation = new double[dimensions];
        for (int j = 0; j < dimensions; j++) {
            double[] summary = columnMeanAndDeviation(values, j);
            mean[j] = summary[0];
            deviation[j] = summary[1];
        }
        NormalizationStatistics statistics = new NormalizationStatistics(mean, deviation, epsilon);
        double[][] normalized = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            normalized[i] = statistics.normalize(values[i]);
        }
        return new NormalizedWindow(normalized, statistics);
    }

    public static class Builder<T extends Builder<T>> {

        private int dimensions;
        private int minimumLength = DEFAULT_MINIMUM_LENGTH;
        private double epsilon = DEFAULT_EPSILON;

        public T dimensions(int dimensions) {
            this.dimensions = dimensions;
            return (T) this;
        }

        public T minimumLength(int minimumLength) {
            this.minimumLength = minimumLength;
            return (T) this;
        }

        public T epsilon(double epsilon) {
            this.epsilon = epsilon;
            return (T) this;
        }

        public WindowPreprocessor build() {
            return new WindowPreprocessor(this);
        }
    }
}
