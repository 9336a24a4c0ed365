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

/**
 * Flags rows in which at least one feature lies more than {@code threshold}
 * standard deviations from its column mean. Useful to screen training series
 * before they are cut into windows.
 */
public class ZScoreOutlierFilter {

    public static final double DEFAULT_THRESHOLD = 3.0;

    private final double threshold;

    private final double epsilon;

    public ZScoreOutlierFilter() {
        this(DEFAULT_THRESHOLD, WindowPreprocessor.DEFAULT_EPSILON);
    }

    public ZScoreOutlierFilter(double threshold, double epsilon) {
        checkArgument(threshold > 0, "threshold must be positive");
        checkArgument(epsilon >= 0, "epsilon cannot be negative");
        this.threshold = threshold;
        this.epsilon = epsilon;
    }

    /**
     * @param values rows of equal width
     * @return one flag per row, true if the row is an outlier
     */
    public boolean[] detectOutliers(double[][] values) {
        checkNotNull(values, "values must not be null");
        boolean[] outliers = new boolean[values.length];
        if (values.length == 0) {
            return outliers;
        }
        int width = values[0].length;
        for (int j = 0; j < width; j++) {
            double[] summary = columnMeanAndDeviation(values, j);
            for (int i = 0; i < values.length; i++) {
                if (Math.abs((values[i][j] - summary[0]) / (summary[1] + epsilon)) > threshold) {
                    outliers[i] = true;
                }
            }
        }
        return outliers;
    }

    /**
     * @param values rows of equal width
     * @return the rows that are not flagged by {@link #detectOutliers}
     */
    public double[][] removeOutliers(double[][] values) {
        boolean[] outliers = detectOutliers(values);
        int count = 0;
        for (boolean flag : outliers) {
            if (!flag) {
                ++count;
            }
        }
        double[][] result = new double[count][];
        int index = 0;
        for (int i = 0; i < values.length; i++) {
            if (!outliers[i]) {
                result[index++] = values[i].clone();
            }
        }
        return result;
    }

    public double getThreshold() {
        return threshold;
    }
}
