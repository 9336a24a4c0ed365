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

package com.amazon.faultpredictor.attribution;

import static com.amazon.faultpredictor.CommonUtils.checkArgument;
import static com.amazon.faultpredictor.CommonUtils.checkNotNull;
import static com.amazon.faultpredictor.CommonUtils.columnMeanAndDeviation;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

import com.amazon.faultpredictor.inputtypes.FeatureSchema;
import com.amazon.faultpredictor.inputtypes.SensorWindow;

/**
 * Attributes an anomaly score to the features of a window in proportion to how
 * much each feature moved within the window. The weight of feature i is
 * std_i / sum_j std_j, scaled by the anomaly score and renormalized to sum to
 * 1.
 *
 * Two degenerate cases fall back instead of failing: a window in which every
 * feature is constant gets uniform weights, and a zero anomaly score keeps the
 * unscaled dispersion shares.
 */
public class FeatureImportanceCalculator {

    public static final int DEFAULT_TOP_K = 10;

    @Getter
    private final FeatureSchema schema;

    public FeatureImportanceCalculator(FeatureSchema schema) {
        this.schema = checkNotNull(schema, "schema must not be null");
    }

    public FeatureImportance calculateImportance(SensorWindow window, double anomalyScore) {
        checkNotNull(window, "window must not be null");
        return calculateImportance(window.getValues(), anomalyScore);
    }

    /**
     * @param values       timesteps of a window, each as wide as the schema
     * @param anomalyScore a non negative score
     * @return weights over every feature of the schema
     */
    public FeatureImportance calculateImportance(double[][] values, double anomalyScore) {
        checkNotNull(values, "values must not be null");
        checkArgument(values.length > 0, "empty window");
        checkArgument(anomalyScore >= 0 && Double.isFinite(anomalyScore), "anomaly score must be finite and non negative");
        int width = schema.getWidth();
        for (double[] row : values) {
            checkArgument(row.length == width, "incorrect width");
        }

        double[] dispersion = new double[width];
        double total = dispersions(values, dispersion);
        if (!Double.isFinite(total)) {
            // deviation is homogeneous, so shares survive dividing by the largest magnitude
            double scale = 0;
            for (double[] row : values) {
                for (double value : row) {
                    scale = Math.max(scale, Math.abs(value));
                }
            }
            if (scale > 0 && Double.isFinite(scale)) {
                double[][] scaled = new double[values.length][];
                for (int r = 0; r < values.length; r++) {
                    scaled[r] = new double[width];
                    for (int c = 0; c < width; c++) {
                        scaled[r][c] = values[r][c] / scale;
                    }
                }
                total = dispersions(scaled, dispersion);
            }
        }

        double[] weights = new double[width];
        if (!(total > 0) || !Double.isFinite(total)) {
            for (int i = 0; i < width; i++) {
                weights[i] = 1.0 / width;
            }
        } else {
            double scaledTotal = 0;
            for (int i = 0; i < width; i++) {
                weights[i] = dispersion[i] / total * anomalyScore;
                scaledTotal += weights[i];
            }
            for (int i = 0; i < width; i++) {
                weights[i] = (scaledTotal > 0) ? weights[i] / scaledTotal : dispersion[i] / total;
            }
        }

        List<FeatureImportance.Entry> entries = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            entries.add(new FeatureImportance.Entry(schema.getName(i), i, weights[i]));
        }
        return new FeatureImportance(entries, anomalyScore);
    }

    private static double dispersions(double[][] values, double[] dispersion) {
        double total = 0;
        for (int i = 0; i < dispersion.length; i++) {
            dispersion[i] = columnMeanAndDeviation(values, i)[1];
            total += dispersion[i];
        }
        return total;
    }

    /**
     * @param importance the weights of a window
     * @param k          the number of entries wanted
     * @return exactly min(k, number of features) entries, heaviest first, ties in
     *         feature order
     */
    public static List<FeatureImportance.Entry> getTopFeatures(FeatureImportance importance, int k) {
        checkNotNull(importance, "importance must not be null");
        checkArgument(k >= 0, "k cannot be negative");
        List<FeatureImportance.Entry> entries = importance.getEntries();
        return new ArrayList<>(entries.subList(0, Math.min(k, entries.size())));
    }
}
