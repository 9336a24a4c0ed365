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

package com.amazon.faultpredictor.returntypes;

import static com.amazon.faultpredictor.CommonUtils.checkArgument;

import java.util.Arrays;

/**
 * Labels and raw scores for a batch of vectors scored by an isolation ensemble.
 * A label is {@link #ANOMALOUS} or {@link #NORMAL}; raw scores follow the
 * isolation forest convention where lower means more anomalous.
 */
public class IsolationResult {

    public static final int ANOMALOUS = -1;

    public static final int NORMAL = 1;

    private final int[] labels;

    private final double[] rawScores;

    public IsolationResult(int[] labels, double[] rawScores) {
        checkArgument(labels.length == rawScores.length, "one label per score");
        this.labels = Arrays.copyOf(labels, labels.length);
        this.rawScores = Arrays.copyOf(rawScores, rawScores.length);
    }

    public int[] getLabels() {
        return Arrays.copyOf(labels, labels.length);
    }

    public double[] getRawScores() {
        return Arrays.copyOf(rawScores, rawScores.length);
    }

    public int size() {
        return labels.length;
    }

    public boolean isAnomaly(int index) {
        return labels[index] == ANOMALOUS;
    }

    /**
     * @return the fraction of vectors labelled anomalous
     */
    public double getAnomalyFraction() {
        if (labels.length == 0) {
            return 0;
        }
        return (double) Arrays.stream(labels).filter(label -> label == ANOMALOUS).count() / labels.length;
    }
}
