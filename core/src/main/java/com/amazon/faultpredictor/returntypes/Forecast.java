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
import static com.amazon.faultpredictor.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.Getter;

/**
 * A point forecast read from the reconstruction of the last timestep, with a
 * confidence derived from the reconstruction error of the whole window.
 */
public class Forecast {

    private final double[] values;

    // in [0,1], 1 - reconstruction error clamped
    @Getter
    private final double confidence;

    @Getter
    private final int horizon;

    public Forecast(double[] values, double confidence, int horizon) {
        checkNotNull(values, "values must not be null");
        checkArgument(confidence >= 0 && confidence <= 1, "confidence must be in [0,1]");
        this.values = Arrays.copyOf(values, values.length);
        this.confidence = confidence;
        this.horizon = horizon;
    }

    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }

    /**
     * @return the mean of the forecast vector, reported as the predicted value
     */
    public double getMeanValue() {
        return Arrays.stream(values).average().orElse(0);
    }
}
