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
import static com.amazon.faultpredictor.CommonUtils.clamp;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An interval around a probability whose half width shrinks as the forecast
 * confidence grows. Both ends are clamped to [0,1].
 */
@Getter
@ToString
@EqualsAndHashCode
public class ConfidenceInterval {

    public static final double DEFAULT_MARGIN_COEFFICIENT = 0.1;

    private final double lower;

    private final double upper;

    public ConfidenceInterval(double lower, double upper) {
        checkArgument(lower <= upper, "lower end exceeds upper end");
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * margin = (1 - forecastConfidence) * coefficient; the interval is [p -
     * margin, p + margin] clamped to [0,1]
     *
     * @param probability        the fused probability, in [0,1]
     * @param forecastConfidence the confidence of the reconstruction forecast, in
     *                           [0,1]
     * @param coefficient        non-negative scale of the margin
     * @return the interval, always containing the probability
     */
    public static ConfidenceInterval around(double probability, double forecastConfidence, double coefficient) {
        checkArgument(probability >= 0 && probability <= 1, "probability must be in [0,1]");
        checkArgument(coefficient >= 0, "coefficient cannot be negative");
        double margin = (1 - clamp(forecastConfidence, 0, 1)) * coefficient;
        return new ConfidenceInterval(clamp(probability - margin, 0, 1), clamp(probability + margin, 0, 1));
    }

    public double getWidth() {
        return upper - lower;
    }

    public boolean contains(double value) {
        return lower <= value && value <= upper;
    }
}
