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

import static com.amazon.faultpredictor.CommonUtils.checkNotNull;
import static com.amazon.faultpredictor.CommonUtils.deepCopy;

import lombok.Getter;

/**
 * The output of {@link WindowPreprocessor#normalize}: the standardized values
 * and the statistics that produced them.
 */
public class NormalizedWindow {

    private final double[][] values;

    @Getter
    private final NormalizationStatistics statistics;

    public NormalizedWindow(double[][] values, NormalizationStatistics statistics) {
        this.values = deepCopy(values);
        this.statistics = checkNotNull(statistics, "statistics must not be null");
    }

    public double[][] getValues() {
        return deepCopy(values);
    }

    public double[] getLastTimestep() {
        return values[values.length - 1].clone();
    }

    public int getLength() {
        return values.length;
    }
}
