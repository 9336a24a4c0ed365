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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.amazon.faultpredictor.inputtypes.FeatureSchema;
import com.amazon.faultpredictor.inputtypes.SensorWindow;

/**
 * Cuts a multivariate series into overlapping windows.
 */
public class SlidingWindows {

    private SlidingWindows() {
    }

    /**
     * Every contiguous window of the series with stride one; a series of n rows
     * yields n - length + 1 windows.
     *
     * @param schema the schema of the rows
     * @param series rows of the series, oldest first
     * @param length the window length
     * @return the windows, in order of their first row
     */
    public static List<SensorWindow> createSequences(FeatureSchema schema, double[][] series, int length) {
        checkNotNull(series, "series must not be null");
        checkArgument(length > 0, "length must be greater than 0");
        checkArgument(series.length >= length,
                String.format("series of %d rows is shorter than the window length %d", series.length, length));
        List<SensorWindow> windows = new ArrayList<>(series.length - length + 1);
        for (int i = 0; i + length <= series.length; i++) {
            windows.add(new SensorWindow(schema, Arrays.copyOfRange(series, i, i + length)));
        }
        return windows;
    }
}
