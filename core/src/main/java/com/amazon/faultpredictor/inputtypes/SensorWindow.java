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

package com.amazon.faultpredictor.inputtypes;

import static com.amazon.faultpredictor.CommonUtils.checkArgument;
import static com.amazon.faultpredictor.CommonUtils.checkNotNull;
import static com.amazon.faultpredictor.CommonUtils.deepCopy;

import java.util.Arrays;

import lombok.Getter;

/**
 * An ordered sequence of timesteps, each a vector of readings laid out according
 * to a {@link FeatureSchema}. The rows are copied on construction and on every
 * read, so a window can be shared across threads.
 */
public class SensorWindow {

    @Getter
    private final FeatureSchema schema;

    private final double[][] values;

    // optional, epoch milliseconds of each timestep
    private final long[] timestamps;

    public SensorWindow(FeatureSchema schema, double[][] values) {
        this(schema, values, null);
    }

    public SensorWindow(FeatureSchema schema, double[][] values, long[] timestamps) {
        this.schema = checkNotNull(schema, "schema must not be null");
        checkNotNull(values, "values must not be null");
        for (int i = 0; i < values.length; i++) {
            checkNotNull(values[i], "timestep " + i + " is null");
        }
        if (timestamps != null) {
            checkArgument(timestamps.length == values.length, "one timestamp per timestep is required");
            for (int i = 1; i < timestamps.length; i++) {
                checkArgument(timestamps[i - 1] <= timestamps[i], "timestamps must be non-decreasing");
            }
        }
        this.values = deepCopy(values);
        this.timestamps = (timestamps == null) ? null : Arrays.copyOf(timestamps, timestamps.length);
    }

    /**
     * convenience constructor for unnamed data
     *
     * @param values rows of the window, all of the same width
     * @return a window over a generic schema of the width of the first row
     */
    public static SensorWindow of(double[][] values) {
        checkArgument(values != null && values.length > 0, "at least one timestep is required");
        return new SensorWindow(FeatureSchema.ofWidth(values[0].length), values);
    }

    public int getLength() {
        return values.length;
    }

    public int getWidth() {
        return schema.getWidth();
    }

    public double[][] getValues() {
        return deepCopy(values);
    }

    public double[] getTimestep(int index) {
        return values[index].clone();
    }

    public double[] getLastTimestep() {
        checkArgument(values.length > 0, "empty window");
        return values[values.length - 1].clone();
    }

    public boolean hasTimestamps() {
        return timestamps != null;
    }

    public long[] getTimestamps() {
        return (timestamps == null) ? null : Arrays.copyOf(timestamps, timestamps.length);
    }
}
