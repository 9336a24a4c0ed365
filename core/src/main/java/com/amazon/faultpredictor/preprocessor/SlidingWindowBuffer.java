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
import static com.amazon.faultpredictor.CommonUtils.checkState;

import com.amazon.faultpredictor.inputtypes.FeatureSchema;
import com.amazon.faultpredictor.inputtypes.SensorWindow;

/**
 * Accumulates streamed readings in a ring buffer and materializes the most
 * recent {@code windowLength} of them as a {@link SensorWindow}. Not thread
 * safe; one buffer per stream.
 */
public class SlidingWindowBuffer {

    private final FeatureSchema schema;

    /**
     * Number of timesteps in a window.
     */
    private final int windowLength;

    /**
     * Recently added readings, oldest at {@code nextIndex} once full.
     */
    private final double[][] recentPoints;

    private final long[] recentTimestamps;

    /**
     * The index where the next reading will be copied to.
     */
    private int nextIndex;

    /**
     * A flag indicating whether the buffer has been completely filled once.
     */
    private boolean full;

    public SlidingWindowBuffer(FeatureSchema schema, int windowLength) {
        this.schema = checkNotNull(schema, "schema must not be null");
        checkArgument(windowLength > 0, "windowLength must be greater than 0");
        this.windowLength = windowLength;
        recentPoints = new double[windowLength][schema.getWidth()];
        recentTimestamps = new long[windowLength];
        nextIndex = 0;
        full = false;
    }

    public boolean isFull() {
        return full;
    }

    public int getWindowLength() {
        return windowLength;
    }

    public void addPoint(double[] point) {
        addPoint(point, 0L);
    }

    public void addPoint(double[] point, long timestamp) {
        checkNotNull(point, "point must not be null");
        checkArgument(point.length == schema.getWidth(),
                String.format("point.length must equal %d", schema.getWidth()));
        System.arraycopy(point, 0, recentPoints[nextIndex], 0, point.length);
        recentTimestamps[nextIndex] = timestamp;

        nextIndex = (nextIndex + 1) % windowLength;
        if (!full && nextIndex == 0) {
            full = true;
        }
    }

    /**
     * @return the latest full window, oldest reading first
     * @throws IllegalStateException if fewer than windowLength readings were added
     */
    public SensorWindow getWindow() {
        checkState(full, "window is not yet full");
        double[][] values = new double[windowLength][];
        long[] timestamps = new long[windowLength];
        for (int i = 0; i < windowLength; i++) {
            int index = (nextIndex + i) % windowLength;
            values[i] = recentPoints[index];
            timestamps[i] = recentTimestamps[index];
        }
        boolean ordered = true;
        for (int i = 1; i < windowLength && ordered; i++) {
            ordered = timestamps[i - 1] <= timestamps[i];
        }
        return new SensorWindow(schema, values, ordered ? timestamps : null);
    }
}
