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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.amazon.faultpredictor.inputtypes.FeatureSchema;
import com.amazon.faultpredictor.inputtypes.SensorWindow;

public class SlidingWindowBufferTest {

    @Test
    public void testWindowKeepsLatestRowsInOrder() {
        SlidingWindowBuffer buffer = new SlidingWindowBuffer(FeatureSchema.ofWidth(2), 3);
        buffer.addPoint(new double[] { 1, 1 }, 100L);
        buffer.addPoint(new double[] { 2, 2 }, 200L);
        assertFalse(buffer.isFull());
        assertThrows(IllegalStateException.class, buffer::getWindow);

        buffer.addPoint(new double[] { 3, 3 }, 300L);
        assertTrue(buffer.isFull());
        buffer.addPoint(new double[] { 4, 4 }, 400L);

        SensorWindow window = buffer.getWindow();
        assertArrayEquals(new double[] { 2, 2 }, window.getTimestep(0));
        assertArrayEquals(new double[] { 4, 4 }, window.getLastTimestep());
        assertArrayEquals(new long[] { 200L, 300L, 400L }, window.getTimestamps());
    }

    @Test
    public void testOutOfOrderTimestampsAreDropped() {
        SlidingWindowBuffer buffer = new SlidingWindowBuffer(FeatureSchema.ofWidth(1), 2);
        buffer.addPoint(new double[] { 1 }, 500L);
        buffer.addPoint(new double[] { 2 }, 100L);
        assertNull(buffer.getWindow().getTimestamps());
    }

    @Test
    public void testWidthIsChecked() {
        SlidingWindowBuffer buffer = new SlidingWindowBuffer(FeatureSchema.ofWidth(2), 2);
        assertThrows(IllegalArgumentException.class, () -> buffer.addPoint(new double[] { 1 }));
    }
}
