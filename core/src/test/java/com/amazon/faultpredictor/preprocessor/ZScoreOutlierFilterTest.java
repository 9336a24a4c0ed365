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
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ZScoreOutlierFilterTest {

    private double[][] values;

    @BeforeEach
    public void setUp() {
        values = new double[100][];
        for (int i = 0; i < 100; i++) {
            values[i] = new double[] { Math.sin(0.3 * i), Math.cos(0.3 * i), 1.0 };
        }
        values[42][1] = 100.0;
    }

    @Test
    public void testSpikeIsFlagged() {
        boolean[] outliers = new ZScoreOutlierFilter().detectOutliers(values);
        for (int i = 0; i < values.length; i++) {
            if (i == 42) {
                assertTrue(outliers[i]);
            } else {
                assertFalse(outliers[i], "row " + i);
            }
        }
    }

    @Test
    public void testRemoveOutliers() {
        double[][] kept = new ZScoreOutlierFilter().removeOutliers(values);
        assertEquals(99, kept.length);
        assertArrayEquals(values[43], kept[42]);
    }

    @Test
    public void testEmptyInput() {
        assertEquals(0, new ZScoreOutlierFilter().detectOutliers(new double[0][]).length);
    }

    @Test
    public void testInvalidThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new ZScoreOutlierFilter(0, 1e-8));
    }
}
