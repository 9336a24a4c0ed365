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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class ConfidenceIntervalTest {

    @Test
    public void testAround() {
        ConfidenceInterval interval = ConfidenceInterval.around(0.8, 0.5, 0.1);
        assertEquals(0.75, interval.getLower(), 1e-9);
        assertEquals(0.85, interval.getUpper(), 1e-9);
        assertEquals(0.1, interval.getWidth(), 1e-9);
    }

    @Test
    public void testClampedAtZero() {
        ConfidenceInterval interval = ConfidenceInterval.around(0.05, 0.0, 0.1);
        assertEquals(0.0, interval.getLower());
        assertEquals(0.15, interval.getUpper(), 1e-9);
    }

    @Test
    public void testFullConfidenceIsAPoint() {
        ConfidenceInterval interval = ConfidenceInterval.around(0.4, 1.0, 0.1);
        assertEquals(0.4, interval.getLower());
        assertEquals(0.4, interval.getUpper());
    }

    @ParameterizedTest
    @CsvSource({ "0.0, 0.0", "1.0, 0.0", "0.99, 0.3", "0.5, 0.7", "0.02, 0.9" })
    public void testIntervalContainsProbability(double probability, double confidence) {
        ConfidenceInterval interval = ConfidenceInterval.around(probability, confidence,
                ConfidenceInterval.DEFAULT_MARGIN_COEFFICIENT);
        assertTrue(interval.contains(probability));
        assertTrue(0 <= interval.getLower() && interval.getLower() <= interval.getUpper()
                && interval.getUpper() <= 1);
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> ConfidenceInterval.around(1.2, 0.5, 0.1));
        assertThrows(IllegalArgumentException.class, () -> ConfidenceInterval.around(0.5, 0.5, -0.1));
        assertThrows(IllegalArgumentException.class, () -> new ConfidenceInterval(0.6, 0.5));
        assertFalse(new ConfidenceInterval(0.2, 0.3).contains(0.31));
    }
}
