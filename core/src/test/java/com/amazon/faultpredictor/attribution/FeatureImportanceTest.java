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

package com.amazon.faultpredictor.attribution;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

public class FeatureImportanceTest {

    @Test
    public void testOrdering() {
        FeatureImportance importance = new FeatureImportance(
                Arrays.asList(new FeatureImportance.Entry("c", 2, 0.25), new FeatureImportance.Entry("a", 0, 0.25),
                        new FeatureImportance.Entry("b", 1, 0.5)),
                1.0);
        assertEquals(Arrays.asList("b", "a", "c"), Arrays.asList(importance.asMap().keySet().toArray()));
    }

    @Test
    public void testTopOfZeroWeights() {
        FeatureImportance importance = new FeatureImportance(
                Arrays.asList(new FeatureImportance.Entry("a", 0, 1.0), new FeatureImportance.Entry("b", 1, 0),
                        new FeatureImportance.Entry("c", 2, 0)),
                1.0);
        FeatureImportance tail = new FeatureImportance(importance.getEntries().subList(1, 3), 1.0).top(2);
        assertEquals(0.5, tail.getWeight("b"));
        assertEquals(0.5, tail.getWeight("c"));
    }

    @Test
    public void testEmpty() {
        FeatureImportance importance = new FeatureImportance(Collections.emptyList(), 0.3);
        assertFalse(importance.getTopFeature().isPresent());
        assertEquals(0, importance.top(3).size());
    }

    @Test
    public void testNegativeWeightsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new FeatureImportance(Arrays.asList(new FeatureImportance.Entry("a", 0, -0.1)), 1.0));
    }
}
