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

package com.amazon.faultpredictor.state.isolation;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

import com.amazon.faultpredictor.isolation.IsolationForest;
import com.amazon.faultpredictor.isolation.IsolationTree;
import com.amazon.faultpredictor.testutils.SensorWindowTestData;

public class IsolationForestMapperTest {

    @Test
    public void testTreeRoundTrip() {
        double[][] data = SensorWindowTestData.standardNormal(32, 3, 5L);
        IsolationTree tree = IsolationTree.build(data, 5, new Random(2L));
        IsolationTreeMapper mapper = new IsolationTreeMapper();
        IsolationTree copy = mapper.toModel(mapper.toState(tree));
        assertArrayEquals(tree.getCutDimension(), copy.getCutDimension());
        assertArrayEquals(tree.getCutValue(), copy.getCutValue());
        assertArrayEquals(tree.getLeftIndex(), copy.getLeftIndex());
        assertArrayEquals(tree.getRightIndex(), copy.getRightIndex());
        assertArrayEquals(tree.getLeafMass(), copy.getLeafMass());
    }

    @Test
    public void testForestRoundTrip() {
        double[][] data = SensorWindowTestData.standardNormal(400, 3, 5L);
        IsolationForest forest = IsolationForest.builder().dimensions(3).numberOfTrees(15).contamination(0.05)
                .randomSeed(21L).build().fit(data);
        IsolationForestMapper mapper = new IsolationForestMapper();
        IsolationForestState state = mapper.toState(forest);
        assertEquals(15, state.getTreeStates().size());

        IsolationForest copy = mapper.toModel(state);
        assertTrue(copy.isTrained());
        assertEquals(forest.getOffset(), copy.getOffset());
        assertEquals(forest.getSampleSize(), copy.getSampleSize());
        assertEquals(forest.getContamination(), copy.getContamination());
        assertArrayEquals(forest.detect(data).getRawScores(), copy.detect(data).getRawScores());
        assertArrayEquals(forest.detect(data).getLabels(), copy.detect(data).getLabels());
    }

    @Test
    public void testUntrainedRoundTrip() {
        IsolationForest forest = IsolationForest.builder().dimensions(3).numberOfTrees(15).randomSeed(21L).build();
        IsolationForestMapper mapper = new IsolationForestMapper();
        IsolationForestState state = mapper.toState(forest);
        assertTrue(state.getTreeStates().isEmpty());
        IsolationForest copy = mapper.toModel(state);
        assertFalse(copy.isTrained());
        assertEquals(15, copy.getNumberOfTrees());
        assertEquals(IsolationForest.UNTRAINED_SCORE, copy.rawScore(new double[3]));
    }
}
