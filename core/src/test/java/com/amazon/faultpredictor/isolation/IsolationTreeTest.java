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

package com.amazon.faultpredictor.isolation;

import static com.amazon.faultpredictor.CommonUtils.averagePathLength;
import static com.amazon.faultpredictor.isolation.IsolationTree.NULL;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

public class IsolationTreeTest {

    @Test
    public void testPathLength() {
        // root splits at 0.5; one point on the left, three on the right
        IsolationTree tree = new IsolationTree(new int[] { 0, NULL, NULL }, new double[] { 0.5, 0, 0 },
                new int[] { 1, NULL, NULL }, new int[] { 2, NULL, NULL }, new int[] { 0, 1, 3 });
        assertEquals(1.0, tree.pathLength(new double[] { 0.0 }));
        assertEquals(1.0 + averagePathLength(3), tree.pathLength(new double[] { 1.0 }), 1e-12);
        assertEquals(1.0 + averagePathLength(3), tree.pathLength(new double[] { 0.5 }), 1e-12);
        assertEquals(3, tree.size());
        assertTrue(tree.isLeaf(2));
    }

    @Test
    public void testBuild() {
        double[][] data = new double[16][];
        for (int i = 0; i < 16; i++) {
            data[i] = new double[] { i, 16 - i };
        }
        IsolationTree tree = IsolationTree.build(data, 4, new Random(17L));
        assertTrue(tree.size() <= 2 * data.length - 1);

        int totalMass = 0;
        int[] leafMass = tree.getLeafMass();
        for (int node = 0; node < tree.size(); node++) {
            if (tree.isLeaf(node)) {
                totalMass += leafMass[node];
            } else {
                assertEquals(0, leafMass[node]);
            }
        }
        assertEquals(16, totalMass);

        for (double[] point : data) {
            double length = tree.pathLength(point);
            assertTrue(length >= 1 && length <= 4 + averagePathLength(16));
        }
    }

    @Test
    public void testDepthLimit() {
        double[][] data = new double[64][];
        for (int i = 0; i < 64; i++) {
            data[i] = new double[] { i };
        }
        IsolationTree tree = IsolationTree.build(data, 0, new Random(1L));
        assertEquals(1, tree.size());
        assertEquals(averagePathLength(64), tree.pathLength(new double[] { 3 }), 1e-12);
    }

    @Test
    public void testConstantDataIsOneLeaf() {
        double[][] data = { { 2, 2 }, { 2, 2 }, { 2, 2 }, { 2, 2 }, { 2, 2 } };
        IsolationTree tree = IsolationTree.build(data, 3, new Random(0L));
        assertEquals(1, tree.size());
        assertEquals(averagePathLength(5), tree.pathLength(new double[] { 100, -100 }), 1e-12);
    }

    @Test
    public void testInvalidStructure() {
        assertThrows(IllegalArgumentException.class, () -> new IsolationTree(new int[] { 0, NULL }, new double[2],
                new int[] { 1, NULL }, new int[] { NULL, NULL }, new int[2]));
        assertThrows(IllegalArgumentException.class, () -> new IsolationTree(new int[] { 0 }, new double[1],
                new int[] { 0 }, new int[] { 0 }, new int[1]));
        // interior node without a cut dimension
        assertThrows(IllegalArgumentException.class, () -> new IsolationTree(new int[] { NULL, NULL, NULL },
                new double[3], new int[] { 1, NULL, NULL }, new int[] { 2, NULL, NULL }, new int[] { 0, 1, 1 }));
        assertThrows(IllegalArgumentException.class, () -> new IsolationTree(new int[] { NULL }, new double[1],
                new int[] { NULL }, new int[] { NULL }, new int[] { -1 }));
    }

    @Test
    public void testRequiredDimensions() {
        IsolationTree leaf = new IsolationTree(new int[] { NULL }, new double[1], new int[] { NULL },
                new int[] { NULL }, new int[] { 4 });
        assertEquals(0, leaf.getRequiredDimensions());

        IsolationTree tree = new IsolationTree(new int[] { 3, 1, NULL, NULL, NULL }, new double[5],
                new int[] { 1, 3, NULL, NULL, NULL }, new int[] { 2, 4, NULL, NULL, NULL }, new int[] { 0, 0, 2, 1, 1 });
        assertEquals(4, tree.getRequiredDimensions());
    }
}
