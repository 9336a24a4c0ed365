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
import static com.amazon.faultpredictor.CommonUtils.checkArgument;
import static com.amazon.faultpredictor.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Random;

/**
 * A randomized partition tree. Interior nodes split on a uniformly chosen
 * feature at a uniformly chosen value between the minimum and maximum of that
 * feature among the points reaching the node; a node becomes a leaf once it
 * holds at most one point or reaches the depth limit.
 *
 * If we think of an array of node objects as being row-oriented, the tree is
 * stored column-oriented: the arrays below are indexed by node, the root is
 * node 0, and a node is a leaf iff its left child is {@link #NULL}.
 */
public class IsolationTree {

    public static final int NULL = -1;

    private final int[] cutDimension;

    private final double[] cutValue;

    private final int[] leftIndex;

    private final int[] rightIndex;

    // number of training points that reached a leaf; 0 for interior nodes
    private final int[] leafMass;

    public IsolationTree(int[] cutDimension, double[] cutValue, int[] leftIndex, int[] rightIndex, int[] leafMass) {
        checkNotNull(cutDimension, "cutDimension must not be null");
        checkNotNull(cutValue, "cutValue must not be null");
        checkNotNull(leftIndex, "leftIndex must not be null");
        checkNotNull(rightIndex, "rightIndex must not be null");
        checkNotNull(leafMass, "leafMass must not be null");
        int size = cutDimension.length;
        checkArgument(size > 0, "a tree has at least a root");
        checkArgument(cutValue.length == size && leftIndex.length == size && rightIndex.length == size
                && leafMass.length == size, "incorrect lengths");
        for (int i = 0; i < size; i++) {
            checkArgument((leftIndex[i] == NULL) == (rightIndex[i] == NULL), "nodes have zero or two children");
            checkArgument(leftIndex[i] == NULL || (leftIndex[i] > i && leftIndex[i] < size && rightIndex[i] > i
                    && rightIndex[i] < size), "children must follow their parent");
            checkArgument(leftIndex[i] == NULL || cutDimension[i] >= 0, "interior nodes need a cut dimension");
            checkArgument(leafMass[i] >= 0, "leaf mass cannot be negative");
        }
        this.cutDimension = Arrays.copyOf(cutDimension, size);
        this.cutValue = Arrays.copyOf(cutValue, size);
        this.leftIndex = Arrays.copyOf(leftIndex, size);
        this.rightIndex = Arrays.copyOf(rightIndex, size);
        this.leafMass = Arrays.copyOf(leafMass, size);
    }

    /**
     * @param data     the subsample the tree is grown on
     * @param maxDepth depth at which growth stops
     * @param random   source of the random features and cut values
     * @return a new tree
     */
    public static IsolationTree build(double[][] data, int maxDepth, Random random) {
        checkArgument(data.length > 0, "cannot grow a tree on no data");
        checkArgument(maxDepth >= 0, "maxDepth cannot be negative");
        int capacity = 2 * data.length - 1;
        Growth growth = new Growth(capacity);
        int[] indices = new int[data.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        growth.grow(data, indices, 0, indices.length, 0, maxDepth, random);
        return growth.toTree();
    }

    /**
     * @param point a vector
     * @return number of edges from the root to the leaf of the point, plus the
     *         expected remaining depth of the leaf's mass
     */
    public double pathLength(double[] point) {
        int node = 0;
        int depth = 0;
        while (leftIndex[node] != NULL) {
            node = (point[cutDimension[node]] < cutValue[node]) ? leftIndex[node] : rightIndex[node];
            ++depth;
        }
        return depth + averagePathLength(leafMass[node]);
    }

    /**
     * @return one more than the largest cut dimension, the smallest width of a
     *         vector this tree can route; 0 for a single leaf
     */
    public int getRequiredDimensions() {
        int required = 0;
        for (int i = 0; i < cutDimension.length; i++) {
            if (leftIndex[i] != NULL) {
                required = Math.max(required, cutDimension[i] + 1);
            }
        }
        return required;
    }

    public int size() {
        return cutDimension.length;
    }

    public boolean isLeaf(int node) {
        return leftIndex[node] == NULL;
    }

    public int[] getCutDimension() {
        return Arrays.copyOf(cutDimension, cutDimension.length);
    }

    public double[] getCutValue() {
        return Arrays.copyOf(cutValue, cutValue.length);
    }

    public int[] getLeftIndex() {
        return Arrays.copyOf(leftIndex, leftIndex.length);
    }

    public int[] getRightIndex() {
        return Arrays.copyOf(rightIndex, rightIndex.length);
    }

    public int[] getLeafMass() {
        return Arrays.copyOf(leafMass, leafMass.length);
    }

    /**
     * mutable buffers used while a tree grows
     */
    private static class Growth {
        final int[] cutDimension;
        final double[] cutValue;
        final int[] leftIndex;
        final int[] rightIndex;
        final int[] leafMass;
        int size;

        Growth(int capacity) {
            cutDimension = new int[capacity];
            cutValue = new double[capacity];
            leftIndex = new int[capacity];
            rightIndex = new int[capacity];
            leafMass = new int[capacity];
            size = 0;
        }

        int newNode() {
            int node = size++;
            cutDimension[node] = NULL;
            leftIndex[node] = NULL;
            rightIndex[node] = NULL;
            return node;
        }

        // grows the subtree over indices[from, to) and returns its root
        int grow(double[][] data, int[] indices, int from, int to, int depth, int maxDepth, Random random) {
            int node = newNode();
            int mass = to - from;
            if (mass <= 1 || depth >= maxDepth) {
                leafMass[node] = mass;
                return node;
            }

            int dimensions = data[indices[from]].length;
            int dimension = NULL;
            double min = 0;
            double max = 0;
            // a constant feature cannot separate anything; try others before giving up
            for (int attempt = 0; attempt < dimensions && dimension == NULL; attempt++) {
                int candidate = random.nextInt(dimensions);
                min = Double.MAX_VALUE;
                max = -Double.MAX_VALUE;
                for (int i = from; i < to; i++) {
                    double value = data[indices[i]][candidate];
                    min = Math.min(min, value);
                    max = Math.max(max, value);
                }
                if (min < max) {
                    dimension = candidate;
                }
            }
            if (dimension == NULL) {
                leafMass[node] = mass;
                return node;
            }

            double value = min + random.nextDouble() * (max - min);
            int split = from;
            for (int i = from; i < to; i++) {
                if (data[indices[i]][dimension] < value) {
                    int swap = indices[split];
                    indices[split] = indices[i];
                    indices[i] = swap;
                    ++split;
                }
            }

            cutDimension[node] = dimension;
            cutValue[node] = value;
            leftIndex[node] = grow(data, indices, from, split, depth + 1, maxDepth, random);
            rightIndex[node] = grow(data, indices, split, to, depth + 1, maxDepth, random);
            return node;
        }

        IsolationTree toTree() {
            return new IsolationTree(Arrays.copyOf(cutDimension, size), Arrays.copyOf(cutValue, size),
                    Arrays.copyOf(leftIndex, size), Arrays.copyOf(rightIndex, size), Arrays.copyOf(leafMass, size));
        }
    }
}
