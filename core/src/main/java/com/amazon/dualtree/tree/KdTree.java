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
package com.amazon.dualtree.tree;

import com.amazon.dualtree.config.SplitMethod;
import com.amazon.dualtree.store.PointSet;

/**
 * A kd-tree over a point set which has been reordered so that every node
 * covers a contiguous range of it. Instances are created by
 * {@link TreeBuilder#build(PointSet)}. The structure is immutable once built;
 * algorithms attach their own per-node statistics by node id.
 */
public class KdTree {

    private final PointSet points;

    private final Node root;

    private final Node[] nodes;

    private final Permutation permutation;

    private final int leafSize;

    private final SplitMethod splitMethod;

    private final int depth;

    KdTree(PointSet points, Node root, Node[] nodes, Permutation permutation, int leafSize, SplitMethod splitMethod,
            int depth) {
        this.points = points;
        this.root = root;
        this.nodes = nodes;
        this.permutation = permutation;
        this.leafSize = leafSize;
        this.splitMethod = splitMethod;
        this.depth = depth;
    }

    /**
     * @return the point set, in the order produced by the build
     */
    public PointSet getPointSet() {
        return points;
    }

    public Node getRoot() {
        return root;
    }

    /**
     * @param id a node id in {@code [0, getNodeCount())}
     * @return the node with the given preorder id
     */
    public Node getNode(int id) {
        return nodes[id];
    }

    public int getNodeCount() {
        return nodes.length;
    }

    public int size() {
        return points.size();
    }

    public Permutation getPermutation() {
        return permutation;
    }

    public int getLeafSize() {
        return leafSize;
    }

    public SplitMethod getSplitMethod() {
        return splitMethod;
    }

    /**
     * @return the number of edges on the longest root to leaf path
     */
    public int getDepth() {
        return depth;
    }
}
