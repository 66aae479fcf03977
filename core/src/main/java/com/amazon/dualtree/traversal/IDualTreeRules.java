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
package com.amazon.dualtree.traversal;

import com.amazon.dualtree.tree.Node;

/**
 * The algorithm specific part of a dual-tree computation. A
 * {@link DualTreeTraverser} walks pairs of query and reference nodes and
 * consults the rules to decide whether a pair can be pruned, how to evaluate a
 * pair of leaves, and in which order to explore the children of a reference
 * node. Per-node statistics live inside the rules.
 */
public interface IDualTreeRules {

    /**
     * Decide whether the contribution of the reference node to every point of
     * the query node can be accounted for without further recursion. If so the
     * rules record that contribution in the statistic of the query node before
     * returning true.
     *
     * @param queryNode     a query node
     * @param referenceNode a reference node
     * @return true if the pair needs no further work
     */
    boolean prune(Node queryNode, Node referenceNode);

    /**
     * Evaluate all pairs of points between two leaves and tighten the statistic
     * of the query node.
     *
     * @param queryNode     a query leaf
     * @param referenceNode a reference leaf
     */
    void baseCase(Node queryNode, Node referenceNode);

    /**
     * A priority for visiting the reference node on behalf of the query node.
     * Among the two children of a reference node, the one with the smaller score
     * is visited first.
     *
     * @param queryNode     a query node
     * @param referenceNode a reference node
     * @return the score, smaller is more promising
     */
    double score(Node queryNode, Node referenceNode);

    /**
     * Called before the children of an internal query node are visited. Rules
     * that postpone contributions push them to the children here.
     *
     * @param queryNode an internal query node
     */
    default void descend(Node queryNode) {
    }

    /**
     * Called after the children of an internal query node have been visited, to
     * rebuild the statistic of the node from those of its children.
     *
     * @param queryNode an internal query node
     */
    default void combine(Node queryNode) {
    }

    /**
     * @return the number of point to point distances evaluated so far
     */
    long getNumberOfDistanceComputations();
}
