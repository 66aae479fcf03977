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
package com.amazon.dualtree.neighbors;

import com.amazon.dualtree.store.PointSet;
import com.amazon.dualtree.traversal.IDualTreeRules;
import com.amazon.dualtree.tree.KdTree;
import com.amazon.dualtree.tree.Node;

/**
 * Rules for exact and relative error k-nearest (or furthest) neighbor search. A
 * reference node is pruned for a query node when its best possible distance
 * does not improve on the relaxed bound of the query node. When the query and
 * reference trees are the same tree a point is never its own neighbor.
 */
public class NeighborSearchRules implements IDualTreeRules {

    private final PointSet queries;

    private final PointSet references;

    private final NeighborTable table;

    private final ISortPolicy sortPolicy;

    private final double relativeError;

    private final boolean monochromatic;

    private final NeighborSearchStat[] statistics;

    private long numberOfDistanceComputations;

    public NeighborSearchRules(KdTree queryTree, KdTree referenceTree, NeighborTable table, ISortPolicy sortPolicy,
            double relativeError) {
        this.queries = queryTree.getPointSet();
        this.references = referenceTree.getPointSet();
        this.table = table;
        this.sortPolicy = sortPolicy;
        this.relativeError = relativeError;
        this.monochromatic = queryTree == referenceTree;
        this.statistics = new NeighborSearchStat[queryTree.getNodeCount()];
        for (int i = 0; i < statistics.length; i++) {
            statistics[i] = new NeighborSearchStat(sortPolicy.getWorstDistance());
        }
    }

    @Override
    public boolean prune(Node queryNode, Node referenceNode) {
        double best = sortPolicy.bestDistance(queryNode.getBoundingBox(), referenceNode.getBoundingBox());
        double bound = sortPolicy.relax(statistics[queryNode.getId()].getBound(), relativeError);
        return !sortPolicy.isBetter(best, bound);
    }

    @Override
    public void baseCase(Node queryNode, Node referenceNode) {
        for (int q = queryNode.getBegin(); q < queryNode.getEnd(); q++) {
            for (int r = referenceNode.getBegin(); r < referenceNode.getEnd(); r++) {
                if (monochromatic && q == r) {
                    continue;
                }
                double distance = Math.sqrt(queries.distanceSquared(q, references, r));
                ++numberOfDistanceComputations;
                table.insert(q, distance, r);
            }
        }
        statistics[queryNode.getId()].setBound(boundOf(queryNode));
    }

    @Override
    public double score(Node queryNode, Node referenceNode) {
        return sortPolicy.score(queryNode.getBoundingBox(), referenceNode.getBoundingBox());
    }

    @Override
    public void combine(Node queryNode) {
        NeighborSearchStat stat = statistics[queryNode.getId()];
        double childBound = sortPolicy.worseOf(statistics[queryNode.getLeftChild().getId()].getBound(),
                statistics[queryNode.getRightChild().getId()].getBound());
        stat.setBound(sortPolicy.betterOf(stat.getBound(), childBound));
    }

    @Override
    public long getNumberOfDistanceComputations() {
        return numberOfDistanceComputations;
    }

    /**
     * @return the worst k-th candidate distance over the points of the node
     */
    double boundOf(Node queryNode) {
        double bound = sortPolicy.getBestDistance();
        for (int q = queryNode.getBegin(); q < queryNode.getEnd(); q++) {
            bound = sortPolicy.worseOf(bound, table.getWorstDistance(q));
        }
        return bound;
    }

    NeighborSearchStat getStatistic(Node node) {
        return statistics[node.getId()];
    }
}
