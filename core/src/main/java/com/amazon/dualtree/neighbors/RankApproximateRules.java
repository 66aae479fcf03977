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

import java.util.Random;

import com.amazon.dualtree.store.PointSet;
import com.amazon.dualtree.traversal.IDualTreeRules;
import com.amazon.dualtree.tree.KdTree;
import com.amazon.dualtree.tree.Node;

/**
 * Rules for rank approximate nearest neighbor search. Every query node counts
 * the reference points it has examined, where a pruned reference node counts in
 * full since none of its points could improve the result. Reference nodes small
 * enough to be sampled cheaply, and reference nodes met by query nodes that are
 * close to their sample quota, are sampled uniformly with replacement instead of
 * being expanded. Once a query node has reached the quota, all further
 * reference nodes are skipped.
 */
public class RankApproximateRules implements IDualTreeRules {

    private final PointSet queries;

    private final PointSet references;

    private final NeighborTable table;

    private final ISortPolicy sortPolicy;

    private final boolean monochromatic;

    private final int[] sampleSizes;

    private final long minimumSamples;

    private final int sampleLimit;

    private final Random random;

    private final NeighborSearchStat[] statistics;

    private long numberOfDistanceComputations;

    private long numberOfSamples;

    /**
     * @param queryTree      the query tree
     * @param referenceTree  the reference tree, possibly the query tree
     * @param table          the result table
     * @param sampleSizes    sample size for every reference set size
     * @param minimumSamples the number of reference points each query has to
     *                       examine
     * @param sampleLimit    reference nodes whose sample size is at most this
     *                       value are sampled
     * @param random         source of the samples
     */
    public RankApproximateRules(KdTree queryTree, KdTree referenceTree, NeighborTable table, int[] sampleSizes,
            long minimumSamples, int sampleLimit, Random random) {
        this.queries = queryTree.getPointSet();
        this.references = referenceTree.getPointSet();
        this.table = table;
        this.sortPolicy = new NearestNeighborSort();
        this.monochromatic = queryTree == referenceTree;
        this.sampleSizes = sampleSizes;
        this.minimumSamples = minimumSamples;
        this.sampleLimit = sampleLimit;
        this.random = random;
        this.statistics = new NeighborSearchStat[queryTree.getNodeCount()];
        for (int i = 0; i < statistics.length; i++) {
            statistics[i] = new NeighborSearchStat(sortPolicy.getWorstDistance());
        }
    }

    @Override
    public boolean prune(Node queryNode, Node referenceNode) {
        NeighborSearchStat stat = statistics[queryNode.getId()];
        boolean postpone = !queryNode.isLeaf();

        if (stat.getSamples() >= minimumSamples) {
            return true;
        }

        double best = sortPolicy.bestDistance(queryNode.getBoundingBox(), referenceNode.getBoundingBox());
        if (!sortPolicy.isBetter(best, stat.getBound())) {
            stat.addSamples(referenceNode.getCount(), postpone);
            return true;
        }

        if (!referenceNode.isLeaf() && (sampleSizes[referenceNode.getCount()] <= sampleLimit
                || stat.getSamples() + sampleLimit >= minimumSamples)) {
            sample(queryNode, referenceNode);
            return true;
        }
        return false;
    }

    @Override
    public void baseCase(Node queryNode, Node referenceNode) {
        for (int q = queryNode.getBegin(); q < queryNode.getEnd(); q++) {
            for (int r = referenceNode.getBegin(); r < referenceNode.getEnd(); r++) {
                if (monochromatic && q == r) {
                    continue;
                }
                evaluate(q, r);
            }
        }
        NeighborSearchStat stat = statistics[queryNode.getId()];
        stat.setBound(boundOf(queryNode));
        stat.addSamples(referenceNode.getCount(), false);
    }

    void sample(Node queryNode, Node referenceNode) {
        NeighborSearchStat stat = statistics[queryNode.getId()];
        int setSize = referenceNode.getCount();
        long remaining = minimumSamples - stat.getSamples();
        int sampleSize = (int) Math.max(1, Math.min(sampleSizes[setSize], remaining));

        for (int q = queryNode.getBegin(); q < queryNode.getEnd(); q++) {
            for (int i = 0; i < sampleSize; i++) {
                int r = referenceNode.getBegin() + random.nextInt(setSize);
                if (monochromatic && q == r) {
                    continue;
                }
                evaluate(q, r);
            }
        }
        numberOfSamples += (long) sampleSize * queryNode.getCount();
        stat.setBound(boundOf(queryNode));
        stat.addSamples(sampleSize, !queryNode.isLeaf());
    }

    private void evaluate(int query, int reference) {
        double distance = Math.sqrt(queries.distanceSquared(query, references, reference));
        ++numberOfDistanceComputations;
        table.insert(query, distance, reference);
    }

    @Override
    public double score(Node queryNode, Node referenceNode) {
        return sortPolicy.score(queryNode.getBoundingBox(), referenceNode.getBoundingBox());
    }

    @Override
    public void descend(Node queryNode) {
        NeighborSearchStat stat = statistics[queryNode.getId()];
        long postponed = stat.getPostponedSamples();
        if (postponed == 0) {
            return;
        }
        statistics[queryNode.getLeftChild().getId()].addSamples(postponed, !queryNode.getLeftChild().isLeaf());
        statistics[queryNode.getRightChild().getId()].addSamples(postponed, !queryNode.getRightChild().isLeaf());
        stat.setPostponedSamples(0);
    }

    @Override
    public void combine(Node queryNode) {
        NeighborSearchStat stat = statistics[queryNode.getId()];
        NeighborSearchStat left = statistics[queryNode.getLeftChild().getId()];
        NeighborSearchStat right = statistics[queryNode.getRightChild().getId()];
        double childBound = sortPolicy.worseOf(left.getBound(), right.getBound());
        stat.setBound(sortPolicy.betterOf(stat.getBound(), childBound));
        stat.setSamples(Math.min(left.getSamples(), right.getSamples()));
    }

    @Override
    public long getNumberOfDistanceComputations() {
        return numberOfDistanceComputations;
    }

    /**
     * @return the number of reference points drawn at random, over all queries
     */
    public long getNumberOfSamples() {
        return numberOfSamples;
    }

    private double boundOf(Node queryNode) {
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
