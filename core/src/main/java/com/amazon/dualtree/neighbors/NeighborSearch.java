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

import static com.amazon.dualtree.CommonUtils.checkArgument;
import static com.amazon.dualtree.CommonUtils.checkNotNull;
import static com.amazon.dualtree.CommonUtils.checkRelativeError;

import java.util.Optional;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.dualtree.returntypes.NeighborSearchResult;
import com.amazon.dualtree.sampler.RankApproximationSampler;
import com.amazon.dualtree.store.PointSet;
import com.amazon.dualtree.traversal.DualTreeTraverser;
import com.amazon.dualtree.traversal.TraversalInfo;
import com.amazon.dualtree.tree.KdTree;
import com.amazon.dualtree.tree.Permutation;

/**
 * All k-nearest (or furthest) neighbor search between a query tree and a
 * reference tree. If no query tree is given, the reference tree is used for
 * both roles and a point is never reported as its own neighbor.
 *
 * <pre>
 * KdTree tree = TreeBuilder.builder().leafSize(10).build().build(new PointSet(data));
 * NeighborSearchResult result = NeighborSearch.builder().referenceTree(tree).build().search(5, 0.0);
 * </pre>
 *
 * Results are reported in the order in which the points were supplied to the
 * trees.
 */
public class NeighborSearch {

    private static final Logger log = LoggerFactory.getLogger(NeighborSearch.class);

    /**
     * Default failure probability of rank approximate search.
     */
    public static final double DEFAULT_ALPHA = 0.05;

    /**
     * Default largest sample size for which a reference node is sampled rather
     * than expanded.
     */
    public static final int DEFAULT_SAMPLE_LIMIT = 20;

    private final KdTree referenceTree;

    private final KdTree queryTree;

    private final ISortPolicy sortPolicy;

    private final Random random;

    protected NeighborSearch(Builder<?> builder) {
        checkNotNull(builder.referenceTree, "referenceTree must not be null");
        checkNotNull(builder.sortPolicy, "sortPolicy must not be null");
        referenceTree = builder.referenceTree;
        queryTree = builder.queryTree.orElse(referenceTree);
        checkArgument(queryTree.getPointSet().getDimensions() == referenceTree.getPointSet().getDimensions(),
                "query and reference points must have the same dimension");
        sortPolicy = builder.sortPolicy;
        random = builder.getRandom();
    }

    /**
     * @return a new NeighborSearch builder.
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    public boolean isMonochromatic() {
        return queryTree == referenceTree;
    }

    /**
     * Find the {@code k} best neighbors of every query point. With a relative
     * error {@code e > 0}, a reported nearest neighbor distance at any rank is at
     * most {@code (1 + e)} times the true distance at that rank; for furthest
     * neighbors, at least the true distance divided by {@code (1 + e)}.
     *
     * @param k             the number of neighbors
     * @param relativeError tolerated relative error, in {@code [0, 1)}
     * @return the neighbors
     */
    public NeighborSearchResult search(int k, double relativeError) {
        checkK(k);
        checkRelativeError(relativeError);

        NeighborTable table = new NeighborTable(queryTree.size(), k, sortPolicy);
        NeighborSearchRules rules = new NeighborSearchRules(queryTree, referenceTree, table, sortPolicy,
                relativeError);
        TraversalInfo info = new DualTreeTraverser(rules).traverse(queryTree.getRoot(), referenceTree.getRoot());
        log.debug("neighbor search k={} relativeError={}: {}", k, relativeError, info);
        return toResult(table, info, info.getNumberOfDistanceComputations(), 0);
    }

    /**
     * Find, for every query point, {@code k} neighbors that with probability at
     * least {@code 1 - alpha} are each among the best
     * {@code floor(rankTolerancePercent * N / 100) + 1} of the {@code N}
     * reference points. Only nearest neighbor search is supported.
     *
     * @param k                    the number of neighbors
     * @param rankTolerancePercent rank tolerance as a percentage of the reference
     *                             set, in {@code (0, 100)}
     * @param alpha                failure probability, in {@code (0, 1)}
     * @param sampleLimit          reference nodes needing at most this many
     *                             samples are sampled instead of expanded
     * @return the neighbors
     */
    public NeighborSearchResult searchApproximate(int k, double rankTolerancePercent, double alpha, int sampleLimit) {
        if (!(sortPolicy instanceof NearestNeighborSort)) {
            throw new UnsupportedOperationException("rank approximation is only supported for nearest neighbors");
        }
        checkK(k);
        checkArgument(rankTolerancePercent > 0 && rankTolerancePercent < 100,
                "rank tolerance must be in (0, 100) percent");
        checkArgument(alpha > 0 && alpha < 1, "alpha must be in (0, 1)");
        checkArgument(sampleLimit > 0, "sampleLimit must be greater than 0");

        int referenceSize = referenceTree.size();
        int rank = (int) (rankTolerancePercent * referenceSize / 100.0);
        checkArgument(rank < referenceSize, "rank tolerance must be smaller than the reference set");

        RankApproximationSampler sampler = new RankApproximationSampler(rank, alpha);
        int[] sampleSizes = sampler.sampleSizeTable(referenceSize);
        long minimumSamples = minimumSamples(sampler, sampleSizes, referenceSize);
        log.debug("rank approximation: rank {} of {} with alpha {}, {} samples per query", rank, referenceSize,
                alpha, minimumSamples);

        NeighborTable table = new NeighborTable(queryTree.size(), k, sortPolicy);
        RankApproximateRules rules = new RankApproximateRules(queryTree, referenceTree, table, sampleSizes,
                minimumSamples, sampleLimit, random);
        TraversalInfo info = new DualTreeTraverser(rules).traverse(queryTree.getRoot(), referenceTree.getRoot());
        return toResult(table, info, info.getNumberOfDistanceComputations(), rules.getNumberOfSamples());
    }

    /**
     * The number of reference points every query has to examine. The table entry
     * for the whole set rounds the sampling ratio down and may fall short of the
     * minimum sample size of the set, so the larger of the two is used.
     */
    static long minimumSamples(RankApproximationSampler sampler, int[] sampleSizes, int referenceSize) {
        return Math.max(sampleSizes[referenceSize], sampler.minimumSampleSize(referenceSize));
    }

    public NeighborSearchResult searchApproximate(int k, double rankTolerancePercent) {
        return searchApproximate(k, rankTolerancePercent, DEFAULT_ALPHA, DEFAULT_SAMPLE_LIMIT);
    }

    /**
     * Compare every query point with every reference point.
     *
     * @param k the number of neighbors
     * @return the exact neighbors
     */
    public NeighborSearchResult searchNaive(int k) {
        checkK(k);
        PointSet queries = queryTree.getPointSet();
        PointSet references = referenceTree.getPointSet();
        boolean monochromatic = isMonochromatic();
        NeighborTable table = new NeighborTable(queries.size(), k, sortPolicy);
        long distanceComputations = 0;
        for (int q = 0; q < queries.size(); q++) {
            for (int r = 0; r < references.size(); r++) {
                if (monochromatic && q == r) {
                    continue;
                }
                table.insert(q, Math.sqrt(queries.distanceSquared(q, references, r)), r);
                ++distanceComputations;
            }
        }
        return toResult(table, null, distanceComputations, 0);
    }

    private void checkK(int k) {
        checkArgument(k > 0, "k must be greater than 0");
        int candidates = isMonochromatic() ? referenceTree.size() - 1 : referenceTree.size();
        checkArgument(k <= candidates, () -> "k must be at most the number of candidates, " + candidates);
    }

    private NeighborSearchResult toResult(NeighborTable table, TraversalInfo info, long distanceComputations,
            long samples) {
        Permutation queryPermutation = queryTree.getPermutation();
        Permutation referencePermutation = referenceTree.getPermutation();
        int k = table.getK();
        int[][] neighbors = new int[table.getNumberOfQueries()][k];
        double[][] distances = new double[table.getNumberOfQueries()][k];
        int[] row = new int[k];
        for (int q = 0; q < table.getNumberOfQueries(); q++) {
            int original = queryPermutation.getOldFromNew(q);
            for (int i = 0; i < k; i++) {
                row[i] = table.getIndex(q, i);
                distances[original][i] = table.getDistance(q, i);
            }
            neighbors[original] = referencePermutation.toOriginalIndices(row);
        }
        return NeighborSearchResult.builder().neighbors(neighbors).distances(distances)
                .numberOfDistanceComputations(distanceComputations).numberOfSamples(samples).traversalInfo(info)
                .build();
    }

    public static class Builder<T extends Builder<T>> {

        private KdTree referenceTree;
        private Optional<KdTree> queryTree = Optional.empty();
        private ISortPolicy sortPolicy = new NearestNeighborSort();
        private Optional<Long> randomSeed = Optional.empty();

        public T referenceTree(KdTree referenceTree) {
            this.referenceTree = referenceTree;
            return (T) this;
        }

        public T queryTree(KdTree queryTree) {
            this.queryTree = Optional.ofNullable(queryTree);
            return (T) this;
        }

        public T sortPolicy(ISortPolicy sortPolicy) {
            this.sortPolicy = sortPolicy;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public NeighborSearch build() {
            return new NeighborSearch(this);
        }

        public Random getRandom() {
            // If a random seed was given, use it to create a new Random. Otherwise, call
            // the 0-argument constructor
            return randomSeed.map(Random::new).orElseGet(Random::new);
        }
    }
}
