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
package com.amazon.dualtree.kde;

import static com.amazon.dualtree.CommonUtils.checkArgument;
import static com.amazon.dualtree.CommonUtils.checkNotNull;
import static com.amazon.dualtree.CommonUtils.checkRelativeError;

import java.util.Optional;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.dualtree.kernel.IKernel;
import com.amazon.dualtree.returntypes.KernelSumResult;
import com.amazon.dualtree.store.PointSet;
import com.amazon.dualtree.traversal.DualTreeTraverser;
import com.amazon.dualtree.traversal.TraversalInfo;
import com.amazon.dualtree.tree.KdTree;
import com.amazon.dualtree.tree.Permutation;

/**
 * Weighted kernel sums, and kernel density estimates, of a query tree against a
 * reference tree. If no query tree is given the reference tree is used for
 * both roles, and leave-one-out estimates can be requested.
 *
 * With {@code probability == 1} the estimate of every query point is within
 * {@code relativeError} of its true sum. A probability below 1 allows Monte
 * Carlo estimates of reference nodes, each of which holds its share of the
 * error budget with that probability. The lower and upper bounds are exact in
 * both cases.
 */
public class KernelSum {

    private static final Logger log = LoggerFactory.getLogger(KernelSum.class);

    /**
     * Default confidence of the Monte Carlo prune; 1 disables it.
     */
    public static final double DEFAULT_PROBABILITY = 1.0;

    /**
     * Default number of kernel values sampled per query point by the Monte Carlo
     * prune.
     */
    public static final int DEFAULT_MONTE_CARLO_SAMPLE_SIZE = 25;

    public static final boolean DEFAULT_NORMALIZE = true;

    public static final boolean DEFAULT_LEAVE_ONE_OUT = false;

    private final KdTree referenceTree;

    private final KdTree queryTree;

    private final IKernel kernel;

    private final double probability;

    private final int monteCarloSampleSize;

    private final boolean normalize;

    private final boolean leaveOneOut;

    private final Random random;

    protected KernelSum(Builder<?> builder) {
        checkNotNull(builder.referenceTree, "referenceTree must not be null");
        checkNotNull(builder.kernel, "kernel must not be null");
        if (!builder.kernel.isMonotoneDecreasing()) {
            throw new UnsupportedOperationException("kernel sums require a monotone decreasing kernel");
        }
        checkArgument(builder.probability > 0 && builder.probability <= 1, "probability must be in (0, 1]");
        checkArgument(builder.monteCarloSampleSize > 1, "monteCarloSampleSize must be greater than 1");
        referenceTree = builder.referenceTree;
        queryTree = builder.queryTree.orElse(referenceTree);
        checkArgument(queryTree.getPointSet().getDimensions() == referenceTree.getPointSet().getDimensions(),
                "query and reference points must have the same dimension");
        checkArgument(!builder.leaveOneOut || queryTree == referenceTree,
                "leave one out requires the query tree to be the reference tree");
        checkArgument(referenceTree.getPointSet().getTotalWeight() > 0, "total reference weight must be positive");
        kernel = builder.kernel;
        probability = builder.probability;
        monteCarloSampleSize = builder.monteCarloSampleSize;
        normalize = builder.normalize;
        leaveOneOut = builder.leaveOneOut;
        random = builder.getRandom();
    }

    /**
     * @return a new KernelSum builder.
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Compute the kernel sums with the dual-tree algorithm.
     *
     * @param relativeError tolerated relative error, in {@code [0, 1)}
     * @return the sums
     */
    public KernelSumResult compute(double relativeError) {
        checkRelativeError(relativeError);
        KernelSumRules rules = new KernelSumRules(queryTree, referenceTree, kernel, relativeError, probability,
                monteCarloSampleSize, random);
        TraversalInfo info = new DualTreeTraverser(rules).traverse(queryTree.getRoot(), referenceTree.getRoot());
        rules.postProcess(queryTree.getRoot());
        log.debug("kernel sum with {} and relative error {}: {}, {} finite difference and {} Monte Carlo prunes",
                kernel, relativeError, info, rules.getNumberOfFiniteDifferencePrunes(),
                rules.getNumberOfMonteCarloPrunes());

        return toResult(rules.getDensityLower(), rules.getDensityEstimate(), rules.getDensityUpper(), info,
                info.getNumberOfDistanceComputations(), rules.getNumberOfFiniteDifferencePrunes(),
                rules.getNumberOfMonteCarloPrunes());
    }

    /**
     * Compute the kernel sums by evaluating every pair of points.
     *
     * @return the exact sums, with equal lower and upper bounds
     */
    public KernelSumResult computeNaive() {
        PointSet queries = queryTree.getPointSet();
        PointSet references = referenceTree.getPointSet();
        double[] sums = new double[queries.size()];
        for (int q = 0; q < queries.size(); q++) {
            double sum = 0;
            for (int r = 0; r < references.size(); r++) {
                sum += references.getWeight(r) * kernel.evaluate(Math.sqrt(queries.distanceSquared(q, references, r)));
            }
            sums[q] = sum;
        }
        return toResult(sums.clone(), sums.clone(), sums.clone(), null, (long) queries.size() * references.size(), 0,
                0);
    }

    private KernelSumResult toResult(double[] lower, double[] estimate, double[] upper, TraversalInfo info,
            long distanceComputations, long finiteDifferencePrunes, long monteCarloPrunes) {
        PointSet queries = queryTree.getPointSet();
        PointSet references = referenceTree.getPointSet();
        double totalWeight = references.getTotalWeight();
        double normalizationConstant = kernel.getNormalizationConstant(references.getDimensions());

        for (int q = 0; q < queries.size(); q++) {
            double selfWeight = leaveOneOut ? queries.getWeight(q) : 0;
            if (leaveOneOut) {
                lower[q] = Math.max(0, lower[q] - selfWeight);
                estimate[q] -= selfWeight;
                upper[q] -= selfWeight;
            }
            if (normalize) {
                double remainingWeight = totalWeight - selfWeight;
                double factor = (remainingWeight > 0) ? 1.0 / (normalizationConstant * remainingWeight) : 0.0;
                lower[q] *= factor;
                estimate[q] *= factor;
                upper[q] *= factor;
            }
        }

        Permutation permutation = queryTree.getPermutation();
        return KernelSumResult.builder().lower(permutation.toOriginalOrder(lower))
                .estimate(permutation.toOriginalOrder(estimate)).upper(permutation.toOriginalOrder(upper))
                .normalized(normalize).numberOfDistanceComputations(distanceComputations)
                .numberOfFiniteDifferencePrunes(finiteDifferencePrunes).numberOfMonteCarloPrunes(monteCarloPrunes)
                .traversalInfo(info).build();
    }

    public static class Builder<T extends Builder<T>> {

        private KdTree referenceTree;
        private Optional<KdTree> queryTree = Optional.empty();
        private IKernel kernel;
        private double probability = DEFAULT_PROBABILITY;
        private int monteCarloSampleSize = DEFAULT_MONTE_CARLO_SAMPLE_SIZE;
        private boolean normalize = DEFAULT_NORMALIZE;
        private boolean leaveOneOut = DEFAULT_LEAVE_ONE_OUT;
        private Optional<Long> randomSeed = Optional.empty();

        public T referenceTree(KdTree referenceTree) {
            this.referenceTree = referenceTree;
            return (T) this;
        }

        public T queryTree(KdTree queryTree) {
            this.queryTree = Optional.ofNullable(queryTree);
            return (T) this;
        }

        public T kernel(IKernel kernel) {
            this.kernel = kernel;
            return (T) this;
        }

        public T probability(double probability) {
            this.probability = probability;
            return (T) this;
        }

        public T monteCarloSampleSize(int monteCarloSampleSize) {
            this.monteCarloSampleSize = monteCarloSampleSize;
            return (T) this;
        }

        public T normalize(boolean normalize) {
            this.normalize = normalize;
            return (T) this;
        }

        public T leaveOneOut(boolean leaveOneOut) {
            this.leaveOneOut = leaveOneOut;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public KernelSum build() {
            return new KernelSum(this);
        }

        public Random getRandom() {
            // If a random seed was given, use it to create a new Random. Otherwise, call
            // the 0-argument constructor
            return randomSeed.map(Random::new).orElseGet(Random::new);
        }
    }
}
