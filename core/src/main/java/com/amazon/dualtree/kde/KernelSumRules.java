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

import java.util.Arrays;
import java.util.Random;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.dualtree.kernel.IKernel;
import com.amazon.dualtree.store.PointSet;
import com.amazon.dualtree.traversal.IDualTreeRules;
import com.amazon.dualtree.tree.KdTree;
import com.amazon.dualtree.tree.Node;

/**
 * Rules for the weighted kernel sum {@code sum_r w_r K(|q - r|)} of every query
 * point. Each query point carries a lower bound, an estimate and an upper bound
 * on its sum. Initially the lower bound is 0 and the upper bound is the total
 * reference weight, since kernel values lie in {@code [0, 1]}.
 *
 * A reference node of weight {@code w} is pruned by finite differences when the
 * kernel varies little between the two boxes: its contribution is replaced by
 * {@code w} times the midpoint of the kernel range, which costs an error of
 * half the range times {@code w}. The prune is taken when that error fits in
 * the remaining budget of the query node,
 *
 * <pre>
 * (relativeError * lower - usedError) / (totalWeight - prunedWeight)
 * </pre>
 *
 * per unit of reference weight. When a probability below 1 is requested and
 * the finite difference test fails, the contribution may instead be estimated
 * from a uniform sample of kernel values whose normal approximation error at
 * that confidence fits the same budget.
 */
public class KernelSumRules implements IDualTreeRules {

    private static final Logger log = LoggerFactory.getLogger(KernelSumRules.class);

    private final PointSet queries;

    private final PointSet references;

    private final IKernel kernel;

    private final double relativeError;

    private final double probability;

    private final int monteCarloSampleSize;

    private final double zScore;

    private final Random random;

    private final double totalWeight;

    private final double[] referenceWeights;

    private final KernelSumStat[] statistics;

    private final double[] densityLower;

    private final double[] densityEstimate;

    private final double[] densityUpper;

    private final double[] usedError;

    private final double[] prunedWeight;

    private long numberOfDistanceComputations;

    private long numberOfFiniteDifferencePrunes;

    private long numberOfMonteCarloPrunes;

    public KernelSumRules(KdTree queryTree, KdTree referenceTree, IKernel kernel, double relativeError,
            double probability, int monteCarloSampleSize, Random random) {
        this.queries = queryTree.getPointSet();
        this.references = referenceTree.getPointSet();
        this.kernel = kernel;
        this.relativeError = relativeError;
        this.probability = probability;
        this.monteCarloSampleSize = monteCarloSampleSize;
        this.random = random;
        this.zScore = (probability < 1) ? new NormalDistribution().inverseCumulativeProbability(0.5 + probability / 2)
                : Double.POSITIVE_INFINITY;
        this.totalWeight = references.getTotalWeight();

        referenceWeights = new double[referenceTree.getNodeCount()];
        for (int i = 0; i < referenceWeights.length; i++) {
            Node node = referenceTree.getNode(i);
            referenceWeights[i] = references.getWeightSum(node.getBegin(), node.getEnd());
        }

        statistics = new KernelSumStat[queryTree.getNodeCount()];
        for (int i = 0; i < statistics.length; i++) {
            statistics[i] = new KernelSumStat(totalWeight);
        }

        int n = queries.size();
        densityLower = new double[n];
        densityEstimate = new double[n];
        densityUpper = new double[n];
        Arrays.fill(densityUpper, totalWeight);
        usedError = new double[n];
        prunedWeight = new double[n];
    }

    @Override
    public boolean prune(Node queryNode, Node referenceNode) {
        double weight = referenceWeights[referenceNode.getId()];
        if (weight == 0) {
            return true;
        }

        double minDistance = queryNode.minDistance(referenceNode);
        double maxDistance = queryNode.maxDistance(referenceNode);
        double kernelMax = kernel.getMaxValue(minDistance, maxDistance);
        double kernelMin = kernel.getMinValue(minDistance, maxDistance);

        double dl = weight * kernelMin;
        double de = 0.5 * weight * (kernelMin + kernelMax);
        double du = -weight * (1 - kernelMax);
        double error = 0.5 * weight * (kernelMax - kernelMin);

        KernelSumStat stat = statistics[queryNode.getId()];
        double allowedError = allowedError(stat, dl);
        if (Double.isNaN(allowedError)) {
            return false;
        }

        if (error <= allowedError * weight) {
            stat.postpone(dl, de, du, error, weight);
            ++numberOfFiniteDifferencePrunes;
            return true;
        }

        if (probability < 1 && monteCarloPrune(queryNode, referenceNode, weight, dl, du, allowedError)) {
            ++numberOfMonteCarloPrunes;
            return true;
        }
        return false;
    }

    /**
     * The error that may be spent per unit of reference weight if the lower
     * bound of the node increases by {@code dl}; NaN if undefined.
     */
    double allowedError(KernelSumStat stat, double dl) {
        double newMassLower = stat.getMassLower() + stat.getPostponedLower() + dl;
        double newUsedError = stat.getUsedError() + stat.getPostponedUsedError();
        double newPrunedWeight = stat.getPrunedWeight() + stat.getPostponedPrunedWeight();
        double remainingWeight = totalWeight - newPrunedWeight;
        if (remainingWeight <= 0) {
            return Double.NaN;
        }
        return (relativeError * newMassLower - newUsedError) / remainingWeight;
    }

    boolean monteCarloPrune(Node queryNode, Node referenceNode, double weight, double dl, double du,
            double allowedError) {
        int setSize = referenceNode.getCount();
        if (allowedError <= 0 || setSize <= monteCarloSampleSize) {
            return false;
        }
        double[] means = new double[queryNode.getCount()];
        double maxError = 0;
        for (int q = queryNode.getBegin(); q < queryNode.getEnd(); q++) {
            SummaryStatistics summary = new SummaryStatistics();
            for (int i = 0; i < monteCarloSampleSize; i++) {
                int r = referenceNode.getBegin() + random.nextInt(setSize);
                double value = kernel.evaluate(Math.sqrt(queries.distanceSquared(q, references, r)));
                ++numberOfDistanceComputations;
                // rescaled so that weight * mean estimates the weighted sum
                summary.addValue(value * references.getWeight(r) * setSize / weight);
            }
            double deviation = summary.getStandardDeviation();
            if (Double.isNaN(deviation)) {
                log.debug("undefined sample deviation, rejecting Monte Carlo prune");
                return false;
            }
            double sampleError = zScore * deviation / Math.sqrt(monteCarloSampleSize);
            if (sampleError > allowedError) {
                return false;
            }
            means[q - queryNode.getBegin()] = summary.getMean();
            maxError = Math.max(maxError, sampleError);
        }

        for (int q = queryNode.getBegin(); q < queryNode.getEnd(); q++) {
            densityEstimate[q] += weight * means[q - queryNode.getBegin()];
        }
        statistics[queryNode.getId()].postpone(dl, 0, du, weight * maxError, weight);
        return true;
    }

    @Override
    public void baseCase(Node queryNode, Node referenceNode) {
        KernelSumStat stat = statistics[queryNode.getId()];
        double weight = referenceWeights[referenceNode.getId()];
        stat.resetBounds();
        for (int q = queryNode.getBegin(); q < queryNode.getEnd(); q++) {
            addPostponed(stat, q);
            double sum = 0;
            for (int r = referenceNode.getBegin(); r < referenceNode.getEnd(); r++) {
                double distance = Math.sqrt(queries.distanceSquared(q, references, r));
                ++numberOfDistanceComputations;
                sum += references.getWeight(r) * kernel.evaluate(distance);
            }
            densityLower[q] += sum;
            densityEstimate[q] += sum;
            densityUpper[q] += sum - weight;
            prunedWeight[q] += weight;
            stat.refine(densityLower[q], densityUpper[q], usedError[q], prunedWeight[q]);
        }
        stat.clearPostponed();
    }

    private void addPostponed(KernelSumStat stat, int q) {
        densityLower[q] += stat.getPostponedLower();
        densityEstimate[q] += stat.getPostponedEstimate();
        densityUpper[q] += stat.getPostponedUpper();
        usedError[q] += stat.getPostponedUsedError();
        prunedWeight[q] += stat.getPostponedPrunedWeight();
    }

    @Override
    public double score(Node queryNode, Node referenceNode) {
        return queryNode.getBoundingBox().minDistanceSquared(referenceNode.getBoundingBox());
    }

    @Override
    public void descend(Node queryNode) {
        KernelSumStat stat = statistics[queryNode.getId()];
        statistics[queryNode.getLeftChild().getId()].addPostponed(stat);
        statistics[queryNode.getRightChild().getId()].addPostponed(stat);
        stat.clearPostponed();
    }

    @Override
    public void combine(Node queryNode) {
        statistics[queryNode.getId()].refine(statistics[queryNode.getLeftChild().getId()],
                statistics[queryNode.getRightChild().getId()]);
    }

    /**
     * Push every remaining postponed contribution down to the query points.
     * Must be called once after the traversal.
     *
     * @param queryNode the root of the query tree
     */
    public void postProcess(Node queryNode) {
        KernelSumStat stat = statistics[queryNode.getId()];
        if (queryNode.isLeaf()) {
            stat.resetBounds();
            for (int q = queryNode.getBegin(); q < queryNode.getEnd(); q++) {
                addPostponed(stat, q);
                stat.refine(densityLower[q], densityUpper[q], usedError[q], prunedWeight[q]);
            }
            stat.clearPostponed();
        } else {
            descend(queryNode);
            postProcess(queryNode.getLeftChild());
            postProcess(queryNode.getRightChild());
            combine(queryNode);
        }
    }

    @Override
    public long getNumberOfDistanceComputations() {
        return numberOfDistanceComputations;
    }

    public long getNumberOfFiniteDifferencePrunes() {
        return numberOfFiniteDifferencePrunes;
    }

    public long getNumberOfMonteCarloPrunes() {
        return numberOfMonteCarloPrunes;
    }

    public double getTotalWeight() {
        return totalWeight;
    }

    /**
     * @return lower bounds of the unnormalized sums, by reordered query index
     */
    public double[] getDensityLower() {
        return densityLower;
    }

    public double[] getDensityEstimate() {
        return densityEstimate;
    }

    public double[] getDensityUpper() {
        return densityUpper;
    }

    public double[] getUsedError() {
        return usedError;
    }

    KernelSumStat getStatistic(Node node) {
        return statistics[node.getId()];
    }
}
