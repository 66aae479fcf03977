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
package com.amazon.dualtree.sampler;

import static com.amazon.dualtree.CommonUtils.checkArgument;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sample sizes for rank approximate search. A candidate is acceptable if its
 * rank among all candidates, ordered from best to worst and counted from 0, is
 * at most {@code rank}, that is if it is one of the best {@code rank + 1}
 * candidates. Drawing {@code n} of {@code N} candidates uniformly without
 * replacement, the best candidate of the sample is acceptable with probability
 *
 * <pre>
 * P(n) = (n / N) * sum_{i = 0}^{rank} prod_{j = 1}^{i} (N - (n - 1) - j) / (N - j)
 * </pre>
 *
 * The sampler finds the smallest {@code n} whose failure probability
 * {@code 1 - P(n)} is below {@code alpha}. To avoid recomputing this for every
 * node size it is solved once for a set of {@code rank + SET_SIZE_MARGIN}
 * candidates and the resulting sampling ratio is applied to every larger set.
 * Sets with at most {@code rank} candidates are examined in full.
 */
public class RankApproximationSampler {

    private static final Logger log = LoggerFactory.getLogger(RankApproximationSampler.class);

    /**
     * The number of candidates beyond the rank in the reference set used to
     * derive the sampling ratio.
     */
    public static final int SET_SIZE_MARGIN = 1000;

    private final int rank;

    private final double alpha;

    private final double samplingRatio;

    /**
     * @param rank  the largest acceptable rank, counted from 0
     * @param alpha the allowed failure probability, in {@code (0, 1)}
     */
    public RankApproximationSampler(int rank, double alpha) {
        checkArgument(rank >= 0, "rank must be non-negative");
        checkArgument(alpha > 0 && alpha < 1, "alpha must be in (0, 1)");
        this.rank = rank;
        this.alpha = alpha;
        int referenceSetSize = rank + SET_SIZE_MARGIN;
        int referenceSampleSize = minimumSampleSize(referenceSetSize);
        this.samplingRatio = (double) referenceSampleSize / referenceSetSize;
        log.debug("rank {} with failure probability {}: {} samples out of {}, ratio {}", rank, alpha,
                referenceSampleSize, referenceSetSize, samplingRatio);
    }

    /**
     * The probability that the best of {@code sampleSize} candidates drawn
     * without replacement from {@code setSize} is among the best
     * {@code rank + 1}. The tail product is built term by term so that no
     * binomial coefficient is formed. Factors which would turn negative are
     * zero, and a NaN result is reported as 0.
     */
    public static double successProbability(int setSize, int sampleSize, int rank) {
        checkArgument(setSize > 0, "setSize must be greater than 0");
        checkArgument(rank >= 0, "rank must be non-negative");
        if (sampleSize <= 0) {
            return 0.0;
        }
        if (sampleSize >= setSize || rank + 1 >= setSize) {
            return 1.0;
        }
        double term = 1.0;
        double sum = 1.0;
        for (int i = 1; i <= rank; i++) {
            double fraction = (double) (setSize - (sampleSize - 1) - i) / (double) (setSize - i);
            if (fraction <= 0) {
                break;
            }
            term *= fraction;
            sum += term;
        }
        double probability = (double) sampleSize / (double) setSize * sum;
        if (Double.isNaN(probability)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, probability));
    }

    /**
     * @return {@code 1 - successProbability(setSize, sampleSize, rank)}
     */
    public static double failureProbability(int setSize, int sampleSize, int rank) {
        return 1.0 - successProbability(setSize, sampleSize, rank);
    }

    /**
     * The smallest sample size {@code n} with
     * {@code failureProbability(setSize, n, rank) < alpha}. Consequently
     * {@code failureProbability(setSize, n - 1, rank) >= alpha}. If every
     * candidate is acceptable, the whole set is required.
     *
     * @param setSize the number of candidates
     * @return the minimum sample size, in {@code [1, setSize]}
     */
    public int minimumSampleSize(int setSize) {
        checkArgument(setSize > 0, "setSize must be greater than 0");
        if (rank + 1 >= setSize) {
            return setSize;
        }
        for (int n = 1; n < setSize; n++) {
            if (failureProbability(setSize, n, rank) < alpha) {
                return n;
            }
        }
        return setSize;
    }

    /**
     * The number of samples to draw from a node with {@code setSize} candidates.
     *
     * @param setSize the number of candidates in the node
     * @return {@code setSize} if it is at most the rank, otherwise the sampling
     *         ratio applied to the set size, clamped to {@code [1, setSize]}
     */
    public int sampleSize(int setSize) {
        checkArgument(setSize >= 0, "setSize must be non-negative");
        if (setSize <= rank) {
            return setSize;
        }
        int size = (int) (samplingRatio * setSize);
        return Math.max(1, Math.min(setSize, size));
    }

    /**
     * @param maxSetSize the largest set size of interest
     * @return an array whose entry {@code s} is {@code sampleSize(s)}, for every
     *         {@code s} in {@code [0, maxSetSize]}
     */
    public int[] sampleSizeTable(int maxSetSize) {
        checkArgument(maxSetSize >= 0, "maxSetSize must be non-negative");
        int[] table = new int[maxSetSize + 1];
        for (int s = 0; s <= maxSetSize; s++) {
            table[s] = sampleSize(s);
        }
        return table;
    }

    public int getRank() {
        return rank;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getSamplingRatio() {
        return samplingRatio;
    }
}
