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
package com.amazon.dualtree.returntypes;

import java.util.Optional;

import lombok.Builder;
import lombok.Getter;

import com.amazon.dualtree.traversal.TraversalInfo;

/**
 * Kernel sums for every query point, in the order in which the query points
 * were supplied. The true value of query {@code i} lies in
 * {@code [getLower()[i], getUpper()[i]]}, and {@code getEstimate()[i]} is the
 * approximation whose error is controlled by the relative error of the
 * computation.
 */
@Builder
@Getter
public class KernelSumResult {

    private final double[] lower;

    private final double[] estimate;

    private final double[] upper;

    /**
     * True if the sums were divided by the kernel normalization constant and the
     * total reference weight.
     */
    private final boolean normalized;

    private final long numberOfDistanceComputations;

    private final long numberOfFiniteDifferencePrunes;

    private final long numberOfMonteCarloPrunes;

    private final TraversalInfo traversalInfo;

    /**
     * @return the traversal counters, or {@code Optional.empty()} for a naive
     *         all pairs computation
     */
    public Optional<TraversalInfo> getTraversalInfo() {
        return Optional.ofNullable(traversalInfo);
    }

    public int getNumberOfQueries() {
        return estimate.length;
    }
}
