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
 * The neighbors found for every query point. Row {@code i} of
 * {@link #getNeighbors()} and {@link #getDistances()} belongs to the query
 * point that was supplied at position {@code i}, and neighbor indices refer to
 * the positions at which reference points were supplied. Candidates are
 * ordered from best to worst; missing candidates have index {@code -1}.
 */
@Builder
@Getter
public class NeighborSearchResult {

    private final int[][] neighbors;

    private final double[][] distances;

    private final long numberOfDistanceComputations;

    /**
     * The number of reference points drawn at random. Zero for exact searches.
     */
    private final long numberOfSamples;

    private final TraversalInfo traversalInfo;

    /**
     * @return the traversal counters, or {@code Optional.empty()} for a naive
     *         all pairs computation
     */
    public Optional<TraversalInfo> getTraversalInfo() {
        return Optional.ofNullable(traversalInfo);
    }

    public int getNumberOfQueries() {
        return neighbors.length;
    }

    /**
     * @return the original index of the best candidate of the query
     */
    public int getNearest(int query) {
        return neighbors[query][0];
    }
}
