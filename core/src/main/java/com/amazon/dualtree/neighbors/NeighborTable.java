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

import java.util.Arrays;

/**
 * For every query point, the {@code k} best candidates seen so far as (distance,
 * reference index) pairs, ordered from best to worst. Unused slots hold the
 * worst distance of the sort policy and the index {@code -1}. All indices refer
 * to reordered positions.
 */
public class NeighborTable {

    private final int numberOfQueries;

    private final int k;

    private final ISortPolicy sortPolicy;

    private final double[] distances;

    private final int[] indices;

    public NeighborTable(int numberOfQueries, int k, ISortPolicy sortPolicy) {
        checkArgument(numberOfQueries > 0, "numberOfQueries must be greater than 0");
        checkArgument(k > 0, "k must be greater than 0");
        this.numberOfQueries = numberOfQueries;
        this.k = k;
        this.sortPolicy = sortPolicy;
        this.distances = new double[numberOfQueries * k];
        this.indices = new int[numberOfQueries * k];
        reset();
    }

    public void reset() {
        Arrays.fill(distances, sortPolicy.getWorstDistance());
        Arrays.fill(indices, -1);
    }

    /**
     * Offer a candidate to a query. The candidate is kept if it is better than
     * the current k-th candidate and the reference index is not already present.
     *
     * @param query     reordered query index
     * @param distance  distance from the query to the candidate
     * @param reference reordered reference index
     * @return true if the candidate was inserted
     */
    public boolean insert(int query, double distance, int reference) {
        int base = query * k;
        if (!sortPolicy.isBetter(distance, distances[base + k - 1])) {
            return false;
        }
        for (int i = 0; i < k; i++) {
            if (indices[base + i] == reference) {
                return false;
            }
        }
        int position = k - 1;
        while (position > 0 && sortPolicy.isBetter(distance, distances[base + position - 1])) {
            distances[base + position] = distances[base + position - 1];
            indices[base + position] = indices[base + position - 1];
            position--;
        }
        distances[base + position] = distance;
        indices[base + position] = reference;
        return true;
    }

    /**
     * @return the distance of the k-th best candidate of the query
     */
    public double getWorstDistance(int query) {
        return distances[query * k + k - 1];
    }

    public double getDistance(int query, int rank) {
        return distances[query * k + rank];
    }

    public int getIndex(int query, int rank) {
        return indices[query * k + rank];
    }

    public int getK() {
        return k;
    }

    public int getNumberOfQueries() {
        return numberOfQueries;
    }
}
