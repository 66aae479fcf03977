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

import lombok.Getter;

/**
 * Counters describing a single traversal.
 */
@Getter
public class TraversalInfo {

    /**
     * The number of node pairs considered.
     */
    private long numberOfVisits;

    /**
     * The number of node pairs which were pruned.
     */
    private long numberOfPrunes;

    /**
     * The number of pairs of leaves evaluated exhaustively.
     */
    private long numberOfBaseCases;

    /**
     * The number of point to point distances evaluated.
     */
    private long numberOfDistanceComputations;

    void incrementVisits() {
        numberOfVisits++;
    }

    void incrementPrunes() {
        numberOfPrunes++;
    }

    void incrementBaseCases() {
        numberOfBaseCases++;
    }

    void setNumberOfDistanceComputations(long numberOfDistanceComputations) {
        this.numberOfDistanceComputations = numberOfDistanceComputations;
    }

    @Override
    public String toString() {
        return String.format("TraversalInfo(visits=%d, prunes=%d, baseCases=%d, distanceComputations=%d)",
                numberOfVisits, numberOfPrunes, numberOfBaseCases, numberOfDistanceComputations);
    }
}
