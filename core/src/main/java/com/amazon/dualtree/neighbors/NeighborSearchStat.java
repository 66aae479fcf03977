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

import lombok.Data;

/**
 * Per query node statistic of the neighbor searches.
 */
@Data
public class NeighborSearchStat {

    /**
     * A bound on the k-th best distance of every query point in the node. No
     * reference point whose best possible distance fails to improve on it can
     * change the result of the node.
     */
    private double bound;

    /**
     * The number of reference points examined on behalf of every query point in
     * the node, either exactly, by sampling or by pruning. Only used by the rank
     * approximate search.
     */
    private long samples;

    /**
     * Samples credited to this node which have not yet been pushed to its
     * children.
     */
    private long postponedSamples;

    public NeighborSearchStat(double bound) {
        this.bound = bound;
    }

    /**
     * Credit samples to the node. For an internal node they are also recorded as
     * postponed so that they reach the children on the next descent.
     */
    public void addSamples(long count, boolean postpone) {
        samples += count;
        if (postpone) {
            postponedSamples += count;
        }
    }
}
