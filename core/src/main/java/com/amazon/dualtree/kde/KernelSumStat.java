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

import lombok.Getter;
import lombok.Setter;

/**
 * Per query node statistic of the kernel sum. The bound fields summarize the
 * query points below the node: the smallest lower bound, the largest upper
 * bound, the largest error spent and the smallest reference weight accounted
 * for. Contributions of pruned reference nodes are kept as postponed deltas
 * until they are pushed to the children or, at a leaf, to the points.
 */
@Getter
@Setter
public class KernelSumStat {

    private double massLower;

    private double massUpper;

    private double usedError;

    private double prunedWeight;

    private double postponedLower;

    private double postponedEstimate;

    private double postponedUpper;

    private double postponedUsedError;

    private double postponedPrunedWeight;

    public KernelSumStat(double totalWeight) {
        massUpper = totalWeight;
    }

    /**
     * Adds the postponed deltas of the parent to this node.
     */
    public void addPostponed(KernelSumStat parent) {
        postponedLower += parent.postponedLower;
        postponedEstimate += parent.postponedEstimate;
        postponedUpper += parent.postponedUpper;
        postponedUsedError += parent.postponedUsedError;
        postponedPrunedWeight += parent.postponedPrunedWeight;
    }

    public void clearPostponed() {
        postponedLower = 0;
        postponedEstimate = 0;
        postponedUpper = 0;
        postponedUsedError = 0;
        postponedPrunedWeight = 0;
    }

    /**
     * Prepare the bound fields for a refinement over the points of a leaf.
     */
    public void resetBounds() {
        massLower = Double.MAX_VALUE;
        massUpper = -Double.MAX_VALUE;
        usedError = 0;
        prunedWeight = Double.MAX_VALUE;
    }

    /**
     * Fold the final values of one query point into the bound fields.
     */
    public void refine(double lower, double upper, double error, double pruned) {
        massLower = Math.min(massLower, lower);
        massUpper = Math.max(massUpper, upper);
        usedError = Math.max(usedError, error);
        prunedWeight = Math.min(prunedWeight, pruned);
    }

    /**
     * Rebuild the bound fields from the children, including what is still
     * postponed at the children.
     */
    public void refine(KernelSumStat left, KernelSumStat right) {
        massLower = Math.min(left.massLower + left.postponedLower, right.massLower + right.postponedLower);
        massUpper = Math.max(left.massUpper + left.postponedUpper, right.massUpper + right.postponedUpper);
        usedError = Math.max(left.usedError + left.postponedUsedError, right.usedError + right.postponedUsedError);
        prunedWeight = Math.min(left.prunedWeight + left.postponedPrunedWeight,
                right.prunedWeight + right.postponedPrunedWeight);
    }

    /**
     * Record the contribution of a pruned reference node.
     */
    public void postpone(double lower, double estimate, double upper, double error, double pruned) {
        postponedLower += lower;
        postponedEstimate += estimate;
        postponedUpper += upper;
        postponedUsedError += error;
        postponedPrunedWeight += pruned;
    }
}
