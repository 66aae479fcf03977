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

import com.amazon.dualtree.tree.BoundingBox;

/**
 * Sort policy for furthest neighbor search: larger distances are better.
 */
public class FurthestNeighborSort implements ISortPolicy {

    @Override
    public boolean isBetter(double value, double reference) {
        return value > reference;
    }

    @Override
    public double getWorstDistance() {
        return 0.0;
    }

    @Override
    public double getBestDistance() {
        return Double.MAX_VALUE;
    }

    @Override
    public double betterOf(double first, double second) {
        return Math.max(first, second);
    }

    @Override
    public double worseOf(double first, double second) {
        return Math.min(first, second);
    }

    @Override
    public double bestDistance(BoundingBox queryBox, BoundingBox referenceBox) {
        return queryBox.maxDistance(referenceBox);
    }

    @Override
    public double relax(double bound, double relativeError) {
        return bound * (1 + relativeError);
    }

    @Override
    public double score(BoundingBox queryBox, BoundingBox referenceBox) {
        return -queryBox.maxDistanceSquared(referenceBox);
    }
}
