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
 * Defines what a "better" neighbor is. The nearest neighbor search prefers
 * small distances while the furthest neighbor search prefers large ones; the
 * traversal rules are written once against this interface.
 */
public interface ISortPolicy {

    /**
     * @return true if {@code value} is strictly better than {@code reference}
     */
    boolean isBetter(double value, double reference);

    /**
     * @return a distance that every real distance improves upon
     */
    double getWorstDistance();

    /**
     * @return a distance which no real distance improves upon
     */
    double getBestDistance();

    /**
     * @return the better of the two distances
     */
    double betterOf(double first, double second);

    /**
     * @return the worse of the two distances
     */
    double worseOf(double first, double second);

    /**
     * The best distance that any point of the query box can have to any point
     * of the reference box.
     */
    double bestDistance(BoundingBox queryBox, BoundingBox referenceBox);

    /**
     * Loosen a bound so that a pruned candidate is at most a factor
     * {@code 1 + relativeError} away from the bound.
     *
     * @param bound         the current bound
     * @param relativeError a value in {@code [0, 1)}
     * @return the relaxed bound
     */
    double relax(double bound, double relativeError);

    /**
     * A priority for exploring the reference box, smaller is more promising.
     */
    double score(BoundingBox queryBox, BoundingBox referenceBox);
}
