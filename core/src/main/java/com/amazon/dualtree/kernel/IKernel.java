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
package com.amazon.dualtree.kernel;

/**
 * A radially symmetric kernel. Values are unnormalized: {@code evaluate(0)} is
 * 1 and all values lie in {@code [0, 1]}. The kernel sum relies on the range
 * methods to bound the kernel over all pairs of points from two boxes.
 */
public interface IKernel {

    /**
     * @return the bandwidth of the kernel
     */
    double getBandwidth();

    /**
     * @param distance a Euclidean distance
     * @return the unnormalized kernel value at that distance
     */
    double evaluate(double distance);

    /**
     * The integral of the unnormalized kernel over {@code R^dimensions}.
     * Dividing by it turns a kernel sum into a density.
     *
     * @param dimensions the dimension of the space
     * @return the normalization constant
     */
    double getNormalizationConstant(int dimensions);

    /**
     * @return true if the kernel value never increases with the distance
     */
    default boolean isMonotoneDecreasing() {
        return true;
    }

    /**
     * @return an upper bound on the kernel value for distances in
     *         {@code [minDistance, maxDistance]}
     */
    default double getMaxValue(double minDistance, double maxDistance) {
        return evaluate(minDistance);
    }

    /**
     * @return a lower bound on the kernel value for distances in
     *         {@code [minDistance, maxDistance]}
     */
    default double getMinValue(double minDistance, double maxDistance) {
        return evaluate(maxDistance);
    }
}
