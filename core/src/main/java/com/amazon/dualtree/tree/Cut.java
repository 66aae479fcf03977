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
package com.amazon.dualtree.tree;

/**
 * A Cut represents a division of space into two half-spaces. Cuts are used to
 * define the tree structure. A cut is determined by a dimension and a value,
 * and a point lies to the left of the cut if its coordinate in that dimension
 * is strictly less than the value.
 */
public class Cut {

    private final int dimension;
    private final double value;

    /**
     * Create a new Cut with the given dimension and value.
     *
     * @param dimension The 0-based index of the dimension that the cut is made
     *                  in.
     * @param value     The spatial value of the cut.
     */
    public Cut(int dimension, double value) {
        this.dimension = dimension;
        this.value = value;
    }

    /**
     * @param coordinate a value in the dimension of this cut
     * @return true if a point with this coordinate belongs to the left child
     */
    public boolean isLeftOf(double coordinate) {
        return coordinate < value;
    }

    /**
     * Return true if the given point is strictly to the left of the cut.
     *
     * @param point a point with at least {@code getDimension() + 1} coordinates
     * @return true if the point lies to the left of the cut
     */
    public boolean isLeftOf(double[] point) {
        return isLeftOf(point[dimension]);
    }

    /**
     * Get the index of the dimension that this cut was made in.
     *
     * @return the 0-based index of the dimension that this cut was made in.
     */
    public int getDimension() {
        return dimension;
    }

    /**
     * Get the value of the cut.
     *
     * @return the value of the cut.
     */
    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return String.format("Cut(%d, %f)", dimension, value);
    }
}
