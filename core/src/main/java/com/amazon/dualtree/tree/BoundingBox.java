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

import static com.amazon.dualtree.CommonUtils.checkArgument;

import java.util.Arrays;

import com.amazon.dualtree.store.PointSet;

/**
 * An axis-aligned bounding box over a set of points. Besides the usual range
 * queries the box provides lower and upper bounds on the Euclidean distance
 * between any point inside it and any point inside another box (or a single
 * point). These bounds are admissible: for all {@code a} in A and {@code b} in
 * B, {@code A.minDistance(B) <= |a - b| <= A.maxDistance(B)}.
 */
public class BoundingBox {

    /**
     * An array containing the minimum value corresponding to each dimension.
     */
    protected final double[] minValues;

    /**
     * An array containing the maximum value corresponding to each dimensions
     */
    protected final double[] maxValues;

    /**
     * The sum of side lengths defined by this bounding box.
     */
    protected double rangeSum;

    /**
     * Create a degenerate box containing a single point. The point is copied.
     *
     * @param point the only point in the box
     */
    public BoundingBox(double[] point) {
        minValues = Arrays.copyOf(point, point.length);
        maxValues = Arrays.copyOf(point, point.length);
        rangeSum = 0.0;
    }

    /**
     * Create a new BoundingBox with the given minimum values and maximum values.
     *
     * @param minValues The minimum values for each coordinate.
     * @param maxValues The maximum values for each coordinate
     */
    public BoundingBox(final double[] minValues, final double[] maxValues) {
        checkArgument(minValues.length == maxValues.length, "incorrect lengths in box");
        this.minValues = Arrays.copyOf(minValues, minValues.length);
        this.maxValues = Arrays.copyOf(maxValues, maxValues.length);
        rangeSum = 0;
        for (int i = 0; i < minValues.length; ++i) {
            checkArgument(minValues[i] <= maxValues[i], "minimum exceeds maximum");
            rangeSum += maxValues[i] - minValues[i];
        }
    }

    /**
     * The tight box around the points stored at positions {@code [begin, end)}
     * of a point set.
     *
     * @param points the point set
     * @param begin  first index, inclusive
     * @param end    last index, exclusive
     * @return the bounding box of the range
     */
    public static BoundingBox of(PointSet points, int begin, int end) {
        checkArgument(begin < end, "cannot bound an empty range");
        BoundingBox box = new BoundingBox(points.getPoint(begin));
        for (int i = begin + 1; i < end; i++) {
            box.addPoint(points, i);
        }
        return box;
    }

    public BoundingBox copy() {
        return new BoundingBox(minValues, maxValues);
    }

    /**
     * Extends this box in place to include the given point of a point set.
     *
     * @return this box
     */
    public BoundingBox addPoint(PointSet points, int index) {
        checkArgument(points.getDimensions() == minValues.length, "incorrect length");
        for (int i = 0; i < minValues.length; ++i) {
            double value = points.get(index, i);
            minValues[i] = Math.min(minValues[i], value);
            maxValues[i] = Math.max(maxValues[i], value);
        }
        updateRangeSum();
        return this;
    }

    /**
     * Extends this box in place to include the given point.
     *
     * @return this box
     */
    public BoundingBox addPoint(double[] point) {
        checkArgument(point.length == minValues.length, "incorrect length");
        for (int i = 0; i < minValues.length; ++i) {
            minValues[i] = Math.min(minValues[i], point[i]);
            maxValues[i] = Math.max(maxValues[i], point[i]);
        }
        updateRangeSum();
        return this;
    }

    /**
     * @return a new box which is the smallest box containing this box and the
     *         other box
     */
    public BoundingBox getMergedBox(BoundingBox otherBox) {
        checkArgument(otherBox.getDimensions() == minValues.length, "incorrect length");
        double[] minValuesMerged = new double[minValues.length];
        double[] maxValuesMerged = new double[minValues.length];
        for (int i = 0; i < minValues.length; ++i) {
            minValuesMerged[i] = Math.min(minValues[i], otherBox.minValues[i]);
            maxValuesMerged[i] = Math.max(maxValues[i], otherBox.maxValues[i]);
        }
        return new BoundingBox(minValuesMerged, maxValuesMerged);
    }

    private void updateRangeSum() {
        rangeSum = 0;
        for (int i = 0; i < minValues.length; ++i) {
            rangeSum += maxValues[i] - minValues[i];
        }
    }

    public int getDimensions() {
        return minValues.length;
    }

    public double getMinValue(int dimension) {
        return minValues[dimension];
    }

    public double getMaxValue(int dimension) {
        return maxValues[dimension];
    }

    public double getRange(int dimension) {
        return maxValues[dimension] - minValues[dimension];
    }

    public double getRangeSum() {
        return rangeSum;
    }

    public double getMidpoint(int dimension) {
        return minValues[dimension] + 0.5 * (maxValues[dimension] - minValues[dimension]);
    }

    /**
     * @return the dimension with the largest range, the smallest such dimension
     *         on ties
     */
    public int getWidestDimension() {
        int widest = 0;
        for (int i = 1; i < minValues.length; ++i) {
            if (getRange(i) > getRange(widest)) {
                widest = i;
            }
        }
        return widest;
    }

    /**
     * Test whether a given point is contained in this bounding box (boundary
     * included).
     */
    public boolean contains(double[] point) {
        checkArgument(point.length == minValues.length, "incorrect dimensions");
        for (int i = 0; i < minValues.length; i++) {
            if (point[i] < minValues[i] || point[i] > maxValues[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Test whether the other box lies entirely within this box.
     */
    public boolean contains(BoundingBox other) {
        checkArgument(other.getDimensions() == minValues.length, "incorrect dimensions");
        for (int i = 0; i < minValues.length; i++) {
            if (other.minValues[i] < minValues[i] || other.maxValues[i] > maxValues[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * The squared Euclidean norm of the per dimension gap between the boxes. The
     * gap in a dimension is zero when the boxes overlap in that dimension.
     */
    public double minDistanceSquared(BoundingBox other) {
        checkArgument(other.getDimensions() == minValues.length, "incorrect dimensions");
        double sum = 0;
        for (int i = 0; i < minValues.length; i++) {
            double gap = Math.max(0, Math.max(other.minValues[i] - maxValues[i], minValues[i] - other.maxValues[i]));
            sum += gap * gap;
        }
        return sum;
    }

    /**
     * The squared distance between the two farthest corners of the boxes.
     */
    public double maxDistanceSquared(BoundingBox other) {
        checkArgument(other.getDimensions() == minValues.length, "incorrect dimensions");
        double sum = 0;
        for (int i = 0; i < minValues.length; i++) {
            double span = Math.max(other.maxValues[i] - minValues[i], maxValues[i] - other.minValues[i]);
            sum += span * span;
        }
        return sum;
    }

    public double minDistance(BoundingBox other) {
        return Math.sqrt(minDistanceSquared(other));
    }

    public double maxDistance(BoundingBox other) {
        return Math.sqrt(maxDistanceSquared(other));
    }

    public double minDistanceSquared(double[] point) {
        checkArgument(point.length == minValues.length, "incorrect dimensions");
        double sum = 0;
        for (int i = 0; i < minValues.length; i++) {
            double gap = Math.max(0, Math.max(point[i] - maxValues[i], minValues[i] - point[i]));
            sum += gap * gap;
        }
        return sum;
    }

    public double maxDistanceSquared(double[] point) {
        checkArgument(point.length == minValues.length, "incorrect dimensions");
        double sum = 0;
        for (int i = 0; i < minValues.length; i++) {
            double span = Math.max(point[i] - minValues[i], maxValues[i] - point[i]);
            sum += span * span;
        }
        return sum;
    }

    public double minDistance(double[] point) {
        return Math.sqrt(minDistanceSquared(point));
    }

    public double maxDistance(double[] point) {
        return Math.sqrt(maxDistanceSquared(point));
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof BoundingBox)) {
            return false;
        }
        BoundingBox otherBox = (BoundingBox) other;
        return Arrays.equals(minValues, otherBox.minValues) && Arrays.equals(maxValues, otherBox.maxValues);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(minValues) + Arrays.hashCode(maxValues);
    }

    @Override
    public String toString() {
        return String.format("BoundingBox(%s, %s)", Arrays.toString(minValues), Arrays.toString(maxValues));
    }
}
