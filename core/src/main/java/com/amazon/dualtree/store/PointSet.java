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
package com.amazon.dualtree.store;

import static com.amazon.dualtree.CommonUtils.checkArgument;
import static com.amazon.dualtree.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * A mutable buffer of points of a fixed dimension. The coordinates of point
 * {@code i} are stored contiguously in
 * {@code [i * dimensions, (i + 1) * dimensions)} of a single array, so that a
 * contiguous range of indices corresponds to a contiguous block of memory.
 * Each point carries a payload of a weight, an integer label and a real valued
 * target; the payload travels with the point whenever two points are swapped.
 *
 * Tree construction reorders a PointSet in place. Indices used by the trees
 * and traversals refer to the reordered positions; the
 * {@link com.amazon.dualtree.tree.Permutation} produced by the build maps them
 * back to the order in which the points were supplied.
 */
public class PointSet {

    public static final double DEFAULT_WEIGHT = 1.0;

    private final int dimensions;

    private final int size;

    private final double[] store;

    private final double[] weights;

    private final int[] labels;

    private final double[] targets;

    /**
     * Creates a point set with unit weights from an array of points.
     *
     * @param points the points, each of the same length
     */
    public PointSet(double[][] points) {
        this(points, null, null, null);
    }

    /**
     * Creates a weighted point set.
     *
     * @param points  the points, each of the same length
     * @param weights non-negative weights, one per point
     */
    public PointSet(double[][] points, double[] weights) {
        this(points, weights, null, null);
    }

    /**
     * Creates a point set with a full payload. Any of the payload arrays can be
     * null, in which case weights default to {@link #DEFAULT_WEIGHT} and labels
     * and targets to zero.
     *
     * @param points  the points, each of the same length
     * @param weights non-negative weights, one per point, or null
     * @param labels  labels, one per point, or null
     * @param targets target values, one per point, or null
     */
    public PointSet(double[][] points, double[] weights, int[] labels, double[] targets) {
        checkNotNull(points, "points must not be null");
        checkArgument(points.length > 0, "point set must not be empty");
        checkNotNull(points[0], "points must not be null");
        checkArgument(points[0].length > 0, "dimensions must be greater than 0");
        this.size = points.length;
        this.dimensions = points[0].length;
        this.store = new double[size * dimensions];
        for (int i = 0; i < size; i++) {
            checkNotNull(points[i], "points must not be null");
            checkArgument(points[i].length == dimensions, "all points must have the same dimension");
            System.arraycopy(points[i], 0, store, i * dimensions, dimensions);
        }
        this.weights = initPayload(weights, DEFAULT_WEIGHT);
        for (double weight : this.weights) {
            checkArgument(weight >= 0, "weights must be non-negative");
        }
        this.labels = (labels == null) ? new int[size] : Arrays.copyOf(labels, labels.length);
        checkArgument(this.labels.length == size, "incorrect number of labels");
        this.targets = initPayload(targets, 0.0);
    }

    private PointSet(PointSet other) {
        this.dimensions = other.dimensions;
        this.size = other.size;
        this.store = Arrays.copyOf(other.store, other.store.length);
        this.weights = Arrays.copyOf(other.weights, size);
        this.labels = Arrays.copyOf(other.labels, size);
        this.targets = Arrays.copyOf(other.targets, size);
    }

    private double[] initPayload(double[] values, double defaultValue) {
        if (values == null) {
            double[] result = new double[size];
            Arrays.fill(result, defaultValue);
            return result;
        }
        checkArgument(values.length == size, "incorrect number of payload values");
        return Arrays.copyOf(values, size);
    }

    /**
     * @return a deep copy of this point set, in its current order
     */
    public PointSet copy() {
        return new PointSet(this);
    }

    public int size() {
        return size;
    }

    public int getDimensions() {
        return dimensions;
    }

    /**
     * @param index     index of the point
     * @param dimension a coordinate
     * @return the value of the coordinate of the point at the given index
     */
    public double get(int index, int dimension) {
        return store[index * dimensions + dimension];
    }

    /**
     * @param index index of the point
     * @return a copy of the coordinates of the point at the given index
     */
    public double[] getPoint(int index) {
        checkArgument(index >= 0 && index < size, "index out of range");
        return Arrays.copyOfRange(store, index * dimensions, (index + 1) * dimensions);
    }

    public double getWeight(int index) {
        return weights[index];
    }

    public int getLabel(int index) {
        return labels[index];
    }

    public double getTarget(int index) {
        return targets[index];
    }

    /**
     * @param begin first index, inclusive
     * @param end   last index, exclusive
     * @return the sum of the weights in the range
     */
    public double getWeightSum(int begin, int end) {
        double sum = 0;
        for (int i = begin; i < end; i++) {
            sum += weights[i];
        }
        return sum;
    }

    public double getTotalWeight() {
        return getWeightSum(0, size);
    }

    /**
     * Squared Euclidean distance between a point of this set and a point of
     * another set of the same dimension.
     */
    public double distanceSquared(int index, PointSet other, int otherIndex) {
        double sum = 0;
        int base = index * dimensions;
        int otherBase = otherIndex * dimensions;
        for (int i = 0; i < dimensions; i++) {
            double t = store[base + i] - other.store[otherBase + i];
            sum += t * t;
        }
        return sum;
    }

    /**
     * Squared Euclidean distance between a point of this set and an arbitrary
     * point.
     */
    public double distanceSquared(int index, double[] point) {
        checkArgument(point.length == dimensions, "incorrect dimension");
        double sum = 0;
        int base = index * dimensions;
        for (int i = 0; i < dimensions; i++) {
            double t = store[base + i] - point[i];
            sum += t * t;
        }
        return sum;
    }

    /**
     * Exchanges the points at the two positions along with their payloads.
     */
    public void swap(int first, int second) {
        if (first == second) {
            return;
        }
        int a = first * dimensions;
        int b = second * dimensions;
        for (int i = 0; i < dimensions; i++) {
            double t = store[a + i];
            store[a + i] = store[b + i];
            store[b + i] = t;
        }
        double weight = weights[first];
        weights[first] = weights[second];
        weights[second] = weight;
        int label = labels[first];
        labels[first] = labels[second];
        labels[second] = label;
        double target = targets[first];
        targets[first] = targets[second];
        targets[second] = target;
    }

    /**
     * @return the points in their current order
     */
    public double[][] toArray() {
        double[][] result = new double[size][];
        for (int i = 0; i < size; i++) {
            result[i] = getPoint(i);
        }
        return result;
    }
}
