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
import static com.amazon.dualtree.CommonUtils.checkNotNull;
import static com.amazon.dualtree.CommonUtils.validateInternalState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.dualtree.config.SplitMethod;
import com.amazon.dualtree.store.PointSet;

/**
 * Builds a {@link KdTree} by recursively splitting a range of points along the
 * widest dimension of its bounding box until the number of points in a node is
 * at most the leaf size. The points are partitioned in place, and the resulting
 * reordering is returned as the {@link Permutation} of the tree.
 */
public class TreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(TreeBuilder.class);

    /**
     * Default maximum number of points in a leaf.
     */
    public static final int DEFAULT_LEAF_SIZE = 20;

    /**
     * Default rule for choosing split values.
     */
    public static final SplitMethod DEFAULT_SPLIT_METHOD = SplitMethod.MIDPOINT;

    private final int leafSize;

    private final SplitMethod splitMethod;

    protected TreeBuilder(Builder<?> builder) {
        checkArgument(builder.leafSize > 0, "leafSize must be greater than 0");
        checkNotNull(builder.splitMethod, "splitMethod must not be null");
        leafSize = builder.leafSize;
        splitMethod = builder.splitMethod;
    }

    /**
     * @return a new TreeBuilder builder.
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    public int getLeafSize() {
        return leafSize;
    }

    public SplitMethod getSplitMethod() {
        return splitMethod;
    }

    /**
     * Build a tree over the given points. The point set is reordered in place
     * and becomes owned by the returned tree; callers that need the original
     * order should pass a {@link PointSet#copy()}.
     *
     * @param points a non-empty point set
     * @return the tree
     */
    public KdTree build(PointSet points) {
        checkNotNull(points, "points must not be null");
        checkArgument(points.size() > 0, "point set must not be empty");

        BuildState state = new BuildState(points);
        Node root = buildNode(state, 0, points.size(), 0);
        Node[] nodes = state.nodes.toArray(new Node[0]);
        Permutation permutation = new Permutation(state.oldFromNew);

        log.debug("built tree over {} points with {} nodes and depth {} (leaf size {}, split {})", points.size(),
                nodes.length, state.depth, leafSize, splitMethod);
        return new KdTree(points, root, nodes, permutation, leafSize, splitMethod, state.depth);
    }

    private Node buildNode(BuildState state, int begin, int end, int level) {
        BoundingBox box = BoundingBox.of(state.points, begin, end);
        Node node = new Node(state.nodes.size(), begin, end - begin, box);
        state.nodes.add(node);
        state.depth = Math.max(state.depth, level);

        if (end - begin <= leafSize) {
            return node;
        }

        int dimension = box.getWidestDimension();
        if (box.getRange(dimension) <= 0) {
            // all points coincide
            return node;
        }

        double splitValue = chooseSplitValue(state.points, begin, end, dimension, box);
        int splitIndex = partition(state, begin, end, dimension, splitValue);
        if (splitIndex == begin || splitIndex == end) {
            // the midpoint can round onto the minimum when the range is tiny
            splitValue = box.getMaxValue(dimension);
            splitIndex = partition(state, begin, end, dimension, splitValue);
        }
        validateInternalState(splitIndex > begin && splitIndex < end, "split did not separate the points");

        Node left = buildNode(state, begin, splitIndex, level + 1);
        Node right = buildNode(state, splitIndex, end, level + 1);
        node.setChildren(new Cut(dimension, splitValue), left, right);
        return node;
    }

    double chooseSplitValue(PointSet points, int begin, int end, int dimension, BoundingBox box) {
        if (splitMethod == SplitMethod.MIDPOINT) {
            return box.getMidpoint(dimension);
        }
        double[] values = new double[end - begin];
        for (int i = begin; i < end; i++) {
            values[i - begin] = points.get(i, dimension);
        }
        Arrays.sort(values);
        double median = values[values.length / 2];
        if (median == values[0] || median == values[values.length - 1]) {
            return box.getMidpoint(dimension);
        }
        return median;
    }

    /**
     * Hoare style partition of {@code [begin, end)}: points whose coordinate is
     * less than the split value are moved to the front. Every swap of points is
     * mirrored in the permutation.
     *
     * @return the index of the first point that is not less than the split value
     */
    int partition(BuildState state, int begin, int end, int dimension, double splitValue) {
        PointSet points = state.points;
        int left = begin;
        int right = end - 1;
        while (true) {
            while (left <= right && points.get(left, dimension) < splitValue) {
                left++;
            }
            while (left <= right && points.get(right, dimension) >= splitValue) {
                right--;
            }
            if (left > right) {
                return left;
            }
            points.swap(left, right);
            int t = state.oldFromNew[left];
            state.oldFromNew[left] = state.oldFromNew[right];
            state.oldFromNew[right] = t;
            left++;
            right--;
        }
    }

    static class BuildState {
        final PointSet points;
        final int[] oldFromNew;
        final List<Node> nodes = new ArrayList<>();
        int depth;

        BuildState(PointSet points) {
            this.points = points;
            this.oldFromNew = new int[points.size()];
            for (int i = 0; i < oldFromNew.length; i++) {
                oldFromNew[i] = i;
            }
        }
    }

    public static class Builder<T extends Builder<T>> {

        private int leafSize = DEFAULT_LEAF_SIZE;
        private SplitMethod splitMethod = DEFAULT_SPLIT_METHOD;

        public T leafSize(int leafSize) {
            this.leafSize = leafSize;
            return (T) this;
        }

        public T splitMethod(SplitMethod splitMethod) {
            this.splitMethod = splitMethod;
            return (T) this;
        }

        public TreeBuilder build() {
            return new TreeBuilder(this);
        }
    }
}
