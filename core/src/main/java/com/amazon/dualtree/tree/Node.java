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

import static com.amazon.dualtree.CommonUtils.checkState;

/**
 * A node of a {@link KdTree}. A node covers the contiguous range
 * {@code [begin, begin + count)} of the reordered point set and holds the tight
 * bounding box of those points. An internal node has exactly two children whose
 * ranges partition its own range. Nodes are numbered in preorder, so that
 * algorithms can keep per-node statistics in arrays indexed by
 * {@link #getId()}.
 */
public class Node {

    private final int id;

    private final int begin;

    private final int count;

    private final BoundingBox boundingBox;

    private Cut cut;

    private Node leftChild;

    private Node rightChild;

    Node(int id, int begin, int count, BoundingBox boundingBox) {
        this.id = id;
        this.begin = begin;
        this.count = count;
        this.boundingBox = boundingBox;
    }

    void setChildren(Cut cut, Node leftChild, Node rightChild) {
        checkState(this.leftChild == null, "children are already set");
        checkState(leftChild.count + rightChild.count == count, "children must partition the range of the parent");
        this.cut = cut;
        this.leftChild = leftChild;
        this.rightChild = rightChild;
    }

    public int getId() {
        return id;
    }

    public int getBegin() {
        return begin;
    }

    public int getEnd() {
        return begin + count;
    }

    public int getCount() {
        return count;
    }

    public BoundingBox getBoundingBox() {
        return boundingBox;
    }

    public boolean isLeaf() {
        return leftChild == null;
    }

    /**
     * @return the cut separating the children, or null for a leaf
     */
    public Cut getCut() {
        return cut;
    }

    public Node getLeftChild() {
        return leftChild;
    }

    public Node getRightChild() {
        return rightChild;
    }

    public double minDistance(Node other) {
        return boundingBox.minDistance(other.boundingBox);
    }

    public double maxDistance(Node other) {
        return boundingBox.maxDistance(other.boundingBox);
    }

    @Override
    public String toString() {
        return String.format("Node(%d, [%d, %d), %s)", id, begin, getEnd(), isLeaf() ? "leaf" : cut.toString());
    }
}
