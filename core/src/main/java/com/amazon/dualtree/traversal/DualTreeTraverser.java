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
package com.amazon.dualtree.traversal;

import static com.amazon.dualtree.CommonUtils.checkNotNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.dualtree.tree.Node;

/**
 * The generic recursion over pairs of query and reference nodes. For every pair
 * the traverser first asks the rules whether the pair can be pruned. Pairs of
 * leaves which cannot be pruned are handed to the base case. Otherwise the
 * non-leaf nodes are expanded; the children of a reference node are visited in
 * increasing order of {@link IDualTreeRules#score}, and the statistic of an
 * expanded query node is pushed down before and rebuilt after its children are
 * visited.
 *
 * A traverser can be reused; every call to {@link #traverse} starts with fresh
 * counters. It is not thread safe.
 */
public class DualTreeTraverser {

    private static final Logger log = LoggerFactory.getLogger(DualTreeTraverser.class);

    private final IDualTreeRules rules;

    private TraversalInfo info;

    public DualTreeTraverser(IDualTreeRules rules) {
        this.rules = checkNotNull(rules, "rules must not be null");
    }

    /**
     * Run the traversal from the given pair of roots. The two roots may belong to
     * the same tree.
     *
     * @param queryRoot     root of the query tree
     * @param referenceRoot root of the reference tree
     * @return the counters of this traversal
     */
    public TraversalInfo traverse(Node queryRoot, Node referenceRoot) {
        checkNotNull(queryRoot, "queryRoot must not be null");
        checkNotNull(referenceRoot, "referenceRoot must not be null");
        info = new TraversalInfo();
        visit(queryRoot, referenceRoot);
        info.setNumberOfDistanceComputations(rules.getNumberOfDistanceComputations());
        log.debug("traversal finished: {}", info);
        return info;
    }

    private void visit(Node queryNode, Node referenceNode) {
        if (queryNode.getCount() == 0 || referenceNode.getCount() == 0) {
            return;
        }
        info.incrementVisits();

        if (rules.prune(queryNode, referenceNode)) {
            info.incrementPrunes();
            return;
        }

        if (queryNode.isLeaf()) {
            if (referenceNode.isLeaf()) {
                rules.baseCase(queryNode, referenceNode);
                info.incrementBaseCases();
            } else {
                visitReferenceChildren(queryNode, referenceNode);
            }
            return;
        }

        rules.descend(queryNode);
        if (referenceNode.isLeaf()) {
            visit(queryNode.getLeftChild(), referenceNode);
            visit(queryNode.getRightChild(), referenceNode);
        } else {
            visitReferenceChildren(queryNode.getLeftChild(), referenceNode);
            visitReferenceChildren(queryNode.getRightChild(), referenceNode);
        }
        rules.combine(queryNode);
    }

    private void visitReferenceChildren(Node queryNode, Node referenceNode) {
        Node first = referenceNode.getLeftChild();
        Node second = referenceNode.getRightChild();
        if (rules.score(queryNode, second) < rules.score(queryNode, first)) {
            Node t = first;
            first = second;
            second = t;
        }
        visit(queryNode, first);
        visit(queryNode, second);
    }
}
