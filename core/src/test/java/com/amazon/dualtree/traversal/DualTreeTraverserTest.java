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

import static com.amazon.dualtree.TestUtils.buildTree;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import com.amazon.dualtree.testutils.ExampleDataSets;
import com.amazon.dualtree.tree.KdTree;
import com.amazon.dualtree.tree.Node;

public class DualTreeTraverserTest {

    private KdTree queryTree;
    private KdTree referenceTree;
    private IDualTreeRules rules;

    @BeforeEach
    public void setUp() {
        queryTree = buildTree(ExampleDataSets.generateUniform(100, 2, 1), 10);
        referenceTree = buildTree(ExampleDataSets.generateUniform(150, 2, 2), 10);
        rules = mock(IDualTreeRules.class);
    }

    private static int countLeaves(KdTree tree) {
        int leaves = 0;
        for (int i = 0; i < tree.getNodeCount(); i++) {
            if (tree.getNode(i).isLeaf()) {
                leaves++;
            }
        }
        return leaves;
    }

    @Test
    public void testWithoutPruningEveryPairOfLeavesIsEvaluated() {
        when(rules.prune(any(), any())).thenReturn(false);
        when(rules.getNumberOfDistanceComputations()).thenReturn(15000L);

        TraversalInfo info = new DualTreeTraverser(rules).traverse(queryTree.getRoot(), referenceTree.getRoot());

        long expected = (long) countLeaves(queryTree) * countLeaves(referenceTree);
        assertThat(info.getNumberOfBaseCases(), is(expected));
        assertThat(info.getNumberOfPrunes(), is(0L));
        assertThat(info.getNumberOfDistanceComputations(), is(15000L));
        verify(rules, times((int) expected)).baseCase(any(), any());
        verify(rules, times((int) info.getNumberOfVisits())).prune(any(), any());
    }

    @Test
    public void testPruneAtRoot() {
        when(rules.prune(any(), any())).thenReturn(true);

        TraversalInfo info = new DualTreeTraverser(rules).traverse(queryTree.getRoot(), referenceTree.getRoot());

        assertThat(info.getNumberOfVisits(), is(1L));
        assertThat(info.getNumberOfPrunes(), is(1L));
        assertThat(info.getNumberOfBaseCases(), is(0L));
        verify(rules, never()).baseCase(any(), any());
        verify(rules, never()).descend(any());
        verify(rules, never()).combine(any());
    }

    @Test
    public void testDescendAndCombineWrapTheChildren() {
        when(rules.prune(any(), any())).thenReturn(false);
        Node root = queryTree.getRoot();

        new DualTreeTraverser(rules).traverse(root, referenceTree.getRoot());

        InOrder order = inOrder(rules);
        order.verify(rules).descend(root);
        order.verify(rules).prune(root.getLeftChild(), referenceTree.getRoot().getLeftChild());
        order.verify(rules).combine(root.getLeftChild());
        order.verify(rules).combine(root);
    }

    @Test
    public void testReferenceChildrenAreVisitedBestFirst() {
        Node queryLeaf = queryTree.getNode(0);
        while (!queryLeaf.isLeaf()) {
            queryLeaf = queryLeaf.getLeftChild();
        }
        Node referenceRoot = referenceTree.getRoot();
        when(rules.prune(any(), any())).thenReturn(false);
        when(rules.score(queryLeaf, referenceRoot.getLeftChild())).thenReturn(2.0);
        when(rules.score(queryLeaf, referenceRoot.getRightChild())).thenReturn(1.0);

        new DualTreeTraverser(rules).traverse(queryLeaf, referenceRoot);

        InOrder order = inOrder(rules);
        order.verify(rules).prune(queryLeaf, referenceRoot.getRightChild());
        order.verify(rules).prune(queryLeaf, referenceRoot.getLeftChild());
    }

    @Test
    public void testTraverserIsReusable() {
        when(rules.prune(any(), any())).thenReturn(false);
        DualTreeTraverser traverser = new DualTreeTraverser(rules);
        TraversalInfo first = traverser.traverse(queryTree.getRoot(), referenceTree.getRoot());
        TraversalInfo second = traverser.traverse(queryTree.getRoot(), referenceTree.getRoot());
        assertThat(second.getNumberOfVisits(), is(first.getNumberOfVisits()));
        assertThat(second.getNumberOfBaseCases(), is(first.getNumberOfBaseCases()));
    }

    @Test
    public void testNullArguments() {
        assertThrows(NullPointerException.class, () -> new DualTreeTraverser(null));
        DualTreeTraverser traverser = new DualTreeTraverser(rules);
        assertThrows(NullPointerException.class, () -> traverser.traverse(null, referenceTree.getRoot()));
        assertThrows(NullPointerException.class, () -> traverser.traverse(queryTree.getRoot(), null));
    }
}
