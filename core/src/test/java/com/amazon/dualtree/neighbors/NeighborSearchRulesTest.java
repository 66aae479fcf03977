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

import static com.amazon.dualtree.TestUtils.buildTree;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.stream.Stream;

import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.provider.ArgumentsSource;

import com.amazon.dualtree.testutils.ExampleDataSets;
import com.amazon.dualtree.traversal.DualTreeTraverser;
import com.amazon.dualtree.tree.KdTree;
import com.amazon.dualtree.tree.Node;

public class NeighborSearchRulesTest {

    static class PolicyProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext context) {
            return Stream.of(Arguments.of(new NearestNeighborSort(), 0.0),
                    Arguments.of(new NearestNeighborSort(), 0.2), Arguments.of(new FurthestNeighborSort(), 0.0),
                    Arguments.of(new FurthestNeighborSort(), 0.2));
        }
    }

    @ParameterizedTest
    @ArgumentsSource(PolicyProvider.class)
    public void testStatisticsAfterTraversal(ISortPolicy sortPolicy, double relativeError) {
        KdTree tree = buildTree(ExampleDataSets.generateUniform(500, 2, 21), 8);
        NeighborTable table = new NeighborTable(tree.size(), 3, sortPolicy);
        NeighborSearchRules rules = new NeighborSearchRules(tree, tree, table, sortPolicy, relativeError);
        new DualTreeTraverser(rules).traverse(tree.getRoot(), tree.getRoot());

        for (int i = 0; i < tree.getNodeCount(); i++) {
            Node node = tree.getNode(i);
            double bound = rules.getStatistic(node).getBound();

            // the bound holds for every point below the node
            for (int q = node.getBegin(); q < node.getEnd(); q++) {
                assertFalse(sortPolicy.isBetter(bound, table.getWorstDistance(q)));
            }

            if (!node.isLeaf()) {
                double childBound = sortPolicy.worseOf(rules.getStatistic(node.getLeftChild()).getBound(),
                        rules.getStatistic(node.getRightChild()).getBound());
                assertThat(sortPolicy.betterOf(bound, childBound), is(bound));
            }
        }
    }
}
