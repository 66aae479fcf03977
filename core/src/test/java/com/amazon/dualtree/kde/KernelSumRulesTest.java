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
package com.amazon.dualtree.kde;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.dualtree.kernel.GaussianKernel;
import com.amazon.dualtree.store.PointSet;
import com.amazon.dualtree.testutils.ExampleDataSets;
import com.amazon.dualtree.testutils.NormalMixtureTestData;
import com.amazon.dualtree.traversal.DualTreeTraverser;
import com.amazon.dualtree.tree.KdTree;
import com.amazon.dualtree.tree.Node;
import com.amazon.dualtree.tree.TreeBuilder;

public class KernelSumRulesTest {

    private static final double TOLERANCE = 1e-9;

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, 0.1 })
    public void testStatisticsAfterPostProcess(double relativeError) {
        double[][] data = new NormalMixtureTestData(4, 10.0, 1.0).generateTestData(800, 2, 41);
        double[] weights = NormalMixtureTestData.generateWeights(data.length, 42);
        KdTree tree = TreeBuilder.builder().leafSize(8).build().build(new PointSet(data, weights));
        KernelSumRules rules = new KernelSumRules(tree, tree, new GaussianKernel(1.0), relativeError, 1.0, 25,
                new Random(0));

        new DualTreeTraverser(rules).traverse(tree.getRoot(), tree.getRoot());
        rules.postProcess(tree.getRoot());

        double totalWeight = rules.getTotalWeight();
        for (int i = 0; i < tree.getNodeCount(); i++) {
            Node node = tree.getNode(i);
            KernelSumStat stat = rules.getStatistic(node);
            assertThat(stat.getPostponedLower(), is(0.0));
            assertThat(stat.getPostponedUpper(), is(0.0));
            assertThat(stat.getPostponedPrunedWeight(), is(0.0));

            // every reference point is accounted for exactly once
            assertThat(stat.getPrunedWeight(), closeTo(totalWeight, TOLERANCE * totalWeight));

            for (int q = node.getBegin(); q < node.getEnd(); q++) {
                assertThat(stat.getMassLower(), lessThanOrEqualTo(rules.getDensityLower()[q]));
                assertThat(stat.getMassUpper(), greaterThanOrEqualTo(rules.getDensityUpper()[q]));
                assertThat(stat.getUsedError(), greaterThanOrEqualTo(rules.getUsedError()[q]));
                assertThat(rules.getDensityLower()[q],
                        lessThanOrEqualTo(rules.getDensityUpper()[q] + TOLERANCE * totalWeight));
            }

            if (!node.isLeaf()) {
                KernelSumStat left = rules.getStatistic(node.getLeftChild());
                KernelSumStat right = rules.getStatistic(node.getRightChild());
                assertThat(stat.getMassLower(), is(Math.min(left.getMassLower(), right.getMassLower())));
                assertThat(stat.getMassUpper(), is(Math.max(left.getMassUpper(), right.getMassUpper())));
                assertThat(stat.getUsedError(), is(Math.max(left.getUsedError(), right.getUsedError())));
            }
        }
    }

    @Test
    public void testZeroWeightReferenceNodeLeavesBoundsUntouched() {
        // two groups separated along x; the group at x > 0 carries no weight
        double[][] data = new double[200][];
        double[] weights = new double[200];
        double[][] left = ExampleDataSets.generateUniform(100, 2, 51);
        double[][] right = ExampleDataSets.generateUniform(100, 2, 52);
        for (int i = 0; i < 100; i++) {
            data[i] = new double[] { left[i][0] - 10.0, left[i][1] };
            weights[i] = 1.0;
            data[100 + i] = new double[] { right[i][0] + 9.0, right[i][1] };
            weights[100 + i] = 0.0;
        }
        KdTree tree = TreeBuilder.builder().leafSize(10).build().build(new PointSet(data, weights));
        Node root = tree.getRoot();
        Node weightless = root.getRightChild();
        assertThat(tree.getPointSet().getWeightSum(weightless.getBegin(), weightless.getEnd()), is(0.0));

        KernelSumRules rules = new KernelSumRules(tree, tree, new GaussianKernel(1.0), 0.1, 1.0, 25,
                new Random(0));
        KernelSumStat stat = rules.getStatistic(root);
        double massLower = stat.getMassLower();
        double massUpper = stat.getMassUpper();

        assertTrue(rules.prune(root, weightless));
        assertThat(stat.getMassLower(), is(massLower));
        assertThat(stat.getMassUpper(), is(massUpper));
        assertThat(stat.getPostponedLower(), is(0.0));
        assertThat(stat.getPostponedEstimate(), is(0.0));
        assertThat(stat.getPostponedUpper(), is(0.0));
        assertThat(stat.getPostponedUsedError(), is(0.0));
        assertThat(stat.getPostponedPrunedWeight(), is(0.0));
        assertThat(rules.getNumberOfFiniteDifferencePrunes(), is(0L));
        assertThat(rules.getNumberOfDistanceComputations(), is(0L));
    }
}
