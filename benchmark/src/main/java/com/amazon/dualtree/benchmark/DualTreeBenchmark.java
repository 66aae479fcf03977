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
package com.amazon.dualtree.benchmark;

import com.amazon.dualtree.config.SplitMethod;
import com.amazon.dualtree.kde.KernelSum;
import com.amazon.dualtree.kernel.GaussianKernel;
import com.amazon.dualtree.neighbors.NeighborSearch;
import com.amazon.dualtree.returntypes.KernelSumResult;
import com.amazon.dualtree.returntypes.NeighborSearchResult;
import com.amazon.dualtree.store.PointSet;
import com.amazon.dualtree.testutils.NormalMixtureTestData;
import com.amazon.dualtree.tree.KdTree;
import com.amazon.dualtree.tree.TreeBuilder;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class DualTreeBenchmark {

    public final static int DATA_SIZE = 10_000;

    public final static int NUMBER_OF_NEIGHBORS = 5;

    @State(Scope.Benchmark)
    public static class TreeState {
        @Param({"2", "8"})
        int dimensions;

        @Param({"10", "40"})
        int leafSize;

        @Param({"MIDPOINT", "MEDIAN"})
        SplitMethod splitMethod;

        double[][] data;
        TreeBuilder treeBuilder;
        KdTree tree;

        @Setup(Level.Trial)
        public void setUpData() {
            NormalMixtureTestData testData = new NormalMixtureTestData();
            data = testData.generateTestData(DATA_SIZE, dimensions, 99);
            treeBuilder = TreeBuilder.builder()
                    .leafSize(leafSize)
                    .splitMethod(splitMethod)
                    .build();
            tree = treeBuilder.build(new PointSet(data));
        }
    }

    @State(Scope.Benchmark)
    public static class ToleranceState {
        @Param({"0.0", "0.05", "0.2"})
        double relativeError;
    }

    @Benchmark
    public KdTree buildTree(TreeState state) {
        return state.treeBuilder.build(new PointSet(state.data));
    }

    @Benchmark
    public NeighborSearchResult dualTreeNeighbors(TreeState state, ToleranceState tolerance, Blackhole blackhole) {
        NeighborSearchResult result = NeighborSearch.builder()
                .referenceTree(state.tree)
                .build()
                .search(NUMBER_OF_NEIGHBORS, tolerance.relativeError);
        blackhole.consume(result.getNumberOfDistanceComputations());
        return result;
    }

    @Benchmark
    public NeighborSearchResult rankApproximateNeighbors(TreeState state, Blackhole blackhole) {
        NeighborSearchResult result = NeighborSearch.builder()
                .referenceTree(state.tree)
                .randomSeed(17)
                .build()
                .searchApproximate(NUMBER_OF_NEIGHBORS, 1.0);
        blackhole.consume(result.getNumberOfSamples());
        return result;
    }

    @Benchmark
    public NeighborSearchResult naiveNeighbors(TreeState state) {
        return NeighborSearch.builder()
                .referenceTree(state.tree)
                .build()
                .searchNaive(NUMBER_OF_NEIGHBORS);
    }

    @Benchmark
    public KernelSumResult kernelSum(TreeState state, ToleranceState tolerance, Blackhole blackhole) {
        KernelSumResult result = KernelSum.builder()
                .referenceTree(state.tree)
                .kernel(new GaussianKernel(1.0))
                .build()
                .compute(tolerance.relativeError);
        blackhole.consume(result.getNumberOfFiniteDifferencePrunes());
        return result;
    }

    @Benchmark
    public KernelSumResult monteCarloKernelSum(TreeState state, ToleranceState tolerance, Blackhole blackhole) {
        KernelSumResult result = KernelSum.builder()
                .referenceTree(state.tree)
                .kernel(new GaussianKernel(1.0))
                .probability(0.95)
                .randomSeed(17)
                .build()
                .compute(tolerance.relativeError);
        blackhole.consume(result.getNumberOfMonteCarloPrunes());
        return result;
    }
}
