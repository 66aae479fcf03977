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
package com.amazon.dualtree;

import com.amazon.dualtree.config.SplitMethod;
import com.amazon.dualtree.store.PointSet;
import com.amazon.dualtree.tree.KdTree;
import com.amazon.dualtree.tree.TreeBuilder;

public class TestUtils {
    public static final double EPSILON = 1e-6;

    /**
     * Build a tree over a copy of the given points.
     */
    public static KdTree buildTree(double[][] points, int leafSize, SplitMethod splitMethod) {
        return TreeBuilder.builder().leafSize(leafSize).splitMethod(splitMethod).build()
                .build(new PointSet(points));
    }

    public static KdTree buildTree(double[][] points, int leafSize) {
        return buildTree(points, leafSize, TreeBuilder.DEFAULT_SPLIT_METHOD);
    }

    public static double distance(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double t = a[i] - b[i];
            sum += t * t;
        }
        return Math.sqrt(sum);
    }
}
