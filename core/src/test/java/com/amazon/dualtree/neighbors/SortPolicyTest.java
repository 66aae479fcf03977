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

import static com.amazon.dualtree.TestUtils.EPSILON;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.amazon.dualtree.tree.BoundingBox;

public class SortPolicyTest {

    private final BoundingBox query = new BoundingBox(new double[] { 0.0, 0.0 }, new double[] { 1.0, 1.0 });
    private final BoundingBox near = new BoundingBox(new double[] { 2.0, 0.0 }, new double[] { 3.0, 1.0 });
    private final BoundingBox far = new BoundingBox(new double[] { 10.0, 0.0 }, new double[] { 11.0, 1.0 });

    @Test
    public void testNearest() {
        ISortPolicy policy = new NearestNeighborSort();
        assertTrue(policy.isBetter(1.0, 2.0));
        assertFalse(policy.isBetter(2.0, 2.0));
        assertTrue(policy.isBetter(policy.getBestDistance(), 1.0));
        assertTrue(policy.isBetter(1e300, policy.getWorstDistance()));
        assertThat(policy.betterOf(1.0, 2.0), is(1.0));
        assertThat(policy.worseOf(1.0, 2.0), is(2.0));
        assertThat(policy.bestDistance(query, near), closeTo(1.0, EPSILON));
        assertThat(policy.relax(2.2, 0.1), closeTo(2.0, EPSILON));
        assertThat(policy.score(query, near), lessThan(policy.score(query, far)));
    }

    @Test
    public void testFurthest() {
        ISortPolicy policy = new FurthestNeighborSort();
        assertTrue(policy.isBetter(2.0, 1.0));
        assertFalse(policy.isBetter(2.0, 2.0));
        assertTrue(policy.isBetter(1e-300, policy.getWorstDistance()));
        assertThat(policy.betterOf(1.0, 2.0), is(2.0));
        assertThat(policy.worseOf(1.0, 2.0), is(1.0));
        assertThat(policy.bestDistance(query, near), closeTo(Math.sqrt(10.0), EPSILON));
        assertThat(policy.relax(2.0, 0.1), closeTo(2.2, EPSILON));
        assertThat(policy.score(query, far), lessThan(policy.score(query, near)));
    }
}
