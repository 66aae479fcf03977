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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class NeighborTableTest {

    @Test
    public void testNearestInsertKeepsOrder() {
        NeighborTable table = new NeighborTable(2, 3, new NearestNeighborSort());
        assertThat(table.getWorstDistance(0), is(Double.MAX_VALUE));
        assertThat(table.getIndex(0, 0), is(-1));

        assertTrue(table.insert(0, 5.0, 10));
        assertTrue(table.insert(0, 1.0, 11));
        assertTrue(table.insert(0, 3.0, 12));
        assertTrue(table.insert(0, 2.0, 13));
        assertFalse(table.insert(0, 4.0, 14));

        assertThat(table.getDistance(0, 0), is(1.0));
        assertThat(table.getIndex(0, 0), is(11));
        assertThat(table.getDistance(0, 1), is(2.0));
        assertThat(table.getIndex(0, 1), is(13));
        assertThat(table.getDistance(0, 2), is(3.0));
        assertThat(table.getIndex(0, 2), is(12));
        assertThat(table.getWorstDistance(0), is(3.0));

        // the other query is untouched
        assertThat(table.getIndex(1, 0), is(-1));
    }

    @Test
    public void testDuplicateReferenceIsRejected() {
        NeighborTable table = new NeighborTable(1, 2, new NearestNeighborSort());
        assertTrue(table.insert(0, 1.0, 4));
        assertFalse(table.insert(0, 1.0, 4));
        assertThat(table.getIndex(0, 1), is(-1));
    }

    @Test
    public void testFurthest() {
        NeighborTable table = new NeighborTable(1, 2, new FurthestNeighborSort());
        assertFalse(table.insert(0, 0.0, 1));
        assertTrue(table.insert(0, 1.0, 2));
        assertTrue(table.insert(0, 3.0, 3));
        assertTrue(table.insert(0, 2.0, 4));
        assertThat(table.getIndex(0, 0), is(3));
        assertThat(table.getIndex(0, 1), is(4));
        assertThat(table.getWorstDistance(0), is(2.0));

        table.reset();
        assertThat(table.getWorstDistance(0), is(0.0));
        assertThat(table.getIndex(0, 0), is(-1));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new NeighborTable(0, 1, new NearestNeighborSort()));
        assertThrows(IllegalArgumentException.class, () -> new NeighborTable(1, 0, new NearestNeighborSort()));
    }
}
