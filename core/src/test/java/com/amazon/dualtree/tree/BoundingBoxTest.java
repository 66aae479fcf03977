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

import static com.amazon.dualtree.TestUtils.EPSILON;
import static com.amazon.dualtree.TestUtils.distance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.dualtree.store.PointSet;
import com.amazon.dualtree.testutils.ExampleDataSets;

public class BoundingBoxTest {

    private double[] point1;
    private double[] point2;
    private BoundingBox box1;
    private BoundingBox box2;

    @BeforeEach
    public void setUp() {
        point1 = new double[] { 1.5, 2.7 };
        point2 = new double[] { 3.0, 1.2 };
        box1 = new BoundingBox(point1);
        box2 = new BoundingBox(point2);
    }

    @Test
    public void testNewFromSinglePoint() {
        assertThat(box1.getDimensions(), is(2));
        assertThat(box1.getMinValue(0), is(point1[0]));
        assertThat(box1.getMaxValue(0), is(point1[0]));
        assertThat(box1.getRange(0), is(0.0));
        assertThat(box1.getMinValue(1), is(point1[1]));
        assertThat(box1.getMaxValue(1), is(point1[1]));
        assertThat(box1.getRange(1), is(0.0));
        assertThat(box1.getRangeSum(), is(0.0));
    }

    @Test
    public void testGetMergedBoxWithOtherBox() {
        BoundingBox mergedBox = box1.getMergedBox(box2);

        assertThat(mergedBox.getDimensions(), is(2));
        assertThat(mergedBox.getMinValue(0), is(1.5));
        assertThat(mergedBox.getMaxValue(0), is(3.0));
        assertThat(mergedBox.getRange(0), closeTo(3.0 - 1.5, EPSILON));
        assertThat(mergedBox.getMinValue(1), is(1.2));
        assertThat(mergedBox.getMaxValue(1), is(2.7));
        assertThat(mergedBox.getRange(1), closeTo(2.7 - 1.2, EPSILON));
        assertThat(mergedBox.getRangeSum(), closeTo((3.0 - 1.5) + (2.7 - 1.2), EPSILON));
        assertThat(mergedBox.getWidestDimension(), is(0));
        assertThat(mergedBox.getMidpoint(1), closeTo(1.95, EPSILON));

        // check that box1 and box2 were not changed
        assertThat(box1.getRangeSum(), is(0.0));
        assertThat(box2.getRangeSum(), is(0.0));
    }

    @Test
    public void testAddPoint() {
        BoundingBox box = box1.copy().addPoint(point2);
        assertThat(box, is(box1.getMergedBox(box2)));
        assertNotEquals(box, box1);
        assertThrows(IllegalArgumentException.class, () -> box1.addPoint(new double[] { 1.0 }));
    }

    @Test
    public void testOf() {
        PointSet points = new PointSet(new double[][] { { 0.0, 5.0 }, { 1.0, -1.0 }, { 3.0, 2.0 } });
        BoundingBox box = BoundingBox.of(points, 1, 3);
        assertThat(box, is(new BoundingBox(new double[] { 1.0, -1.0 }, new double[] { 3.0, 2.0 })));
        assertThrows(IllegalArgumentException.class, () -> BoundingBox.of(points, 1, 1));
    }

    @Test
    public void testContains() {
        BoundingBox box = new BoundingBox(new double[] { 0.0, 0.0 }, new double[] { 1.0, 1.0 });
        assertTrue(box.contains(new double[] { 1.0, 0.5 }));
        assertFalse(box.contains(new double[] { 1.1, 0.5 }));
        assertTrue(box.contains(new BoundingBox(new double[] { 0.5, 0.5 })));
        assertFalse(box.contains(box1));
        assertThrows(IllegalArgumentException.class,
                () -> new BoundingBox(new double[] { 1.0 }, new double[] { 0.0 }));
    }

    @Test
    public void testDistancesBetweenBoxes() {
        BoundingBox a = new BoundingBox(new double[] { 0.0, 0.0 }, new double[] { 1.0, 1.0 });
        BoundingBox b = new BoundingBox(new double[] { 4.0, 0.5 }, new double[] { 5.0, 3.0 });
        assertThat(a.minDistance(b), closeTo(3.0, EPSILON));
        assertThat(b.minDistance(a), closeTo(3.0, EPSILON));
        assertThat(a.maxDistance(b), closeTo(Math.sqrt(25.0 + 9.0), EPSILON));

        BoundingBox overlapping = new BoundingBox(new double[] { 0.5, 0.5 }, new double[] { 2.0, 2.0 });
        assertThat(a.minDistance(overlapping), is(0.0));

        assertThat(a.minDistance(new double[] { 2.0, 2.0 }), closeTo(Math.sqrt(2.0), EPSILON));
        assertThat(a.maxDistance(new double[] { 2.0, 2.0 }), closeTo(Math.sqrt(8.0), EPSILON));
        assertThat(a.minDistance(new double[] { 0.5, 0.5 }), is(0.0));
    }

    @Test
    public void testAdmissibility() {
        Random random = new Random(17);
        for (int trial = 0; trial < 50; trial++) {
            double[][] first = ExampleDataSets.generateUniform(10, 3, random.nextLong());
            double[][] second = ExampleDataSets.generateUniform(10, 3, random.nextLong());
            double shift = 2 * random.nextDouble() - 1;
            for (double[] point : second) {
                point[0] += shift;
            }
            BoundingBox a = BoundingBox.of(new PointSet(first), 0, first.length);
            BoundingBox b = BoundingBox.of(new PointSet(second), 0, second.length);
            double min = a.minDistance(b);
            double max = a.maxDistance(b);
            for (double[] p : first) {
                assertThat(a.minDistance(p), is(0.0));
                for (double[] q : second) {
                    double d = distance(p, q);
                    assertThat(d, greaterThanOrEqualTo(min - EPSILON));
                    assertThat(d, lessThanOrEqualTo(max + EPSILON));
                    assertThat(d, greaterThanOrEqualTo(b.minDistance(p) - EPSILON));
                    assertThat(d, lessThanOrEqualTo(b.maxDistance(p) + EPSILON));
                }
            }
        }
    }
}
