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

import static com.amazon.dualtree.CommonUtils.checkArgument;
import static com.amazon.dualtree.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * The reordering applied to a point set by tree construction.
 * {@code getOldFromNew(i)} is the original index of the point now stored at
 * position {@code i}, and {@code getNewFromOld} is its inverse. A Permutation
 * is a bijection on {@code [0, size)} and is immutable.
 */
public final class Permutation {

    private final int[] oldFromNew;

    private final int[] newFromOld;

    /**
     * Creates a permutation from the {@code oldFromNew} array, which is copied.
     * The inverse is computed once.
     *
     * @param oldFromNew original index of each reordered position
     * @throws IllegalArgumentException if the array is not a bijection on
     *                                  {@code [0, oldFromNew.length)}
     */
    public Permutation(int[] oldFromNew) {
        checkNotNull(oldFromNew, "oldFromNew must not be null");
        this.oldFromNew = Arrays.copyOf(oldFromNew, oldFromNew.length);
        this.newFromOld = new int[oldFromNew.length];
        Arrays.fill(newFromOld, -1);
        for (int i = 0; i < oldFromNew.length; i++) {
            int old = oldFromNew[i];
            checkArgument(old >= 0 && old < oldFromNew.length, "index out of range in permutation");
            checkArgument(newFromOld[old] == -1, "duplicate index in permutation");
            newFromOld[old] = i;
        }
    }

    public int size() {
        return oldFromNew.length;
    }

    public int getOldFromNew(int newIndex) {
        return oldFromNew[newIndex];
    }

    public int getNewFromOld(int oldIndex) {
        return newFromOld[oldIndex];
    }

    public int[] getOldFromNew() {
        return Arrays.copyOf(oldFromNew, oldFromNew.length);
    }

    public int[] getNewFromOld() {
        return Arrays.copyOf(newFromOld, newFromOld.length);
    }

    /**
     * Rearranges values stored by reordered position into the original order.
     *
     * @param values one value per reordered position
     * @return a new array where entry {@code j} holds the value of original
     *         point {@code j}
     */
    public double[] toOriginalOrder(double[] values) {
        checkArgument(values.length == oldFromNew.length, "incorrect length");
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[oldFromNew[i]] = values[i];
        }
        return result;
    }

    /**
     * Translates indices that refer to reordered positions into original
     * indices. Negative entries mark missing values and are kept.
     */
    public int[] toOriginalIndices(int[] newIndices) {
        int[] result = new int[newIndices.length];
        for (int i = 0; i < newIndices.length; i++) {
            result[i] = (newIndices[i] < 0) ? newIndices[i] : oldFromNew[newIndices[i]];
        }
        return result;
    }
}
