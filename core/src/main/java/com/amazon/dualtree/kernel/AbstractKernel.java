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
package com.amazon.dualtree.kernel;

import static com.amazon.dualtree.CommonUtils.checkArgument;

import org.apache.commons.math3.special.Gamma;

/**
 * Holds the bandwidth shared by all kernels.
 */
public abstract class AbstractKernel implements IKernel {

    protected final double bandwidth;

    protected AbstractKernel(double bandwidth) {
        checkArgument(bandwidth > 0 && !Double.isInfinite(bandwidth), "bandwidth must be positive and finite");
        this.bandwidth = bandwidth;
    }

    @Override
    public double getBandwidth() {
        return bandwidth;
    }

    /**
     * @param dimensions the dimension of the space
     * @return the volume of the unit ball in {@code R^dimensions}
     */
    public static double unitBallVolume(int dimensions) {
        checkArgument(dimensions > 0, "dimensions must be greater than 0");
        return Math.pow(Math.PI, dimensions / 2.0) / Gamma.gamma(dimensions / 2.0 + 1);
    }

    @Override
    public String toString() {
        return String.format("%s(%f)", getClass().getSimpleName(), bandwidth);
    }
}
