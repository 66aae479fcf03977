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

import org.apache.commons.math3.special.Gamma;

/**
 * {@code exp(-d / h)}.
 */
public class LaplacianKernel extends AbstractKernel {

    public LaplacianKernel(double bandwidth) {
        super(bandwidth);
    }

    @Override
    public double evaluate(double distance) {
        return Math.exp(-distance / bandwidth);
    }

    @Override
    public double getNormalizationConstant(int dimensions) {
        return unitBallVolume(dimensions) * Gamma.gamma(dimensions + 1.0) * Math.pow(bandwidth, dimensions);
    }
}
