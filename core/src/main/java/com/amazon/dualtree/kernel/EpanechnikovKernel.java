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

/**
 * {@code max(0, 1 - d^2 / h^2)}.
 */
public class EpanechnikovKernel extends AbstractKernel {

    public EpanechnikovKernel(double bandwidth) {
        super(bandwidth);
    }

    @Override
    public double evaluate(double distance) {
        double u = distance / bandwidth;
        return Math.max(0, 1 - u * u);
    }

    @Override
    public double getNormalizationConstant(int dimensions) {
        return unitBallVolume(dimensions) * 2.0 / (dimensions + 2) * Math.pow(bandwidth, dimensions);
    }
}
