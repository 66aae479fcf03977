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

package com.amazon.dualtree.testutils;

import java.util.Random;

/**
 * This class samples points from a mixture of multi-variate normal
 * distributions with covariance matrices of the form sigma * I. The centers of
 * the components are placed uniformly at random in the cube
 * {@code [-spread, spread]^d} and every point picks its component uniformly at
 * random. All randomness is derived from the seed, so two calls with the same
 * arguments produce the same data.
 */
public class NormalMixtureTestData {

    private final int numberOfComponents;
    private final double spread;
    private final double sigma;

    public NormalMixtureTestData(int numberOfComponents, double spread, double sigma) {
        if (numberOfComponents <= 0) {
            throw new IllegalArgumentException("numberOfComponents must be greater than 0");
        }
        this.numberOfComponents = numberOfComponents;
        this.spread = spread;
        this.sigma = sigma;
    }

    public NormalMixtureTestData() {
        this(4, 10.0, 1.0);
    }

    public double[][] generateTestData(int numberOfRows, int numberOfColumns) {
        return generateTestData(numberOfRows, numberOfColumns, 0);
    }

    public double[][] generateTestData(int numberOfRows, int numberOfColumns, int seed) {
        Random rng = new Random(seed);
        NormalDistribution dist = new NormalDistribution(rng);

        double[][] centers = new double[numberOfComponents][numberOfColumns];
        for (int i = 0; i < numberOfComponents; i++) {
            for (int j = 0; j < numberOfColumns; j++) {
                centers[i][j] = spread * (2 * rng.nextDouble() - 1);
            }
        }

        double[][] result = new double[numberOfRows][numberOfColumns];
        for (int i = 0; i < numberOfRows; i++) {
            fillRow(result[i], dist, centers[rng.nextInt(numberOfComponents)], sigma);
        }
        return result;
    }

    /**
     * Generates a vector of positive weights, one for each row.
     *
     * @param numberOfRows the number of weights
     * @param seed         random seed
     * @return weights drawn uniformly from {@code [0.5, 1.5)}
     */
    public static double[] generateWeights(int numberOfRows, int seed) {
        Random rng = new Random(seed);
        double[] weights = new double[numberOfRows];
        for (int i = 0; i < numberOfRows; i++) {
            weights[i] = 0.5 + rng.nextDouble();
        }
        return weights;
    }

    private void fillRow(double[] row, NormalDistribution dist, double[] mu, double sigma) {
        for (int j = 0; j < row.length; j++) {
            row[j] = dist.nextDouble(mu[j], sigma);
        }
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // apply the Box-Muller transform to produce Normal variates
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
