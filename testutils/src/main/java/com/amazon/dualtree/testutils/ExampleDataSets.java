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

import static java.lang.Math.PI;
import static java.lang.Math.cos;
import static java.lang.Math.sin;

import java.util.Random;

/**
 * Small synthetic point sets with a known shape. These are used to exercise
 * trees on clustered, uniform and degenerate inputs.
 */
public class ExampleDataSets {

    public static double[][] generateFan(int numberPerBlade, int numberOfBlades) {
        if ((numberOfBlades > 12) || (numberPerBlade <= 0))
            return null;
        int newDimensions = 2;
        int dataSize = numberOfBlades * numberPerBlade;

        Random prg = new Random(0);
        NormalMixtureTestData generator = new NormalMixtureTestData(1, 0.0, 1.0);
        double[][] data = generator.generateTestData(dataSize, newDimensions, 100);

        double[][] transformedData = new double[data.length][newDimensions];
        for (int j = 0; j < data.length; j++) {

            // shrink

            transformedData[j][0] = 0.05 * data[j][0];
            transformedData[j][1] = 0.2 * data[j][1];
            double toss = prg.nextDouble();

            // rotate
            int i = 0;
            while (i < numberOfBlades + 1) {
                if (toss < i * 1.0 / numberOfBlades) {
                    double[] vec = rotateClockWise(transformedData[j], 2 * PI * i / numberOfBlades);
                    transformedData[j][0] = vec[0] + 0.6 * sin(2 * PI * i / numberOfBlades);
                    transformedData[j][1] = vec[1] + 0.6 * cos(2 * PI * i / numberOfBlades);
                    break;
                } else
                    ++i;
            }
        }
        return transformedData;

    }

    public static double[] rotateClockWise(double[] point, double theta) {
        double[] result = new double[2];
        result[0] = cos(theta) * point[0] + sin(theta) * point[1];
        result[1] = -sin(theta) * point[0] + cos(theta) * point[1];
        return result;
    }

    /**
     * Points drawn uniformly from the cube {@code [0, 1)^dimensions}.
     */
    public static double[][] generateUniform(int size, int dimensions, long seed) {
        Random prg = new Random(seed);
        double[][] data = new double[size][dimensions];
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < dimensions; j++) {
                data[i][j] = prg.nextDouble();
            }
        }
        return data;
    }

    /**
     * Points on an integer grid where every grid point is repeated
     * {@code copies} times. Useful for checking ties and duplicate coordinates.
     */
    public static double[][] generateGrid(int pointsPerSide, int copies) {
        double[][] data = new double[pointsPerSide * pointsPerSide * copies][2];
        int index = 0;
        for (int c = 0; c < copies; c++) {
            for (int i = 0; i < pointsPerSide; i++) {
                for (int j = 0; j < pointsPerSide; j++) {
                    data[index][0] = i;
                    data[index][1] = j;
                    index++;
                }
            }
        }
        return data;
    }
}
