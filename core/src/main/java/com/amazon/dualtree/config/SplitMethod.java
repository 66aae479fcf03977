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
package com.amazon.dualtree.config;

/**
 * Options for choosing the value at which a node is divided along its widest
 * dimension.
 */
public enum SplitMethod {
    /**
     * Split at the midpoint of the range of the bounding box. This is cheap and
     * keeps the boxes close to cubical.
     */
    MIDPOINT,
    /**
     * Split at the median coordinate of the points in the node, which produces
     * balanced trees on skewed data. A median equal to the minimum or maximum
     * coordinate is replaced by the midpoint.
     */
    MEDIAN;
}
