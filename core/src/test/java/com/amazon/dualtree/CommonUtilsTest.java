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
package com.amazon.dualtree;

import static com.amazon.dualtree.CommonUtils.checkArgument;
import static com.amazon.dualtree.CommonUtils.checkNotNull;
import static com.amazon.dualtree.CommonUtils.checkRelativeError;
import static com.amazon.dualtree.CommonUtils.checkState;
import static com.amazon.dualtree.CommonUtils.validateInternalState;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class CommonUtilsTest {

    @Test
    public void testChecks() {
        assertDoesNotThrow(() -> checkArgument(true, "ok"));
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> checkArgument(false, "bad argument"));
        assertThat(exception.getMessage(), is("bad argument"));
        assertThrows(IllegalArgumentException.class, () -> checkArgument(false, () -> "lazy"));
        assertThrows(IllegalStateException.class, () -> checkState(false, "bad state"));
        assertThrows(IllegalStateException.class, () -> validateInternalState(false, "bad state"));
        assertThrows(NullPointerException.class, () -> checkNotNull(null, "null"));
        assertThat(checkNotNull("value", "null"), is("value"));
    }

    @ParameterizedTest
    @ValueSource(doubles = { -0.1, 1.0, 1.5, Double.NaN })
    public void testInvalidRelativeError(double relativeError) {
        assertThrows(IllegalArgumentException.class, () -> checkRelativeError(relativeError));
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, 0.01, 0.5, 0.999 })
    public void testValidRelativeError(double relativeError) {
        assertDoesNotThrow(() -> checkRelativeError(relativeError));
    }
}
