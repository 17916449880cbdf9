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

package com.hyperdx.anomaly.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.hyperdx.anomaly.ConfigurationException;

public class AggregationModeTest {

    @ParameterizedTest
    @EnumSource(AggregationMode.class)
    public void testConfigNameRoundTrip(AggregationMode mode) {
        assertEquals(mode, AggregationMode.fromConfigName(mode.getConfigName()));
    }

    @Test
    public void testNames() {
        assertEquals(AggregationMode.ANY, AggregationMode.fromConfigName("any"));
        assertEquals(AggregationMode.COMBINED, AggregationMode.fromConfigName("combined"));
    }

    @Test
    public void testUnknownMode() {
        assertThrows(ConfigurationException.class, () -> AggregationMode.fromConfigName("majority"));
        assertThrows(ConfigurationException.class, () -> AggregationMode.fromConfigName("ANY"));
        assertThrows(ConfigurationException.class, () -> AggregationMode.fromConfigName(null));
    }

    @ParameterizedTest
    @EnumSource(DetectorType.class)
    public void testDetectorTypeNames(DetectorType type) {
        assertEquals(type, DetectorType.fromConfigName(type.getConfigName()).get());
        assertEquals(type, DetectorType.fromDetailsKey(type.getDetailsKey()).get());
        assertFalse(DetectorType.fromConfigName(type.getConfigName().toUpperCase()).isPresent());
    }

    @Test
    public void testDetailsKeys() {
        assertEquals("zscore", DetectorType.ZSCORE.getDetailsKey());
        assertEquals("changepoint", DetectorType.CHANGE_POINT.getDetailsKey());
        assertEquals("isolation", DetectorType.ISOLATION_FOREST.getDetailsKey());
        assertFalse(DetectorType.fromConfigName("isolation").isPresent());
    }
}
