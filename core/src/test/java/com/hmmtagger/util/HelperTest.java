/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package com.hmmtagger.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

public class HelperTest {

    @Test
    public void testFormatDecimal() {
        assertEquals("0.50000", Helper.formatDecimal(0.5, 5));
        assertEquals("1.00000", Helper.formatDecimal(1, 5));
        assertEquals("0.00000", Helper.formatDecimal(0, 5));
        assertEquals("0.33333", Helper.formatDecimal(1.0 / 3, 5));
        assertEquals("0.66667", Helper.formatDecimal(2.0 / 3, 5));
        // exact binary ties are rounded to even
        assertEquals("0.01562", Helper.formatDecimal(1.0 / 64, 5));
        assertEquals("0.04688", Helper.formatDecimal(3.0 / 64, 5));
        assertThrows(IllegalArgumentException.class, () -> Helper.formatDecimal(Double.NaN, 5));
    }

    @Test
    public void testPruneFileEnd() {
        assertEquals("train", Helper.pruneFileEnd("train.txt"));
        assertEquals("data.v2/train", Helper.pruneFileEnd("data.v2/train"));
        assertEquals("data/train.big", Helper.pruneFileEnd("data/train.big.txt"));
    }

    @Test
    public void testSiblingWithSuffix() {
        assertEquals(Paths.get("data", "train_output.txt"), Helper.siblingWithSuffix(Paths.get("data", "train.txt"), "_output.txt"));
        assertEquals(Paths.get("train_output.txt"), Helper.siblingWithSuffix(Paths.get("train"), "_output.txt"));
    }

    @Test
    public void testCamelCaseToUnderScore() {
        assertEquals("start_state", Helper.camelCaseToUnderScore("startState"));
        assertEquals("prediction.threads", Helper.camelCaseToUnderScore("prediction.threads"));
    }
}
