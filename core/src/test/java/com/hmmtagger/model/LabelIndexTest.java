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
package com.hmmtagger.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LabelIndexTest {

    @Test
    public void testIndexFollowsLabelOrder() {
        LabelIndex index = LabelIndex.of(42, -7, 3, 42);
        assertEquals(3, index.size());
        assertArrayEquals(new int[]{-7, 3, 42}, index.getLabels());
        assertEquals(0, index.getIndex(-7));
        assertEquals(2, index.getIndex(42));
        assertEquals(3, index.getLabel(1));
        assertEquals(-1, index.getIndex(5));
        assertFalse(index.contains(5));
        assertTrue(index.contains(3));
    }

    @Test
    public void testUnsortedLabelsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LabelIndex(new int[]{2, 1}));
        assertThrows(IllegalArgumentException.class, () -> new LabelIndex(new int[]{1, 1}));
    }

    @Test
    public void testEquals() {
        assertEquals(LabelIndex.of(1, 2), new LabelIndex(new int[]{1, 2}));
        assertNotEquals(LabelIndex.of(1, 2), LabelIndex.of(1, 3));
    }
}
