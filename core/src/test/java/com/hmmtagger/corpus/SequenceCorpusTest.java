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
package com.hmmtagger.corpus;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SequenceCorpusTest {

    @Test
    public void testSortedLabels() {
        List<LabeledSequence> runs = new ArrayList<>();
        runs.add(new LabeledSequence(new int[]{10, -3, 10}, new int[]{4, 4, 2}));
        runs.add(new LabeledSequence(new int[]{7}, new int[]{100}));
        SequenceCorpus corpus = new SequenceCorpus(runs);

        assertArrayEquals(new int[]{-3, 7, 10}, corpus.getStateLabels());
        assertArrayEquals(new int[]{2, 4, 100}, corpus.getObservationLabels());

        // the corpus is not affected by later changes of the list
        runs.clear();
        assertEquals(2, corpus.size());
        assertThrows(UnsupportedOperationException.class, () -> corpus.getRuns().clear());
    }

    @Test
    public void testEmpty() {
        SequenceCorpus corpus = new SequenceCorpus(Arrays.asList());
        assertTrue(corpus.isEmpty());
        assertEquals(0, corpus.getStateLabels().length);
    }

    @Test
    public void testSequenceIsCopied() {
        int[] states = {1, 2};
        LabeledSequence sequence = new LabeledSequence(states, new int[]{3});
        states[0] = 5;
        assertEquals(1, sequence.getStates()[0]);
        assertFalse(sequence.isAligned());
    }
}
