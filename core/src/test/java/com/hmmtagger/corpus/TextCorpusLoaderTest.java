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

import com.hmmtagger.util.exceptions.CorpusParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class TextCorpusLoaderTest {

    private final TextCorpusLoader loader = new TextCorpusLoader();

    @Test
    public void testParse() {
        SequenceCorpus corpus = loader.parse("test", Arrays.asList("2", "0 3 1", "7 5 5", "0 1", " 6  5 ", "", ""));
        assertEquals(2, corpus.size());
        assertArrayEquals(new int[]{0, 3, 1}, corpus.getRuns().get(0).getStates());
        assertArrayEquals(new int[]{7, 5, 5}, corpus.getRuns().get(0).getObservations());
        assertArrayEquals(new int[]{6, 5}, corpus.getRuns().get(1).getObservations());
        assertArrayEquals(new int[]{0, 1, 3}, corpus.getStateLabels());
        assertArrayEquals(new int[]{5, 6, 7}, corpus.getObservationLabels());
    }

    @Test
    public void testMismatchedLength() {
        CorpusParseException ex = assertThrows(CorpusParseException.class,
                () -> loader.parse("corpus.txt", Arrays.asList("1", "1 2", "5")));
        assertEquals(3, ex.getLine());
        assertEquals("corpus.txt", ex.getSource());
    }

    @Test
    public void testMissingLines() {
        CorpusParseException ex = assertThrows(CorpusParseException.class,
                () -> loader.parse("corpus.txt", Arrays.asList("2", "1 2", "5 6")));
        assertEquals(4, ex.getLine());
    }

    @Test
    public void testInvalidTokens() {
        assertThrows(CorpusParseException.class, () -> loader.parse("c", Arrays.asList("one", "1", "5")));
        assertThrows(CorpusParseException.class, () -> loader.parse("c", Arrays.asList("1", "1 x", "5 6")));
        assertThrows(CorpusParseException.class, () -> loader.parse("c", Arrays.asList("-1")));
        assertThrows(CorpusParseException.class, () -> loader.parse("c", Arrays.asList()));
    }

    @Test
    public void testBlankLinesArePositional() {
        SequenceCorpus corpus = loader.parse("c", Arrays.asList("2", "1 2", "5 6", "", ""));
        assertEquals(2, corpus.size());
        assertEquals(0, corpus.getRuns().get(1).size());
        assertEquals(0, corpus.getRuns().get(1).getObservations().length);

        CorpusParseException ex = assertThrows(CorpusParseException.class,
                () -> loader.parse("c", Arrays.asList("1", "", "1 2", "5 6")));
        assertEquals(3, ex.getLine());
    }

    @Test
    public void testTrailingContent() {
        CorpusParseException ex = assertThrows(CorpusParseException.class,
                () -> loader.parse("c", Arrays.asList("1", "1", "5", "", "2")));
        assertEquals(5, ex.getLine());
    }

    @Test
    public void testLoadFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("corpus.txt");
        Files.write(file, Arrays.asList("1", "1 1 2", "5 5 6"));
        SequenceCorpus corpus = loader.load(file);
        assertEquals(1, corpus.size());
        assertEquals(new LabeledSequence(new int[]{1, 1, 2}, new int[]{5, 5, 6}), corpus.getRuns().get(0));

        assertThrows(NoSuchFileException.class, () -> loader.load(dir.resolve("missing.txt")));
    }
}
