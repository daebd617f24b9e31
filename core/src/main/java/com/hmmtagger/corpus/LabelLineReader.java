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

import com.carrotsearch.hppc.IntArrayList;
import com.hmmtagger.util.exceptions.CorpusParseException;

import java.util.List;

/**
 * Iterates the lines of a text file and parses them as integer labels. Failures are reported as
 * {@link CorpusParseException} with the 1-based line number in the source file.
 * <p>
 * In positional mode every line counts and a blank line yields no labels. Otherwise blank lines
 * are skipped. Blank lines after the last expected line are ignored in both modes.
 */
public class LabelLineReader {
    private final String source;
    private final List<String> lines;
    private final boolean skipBlanks;
    private int index;
    private int lastLine;

    public LabelLineReader(String source, List<String> lines) {
        this(source, lines, true);
    }

    public LabelLineReader(String source, List<String> lines, boolean skipBlankLines) {
        this.source = source;
        this.lines = lines;
        this.skipBlanks = skipBlankLines;
        if (skipBlanks)
            skipBlankLines();
    }

    private void skipBlankLines() {
        while (index < lines.size() && lines.get(index).trim().isEmpty()) {
            index++;
        }
    }

    public boolean hasNext() {
        return index < lines.size();
    }

    /**
     * Returns the next line, trimmed.
     */
    public String nextLine(String expected) {
        if (!hasNext())
            throw new CorpusParseException(source, lastLine + 1, "unexpected end of file, expected " + expected);

        lastLine = index + 1;
        String line = lines.get(index).trim();
        index++;
        if (skipBlanks)
            skipBlankLines();
        return line;
    }

    /**
     * Parses the next line as a single integer.
     */
    public int nextInt(String expected) {
        String line = nextLine(expected);
        try {
            return Integer.parseInt(line);
        } catch (NumberFormatException ex) {
            throw new CorpusParseException(source, lastLine, "expected " + expected + " but was '" + line + "'", ex);
        }
    }

    /**
     * Parses the next line as space separated integer labels.
     */
    public int[] nextLabels(String expected) {
        String line = nextLine(expected);
        IntArrayList labels = new IntArrayList();
        if (line.isEmpty())
            return labels.toArray();

        for (String token : line.split("\\s+")) {
            try {
                labels.add(Integer.parseInt(token));
            } catch (NumberFormatException ex) {
                throw new CorpusParseException(source, lastLine, "invalid label '" + token + "' in " + expected, ex);
            }
        }
        return labels.toArray();
    }

    /**
     * Parses the next line as exactly count labels.
     */
    public int[] nextLabels(String expected, int count) {
        int[] labels = nextLabels(expected);
        if (labels.length != count)
            throw new CorpusParseException(source, lastLine, "expected " + count + " labels in " + expected
                    + " but found " + labels.length);
        return labels;
    }

    /**
     * @return the 1-based number of the line returned last, 0 before the first call
     */
    public int getLastLine() {
        return lastLine;
    }

    public String getSource() {
        return source;
    }

    /**
     * Fails if non-blank lines remain.
     */
    public void expectEnd() {
        skipBlankLines();
        if (hasNext())
            throw new CorpusParseException(source, index + 1, "unexpected content after the last expected line");
    }
}
