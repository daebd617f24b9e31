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

import com.hmmtagger.util.Helper;
import com.hmmtagger.util.exceptions.CorpusParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the plain text corpus format:
 * <pre>
 * R
 * states of run 1
 * observations of run 1
 * ...
 * </pre>
 * The first line is the number of runs R, followed by two lines of space separated integer
 * labels per run. Lines are read by position: a blank states or observations line is an empty
 * run, which the estimation rejects. Blank lines after the last run are ignored.
 */
public class TextCorpusLoader implements CorpusLoader {
    private static final Logger logger = LoggerFactory.getLogger(TextCorpusLoader.class);

    @Override
    public SequenceCorpus load(Path file) throws IOException {
        SequenceCorpus corpus = parse(file.toString(), Helper.readFile(file));
        logger.info("loaded corpus {}, {}", file, corpus);
        return corpus;
    }

    public SequenceCorpus parse(String source, List<String> lines) {
        LabelLineReader reader = new LabelLineReader(source, lines, false);
        int runCount = reader.nextInt("number of runs");
        if (runCount < 0)
            throw new CorpusParseException(source, reader.getLastLine(), "number of runs must not be negative: " + runCount);

        List<LabeledSequence> runs = new ArrayList<>(runCount);
        for (int run = 0; run < runCount; run++) {
            int[] states = reader.nextLabels("states of run " + (run + 1));
            int[] observations = reader.nextLabels("observations of run " + (run + 1), states.length);
            runs.add(new LabeledSequence(states, observations));
        }
        reader.expectEnd();
        return new SequenceCorpus(runs);
    }
}
