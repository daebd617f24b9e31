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
package com.hmmtagger.decoding;

import com.hmmtagger.corpus.LabelLineReader;
import com.hmmtagger.util.Helper;
import com.hmmtagger.util.exceptions.CorpusParseException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a prediction job file:
 * <pre>
 * path to corpus file
 * K
 * L_1
 * L_1 observation labels
 * ...
 * </pre>
 * Lines are trimmed and blank lines are skipped.
 */
public class PredictionJobLoader {

    public PredictionJob load(Path file) throws IOException {
        return parse(file.toString(), Helper.readFile(file));
    }

    public PredictionJob parse(String source, List<String> lines) {
        LabelLineReader reader = new LabelLineReader(source, lines);
        String corpusLocation = reader.nextLine("path to the corpus file");
        int count = reader.nextInt("number of test cases");
        if (count < 0)
            throw new CorpusParseException(source, reader.getLastLine(), "number of test cases must not be negative: " + count);

        List<int[]> testCases = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            int length = reader.nextInt("length of test case " + i);
            if (length <= 0)
                throw new CorpusParseException(source, reader.getLastLine(), "length of test case " + i + " must be positive: " + length);
            testCases.add(reader.nextLabels("observations of test case " + i, length));
        }
        reader.expectEnd();
        return new PredictionJob(corpusLocation, testCases);
    }
}
