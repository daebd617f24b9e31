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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A corpus to estimate the model from and the observation sequences to decode with it, in the
 * order their predictions have to be reported.
 */
public class PredictionJob {
    private final String corpusLocation;
    private final List<int[]> testCases;

    public PredictionJob(String corpusLocation, List<int[]> testCases) {
        this.corpusLocation = corpusLocation;
        this.testCases = Collections.unmodifiableList(new ArrayList<>(testCases));
    }

    public String getCorpusLocation() {
        return corpusLocation;
    }

    public List<int[]> getTestCases() {
        return testCases;
    }

    @Override
    public String toString() {
        return "corpus:" + corpusLocation + ", test cases:" + testCases.size();
    }
}
