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

/**
 * Configuration keys and their defaults understood by {@link com.hmmtagger.HmmTagger}.
 */
public class Parameters {

    public static final class HMM {
        public static final String START_STATE = "hmm.start_state";
        public static final int DEFAULT_START_STATE = 0;
    }

    public static final class Estimation {
        /**
         * If true the estimation fails when the start pseudo-state label is used as a genuine
         * hidden state, otherwise only a warning is logged.
         */
        public static final String START_STATE_STRICT = "estimation.start_state_strict";
    }

    public static final class Prediction {
        public static final String THREADS = "prediction.threads";
    }

    public static final class Output {
        public static final String SUFFIX = "output.suffix";
        public static final String DEFAULT_SUFFIX = "_output.txt";
        public static final int DECIMAL_PLACES = 5;
    }
}
