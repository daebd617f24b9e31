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
package com.hmmtagger.tools;

import com.hmmtagger.HmmTagger;
import com.hmmtagger.util.CmdArgs;

/**
 * Decodes the test cases of a prediction job file with the model estimated from the corpus the
 * job refers to and writes one predicted state path per line to the job file name with the
 * extension replaced by _output.txt.
 */
public class Predict {

    static final ToolRunner RUNNER = new ToolRunner("predict", "job_file", HmmTagger::predictAndWrite);

    public static void main(String[] args) {
        System.exit(RUNNER.run(args, CmdArgs.readFromSystemProperties(), System.err));
    }
}
