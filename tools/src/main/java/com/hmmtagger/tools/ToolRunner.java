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
import com.hmmtagger.util.StopWatch;
import com.hmmtagger.util.exceptions.HmmTaggerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Common flow of the command line tools: check the single positional argument, configure a
 * {@link HmmTagger} from system properties, run the action and map failures to exit codes.
 */
class ToolRunner {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private static final Logger logger = LoggerFactory.getLogger(ToolRunner.class);

    interface Action {
        Path run(HmmTagger tagger, Path input) throws IOException;
    }

    private final String toolName;
    private final String argumentName;
    private final Action action;

    ToolRunner(String toolName, String argumentName, Action action) {
        this.toolName = toolName;
        this.argumentName = argumentName;
        this.action = action;
    }

    int run(String[] args, CmdArgs config, PrintStream err) {
        if (args.length != 1) {
            err.println("usage: " + toolName + " <" + argumentName + ">");
            err.println("options are passed as system properties, e.g. -D" + CmdArgs.SYSTEM_PROPERTY_PREFIX + "prediction.threads=4");
            return EXIT_USAGE;
        }

        Path input = Paths.get(args[0]);
        StopWatch sw = new StopWatch(toolName).start();
        try {
            HmmTagger tagger = new HmmTagger().init(config);
            Path output = action.run(tagger, input);
            logger.info("{} finished, output: {}, {}", toolName, output, sw.stop());
            return EXIT_OK;
        } catch (IOException ex) {
            logger.error("Cannot process " + input + ": " + ex, ex);
            err.println(toolName + ": I/O error: " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (HmmTaggerException | IllegalArgumentException ex) {
            logger.error("Cannot process " + input, ex);
            err.println(toolName + ": " + ex.getMessage());
            return EXIT_FAILURE;
        }
    }
}
