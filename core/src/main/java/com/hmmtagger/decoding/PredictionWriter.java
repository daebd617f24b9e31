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

import com.hmmtagger.util.Helper;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes one line per predicted path, the state labels separated by a space.
 */
public class PredictionWriter {

    public void write(List<int[]> paths, Path file) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, Helper.UTF_CS)) {
            write(paths, writer);
        }
    }

    public void write(List<int[]> paths, Writer writer) throws IOException {
        for (int[] path : paths) {
            for (int t = 0; t < path.length; t++) {
                if (t > 0)
                    writer.write(' ');
                writer.write(Integer.toString(path[t]));
            }
            writer.write('\n');
        }
        writer.flush();
    }
}
