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
package com.hmmtagger.model;

import com.hmmtagger.util.Helper;
import com.hmmtagger.util.Parameters;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders the matrices of a model as text: the N rows of the transition matrix followed by the
 * N rows of the emission matrix, values separated by a space and formatted with 5 decimal places.
 * Every row is terminated by a newline.
 */
public class MatrixWriter {
    private int decimalPlaces = Parameters.Output.DECIMAL_PLACES;

    public MatrixWriter setDecimalPlaces(int decimalPlaces) {
        if (decimalPlaces < 0)
            throw new IllegalArgumentException("decimal places must not be negative: " + decimalPlaces);
        this.decimalPlaces = decimalPlaces;
        return this;
    }

    public void write(HmmModel model, Path file) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, Helper.UTF_CS)) {
            write(model, writer);
        }
    }

    public void write(HmmModel model, Writer writer) throws IOException {
        for (double[] row : model.getTransitionMatrix()) {
            writer.write(formatRow(row));
            writer.write('\n');
        }
        for (double[] row : model.getEmissionMatrix()) {
            writer.write(formatRow(row));
            writer.write('\n');
        }
        writer.flush();
    }

    String formatRow(double[] row) {
        StringBuilder sb = new StringBuilder();
        for (int j = 0; j < row.length; j++) {
            if (j > 0)
                sb.append(' ');
            sb.append(Helper.formatDecimal(row[j], decimalPlaces));
        }
        return sb.toString();
    }
}
