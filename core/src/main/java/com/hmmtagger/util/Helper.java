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

import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * @author Peter Karich
 */
public class Helper {
    public static final Charset UTF_CS = StandardCharsets.UTF_8;
    public static final long MB = 1L << 20;

    private Helper() {
    }

    public static List<String> readFile(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, UTF_CS)) {
            List<String> res = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                res.add(line);
            }
            return res;
        }
    }

    public static long getTotalMB() {
        return Runtime.getRuntime().totalMemory() / MB;
    }

    public static long getUsedMB() {
        return (Runtime.getRuntime().totalMemory() - Runtime.getRuntime().freeMemory()) / MB;
    }

    public static String getMemInfo() {
        return "totalMB:" + getTotalMB() + ", usedMB:" + getUsedMB();
    }

    public static boolean isEmpty(String str) {
        return str == null || str.trim().length() == 0;
    }

    /**
     * Removes the extension of the file name. Dots in directory names are kept.
     */
    public static String pruneFileEnd(String file) {
        int index = file.lastIndexOf(".");
        int separator = Math.max(file.lastIndexOf('/'), file.lastIndexOf('\\'));
        if (index < 0 || index < separator)
            return file;
        return file.substring(0, index);
    }

    /**
     * Returns the sibling of the specified file whose name is the base name of file followed by
     * the suffix, e.g. data/train.txt and "_output.txt" result in data/train_output.txt
     */
    public static Path siblingWithSuffix(Path file, String suffix) {
        Path fileName = file.getFileName();
        if (fileName == null)
            throw new IllegalArgumentException("Not a file: " + file);

        return file.resolveSibling(pruneFileEnd(fileName.toString()) + suffix);
    }

    /**
     * Formats the value with exactly the specified number of decimal places, independent of the
     * default locale. Rounds the exact binary value half-even, so 1/64 with 5 places is 0.01562.
     */
    public static String formatDecimal(double value, int decimalPlaces) {
        if (Double.isNaN(value) || Double.isInfinite(value))
            throw new IllegalArgumentException("Cannot format " + value);

        return new BigDecimal(value).setScale(decimalPlaces, RoundingMode.HALF_EVEN).toPlainString();
    }

    public static String camelCaseToUnderScore(String key) {
        if (key.isEmpty())
            return key;

        StringBuilder sb = new StringBuilder(key.length());
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (Character.isUpperCase(c))
                sb.append("_").append(Character.toLowerCase(c));
            else
                sb.append(c);
        }

        return sb.toString();
    }
}
