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
package com.hmmrecognizer.reader;

import com.hmmrecognizer.util.exceptions.HmmParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a line into whitespace-separated tokens and converts them into strings, integers or
 * floating point numbers. Every typed method checks the number of tokens.
 */
public class LineTokenizer {

    private LineTokenizer() {
    }

    public static List<String> split(String line) {
        List<String> tokens = new ArrayList<>();
        int length = line.length();
        int i = 0;
        while (i < length) {
            while (i < length && Character.isWhitespace(line.charAt(i))) {
                i++;
            }
            int start = i;
            while (i < length && !Character.isWhitespace(line.charAt(i))) {
                i++;
            }
            if (start < i)
                tokens.add(line.substring(start, i));
        }
        return tokens;
    }

    public static List<String> parseStrings(String line, int lineNumber, int expectedCount) {
        List<String> tokens = split(line);
        checkCount(tokens, line, lineNumber, expectedCount);
        return tokens;
    }

    public static int[] parseInts(String line, int lineNumber, int expectedCount) {
        List<String> tokens = split(line);
        checkCount(tokens, line, lineNumber, expectedCount);
        int[] result = new int[tokens.size()];
        for (int i = 0; i < result.length; i++) {
            try {
                result[i] = Integer.parseInt(tokens.get(i));
            } catch (NumberFormatException ex) {
                throw new HmmParseException("Expected an integer but found '" + tokens.get(i) + "'", line, lineNumber, ex);
            }
        }
        return result;
    }

    public static double[] parseDoubles(String line, int lineNumber, int expectedCount) {
        List<String> tokens = split(line);
        checkCount(tokens, line, lineNumber, expectedCount);
        double[] result = new double[tokens.size()];
        for (int i = 0; i < result.length; i++) {
            try {
                result[i] = Double.parseDouble(tokens.get(i));
            } catch (NumberFormatException ex) {
                throw new HmmParseException("Expected a number but found '" + tokens.get(i) + "'", line, lineNumber, ex);
            }
        }
        return result;
    }

    private static void checkCount(List<String> tokens, String line, int lineNumber, int expectedCount) {
        if (tokens.size() != expectedCount)
            throw new HmmParseException("Expected " + expectedCount + " tokens but found " + tokens.size(), line, lineNumber);
    }
}
