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

import com.hmmrecognizer.HiddenMarkovModel;
import com.hmmrecognizer.util.Helper;
import com.hmmrecognizer.util.PMap;
import com.hmmrecognizer.util.exceptions.HmmParseException;
import com.hmmrecognizer.util.exceptions.InvalidModelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a model file:
 * <pre>
 * N M T
 * state names (N tokens)
 * output symbols (M tokens)
 * a:
 * N lines with N transition probabilities
 * b:
 * N lines with M emission probabilities
 * pi:
 * one line with N initial probabilities
 * </pre>
 * The label lines are skipped. Either the whole model is read or an exception is thrown.
 */
public class ModelReader {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private boolean validate = true;
    private double tolerance = HiddenMarkovModel.DEFAULT_TOLERANCE;

    public ModelReader() {
    }

    /**
     * Reads the options model.validate and model.tolerance.
     */
    public ModelReader init(PMap args) {
        setValidate(args.getBool("model.validate", validate));
        setTolerance(args.getDouble("model.tolerance", tolerance));
        return this;
    }

    /**
     * Disabling the validation allows reading a model whose rows are not probability
     * distributions. The inference algorithms still work but their results are no probabilities.
     */
    public ModelReader setValidate(boolean validate) {
        this.validate = validate;
        return this;
    }

    public ModelReader setTolerance(double tolerance) {
        if (tolerance < 0)
            throw new IllegalArgumentException("Tolerance must not be negative: " + tolerance);
        this.tolerance = tolerance;
        return this;
    }

    /**
     * @throws java.io.FileNotFoundException if the file does not exist
     * @throws HmmParseException             if the file is malformed
     * @throws InvalidModelException         if validation is enabled and a table row is no distribution
     */
    public HiddenMarkovModel read(String modelFile) throws IOException {
        try (Reader reader = Helper.createReader(modelFile)) {
            HiddenMarkovModel model = read(reader);
            logger.info("Loaded model " + modelFile + " with " + model.stateCount() + " states and "
                    + model.outputCount() + " outputs");
            return model;
        }
    }

    public HiddenMarkovModel read(Reader reader) throws IOException {
        LineCursor cursor = new LineCursor(reader);

        String line = cursor.next("sizes 'N M T'");
        int[] sizes = LineTokenizer.parseInts(line, cursor.lineNumber(), 3);
        int n = sizes[0];
        int m = sizes[1];
        if (n < 1 || m < 1)
            throw new HmmParseException("State and output count must be positive", line, cursor.lineNumber());

        List<String> stateNames = LineTokenizer.parseStrings(cursor.next("state names"), cursor.lineNumber(), n);
        checkUnique(stateNames, "state", cursor);
        List<String> outputNames = LineTokenizer.parseStrings(cursor.next("output symbols"), cursor.lineNumber(), m);
        checkUnique(outputNames, "output", cursor);

        cursor.next("transition label");
        double[][] transitions = readTable(cursor, "transition", n, n);
        cursor.next("emission label");
        double[][] emissions = readTable(cursor, "emission", n, m);
        cursor.next("initial state label");
        double[] initial = LineTokenizer.parseDoubles(cursor.next("initial state probabilities"), cursor.lineNumber(), n);

        HiddenMarkovModel model = new HiddenMarkovModel(stateNames, outputNames, transitions, emissions, initial, sizes[2]);
        if (validate)
            model.validate(tolerance);
        else if (!model.isStochastic(tolerance))
            logger.warn("Model validation is disabled but its tables are no probability distributions,"
                    + " results of the algorithms are no probabilities: " + model);
        return model;
    }

    private static double[][] readTable(LineCursor cursor, String name, int rows, int cols) {
        double[][] table = new double[rows][];
        for (int i = 0; i < rows; i++) {
            table[i] = LineTokenizer.parseDoubles(cursor.next(name + " row " + i), cursor.lineNumber(), cols);
        }
        return table;
    }

    private static void checkUnique(List<String> names, String kind, LineCursor cursor) {
        Set<String> seen = new HashSet<>(names.size());
        for (String name : names) {
            if (!seen.add(name))
                throw new HmmParseException("Duplicate " + kind + " name '" + name + "'", String.join(" ", names), cursor.lineNumber());
        }
    }
}
