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

import com.hmmrecognizer.util.Helper;
import com.hmmrecognizer.util.exceptions.HmmParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads an observation file. The first line holds the number C of sequences, followed by two
 * lines per sequence: a header line which is skipped and the whitespace-separated symbols.
 * Symbols are not checked against a model here.
 */
public class ObservationReader {
    private final Logger logger = LoggerFactory.getLogger(getClass());

    /**
     * @throws java.io.FileNotFoundException if the file does not exist
     * @throws HmmParseException             if the file is malformed
     */
    public List<List<String>> read(String observationFile) throws IOException {
        try (Reader reader = Helper.createReader(observationFile)) {
            List<List<String>> sequences = read(reader);
            logger.debug("Read " + sequences.size() + " observation sequences from " + observationFile);
            return sequences;
        }
    }

    public List<List<String>> read(Reader reader) throws IOException {
        LineCursor cursor = new LineCursor(reader);
        String line = cursor.next("sequence count");
        int count = LineTokenizer.parseInts(line, cursor.lineNumber(), 1)[0];
        if (count < 0)
            throw new HmmParseException("Sequence count must not be negative", line, cursor.lineNumber());
        // every sequence needs a header and a symbol line
        if (count > cursor.remaining() / 2)
            throw new HmmParseException("Sequence count " + count + " exceeds the " + cursor.remaining()
                    + " remaining lines", line, cursor.lineNumber());

        List<List<String>> sequences = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            cursor.next("header of sequence " + i);
            line = cursor.next("symbols of sequence " + i);
            List<String> symbols = LineTokenizer.split(line);
            if (symbols.isEmpty())
                throw new HmmParseException("Observation sequence " + i + " is empty", line, cursor.lineNumber());
            sequences.add(symbols);
        }
        return sequences;
    }
}
