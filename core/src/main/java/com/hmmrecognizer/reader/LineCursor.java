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

import java.io.IOException;
import java.io.Reader;
import java.util.List;

/**
 * Line oriented access to a text file which remembers the 1-based number of the current line.
 */
class LineCursor {
    private final List<String> lines;
    private int index;

    LineCursor(Reader reader) throws IOException {
        this.lines = Helper.readFile(reader);
    }

    /**
     * Returns the next line.
     *
     * @param what describes the expected content for the error message
     * @throws HmmParseException if the file has no more lines
     */
    String next(String what) {
        if (index >= lines.size())
            throw new HmmParseException("Unexpected end of file, expected " + what, "", 0);
        return lines.get(index++);
    }

    /**
     * @return the number of lines not yet returned by next
     */
    int remaining() {
        return lines.size() - index;
    }

    /**
     * @return the 1-based number of the line last returned by next
     */
    int lineNumber() {
        return index;
    }
}
