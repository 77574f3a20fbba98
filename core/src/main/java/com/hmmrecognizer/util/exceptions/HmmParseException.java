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
package com.hmmrecognizer.util.exceptions;

import java.util.HashMap;
import java.util.Map;

/**
 * Thrown if a model or observation file is structurally malformed. The line number is 1-based,
 * or 0 if the file ended before the expected line.
 */
public class HmmParseException extends RuntimeException implements HmmException {

    private final String line;
    private final int lineNumber;

    public HmmParseException(String message, String line, int lineNumber) {
        super(message + (lineNumber > 0 ? " (line " + lineNumber + ")" : ""));
        this.line = line;
        this.lineNumber = lineNumber;
    }

    public HmmParseException(String message, String line, int lineNumber, Throwable cause) {
        this(message, line, lineNumber);
        initCause(cause);
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new HashMap<>(2);
        details.put("line_number", lineNumber);
        details.put("line", line);
        return details;
    }
}
