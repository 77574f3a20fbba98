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
 * Thrown if a probability table of a model is not a proper probability distribution, i.e. a row
 * contains a negative or non-finite value or does not sum up to 1.
 */
public class InvalidModelException extends IllegalArgumentException implements HmmException {

    private final String table;
    private final int row;
    private final int column;
    private final double value;

    /**
     * Creates an exception for a row whose values do not sum up to 1.
     */
    public InvalidModelException(String table, int row, double sum) {
        super("Probabilities of " + describe(table, row) + " do not form a distribution, sum: " + sum);
        this.table = table;
        this.row = row;
        this.column = -1;
        this.value = sum;
    }

    /**
     * Creates an exception for a single negative or non-finite value.
     */
    public InvalidModelException(String table, int row, int column, double value) {
        super("Probability of " + describe(table, row) + " column " + column + " is invalid: " + value);
        this.table = table;
        this.row = row;
        this.column = column;
        this.value = value;
    }

    private static String describe(String table, int row) {
        return table + (row >= 0 ? " row " + row : "");
    }

    public String getTable() {
        return table;
    }

    /**
     * @return the row index or -1 for the initial state distribution
     */
    public int getRow() {
        return row;
    }

    /**
     * @return the column of the invalid value or -1 if the row sum is wrong
     */
    public int getColumn() {
        return column;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new HashMap<>(4);
        details.put("table", table);
        details.put("row", row);
        if (column >= 0) {
            details.put("column", column);
            details.put("value", value);
        } else {
            details.put("sum", value);
        }
        return details;
    }
}
