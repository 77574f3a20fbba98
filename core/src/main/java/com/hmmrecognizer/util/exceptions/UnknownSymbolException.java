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

import java.util.Collections;
import java.util.Map;

/**
 * Thrown if an observation symbol is not part of the output alphabet of the model.
 */
public class UnknownSymbolException extends IllegalArgumentException implements HmmException {

    protected final String symbol;

    public UnknownSymbolException(String symbol) {
        super("No such output: " + symbol);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Collections.<String, Object>singletonMap("symbol", symbol);
    }
}
