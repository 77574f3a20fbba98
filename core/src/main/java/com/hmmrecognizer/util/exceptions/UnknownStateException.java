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
 * Thrown if a state name is not part of the state alphabet of the model.
 */
public class UnknownStateException extends IllegalArgumentException implements HmmException {

    protected final String state;

    public UnknownStateException(String state) {
        super("No such state: " + state);
        this.state = state;
    }

    public String getState() {
        return state;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Collections.<String, Object>singletonMap("state", state);
    }
}
