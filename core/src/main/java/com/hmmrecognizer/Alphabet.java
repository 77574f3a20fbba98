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
package com.hmmrecognizer;

import com.carrotsearch.hppc.ObjectIntHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered set of unique names, e.g. the states or the observation symbols of a model. Each name
 * is mapped to its dense index once, so a lookup is a single hash access.
 */
public class Alphabet {
    private final List<String> names;
    private final ObjectIntHashMap<String> indices;

    public Alphabet(List<String> names) {
        if (names.isEmpty())
            throw new IllegalArgumentException("Alphabet must not be empty");

        this.names = Collections.unmodifiableList(new ArrayList<>(names));
        this.indices = new ObjectIntHashMap<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            if (name == null)
                throw new NullPointerException("Alphabet must not contain null");
            if (!indices.putIfAbsent(name, i))
                throw new IllegalArgumentException("Duplicate name in alphabet: " + name);
        }
    }

    public int size() {
        return names.size();
    }

    /**
     * @return the index of the specified name or -1 if it is not part of this alphabet
     */
    public int indexOf(String name) {
        if (name == null)
            return -1;
        return indices.getOrDefault(name, -1);
    }

    public boolean contains(String name) {
        return indexOf(name) >= 0;
    }

    public String get(int index) {
        return names.get(index);
    }

    public List<String> getNames() {
        return names;
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
