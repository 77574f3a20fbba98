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
package com.hmmrecognizer.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PMapTest {

    @Test
    public void propertyFromStringWithMultiplePropertiesCanBeRetrieved() {
        PMap subject = new PMap("foo=valueA|bar=valueB");

        assertEquals("valueA", subject.get("foo", ""));
        assertEquals("valueB", subject.get("bar", ""));
        assertEquals("default", subject.get("baz", "default"));
    }

    @Test
    public void camelCaseAndUnderScoreKeysAreEqual() {
        PMap subject = new PMap().put("modelTolerance", 0.5);

        assertTrue(subject.has("model_tolerance"));
        assertEquals(0.5, subject.getDouble("model_tolerance", 0), 1e-10);
        subject.remove("model_tolerance");
        assertFalse(subject.has("modelTolerance"));
    }

    @Test
    public void numericPropertiesCanBeRetrieved() {
        PMap subject = new PMap("foo=1234|bar=56.78|flag=false");

        assertEquals(1234, subject.getInt("foo", 0));
        assertEquals(56.78, subject.getDouble("bar", 0), 1e-4);
        assertFalse(subject.getBool("flag", true));
        assertEquals(7, subject.getInt("missing", 7));
    }

    @Test
    public void malformedNumberIsRejected() {
        PMap subject = new PMap("model.tolerance=small");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> subject.getDouble("model.tolerance", 1e-6));
        assertTrue(ex.getMessage().contains("model.tolerance"), ex.getMessage());
    }

    @Test
    public void mergeOverwritesExistingKeys() {
        PMap subject = new PMap("a=1|b=2").merge(new PMap("b=3"));

        assertEquals(1, subject.getInt("a", 0));
        assertEquals(3, subject.getInt("b", 0));
    }
}
