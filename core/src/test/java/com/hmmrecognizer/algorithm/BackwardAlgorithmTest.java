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
package com.hmmrecognizer.algorithm;

import com.hmmrecognizer.HiddenMarkovModel;
import com.hmmrecognizer.WeatherModel;
import com.hmmrecognizer.util.exceptions.UnknownSymbolException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class BackwardAlgorithmTest {
    private static final double DELTA = 1e-12;
    private final HiddenMarkovModel model = WeatherModel.create();
    private final BackwardAlgorithm backward = new BackwardAlgorithm(model);

    @Test
    public void testTwoObservations() {
        BackwardResult result = backward.compute(Arrays.asList("Walk", "Shop"));
        assertEquals(1, result.beta(1, 0), DELTA);
        assertEquals(1, result.beta(1, 1), DELTA);
        assertEquals(0.7 * 0.9 + 0.3 * 0.4, result.beta(0, 0), DELTA);
        assertEquals(0.4 * 0.9 + 0.6 * 0.4, result.beta(0, 1), DELTA);
        assertEquals(0.189, result.getProbability(), DELTA);
    }

    @Test
    public void testSingleObservation() {
        assertEquals(0.3, backward.probability(Arrays.asList("Walk")), DELTA);
    }

    @Test
    public void testAgreesWithForward() {
        ForwardAlgorithm forward = new ForwardAlgorithm(model);
        for (int length = 1; length <= 4; length++) {
            for (List<String> observations : WeatherModel.enumerate(model.getOutputs().getNames(), length)) {
                assertEquals(forward.probability(observations), backward.probability(observations), DELTA);
            }
        }
    }

    @Test
    public void testAgreesWithForwardOnRandomModels() {
        Random random = new Random(42);
        for (int i = 0; i < 20; i++) {
            HiddenMarkovModel randomModel = RandomModels.create(random, 1 + random.nextInt(5), 1 + random.nextInt(4));
            List<String> observations = RandomModels.observations(random, randomModel, 1 + random.nextInt(40));
            double logForward = new ForwardAlgorithm(randomModel).compute(observations).getLogProbability();
            double logBackward = new BackwardAlgorithm(randomModel).compute(observations).getLogProbability();
            assertEquals(logForward, logBackward, 1e-9);
        }
    }

    @Test
    public void testImpossibleObservation() {
        HiddenMarkovModel onlyX = new HiddenMarkovModel(Arrays.asList("A", "B"), Arrays.asList("x", "y"),
                new double[][]{{0.5, 0.5}, {0.5, 0.5}},
                new double[][]{{1, 0}, {1, 0}},
                new double[]{0.5, 0.5});
        BackwardResult result = new BackwardAlgorithm(onlyX).compute(Arrays.asList("x", "y", "x"));
        assertEquals(0, result.getProbability());
        assertEquals(Double.NEGATIVE_INFINITY, result.getLogProbability());
        assertEquals(1, result.beta(2, 0), DELTA);
    }

    @Test
    public void testInvalidInput() {
        assertThrows(UnknownSymbolException.class, () -> backward.compute(Arrays.asList("Swim")));
        assertThrows(IllegalArgumentException.class, () -> backward.compute(Collections.<String>emptyList()));
    }
}
