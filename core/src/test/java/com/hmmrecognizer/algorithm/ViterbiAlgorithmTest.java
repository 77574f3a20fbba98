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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class ViterbiAlgorithmTest {
    private static final double DELTA = 1e-12;
    private final HiddenMarkovModel model = WeatherModel.create();
    private final ViterbiAlgorithm viterbi = new ViterbiAlgorithm(model);

    @Test
    public void testComputeMostLikelySequence() {
        // RR: 0.0378, RS: 0.0072, SR: 0.0864, SS: 0.0576
        MostLikelySequence result = viterbi.computeMostLikelySequence(Arrays.asList("Walk", "Shop"));
        assertEquals(Arrays.asList("Sunny", "Rainy"), result.getSequence());
        assertEquals(0.24 * 0.4 * 0.9, result.getProbability(), DELTA);
        assertFalse(result.isBroken());
        assertEquals(Math.log(0.06), result.logDelta(0, 0), DELTA);
        assertEquals(Math.log(0.24), result.logDelta(0, 1), DELTA);
        assertEquals(Math.log(0.0576), result.logDelta(1, 1), DELTA);
    }

    @Test
    public void testSingleObservation() {
        MostLikelySequence result = viterbi.computeMostLikelySequence(Arrays.asList("Shop"));
        assertEquals(Arrays.asList("Rainy"), result.getSequence());
        assertEquals(0.54, result.getProbability(), DELTA);
    }

    @Test
    public void testEqualsBruteForce() {
        SequenceEvaluator evaluator = new SequenceEvaluator(model);
        for (List<String> observations : WeatherModel.enumerate(model.getOutputs().getNames(), 3)) {
            double best = 0;
            List<String> bestPath = null;
            for (List<String> states : WeatherModel.enumeratePaths(model, 3)) {
                double probability = evaluator.evaluate(observations, states);
                if (probability > best) {
                    best = probability;
                    bestPath = states;
                }
            }
            MostLikelySequence result = viterbi.computeMostLikelySequence(observations);
            assertEquals(best, result.getProbability(), DELTA, observations.toString());
            assertEquals(best, evaluator.evaluate(observations, result.getSequence()), DELTA);
            assertEquals(bestPath, result.getSequence(), observations.toString());
        }
    }

    @Test
    public void testBruteForceOnRandomModels() {
        Random random = new Random(7);
        for (int i = 0; i < 10; i++) {
            HiddenMarkovModel randomModel = RandomModels.create(random, 3, 3);
            SequenceEvaluator evaluator = new SequenceEvaluator(randomModel);
            List<String> observations = RandomModels.observations(random, randomModel, 4);
            double best = 0;
            for (List<String> states : WeatherModel.enumeratePaths(randomModel, 4)) {
                best = Math.max(best, evaluator.evaluate(observations, states));
            }
            MostLikelySequence result = new ViterbiAlgorithm(randomModel).computeMostLikelySequence(observations);
            assertEquals(best, result.getProbability(), 1e-12);
            assertEquals(best, evaluator.evaluate(observations, result.getSequence()), 1e-12);
        }
    }

    @Test
    public void testTiesPreferLowestStateIndex() {
        HiddenMarkovModel uniform = new HiddenMarkovModel(Arrays.asList("A", "B", "C"), Arrays.asList("x"),
                new double[][]{{1 / 3.0, 1 / 3.0, 1 / 3.0}, {1 / 3.0, 1 / 3.0, 1 / 3.0}, {1 / 3.0, 1 / 3.0, 1 / 3.0}},
                new double[][]{{1}, {1}, {1}},
                new double[]{1 / 3.0, 1 / 3.0, 1 / 3.0});
        MostLikelySequence result = new ViterbiAlgorithm(uniform).computeMostLikelySequence(Arrays.asList("x", "x", "x"));
        assertEquals(Arrays.asList("A", "A", "A"), result.getSequence());
        assertEquals(1 / 27.0, result.getProbability(), DELTA);
    }

    @Test
    public void testZeroProbabilityForAllPaths() {
        HiddenMarkovModel onlyX = new HiddenMarkovModel(Arrays.asList("A", "B"), Arrays.asList("x", "y"),
                new double[][]{{0.5, 0.5}, {0.5, 0.5}},
                new double[][]{{1, 0}, {1, 0}},
                new double[]{0.5, 0.5});
        ViterbiAlgorithm algorithm = new ViterbiAlgorithm(onlyX);

        MostLikelySequence result = algorithm.computeMostLikelySequence(Arrays.asList("x", "y", "x"));
        assertTrue(result.isBroken());
        assertTrue(result.getSequence().isEmpty());
        assertEquals(0, result.getProbability());
        assertEquals(Double.NEGATIVE_INFINITY, result.getLogProbability());

        result = algorithm.computeMostLikelySequence(Arrays.asList("y"));
        assertTrue(result.isBroken());
    }

    @Test
    public void testUnreachableStateIsSkipped() {
        // B can never be entered after the start and does not start either
        HiddenMarkovModel model = new HiddenMarkovModel(Arrays.asList("A", "B"), Arrays.asList("x", "y"),
                new double[][]{{1, 0}, {0.5, 0.5}},
                new double[][]{{0.5, 0.5}, {0, 1}},
                new double[]{1, 0});
        MostLikelySequence result = new ViterbiAlgorithm(model).computeMostLikelySequence(Arrays.asList("x", "y", "y"));
        assertEquals(Arrays.asList("A", "A", "A"), result.getSequence());
        assertEquals(0.125, result.getProbability(), DELTA);
        assertEquals(Double.NEGATIVE_INFINITY, result.logDelta(2, 1));
    }

    @Test
    public void testLongSequence() {
        List<String> observations = new ArrayList<>();
        for (int i = 0; i < 10_000; i++) {
            observations.add(i % 2 == 0 ? "Walk" : "Shop");
        }
        MostLikelySequence result = viterbi.computeMostLikelySequence(observations);
        assertEquals(observations.size(), result.getSequence().size());
        assertTrue(Double.isFinite(result.getLogProbability()));
        assertFalse(result.isBroken());
    }

    @Test
    public void testRepeatedCallsReturnSameResult() {
        List<String> observations = Arrays.asList("Shop", "Walk", "Walk", "Shop");
        MostLikelySequence first = viterbi.computeMostLikelySequence(observations);
        MostLikelySequence second = viterbi.computeMostLikelySequence(observations);
        assertEquals(first.getSequence(), second.getSequence());
        assertEquals(first.getLogProbability(), second.getLogProbability());
    }

    @Test
    public void testInvalidInput() {
        assertThrows(UnknownSymbolException.class, () -> viterbi.computeMostLikelySequence(Arrays.asList("Walk", "Swim")));
        assertThrows(IllegalArgumentException.class, () -> viterbi.computeMostLikelySequence(Collections.<String>emptyList()));
    }
}
