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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Creates random but proper (row stochastic) models and observation sequences.
 */
class RandomModels {

    static HiddenMarkovModel create(Random random, int stateCount, int outputCount) {
        List<String> states = new ArrayList<>();
        for (int i = 0; i < stateCount; i++) {
            states.add("s" + i);
        }
        List<String> outputs = new ArrayList<>();
        for (int i = 0; i < outputCount; i++) {
            outputs.add("o" + i);
        }
        double[][] transitions = new double[stateCount][];
        double[][] emissions = new double[stateCount][];
        for (int i = 0; i < stateCount; i++) {
            transitions[i] = distribution(random, stateCount);
            emissions[i] = distribution(random, outputCount);
        }
        return new HiddenMarkovModel(states, outputs, transitions, emissions, distribution(random, stateCount));
    }

    static List<String> observations(Random random, HiddenMarkovModel model, int length) {
        List<String> result = new ArrayList<>(length);
        for (int t = 0; t < length; t++) {
            result.add(model.getOutputs().get(random.nextInt(model.outputCount())));
        }
        return result;
    }

    private static double[] distribution(Random random, int size) {
        double[] values = new double[size];
        double sum = 0;
        for (int i = 0; i < size; i++) {
            values[i] = 0.05 + random.nextDouble();
            sum += values[i];
        }
        for (int i = 0; i < size; i++) {
            values[i] /= sum;
        }
        return values;
    }
}
