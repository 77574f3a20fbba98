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

import java.util.List;

/**
 * Computes the joint probability P(observations, states | model) of one fully specified state path
 * by the chain rule:
 * <pre>
 * pi[s_0] * B[s_0][o_0] * prod_{t=1..T-1} A[s_{t-1}][s_t] * B[s_t][o_t]
 * </pre>
 */
public class SequenceEvaluator {
    private final HiddenMarkovModel model;

    public SequenceEvaluator(HiddenMarkovModel model) {
        if (model == null)
            throw new NullPointerException("model must not be null");
        this.model = model;
    }

    /**
     * @return the probability to start in the specified state and to emit the observation there
     */
    public double initialStep(String observation, String state) {
        return model.initialProbability(state) * model.emissionProbability(state, observation);
    }

    /**
     * @return the probability to move from one state into another and to emit the observation there
     */
    public double step(String observation, String fromState, String toState) {
        return model.transitionProbability(fromState, toState) * model.emissionProbability(toState, observation);
    }

    /**
     * Returns the joint probability of the observations and the state path. Sequences of different
     * length describe an impossible path, so 0 is returned for them, as well as for empty sequences.
     *
     * @throws com.hmmrecognizer.util.exceptions.UnknownStateException  for an unknown state
     * @throws com.hmmrecognizer.util.exceptions.UnknownSymbolException for an unknown observation
     */
    public double evaluate(List<String> observations, List<String> states) {
        if (observations.size() != states.size() || observations.isEmpty())
            return 0;

        double probability = initialStep(observations.get(0), states.get(0));
        for (int t = 1; t < observations.size(); t++) {
            probability *= step(observations.get(t), states.get(t - 1), states.get(t));
        }
        return probability;
    }
}
