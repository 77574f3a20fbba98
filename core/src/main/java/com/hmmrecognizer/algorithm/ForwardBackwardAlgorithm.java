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

import com.hmmrecognizer.Alphabet;
import com.hmmrecognizer.HiddenMarkovModel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the forward-backward algorithm, also known as smoothing. This computes the probability
 * of each state at each time step given the entire observation sequence:
 * gamma_t(s) = alpha_t(s) * beta_t(s) / P(observations | model).
 */
public class ForwardBackwardAlgorithm {
    private final HiddenMarkovModel model;
    private final ForwardAlgorithm forward;
    private final BackwardAlgorithm backward;

    public ForwardBackwardAlgorithm(HiddenMarkovModel model) {
        this.model = model;
        this.forward = new ForwardAlgorithm(model);
        this.backward = new BackwardAlgorithm(model);
    }

    /**
     * Returns the probability for all states of all time steps given all observations. The states
     * of each time step are iterated in alphabet order. The result is empty if the observations
     * have zero probability, since the posterior is undefined then.
     */
    public List<Map<String, Double>> computePosteriors(List<String> observations) {
        ForwardResult forwardResult = forward.compute(observations);
        BackwardResult backwardResult = backward.compute(observations);
        List<Map<String, Double>> result = new ArrayList<>(forwardResult.getLength());
        double logProbability = forwardResult.getLogProbability();
        if (logProbability == Double.NEGATIVE_INFINITY)
            return result;

        Alphabet states = model.getStates();
        for (int t = 0; t < forwardResult.getLength(); t++) {
            Map<String, Double> posteriors = new LinkedHashMap<>();
            for (int s = 0; s < states.size(); s++) {
                double logPosterior = forwardResult.logAlpha(t, s) + backwardResult.logBeta(t, s) - logProbability;
                posteriors.put(states.get(s), Math.exp(logPosterior));
            }
            result.add(posteriors);
        }
        return result;
    }
}
