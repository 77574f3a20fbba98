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
 * Computes the probability of an observation sequence summed over all state paths. The forward
 * variables are filled time step by time step into a table, which needs O(T*N^2) operations
 * for T observations and N states.
 * <p>
 * Recurrence: alpha_0(s) = pi[s] * B[s][o_0] and
 * alpha_t(s) = (sum_{s'} alpha_{t-1}(s') * A[s'][s]) * B[s][o_t].
 */
public class ForwardAlgorithm {
    private final HiddenMarkovModel model;

    public ForwardAlgorithm(HiddenMarkovModel model) {
        if (model == null)
            throw new NullPointerException("model must not be null");
        this.model = model;
    }

    /**
     * @throws com.hmmrecognizer.util.exceptions.UnknownSymbolException if an observation is unknown
     * @throws IllegalArgumentException                                 if the sequence is empty
     */
    public ForwardResult compute(List<String> observations) {
        if (observations.isEmpty())
            throw new IllegalArgumentException("Observation sequence must not be empty");

        int[] obs = model.encodeObservations(observations);
        int n = model.stateCount();
        double[][] alpha = new double[obs.length][n];
        double[] logScale = new double[obs.length];

        for (int s = 0; s < n; s++) {
            alpha[0][s] = model.getInitial(s) * model.getEmission(s, obs[0]);
        }
        double logSum = Math.log(normalize(alpha[0]));
        logScale[0] = logSum;

        for (int t = 1; t < obs.length; t++) {
            if (logSum == Double.NEGATIVE_INFINITY) {
                // all paths have zero probability already, the row stays zero
                logScale[t] = logSum;
                continue;
            }
            double[] prev = alpha[t - 1];
            double[] cur = alpha[t];
            for (int s = 0; s < n; s++) {
                double sum = 0;
                for (int prevState = 0; prevState < n; prevState++) {
                    sum += prev[prevState] * model.getTransition(prevState, s);
                }
                cur[s] = sum * model.getEmission(s, obs[t]);
            }
            logSum += Math.log(normalize(cur));
            logScale[t] = logSum;
        }
        return new ForwardResult(alpha, logScale, logSum);
    }

    public double probability(List<String> observations) {
        return compute(observations).getProbability();
    }

    /**
     * Divides the values by their sum if the sum is positive.
     *
     * @return the sum of the values before scaling
     */
    static double normalize(double[] values) {
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        if (sum > 0) {
            for (int i = 0; i < values.length; i++) {
                values[i] /= sum;
            }
        }
        return sum;
    }
}
