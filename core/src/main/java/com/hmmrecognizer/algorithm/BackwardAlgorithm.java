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

import java.util.Arrays;
import java.util.List;

/**
 * Computes the probability of an observation sequence via the backward variables, independently
 * of {@link ForwardAlgorithm}. Both results must agree. The table is filled from the last time
 * step to the first in O(T*N^2).
 * <p>
 * Recurrence: beta_{T-1}(s) = 1 and
 * beta_t(s) = sum_{s'} A[s][s'] * B[s'][o_{t+1}] * beta_{t+1}(s').
 * The result is sum_s pi[s] * B[s][o_0] * beta_0(s).
 */
public class BackwardAlgorithm {
    private final HiddenMarkovModel model;

    public BackwardAlgorithm(HiddenMarkovModel model) {
        if (model == null)
            throw new NullPointerException("model must not be null");
        this.model = model;
    }

    /**
     * @throws com.hmmrecognizer.util.exceptions.UnknownSymbolException if an observation is unknown
     * @throws IllegalArgumentException                                 if the sequence is empty
     */
    public BackwardResult compute(List<String> observations) {
        if (observations.isEmpty())
            throw new IllegalArgumentException("Observation sequence must not be empty");

        int[] obs = model.encodeObservations(observations);
        int n = model.stateCount();
        int last = obs.length - 1;
        double[][] beta = new double[obs.length][n];
        double[] logScale = new double[obs.length];

        Arrays.fill(beta[last], 1);
        double logSum = 0;
        logScale[last] = logSum;

        for (int t = last - 1; t >= 0; t--) {
            if (logSum == Double.NEGATIVE_INFINITY) {
                logScale[t] = logSum;
                continue;
            }
            double[] next = beta[t + 1];
            double[] cur = beta[t];
            int nextObs = obs[t + 1];
            for (int s = 0; s < n; s++) {
                double sum = 0;
                for (int nextState = 0; nextState < n; nextState++) {
                    sum += model.getTransition(s, nextState) * model.getEmission(nextState, nextObs) * next[nextState];
                }
                cur[s] = sum;
            }
            logSum += Math.log(ForwardAlgorithm.normalize(cur));
            logScale[t] = logSum;
        }

        double sum = 0;
        for (int s = 0; s < n; s++) {
            sum += model.getInitial(s) * model.getEmission(s, obs[0]) * beta[0][s];
        }
        return new BackwardResult(beta, logScale, Math.log(sum) + logSum);
    }

    public double probability(List<String> observations) {
        return compute(observations).getProbability();
    }
}
