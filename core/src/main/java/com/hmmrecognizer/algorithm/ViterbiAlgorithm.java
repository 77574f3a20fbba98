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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Implementation of the Viterbi algorithm for a stationary discrete HMM as described e.g. in
 * Rabiner, Juang, An introduction to Hidden Markov Models, IEEE ASSP Mag., pp 4-16, June 1986.
 * <p>
 * Works with logarithmic probabilities to prevent arithmetic underflows for long sequences, where
 * log(0) is negative infinity. For each time step t and state s the table delta_t(s) holds the log
 * probability of the most likely path ending in s at t and psi_t(s) the back pointer to the
 * previous state of that path. Both are filled once per (t, s) in a forward pass.
 * <p>
 * Ties are broken deterministically: if several predecessors (or final states) have the same
 * probability, the one with the lowest state index wins.
 */
public class ViterbiAlgorithm {
    private static final int NO_STATE = -1;

    private final HiddenMarkovModel model;
    private final double[][] transitionLogProbabilities;
    private final double[][] emissionLogProbabilities;
    private final double[] initialLogProbabilities;

    public ViterbiAlgorithm(HiddenMarkovModel model) {
        if (model == null)
            throw new NullPointerException("model must not be null");
        this.model = model;
        int n = model.stateCount();
        int m = model.outputCount();
        transitionLogProbabilities = new double[n][n];
        emissionLogProbabilities = new double[n][m];
        initialLogProbabilities = new double[n];
        for (int s = 0; s < n; s++) {
            initialLogProbabilities[s] = Math.log(model.getInitial(s));
            for (int next = 0; next < n; next++) {
                transitionLogProbabilities[s][next] = Math.log(model.getTransition(s, next));
            }
            for (int o = 0; o < m; o++) {
                emissionLogProbabilities[s][o] = Math.log(model.getEmission(s, o));
            }
        }
    }

    /**
     * Computes the most likely state sequence for the specified observations. If the model assigns
     * zero probability to every path the returned sequence is empty and its probability is 0.
     *
     * @throws com.hmmrecognizer.util.exceptions.UnknownSymbolException if an observation is unknown
     * @throws IllegalArgumentException                                 if the sequence is empty
     */
    public MostLikelySequence computeMostLikelySequence(List<String> observations) {
        if (observations.isEmpty())
            throw new IllegalArgumentException("Observation sequence must not be empty");

        int[] obs = model.encodeObservations(observations);
        int n = model.stateCount();
        double[][] delta = new double[obs.length][n];
        int[][] backPointers = new int[obs.length][n];

        for (int s = 0; s < n; s++) {
            delta[0][s] = initialLogProbabilities[s] + emissionLogProbabilities[s][obs[0]];
            backPointers[0][s] = NO_STATE;
        }

        boolean broken = hmmBreak(delta[0]);
        for (int t = 1; t < obs.length; t++) {
            if (broken) {
                Arrays.fill(delta[t], Double.NEGATIVE_INFINITY);
                Arrays.fill(backPointers[t], NO_STATE);
                continue;
            }
            forwardStep(delta[t - 1], obs[t], delta[t], backPointers[t]);
            broken = hmmBreak(delta[t]);
        }

        int last = obs.length - 1;
        int lastState = mostLikelyState(delta[last]);
        if (lastState == NO_STATE)
            return new MostLikelySequence(Collections.<String>emptyList(), Double.NEGATIVE_INFINITY, delta);

        return new MostLikelySequence(retrieveMostLikelySequence(backPointers, lastState),
                delta[last][lastState], delta);
    }

    private void forwardStep(double[] prevDelta, int observation, double[] curDelta, int[] curBackPointers) {
        for (int curState = 0; curState < curDelta.length; curState++) {
            double maxLogProbability = Double.NEGATIVE_INFINITY;
            int maxPrevState = NO_STATE;
            for (int prevState = 0; prevState < prevDelta.length; prevState++) {
                double logProbability = prevDelta[prevState] + transitionLogProbabilities[prevState][curState];
                if (logProbability > maxLogProbability) {
                    maxLogProbability = logProbability;
                    maxPrevState = prevState;
                }
            }
            // maxPrevState is NO_STATE if curState cannot be reached, its probability is then zero
            curDelta[curState] = maxLogProbability + emissionLogProbabilities[curState][observation];
            curBackPointers[curState] = maxPrevState;
        }
    }

    /**
     * Returns whether all states have zero probability.
     */
    private static boolean hmmBreak(double[] logProbabilities) {
        for (double logProbability : logProbabilities) {
            if (logProbability != Double.NEGATIVE_INFINITY)
                return false;
        }
        return true;
    }

    /**
     * Retrieves the first state with maximum probability or NO_STATE if all have zero probability.
     */
    private static int mostLikelyState(double[] logProbabilities) {
        int result = NO_STATE;
        double maxLogProbability = Double.NEGATIVE_INFINITY;
        for (int s = 0; s < logProbabilities.length; s++) {
            if (logProbabilities[s] > maxLogProbability) {
                maxLogProbability = logProbabilities[s];
                result = s;
            }
        }
        return result;
    }

    private List<String> retrieveMostLikelySequence(int[][] backPointers, int lastState) {
        // Retrieve most likely state sequence in reverse order
        List<String> result = new ArrayList<>(backPointers.length);
        int state = lastState;
        for (int t = backPointers.length - 1; t >= 0; t--) {
            result.add(model.getStates().get(state));
            state = backPointers[t][state];
        }
        Collections.reverse(result);
        return result;
    }
}
