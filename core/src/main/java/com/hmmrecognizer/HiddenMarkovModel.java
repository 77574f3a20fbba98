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

import com.hmmrecognizer.util.exceptions.InvalidModelException;
import com.hmmrecognizer.util.exceptions.UnknownStateException;
import com.hmmrecognizer.util.exceptions.UnknownSymbolException;

import java.util.List;

/**
 * A discrete hidden Markov model: the state and output alphabets, the transition matrix A, the
 * emission matrix B and the initial state distribution pi. Instances are immutable, so one model
 * can be shared by any number of concurrent evaluations.
 * <p>
 * Name based lookups validate the name and throw {@link UnknownStateException} or
 * {@link UnknownSymbolException}. The index based getters are meant for the inference algorithms
 * which encode a sequence once and then work on dense indices only.
 *
 * @see com.hmmrecognizer.reader.ModelReader
 */
public class HiddenMarkovModel {
    public static final double DEFAULT_TOLERANCE = 1e-6;

    private final Alphabet states;
    private final Alphabet outputs;
    private final double[][] transitions;
    private final double[][] emissions;
    private final double[] initial;
    private final int nominalLength;

    public HiddenMarkovModel(List<String> stateNames, List<String> outputNames,
                             double[][] transitions, double[][] emissions, double[] initial) {
        this(stateNames, outputNames, transitions, emissions, initial, 0);
    }

    /**
     * @param nominalLength the sequence length declared in the model file, informational only
     */
    public HiddenMarkovModel(List<String> stateNames, List<String> outputNames,
                             double[][] transitions, double[][] emissions, double[] initial,
                             int nominalLength) {
        this.states = new Alphabet(stateNames);
        this.outputs = new Alphabet(outputNames);
        int n = states.size();
        int m = outputs.size();
        this.transitions = copy("transition", transitions, n, n);
        this.emissions = copy("emission", emissions, n, m);
        if (initial.length != n)
            throw new IllegalArgumentException("Initial state distribution needs " + n + " entries but has " + initial.length);
        this.initial = initial.clone();
        this.nominalLength = nominalLength;
    }

    private static double[][] copy(String name, double[][] table, int rows, int cols) {
        if (table.length != rows)
            throw new IllegalArgumentException("The " + name + " table needs " + rows + " rows but has " + table.length);

        double[][] result = new double[rows][];
        for (int i = 0; i < rows; i++) {
            if (table[i].length != cols)
                throw new IllegalArgumentException("Row " + i + " of the " + name + " table needs " + cols
                        + " entries but has " + table[i].length);
            result[i] = table[i].clone();
        }
        return result;
    }

    public int stateCount() {
        return states.size();
    }

    public int outputCount() {
        return outputs.size();
    }

    public Alphabet getStates() {
        return states;
    }

    public Alphabet getOutputs() {
        return outputs;
    }

    public int getNominalLength() {
        return nominalLength;
    }

    public int stateIndex(String state) {
        int index = states.indexOf(state);
        if (index < 0)
            throw new UnknownStateException(state);
        return index;
    }

    public int outputIndex(String symbol) {
        int index = outputs.indexOf(symbol);
        if (index < 0)
            throw new UnknownSymbolException(symbol);
        return index;
    }

    /**
     * Converts the specified observation sequence into output indices.
     *
     * @throws UnknownSymbolException for the first symbol not part of the output alphabet
     */
    public int[] encodeObservations(List<String> observations) {
        int[] result = new int[observations.size()];
        for (int t = 0; t < result.length; t++) {
            result[t] = outputIndex(observations.get(t));
        }
        return result;
    }

    /**
     * @return P(next state = to | current state = from)
     */
    public double transitionProbability(String from, String to) {
        return transitions[stateIndex(from)][stateIndex(to)];
    }

    /**
     * @return P(observe symbol | current state = state)
     */
    public double emissionProbability(String state, String symbol) {
        return emissions[stateIndex(state)][outputIndex(symbol)];
    }

    /**
     * @return P(start in state)
     */
    public double initialProbability(String state) {
        return initial[stateIndex(state)];
    }

    public double getTransition(int from, int to) {
        return transitions[from][to];
    }

    public double getEmission(int state, int output) {
        return emissions[state][output];
    }

    public double getInitial(int state) {
        return initial[state];
    }

    public boolean isStochastic(double tolerance) {
        try {
            validate(tolerance);
            return true;
        } catch (InvalidModelException ex) {
            return false;
        }
    }

    /**
     * Checks that every transition row, every emission row and the initial state distribution
     * contain only finite, non-negative values summing up to 1 within the specified tolerance.
     *
     * @throws InvalidModelException for the first table row violating this
     */
    public void validate(double tolerance) {
        for (int i = 0; i < transitions.length; i++) {
            checkDistribution("transition", i, transitions[i], tolerance);
        }
        for (int i = 0; i < emissions.length; i++) {
            checkDistribution("emission", i, emissions[i], tolerance);
        }
        checkDistribution("initial", -1, initial, tolerance);
    }

    private static void checkDistribution(String table, int row, double[] values, double tolerance) {
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            double value = values[i];
            if (value < 0 || Double.isNaN(value) || Double.isInfinite(value))
                throw new InvalidModelException(table, row, i, value);
            sum += value;
        }
        if (Math.abs(sum - 1) > tolerance)
            throw new InvalidModelException(table, row, sum);
    }

    @Override
    public String toString() {
        return "states:" + states + ", outputs:" + outputs;
    }
}
