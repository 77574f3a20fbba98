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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Contains the most likely state sequence and its joint probability with the observations as
 * computed by {@link ViterbiAlgorithm}.
 */
public class MostLikelySequence {
    private final List<String> sequence;
    private final double logProbability;
    private final double[][] logDelta;

    MostLikelySequence(List<String> sequence, double logProbability, double[][] logDelta) {
        this.sequence = sequence;
        this.logProbability = logProbability;
        this.logDelta = logDelta;
    }

    /**
     * @return the states of the most likely path in chronological order. Empty if the model
     * assigns zero probability to every path.
     */
    @JsonProperty("states")
    public List<String> getSequence() {
        return sequence;
    }

    @JsonProperty("probability")
    public double getProbability() {
        return Math.exp(logProbability);
    }

    /**
     * @return the log probability which is negative infinity for a broken sequence
     */
    @JsonIgnore
    public double getLogProbability() {
        return logProbability;
    }

    /**
     * JSON has no infinity, so a broken sequence is written with a null log probability.
     */
    @JsonProperty("log_probability")
    Double getLogProbabilityOrNull() {
        return Double.isInfinite(logProbability) ? null : logProbability;
    }

    /**
     * Returns whether an HMM break occurred, i.e. every state path has zero probability.
     */
    @JsonProperty("broken")
    public boolean isBroken() {
        return sequence.isEmpty();
    }

    /**
     * @return the log probability of the most likely path ending in the specified state at time t
     */
    public double logDelta(int t, int state) {
        return logDelta[t][state];
    }

    @Override
    public String toString() {
        return "MostLikelySequence [probability=" + getProbability() + ", sequence=" + sequence + "]";
    }
}
