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
package com.hmmrecognizer.tools;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hmmrecognizer.algorithm.MostLikelySequence;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;

/**
 * The results of one observation file. Only the requested algorithms are filled in.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchReport {
    private final String file;
    private final List<List<String>> sequences;
    private List<Double> forward;
    private List<Double> backward;
    private List<MostLikelySequence> viterbi;
    private List<List<Map<String, Double>>> posteriors;

    public BatchReport(String file, List<List<String>> sequences) {
        this.file = file;
        this.sequences = sequences;
    }

    @JsonProperty("file")
    public String getFile() {
        return file;
    }

    @JsonProperty("sequences")
    public List<List<String>> getSequences() {
        return sequences;
    }

    @JsonProperty("forward")
    public List<Double> getForward() {
        return forward;
    }

    public BatchReport setForward(List<Double> forward) {
        this.forward = forward;
        return this;
    }

    @JsonProperty("backward")
    public List<Double> getBackward() {
        return backward;
    }

    public BatchReport setBackward(List<Double> backward) {
        this.backward = backward;
        return this;
    }

    @JsonProperty("viterbi")
    public List<MostLikelySequence> getViterbi() {
        return viterbi;
    }

    public BatchReport setViterbi(List<MostLikelySequence> viterbi) {
        this.viterbi = viterbi;
        return this;
    }

    @JsonProperty("posteriors")
    public List<List<Map<String, Double>>> getPosteriors() {
        return posteriors;
    }

    public BatchReport setPosteriors(List<List<Map<String, Double>>> posteriors) {
        this.posteriors = posteriors;
        return this;
    }

    public void writeText(PrintStream out) {
        out.println(file + ":");
        for (int i = 0; i < sequences.size(); i++) {
            out.println("  sequence " + i + ": " + String.join(" ", sequences.get(i)));
            if (forward != null)
                out.println("\tforward:\t" + forward.get(i));
            if (backward != null)
                out.println("\tbackward:\t" + backward.get(i));
            if (viterbi != null) {
                MostLikelySequence mls = viterbi.get(i);
                out.println("\tviterbi:\t" + mls.getProbability() + "\t" + String.join(" ", mls.getSequence()));
            }
            if (posteriors != null)
                out.println("\tposteriors:\t" + posteriors.get(i));
        }
    }
}
