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

/**
 * The memo table of the backward algorithm for one observation sequence. Like in
 * {@link ForwardResult} each time step is scaled to sum up to 1 and the cumulative log of the
 * scaling factors is kept, here accumulated from the end of the sequence.
 */
public class BackwardResult {
    private final double[][] scaledBeta;
    private final double[] logScale;
    private final double logProbability;

    BackwardResult(double[][] scaledBeta, double[] logScale, double logProbability) {
        this.scaledBeta = scaledBeta;
        this.logScale = logScale;
        this.logProbability = logProbability;
    }

    public int getLength() {
        return scaledBeta.length;
    }

    public double getProbability() {
        return Math.exp(logProbability);
    }

    public double getLogProbability() {
        return logProbability;
    }

    /**
     * @return beta_t(s) = P(o_{t+1}, ..., o_{T-1} | state at t = s, model)
     */
    public double beta(int t, int state) {
        return Math.exp(logBeta(t, state));
    }

    public double logBeta(int t, int state) {
        return Math.log(scaledBeta[t][state]) + logScale[t];
    }
}
