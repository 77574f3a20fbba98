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
 * The memo table of the forward algorithm for one observation sequence. The forward variables
 * are stored scaled so that each time step sums up to 1, together with the cumulative log of
 * the scaling factors. This avoids arithmetic underflows for long sequences.
 */
public class ForwardResult {
    private final double[][] scaledAlpha;
    private final double[] logScale;
    private final double logProbability;

    ForwardResult(double[][] scaledAlpha, double[] logScale, double logProbability) {
        this.scaledAlpha = scaledAlpha;
        this.logScale = logScale;
        this.logProbability = logProbability;
    }

    public int getLength() {
        return scaledAlpha.length;
    }

    /**
     * @return P(observations | model), 0 if no state path can produce the observations
     */
    public double getProbability() {
        return Math.exp(logProbability);
    }

    /**
     * @return ln P(observations | model), negative infinity for zero probability
     */
    public double getLogProbability() {
        return logProbability;
    }

    /**
     * @return alpha_t(s) = P(o_0, ..., o_t, state at t = s | model)
     */
    public double alpha(int t, int state) {
        return Math.exp(logAlpha(t, state));
    }

    public double logAlpha(int t, int state) {
        return Math.log(scaledAlpha[t][state]) + logScale[t];
    }
}
