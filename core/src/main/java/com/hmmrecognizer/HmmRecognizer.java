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

import com.hmmrecognizer.algorithm.*;
import com.hmmrecognizer.reader.ModelReader;
import com.hmmrecognizer.reader.ObservationReader;
import com.hmmrecognizer.util.PMap;
import com.hmmrecognizer.util.StopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Easy to use access point to evaluate and decode whole observation files against one model.
 * Every method returns one result per observation sequence in file order. A batch is aborted on
 * the first failing sequence: the exception is propagated and no partial result is returned.
 * <p>
 * Instances are immutable and can be shared between threads.
 */
public class HmmRecognizer {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final HiddenMarkovModel model;
    private final SequenceEvaluator evaluator;
    private final ForwardAlgorithm forward;
    private final BackwardAlgorithm backward;
    private final ViterbiAlgorithm viterbi;
    private final ForwardBackwardAlgorithm forwardBackward;

    public HmmRecognizer(HiddenMarkovModel model) {
        if (model == null)
            throw new NullPointerException("model must not be null");
        this.model = model;
        this.evaluator = new SequenceEvaluator(model);
        this.forward = new ForwardAlgorithm(model);
        this.backward = new BackwardAlgorithm(model);
        this.viterbi = new ViterbiAlgorithm(model);
        this.forwardBackward = new ForwardBackwardAlgorithm(model);
    }

    /**
     * Reads the model from the specified file. See {@link ModelReader#init(PMap)} for the options.
     */
    public static HmmRecognizer load(String modelFile, PMap args) throws IOException {
        StopWatch sw = new StopWatch("load").start();
        HiddenMarkovModel model = new ModelReader().init(args).read(modelFile);
        LoggerFactory.getLogger(HmmRecognizer.class).info("Model " + modelFile + " loaded, " + sw.stop());
        return new HmmRecognizer(model);
    }

    public HiddenMarkovModel getModel() {
        return model;
    }

    public double evaluate(List<String> observations, List<String> states) {
        return evaluator.evaluate(observations, states);
    }

    public List<Double> forward(String observationFile) throws IOException {
        return forward(read(observationFile));
    }

    public List<Double> forward(List<List<String>> batch) {
        return computeBatch("forward", batch, observations -> forward.compute(observations).getProbability());
    }

    public List<Double> backward(String observationFile) throws IOException {
        return backward(read(observationFile));
    }

    public List<Double> backward(List<List<String>> batch) {
        return computeBatch("backward", batch, observations -> backward.compute(observations).getProbability());
    }

    public List<MostLikelySequence> viterbi(String observationFile) throws IOException {
        return viterbi(read(observationFile));
    }

    public List<MostLikelySequence> viterbi(List<List<String>> batch) {
        return computeBatch("viterbi", batch, observations -> viterbi.computeMostLikelySequence(observations));
    }

    public List<List<Map<String, Double>>> posteriors(String observationFile) throws IOException {
        return posteriors(read(observationFile));
    }

    public List<List<Map<String, Double>>> posteriors(List<List<String>> batch) {
        return computeBatch("posteriors", batch, observations -> forwardBackward.computePosteriors(observations));
    }

    public List<List<String>> read(String observationFile) throws IOException {
        return new ObservationReader().read(observationFile);
    }

    private <T> List<T> computeBatch(String name, List<List<String>> batch, Function<List<String>, T> function) {
        StopWatch sw = new StopWatch(name).start();
        List<T> results = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            List<String> observations = batch.get(i);
            T result;
            try {
                result = function.apply(observations);
            } catch (RuntimeException ex) {
                logger.error("Aborting " + name + " batch at sequence " + i + " " + observations + ": " + ex.getMessage());
                throw ex;
            }
            if (logger.isDebugEnabled())
                logger.debug(name + " sequence " + i + " " + observations + ": " + result);
            results.add(result);
        }
        logger.info(name + " for " + batch.size() + " sequences, " + sw.stop());
        return results;
    }
}
