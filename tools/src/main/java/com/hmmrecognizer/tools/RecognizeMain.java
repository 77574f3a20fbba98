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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hmmrecognizer.HmmRecognizer;
import com.hmmrecognizer.util.CmdArgs;
import com.hmmrecognizer.util.StopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates observation files against a model:
 * <pre>
 * recognize model.hmm first.obs second.obs [algorithm=forward|backward|viterbi|posterior|all]
 *           [format=text|json] [config=recognize.properties]
 * </pre>
 */
public class RecognizeMain {
    public static final String MODEL_SUFFIX = ".hmm";
    public static final String OBSERVATION_SUFFIX = ".obs";

    public static void main(String[] args) {
        System.exit(new RecognizeMain(System.out, System.err).start(args));
    }

    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final PrintStream out;
    private final PrintStream err;

    public RecognizeMain(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * @return the exit status, 0 on success
     */
    public int start(String[] rawArgs) {
        if (rawArgs.length == 0) {
            printUsage();
            return 1;
        }

        try {
            CmdArgs args = CmdArgs.readFromConfigAndMerge(CmdArgs.read(rawArgs));
            String modelFile = "";
            List<String> observationFiles = new ArrayList<>();
            for (String arg : args.getPositional()) {
                if (arg.contains(MODEL_SUFFIX)) {
                    if (!modelFile.isEmpty())
                        logger.warn("More than one model file specified, using " + arg + " instead of " + modelFile);
                    modelFile = arg;
                } else if (arg.contains(OBSERVATION_SUFFIX)) {
                    observationFiles.add(arg);
                } else {
                    logger.warn("Ignoring argument " + arg);
                }
            }

            if (modelFile.isEmpty()) {
                err.println("no " + MODEL_SUFFIX + " file found");
                printUsage();
                return 1;
            }

            String algorithm = args.get("algorithm", "all").toLowerCase();
            if (!algorithm.equals("all") && !algorithm.equals("forward") && !algorithm.equals("backward")
                    && !algorithm.equals("viterbi") && !algorithm.equals("posterior")) {
                err.println("unknown algorithm: " + algorithm);
                printUsage();
                return 1;
            }
            String format = args.get("format", "text").toLowerCase();
            if (!format.equals("text") && !format.equals("json")) {
                err.println("unknown format: " + format);
                printUsage();
                return 1;
            }

            logger.info("Configuration: " + args);
            HmmRecognizer recognizer = HmmRecognizer.load(modelFile, args);
            ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
            StopWatch sw = new StopWatch().start();
            for (String observationFile : observationFiles) {
                BatchReport report = createReport(recognizer, observationFile, algorithm);
                if (format.equals("json"))
                    out.println(objectMapper.writeValueAsString(report));
                else
                    report.writeText(out);
            }
            logger.info("Processed " + observationFiles.size() + " observation files in " + sw.stop().getSeconds() + "s");
            return 0;
        } catch (IOException | RuntimeException ex) {
            logger.error("Recognition failed: " + ex.getMessage(), ex);
            err.println(ex.getMessage());
            return 1;
        }
    }

    BatchReport createReport(HmmRecognizer recognizer, String observationFile, String algorithm) throws IOException {
        List<List<String>> batch = recognizer.read(observationFile);
        BatchReport report = new BatchReport(observationFile, batch);
        boolean all = algorithm.equals("all");
        if (all || algorithm.equals("forward"))
            report.setForward(recognizer.forward(batch));
        if (all || algorithm.equals("backward"))
            report.setBackward(recognizer.backward(batch));
        if (all || algorithm.equals("viterbi"))
            report.setViterbi(recognizer.viterbi(batch));
        if (algorithm.equals("posterior"))
            report.setPosteriors(recognizer.posteriors(batch));
        return report;
    }

    private void printUsage() {
        out.println("Usage: recognize [model" + MODEL_SUFFIX + "] [observation" + OBSERVATION_SUFFIX + " ...]\n"
                + "  algorithm=forward|backward|viterbi|posterior|all (default all)\n"
                + "  format=text|json (default text)\n"
                + "  config=<properties file> with e.g. model.validate=false or model.tolerance=1e-4");
    }
}
