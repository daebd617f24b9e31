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
package com.hmmtagger;

import com.hmmtagger.corpus.CorpusLoader;
import com.hmmtagger.corpus.SequenceCorpus;
import com.hmmtagger.corpus.TextCorpusLoader;
import com.hmmtagger.decoding.BatchPredictor;
import com.hmmtagger.decoding.PredictionJob;
import com.hmmtagger.decoding.PredictionJobLoader;
import com.hmmtagger.decoding.PredictionWriter;
import com.hmmtagger.decoding.ViterbiDecoder;
import com.hmmtagger.model.HmmModel;
import com.hmmtagger.model.MatrixWriter;
import com.hmmtagger.model.ParameterEstimator;
import com.hmmtagger.util.Helper;
import com.hmmtagger.util.PMap;
import com.hmmtagger.util.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Easy to use access point to estimate a hidden Markov model from a corpus file and to decode
 * the test cases of a prediction job file. Results are written next to the input file, the
 * extension replaced by the output suffix. Output files are only created once all results are
 * computed.
 */
public class HmmTagger {
    private static final Logger logger = LoggerFactory.getLogger(HmmTagger.class);

    private CorpusLoader corpusLoader = new TextCorpusLoader();
    private int startState = Parameters.HMM.DEFAULT_START_STATE;
    private boolean startStateStrict = false;
    private int predictionThreads = 1;
    private String outputSuffix = Parameters.Output.DEFAULT_SUFFIX;

    /**
     * Reads the configuration from the specified properties, see {@link Parameters}.
     */
    public HmmTagger init(PMap args) {
        Integer start = args.getIntOrNull(Parameters.HMM.START_STATE);
        if (args.has(Parameters.HMM.START_STATE) && start == null)
            throw new IllegalArgumentException(Parameters.HMM.START_STATE + " must be an integer label but was '"
                    + args.get(Parameters.HMM.START_STATE, "") + "'");
        if (start != null)
            setStartState(start);

        setStartStateStrict(args.getBool(Parameters.Estimation.START_STATE_STRICT, startStateStrict));
        setPredictionThreads(args.getInt(Parameters.Prediction.THREADS, predictionThreads));
        setOutputSuffix(args.get(Parameters.Output.SUFFIX, outputSuffix));
        logger.info("initialized with {}", this);
        return this;
    }

    public HmmTagger setCorpusLoader(CorpusLoader corpusLoader) {
        this.corpusLoader = corpusLoader;
        return this;
    }

    public HmmTagger setStartState(int startState) {
        this.startState = startState;
        return this;
    }

    public int getStartState() {
        return startState;
    }

    public HmmTagger setStartStateStrict(boolean startStateStrict) {
        this.startStateStrict = startStateStrict;
        return this;
    }

    public HmmTagger setPredictionThreads(int predictionThreads) {
        if (predictionThreads < 1)
            throw new IllegalArgumentException(Parameters.Prediction.THREADS + " must be at least 1 but was " + predictionThreads);
        this.predictionThreads = predictionThreads;
        return this;
    }

    public int getPredictionThreads() {
        return predictionThreads;
    }

    public HmmTagger setOutputSuffix(String outputSuffix) {
        if (Helper.isEmpty(outputSuffix))
            throw new IllegalArgumentException(Parameters.Output.SUFFIX + " must not be empty");
        this.outputSuffix = outputSuffix;
        return this;
    }

    public String getOutputSuffix() {
        return outputSuffix;
    }

    public HmmModel estimate(Path corpusFile) throws IOException {
        return estimate(corpusLoader.load(corpusFile));
    }

    public HmmModel estimate(SequenceCorpus corpus) {
        return new ParameterEstimator().
                setStartState(startState).
                setStartStateStrict(startStateStrict).
                estimate(corpus);
    }

    /**
     * Estimates the model of the corpus file and writes its matrices next to it.
     *
     * @return the written file
     */
    public Path estimateAndWrite(Path corpusFile) throws IOException {
        HmmModel model = estimate(corpusFile);
        Path output = getOutputFile(corpusFile);
        new MatrixWriter().write(model, output);
        logger.info("wrote matrices to {}", output);
        return output;
    }

    /**
     * Estimates the model from the corpus of the job and decodes all its test cases.
     *
     * @return the predicted state labels in the order of the test cases
     */
    public List<int[]> predict(PredictionJob job) throws IOException {
        HmmModel model = estimate(Paths.get(job.getCorpusLocation()));
        return predict(model, job.getTestCases());
    }

    public List<int[]> predict(HmmModel model, List<int[]> testCases) {
        ViterbiDecoder decoder = new ViterbiDecoder(model, startState);
        return new BatchPredictor(decoder, predictionThreads).predict(testCases);
    }

    /**
     * Reads the job file, decodes every test case and writes one line per test case next to the
     * job file.
     *
     * @return the written file
     */
    public Path predictAndWrite(Path jobFile) throws IOException {
        PredictionJob job = new PredictionJobLoader().load(jobFile);
        logger.info("loaded prediction job {}, {}", jobFile, job);
        List<int[]> paths = predict(job);
        Path output = getOutputFile(jobFile);
        new PredictionWriter().write(paths, output);
        logger.info("wrote {} predictions to {}", paths.size(), output);
        return output;
    }

    public Path getOutputFile(Path inputFile) {
        return Helper.siblingWithSuffix(inputFile, outputSuffix);
    }

    @Override
    public String toString() {
        return Parameters.HMM.START_STATE + "=" + startState
                + ", " + Parameters.Estimation.START_STATE_STRICT + "=" + startStateStrict
                + ", " + Parameters.Prediction.THREADS + "=" + predictionThreads
                + ", " + Parameters.Output.SUFFIX + "=" + outputSuffix;
    }
}
