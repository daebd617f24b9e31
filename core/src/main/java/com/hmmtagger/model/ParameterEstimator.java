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
package com.hmmtagger.model;

import com.hmmtagger.corpus.LabeledSequence;
import com.hmmtagger.corpus.SequenceCorpus;
import com.hmmtagger.util.Parameters;
import com.hmmtagger.util.StopWatch;
import com.hmmtagger.util.exceptions.CorpusException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.hmmtagger.util.Helper.getMemInfo;

/**
 * Supervised maximum likelihood estimation of an {@link HmmModel} from labeled runs.
 * <p>
 * A[i][j] is the number of transitions i to j divided by all transitions leaving i and B[i][k]
 * is the number of times state i emitted k divided by the occurrences of i. A row without any
 * count stays all zero, no smoothing is applied.
 */
public class ParameterEstimator {
    private static final Logger logger = LoggerFactory.getLogger(ParameterEstimator.class);

    private int startState = Parameters.HMM.DEFAULT_START_STATE;
    private boolean startStateStrict = false;

    /**
     * Sets the label of the start pseudo-state. It is only inspected to detect training data that
     * uses it as a genuine hidden state.
     */
    public ParameterEstimator setStartState(int startState) {
        this.startState = startState;
        return this;
    }

    /**
     * If true, a start pseudo-state appearing after the first position of a run makes the
     * estimation fail. Otherwise a warning is logged.
     */
    public ParameterEstimator setStartStateStrict(boolean startStateStrict) {
        this.startStateStrict = startStateStrict;
        return this;
    }

    /**
     * @throws CorpusException if the corpus is empty or a run is empty or not aligned
     */
    public HmmModel estimate(SequenceCorpus corpus) {
        StopWatch sw = new StopWatch().start();
        validate(corpus);

        LabelIndex states = new LabelIndex(corpus.getStateLabels());
        LabelIndex observations = new LabelIndex(corpus.getObservationLabels());
        int n = states.size();
        int m = observations.size();

        int[][] transitionCounts = new int[n][n];
        int[][] emissionCounts = new int[n][m];
        int[] stateCounts = new int[n];
        int startStateUses = 0;
        for (LabeledSequence run : corpus.getRuns()) {
            int[] stateLabels = run.getStates();
            int[] observationLabels = run.getObservations();
            int prev = -1;
            for (int t = 0; t < stateLabels.length; t++) {
                int cur = states.getIndex(stateLabels[t]);
                if (prev >= 0)
                    transitionCounts[prev][cur]++;
                emissionCounts[cur][observations.getIndex(observationLabels[t])]++;
                stateCounts[cur]++;
                if (t > 0 && stateLabels[t] == startState)
                    startStateUses++;
                prev = cur;
            }
        }

        checkStartState(startStateUses);

        double[][] transitions = new double[n][n];
        for (int i = 0; i < n; i++) {
            normalize(transitionCounts[i], sum(transitionCounts[i]), transitions[i]);
        }

        double[][] emissions = new double[n][m];
        for (int i = 0; i < n; i++) {
            normalize(emissionCounts[i], stateCounts[i], emissions[i]);
        }

        HmmModel model = new HmmModel(states, observations, transitions, emissions);
        logger.info("estimated model from {} runs, {}, took {}ms, {}", corpus.size(), model, sw.stop().getMillis(), getMemInfo());
        return model;
    }

    private static void validate(SequenceCorpus corpus) {
        if (corpus.isEmpty())
            throw new CorpusException("corpus contains no runs");

        List<LabeledSequence> runs = corpus.getRuns();
        for (int r = 0; r < runs.size(); r++) {
            LabeledSequence run = runs.get(r);
            if (!run.isAligned())
                throw new CorpusException(r, run.getStates().length + " states but "
                        + run.getObservations().length + " observations");
            if (run.size() == 0)
                throw new CorpusException(r, "run is empty");
        }
    }

    private void checkStartState(int startStateUses) {
        if (startStateUses == 0)
            return;

        String message = "start pseudo-state " + startState + " is used " + startStateUses
                + " times as a hidden state after the first position of a run";
        if (startStateStrict)
            throw new CorpusException(message);
        logger.warn(message + ", decoding will never predict it");
    }

    private static int sum(int[] counts) {
        int sum = 0;
        for (int count : counts) {
            sum += count;
        }
        return sum;
    }

    /**
     * Divides every count by total. Leaves the row zero if total is 0.
     */
    static void normalize(int[] counts, int total, double[] row) {
        if (total <= 0)
            return;

        for (int j = 0; j < counts.length; j++) {
            row[j] = (double) counts[j] / total;
        }
    }
}
