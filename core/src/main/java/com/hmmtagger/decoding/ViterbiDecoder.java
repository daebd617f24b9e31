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
package com.hmmtagger.decoding;

import com.hmmtagger.hmm.MostLikelySequence;
import com.hmmtagger.hmm.ViterbiAlgorithm;
import com.hmmtagger.model.HmmModel;
import com.hmmtagger.model.LabelIndex;
import com.hmmtagger.util.Parameters;
import com.hmmtagger.util.exceptions.EmptySequenceException;
import com.hmmtagger.util.exceptions.NoCandidateStatesException;
import com.hmmtagger.util.exceptions.UnknownObservationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Decodes the most probable hidden state labels for observation labels of an {@link HmmModel}.
 * <p>
 * The start pseudo-state seeds the first time step through its transition row and is never
 * decoded itself. All other states are candidates, iterated in ascending label order so that the
 * lowest label wins ties. Instances are immutable and thread-safe.
 */
public class ViterbiDecoder {
    private static final Logger logger = LoggerFactory.getLogger(ViterbiDecoder.class);

    private final HmmModel model;
    private final int startStateLabel;
    private final int startState;
    private final int[] candidates;

    public ViterbiDecoder(HmmModel model) {
        this(model, Parameters.HMM.DEFAULT_START_STATE);
    }

    /**
     * @throws IllegalArgumentException if the start pseudo-state is not part of the state space
     */
    public ViterbiDecoder(HmmModel model, int startStateLabel) {
        LabelIndex states = model.getStates();
        this.startState = states.getIndex(startStateLabel);
        if (startState < 0)
            throw new IllegalArgumentException("start pseudo-state " + startStateLabel
                    + " is not part of the state space " + states);

        this.model = model;
        this.startStateLabel = startStateLabel;
        this.candidates = new int[states.size() - 1];
        int k = 0;
        for (int i = 0; i < states.size(); i++) {
            if (i != startState)
                candidates[k++] = i;
        }
    }

    public int getStartStateLabel() {
        return startStateLabel;
    }

    /**
     * Returns the most probable state labels, one for each observation label.
     *
     * @throws EmptySequenceException      if observations is empty
     * @throws NoCandidateStatesException  if the start pseudo-state is the only state
     * @throws UnknownObservationException if an observation label was not seen during estimation
     */
    public int[] decode(int[] observations) {
        MostLikelySequence result = computeMostLikelySequence(observations, logger.isDebugEnabled());
        if (result.messageHistory != null)
            logger.debug("decoded {} with probability {}\n{}", Arrays.toString(observations),
                    result.probability, result.messageHistoryString());

        LabelIndex states = model.getStates();
        int[] path = new int[result.sequence.length];
        for (int t = 0; t < path.length; t++) {
            path[t] = states.getLabel(result.sequence[t]);
        }
        return path;
    }

    /**
     * Runs the Viterbi algorithm and returns the result in state indices of the model.
     */
    public MostLikelySequence computeMostLikelySequence(int[] observations, boolean keepMessageHistory) {
        if (observations.length == 0)
            throw new EmptySequenceException("Cannot decode an empty observation sequence");
        if (candidates.length == 0)
            throw new NoCandidateStatesException("The state space " + model.getStates()
                    + " contains no state besides the start pseudo-state " + startStateLabel);

        int[] observationIndices = toObservationIndices(observations);
        ViterbiAlgorithm viterbi = new ViterbiAlgorithm(model, startState, candidates, keepMessageHistory);
        viterbi.startWithInitialObservation(observationIndices[0]);
        for (int t = 1; t < observationIndices.length; t++) {
            viterbi.nextStep(observationIndices[t]);
        }
        return viterbi.computeMostLikelySequence();
    }

    private int[] toObservationIndices(int[] observations) {
        LabelIndex alphabet = model.getObservations();
        int[] indices = new int[observations.length];
        for (int t = 0; t < observations.length; t++) {
            indices[t] = alphabet.getIndex(observations[t]);
            if (indices[t] < 0)
                throw new UnknownObservationException(observations[t], t);
        }
        return indices;
    }
}
