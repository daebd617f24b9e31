/**
 * Copyright (C) 2015-2016, BMW Car IT GmbH and BMW AG
 * Author: Stefan Holder (stefan.holder@bmw.de)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.hmmtagger.hmm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Implementation of the Viterbi algorithm for stationary Markov processes with a fixed set of
 * candidate states, as described e.g. in Rabiner, Juang, An introduction to Hidden Markov Models,
 * IEEE ASSP Mag., pp 4-16, June 1986.
 *
 * <p>States and observations are dense indices into the matrices of {@link HmmProbabilities}.
 * The computation is seeded from a start pseudo-state: the initial message for candidate s is
 * p(s|start) * p(o_1|s). The start pseudo-state is never a candidate and never part of the
 * returned sequence.
 *
 * <p>Probabilities are multiplied directly without a logarithmic transform. Long sequences may
 * therefore underflow to zero. In this case the maximization still picks a state and back
 * pointer, the first candidate in iteration order, see {@link FirstMaxSelector}.
 *
 * <p>Need to construct a new instance for each sequence of observations.
 */
public class ViterbiAlgorithm {

    private final HmmProbabilities probabilities;
    private final int startState;

    /**
     * Candidate state indices in iteration order. Ties are resolved in favor of the earlier
     * candidate.
     */
    private final int[] candidates;

    /**
     * For the k-th candidate s of the current time step t, message[k] contains the probability
     * of the most likely sequence ending in s with given observations o_1, ..., o_t.
     */
    private double[] message;

    /**
     * backPointers.get(t)[k] contains the position in {@link #candidates} of the previous state
     * of the most likely sequence passing at time step t through the k-th candidate, or -1 for
     * the start pseudo-state at t=0.
     */
    private final List<int[]> backPointers = new ArrayList<>();

    private List<double[]> messageHistory; // For debugging only.

    /**
     * Does not keep the message history.
     */
    public ViterbiAlgorithm(HmmProbabilities probabilities, int startState, int[] candidates) {
        this(probabilities, startState, candidates, false);
    }

    /**
     * @param startState index of the start pseudo-state whose transition row seeds the first
     * time step
     * @param candidates indices of all candidate states in the order used for tie-breaking. Must
     * not contain the start pseudo-state.
     * @param keepMessageHistory Whether to store intermediate forward messages
     * (probabilities of intermediate most likely paths) for debugging.
     */
    public ViterbiAlgorithm(HmmProbabilities probabilities, int startState, int[] candidates,
                            boolean keepMessageHistory) {
        if (probabilities == null || candidates == null) {
            throw new NullPointerException();
        }
        if (candidates.length == 0) {
            throw new IllegalArgumentException("At least one candidate state is required");
        }
        int stateCount = probabilities.getStateCount();
        checkState(startState, stateCount);
        for (int candidate : candidates) {
            checkState(candidate, stateCount);
            if (candidate == startState) {
                throw new IllegalArgumentException("Start state " + startState + " must not be a candidate");
            }
        }

        this.probabilities = probabilities;
        this.startState = startState;
        this.candidates = candidates.clone(); // Defensive copy.
        if (keepMessageHistory) {
            messageHistory = new ArrayList<>();
        }
    }

    private static void checkState(int state, int stateCount) {
        if (state < 0 || state >= stateCount) {
            throw new IllegalArgumentException("State " + state + " out of range [0, " + stateCount + ")");
        }
    }

    /**
     * Lets the HMM computation start at the given first observation. The initial probability of
     * each candidate s is p(s|start) * p(observation|s).
     *
     * @throws IllegalStateException if this method has already been called
     */
    public void startWithInitialObservation(int observation) {
        if (message != null) {
            throw new IllegalStateException("Initial probabilities have already been set.");
        }
        checkObservation(observation);

        final double[] initialMessage = new double[candidates.length];
        final int[] initialBackPointers = new int[candidates.length];
        for (int k = 0; k < candidates.length; k++) {
            final int candidate = candidates[k];
            initialMessage[k] = probabilities.transitionProbability(startState, candidate)
                    * probabilities.emissionProbability(candidate, observation);
            initialBackPointers[k] = -1;
        }
        setMessage(initialMessage, initialBackPointers);
    }

    /**
     * Processes the next time step.
     *
     * @throws IllegalStateException if {@link #startWithInitialObservation(int)} has not been
     * called before
     */
    public void nextStep(int observation) {
        if (message == null) {
            throw new IllegalStateException("startWithInitialObservation() must be called first.");
        }
        checkObservation(observation);

        // Forward step
        final double[] newMessage = new double[candidates.length];
        final int[] newBackPointers = new int[candidates.length];
        final FirstMaxSelector selector = new FirstMaxSelector();
        for (int k = 0; k < candidates.length; k++) {
            final int curState = candidates[k];
            final double emissionProbability = probabilities.emissionProbability(curState, observation);
            selector.reset();
            // The emission is part of the compared value: products that underflow to the same
            // value tie and the first predecessor wins.
            for (int prev = 0; prev < candidates.length; prev++) {
                selector.offer(prev, message[prev]
                        * probabilities.transitionProbability(candidates[prev], curState)
                        * emissionProbability);
            }
            newMessage[k] = selector.getBestValue();
            newBackPointers[k] = selector.getBest();
        }
        setMessage(newMessage, newBackPointers);
    }

    private void setMessage(double[] newMessage, int[] newBackPointers) {
        message = newMessage;
        backPointers.add(newBackPointers);
        if (messageHistory != null) {
            messageHistory.add(newMessage);
        }
    }

    private void checkObservation(int observation) {
        if (observation < 0 || observation >= probabilities.getObservationCount()) {
            throw new IllegalArgumentException("Observation " + observation + " out of range [0, "
                    + probabilities.getObservationCount() + ")");
        }
    }

    /**
     * Returns the number of processed time steps.
     */
    public int getTimeSteps() {
        return backPointers.size();
    }

    /**
     * Returns the most likely sequence of states for all time steps. Returns an empty sequence
     * if no time step has been processed.
     *
     * <p>Formally, the most likely sequence is argmax p(s_1, ..., s_T | o_1, ..., o_T)
     * with respect to s_1, ..., s_T, where s_t is a state candidate at time step t,
     * o_t is the observation at time step t and T is the number of time steps.
     */
    public MostLikelySequence computeMostLikelySequence() {
        if (message == null) {
            return new MostLikelySequence(new int[0], 0, messageHistory);
        }

        final FirstMaxSelector selector = new FirstMaxSelector();
        for (int k = 0; k < message.length; k++) {
            selector.offer(k, message[k]);
        }

        // Retrieve most likely state sequence in reverse order
        final int timeSteps = backPointers.size();
        final int[] sequence = new int[timeSteps];
        int position = selector.getBest();
        for (int t = timeSteps - 1; t >= 0; t--) {
            sequence[t] = candidates[position];
            position = backPointers.get(t)[position];
        }
        assert position == -1 : "back pointers must end at the start state";

        return new MostLikelySequence(sequence, selector.getBestValue(), messageHistory);
    }

    /**
     * Computes the most likely sequence for the specified observation indices.
     *
     * @throws IllegalArgumentException if observations is empty
     */
    public static MostLikelySequence computeMostLikelySequence(HmmProbabilities probabilities,
                                                               int startState, int[] candidates,
                                                               int[] observations) {
        if (observations.length == 0) {
            throw new IllegalArgumentException("Observation sequence must not be empty");
        }

        ViterbiAlgorithm viterbi = new ViterbiAlgorithm(probabilities, startState, candidates);
        viterbi.startWithInitialObservation(observations[0]);
        for (int t = 1; t < observations.length; t++) {
            viterbi.nextStep(observations[t]);
        }
        return viterbi.computeMostLikelySequence();
    }

    @Override
    public String toString() {
        return "ViterbiAlgorithm [startState=" + startState + ", candidates=" + Arrays.toString(candidates)
                + ", timeSteps=" + backPointers.size() + "]";
    }
}
