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

import com.hmmtagger.hmm.HmmProbabilities;

/**
 * The estimated hidden Markov model: the state space, the observation alphabet, the transition
 * matrix A (N x N) and the emission matrix B (N x M). Row and column indices are the ones of the
 * label indexes.
 * <p>
 * Instances are immutable and can be shared by concurrent decoders.
 */
public class HmmModel implements HmmProbabilities {
    private final LabelIndex states;
    private final LabelIndex observations;
    private final double[][] transitions;
    private final double[][] emissions;

    public HmmModel(LabelIndex states, LabelIndex observations, double[][] transitions, double[][] emissions) {
        int n = states.size();
        int m = observations.size();
        if (transitions.length != n || emissions.length != n)
            throw new IllegalArgumentException("Expected " + n + " rows but transitions has " + transitions.length
                    + " and emissions " + emissions.length);

        this.states = states;
        this.observations = observations;
        this.transitions = new double[n][];
        this.emissions = new double[n][];
        for (int i = 0; i < n; i++) {
            if (transitions[i].length != n)
                throw new IllegalArgumentException("Transition row " + i + " has " + transitions[i].length + " columns, expected " + n);
            if (emissions[i].length != m)
                throw new IllegalArgumentException("Emission row " + i + " has " + emissions[i].length + " columns, expected " + m);
            this.transitions[i] = transitions[i].clone();
            this.emissions[i] = emissions[i].clone();
        }
    }

    public LabelIndex getStates() {
        return states;
    }

    public LabelIndex getObservations() {
        return observations;
    }

    @Override
    public int getStateCount() {
        return states.size();
    }

    @Override
    public int getObservationCount() {
        return observations.size();
    }

    @Override
    public double transitionProbability(int sourceState, int targetState) {
        return transitions[sourceState][targetState];
    }

    @Override
    public double emissionProbability(int state, int observation) {
        return emissions[state][observation];
    }

    /**
     * Returns A[from][to] looked up by labels.
     *
     * @throws IllegalArgumentException if a label is not part of the state space
     */
    public double getTransition(int fromLabel, int toLabel) {
        return transitions[stateIndex(fromLabel)][stateIndex(toLabel)];
    }

    /**
     * Returns B[state][observation] looked up by labels.
     *
     * @throws IllegalArgumentException if a label is unknown
     */
    public double getEmission(int stateLabel, int observationLabel) {
        int obs = observations.getIndex(observationLabel);
        if (obs < 0)
            throw new IllegalArgumentException("Unknown observation " + observationLabel);
        return emissions[stateIndex(stateLabel)][obs];
    }

    private int stateIndex(int label) {
        int index = states.getIndex(label);
        if (index < 0)
            throw new IllegalArgumentException("Unknown state " + label);
        return index;
    }

    /**
     * @return a copy of the transition matrix
     */
    public double[][] getTransitionMatrix() {
        return copy(transitions);
    }

    /**
     * @return a copy of the emission matrix
     */
    public double[][] getEmissionMatrix() {
        return copy(emissions);
    }

    private static double[][] copy(double[][] matrix) {
        double[][] result = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            result[i] = matrix[i].clone();
        }
        return result;
    }

    @Override
    public String toString() {
        return "states:" + states.size() + ", observations:" + observations.size();
    }
}
