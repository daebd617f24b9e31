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

/**
 * This interface needs to be implemented and passed to {@link ViterbiAlgorithm} to specify
 * emission and transition probabilities of a stationary HMM whose states and observations are
 * identified by dense indices.
 *
 * <p>The methods return plain probabilities, not logarithms. Products of many small values may
 * underflow to zero, which the algorithm accepts.
 */
public interface HmmProbabilities {

    /**
     * Returns the number of states, including a possible start pseudo-state.
     */
    int getStateCount();

    /**
     * Returns the number of distinct observation symbols.
     */
    int getObservationCount();

    /**
     * Returns the probability of making the specified observation in the specified state,
     * i.e. p(observation|state).
     */
    double emissionProbability(int state, int observation);

    /**
     * Returns the probability of the transition from sourceState to targetState,
     * i.e. p(targetState|sourceState).
     */
    double transitionProbability(int sourceState, int targetState);

}
