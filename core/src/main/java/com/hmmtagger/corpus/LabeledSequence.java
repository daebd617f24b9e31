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
package com.hmmtagger.corpus;

import java.util.Arrays;

/**
 * One training run: the hidden state labels and the observation labels emitted at the same time
 * steps. Both arrays are expected to have the same length, this is checked by the estimation.
 */
public class LabeledSequence {
    private final int[] states;
    private final int[] observations;

    public LabeledSequence(int[] states, int[] observations) {
        if (states == null || observations == null)
            throw new NullPointerException("states and observations are required");

        this.states = states.clone();
        this.observations = observations.clone();
    }

    /**
     * @return the state labels. Callers must not modify the returned array.
     */
    public int[] getStates() {
        return states;
    }

    /**
     * @return the observation labels. Callers must not modify the returned array.
     */
    public int[] getObservations() {
        return observations;
    }

    public int size() {
        return states.length;
    }

    public boolean isAligned() {
        return states.length == observations.length;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        LabeledSequence other = (LabeledSequence) obj;
        return Arrays.equals(states, other.states) && Arrays.equals(observations, other.observations);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(states) + Arrays.hashCode(observations);
    }

    @Override
    public String toString() {
        return "LabeledSequence [states=" + Arrays.toString(states) + ", observations="
                + Arrays.toString(observations) + "]";
    }
}
