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

import com.carrotsearch.hppc.IntHashSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An ordered collection of training runs together with the sorted sets of all state and
 * observation labels occurring in them. The order of the runs does not influence the estimated
 * model.
 */
public class SequenceCorpus {
    private final List<LabeledSequence> runs;
    private final int[] stateLabels;
    private final int[] observationLabels;

    public SequenceCorpus(List<LabeledSequence> runs) {
        this.runs = Collections.unmodifiableList(new ArrayList<>(runs));

        IntHashSet states = new IntHashSet();
        IntHashSet observations = new IntHashSet();
        for (LabeledSequence run : this.runs) {
            states.addAll(run.getStates());
            observations.addAll(run.getObservations());
        }
        this.stateLabels = sorted(states);
        this.observationLabels = sorted(observations);
    }

    private static int[] sorted(IntHashSet set) {
        int[] array = set.toArray();
        Arrays.sort(array);
        return array;
    }

    public List<LabeledSequence> getRuns() {
        return runs;
    }

    public int size() {
        return runs.size();
    }

    public boolean isEmpty() {
        return runs.isEmpty();
    }

    /**
     * @return all distinct state labels in ascending order
     */
    public int[] getStateLabels() {
        return stateLabels.clone();
    }

    /**
     * @return all distinct observation labels in ascending order
     */
    public int[] getObservationLabels() {
        return observationLabels.clone();
    }

    @Override
    public String toString() {
        return "runs:" + runs.size() + ", states:" + stateLabels.length + ", observations:" + observationLabels.length;
    }
}
