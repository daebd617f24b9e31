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

import java.util.Arrays;
import java.util.List;

/**
 * Contains the most likely sequence and additional results of the Viterbi algorithm.
 */
public class MostLikelySequence {

    /**
     * State indices of the most likely sequence, one per time step. Never contains the start
     * pseudo-state.
     */
    public final int[] sequence;

    /**
     * Probability of the most likely sequence, i.e. max p(s_1, ..., s_T, o_1, ..., o_T).
     * Zero if all paths underflowed.
     */
    public final double probability;

    /**
     * Sequence of computed messages for each time step. Is null if message history
     * is not kept.
     *
     * For time step t, messageHistory.get(t)[k] contains the probability of the most likely
     * sequence ending in the k-th candidate state with given observations o_1, ..., o_t.
     */
    public final List<double[]> messageHistory;

    public MostLikelySequence(int[] sequence, double probability, List<double[]> messageHistory) {
        this.sequence = sequence;
        this.probability = probability;
        this.messageHistory = messageHistory;
    }

    public int size() {
        return sequence.length;
    }

    public String messageHistoryString() {
        if (messageHistory == null) {
            throw new IllegalStateException("Message history was not recorded.");
        }

        final StringBuilder sb = new StringBuilder();
        sb.append("Message history with probabilities\n\n");
        int i = 0;
        for (double[] message : messageHistory) {
            sb.append("Time step " + i + "\n");
            i++;
            for (int k = 0; k < message.length; k++) {
                sb.append(k + ": " + message[k] + "\n");
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "MostLikelySequence [sequence=" + Arrays.toString(sequence) + ", probability=" + probability + "]";
    }
}
