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
 * Keeps the first candidate with the highest value among all offered candidates.
 * A later candidate replaces the current best only if its value is strictly greater, so on
 * ties the earliest offered candidate wins. The Viterbi algorithm relies on this to be
 * reproducible for tied probabilities, including paths whose probability underflowed to zero.
 * <p>
 * The first offered candidate is always accepted, regardless of its value.
 */
public final class FirstMaxSelector {
    private int best = -1;
    private double bestValue = Double.NaN;

    public FirstMaxSelector offer(int candidate, double value) {
        if (candidate < 0)
            throw new IllegalArgumentException("Candidate must not be negative: " + candidate);

        if (best < 0 || value > bestValue) {
            best = candidate;
            bestValue = value;
        }
        return this;
    }

    public boolean isEmpty() {
        return best < 0;
    }

    /**
     * @throws IllegalStateException if nothing was offered yet
     */
    public int getBest() {
        if (isEmpty())
            throw new IllegalStateException("No candidate offered");
        return best;
    }

    public double getBestValue() {
        if (isEmpty())
            throw new IllegalStateException("No candidate offered");
        return bestValue;
    }

    public FirstMaxSelector reset() {
        best = -1;
        bestValue = Double.NaN;
        return this;
    }

    @Override
    public String toString() {
        return isEmpty() ? "FirstMaxSelector [empty]" : "FirstMaxSelector [best=" + best + ", value=" + bestValue + "]";
    }
}
