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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ViterbiAlgorithmTest {

    private static final int START = 0;
    private static final int RAIN = 1;
    private static final int SUN = 2;

    private static final int UMBRELLA = 0;
    private static final int NO_UMBRELLA = 1;

    private static double DELTA = 1e-8;

    static class ArrayProbabilities implements HmmProbabilities {
        final double[][] transitions;
        final double[][] emissions;

        ArrayProbabilities(double[][] transitions, double[][] emissions) {
            this.transitions = transitions;
            this.emissions = emissions;
        }

        @Override
        public int getStateCount() {
            return transitions.length;
        }

        @Override
        public int getObservationCount() {
            return emissions[0].length;
        }

        @Override
        public double emissionProbability(int state, int observation) {
            return emissions[state][observation];
        }

        @Override
        public double transitionProbability(int sourceState, int targetState) {
            return transitions[sourceState][targetState];
        }
    }

    private static ArrayProbabilities umbrellaWorld() {
        return new ArrayProbabilities(new double[][]{
                {0, 0.5, 0.5},
                {0, 0.7, 0.3},
                {0, 0.3, 0.7}
        }, new double[][]{
                {0, 0},
                {0.9, 0.1},
                {0.2, 0.8}
        });
    }

    /**
     * Tests the Viterbi algorithms with the umbrella example taken from Russell, Norvig: Aritifical
     * Intelligence - A Modern Approach, 3rd edition, chapter 15.2.3. The prior of 0.5 for both
     * states is the transition row of the start state.
     */
    @Test
    public void testComputeMostLikelySequence() {
        final ViterbiAlgorithm viterbi = new ViterbiAlgorithm(umbrellaWorld(), START, new int[]{RAIN, SUN}, true);
        viterbi.startWithInitialObservation(UMBRELLA);
        viterbi.nextStep(UMBRELLA);
        viterbi.nextStep(NO_UMBRELLA);
        viterbi.nextStep(UMBRELLA);

        final MostLikelySequence result = viterbi.computeMostLikelySequence();

        // Check most likely sequence
        assertArrayEquals(new int[]{RAIN, RAIN, SUN, RAIN}, result.sequence);
        assertEquals(0.0183708, result.probability, DELTA);
        assertEquals(4, viterbi.getTimeSteps());

        // Check message history
        List<double[]> history = result.messageHistory;
        assertEquals(4, history.size());
        assertArrayEquals(new double[]{0.45, 0.1}, history.get(0), DELTA);
        assertArrayEquals(new double[]{0.2835, 0.027}, history.get(1), DELTA);
        assertArrayEquals(new double[]{0.019845, 0.06804}, history.get(2), DELTA);
        assertArrayEquals(new double[]{0.0183708, 0.0095256}, history.get(3), DELTA);
        assertTrue(result.messageHistoryString().startsWith("Message history with probabilities"));
    }

    @Test
    public void testStaticCompute() {
        MostLikelySequence result = ViterbiAlgorithm.computeMostLikelySequence(umbrellaWorld(), START,
                new int[]{RAIN, SUN}, new int[]{UMBRELLA, UMBRELLA, NO_UMBRELLA, UMBRELLA});
        assertArrayEquals(new int[]{RAIN, RAIN, SUN, RAIN}, result.sequence);
        assertNull(result.messageHistory);
    }

    @Test
    public void testSingleObservation() {
        MostLikelySequence result = ViterbiAlgorithm.computeMostLikelySequence(umbrellaWorld(), START,
                new int[]{RAIN, SUN}, new int[]{NO_UMBRELLA});
        assertArrayEquals(new int[]{SUN}, result.sequence);
        assertEquals(0.4, result.probability, DELTA);
    }

    @Test
    public void testTiesKeepFirstCandidate() {
        ArrayProbabilities uniform = new ArrayProbabilities(new double[][]{
                {0, 0.5, 0.5},
                {0, 0.5, 0.5},
                {0, 0.5, 0.5}
        }, new double[][]{
                {0},
                {1},
                {1}
        });

        MostLikelySequence result = ViterbiAlgorithm.computeMostLikelySequence(uniform, START,
                new int[]{1, 2}, new int[]{0, 0, 0});
        assertArrayEquals(new int[]{1, 1, 1}, result.sequence);

        // iteration order decides, not the state index
        result = ViterbiAlgorithm.computeMostLikelySequence(uniform, START,
                new int[]{2, 1}, new int[]{0, 0, 0});
        assertArrayEquals(new int[]{2, 2, 2}, result.sequence);
    }

    @Test
    public void testTieCreatedByEmissionUnderflow() {
        // after the first step the messages are 3 and 4 times the smallest subnormal, the
        // emission of 0.5 rounds both products to 2 times the smallest subnormal
        ArrayProbabilities subnormal = new ArrayProbabilities(new double[][]{
                {0, 1, 1},
                {0, 1, 0},
                {0, 1, 0}
        }, new double[][]{
                {0, 0},
                {3 * Double.MIN_VALUE, 0.5},
                {4 * Double.MIN_VALUE, 0}
        });

        final ViterbiAlgorithm viterbi = new ViterbiAlgorithm(subnormal, START, new int[]{1, 2}, true);
        viterbi.startWithInitialObservation(0);
        viterbi.nextStep(1);
        final MostLikelySequence result = viterbi.computeMostLikelySequence();

        assertArrayEquals(new double[]{3 * Double.MIN_VALUE, 4 * Double.MIN_VALUE}, result.messageHistory.get(0), 0);
        assertArrayEquals(new double[]{2 * Double.MIN_VALUE, 0}, result.messageHistory.get(1), 0);
        assertArrayEquals(new int[]{1, 1}, result.sequence);
        assertEquals(2 * Double.MIN_VALUE, result.probability, 0);
    }

    @Test
    public void testZeroProbabilityPathsStillDecoded() {
        ArrayProbabilities impossible = new ArrayProbabilities(new double[][]{
                {0, 0.5, 0.5},
                {0, 1, 0},
                {0, 0, 1}
        }, new double[][]{
                {0, 0},
                {1, 0},
                {1, 0}
        });

        MostLikelySequence result = ViterbiAlgorithm.computeMostLikelySequence(impossible, START,
                new int[]{1, 2}, new int[]{0, 1, 1});
        assertEquals(3, result.size());
        assertEquals(0, result.probability, DELTA);
        assertArrayEquals(new int[]{1, 1, 1}, result.sequence);
    }

    @Test
    public void testEmptySequence() {
        ViterbiAlgorithm viterbi = new ViterbiAlgorithm(umbrellaWorld(), START, new int[]{RAIN, SUN});
        MostLikelySequence result = viterbi.computeMostLikelySequence();
        assertEquals(0, result.size());

        assertThrows(IllegalArgumentException.class, () ->
                ViterbiAlgorithm.computeMostLikelySequence(umbrellaWorld(), START, new int[]{RAIN, SUN}, new int[0]));
    }

    @Test
    public void testIllegalUsage() {
        assertThrows(IllegalArgumentException.class, () -> new ViterbiAlgorithm(umbrellaWorld(), START, new int[0]));
        assertThrows(IllegalArgumentException.class, () -> new ViterbiAlgorithm(umbrellaWorld(), START, new int[]{START, RAIN}));
        assertThrows(IllegalArgumentException.class, () -> new ViterbiAlgorithm(umbrellaWorld(), START, new int[]{3}));

        ViterbiAlgorithm viterbi = new ViterbiAlgorithm(umbrellaWorld(), START, new int[]{RAIN, SUN});
        assertThrows(IllegalStateException.class, () -> viterbi.nextStep(UMBRELLA));
        assertThrows(IllegalArgumentException.class, () -> viterbi.startWithInitialObservation(2));
        viterbi.startWithInitialObservation(UMBRELLA);
        assertThrows(IllegalStateException.class, () -> viterbi.startWithInitialObservation(UMBRELLA));
        assertThrows(IllegalStateException.class, () -> viterbi.computeMostLikelySequence().messageHistoryString());
    }
}
