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
package com.hmmtagger.util.exceptions;

/**
 * Thrown if an observation label to decode was never seen during estimation and therefore has
 * no column in the emission matrix.
 */
public class UnknownObservationException extends HmmTaggerException {
    private final int label;
    private final int timeStep;

    public UnknownObservationException(int label, int timeStep) {
        super("Unknown observation " + label + " at time step " + timeStep);
        this.label = label;
        this.timeStep = timeStep;
    }

    public int getLabel() {
        return label;
    }

    public int getTimeStep() {
        return timeStep;
    }
}
