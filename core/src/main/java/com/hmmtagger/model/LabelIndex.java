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

import com.carrotsearch.hppc.IntIntHashMap;

import java.util.Arrays;

/**
 * A bijection between arbitrary integer labels and the dense indices 0..size()-1 used for the
 * rows and columns of the probability matrices. Indices follow the ascending label order, so the
 * same label set always results in the same matrix layout.
 */
public class LabelIndex {
    private final int[] labels;
    private final IntIntHashMap indexByLabel;

    /**
     * @param sortedLabels distinct labels in strictly ascending order
     */
    public LabelIndex(int[] sortedLabels) {
        this.labels = sortedLabels.clone();
        this.indexByLabel = new IntIntHashMap(labels.length);
        for (int i = 0; i < labels.length; i++) {
            if (i > 0 && labels[i - 1] >= labels[i])
                throw new IllegalArgumentException("Labels must be distinct and in ascending order: " + Arrays.toString(sortedLabels));
            indexByLabel.put(labels[i], i);
        }
    }

    /**
     * Creates the index of the distinct values of the specified labels in any order.
     */
    public static LabelIndex of(int... labels) {
        return new LabelIndex(Arrays.stream(labels).distinct().sorted().toArray());
    }

    public int size() {
        return labels.length;
    }

    /**
     * @return the index of the label or -1 if the label is unknown
     */
    public int getIndex(int label) {
        return indexByLabel.getOrDefault(label, -1);
    }

    public boolean contains(int label) {
        return indexByLabel.containsKey(label);
    }

    public int getLabel(int index) {
        return labels[index];
    }

    public int[] getLabels() {
        return labels.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        return Arrays.equals(labels, ((LabelIndex) obj).labels);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(labels);
    }

    @Override
    public String toString() {
        return Arrays.toString(labels);
    }
}
