/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.faultpredictor.attribution;

import static com.amazon.faultpredictor.CommonUtils.checkArgument;
import static com.amazon.faultpredictor.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-feature weights explaining an anomaly judgment. Entries are ordered by
 * descending weight; equal weights keep the order of the feature index.
 */
@ToString
public class FeatureImportance {

    /**
     * descending weight, then ascending feature index
     */
    public static final Comparator<Entry> ORDER = Comparator.comparingDouble(Entry::getWeight).reversed()
            .thenComparingInt(Entry::getIndex);

    @Getter
    @ToString
    @EqualsAndHashCode
    @AllArgsConstructor
    public static class Entry {
        private final String name;
        private final int index;
        private final double weight;
    }

    private final List<Entry> entries;

    /**
     * the score the weights were scaled by
     */
    @Getter
    private final double anomalyScore;

    public FeatureImportance(List<Entry> entries, double anomalyScore) {
        checkNotNull(entries, "entries must not be null");
        for (Entry entry : entries) {
            checkArgument(entry.getWeight() >= 0, "weights cannot be negative");
        }
        List<Entry> sorted = new ArrayList<>(entries);
        sorted.sort(ORDER);
        this.entries = Collections.unmodifiableList(sorted);
        this.anomalyScore = anomalyScore;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public double getWeight(String name) {
        return find(name).map(Entry::getWeight).orElse(0.0);
    }

    /**
     * @param name a feature name
     * @return the weight of the feature multiplied by the anomaly score, or 0 for
     *         an unknown feature
     */
    public double getContribution(String name) {
        return getWeight(name) * anomalyScore;
    }

    public Optional<String> getTopFeature() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(0).getName());
    }

    public double getTotalWeight() {
        double sum = 0;
        for (Entry entry : entries) {
            sum += entry.getWeight();
        }
        return sum;
    }

    /**
     * The k heaviest entries, renormalized so that their weights sum to 1. When
     * every kept weight is 0 the kept entries share the weight uniformly.
     *
     * @param k maximum number of entries
     * @return a new importance with min(k, size()) entries
     */
    public FeatureImportance top(int k) {
        checkArgument(k > 0, "k must be positive");
        List<Entry> kept = entries.subList(0, Math.min(k, entries.size()));
        double total = 0;
        for (Entry entry : kept) {
            total += entry.getWeight();
        }
        List<Entry> normalized = new ArrayList<>(kept.size());
        for (Entry entry : kept) {
            double weight = (total > 0) ? entry.getWeight() / total : 1.0 / kept.size();
            normalized.add(new Entry(entry.getName(), entry.getIndex(), weight));
        }
        return new FeatureImportance(normalized, anomalyScore);
    }

    /**
     * @return feature name to weight, in descending weight order
     */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (Entry entry : entries) {
            map.put(entry.getName(), entry.getWeight());
        }
        return map;
    }

    private Optional<Entry> find(String name) {
        checkNotNull(name, "name must not be null");
        return entries.stream().filter(entry -> entry.getName().equals(name)).findFirst();
    }
}
