/*
 * Copyright [2012-2014] PayPal Software Foundation
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
package ml.tally.tally.core.model;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.tally.tally.container.Record;
import ml.tally.tally.core.FieldAccessor;
import ml.tally.tally.exception.TallyErrorCode;
import ml.tally.tally.exception.TallyException;
import ml.tally.tally.util.JSONUtils;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Function;

/**
 * Trained state of a categorical Naive Bayes classifier: label counts and, per label, feature value counts. Immutable
 * once built, so one model can serve predictions from many threads.
 * 
 * <p>
 * Probabilities use Laplace (add-one) smoothing:
 * {@code P(value | label) = (count(label, feature, value) + 1) / (count(label) + distinct(feature))}, an unseen value
 * gets the floor {@code 1 / (count(label) + distinct(feature))}. Scores are summed in log space, which keeps the
 * arg-max of the product form without underflow on long feature lists.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class NaiveBayesModel {

    private final String labelField;

    private final List<String> featureFields;

    private final int totalCount;

    /**
     * in first appearance order of the training data, which breaks ties
     */
    private final List<LabelStats> labels;

    private final Map<String, Integer> distinctValueCounts;

    /**
     * label index -> feature -> canonical value -> count
     */
    @JsonIgnore
    private final List<Map<String, Map<Object, Integer>>> lookup;

    @JsonCreator
    public NaiveBayesModel(@JsonProperty("labelField") String labelField,
            @JsonProperty("featureFields") List<String> featureFields, @JsonProperty("totalCount") int totalCount,
            @JsonProperty("labels") List<LabelStats> labels,
            @JsonProperty("distinctValueCounts") Map<String, Integer> distinctValueCounts) {
        this.labelField = labelField;
        this.featureFields = Collections.unmodifiableList(new ArrayList<String>(featureFields));
        this.totalCount = totalCount;
        this.labels = Collections.unmodifiableList(new ArrayList<LabelStats>(labels));
        this.distinctValueCounts = Collections.unmodifiableMap(new LinkedHashMap<String, Integer>(
                distinctValueCounts));
        this.lookup = buildLookup(this.labels);
    }

    private static List<Map<String, Map<Object, Integer>>> buildLookup(List<LabelStats> labels) {
        List<Map<String, Map<Object, Integer>>> lookup = new ArrayList<Map<String, Map<Object, Integer>>>(
                labels.size());
        for(LabelStats label: labels) {
            Map<String, Map<Object, Integer>> features = new HashMap<String, Map<Object, Integer>>();
            for(FeatureValueCount valueCount: label.getValueCounts()) {
                Map<Object, Integer> counts = features.get(valueCount.getFeature());
                if(counts == null) {
                    counts = new HashMap<Object, Integer>();
                    features.put(valueCount.getFeature(), counts);
                }
                counts.put(valueCount.getValue(), valueCount.getCount());
            }
            lookup.add(features);
        }
        return lookup;
    }

    /**
     * Label with the highest score; on equal scores the label seen first in training wins. Never fails: unseen values
     * fall back to the smoothing floor and features missing from the query are left out of the score.
     */
    public Object predict(Record query) {
        Object best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for(int i = 0; i < labels.size(); i++) {
            double score = logScore(i, query);
            if(best == null || score > bestScore) {
                best = labels.get(i).getLabel();
                bestScore = score;
            }
        }
        return best;
    }

    /**
     * @return label to {@code log(prior) + sum(log(P(value | label)))}, in label order
     */
    public Map<Object, Double> logScores(Record query) {
        Map<Object, Double> scores = new LinkedHashMap<Object, Double>();
        for(int i = 0; i < labels.size(); i++) {
            scores.put(labels.get(i).getLabel(), logScore(i, query));
        }
        return scores;
    }

    private double logScore(int labelIndex, Record query) {
        LabelStats label = labels.get(labelIndex);
        double score = Math.log((double) label.getCount() / totalCount);
        for(String feature: featureFields) {
            Object value = query.get(feature);
            if(value == null) {
                continue;
            }
            score += Math.log(conditional(labelIndex, feature, value));
        }
        return score;
    }

    /**
     * @return prior probability of the label, 0 for a label never seen in training
     */
    public double prior(Object label) {
        int index = indexOf(label);
        return index < 0 ? 0d : (double) labels.get(index).getCount() / totalCount;
    }

    /**
     * @return smoothed P(value | label), NaN for a label never seen in training
     */
    public double conditional(Object label, String feature, Object value) {
        int index = indexOf(label);
        return index < 0 ? Double.NaN : conditional(index, feature, value);
    }

    private double conditional(int labelIndex, String feature, Object value) {
        Map<Object, Integer> counts = lookup.get(labelIndex).get(feature);
        Integer count = counts == null ? null : counts.get(canonicalValue(value));
        int distinct = distinctValueCounts.containsKey(feature) ? distinctValueCounts.get(feature) : 0;
        return ((count == null ? 0 : count) + 1d) / (labels.get(labelIndex).getCount() + distinct);
    }

    private int indexOf(Object label) {
        Object key = canonicalValue(label);
        for(int i = 0; i < labels.size(); i++) {
            if(labels.get(i).getLabel().equals(key)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Prediction function closing over this model.
     */
    public Function<Record, Object> asFunction() {
        return new Function<Record, Object>() {
            @Override
            public Object apply(Record input) {
                return predict(input);
            }
        };
    }

    /**
     * Canonical form of labels and feature values: numbers as in {@link FieldAccessor#canonical(Object)}, strings
     * and booleans as they are, dates as ISO-8601 UTC instants, anything else by its string form. These are the types
     * that survive a json round trip.
     */
    public static Object canonicalValue(Object value) {
        if(value instanceof Number || value instanceof Boolean || value instanceof String) {
            return FieldAccessor.canonical(value);
        }
        if(value instanceof Date) {
            return ((Date) value).toInstant().toString();
        }
        return value == null ? null : String.valueOf(value);
    }

    public String toJson() {
        try {
            return JSONUtils.writeValueAsString(this);
        } catch (IOException e) {
            throw new TallyException(TallyErrorCode.ERROR_FAIL_TO_WRITE_MODEL, e);
        }
    }

    public static NaiveBayesModel fromJson(String json) {
        try {
            return JSONUtils.readValue(json, NaiveBayesModel.class);
        } catch (IOException e) {
            throw new TallyException(TallyErrorCode.ERROR_FAIL_TO_LOAD_MODEL, e);
        }
    }

    public String getLabelField() {
        return labelField;
    }

    public List<String> getFeatureFields() {
        return featureFields;
    }

    public int getTotalCount() {
        return totalCount;
    }

    public List<LabelStats> getLabels() {
        return labels;
    }

    public Map<String, Integer> getDistinctValueCounts() {
        return distinctValueCounts;
    }

    @Override
    public String toString() {
        return "NaiveBayesModel [labelField=" + labelField + ", featureFields=" + featureFields + ", totalCount="
                + totalCount + ", labels=" + labels.size() + "]";
    }

    /**
     * Count of one label and of the feature values seen with it.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class LabelStats {

        private final Object label;

        private final int count;

        private final List<FeatureValueCount> valueCounts;

        @JsonCreator
        public LabelStats(@JsonProperty("label") Object label, @JsonProperty("count") int count,
                @JsonProperty("valueCounts") List<FeatureValueCount> valueCounts) {
            this.label = canonicalValue(label);
            this.count = count;
            this.valueCounts = Collections.unmodifiableList(new ArrayList<FeatureValueCount>(
                    valueCounts == null ? Collections.<FeatureValueCount> emptyList() : valueCounts));
        }

        public Object getLabel() {
            return label;
        }

        public int getCount() {
            return count;
        }

        public List<FeatureValueCount> getValueCounts() {
            return valueCounts;
        }

        @Override
        public String toString() {
            return "LabelStats [label=" + label + ", count=" + count + "]";
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FeatureValueCount {

        private final String feature;

        private final Object value;

        private final int count;

        @JsonCreator
        public FeatureValueCount(@JsonProperty("feature") String feature, @JsonProperty("value") Object value,
                @JsonProperty("count") int count) {
            this.feature = feature;
            this.value = canonicalValue(value);
            this.count = count;
        }

        public String getFeature() {
            return feature;
        }

        public Object getValue() {
            return value;
        }

        public int getCount() {
            return count;
        }
    }

}
