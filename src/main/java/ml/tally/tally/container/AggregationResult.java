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
package ml.tally.tally.container;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.tally.tally.core.AggregationType;
import ml.tally.tally.core.FieldAccessor;
import ml.tally.tally.util.Constants;

/**
 * Result of a grouped aggregation: group key to field name to aggregation to value. Key, field and aggregation order
 * follow the order they were computed in.
 */
public final class AggregationResult {

    private final Map<Object, Map<String, Map<AggregationType, Double>>> values;

    public AggregationResult(LinkedHashMap<Object, Map<String, Map<AggregationType, Double>>> values) {
        LinkedHashMap<Object, Map<String, Map<AggregationType, Double>>> copy = new LinkedHashMap<Object, Map<String, Map<AggregationType, Double>>>();
        for(Map.Entry<Object, Map<String, Map<AggregationType, Double>>> group: values.entrySet()) {
            copy.put(group.getKey(), copyFields(group.getValue()));
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    /**
     * Unmodifiable copy of field name to aggregation values, order kept.
     */
    public static Map<String, Map<AggregationType, Double>> copyFields(Map<String, Map<AggregationType, Double>> fields) {
        LinkedHashMap<String, Map<AggregationType, Double>> copy = new LinkedHashMap<String, Map<AggregationType, Double>>();
        for(Map.Entry<String, Map<AggregationType, Double>> field: fields.entrySet()) {
            copy.put(field.getKey(),
                    Collections.unmodifiableMap(new LinkedHashMap<AggregationType, Double>(field.getValue())));
        }
        return Collections.unmodifiableMap(copy);
    }

    public List<Object> keys() {
        return Collections.unmodifiableList(new ArrayList<Object>(values.keySet()));
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * @return field name to aggregation values of the group, null for an unknown group
     */
    public Map<String, Map<AggregationType, Double>> get(Object key) {
        return values.get(FieldAccessor.canonical(key));
    }

    /**
     * @return the aggregated value, null if the group, field or aggregation was not computed
     */
    public Double get(Object key, String field, AggregationType type) {
        Map<String, Map<AggregationType, Double>> fields = get(key);
        if(fields == null || !fields.containsKey(field)) {
            return null;
        }
        return fields.get(field).get(type);
    }

    public Map<Object, Map<String, Map<AggregationType, Double>>> asMap() {
        return values;
    }

    /**
     * One record per group and field, aggregation names as field names.
     */
    public Dataset toDataset() {
        List<Record> records = new ArrayList<Record>();
        for(Map.Entry<Object, Map<String, Map<AggregationType, Double>>> group: values.entrySet()) {
            for(Map.Entry<String, Map<AggregationType, Double>> field: group.getValue().entrySet()) {
                Record.Builder builder = Record.builder().put(Constants.KEY, group.getKey())
                        .put(Constants.FIELD, field.getKey());
                for(Map.Entry<AggregationType, Double> aggregate: field.getValue().entrySet()) {
                    builder.put(aggregate.getKey().getName(), aggregate.getValue());
                }
                records.add(builder.build());
            }
        }
        return Dataset.of(records);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || ((o instanceof AggregationResult) && values.equals(((AggregationResult) o).values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "AggregationResult " + values;
    }

}
