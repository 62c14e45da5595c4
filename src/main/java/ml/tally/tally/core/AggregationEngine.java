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
package ml.tally.tally.core;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.tally.tally.container.AggregationResult;
import ml.tally.tally.container.Dataset;
import ml.tally.tally.container.FieldSelector;
import ml.tally.tally.container.GroupedDataset;
import ml.tally.tally.exception.TallyErrorCode;
import ml.tally.tally.exception.TallyException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named aggregates over explicit value fields, per group or over a whole dataset.
 * 
 * <p>
 * sum, min and max skip absent and non-numeric values; avg is sum / count of valid values, NaN without valid values;
 * count is the number of records of the group, {@link AggregationType#COUNT_VALID} the number of valid values.
 */
public final class AggregationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationEngine.class);

    private AggregationEngine() {
    }

    /**
     * Group the dataset and aggregate each value field with each operation.
     * 
     * @return group key to field name to aggregation to value, in group first appearance order
     * @throws TallyException
     *             if fields or operations are empty, or a numeric aggregation targets a non-numeric field; raised
     *             before grouping
     */
    public static AggregationResult aggregate(Dataset dataset, FieldSelector groupSelector, List<String> valueFields,
            List<AggregationType> operations) {
        GroupingEngine.checkSelector(groupSelector);
        validate(dataset, valueFields, operations);

        GroupedDataset grouped = GroupingEngine.groupBy(dataset, groupSelector);
        LinkedHashMap<Object, Map<String, Map<AggregationType, Double>>> result = new LinkedHashMap<Object, Map<String, Map<AggregationType, Double>>>();
        for(Map.Entry<Object, Dataset> group: grouped) {
            result.put(group.getKey(), aggregateFields(group.getValue(), valueFields, operations));
        }
        LOG.debug("Aggregate {} fields with {} over {} groups", valueFields.size(), operations, result.size());
        return new AggregationResult(result);
    }

    public static AggregationResult aggregate(Dataset dataset, String groupField, List<String> valueFields,
            AggregationType... operations) {
        return aggregate(dataset, FieldSelector.field(groupField), valueFields, Arrays.asList(operations));
    }

    /**
     * Aggregate the whole dataset as a single group.
     * 
     * @return field name to aggregation to value, unmodifiable
     */
    public static Map<String, Map<AggregationType, Double>> aggregate(Dataset dataset, List<String> valueFields,
            List<AggregationType> operations) {
        validate(dataset, valueFields, operations);
        return aggregateFields(dataset, valueFields, operations);
    }

    private static Map<String, Map<AggregationType, Double>> aggregateFields(Dataset group, List<String> valueFields,
            List<AggregationType> operations) {
        Map<String, Map<AggregationType, Double>> fields = new LinkedHashMap<String, Map<AggregationType, Double>>();
        for(String field: valueFields) {
            BasicStatsCalculator stats = new BasicStatsCalculator(FieldAccessor.numericValues(group,
                    FieldSelector.field(field)));
            Map<AggregationType, Double> values = new LinkedHashMap<AggregationType, Double>();
            for(AggregationType operation: operations) {
                values.put(operation, operation.compute(stats, group.size()));
            }
            fields.put(field, values);
        }
        return AggregationResult.copyFields(fields);
    }

    private static void validate(Dataset dataset, List<String> valueFields, List<AggregationType> operations) {
        if(valueFields == null || valueFields.isEmpty()) {
            throw new TallyException(TallyErrorCode.ERROR_INVALID_ARGUMENT, "Aggregate needs at least one value field");
        }
        if(operations == null || operations.isEmpty()) {
            throw new TallyException(TallyErrorCode.ERROR_INVALID_ARGUMENT, "Aggregate needs at least one operation");
        }
        for(AggregationType operation: operations) {
            if(operation == null) {
                throw new TallyException(TallyErrorCode.ERROR_UNSUPPORTED_AGGREGATION, "Aggregation should not be null");
            }
            if(!operation.isNumeric()) {
                continue;
            }
            for(String field: valueFields) {
                FieldAccessor.checkNumeric(dataset, FieldSelector.field(field), operation.getName());
            }
        }
    }

}
