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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ml.tally.tally.container.Dataset;
import ml.tally.tally.container.FieldSelector;
import ml.tally.tally.container.GroupedDataset;
import ml.tally.tally.container.PivotTable;
import ml.tally.tally.container.Record;
import ml.tally.tally.exception.TallyErrorCode;
import ml.tally.tally.exception.TallyException;
import ml.tally.tally.util.Constants;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Partitions datasets by group key. Grouping is one scan: key order is the order of first appearance and members
 * keep their source order, so {@link GroupedDataset#flatten()} is a stable partition of the source.
 */
public final class GroupingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(GroupingEngine.class);

    private GroupingEngine() {
    }

    public static GroupedDataset groupBy(Dataset dataset, String field) {
        return groupBy(dataset, FieldSelector.field(field));
    }

    public static GroupedDataset groupBy(Dataset dataset, FieldSelector selector) {
        checkSelector(selector);
        LinkedHashMap<Object, ImmutableList.Builder<Record>> builders = new LinkedHashMap<Object, ImmutableList.Builder<Record>>();
        for(Record record: dataset) {
            Object key = FieldAccessor.groupKey(record, selector);
            ImmutableList.Builder<Record> builder = builders.get(key);
            if(builder == null) {
                builder = ImmutableList.builder();
                builders.put(key, builder);
            }
            builder.add(record);
        }

        LinkedHashMap<Object, Dataset> groups = new LinkedHashMap<Object, Dataset>(builders.size());
        for(Map.Entry<Object, ImmutableList.Builder<Record>> entry: builders.entrySet()) {
            groups.put(entry.getKey(), Dataset.of(entry.getValue().build()));
        }
        LOG.debug("Group {} records by {} into {} groups", dataset.size(), selector.getName(), groups.size());
        return new GroupedDataset(groups);
    }

    /**
     * Group by several fields at once; the key is the string forms of the values joined by {@code ::}, absent values
     * as {@code null}.
     */
    public static GroupedDataset groupByMultiple(Dataset dataset, final String... fields) {
        if(fields == null || fields.length == 0) {
            throw new TallyException(TallyErrorCode.ERROR_INVALID_ARGUMENT, "Group by multiple needs at least one field");
        }
        final Joiner joiner = Joiner.on(Constants.GROUP_KEY_SEPARATOR).useForNull("null");
        return groupBy(dataset, FieldSelector.of(joiner.join(fields), record -> {
            List<Object> parts = new ArrayList<Object>(fields.length);
            for(String field: fields) {
                parts.add(FieldAccessor.groupKey(record.get(field)));
            }
            return joiner.join(parts);
        }));
    }

    /**
     * Filter groups on the sum of a field: a group is kept when {@code sum(field) <operator> value} holds. Absent and
     * non-numeric values add nothing to the sum, so a group without valid values sums to 0.
     * 
     * @throws TallyException
     *             for an unknown operator or a non-numeric field, before any group is looked at
     */
    public static GroupedDataset having(GroupedDataset grouped, String field, String operator, double value) {
        ComparisonOperator comparison = ComparisonOperator.fromSymbol(operator);
        FieldSelector selector = FieldSelector.field(field);
        checkNumeric(grouped, selector, "having");

        LinkedHashMap<Object, Dataset> retained = new LinkedHashMap<Object, Dataset>();
        for(Map.Entry<Object, Dataset> group: grouped) {
            double sum = new BasicStatsCalculator(FieldAccessor.numericValues(group.getValue(), selector)).getSum();
            if(comparison.test(sum, value)) {
                retained.put(group.getKey(), group.getValue());
            }
        }
        LOG.debug("Having sum({}) {} {} keeps {} of {} groups", field, operator, value, retained.size(),
                grouped.size());
        return new GroupedDataset(retained);
    }

    /**
     * Group the dataset first, then filter the groups, see {@link #having(GroupedDataset, String, String, double)}.
     */
    public static GroupedDataset having(Dataset dataset, FieldSelector groupSelector, String field, String operator,
            double value) {
        ComparisonOperator.fromSymbol(operator);
        FieldAccessor.checkNumeric(dataset, FieldSelector.field(field), "having");
        return having(groupBy(dataset, groupSelector), field, operator, value);
    }

    /**
     * Cross tabulate the dataset: rows by rowSelector, columns by columnSelector, each cell aggregating valueField with
     * sum, avg or count. Row and column keys each follow first appearance; a missing combination is 0 for sum and count
     * and null (no data) for avg. An avg cell with records but no valid value is NaN.
     */
    public static PivotTable pivotTable(Dataset dataset, FieldSelector rowSelector, FieldSelector columnSelector,
            String valueField, AggregationType aggregation) {
        checkSelector(rowSelector);
        checkSelector(columnSelector);
        if(aggregation != AggregationType.SUM && aggregation != AggregationType.AVG
                && aggregation != AggregationType.COUNT) {
            throw new TallyException(TallyErrorCode.ERROR_UNSUPPORTED_AGGREGATION, "Pivot table supports sum, avg "
                    + "and count but not " + aggregation);
        }
        FieldSelector valueSelector = valueField == null ? null : FieldSelector.field(valueField);
        if(aggregation != AggregationType.COUNT) {
            if(valueSelector == null) {
                throw new TallyException(TallyErrorCode.ERROR_INVALID_ARGUMENT, "Pivot table " + aggregation
                        + " needs a value field");
            }
            FieldAccessor.checkNumeric(dataset, valueSelector, "pivotTable " + aggregation);
        }

        Set<Object> rowKeys = new LinkedHashSet<Object>();
        Set<Object> columnKeys = new LinkedHashSet<Object>();
        Map<Object, Map<Object, Cell>> cells = new LinkedHashMap<Object, Map<Object, Cell>>();
        for(Record record: dataset) {
            Object rowKey = FieldAccessor.groupKey(record, rowSelector);
            Object columnKey = FieldAccessor.groupKey(record, columnSelector);
            rowKeys.add(rowKey);
            columnKeys.add(columnKey);

            Map<Object, Cell> row = cells.get(rowKey);
            if(row == null) {
                row = new LinkedHashMap<Object, Cell>();
                cells.put(rowKey, row);
            }
            Cell cell = row.get(columnKey);
            if(cell == null) {
                cell = new Cell();
                row.put(columnKey, cell);
            }
            cell.add(valueSelector == null ? null : FieldAccessor.numeric(record, valueSelector));
        }

        LinkedHashMap<Object, Map<Object, Double>> table = new LinkedHashMap<Object, Map<Object, Double>>();
        for(Object rowKey: rowKeys) {
            Map<Object, Cell> row = cells.get(rowKey);
            Map<Object, Double> values = new LinkedHashMap<Object, Double>();
            for(Object columnKey: columnKeys) {
                values.put(columnKey, cellValue(row.get(columnKey), aggregation));
            }
            table.put(rowKey, values);
        }
        return new PivotTable(aggregation, new ArrayList<Object>(rowKeys), new ArrayList<Object>(columnKeys), table);
    }

    public static PivotTable pivotTable(Dataset dataset, String rowField, String columnField, String valueField,
            AggregationType aggregation) {
        return pivotTable(dataset, FieldSelector.field(rowField), FieldSelector.field(columnField), valueField,
                aggregation);
    }

    private static Double cellValue(Cell cell, AggregationType aggregation) {
        if(cell == null) {
            return aggregation == AggregationType.AVG ? null : 0d;
        }
        switch(aggregation) {
            case SUM:
                return cell.sum;
            case AVG:
                return cell.validCount == 0 ? Double.NaN : cell.sum / cell.validCount;
            default:
                return (double) cell.count;
        }
    }

    /**
     * Frequency of each distinct value in first appearance order, absent values under the null key.
     */
    public static Map<Object, Long> frequency(Dataset dataset, FieldSelector selector) {
        checkSelector(selector);
        Map<Object, Long> frequency = new LinkedHashMap<Object, Long>();
        for(Record record: dataset) {
            Object key = FieldAccessor.canonical(selector.select(record));
            Long count = frequency.get(key);
            frequency.put(key, count == null ? 1L : count + 1L);
        }
        return frequency;
    }

    private static void checkNumeric(GroupedDataset grouped, FieldSelector selector, String operation) {
        FieldAccessor.checkNumeric(grouped.flatten(), selector, operation);
    }

    static void checkSelector(FieldSelector selector) {
        if(selector == null) {
            throw new TallyException(TallyErrorCode.ERROR_INVALID_ARGUMENT, "Selector should not be null");
        }
    }

    private static class Cell {
        private int count;
        private int validCount;
        private double sum;

        private void add(Double value) {
            count++;
            if(value != null) {
                validCount++;
                sum += value;
            }
        }
    }

}
