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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ml.tally.tally.core.AggregationType;
import ml.tally.tally.core.FieldAccessor;
import ml.tally.tally.exception.TallyErrorCode;
import ml.tally.tally.exception.TallyException;
import ml.tally.tally.util.Constants;

/**
 * Two-dimensional aggregate: row key to column key to cell value. Every observed row has an entry for every observed
 * column. A cell with no contributing record holds 0 for sum and count, and null for avg: no data is not a zero
 * average.
 */
public final class PivotTable {

    private final AggregationType aggregation;

    private final List<Object> rowKeys;

    private final List<Object> columnKeys;

    private final Map<Object, Map<Object, Double>> cells;

    public PivotTable(AggregationType aggregation, List<Object> rowKeys, List<Object> columnKeys,
            LinkedHashMap<Object, Map<Object, Double>> cells) {
        this.aggregation = aggregation;
        this.rowKeys = Collections.unmodifiableList(new ArrayList<Object>(rowKeys));
        this.columnKeys = Collections.unmodifiableList(new ArrayList<Object>(columnKeys));
        LinkedHashMap<Object, Map<Object, Double>> copy = new LinkedHashMap<Object, Map<Object, Double>>();
        for(Map.Entry<Object, Map<Object, Double>> row: cells.entrySet()) {
            copy.put(row.getKey(), Collections.unmodifiableMap(new LinkedHashMap<Object, Double>(row.getValue())));
        }
        this.cells = Collections.unmodifiableMap(copy);
    }

    public AggregationType getAggregation() {
        return aggregation;
    }

    public List<Object> getRowKeys() {
        return rowKeys;
    }

    public List<Object> getColumnKeys() {
        return columnKeys;
    }

    /**
     * @return the cell value, null when the cell has no data under avg or the keys were never observed
     */
    public Double get(Object rowKey, Object columnKey) {
        Map<Object, Double> row = cells.get(FieldAccessor.canonical(rowKey));
        return row == null ? null : row.get(FieldAccessor.canonical(columnKey));
    }

    public boolean hasValue(Object rowKey, Object columnKey) {
        return get(rowKey, columnKey) != null;
    }

    public Map<Object, Double> getRow(Object rowKey) {
        return cells.get(FieldAccessor.canonical(rowKey));
    }

    public Map<Object, Map<Object, Double>> asMap() {
        return cells;
    }

    /**
     * One record per row: the row key under {@code row} and one field per column key, named by its string form.
     * No-data cells are left absent.
     * 
     * @throws TallyException
     *             if a column name is {@code row} or two column keys share a string form
     */
    public Dataset toDataset() {
        Set<String> names = new HashSet<String>();
        names.add(Constants.ROW);
        for(Object columnKey: columnKeys) {
            String name = String.valueOf(columnKey);
            if(!names.add(name)) {
                throw new TallyException(TallyErrorCode.ERROR_INVALID_ARGUMENT, "Column key " + columnKey
                        + " collides with another field named " + name + " in the flattened pivot table");
            }
        }

        List<Record> records = new ArrayList<Record>(rowKeys.size());
        for(Object rowKey: rowKeys) {
            Record.Builder builder = Record.builder().put(Constants.ROW, rowKey);
            for(Map.Entry<Object, Double> cell: cells.get(rowKey).entrySet()) {
                builder.put(String.valueOf(cell.getKey()), cell.getValue());
            }
            records.add(builder.build());
        }
        return Dataset.of(records);
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof PivotTable)) {
            return false;
        }
        PivotTable other = (PivotTable) o;
        return aggregation == other.aggregation && rowKeys.equals(other.rowKeys)
                && columnKeys.equals(other.columnKeys) && cells.equals(other.cells);
    }

    @Override
    public int hashCode() {
        return cells.hashCode();
    }

    @Override
    public String toString() {
        return "PivotTable [aggregation=" + aggregation + ", cells=" + cells + "]";
    }

}
