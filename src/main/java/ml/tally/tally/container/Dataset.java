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
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Ordered, immutable sequence of {@link Record}s. Every operation returns a new dataset and keeps the source order
 * unless a sort is asked for.
 */
public final class Dataset implements Iterable<Record> {

    private static final Dataset EMPTY = new Dataset(ImmutableList.<Record> of());

    private final ImmutableList<Record> records;

    private Dataset(ImmutableList<Record> records) {
        this.records = records;
    }

    public static Dataset empty() {
        return EMPTY;
    }

    public static Dataset of(Record... records) {
        return new Dataset(ImmutableList.copyOf(records));
    }

    public static Dataset of(Iterable<Record> records) {
        return new Dataset(ImmutableList.copyOf(records));
    }

    /**
     * Dataset of scalar records, null elements are kept as records with an absent scalar.
     */
    public static Dataset ofScalars(Object... values) {
        ImmutableList.Builder<Record> builder = ImmutableList.builder();
        for(Object value: values) {
            builder.add(value == null ? Record.empty() : Record.ofScalar(value));
        }
        return new Dataset(builder.build());
    }

    public static Dataset ofValues(double... values) {
        ImmutableList.Builder<Record> builder = ImmutableList.builder();
        for(double value: values) {
            builder.add(Record.ofScalar(value));
        }
        return new Dataset(builder.build());
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public Record get(int index) {
        return records.get(index);
    }

    public List<Record> records() {
        return records;
    }

    @Override
    public Iterator<Record> iterator() {
        return records.iterator();
    }

    public Dataset filter(Predicate<Record> predicate) {
        ImmutableList.Builder<Record> builder = ImmutableList.builder();
        for(Record record: records) {
            if(predicate.apply(record)) {
                builder.add(record);
            }
        }
        return new Dataset(builder.build());
    }

    public Dataset map(Function<Record, Record> function) {
        ImmutableList.Builder<Record> builder = ImmutableList.builder();
        for(Record record: records) {
            builder.add(Preconditions.checkNotNull(function.apply(record), "Mapped record should not be null"));
        }
        return new Dataset(builder.build());
    }

    /**
     * Project the selector over all records; absent values are kept as null so positions line up with records.
     */
    public List<Object> pluck(FieldSelector selector) {
        List<Object> values = new ArrayList<Object>(records.size());
        for(Record record: records) {
            values.add(selector.select(record));
        }
        return Collections.unmodifiableList(values);
    }

    public List<Object> pluck(String field) {
        return pluck(FieldSelector.field(field));
    }

    /**
     * Stable sort.
     */
    public Dataset sort(Comparator<Record> comparator) {
        List<Record> sorted = Lists.newArrayList(records);
        Collections.sort(sorted, comparator);
        return new Dataset(ImmutableList.copyOf(sorted));
    }

    public Dataset concat(Dataset other) {
        return new Dataset(ImmutableList.<Record> builder().addAll(records).addAll(other.records).build());
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        return (o instanceof Dataset) && records.equals(((Dataset) o).records);
    }

    @Override
    public int hashCode() {
        return records.hashCode();
    }

    @Override
    public String toString() {
        return "Dataset " + records;
    }

}
