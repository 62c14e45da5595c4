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
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

import ml.tally.tally.core.FieldAccessor;

/**
 * Ordered mapping of group key to sub-dataset. Keys keep the order of their first appearance in the source scan and
 * each sub-dataset keeps the relative order of its members.
 */
public final class GroupedDataset implements Iterable<Map.Entry<Object, Dataset>> {

    private final Map<Object, Dataset> groups;

    public GroupedDataset(LinkedHashMap<Object, Dataset> groups) {
        this.groups = Collections.unmodifiableMap(new LinkedHashMap<Object, Dataset>(groups));
    }

    public List<Object> keys() {
        // ImmutableList rejects the null key of absent values
        return Collections.unmodifiableList(new ArrayList<Object>(groups.keySet()));
    }

    /**
     * @return the group of the key, or null if no record produced it
     */
    public Dataset get(Object key) {
        return groups.get(FieldAccessor.canonical(key));
    }

    public boolean containsKey(Object key) {
        return groups.containsKey(FieldAccessor.canonical(key));
    }

    public int size() {
        return groups.size();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    public Map<Object, Dataset> asMap() {
        return groups;
    }

    /**
     * Concatenate all groups in key order.
     */
    public Dataset flatten() {
        ImmutableList.Builder<Record> builder = ImmutableList.builder();
        for(Dataset group: groups.values()) {
            builder.addAll(group.records());
        }
        return Dataset.of(builder.build());
    }

    @Override
    public Iterator<Map.Entry<Object, Dataset>> iterator() {
        return groups.entrySet().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof GroupedDataset)) {
            return false;
        }
        // key order is part of the value
        return keys().equals(((GroupedDataset) o).keys()) && groups.equals(((GroupedDataset) o).groups);
    }

    @Override
    public int hashCode() {
        return groups.hashCode();
    }

    @Override
    public String toString() {
        return "GroupedDataset " + groups;
    }

}
