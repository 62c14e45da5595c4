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

import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * Immutable mapping from field name to value. A value is a number, string, boolean or date. Absent fields are not in
 * the mapping: putting null removes the field.
 * 
 * <p>
 * A record may instead wrap a single scalar, which is how datasets of plain numbers or labels are represented. The
 * scalar is reached through {@link FieldSelector#self()}.
 */
public final class Record {

    private static final Record EMPTY = new Record(ImmutableMap.<String, Object> of(), null);

    private final ImmutableMap<String, Object> fields;

    private final Object scalar;

    private Record(ImmutableMap<String, Object> fields, Object scalar) {
        this.fields = fields;
        this.scalar = scalar;
    }

    public static Record empty() {
        return EMPTY;
    }

    public static Record of(Map<String, ?> values) {
        Builder builder = builder();
        for(Map.Entry<String, ?> entry: values.entrySet()) {
            builder.put(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    /**
     * Build record from alternating field names and values, like {@code Record.of("city", "Rome", "sales", 10)}.
     */
    public static Record of(Object... keyValues) {
        Preconditions.checkArgument(keyValues.length % 2 == 0, "Field names and values should come in pairs");
        Builder builder = builder();
        for(int i = 0; i < keyValues.length; i += 2) {
            builder.put((String) keyValues[i], keyValues[i + 1]);
        }
        return builder.build();
    }

    public static Record ofScalar(Object value) {
        return new Record(ImmutableMap.<String, Object> of(), copyIfMutable(value));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Object get(String field) {
        return copyIfMutable(fields.get(field));
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public FieldType typeOf(String field) {
        return FieldType.of(fields.get(field));
    }

    public boolean isScalar() {
        return scalar != null;
    }

    public Object getScalar() {
        return copyIfMutable(scalar);
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    /**
     * @return the fields, dates copied
     */
    public Map<String, Object> asMap() {
        return Maps.transformValues(fields, COPY_IF_MUTABLE);
    }

    /**
     * @return a copy of this record with the field set, or removed when value is null
     */
    public Record with(String field, Object value) {
        Builder builder = builder();
        for(Map.Entry<String, Object> entry: fields.entrySet()) {
            builder.put(entry.getKey(), entry.getValue());
        }
        return builder.put(field, value).build();
    }

    private static final Function<Object, Object> COPY_IF_MUTABLE = new Function<Object, Object>() {
        @Override
        public Object apply(Object input) {
            return copyIfMutable(input);
        }
    };

    private static Object copyIfMutable(Object value) {
        if(value instanceof Date) {
            return new Date(((Date) value).getTime());
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof Record)) {
            return false;
        }
        Record other = (Record) o;
        return fields.equals(other.fields) && Objects.equals(scalar, other.scalar);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields, scalar);
    }

    @Override
    public String toString() {
        return isScalar() ? String.valueOf(scalar) : fields.toString();
    }

    public static final class Builder {

        private final Map<String, Object> values = new LinkedHashMap<String, Object>();

        private Builder() {
        }

        public Builder put(String field, Object value) {
            Preconditions.checkNotNull(field, "Field name should not be null");
            if(value == null) {
                values.remove(field);
            } else {
                values.put(field, copyIfMutable(value));
            }
            return this;
        }

        public Record build() {
            return new Record(ImmutableMap.copyOf(values), null);
        }
    }

}
