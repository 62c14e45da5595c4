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

import ml.tally.tally.util.Constants;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;

/**
 * Extracts a value from a {@link Record}: either a named field or an arbitrary accessor function. A selector returns
 * null when the value is absent.
 */
public final class FieldSelector {

    private static final FieldSelector SELF = new FieldSelector(Constants.VALUE, new Function<Record, Object>() {
        @Override
        public Object apply(Record input) {
            return input.getScalar();
        }
    });

    private final String name;

    private final Function<Record, ?> accessor;

    private FieldSelector(String name, Function<Record, ?> accessor) {
        this.name = name;
        this.accessor = accessor;
    }

    public static FieldSelector field(final String field) {
        Preconditions.checkNotNull(field, "Field name should not be null");
        return new FieldSelector(field, new Function<Record, Object>() {
            @Override
            public Object apply(Record input) {
                return input.get(field);
            }
        });
    }

    /**
     * Selector of the scalar wrapped by a record, see {@link Record#ofScalar(Object)}.
     */
    public static FieldSelector self() {
        return SELF;
    }

    public static FieldSelector of(String name, Function<Record, ?> accessor) {
        Preconditions.checkNotNull(accessor, "Accessor should not be null");
        return new FieldSelector(name, accessor);
    }

    /**
     * Select the named field, or the record scalar when field is null.
     */
    public static FieldSelector fieldOrSelf(String field) {
        return field == null ? SELF : field(field);
    }

    public Object select(Record record) {
        return accessor.apply(record);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "FieldSelector [" + name + "]";
    }

}
