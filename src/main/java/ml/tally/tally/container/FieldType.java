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

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Date;

/**
 * Tag of a record value, determined at read time since records carry no schema.
 */
public enum FieldType {
    NUMERIC, STRING, BOOLEAN, DATE, ABSENT, OTHER;

    public static FieldType of(Object value) {
        if(value == null) {
            return ABSENT;
        }
        if(value instanceof Number) {
            return NUMERIC;
        }
        if(value instanceof String || value instanceof Character) {
            return STRING;
        }
        if(value instanceof Boolean) {
            return BOOLEAN;
        }
        if(value instanceof Date || value instanceof LocalDate || value instanceof LocalDateTime
                || value instanceof Instant) {
            return DATE;
        }
        return OTHER;
    }

}
