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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Date;

import ml.tally.tally.container.Dataset;
import ml.tally.tally.container.FieldSelector;
import ml.tally.tally.container.FieldType;
import ml.tally.tally.container.Record;
import ml.tally.tally.exception.TallyErrorCode;
import ml.tally.tally.exception.TallyException;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves selectors against records and reads values by their runtime tag.
 * 
 * <p>
 * Numbers are compared by value: any number whose value is integral and exactly representable becomes a
 * {@link Long}, other numbers a {@link Double}. So {@code 1}, {@code 1L} and {@code 1.0d} are one group key.
 */
public final class FieldAccessor {

    private static final Logger LOG = LoggerFactory.getLogger(FieldAccessor.class);

    /**
     * 2^53, beyond it not every long is a double
     */
    private static final double MAX_EXACT_INTEGRAL = 9007199254740992d;

    private FieldAccessor() {
    }

    /**
     * Canonical form used for equality based bucketing.
     */
    public static Object canonical(Object value) {
        if(value instanceof Number) {
            return canonicalNumber((Number) value);
        }
        if(value instanceof Character) {
            return value.toString();
        }
        if(value instanceof Date) {
            return new Date(((Date) value).getTime());
        }
        return value;
    }

    private static Object canonicalNumber(Number number) {
        if(number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return number.longValue();
        }
        if(number instanceof BigInteger && ((BigInteger) number).bitLength() < 64) {
            return number.longValue();
        }
        double d = number.doubleValue();
        if(number instanceof BigDecimal) {
            try {
                return ((BigDecimal) number).longValueExact();
            } catch (ArithmeticException e) {
                return d;
            }
        }
        if(!Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d) && Math.abs(d) <= MAX_EXACT_INTEGRAL) {
            return (long) d;
        }
        return d;
    }

    /**
     * Canonical group key of the value.
     * 
     * @throws TallyException
     *             if the value is neither a number, string, boolean, date nor absent
     */
    public static Object groupKey(Object value) {
        FieldType type = FieldType.of(value);
        if(type == FieldType.OTHER) {
            throw new TallyException(TallyErrorCode.ERROR_UNSUPPORTED_GROUP_KEY, "Unsupported group key "
                    + value.getClass().getName() + ": " + value);
        }
        return canonical(value);
    }

    public static Object groupKey(Record record, FieldSelector selector) {
        return groupKey(selector.select(record));
    }

    /**
     * @return the finite double value, or null if the value is absent, not a number, NaN or infinite
     */
    public static Double numeric(Object value) {
        if(!(value instanceof Number)) {
            return null;
        }
        double d = ((Number) value).doubleValue();
        if(Double.isNaN(d) || Double.isInfinite(d)) {
            return null;
        }
        return d;
    }

    public static Double numeric(Record record, FieldSelector selector) {
        return numeric(selector.select(record));
    }

    /**
     * Valid numeric values of the selector in record order. Other values are skipped.
     */
    public static double[] numericValues(Dataset dataset, FieldSelector selector) {
        double[] values = new double[dataset.size()];
        int size = 0;
        for(Record record: dataset) {
            Double value = numeric(selector.select(record));
            if(value != null) {
                values[size++] = value;
            }
        }
        if(size < values.length) {
            LOG.debug("Skip {} absent or non-numeric values of {}", values.length - size, selector.getName());
            double[] valid = new double[size];
            System.arraycopy(values, 0, valid, 0, size);
            return valid;
        }
        return values;
    }

    /**
     * Check the selector can feed a numeric operation: a field is non-numeric when it has at least one present value
     * and none of its values is a number. Fields with only absent values pass, the operation then sees no data.
     * 
     * @throws TallyException
     *             with {@link TallyErrorCode#ERROR_NON_NUMERIC_FIELD}
     */
    public static void checkNumeric(Dataset dataset, FieldSelector selector, String operation) {
        Object sample = null;
        for(Record record: dataset) {
            Object value = selector.select(record);
            if(value instanceof Number) {
                return;
            }
            if(value != null && sample == null) {
                sample = value;
            }
        }
        if(sample != null) {
            throw new TallyException(TallyErrorCode.ERROR_NON_NUMERIC_FIELD, "Operation " + operation
                    + " needs a numeric field but " + selector.getName() + " holds values like '" + sample + "'");
        }
    }

    /**
     * Calendar date of a date-like value: dates, instants, local date (times) and ISO-8601 strings.
     * 
     * @return the date, or null if the value has no date reading
     */
    public static LocalDate toLocalDate(Object value, ZoneId zone) {
        if(value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if(value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        }
        if(value instanceof Date) {
            return ((Date) value).toInstant().atZone(zone).toLocalDate();
        }
        if(value instanceof Instant) {
            return ((Instant) value).atZone(zone).toLocalDate();
        }
        if(value instanceof String && StringUtils.isNotBlank((String) value)) {
            return parseDate(((String) value).trim(), zone);
        }
        return null;
    }

    private static LocalDate parseDate(String text, ZoneId zone) {
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            LOG.trace("{} is not an iso date", text);
        }
        try {
            return LocalDateTime.parse(text).toLocalDate();
        } catch (DateTimeParseException e) {
            LOG.trace("{} is not an iso date time", text);
        }
        try {
            return Instant.parse(text).atZone(zone).toLocalDate();
        } catch (DateTimeParseException e) {
            LOG.debug("Skip unparseable date {}", text);
            return null;
        }
    }

}
