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

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Month;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang.StringUtils;

/**
 * Continues a label column past the end of a series, used by {@link TimeSeriesEngine#forecast}. The step is read from
 * the last two labels:
 * <ul>
 * <li>numbers advance by the last difference (1 when there is a single label)</li>
 * <li>dates advance by whole months when both dates fall on the same day of month or both on a month end, otherwise
 * by the elapsed time (1 day when there is a single label)</li>
 * <li>English month and weekday names, full or abbreviated, cycle and keep their letter case</li>
 * <li>ISO dates written as strings advance like dates</li>
 * <li>strings ending with an integer, like {@code Q3} or {@code week-07}, increment it keeping zero padding</li>
 * </ul>
 * Anything else is repeated.
 */
public final class LabelSequencer {

    private static final Pattern TRAILING_NUMBER = Pattern.compile("^(.*?)(\\d{1,18})$");

    private static final Duration ONE_DAY = Duration.ofDays(1);

    private LabelSequencer() {
    }

    /**
     * @param previous
     *            the label before last, null when the series has a single record
     * @param last
     *            the last label
     * @param steps
     *            how many periods after the last label, 1 for the first forecast
     * @return the label of that period
     */
    public static Object next(Object previous, Object last, int steps) {
        if(last instanceof Number) {
            return nextNumber(previous, (Number) last, steps);
        }
        if(last instanceof LocalDate) {
            return nextDate(previous instanceof LocalDate ? (LocalDate) previous : null, (LocalDate) last, steps);
        }
        if(last instanceof LocalDateTime) {
            LocalDateTime lastTime = (LocalDateTime) last;
            Duration step = previous instanceof LocalDateTime ? Duration.between((LocalDateTime) previous, lastTime)
                    : ONE_DAY;
            return lastTime.plus(nonZero(step).multipliedBy(steps));
        }
        if(last instanceof Date) {
            long lastMillis = ((Date) last).getTime();
            long step = previous instanceof Date ? lastMillis - ((Date) previous).getTime() : 0L;
            return new Date(lastMillis + (step == 0L ? ONE_DAY.toMillis() : step) * steps);
        }
        if(last instanceof Instant) {
            Duration step = previous instanceof Instant ? Duration.between((Instant) previous, (Instant) last)
                    : ONE_DAY;
            return ((Instant) last).plus(nonZero(step).multipliedBy(steps));
        }
        if(last instanceof String) {
            return nextString(previous instanceof String ? (String) previous : null, (String) last, steps);
        }
        return last;
    }

    private static Object nextNumber(Object previous, Number last, int steps) {
        Object lastValue = FieldAccessor.canonical(last);
        Object previousValue = previous instanceof Number ? FieldAccessor.canonical(previous) : null;
        if(lastValue instanceof Long && (previousValue == null || previousValue instanceof Long)) {
            long step = previousValue == null ? 1L : (Long) lastValue - (Long) previousValue;
            return (Long) lastValue + step * steps;
        }
        double step = previousValue == null ? 1d : last.doubleValue() - ((Number) previousValue).doubleValue();
        return last.doubleValue() + step * steps;
    }

    private static LocalDate nextDate(LocalDate previous, LocalDate last, int steps) {
        if(previous == null) {
            return last.plusDays(steps);
        }
        long months = ChronoUnit.MONTHS.between(previous.withDayOfMonth(1), last.withDayOfMonth(1));
        boolean sameDay = previous.getDayOfMonth() == last.getDayOfMonth();
        boolean monthEnds = isMonthEnd(previous) && isMonthEnd(last);
        if(months != 0 && (sameDay || monthEnds)) {
            LocalDate next = last.plusMonths(months * steps);
            return monthEnds ? next.withDayOfMonth(next.lengthOfMonth()) : next;
        }
        long days = ChronoUnit.DAYS.between(previous, last);
        return last.plusDays((days == 0L ? 1L : days) * steps);
    }

    private static boolean isMonthEnd(LocalDate date) {
        return date.getDayOfMonth() == date.lengthOfMonth();
    }

    private static String nextString(String previous, String last, int steps) {
        LocalDate lastDate = parseIsoDate(last);
        if(lastDate != null) {
            return nextDate(previous == null ? null : parseIsoDate(previous), lastDate, steps).toString();
        }

        String cycled = nextInCycle(previous, last, steps, monthNames(TextStyle.FULL), monthNames(TextStyle.SHORT));
        if(cycled == null) {
            cycled = nextInCycle(previous, last, steps, dayNames(TextStyle.FULL), dayNames(TextStyle.SHORT));
        }
        if(cycled != null) {
            return cycled;
        }

        Matcher lastMatcher = TRAILING_NUMBER.matcher(last);
        if(lastMatcher.matches()) {
            String prefix = lastMatcher.group(1);
            String digits = lastMatcher.group(2);
            long step = 1L;
            Matcher previousMatcher = previous == null ? null : TRAILING_NUMBER.matcher(previous);
            if(previousMatcher != null && previousMatcher.matches() && previousMatcher.group(1).equals(prefix)) {
                long diff = Long.parseLong(digits) - Long.parseLong(previousMatcher.group(2));
                step = diff > 0L ? diff : 1L;
            }
            String number = String.valueOf(Long.parseLong(digits) + step * steps);
            return prefix + StringUtils.leftPad(number, digits.startsWith("0") ? digits.length() : 0, '0');
        }
        return last;
    }

    private static String nextInCycle(String previous, String last, int steps, String[] full, String[] abbreviated) {
        String[] names = full;
        int lastIndex = indexOf(full, last);
        if(lastIndex < 0) {
            names = abbreviated;
            lastIndex = indexOf(abbreviated, last);
        }
        if(lastIndex < 0) {
            return null;
        }
        int step = 1;
        int previousIndex = previous == null ? -1 : indexOf(names, previous);
        if(previousIndex >= 0) {
            int diff = Math.floorMod(lastIndex - previousIndex, names.length);
            step = diff == 0 ? 1 : diff;
        }
        String name = names[Math.floorMod(lastIndex + step * steps, names.length)];
        return sameCase(last, name);
    }

    private static int indexOf(String[] names, String value) {
        for(int i = 0; i < names.length; i++) {
            if(names[i].equalsIgnoreCase(value.trim())) {
                return i;
            }
        }
        return -1;
    }

    private static String sameCase(String sample, String name) {
        if(StringUtils.isAllUpperCase(sample)) {
            return name.toUpperCase(Locale.ENGLISH);
        }
        if(StringUtils.isAllLowerCase(sample)) {
            return name.toLowerCase(Locale.ENGLISH);
        }
        return name;
    }

    private static String[] monthNames(TextStyle style) {
        String[] names = new String[12];
        for(Month month: Month.values()) {
            names[month.ordinal()] = month.getDisplayName(style, Locale.ENGLISH);
        }
        return names;
    }

    private static String[] dayNames(TextStyle style) {
        String[] names = new String[7];
        for(DayOfWeek day: DayOfWeek.values()) {
            names[day.ordinal()] = day.getDisplayName(style, Locale.ENGLISH);
        }
        return names;
    }

    private static LocalDate parseIsoDate(String text) {
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Duration nonZero(Duration step) {
        return step.isZero() ? ONE_DAY : step;
    }

}
