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
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;

import ml.tally.tally.exception.TallyErrorCode;
import ml.tally.tally.exception.TallyException;

import org.apache.commons.lang.StringUtils;

/**
 * Calendar periods of the time series operations.
 */
public enum TimeInterval {
    DAY("day"), WEEK("week"), MONTH("month"), YEAR("year");

    private final String name;

    private TimeInterval(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static TimeInterval of(String name) {
        for(TimeInterval interval: values()) {
            if(interval.name.equalsIgnoreCase(StringUtils.trimToEmpty(name))) {
                return interval;
            }
        }
        throw new TallyException(TallyErrorCode.ERROR_INVALID_ARGUMENT, "Un-support interval " + name
                + ", make sure it is day, week, month or year");
    }

    /**
     * Seasonal period index: day of week 0-6 from Sunday, ISO week number, month of year 0-11 or the calendar year.
     */
    public int periodIndex(LocalDate date) {
        switch(this) {
            case DAY:
                return date.getDayOfWeek().getValue() % 7;
            case WEEK:
                return date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
            case MONTH:
                return date.getMonthValue() - 1;
            case YEAR:
                return date.getYear();
            default:
                throw new IllegalStateException("Unknown interval " + this);
        }
    }

    /**
     * First day of the period holding the date; weeks start on Monday.
     */
    public LocalDate periodStart(LocalDate date) {
        switch(this) {
            case DAY:
                return date;
            case WEEK:
                return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH:
                return date.withDayOfMonth(1);
            case YEAR:
                return date.withDayOfYear(1);
            default:
                throw new IllegalStateException("Unknown interval " + this);
        }
    }

    public LocalDate next(LocalDate periodStart) {
        switch(this) {
            case DAY:
                return periodStart.plus(1, ChronoUnit.DAYS);
            case WEEK:
                return periodStart.plus(1, ChronoUnit.WEEKS);
            case MONTH:
                return periodStart.plus(1, ChronoUnit.MONTHS);
            case YEAR:
                return periodStart.plus(1, ChronoUnit.YEARS);
            default:
                throw new IllegalStateException("Unknown interval " + this);
        }
    }

    @Override
    public String toString() {
        return name;
    }

}
