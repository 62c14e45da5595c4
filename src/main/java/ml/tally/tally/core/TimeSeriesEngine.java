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

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import ml.tally.tally.container.Dataset;
import ml.tally.tally.container.FieldSelector;
import ml.tally.tally.container.Record;
import ml.tally.tally.exception.TallyErrorCode;
import ml.tally.tally.exception.TallyException;
import ml.tally.tally.util.Constants;
import ml.tally.tally.util.Environment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calendar based analysis of dated records and linear trend forecasting of ordered series.
 * 
 * <p>
 * Dates are read with {@link FieldAccessor#toLocalDate}; {@link java.util.Date} and {@link java.time.Instant} values
 * are turned into calendar dates in the configured time zone ({@code timeZone}, UTC by default). Records without a
 * readable date or a valid value are skipped.
 */
public final class TimeSeriesEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesEngine.class);

    private TimeSeriesEngine() {
    }

    /**
     * Mean of valueField per seasonal period, see {@link TimeInterval#periodIndex(LocalDate)}. Periods without
     * observations are absent, not 0. Periods come in ascending order.
     */
    public static Map<Integer, Double> seasonality(Dataset dataset, String dateField, String valueField,
            TimeInterval interval) {
        FieldSelector dateSelector = FieldSelector.field(dateField);
        FieldSelector valueSelector = FieldSelector.field(valueField);
        FieldAccessor.checkNumeric(dataset, valueSelector, "seasonality");
        ZoneId zone = Environment.getTimeZone();

        TreeMap<Integer, double[]> periods = new TreeMap<Integer, double[]>();
        int skipped = 0;
        for(Record record: dataset) {
            LocalDate date = FieldAccessor.toLocalDate(dateSelector.select(record), zone);
            Double value = FieldAccessor.numeric(record, valueSelector);
            if(date == null || value == null) {
                skipped++;
                continue;
            }
            int period = interval.periodIndex(date);
            double[] sumAndCount = periods.get(period);
            if(sumAndCount == null) {
                sumAndCount = new double[2];
                periods.put(period, sumAndCount);
            }
            sumAndCount[0] += value;
            sumAndCount[1] += 1d;
        }
        if(skipped > 0) {
            LOG.debug("Seasonality skips {} records without date or value", skipped);
        }

        Map<Integer, Double> means = new LinkedHashMap<Integer, Double>();
        for(Map.Entry<Integer, double[]> entry: periods.entrySet()) {
            means.put(entry.getKey(), entry.getValue()[0] / entry.getValue()[1]);
        }
        return means;
    }

    public static Map<Integer, Double> seasonality(Dataset dataset, String dateField, String valueField,
            String interval) {
        return seasonality(dataset, dateField, valueField, TimeInterval.of(interval));
    }

    /**
     * Sum of valueField per period, ordered by date. Records carry {@code date} (the first day of the period) and
     * {@code value}. With fillGaps every period between the first and the last is present, missing ones with 0.
     */
    public static Dataset timeSeries(Dataset dataset, String dateField, String valueField, TimeInterval interval,
            boolean fillGaps) {
        FieldSelector dateSelector = FieldSelector.field(dateField);
        FieldSelector valueSelector = FieldSelector.field(valueField);
        FieldAccessor.checkNumeric(dataset, valueSelector, "timeSeries");
        ZoneId zone = Environment.getTimeZone();

        TreeMap<LocalDate, Double> sums = new TreeMap<LocalDate, Double>();
        for(Record record: dataset) {
            LocalDate date = FieldAccessor.toLocalDate(dateSelector.select(record), zone);
            Double value = FieldAccessor.numeric(record, valueSelector);
            if(date == null || value == null) {
                continue;
            }
            LocalDate start = interval.periodStart(date);
            Double sum = sums.get(start);
            sums.put(start, sum == null ? value : sum + value);
        }

        List<Record> points = new ArrayList<Record>();
        if(sums.isEmpty()) {
            return Dataset.of(points);
        }
        if(!fillGaps) {
            for(Map.Entry<LocalDate, Double> entry: sums.entrySet()) {
                points.add(point(entry.getKey(), entry.getValue()));
            }
            return Dataset.of(points);
        }
        for(LocalDate period = sums.firstKey(); !period.isAfter(sums.lastKey()); period = interval.next(period)) {
            Double sum = sums.get(period);
            points.add(point(period, sum == null ? 0d : sum));
        }
        return Dataset.of(points);
    }

    private static Record point(LocalDate date, double value) {
        return Record.of(Constants.DATE, date, Constants.VALUE, value);
    }

    /**
     * Extend a series by periods points along its least squares line over indexes 0..n-1. A series of one point repeats
     * it; an empty series forecasts nothing.
     */
    public static double[] forecast(double[] series, int periods) {
        checkPeriods(periods);
        double[] indexes = new double[series.length];
        for(int i = 0; i < indexes.length; i++) {
            indexes[i] = i;
        }
        return extrapolate(indexes, series, series.length, periods);
    }

    /**
     * Forecast the valueField of an ordered dataset for the next periods records. The trend is fitted over record
     * positions 0..n-1 against the valid values of valueField; records without a valid value keep their position but
     * do not weigh in the fit. Fewer than two valid values repeat the last valid value.
     * 
     * <p>
     * Forecast records copy the shape of the last record: other fields continue their sequence with
     * {@link LabelSequencer}, so a month label goes on with the next month rather than repeating.
     */
    public static Dataset forecast(Dataset dataset, String valueField, int periods) {
        checkPeriods(periods);
        FieldSelector valueSelector = FieldSelector.field(valueField);
        FieldAccessor.checkNumeric(dataset, valueSelector, "forecast");
        if(dataset.isEmpty() || periods == 0) {
            return Dataset.empty();
        }

        double[] indexes = new double[dataset.size()];
        double[] values = new double[dataset.size()];
        int size = 0;
        for(int i = 0; i < dataset.size(); i++) {
            Double value = FieldAccessor.numeric(dataset.get(i), valueSelector);
            if(value != null) {
                indexes[size] = i;
                values[size] = value;
                size++;
            }
        }
        double[] forecast = extrapolate(Arrays.copyOf(indexes, size), Arrays.copyOf(values, size),
                dataset.size(), periods);

        Record last = dataset.get(dataset.size() - 1);
        Record previous = dataset.size() > 1 ? dataset.get(dataset.size() - 2) : null;
        List<Record> records = new ArrayList<Record>(periods);
        for(int k = 1; k <= periods; k++) {
            Record.Builder builder = Record.builder();
            for(String field: last.fieldNames()) {
                if(!field.equals(valueField)) {
                    builder.put(field, LabelSequencer.next(previous == null ? null : previous.get(field),
                            last.get(field), k));
                }
            }
            builder.put(valueField, forecast[k - 1]);
            records.add(builder.build());
        }
        return Dataset.of(records);
    }

    /**
     * Evaluate the least squares line of (x, y) at n, n+1, ... n+periods-1.
     */
    private static double[] extrapolate(double[] x, double[] y, int n, int periods) {
        if(x.length == 0) {
            if(n == 0) {
                return new double[0];
            }
            double[] unknown = new double[periods];
            Arrays.fill(unknown, Double.NaN);
            return unknown;
        }
        double[] out = new double[periods];
        if(x.length < 2) {
            LOG.debug("Slope is undefined with {} point, repeat the last value", x.length);
            Arrays.fill(out, y[y.length - 1]);
            return out;
        }
        LinearTrend trend = LinearTrend.fit(x, y);
        for(int k = 0; k < periods; k++) {
            out[k] = trend.valueAt(n + k);
        }
        return out;
    }

    private static void checkPeriods(int periods) {
        if(periods < 0) {
            throw new TallyException(TallyErrorCode.ERROR_INVALID_ARGUMENT, "Forecast periods should not be negative "
                    + "but is " + periods);
        }
    }

    /**
     * Ordinary least squares line y = intercept + slope * x.
     */
    public static final class LinearTrend {

        private final double slope;

        private final double intercept;

        private LinearTrend(double slope, double intercept) {
            this.slope = slope;
            this.intercept = intercept;
        }

        /**
         * @param x
         *            at least two distinct values
         */
        public static LinearTrend fit(double[] x, double[] y) {
            BasicStatsCalculator xStats = new BasicStatsCalculator(x);
            BasicStatsCalculator yStats = new BasicStatsCalculator(y);
            double sxy = 0d;
            for(int i = 0; i < x.length; i++) {
                sxy += (x[i] - xStats.getMean()) * (y[i] - yStats.getMean());
            }
            double slope = sxy / xStats.getSquaredDeviationSum();
            return new LinearTrend(slope, yStats.getMean() - slope * xStats.getMean());
        }

        public double getSlope() {
            return slope;
        }

        public double getIntercept() {
            return intercept;
        }

        public double valueAt(double x) {
            return intercept + slope * x;
        }
    }

}
