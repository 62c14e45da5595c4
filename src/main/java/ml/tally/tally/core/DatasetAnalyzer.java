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

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import ml.tally.tally.container.AggregationResult;
import ml.tally.tally.container.Dataset;
import ml.tally.tally.container.DispersionSummary;
import ml.tally.tally.container.FieldSelector;
import ml.tally.tally.container.GroupedDataset;
import ml.tally.tally.container.PivotTable;
import ml.tally.tally.container.Record;
import ml.tally.tally.core.model.NaiveBayesModel;

import com.google.common.base.Function;
import com.google.common.base.Predicate;

/**
 * Fluent entry point over one dataset snapshot. Operations producing a dataset return a new analyzer so calls chain:
 * 
 * <pre>
 * DatasetAnalyzer.of(sales).removeOutliers(&quot;amount&quot;).standardDeviation(&quot;amount&quot;);
 * </pre>
 */
public final class DatasetAnalyzer {

    private final Dataset dataset;

    private DatasetAnalyzer(Dataset dataset) {
        this.dataset = dataset;
    }

    public static DatasetAnalyzer of(Dataset dataset) {
        return new DatasetAnalyzer(dataset);
    }

    public Dataset getDataset() {
        return dataset;
    }

    public DatasetAnalyzer filter(Predicate<Record> predicate) {
        return of(dataset.filter(predicate));
    }

    public DatasetAnalyzer map(Function<Record, Record> function) {
        return of(dataset.map(function));
    }

    public GroupedDataset groupBy(String field) {
        return GroupingEngine.groupBy(dataset, field);
    }

    public GroupedDataset groupBy(FieldSelector selector) {
        return GroupingEngine.groupBy(dataset, selector);
    }

    public GroupedDataset groupByMultiple(String... fields) {
        return GroupingEngine.groupByMultiple(dataset, fields);
    }

    /**
     * Groups by groupField whose sum of field satisfies the comparison, members flattened in group order.
     */
    public DatasetAnalyzer having(String groupField, String field, String operator, double value) {
        return of(GroupingEngine.having(dataset, FieldSelector.field(groupField), field, operator, value).flatten());
    }

    public PivotTable pivotTable(String rowField, String columnField, String valueField, AggregationType aggregation) {
        return GroupingEngine.pivotTable(dataset, rowField, columnField, valueField, aggregation);
    }

    public Map<Object, Long> frequency(String field) {
        return GroupingEngine.frequency(dataset, FieldSelector.fieldOrSelf(field));
    }

    public AggregationResult aggregate(String groupField, List<String> valueFields, AggregationType... operations) {
        return AggregationEngine.aggregate(dataset, groupField, valueFields, operations);
    }

    public DispersionSummary standardDeviation(String field) {
        return DescriptiveStatistics.standardDeviation(dataset, field);
    }

    public double variance(String field) {
        return DescriptiveStatistics.variance(dataset, field);
    }

    public double entropy(String field) {
        return DescriptiveStatistics.entropy(dataset, field);
    }

    public double correlate(String fieldA, String fieldB) {
        return DescriptiveStatistics.correlate(dataset, fieldA, fieldB);
    }

    public double covariance(String fieldA, String fieldB) {
        return DescriptiveStatistics.covariance(dataset, fieldA, fieldB);
    }

    public Map<String, Double> describe(String field) {
        return DescriptiveStatistics.describe(dataset, field);
    }

    public DatasetAnalyzer removeOutliers(String field) {
        return of(DescriptiveStatistics.removeOutliers(dataset, field));
    }

    public DatasetAnalyzer removeOutliers(String field, double threshold) {
        return of(DescriptiveStatistics.removeOutliers(dataset, field, threshold));
    }

    public DatasetAnalyzer convolve(String field, double... kernel) {
        return of(SignalProcessor.convolve(dataset, field, kernel));
    }

    public DatasetAnalyzer movingAverage(String field, int window) {
        return of(SignalProcessor.movingAverage(dataset, field, window));
    }

    public DatasetAnalyzer fft(String field) {
        return of(SignalProcessor.fft(dataset, field));
    }

    public Map<Integer, Double> seasonality(String dateField, String valueField, TimeInterval interval) {
        return TimeSeriesEngine.seasonality(dataset, dateField, valueField, interval);
    }

    public DatasetAnalyzer timeSeries(String dateField, String valueField, TimeInterval interval, boolean fillGaps) {
        return of(TimeSeriesEngine.timeSeries(dataset, dateField, valueField, interval, fillGaps));
    }

    public DatasetAnalyzer forecast(String valueField, int periods) {
        return of(TimeSeriesEngine.forecast(dataset, valueField, periods));
    }

    public NaiveBayesModel naiveBayes(String labelField, String... featureFields) {
        return ClassificationEngine.naiveBayes(dataset, Arrays.asList(featureFields), labelField);
    }

}
