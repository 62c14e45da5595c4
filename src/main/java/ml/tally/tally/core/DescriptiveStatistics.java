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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.tally.tally.container.Dataset;
import ml.tally.tally.container.DispersionSummary;
import ml.tally.tally.container.FieldSelector;
import ml.tally.tally.container.Record;
import ml.tally.tally.exception.TallyErrorCode;
import ml.tally.tally.exception.TallyException;
import ml.tally.tally.util.Environment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * Dispersion, shape and association measures of numeric fields, plus entropy of any equality-comparable field.
 * 
 * <p>
 * All measures work on the valid numeric values of a field: absent, non-numeric, NaN and infinite values are skipped.
 * A null field means the scalars of a scalar dataset, see {@link Record#ofScalar(Object)}. Insufficient data gives
 * NaN, never a silent 0, except {@link #standardDeviation} of an empty dataset which is 0 by convention.
 */
public final class DescriptiveStatistics {

    private static final Logger LOG = LoggerFactory.getLogger(DescriptiveStatistics.class);

    private static final double LOG2 = Math.log(2d);

    private DescriptiveStatistics() {
    }

    /**
     * Population and sample standard deviation. No value gives 0 for both; one value gives population 0 and sample
     * NaN.
     */
    public static DispersionSummary standardDeviation(Dataset dataset, String field) {
        BasicStatsCalculator stats = numericStats(dataset, field, "standardDeviation");
        if(stats.getCount() == 0) {
            return new DispersionSummary(0d, 0d);
        }
        return new DispersionSummary(stats.getPopulationStdDev(), stats.getSampleStdDev());
    }

    /**
     * @return population variance, NaN when no value
     */
    public static double variance(Dataset dataset, String field) {
        return numericStats(dataset, field, "variance").getPopulationVariance();
    }

    public static double skewness(Dataset dataset, String field) {
        return numericStats(dataset, field, "skewness").getSkewness();
    }

    public static double kurtosis(Dataset dataset, String field) {
        return numericStats(dataset, field, "kurtosis").getKurtosis();
    }

    public static double median(Dataset dataset, String field) {
        return numericStats(dataset, field, "median").getMedian();
    }

    /**
     * Nearest-rank percentile.
     * 
     * @throws TallyException
     *             if p is not in [0, 100]
     */
    public static double percentile(Dataset dataset, String field, double p) {
        if(!(p >= 0d && p <= 100d)) {
            throw new TallyException(TallyErrorCode.ERROR_INVALID_ARGUMENT, "Percentile should be in [0, 100] but is "
                    + p);
        }
        return numericStats(dataset, field, "percentile").getPercentile(p);
    }

    /**
     * Summary of a numeric field: count, mean, min, max, sum, stdDev (population), variance, q1, q3 and iqr. count is
     * the number of valid values.
     */
    public static Map<String, Double> describe(Dataset dataset, String field) {
        BasicStatsCalculator stats = numericStats(dataset, field, "describe");
        Map<String, Double> summary = new LinkedHashMap<String, Double>();
        summary.put("count", (double) stats.getCount());
        summary.put("mean", stats.getMean());
        summary.put("min", stats.getMin());
        summary.put("max", stats.getMax());
        summary.put("sum", stats.getSum());
        summary.put("stdDev", stats.getPopulationStdDev());
        summary.put("variance", stats.getPopulationVariance());
        double q1 = stats.getPercentile(25d);
        double q3 = stats.getPercentile(75d);
        summary.put("q1", q1);
        summary.put("q3", q3);
        summary.put("iqr", q3 - q1);
        return summary;
    }

    /**
     * Shannon entropy in bits of the distinct values of the selector: -sum(p * log2(p)). Absent values are not
     * counted; an empty dataset has entropy 0.
     */
    public static double entropy(Dataset dataset, FieldSelector selector) {
        GroupingEngine.checkSelector(selector);
        Map<Object, Long> frequency = GroupingEngine.frequency(dataset, selector);
        frequency.remove(null);
        return entropy(frequency.values());
    }

    /**
     * Entropy of the scalars of a scalar dataset.
     */
    public static double entropy(Dataset dataset) {
        return entropy(dataset, FieldSelector.self());
    }

    public static double entropy(Dataset dataset, String field) {
        return entropy(dataset, FieldSelector.fieldOrSelf(field));
    }

    /**
     * Entropy of a numeric field discretized into equal-width bins between its min and max.
     */
    public static double entropy(Dataset dataset, String field, int bins) {
        if(bins < 1) {
            throw new TallyException(TallyErrorCode.ERROR_INVALID_ARGUMENT, "Entropy needs at least one bin but got "
                    + bins);
        }
        BasicStatsCalculator stats = numericStats(dataset, field, "entropy");
        double[] values = FieldAccessor.numericValues(dataset, FieldSelector.fieldOrSelf(field));
        if(values.length == 0) {
            return 0d;
        }
        double width = (stats.getMax() - stats.getMin()) / bins;
        long[] counts = new long[bins];
        for(double value: values) {
            int bin = width == 0d ? 0 : (int) ((value - stats.getMin()) / width);
            // max falls on the upper edge of the last bin
            counts[Math.min(bin, bins - 1)]++;
        }
        List<Long> frequencies = new ArrayList<Long>(bins);
        for(long count: counts) {
            frequencies.add(count);
        }
        return entropy(frequencies);
    }

    /**
     * Entropy with the configured number of bins, see {@link Environment#getEntropyBins()}.
     */
    public static double discretizedEntropy(Dataset dataset, String field) {
        return entropy(dataset, field, Environment.getEntropyBins());
    }

    private static double entropy(Iterable<Long> frequencies) {
        long total = 0L;
        for(Long count: frequencies) {
            total += count;
        }
        if(total == 0L) {
            return 0d;
        }
        double entropy = 0d;
        for(Long count: frequencies) {
            if(count == 0L) {
                continue;
            }
            double p = (double) count / total;
            entropy -= p * Math.log(p) / LOG2;
        }
        return entropy;
    }

    /**
     * Pearson correlation over the records where both fields are valid numbers. NaN with fewer than two pairs or when
     * either side has no variance.
     */
    public static double correlate(Dataset dataset, String fieldA, String fieldB) {
        double[][] pairs = pairs(dataset, fieldA, fieldB, "correlate");
        double[] x = pairs[0];
        double[] y = pairs[1];
        if(x.length < 2) {
            LOG.debug("Correlation of {} and {} is undefined with {} pairs", fieldA, fieldB, x.length);
            return Double.NaN;
        }
        BasicStatsCalculator xStats = new BasicStatsCalculator(x);
        BasicStatsCalculator yStats = new BasicStatsCalculator(y);
        double sxx = xStats.getSquaredDeviationSum();
        double syy = yStats.getSquaredDeviationSum();
        if(sxx == 0d || syy == 0d) {
            return Double.NaN;
        }
        return covarianceSum(x, xStats.getMean(), y, yStats.getMean()) / Math.sqrt(sxx * syy);
    }

    /**
     * Population covariance over the records where both fields are valid numbers, NaN without any pair.
     */
    public static double covariance(Dataset dataset, String fieldA, String fieldB) {
        double[][] pairs = pairs(dataset, fieldA, fieldB, "covariance");
        double[] x = pairs[0];
        double[] y = pairs[1];
        if(x.length == 0) {
            return Double.NaN;
        }
        double meanX = new BasicStatsCalculator(x).getMean();
        double meanY = new BasicStatsCalculator(y).getMean();
        return covarianceSum(x, meanX, y, meanY) / x.length;
    }

    private static double covarianceSum(double[] x, double meanX, double[] y, double meanY) {
        double sum = 0d;
        for(int i = 0; i < x.length; i++) {
            sum += (x[i] - meanX) * (y[i] - meanY);
        }
        return sum;
    }

    private static double[][] pairs(Dataset dataset, String fieldA, String fieldB, String operation) {
        FieldSelector a = FieldSelector.field(fieldA);
        FieldSelector b = FieldSelector.field(fieldB);
        FieldAccessor.checkNumeric(dataset, a, operation);
        FieldAccessor.checkNumeric(dataset, b, operation);

        double[] x = new double[dataset.size()];
        double[] y = new double[dataset.size()];
        int size = 0;
        for(Record record: dataset) {
            Double valueA = FieldAccessor.numeric(record, a);
            Double valueB = FieldAccessor.numeric(record, b);
            if(valueA != null && valueB != null) {
                x[size] = valueA;
                y[size] = valueB;
                size++;
            }
        }
        double[][] result = new double[2][size];
        System.arraycopy(x, 0, result[0], 0, size);
        System.arraycopy(y, 0, result[1], 0, size);
        return result;
    }

    /**
     * z-score of each valid value in record order, NaN everywhere when the values have no spread.
     */
    public static List<Double> zscore(Dataset dataset, String field) {
        BasicStatsCalculator stats = numericStats(dataset, field, "zscore");
        double[] values = FieldAccessor.numericValues(dataset, FieldSelector.fieldOrSelf(field));
        double stdDev = stats.getPopulationStdDev();
        List<Double> scores = new ArrayList<Double>(values.length);
        for(double value: values) {
            scores.add(stdDev == 0d ? Double.NaN : (value - stats.getMean()) / stdDev);
        }
        return Collections.unmodifiableList(scores);
    }

    /**
     * Keep records whose value is within threshold population standard deviations of the mean,
     * {@code |x - mean| <= threshold * stdDev}. Records without a valid value are kept, there is no evidence they are
     * outliers. With no spread every record is kept. Order is preserved.
     */
    public static Dataset removeOutliers(Dataset dataset, String field, double threshold) {
        return splitOutliers(dataset, field, threshold, true);
    }

    /**
     * {@link #removeOutliers(Dataset, String, double)} with the configured threshold, 2 by default.
     */
    public static Dataset removeOutliers(Dataset dataset, String field) {
        return removeOutliers(dataset, field, Environment.getOutlierThreshold());
    }

    /**
     * Complement of {@link #removeOutliers(Dataset, String, double)}: records whose valid value is strictly beyond
     * threshold standard deviations.
     */
    public static Dataset outliers(Dataset dataset, String field, double threshold) {
        return splitOutliers(dataset, field, threshold, false);
    }

    public static Dataset outliers(Dataset dataset, String field) {
        return outliers(dataset, field, Environment.getOutlierThreshold());
    }

    private static Dataset splitOutliers(Dataset dataset, String field, double threshold, boolean keepInliers) {
        if(!(threshold >= 0d)) {
            throw new TallyException(TallyErrorCode.ERROR_INVALID_ARGUMENT,
                    "Outlier threshold should be a non-negative number but is " + threshold);
        }
        FieldSelector selector = FieldSelector.fieldOrSelf(field);
        BasicStatsCalculator stats = numericStats(dataset, field, "removeOutliers");
        double mean = stats.getMean();
        double limit = threshold * stats.getPopulationStdDev();

        ImmutableList.Builder<Record> builder = ImmutableList.builder();
        int outliers = 0;
        for(Record record: dataset) {
            Double value = FieldAccessor.numeric(record, selector);
            boolean outlier = value != null && Math.abs(value - mean) > limit;
            if(outlier) {
                outliers++;
            }
            if(outlier != keepInliers) {
                builder.add(record);
            }
        }
        LOG.debug("Found {} outliers of {} beyond {} standard deviations", outliers, selector.getName(), threshold);
        return Dataset.of(builder.build());
    }

    /**
     * Most frequent value of the selector, first appearance wins ties, absent values are not counted.
     * 
     * @return the mode, null for no value
     */
    public static Object mode(Dataset dataset, FieldSelector selector) {
        Map<Object, Long> frequency = GroupingEngine.frequency(dataset, selector);
        frequency.remove(null);
        Object mode = null;
        long max = 0L;
        for(Map.Entry<Object, Long> entry: frequency.entrySet()) {
            if(entry.getValue() > max) {
                max = entry.getValue();
                mode = entry.getKey();
            }
        }
        return mode;
    }

    private static BasicStatsCalculator numericStats(Dataset dataset, String field, String operation) {
        FieldSelector selector = FieldSelector.fieldOrSelf(field);
        FieldAccessor.checkNumeric(dataset, selector, operation);
        return new BasicStatsCalculator(FieldAccessor.numericValues(dataset, selector));
    }

}
