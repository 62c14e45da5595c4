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

/**
 * Calculator, it helps to calculate the count, sum, min, max, mean and central moments of valid numeric values.
 * 
 * <p>
 * Moments use two passes (mean first, then deviations) instead of a running sum of squares, which loses precision
 * when values are large compared to their spread. Both passes work on values divided by a power of two close to the
 * largest magnitude, so means and standard deviations of values near {@link Double#MAX_VALUE} stay finite.
 */
public class BasicStatsCalculator {

    private final double[] values;

    private double sum = 0d;
    private double min = Double.NaN;
    private double max = Double.NaN;
    private double mean = Double.NaN;

    /**
     * power of two the moments are scaled by
     */
    private double scale = 1d;

    /**
     * sums of the 2nd, 3rd and 4th powers of the scaled deviations from the mean
     */
    private double m2 = 0d;
    private double m3 = 0d;
    private double m4 = 0d;

    /**
     * @param values
     *            valid values, see {@link FieldAccessor#numericValues}
     */
    public BasicStatsCalculator(double[] values) {
        this.values = values;
        calculateStats();
    }

    private void calculateStats() {
        if(values.length == 0) {
            return;
        }

        min = Double.MAX_VALUE;
        max = -Double.MAX_VALUE;
        for(double value: values) {
            sum += value;
            min = Math.min(min, value);
            max = Math.max(max, value);
        }

        if(min == max) {
            // deviations are exactly zero, do not let rounding of the mean say otherwise
            mean = min;
            return;
        }

        double magnitude = Math.max(Math.abs(min), Math.abs(max));
        scale = Math.scalb(1d, Math.getExponent(magnitude));

        double scaledSum = 0d;
        for(double value: values) {
            scaledSum += value / scale;
        }
        double scaledMean = scaledSum / values.length;
        mean = scaledMean * scale;

        for(double value: values) {
            double dev = value / scale - scaledMean;
            double dev2 = dev * dev;
            m2 += dev2;
            m3 += dev2 * dev;
            m4 += dev2 * dev2;
        }
    }

    public int getCount() {
        return values.length;
    }

    /**
     * @return sum, 0 when no value
     */
    public double getSum() {
        return sum;
    }

    /**
     * @return min, NaN when no value
     */
    public double getMin() {
        return min;
    }

    /**
     * @return max, NaN when no value
     */
    public double getMax() {
        return max;
    }

    /**
     * @return mean, NaN when no value
     */
    public double getMean() {
        return mean;
    }

    /**
     * @return sum of squared deviations
     */
    public double getSquaredDeviationSum() {
        return m2 * scale * scale;
    }

    /**
     * @return population variance, NaN when no value
     */
    public double getPopulationVariance() {
        return values.length == 0 ? Double.NaN : (m2 / values.length) * scale * scale;
    }

    /**
     * @return sample variance, NaN for less than 2 values (n - 1 = 0 is not masked)
     */
    public double getSampleVariance() {
        return values.length <= 1 ? Double.NaN : (m2 / (values.length - 1)) * scale * scale;
    }

    public double getPopulationStdDev() {
        return values.length == 0 ? Double.NaN : Math.sqrt(m2 / values.length) * scale;
    }

    public double getSampleStdDev() {
        return values.length <= 1 ? Double.NaN : Math.sqrt(m2 / (values.length - 1)) * scale;
    }

    /**
     * @return population skewness m3 / sigma^3, NaN when no value or no spread
     */
    public double getSkewness() {
        if(values.length == 0 || m2 == 0d) {
            return Double.NaN;
        }
        double n = values.length;
        return (m3 / n) / Math.pow(m2 / n, 1.5d);
    }

    /**
     * @return population excess kurtosis m4 / sigma^4 - 3, NaN when no value or no spread
     */
    public double getKurtosis() {
        if(values.length == 0 || m2 == 0d) {
            return Double.NaN;
        }
        double n = values.length;
        double variance = m2 / n;
        return (m4 / n) / (variance * variance) - 3d;
    }

    /**
     * Nearest-rank percentile.
     * 
     * @param p
     *            percentile in [0, 100]
     * @return the value of rank ceil(p / 100 * n), the smallest value for p = 0, NaN when no value
     */
    public double getPercentile(double p) {
        if(values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = sortedValues();
        int index = (int) Math.ceil((p / 100d) * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(index, sorted.length - 1))];
    }

    /**
     * @return middle value, mean of the two middle values for an even count, NaN when no value
     */
    public double getMedian() {
        if(values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = sortedValues();
        int mid = sorted.length / 2;
        return sorted.length % 2 == 0 ? (sorted[mid - 1] + sorted[mid]) / 2d : sorted[mid];
    }

    private double[] sortedValues() {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        return sorted;
    }

}
