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

import ml.tally.tally.container.Dataset;
import ml.tally.tally.container.DispersionSummary;
import ml.tally.tally.container.FieldSelector;
import ml.tally.tally.container.Record;
import ml.tally.tally.exception.TallyErrorCode;
import ml.tally.tally.exception.TallyException;

import org.testng.Assert;
import org.testng.annotations.Test;

public class DescriptiveStatisticsTest {

    private static Dataset values(String field, Object... values) {
        Record[] records = new Record[values.length];
        for(int i = 0; i < values.length; i++) {
            records[i] = Record.of(field, values[i]);
        }
        return Dataset.of(records);
    }

    @Test
    public void testStandardDeviation() {
        DispersionSummary summary = DescriptiveStatistics.standardDeviation(
                values("v", 2, 4, 4, 4, 5, 5, 7, 9), "v");

        Assert.assertEquals(summary.getPopulation(), 2.0d, 1e-12);
        Assert.assertEquals(summary.getSample(), 2.138089935299395d, 1e-12);
        Assert.assertTrue(summary.getSample() >= summary.getPopulation());
        Assert.assertEquals(summary.toRecord().get("population"), 2.0d);
    }

    @Test
    public void testStandardDeviationOfScalars() {
        DispersionSummary summary = DescriptiveStatistics.standardDeviation(
                Dataset.ofValues(2, 4, 4, 4, 5, 5, 7, 9), null);
        Assert.assertEquals(summary.getPopulation(), 2.0d, 1e-12);
    }

    @Test
    public void testStandardDeviationSmallInputs() {
        Assert.assertEquals(DescriptiveStatistics.standardDeviation(Dataset.empty(), "v"),
                new DispersionSummary(0d, 0d));

        DispersionSummary single = DescriptiveStatistics.standardDeviation(values("v", 3), "v");
        Assert.assertEquals(single.getPopulation(), 0d);
        Assert.assertTrue(Double.isNaN(single.getSample()));
    }

    @Test
    public void testStandardDeviationSkipsInvalid() {
        Dataset dataset = values("v", 2, 4, 4, 4, 5, 5, 7, 9, "oops", Double.NaN, Double.POSITIVE_INFINITY);
        Assert.assertEquals(DescriptiveStatistics.standardDeviation(dataset.concat(Dataset.of(Record.empty())), "v")
                .getPopulation(), 2.0d, 1e-12);
    }

    @Test
    public void testStandardDeviationNonNumeric() {
        try {
            DescriptiveStatistics.standardDeviation(values("v", "a", "b"), "v");
            Assert.fail("strings have no deviation");
        } catch (TallyException e) {
            Assert.assertEquals(e.getError(), TallyErrorCode.ERROR_NON_NUMERIC_FIELD);
        }
    }

    @Test
    public void testShapeAndDescribe() {
        Dataset dataset = values("v", 2, 4, 4, 4, 5, 5, 7, 9);

        Assert.assertEquals(DescriptiveStatistics.variance(dataset, "v"), 4d, 1e-12);
        Assert.assertEquals(DescriptiveStatistics.skewness(dataset, "v"), 0.65625d, 1e-12);
        Assert.assertEquals(DescriptiveStatistics.kurtosis(dataset, "v"), -0.21875d, 1e-12);
        Assert.assertEquals(DescriptiveStatistics.median(dataset, "v"), 4.5d, 1e-12);
        Assert.assertEquals(DescriptiveStatistics.percentile(dataset, "v", 90d), 9d, 1e-12);

        Map<String, Double> summary = DescriptiveStatistics.describe(dataset, "v");
        Assert.assertEquals(summary.get("count"), 8d, 1e-12);
        Assert.assertEquals(summary.get("mean"), 5d, 1e-12);
        Assert.assertEquals(summary.get("stdDev"), 2d, 1e-12);
        Assert.assertEquals(summary.get("q1"), 4d, 1e-12);
        Assert.assertEquals(summary.get("q3"), 5d, 1e-12);
        Assert.assertEquals(summary.get("iqr"), 1d, 1e-12);
    }

    @Test(expectedExceptions = TallyException.class)
    public void testPercentileOutOfRange() {
        DescriptiveStatistics.percentile(values("v", 1, 2), "v", 101d);
    }

    @Test
    public void testEntropy() {
        double entropy = DescriptiveStatistics.entropy(Dataset.ofScalars("A", "A", "C", "C", "C", "B"));

        Assert.assertTrue(entropy > 0d);
        Assert.assertTrue(entropy < Math.log(3d) / Math.log(2d));
        Assert.assertEquals(entropy, 1.4591479170272448d, 1e-12);
    }

    @Test
    public void testEntropyBounds() {
        Assert.assertEquals(DescriptiveStatistics.entropy(Dataset.ofScalars("x", "x", "x")), 0d, 1e-12);
        Assert.assertEquals(DescriptiveStatistics.entropy(Dataset.empty()), 0d, 1e-12);
        Assert.assertEquals(DescriptiveStatistics.entropy(Dataset.ofScalars("a", "b", "c", "d")), 2d, 1e-12);
    }

    @Test
    public void testEntropyOfFieldIgnoresAbsent() {
        Dataset dataset = values("color", "red", "blue", null, "red", "blue");
        Assert.assertEquals(DescriptiveStatistics.entropy(dataset, "color"), 1d, 1e-12);
        Assert.assertEquals(DescriptiveStatistics.entropy(dataset, FieldSelector.field("color")), 1d, 1e-12);
    }

    @Test
    public void testDiscretizedEntropy() {
        Assert.assertEquals(DescriptiveStatistics.entropy(Dataset.ofValues(0, 1, 2, 3), null, 2), 1d, 1e-12);
        Assert.assertEquals(DescriptiveStatistics.discretizedEntropy(Dataset.ofValues(0, 1, 2, 3, 4, 5, 6, 7, 8, 9),
                null), Math.log(10d) / Math.log(2d), 1e-12);
        Assert.assertEquals(DescriptiveStatistics.entropy(Dataset.ofValues(5, 5), null, 3), 0d, 1e-12);
    }

    @Test
    public void testCorrelate() {
        Dataset dataset = Dataset.of(Record.of("x", 1, "y", 2), Record.of("x", 2, "y", 4), Record.of("x", 3, "y", 6),
                Record.of("x", 4, "y", 8));

        Assert.assertEquals(DescriptiveStatistics.correlate(dataset, "x", "y"), 1d);
        Assert.assertEquals(DescriptiveStatistics.correlate(dataset, "y", "x"),
                DescriptiveStatistics.correlate(dataset, "x", "y"));
        Assert.assertEquals(DescriptiveStatistics.covariance(dataset, "x", "y"), 2.5d, 1e-12);
    }

    @Test
    public void testCorrelateWithItself() {
        Dataset dataset = Dataset.of(Record.of("x", 0.1d), Record.of("x", 0.7d), Record.of("x", 3.3d),
                Record.of("x", 1e-3d), Record.of("x", 12345.678d));

        Assert.assertEquals(DescriptiveStatistics.correlate(dataset, "x", "x"), 1d);
    }

    @Test
    public void testStandardDeviationOfHugeValues() {
        DispersionSummary summary = DescriptiveStatistics.standardDeviation(Dataset.ofValues(1e308d, 1.5e308d), null);

        Assert.assertEquals(summary.getPopulation(), 2.5e307d, 1e295d);
    }

    @Test
    public void testCorrelateNegativeAndBounded() {
        Dataset dataset = Dataset.of(Record.of("x", 1, "y", 9), Record.of("x", 2, "y", 7), Record.of("x", 3, "y", 8),
                Record.of("x", 4, "y", 1), Record.of("x", 5));
        double r = DescriptiveStatistics.correlate(dataset, "x", "y");
        Assert.assertTrue(r < 0d && r >= -1d);
    }

    @Test
    public void testCorrelateUndefined() {
        Dataset flat = Dataset.of(Record.of("x", 1, "y", 3), Record.of("x", 2, "y", 3));
        Assert.assertTrue(Double.isNaN(DescriptiveStatistics.correlate(flat, "x", "y")));
        Assert.assertTrue(Double.isNaN(DescriptiveStatistics.correlate(Dataset.of(Record.of("x", 1, "y", 3)), "x",
                "y")));
    }

    @Test
    public void testCorrelateNonNumeric() {
        try {
            DescriptiveStatistics.correlate(Dataset.of(Record.of("x", 1, "y", "a")), "x", "y");
            Assert.fail("y is not numeric");
        } catch (TallyException e) {
            Assert.assertEquals(e.getError(), TallyErrorCode.ERROR_NON_NUMERIC_FIELD);
        }
    }

    @Test
    public void testZscore() {
        List<Double> scores = DescriptiveStatistics.zscore(values("v", 2, 4, 4, 4, 5, 5, 7, 9), "v");
        Assert.assertEquals(scores.size(), 8);
        Assert.assertEquals(scores.get(0), -1.5d, 1e-12);
        Assert.assertEquals(scores.get(7), 2d, 1e-12);
    }

    @Test
    public void testRemoveOutliers() {
        Dataset dataset = values("v", 1, 2, 3, 100, 4);

        Dataset kept = DescriptiveStatistics.removeOutliers(dataset, "v", 1.5d);
        Assert.assertEquals(kept.pluck("v"), Arrays.<Object> asList(1, 2, 3, 4));

        Dataset removed = DescriptiveStatistics.outliers(dataset, "v", 1.5d);
        Assert.assertEquals(removed.pluck("v"), Arrays.<Object> asList(100));
    }

    @Test
    public void testRemoveOutliersDefaultThreshold() {
        Dataset dataset = values("v", 1, 2, 3, 4, 5, 6, 7, 8, 9, 100);
        Dataset kept = DescriptiveStatistics.removeOutliers(dataset, "v");

        Assert.assertEquals(kept.size(), 9);
        Assert.assertFalse(kept.pluck("v").contains(100));
    }

    @Test
    public void testRemoveOutliersKeepsInvalidAndFlat() {
        Dataset dataset = values("v", 1, 2, 3, 100, "n/a", 4).concat(Dataset.of(Record.of("w", 1)));
        Dataset kept = DescriptiveStatistics.removeOutliers(dataset, "v", 1.5d);
        Assert.assertEquals(kept.size(), 6);
        Assert.assertEquals(kept.get(3).get("v"), "n/a");

        Dataset flat = values("v", 5, 5, 5);
        Assert.assertEquals(DescriptiveStatistics.removeOutliers(flat, "v", 0d), flat);
    }

    @Test
    public void testRemoveOutliersIsIdempotentOnResultSubset() {
        Dataset dataset = values("v", 1, 2, 3, 4, 5, 6, 7, 8, 9, 100);
        Dataset kept = DescriptiveStatistics.removeOutliers(dataset, "v", 2d);
        for(Record record: kept) {
            Assert.assertTrue(dataset.records().contains(record));
        }
    }

    @Test
    public void testMode() {
        Assert.assertEquals(DescriptiveStatistics.mode(Dataset.ofScalars("a", "b", "b", "a", "c"),
                FieldSelector.self()), "a");
        Assert.assertNull(DescriptiveStatistics.mode(Dataset.empty(), FieldSelector.self()));
    }

}
