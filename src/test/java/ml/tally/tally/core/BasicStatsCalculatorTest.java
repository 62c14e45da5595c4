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

import org.testng.Assert;
import org.testng.annotations.Test;

public class BasicStatsCalculatorTest {

    @Test
    public void testMoments() {
        BasicStatsCalculator stats = new BasicStatsCalculator(new double[] { 2, 4, 4, 4, 5, 5, 7, 9 });

        Assert.assertEquals(stats.getCount(), 8);
        Assert.assertEquals(stats.getSum(), 40d, 1e-12);
        Assert.assertEquals(stats.getMin(), 2d, 1e-12);
        Assert.assertEquals(stats.getMax(), 9d, 1e-12);
        Assert.assertEquals(stats.getMean(), 5d, 1e-12);
        Assert.assertEquals(stats.getPopulationVariance(), 4d, 1e-12);
        Assert.assertEquals(stats.getSampleVariance(), 32d / 7d, 1e-12);
        Assert.assertEquals(stats.getSkewness(), 0.65625d, 1e-12);
        Assert.assertEquals(stats.getKurtosis(), -0.21875d, 1e-12);
    }

    @Test
    public void testPercentiles() {
        BasicStatsCalculator stats = new BasicStatsCalculator(new double[] { 9, 2, 5, 4, 7, 4, 5, 4 });

        Assert.assertEquals(stats.getPercentile(0d), 2d, 1e-12);
        Assert.assertEquals(stats.getPercentile(25d), 4d, 1e-12);
        Assert.assertEquals(stats.getPercentile(75d), 5d, 1e-12);
        Assert.assertEquals(stats.getPercentile(100d), 9d, 1e-12);
        Assert.assertEquals(stats.getMedian(), 4.5d, 1e-12);
        Assert.assertEquals(new BasicStatsCalculator(new double[] { 3, 1, 2 }).getMedian(), 2d, 1e-12);
    }

    @Test
    public void testNoSpread() {
        BasicStatsCalculator stats = new BasicStatsCalculator(new double[] { 0.1d, 0.1d, 0.1d });

        Assert.assertEquals(stats.getMean(), 0.1d);
        Assert.assertEquals(stats.getPopulationVariance(), 0d);
        Assert.assertTrue(Double.isNaN(stats.getSkewness()));
    }

    @Test
    public void testEmpty() {
        BasicStatsCalculator stats = new BasicStatsCalculator(new double[0]);

        Assert.assertEquals(stats.getCount(), 0);
        Assert.assertEquals(stats.getSum(), 0d);
        Assert.assertTrue(Double.isNaN(stats.getMean()));
        Assert.assertTrue(Double.isNaN(stats.getMin()));
        Assert.assertTrue(Double.isNaN(stats.getPopulationVariance()));
        Assert.assertTrue(Double.isNaN(stats.getPercentile(50d)));
        Assert.assertTrue(Double.isNaN(stats.getMedian()));
    }

    @Test
    public void testSingleValue() {
        BasicStatsCalculator stats = new BasicStatsCalculator(new double[] { 7d });
        Assert.assertEquals(stats.getPopulationStdDev(), 0d);
        Assert.assertTrue(Double.isNaN(stats.getSampleStdDev()));
    }

}
