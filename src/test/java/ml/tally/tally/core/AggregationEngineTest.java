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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.tally.tally.container.AggregationResult;
import ml.tally.tally.container.Dataset;
import ml.tally.tally.container.Record;
import ml.tally.tally.exception.TallyErrorCode;
import ml.tally.tally.exception.TallyException;

import org.testng.Assert;
import org.testng.annotations.Test;

public class AggregationEngineTest {

    private final Dataset orders = Dataset.of(
            Record.of("shop", "a", "qty", 2, "price", 10.0d, "note", "x"),
            Record.of("shop", "b", "qty", 5, "price", 3.5d),
            Record.of("shop", "a", "qty", 4, "price", "n/a"),
            Record.of("shop", "a", "price", Double.NaN),
            Record.of("shop", "c", "note", "y"));

    @Test
    public void testAggregatePerGroup() {
        AggregationResult result = AggregationEngine.aggregate(orders, "shop", Arrays.asList("qty", "price"),
                AggregationType.SUM, AggregationType.AVG, AggregationType.MIN, AggregationType.MAX,
                AggregationType.COUNT, AggregationType.COUNT_VALID);

        Assert.assertEquals(result.keys(), Arrays.<Object> asList("a", "b", "c"));
        Assert.assertEquals(result.get("a", "qty", AggregationType.SUM), 6d, 1e-12);
        Assert.assertEquals(result.get("a", "qty", AggregationType.AVG), 3d, 1e-12);
        Assert.assertEquals(result.get("a", "qty", AggregationType.MIN), 2d, 1e-12);
        Assert.assertEquals(result.get("a", "qty", AggregationType.MAX), 4d, 1e-12);
        Assert.assertEquals(result.get("a", "qty", AggregationType.COUNT), 3d, 1e-12);
        Assert.assertEquals(result.get("a", "qty", AggregationType.COUNT_VALID), 2d, 1e-12);

        // "n/a" and NaN are skipped
        Assert.assertEquals(result.get("a", "price", AggregationType.SUM), 10d, 1e-12);
        Assert.assertEquals(result.get("a", "price", AggregationType.AVG), 10d, 1e-12);
    }

    @Test
    public void testResultCannotBeChanged() {
        AggregationResult result = AggregationEngine.aggregate(orders, "shop", Collections.singletonList("qty"),
                AggregationType.SUM);

        try {
            result.get("a").get("qty").put(AggregationType.SUM, 999d);
            Assert.fail("aggregation values should be read only");
        } catch (UnsupportedOperationException e) {
            Assert.assertEquals(result.get("a", "qty", AggregationType.SUM), 6d, 1e-12);
        }
        try {
            result.get("a").remove("qty");
            Assert.fail("field map should be read only");
        } catch (UnsupportedOperationException e) {
            Assert.assertTrue(result.get("a").containsKey("qty"));
        }

        Map<String, Map<AggregationType, Double>> whole = AggregationEngine.aggregate(orders,
                Collections.singletonList("qty"), Collections.singletonList(AggregationType.SUM));
        try {
            whole.get("qty").put(AggregationType.SUM, 0d);
            Assert.fail("whole dataset aggregation should be read only");
        } catch (UnsupportedOperationException e) {
            Assert.assertEquals(whole.get("qty").get(AggregationType.SUM), 11d, 1e-12);
        }
    }

    @Test
    public void testResultDoesNotShareSourceMap() {
        LinkedHashMap<AggregationType, Double> values = new LinkedHashMap<AggregationType, Double>();
        values.put(AggregationType.SUM, 1d);
        LinkedHashMap<String, Map<AggregationType, Double>> fields = new LinkedHashMap<String, Map<AggregationType, Double>>();
        fields.put("qty", values);
        LinkedHashMap<Object, Map<String, Map<AggregationType, Double>>> groups = new LinkedHashMap<Object, Map<String, Map<AggregationType, Double>>>();
        groups.put("a", fields);
        AggregationResult result = new AggregationResult(groups);

        values.put(AggregationType.SUM, 2d);
        groups.put("b", fields);

        Assert.assertEquals(result.get("a", "qty", AggregationType.SUM), 1d, 1e-12);
        Assert.assertEquals(result.size(), 1);
    }

    @Test
    public void testGroupWithoutValidValues() {
        AggregationResult result = AggregationEngine.aggregate(orders, "shop", Collections.singletonList("qty"),
                AggregationType.SUM, AggregationType.AVG, AggregationType.MIN, AggregationType.COUNT);

        Assert.assertEquals(result.get("c", "qty", AggregationType.SUM), 0d, 1e-12);
        Assert.assertTrue(Double.isNaN(result.get("c", "qty", AggregationType.AVG)));
        Assert.assertTrue(Double.isNaN(result.get("c", "qty", AggregationType.MIN)));
        Assert.assertEquals(result.get("c", "qty", AggregationType.COUNT), 1d, 1e-12);
    }

    @Test
    public void testCountOnNonNumericField() {
        AggregationResult result = AggregationEngine.aggregate(orders, "shop", Collections.singletonList("note"),
                AggregationType.COUNT);
        Assert.assertEquals(result.get("a", "note", AggregationType.COUNT), 3d, 1e-12);
    }

    @Test
    public void testNumericAggregationOnNonNumericField() {
        try {
            AggregationEngine.aggregate(orders, "shop", Collections.singletonList("note"), AggregationType.SUM);
            Assert.fail("note is not numeric");
        } catch (TallyException e) {
            Assert.assertEquals(e.getError(), TallyErrorCode.ERROR_NON_NUMERIC_FIELD);
        }
    }

    @Test
    public void testWholeDataset() {
        Map<String, Map<AggregationType, Double>> result = AggregationEngine.aggregate(orders,
                Collections.singletonList("qty"), Arrays.asList(AggregationType.SUM, AggregationType.COUNT));
        Assert.assertEquals(result.get("qty").get(AggregationType.SUM), 11d, 1e-12);
        Assert.assertEquals(result.get("qty").get(AggregationType.COUNT), 5d, 1e-12);
    }

    @Test
    public void testToDataset() {
        AggregationResult result = AggregationEngine.aggregate(orders, "shop", Collections.singletonList("qty"),
                AggregationType.SUM);
        Dataset dataset = result.toDataset();

        Assert.assertEquals(dataset.size(), 3);
        Assert.assertEquals(dataset.get(1).get("key"), "b");
        Assert.assertEquals(dataset.get(1).get("field"), "qty");
        Assert.assertEquals(dataset.get(1).get("sum"), 5d);
    }

    @Test
    public void testAggregationNames() {
        Assert.assertEquals(AggregationType.of("avg"), AggregationType.AVG);
        Assert.assertEquals(AggregationType.of(" countValid "), AggregationType.COUNT_VALID);
        try {
            AggregationType.of("median");
            Assert.fail("median is not an aggregation");
        } catch (TallyException e) {
            Assert.assertEquals(e.getError(), TallyErrorCode.ERROR_UNSUPPORTED_AGGREGATION);
        }
    }

    @Test(expectedExceptions = TallyException.class)
    public void testEmptyFields() {
        List<String> none = Collections.emptyList();
        AggregationEngine.aggregate(orders, "shop", none, AggregationType.SUM);
    }

}
