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
package ml.tally.tally.container;

import java.util.Arrays;
import java.util.Comparator;

import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.base.Function;
import com.google.common.base.Predicate;

public class DatasetTest {

    private Dataset sales() {
        return Dataset.of(Record.of("city", "Rome", "sales", 10), Record.of("city", "Oslo", "sales", 5),
                Record.of("city", "Rome"), Record.of("city", "Lima", "sales", 10));
    }

    @Test
    public void testPluckKeepsAbsent() {
        Assert.assertEquals(sales().pluck("sales"), Arrays.<Object> asList(10, 5, null, 10));
        Assert.assertEquals(Dataset.ofScalars(1, null, 3).pluck(FieldSelector.self()),
                Arrays.<Object> asList(1, null, 3));
    }

    @Test
    public void testFilterAndMap() {
        Dataset dataset = sales();
        Dataset rome = dataset.filter(new Predicate<Record>() {
            @Override
            public boolean apply(Record input) {
                return "Rome".equals(input.get("city"));
            }
        });
        Assert.assertEquals(rome.size(), 2);
        Assert.assertEquals(dataset.size(), 4);

        Dataset tagged = dataset.map(new Function<Record, Record>() {
            @Override
            public Record apply(Record input) {
                return input.with("tag", "x");
            }
        });
        Assert.assertEquals(tagged.get(3).get("tag"), "x");
        Assert.assertFalse(dataset.get(3).has("tag"));
    }

    @Test
    public void testSortIsStable() {
        Dataset sorted = sales().sort(new Comparator<Record>() {
            @Override
            public int compare(Record o1, Record o2) {
                int s1 = o1.has("sales") ? (Integer) o1.get("sales") : 0;
                int s2 = o2.has("sales") ? (Integer) o2.get("sales") : 0;
                return Integer.compare(s2, s1);
            }
        });
        Assert.assertEquals(sorted.pluck("city"), Arrays.<Object> asList("Rome", "Lima", "Oslo", "Rome"));
        Assert.assertEquals(sorted.get(3).has("sales"), false);
    }

    @Test
    public void testConcatAndEquals() {
        Dataset a = Dataset.ofValues(1d, 2d);
        Dataset b = Dataset.ofValues(3d);
        Assert.assertEquals(a.concat(b), Dataset.ofValues(1d, 2d, 3d));
        Assert.assertTrue(Dataset.empty().isEmpty());
        Assert.assertEquals(Dataset.of(Arrays.asList(Record.ofScalar(1d))), Dataset.ofValues(1d));
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testRecordsUnmodifiable() {
        sales().records().add(Record.empty());
    }

}
