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
package ml.tally.tally.core.model;

import java.time.LocalDate;
import java.util.Date;

import ml.tally.tally.container.Dataset;
import ml.tally.tally.container.Record;
import ml.tally.tally.core.ClassificationEngine;
import ml.tally.tally.exception.TallyErrorCode;
import ml.tally.tally.exception.TallyException;

import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

public class NaiveBayesModelTest {

    private NaiveBayesModel model;

    @BeforeClass
    public void setUp() {
        Dataset houses = Dataset.of(
                Record.of("rooms", 3, "garden", true, "city", "Pisa", "band", "mid"),
                Record.of("rooms", 4, "garden", true, "city", "Pisa", "band", "high"),
                Record.of("rooms", 2, "garden", false, "city", "Lucca", "band", "low"),
                Record.of("rooms", 3, "garden", false, "city", "Lucca", "band", "mid"),
                Record.of("rooms", 4, "garden", true, "city", "Lucca", "band", "high"));
        model = ClassificationEngine.naiveBayes(houses, "band", "rooms", "garden", "city");
    }

    @Test
    public void testJsonRoundTrip() {
        String json = model.toJson();
        NaiveBayesModel loaded = NaiveBayesModel.fromJson(json);

        Assert.assertEquals(loaded.getLabelField(), "band");
        Assert.assertEquals(loaded.getFeatureFields(), model.getFeatureFields());
        Assert.assertEquals(loaded.getTotalCount(), 5);
        Assert.assertEquals(loaded.getDistinctValueCounts(), model.getDistinctValueCounts());
        Assert.assertEquals(loaded.getLabels().size(), 3);

        Record query = Record.of("rooms", 4, "garden", true, "city", "Pisa");
        Assert.assertEquals(loaded.predict(query), model.predict(query));
        Assert.assertEquals(loaded.logScores(query), model.logScores(query));
        // json gives back ints, lookups still match the long values seen in training
        Assert.assertEquals(loaded.conditional("mid", "rooms", 3), model.conditional("mid", "rooms", 3L), 1e-12);
        Assert.assertEquals(loaded.conditional("high", "garden", true), 0.75d, 1e-12);
    }

    @Test
    public void testCanonicalValue() {
        Assert.assertEquals(NaiveBayesModel.canonicalValue(3), 3L);
        Assert.assertEquals(NaiveBayesModel.canonicalValue(2.0f), 2L);
        Assert.assertEquals(NaiveBayesModel.canonicalValue(Boolean.FALSE), Boolean.FALSE);
        Assert.assertEquals(NaiveBayesModel.canonicalValue('c'), "c");
        Assert.assertEquals(NaiveBayesModel.canonicalValue(LocalDate.of(2024, 1, 2)), "2024-01-02");
        Assert.assertEquals(NaiveBayesModel.canonicalValue(new Date(86400000L)), "1970-01-02T00:00:00Z");
        Assert.assertNull(NaiveBayesModel.canonicalValue(null));
    }

    @Test
    public void testDateFeatureSurvivesJson() {
        Dataset visits = Dataset.of(Record.of("day", new Date(0L), "outcome", "sale"),
                Record.of("day", new Date(0L), "outcome", "sale"),
                Record.of("day", new Date(86400000L), "outcome", "none"));
        NaiveBayesModel trained = ClassificationEngine.naiveBayes(visits, "outcome", "day");
        NaiveBayesModel loaded = NaiveBayesModel.fromJson(trained.toJson());

        Record query = Record.of("day", new Date(86400000L));
        Assert.assertEquals(loaded.predict(query), "none");
        Assert.assertEquals(loaded.logScores(query), trained.logScores(query));
    }

    @Test
    public void testLoadBrokenJson() {
        try {
            NaiveBayesModel.fromJson("{ not json");
            Assert.fail("broken json");
        } catch (TallyException e) {
            Assert.assertEquals(e.getError(), TallyErrorCode.ERROR_FAIL_TO_LOAD_MODEL);
        }
    }

}
