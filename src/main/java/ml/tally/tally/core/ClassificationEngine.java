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
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ml.tally.tally.container.Dataset;
import ml.tally.tally.container.Record;
import ml.tally.tally.core.model.NaiveBayesModel;
import ml.tally.tally.core.model.NaiveBayesModel.FeatureValueCount;
import ml.tally.tally.core.model.NaiveBayesModel.LabelStats;
import ml.tally.tally.exception.TallyErrorCode;
import ml.tally.tally.exception.TallyException;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trains supervised classifiers from labeled datasets.
 */
public final class ClassificationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ClassificationEngine.class);

    private ClassificationEngine() {
    }

    /**
     * Train a categorical Naive Bayes classifier in one pass. Records without a label are left out; absent feature
     * values are not counted. The distinct value count of a feature is taken over all labels.
     * 
     * @return the trained model, whose {@link NaiveBayesModel#predict(Record)} is the prediction function
     * @throws TallyException
     *             with {@link TallyErrorCode#ERROR_EMPTY_TRAINING_SET} if no record has a label
     */
    public static NaiveBayesModel naiveBayes(Dataset dataset, List<String> featureFields, String labelField) {
        if(StringUtils.isBlank(labelField)) {
            throw new TallyException(TallyErrorCode.ERROR_INVALID_ARGUMENT, "Label field should not be blank");
        }
        if(featureFields == null || featureFields.contains(null)) {
            throw new TallyException(TallyErrorCode.ERROR_INVALID_ARGUMENT, "Feature fields should not be null");
        }

        // label -> [count], label -> feature -> value -> [count]
        Map<Object, int[]> labelCounts = new LinkedHashMap<Object, int[]>();
        Map<Object, Map<String, Map<Object, int[]>>> valueCounts = new LinkedHashMap<Object, Map<String, Map<Object, int[]>>>();
        Map<String, Set<Object>> distinctValues = new LinkedHashMap<String, Set<Object>>();
        for(String feature: featureFields) {
            distinctValues.put(feature, new HashSet<Object>());
        }

        int total = 0;
        for(Record record: dataset) {
            Object label = NaiveBayesModel.canonicalValue(record.get(labelField));
            if(label == null) {
                continue;
            }
            total++;
            int[] labelCount = labelCounts.get(label);
            if(labelCount == null) {
                labelCount = new int[1];
                labelCounts.put(label, labelCount);
                valueCounts.put(label, new LinkedHashMap<String, Map<Object, int[]>>());
            }
            labelCount[0]++;

            Map<String, Map<Object, int[]>> features = valueCounts.get(label);
            for(String feature: featureFields) {
                Object value = NaiveBayesModel.canonicalValue(record.get(feature));
                if(value == null) {
                    continue;
                }
                distinctValues.get(feature).add(value);
                Map<Object, int[]> counts = features.get(feature);
                if(counts == null) {
                    counts = new LinkedHashMap<Object, int[]>();
                    features.put(feature, counts);
                }
                int[] count = counts.get(value);
                if(count == null) {
                    count = new int[1];
                    counts.put(value, count);
                }
                count[0]++;
            }
        }

        if(total == 0) {
            throw new TallyException(TallyErrorCode.ERROR_EMPTY_TRAINING_SET, "No record of " + dataset.size()
                    + " has label field " + labelField);
        }
        if(total < dataset.size()) {
            LOG.warn("Skip {} records without label {}", dataset.size() - total, labelField);
        }

        List<LabelStats> labels = new ArrayList<LabelStats>(labelCounts.size());
        for(Map.Entry<Object, int[]> entry: labelCounts.entrySet()) {
            List<FeatureValueCount> counts = new ArrayList<FeatureValueCount>();
            for(Map.Entry<String, Map<Object, int[]>> feature: valueCounts.get(entry.getKey()).entrySet()) {
                for(Map.Entry<Object, int[]> value: feature.getValue().entrySet()) {
                    counts.add(new FeatureValueCount(feature.getKey(), value.getKey(), value.getValue()[0]));
                }
            }
            labels.add(new LabelStats(entry.getKey(), entry.getValue()[0], counts));
        }
        Map<String, Integer> distinctValueCounts = new LinkedHashMap<String, Integer>();
        for(Map.Entry<String, Set<Object>> entry: distinctValues.entrySet()) {
            distinctValueCounts.put(entry.getKey(), entry.getValue().size());
        }

        LOG.info("Trained naive bayes on {} records: {} labels, {} features", total, labels.size(),
                featureFields.size());
        return new NaiveBayesModel(labelField, featureFields, total, labels, distinctValueCounts);
    }

    public static NaiveBayesModel naiveBayes(Dataset dataset, String labelField, String... featureFields) {
        return naiveBayes(dataset, Arrays.asList(featureFields), labelField);
    }

}
