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

import ml.tally.tally.exception.TallyErrorCode;
import ml.tally.tally.exception.TallyException;

import org.apache.commons.lang.StringUtils;

/**
 * Aggregations over the values of one field within a group.
 */
public enum AggregationType {
    SUM("sum", true), AVG("avg", true), MIN("min", true), MAX("max", true),
    /**
     * number of records in the group, whatever the field holds
     */
    COUNT("count", false),
    /**
     * number of valid numeric values of the field in the group
     */
    COUNT_VALID("countValid", false);

    private final String name;

    private final boolean numeric;

    private AggregationType(String name, boolean numeric) {
        this.name = name;
        this.numeric = numeric;
    }

    public String getName() {
        return name;
    }

    /**
     * @return true if the aggregation needs a numeric field
     */
    public boolean isNumeric() {
        return numeric;
    }

    public static AggregationType of(String name) {
        for(AggregationType type: values()) {
            if(type.name.equalsIgnoreCase(StringUtils.trimToEmpty(name))) {
                return type;
            }
        }
        throw new TallyException(TallyErrorCode.ERROR_UNSUPPORTED_AGGREGATION, "Un-support aggregation " + name);
    }

    /**
     * Aggregate of the valid values of a group holding groupSize records.
     */
    public double compute(BasicStatsCalculator stats, int groupSize) {
        switch(this) {
            case SUM:
                return stats.getSum();
            case AVG:
                return stats.getMean();
            case MIN:
                return stats.getMin();
            case MAX:
                return stats.getMax();
            case COUNT:
                return groupSize;
            case COUNT_VALID:
                return stats.getCount();
            default:
                throw new IllegalStateException("Unknown aggregation " + this);
        }
    }

    @Override
    public String toString() {
        return name;
    }

}
