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
package ml.tally.tally.util;

/**
 * Global constants class
 */
public interface Constants {

    public static final String TALLY_CONFIG_FILE_NAME = "tallyconfig";

    public static final String TALLY_DEFAULT_PROPERTIES = "tally-default.properties";

    /**
     * Keys of {@link Environment}
     */
    public static final String OUTLIER_THRESHOLD = "outlierThreshold";
    public static final String TIME_ZONE = "timeZone";
    public static final String ENTROPY_BINS = "entropyBins";

    public static final double DEFAULT_OUTLIER_THRESHOLD = 2.0d;
    public static final String DEFAULT_TIME_ZONE = "UTC";
    public static final int DEFAULT_ENTROPY_BINS = 10;

    /**
     * Separator of composite keys built by multi-field grouping.
     */
    public static final String GROUP_KEY_SEPARATOR = "::";

    /**
     * Field names of flattened results.
     */
    public static final String KEY = "key";
    public static final String FIELD = "field";
    public static final String ROW = "row";
    public static final String VALUE = "value";
    public static final String DATE = "date";
    public static final String POPULATION = "population";
    public static final String SAMPLE = "sample";
    public static final String REAL = "real";
    public static final String IMAGINARY = "imaginary";

}
