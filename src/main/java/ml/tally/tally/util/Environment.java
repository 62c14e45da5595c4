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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.ZoneId;
import java.util.Properties;

import ml.tally.tally.exception.TallyErrorCode;
import ml.tally.tally.exception.TallyException;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Environment} is used to store common settings like the default outlier threshold and return to user by
 * calling {@link #getProperty(String)} method
 */
public class Environment {

    public static final String TALLY_HOME = "TALLY_HOME";

    private static Logger logger = LoggerFactory.getLogger(Environment.class);
    private static Properties properties = new Properties();

    static {
        String tallyHomePath = ((System.getenv(TALLY_HOME) == null) ? System.getProperty(TALLY_HOME) : System
                .getenv(TALLY_HOME));
        properties.put(TALLY_HOME, ((tallyHomePath == null) ? "" : tallyHomePath));

        try {
            loadTallyConfig();
        } catch (IOException e) {
            throw new TallyException(TallyErrorCode.ERROR_TALLY_CONFIG, e);
        }
    }

    /*
     * Load properties from
     * 1. classpath tally-default.properties
     * 2. ${TALLY_HOME}/conf/tallyconfig
     * 3. /etc/tallyconfig
     * 4. ~/.tallyconfig
     * 
     * Provide function to reload
     */
    public static void loadTallyConfig() throws IOException {
        loadClasspathProperties(properties, Constants.TALLY_DEFAULT_PROPERTIES);

        loadProperties(properties, getProperty(TALLY_HOME) + File.separator + "conf" + File.separator
                + Constants.TALLY_CONFIG_FILE_NAME);

        loadProperties(properties, File.separator + "etc" + File.separator + Constants.TALLY_CONFIG_FILE_NAME);

        String userHome = System.getProperty("user.home");
        loadProperties(properties, userHome + File.separator + "." + Constants.TALLY_CONFIG_FILE_NAME);
    }

    /*
     * Get global property by property name
     */
    public static String getProperty(String propertyName) {
        return properties.getProperty(propertyName);
    }

    public static void setProperty(String propertyName, String propertyValue) {
        properties.put(propertyName, propertyValue);
    }

    /*
     * Get property, if null return default value
     */
    public static String getProperty(String propertyName, String defValue) {
        String propertyValue = getProperty(propertyName);
        return (propertyValue == null) ? defValue : propertyValue;
    }

    /*
     * Get property as Integer value, if blank or malformed return default value
     */
    public static Integer getInt(String propertyName, Integer defValue) {
        String propertyValue = getProperty(propertyName);
        if(StringUtils.isBlank(propertyValue)) {
            return defValue;
        }
        try {
            return Integer.valueOf(propertyValue.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignore malformed int property {}={}", propertyName, propertyValue);
            return defValue;
        }
    }

    /*
     * Get property as Double value, if blank or malformed return default value
     */
    public static Double getDouble(String propertyName, Double defValue) {
        String propertyValue = getProperty(propertyName);
        if(StringUtils.isBlank(propertyValue)) {
            return defValue;
        }
        try {
            return Double.valueOf(propertyValue.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignore malformed double property {}={}", propertyName, propertyValue);
            return defValue;
        }
    }

    public static double getOutlierThreshold() {
        return getDouble(Constants.OUTLIER_THRESHOLD, Constants.DEFAULT_OUTLIER_THRESHOLD);
    }

    public static int getEntropyBins() {
        return getInt(Constants.ENTROPY_BINS, Constants.DEFAULT_ENTROPY_BINS);
    }

    /**
     * Zone used to turn instants into calendar dates, falls back to UTC on an unknown zone id.
     * 
     * @return the configured zone
     */
    public static ZoneId getTimeZone() {
        String zone = StringUtils.trimToEmpty(getProperty(Constants.TIME_ZONE, Constants.DEFAULT_TIME_ZONE));
        try {
            return ZoneId.of(zone);
        } catch (RuntimeException e) {
            logger.warn("Ignore unknown time zone {}, use {}", zone, Constants.DEFAULT_TIME_ZONE);
            return ZoneId.of(Constants.DEFAULT_TIME_ZONE);
        }
    }

    /*
     * Load tallyconfig into properties
     */
    private static void loadProperties(Properties props, String fileName) throws IOException {
        File configFile = new File(fileName);
        if(!configFile.exists()) {
            return;
        }

        FileInputStream inStream = null;
        try {
            inStream = new FileInputStream(configFile);
            props.load(inStream);
            logger.debug("Loaded tally config from {}", fileName);
        } finally {
            IOUtils.closeQuietly(inStream);
        }
    }

    private static void loadClasspathProperties(Properties props, String resource) throws IOException {
        InputStream inStream = Environment.class.getClassLoader().getResourceAsStream(resource);
        if(inStream == null) {
            return;
        }

        try {
            props.load(inStream);
        } finally {
            IOUtils.closeQuietly(inStream);
        }
    }

}
