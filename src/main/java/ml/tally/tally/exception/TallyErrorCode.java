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
package ml.tally.tally.exception;

/**
 * Tally error code
 */
public enum TallyErrorCode {
    /**
     * Configuration Error 400 ~ 500
     */
    ERROR_TALLY_CONFIG(400, "Errors happen when loading tallyconfig"),

    /*
     * Call argument errors: 1101 - 1150
     */
    ERROR_UNSUPPORTED_OPERATOR(1101, "Un-support comparison operator, make sure it is one of >, <, >=, <=, =, !="), ERROR_NON_NUMERIC_FIELD(
            1102, "The field holds no numeric value but a numeric operation is requested"), ERROR_UNSUPPORTED_AGGREGATION(
            1103, "Un-support aggregation for this operation"), ERROR_UNSUPPORTED_GROUP_KEY(1104,
            "Group key must be a number, string, boolean, date or absent"), ERROR_INVALID_ARGUMENT(1105,
            "Invalid argument for the analytic operation"),

    /*
     * model 1201 - 1250
     */
    ERROR_EMPTY_TRAINING_SET(1201, "The training dataset has no labeled record"), ERROR_FAIL_TO_LOAD_MODEL(1202,
            "Fail to load the model json"), ERROR_FAIL_TO_WRITE_MODEL(1203, "Fail to write the model json");

    /**
     * code
     */
    private final int code;

    /**
     * description
     */
    private final String description;

    /**
     * Constructor, not public
     * 
     * @param code
     *            the code
     * @param description
     *            the description
     */
    private TallyErrorCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    /**
     * description getter
     * 
     * @return description
     */
    public String getDescription() {
        return description;
    }

    /**
     * code getter
     * 
     * @return code
     */
    public int getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code + ": " + description;
    }

}
