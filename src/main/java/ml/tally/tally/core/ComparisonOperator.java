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
 * Operators of a group filter, see {@link GroupingEngine#having}. Comparison is exact on doubles.
 */
public enum ComparisonOperator {
    GT(">") {
        @Override
        public boolean test(double left, double right) {
            return left > right;
        }
    },
    LT("<") {
        @Override
        public boolean test(double left, double right) {
            return left < right;
        }
    },
    GE(">=") {
        @Override
        public boolean test(double left, double right) {
            return left >= right;
        }
    },
    LE("<=") {
        @Override
        public boolean test(double left, double right) {
            return left <= right;
        }
    },
    EQ("=") {
        @Override
        public boolean test(double left, double right) {
            return left == right;
        }
    },
    NE("!=") {
        @Override
        public boolean test(double left, double right) {
            return left != right;
        }
    };

    private final String symbol;

    private ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public abstract boolean test(double left, double right);

    public String getSymbol() {
        return symbol;
    }

    /**
     * @throws TallyException
     *             with {@link TallyErrorCode#ERROR_UNSUPPORTED_OPERATOR} for an unknown symbol
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        String trimmed = StringUtils.trimToEmpty(symbol);
        for(ComparisonOperator operator: values()) {
            if(operator.symbol.equals(trimmed)) {
                return operator;
            }
        }
        throw new TallyException(TallyErrorCode.ERROR_UNSUPPORTED_OPERATOR, "Un-support operator '" + symbol
                + "', make sure it is one of >, <, >=, <=, =, !=");
    }

}
