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
 * TallyException, contain error code. Raised for configuration errors, which are deterministic given the call
 * arguments; degenerate numeric results are returned as NaN instead.
 */
public class TallyException extends RuntimeException {

    private static final long serialVersionUID = -2864117319352051903L;

    /**
     * error code
     */
    private final TallyErrorCode error;

    public TallyException(TallyErrorCode code) {
        super(code.getDescription());
        this.error = code;
    }

    public TallyException(TallyErrorCode code, Exception e) {
        super(code.getDescription(), e);
        this.error = code;
    }

    public TallyException(TallyErrorCode code, String msg) {
        super(msg);
        this.error = code;
    }

    public TallyException(TallyErrorCode code, Exception e, String msg) {
        super(msg, e);
        this.error = code;
    }

    public TallyErrorCode getError() {
        return error;
    }

    @Override
    public String toString() {
        return "TallyException [error=" + error + ", message=" + getMessage() + "]";
    }

}
