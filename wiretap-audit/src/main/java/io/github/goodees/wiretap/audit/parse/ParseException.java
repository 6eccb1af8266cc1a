package io.github.goodees.wiretap.audit.parse;

/*-
 * #%L
 * wiretap
 * %%
 * Copyright (C) 2026 The Wiretap Authors
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

/**
 * Request body could not be parsed.
 */
public class ParseException extends Exception {
    private final Fault fault;

    public enum Fault {
        INVALID_ENCODING,
        INVALID_JSON,
        MISSING_FIELD,
        INVALID_FIELD_VALUE,
        UNKNOWN_FORMAT
    }

    protected ParseException(Fault fault, String message, Throwable cause) {
        super(message, cause);
        this.fault = fault;
    }

    public Fault getFault() {
        return fault;
    }

    public static ParseException invalidEncoding(Throwable cause) {
        return new ParseException(Fault.INVALID_ENCODING, "Body is not valid UTF-8", cause);
    }

    public static ParseException invalidJson(Throwable cause) {
        return new ParseException(Fault.INVALID_JSON, "Invalid JSON: " + cause.getMessage(), cause);
    }

    public static ParseException missingField(String field) {
        return new ParseException(Fault.MISSING_FIELD, "Missing required field: " + field, null);
    }

    public static ParseException invalidFieldValue(String field, String problem) {
        return new ParseException(Fault.INVALID_FIELD_VALUE, "Invalid value of field " + field + ": " + problem,
                null);
    }

    public static ParseException unknownFormat(String uri) {
        return new ParseException(Fault.UNKNOWN_FORMAT, "Unknown request format for " + uri, null);
    }
}
