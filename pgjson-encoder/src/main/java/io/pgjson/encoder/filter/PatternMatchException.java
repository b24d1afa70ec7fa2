/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.filter;

import io.pgjson.PgJsonException;

/**
 * Raised when evaluating a compiled pattern fails for a reason other than the candidate not matching.
 */
public class PatternMatchException extends PgJsonException {

    private static final long serialVersionUID = 1L;

    private final String candidate;

    public PatternMatchException(String candidate, Throwable cause) {
        super(String.format("regular expression match for \"%s\" failed: %s", candidate, cause.getMessage()), cause);
        this.candidate = candidate;
    }

    public String candidate() {
        return candidate;
    }
}
