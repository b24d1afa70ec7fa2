/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.filter;

import io.pgjson.config.InvalidConfigurationException;

/**
 * Raised when a table pattern given in the options is not a valid regular expression.
 */
public class InvalidPatternException extends InvalidConfigurationException {

    private static final long serialVersionUID = 1L;

    private final String pattern;

    public InvalidPatternException(String pattern, Throwable cause) {
        super(String.format("invalid regular expression \"%s\": %s", pattern, cause.getMessage()));
        initCause(cause);
        this.pattern = pattern;
    }

    public String pattern() {
        return pattern;
    }
}
