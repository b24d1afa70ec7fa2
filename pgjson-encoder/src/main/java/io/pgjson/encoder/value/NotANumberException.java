/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.value;

import io.pgjson.PgJsonException;

/**
 * Raised when the text of a numeric column cannot be written as a JSON number.
 */
public class NotANumberException extends PgJsonException {

    private static final long serialVersionUID = 1L;

    private final String text;

    public NotANumberException(String text) {
        super(String.format("%s is not a number", text));
        this.text = text;
    }

    public String text() {
        return text;
    }
}
