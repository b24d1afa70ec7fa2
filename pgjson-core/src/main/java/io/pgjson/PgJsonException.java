/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson;

/**
 * Base exception raised by the change-event encoder and its configuration layer.
 */
public class PgJsonException extends RuntimeException {

    private static final long serialVersionUID = 3094752031857316289L;

    public PgJsonException() {
    }

    public PgJsonException(String message) {
        super(message);
    }

    public PgJsonException(Throwable cause) {
        super(cause);
    }

    public PgJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
