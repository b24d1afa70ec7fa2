/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.spi;

/**
 * The kind of row-level change.
 */
public enum Operation {
    INSERT("insert", "I"),
    UPDATE("update", "U"),
    DELETE("delete", "D");

    private final String kind;
    private final String action;

    Operation(String kind, String action) {
        this.kind = kind;
        this.action = action;
    }

    /**
     * @return the name used by the transaction-enveloped format
     */
    public String kind() {
        return kind;
    }

    /**
     * @return the one-letter tag used by the streaming format
     */
    public String action() {
        return action;
    }
}
