/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.types;

/**
 * How the textual output of a type is rendered as a JSON literal.
 */
public enum ValueKind {
    /**
     * Integers, floating point and arbitrary precision numbers; written unquoted.
     */
    NUMBER,
    /**
     * {@code t}/{@code f}; written as {@code true}/{@code false}.
     */
    BOOLEAN,
    /**
     * {@code bytea} in hex format; written as a string without the {@code \x} prefix.
     */
    BINARY,
    /**
     * Everything else; written as a string.
     */
    TEXT
}
