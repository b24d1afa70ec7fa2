/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.spi;

/**
 * The replica identity of a table, as stored in {@code pg_class.relreplident}.
 */
public enum ReplicaIdentity {
    NOTHING("n", "UPDATE and DELETE events will not contain any old values"),
    FULL("f", "UPDATE and DELETE events will contain the previous values of all the columns"),
    DEFAULT("d", "UPDATE and DELETE events will contain previous values only for PK columns"),
    INDEX("i", "UPDATE and DELETE events will contain previous values only for columns present in the REPLICA IDENTITY index");

    private final String code;
    private final String description;

    ReplicaIdentity(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String code() {
        return code;
    }

    public String description() {
        return description;
    }

    /**
     * Parse the catalog code ({@code d}, {@code n}, {@code f}, {@code i}) or the name of a replica identity.
     *
     * @param value the code or name; may be null
     * @return the replica identity; never null
     * @throws IllegalArgumentException if the value is neither a known code nor a known name
     */
    public static ReplicaIdentity parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Replica identity must not be null");
        }
        final String trimmed = value.trim();
        for (ReplicaIdentity identity : values()) {
            if (identity.code.equalsIgnoreCase(trimmed) || identity.name().equalsIgnoreCase(trimmed)) {
                return identity;
            }
        }
        throw new IllegalArgumentException("Unknown replica identity '" + value + "'");
    }
}
