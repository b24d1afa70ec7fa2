/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.tuple;

import io.pgjson.annotation.Immutable;

/**
 * A column that made it into the output, with its value already rendered as a JSON literal.
 */
@Immutable
public final class ProjectedColumn {

    private final String name;
    private final String typeName;
    private final int typeOid;
    private final boolean notNull;
    private final String literal;

    public ProjectedColumn(String name, String typeName, int typeOid, boolean notNull, String literal) {
        this.name = name;
        this.typeName = typeName;
        this.typeOid = typeOid;
        this.notNull = notNull;
        this.literal = literal;
    }

    public String name() {
        return name;
    }

    /**
     * @return the type name, with modifiers when those were requested
     */
    public String typeName() {
        return typeName;
    }

    public int typeOid() {
        return typeOid;
    }

    public boolean isNotNull() {
        return notNull;
    }

    /**
     * @return the JSON literal of the value: a number, {@code true}, {@code false}, {@code null} or a quoted string
     */
    public String literal() {
        return literal;
    }

    @Override
    public String toString() {
        return name + " " + typeName + " = " + literal;
    }
}
