/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.spi;

import java.util.Objects;

import io.pgjson.annotation.Immutable;

/**
 * The definition of one attribute of a relation, as described by {@code pg_attribute}.
 */
@Immutable
public final class ColumnDescriptor {

    public static final int NO_TYPE_MODIFIER = -1;

    private final String name;
    private final int typeOid;
    private final int typeModifier;
    private final boolean notNull;
    private final boolean dropped;
    private final int attributeNumber;

    private ColumnDescriptor(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "The column name is required");
        this.typeOid = builder.typeOid;
        this.typeModifier = builder.typeModifier;
        this.notNull = builder.notNull;
        this.dropped = builder.dropped;
        this.attributeNumber = builder.attributeNumber;
    }

    public static Builder builder(String name, int typeOid) {
        return new Builder(name, typeOid);
    }

    public String name() {
        return name;
    }

    public int typeOid() {
        return typeOid;
    }

    /**
     * @return the type modifier ({@code atttypmod}), or {@link #NO_TYPE_MODIFIER} if there is none
     */
    public int typeModifier() {
        return typeModifier;
    }

    public boolean isNotNull() {
        return notNull;
    }

    public boolean isDropped() {
        return dropped;
    }

    /**
     * System columns such as {@code ctid} have negative attribute numbers.
     */
    public boolean isSystem() {
        return attributeNumber < 0;
    }

    public int attributeNumber() {
        return attributeNumber;
    }

    @Override
    public String toString() {
        return name + " (oid=" + typeOid + ", typmod=" + typeModifier + (notNull ? ", not null" : "") + (dropped ? ", dropped" : "")
                + ", attnum=" + attributeNumber + ")";
    }

    public static final class Builder {
        private final String name;
        private final int typeOid;
        private int typeModifier = NO_TYPE_MODIFIER;
        private boolean notNull;
        private boolean dropped;
        private int attributeNumber = 1;

        private Builder(String name, int typeOid) {
            this.name = name;
            this.typeOid = typeOid;
        }

        public Builder typeModifier(int typeModifier) {
            this.typeModifier = typeModifier;
            return this;
        }

        public Builder notNull(boolean notNull) {
            this.notNull = notNull;
            return this;
        }

        public Builder dropped(boolean dropped) {
            this.dropped = dropped;
            return this;
        }

        public Builder attributeNumber(int attributeNumber) {
            this.attributeNumber = attributeNumber;
            return this;
        }

        public ColumnDescriptor build() {
            return new ColumnDescriptor(this);
        }
    }
}
