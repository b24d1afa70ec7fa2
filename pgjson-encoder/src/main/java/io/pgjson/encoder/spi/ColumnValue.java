/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.spi;

import java.util.Objects;

import io.pgjson.annotation.Immutable;

/**
 * The value of one column within a row image: the text produced by the type's output function, {@code null}, or
 * the marker for a TOASTed value that did not change and therefore was not logged.
 */
@Immutable
public final class ColumnValue {

    private final ColumnDescriptor column;
    private final String text;
    private final boolean unchangedToast;

    private ColumnValue(ColumnDescriptor column, String text, boolean unchangedToast) {
        this.column = Objects.requireNonNull(column);
        this.text = text;
        this.unchangedToast = unchangedToast;
    }

    public static ColumnValue of(ColumnDescriptor column, String text) {
        return new ColumnValue(column, text, false);
    }

    public static ColumnValue nullValue(ColumnDescriptor column) {
        return new ColumnValue(column, null, false);
    }

    public static ColumnValue unchangedToast(ColumnDescriptor column) {
        return new ColumnValue(column, null, true);
    }

    public ColumnDescriptor column() {
        return column;
    }

    /**
     * @return the textual value, or {@code null} for SQL NULL and unchanged TOAST values
     */
    public String text() {
        return text;
    }

    public boolean isNull() {
        return text == null && !unchangedToast;
    }

    public boolean isUnchangedToast() {
        return unchangedToast;
    }

    @Override
    public String toString() {
        return column.name() + "=" + (unchangedToast ? "<unchanged toast>" : text);
    }
}
