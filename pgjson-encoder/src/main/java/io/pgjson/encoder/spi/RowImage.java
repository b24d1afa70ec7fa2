/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.spi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * One version of a row (before or after the change) in row-descriptor order. Instances are only valid for the
 * duration of the callback that supplied them.
 */
public final class RowImage implements Iterable<ColumnValue> {

    private final List<ColumnValue> values;

    private RowImage(List<ColumnValue> values) {
        this.values = Collections.unmodifiableList(values);
    }

    public static RowImage of(List<ColumnValue> values) {
        return new RowImage(new ArrayList<>(values));
    }

    /**
     * Start a row image for the given relation; columns that are not given a value are {@code null}.
     */
    public static Builder builder(Relation relation) {
        return new Builder(relation);
    }

    public List<ColumnValue> values() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public Iterator<ColumnValue> iterator() {
        return values.iterator();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static final class Builder {
        private final Relation relation;
        private final Map<String, ColumnValue> valuesByName = new HashMap<>();

        private Builder(Relation relation) {
            this.relation = relation;
        }

        public Builder value(String columnName, String text) {
            valuesByName.put(columnName, ColumnValue.of(column(columnName), text));
            return this;
        }

        public Builder nullValue(String columnName) {
            valuesByName.put(columnName, ColumnValue.nullValue(column(columnName)));
            return this;
        }

        public Builder unchangedToast(String columnName) {
            valuesByName.put(columnName, ColumnValue.unchangedToast(column(columnName)));
            return this;
        }

        private ColumnDescriptor column(String columnName) {
            for (ColumnDescriptor column : relation.columns()) {
                if (column.name().equals(columnName)) {
                    return column;
                }
            }
            throw new IllegalArgumentException("Relation " + relation + " has no column '" + columnName + "'");
        }

        public RowImage build() {
            List<ColumnValue> values = new ArrayList<>(relation.columns().size());
            for (ColumnDescriptor column : relation.columns()) {
                ColumnValue value = valuesByName.get(column.name());
                values.add(value != null ? value : ColumnValue.nullValue(column));
            }
            return new RowImage(values);
        }
    }
}
