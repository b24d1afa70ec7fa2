/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.tuple;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgjson.annotation.ThreadSafe;
import io.pgjson.encoder.spi.ColumnDescriptor;
import io.pgjson.encoder.spi.ColumnValue;
import io.pgjson.encoder.spi.RowImage;
import io.pgjson.encoder.types.CatalogLookupException;
import io.pgjson.encoder.types.PostgresType;
import io.pgjson.encoder.types.TypeRegistry;
import io.pgjson.encoder.value.JsonStrings;
import io.pgjson.encoder.value.ValueEncoder;

/**
 * Turns a row image into the list of columns that are written, in row order. Dropped and system columns never appear.
 */
@ThreadSafe
public class TupleProjector {

    private static final Logger LOGGER = LoggerFactory.getLogger(TupleProjector.class);

    private final TypeRegistry typeRegistry;
    private final boolean includeTypeModifiers;
    private final boolean includeUnchangedToast;
    private final String unchangedToastLiteral;

    /**
     * @param typeRegistry the catalog used to name column types
     * @param includeTypeModifiers whether type names carry their modifiers, e.g. {@code character varying(255)}
     * @param includeUnchangedToast whether unchanged TOAST columns are written with the placeholder
     * @param unchangedToastPlaceholder the text written for unchanged TOAST columns
     */
    public TupleProjector(TypeRegistry typeRegistry, boolean includeTypeModifiers, boolean includeUnchangedToast,
                          String unchangedToastPlaceholder) {
        this.typeRegistry = typeRegistry;
        this.includeTypeModifiers = includeTypeModifiers;
        this.includeUnchangedToast = includeUnchangedToast;
        this.unchangedToastLiteral = JsonStrings.quote(unchangedToastPlaceholder);
    }

    /**
     * Project all columns of a row. Null values are kept; unchanged TOAST values are skipped unless they were
     * requested.
     *
     * @throws CatalogLookupException if the type of a column is unknown
     */
    public List<ProjectedColumn> projectColumns(RowImage row) {
        return project(row, null, false);
    }

    /**
     * Project the identity of a row. Null values and unchanged TOAST values are always skipped.
     *
     * @param row the row image
     * @param keyColumns the names of the columns that form the key, or {@code null} when every column does
     * @throws CatalogLookupException if the type of a column is unknown
     */
    public List<ProjectedColumn> projectIdentity(RowImage row, Set<String> keyColumns) {
        return project(row, keyColumns, true);
    }

    private List<ProjectedColumn> project(RowImage row, Set<String> keyColumns, boolean identity) {
        if (row == null) {
            return Collections.emptyList();
        }
        final List<ProjectedColumn> columns = new ArrayList<>(row.size());
        for (ColumnValue value : row) {
            final ColumnDescriptor column = value.column();
            if (column.isDropped() || column.isSystem()) {
                continue;
            }
            if (keyColumns != null && !keyColumns.contains(column.name())) {
                continue;
            }
            final PostgresType type = typeRegistry.get(column.typeOid());
            if (identity && value.isNull()) {
                continue;
            }
            final String literal;
            if (value.isUnchangedToast()) {
                if (identity || !includeUnchangedToast) {
                    LOGGER.debug("Column '{}' has an unchanged TOAST value and is excluded", column.name());
                    continue;
                }
                literal = unchangedToastLiteral;
            }
            else {
                literal = ValueEncoder.encode(type, value.text());
            }
            columns.add(new ProjectedColumn(column.name(), typeName(type, column), column.typeOid(), column.isNotNull(), literal));
        }
        return columns;
    }

    private String typeName(PostgresType type, ColumnDescriptor column) {
        return includeTypeModifiers ? type.format(column.typeModifier()) : type.getName();
    }
}
