/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.pgjson.annotation.Immutable;
import io.pgjson.util.Strings;

/**
 * A {@code schema.table} selector entry where either part may be the {@code *} wildcard.
 */
@Immutable
public final class SelectTable {

    private static final String WILDCARD = "*";
    private static final char LIST_SEPARATOR = ',';
    private static final char NAME_SEPARATOR = '.';

    public static final SelectTable ALL = new SelectTable(null, null);

    private final String schemaName;
    private final String tableName;

    private SelectTable(String schemaName, String tableName) {
        this.schemaName = schemaName;
        this.tableName = tableName;
    }

    /**
     * @param schemaName the schema, or {@code null} for every schema
     * @param tableName the table, or {@code null} for every table
     */
    public static SelectTable of(String schemaName, String tableName) {
        return new SelectTable(schemaName, tableName);
    }

    /**
     * Parse a comma separated list of {@code schema.table} entries. Whitespace around entries is ignored, an unescaped
     * {@code *} standing for a whole part is a wildcard, and a backslash makes the next character ({@code .},
     * {@code *}, {@code ,} or whitespace) literal.
     *
     * @param value the list; may be null or blank
     * @return the entries in order; never null
     * @throws IllegalArgumentException if an entry is empty or has no schema separator
     */
    public static List<SelectTable> parseList(String value) {
        final List<SelectTable> tables = new ArrayList<>();
        for (String item : Strings.splitEscaped(value, LIST_SEPARATOR)) {
            tables.add(parse(item));
        }
        return Collections.unmodifiableList(tables);
    }

    /**
     * Parse one escaped {@code schema.table} entry.
     */
    static SelectTable parse(String item) {
        int separator = -1;
        for (int i = 0; i < item.length(); i++) {
            char c = item.charAt(i);
            if (c == '\\') {
                i++;
            }
            else if (c == NAME_SEPARATOR) {
                separator = i;
                break;
            }
        }
        if (separator < 0) {
            throw new IllegalArgumentException("Table '" + item + "' must be qualified with a schema name");
        }
        String schema = item.substring(0, separator);
        String table = item.substring(separator + 1);
        if (schema.isEmpty() || table.isEmpty()) {
            throw new IllegalArgumentException("Table '" + item + "' has an empty schema or table name");
        }
        return new SelectTable(WILDCARD.equals(schema) ? null : Strings.unescape(schema),
                WILDCARD.equals(table) ? null : Strings.unescape(table));
    }

    public boolean matches(String schema, String table) {
        return (schemaName == null || schemaName.equals(schema))
                && (tableName == null || tableName.equals(table));
    }

    public boolean isAllSchemas() {
        return schemaName == null;
    }

    public boolean isAllTables() {
        return tableName == null;
    }

    /**
     * @return the schema name, or {@code null} if the entry selects every schema
     */
    public String schemaName() {
        return schemaName;
    }

    /**
     * @return the table name, or {@code null} if the entry selects every table
     */
    public String tableName() {
        return tableName;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SelectTable)) {
            return false;
        }
        SelectTable other = (SelectTable) obj;
        return Objects.equals(schemaName, other.schemaName) && Objects.equals(tableName, other.tableName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaName, tableName);
    }

    @Override
    public String toString() {
        return (schemaName == null ? WILDCARD : schemaName) + NAME_SEPARATOR + (tableName == null ? WILDCARD : tableName);
    }
}
