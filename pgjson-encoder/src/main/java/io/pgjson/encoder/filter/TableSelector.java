/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.filter;

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgjson.annotation.Immutable;
import io.pgjson.encoder.spi.Relation;

/**
 * Selects tables by schema and name using a list of excluded entries and a list of added entries. An excluded entry
 * always wins; when entries were added, only those tables are selected.
 */
@Immutable
public final class TableSelector implements TableFilter {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableSelector.class);

    private final List<SelectTable> filterTables;
    private final List<SelectTable> addTables;

    public TableSelector(List<SelectTable> filterTables, List<SelectTable> addTables) {
        this.filterTables = filterTables != null ? filterTables : Collections.emptyList();
        this.addTables = addTables != null ? addTables : Collections.emptyList();
    }

    /**
     * A selector that excludes nothing and adds every table.
     */
    public static TableSelector all() {
        return new TableSelector(Collections.emptyList(), Collections.singletonList(SelectTable.ALL));
    }

    public boolean shouldProcess(String schema, String table) {
        for (SelectTable entry : filterTables) {
            if (entry.matches(schema, table)) {
                LOGGER.trace("Table \"{}\".\"{}\" was filtered out by '{}'", schema, table, entry);
                return false;
            }
        }
        if (addTables.isEmpty()) {
            return true;
        }
        for (SelectTable entry : addTables) {
            if (entry.matches(schema, table)) {
                return true;
            }
        }
        LOGGER.trace("Table \"{}\".\"{}\" was not added", schema, table);
        return false;
    }

    @Override
    public boolean isIncluded(Relation relation) {
        return shouldProcess(relation.schema(), relation.name());
    }

    public List<SelectTable> filterTables() {
        return filterTables;
    }

    public List<SelectTable> addTables() {
        return addTables;
    }
}
