/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.tuple;

import java.util.Set;

import io.pgjson.annotation.ThreadSafe;
import io.pgjson.encoder.spi.Relation;
import io.pgjson.encoder.spi.ReplicaIdentity;
import io.pgjson.encoder.spi.RowChange;
import io.pgjson.encoder.spi.RowImage;

/**
 * Determines where the key of an update or delete comes from, based on the replica identity of the table.
 */
@ThreadSafe
public class ReplicaIdentityResolver {

    public enum KeySource {
        /**
         * Every column of the before-image is part of the key.
         */
        FULL_ROW,
        /**
         * The columns of the primary key or of the replica identity index form the key.
         */
        INDEX_COLUMNS,
        /**
         * No key can be derived; updates and deletes of the table cannot be written.
         */
        NONE
    }

    /**
     * The row image a key is read from and the columns it is restricted to.
     */
    public static final class Identity {
        private final RowImage row;
        private final Set<String> keyColumns;

        Identity(RowImage row, Set<String> keyColumns) {
            this.row = row;
            this.keyColumns = keyColumns;
        }

        public RowImage row() {
            return row;
        }

        /**
         * @return the key column names, or {@code null} if every column of the row is used
         */
        public Set<String> keyColumns() {
            return keyColumns;
        }
    }

    public KeySource resolve(Relation relation) {
        if (relation.replicaIdentity() == ReplicaIdentity.FULL) {
            return KeySource.FULL_ROW;
        }
        if (relation.replicaIdentity() != ReplicaIdentity.NOTHING && relation.hasIdentityIndex()) {
            return KeySource.INDEX_COLUMNS;
        }
        return KeySource.NONE;
    }

    /**
     * Select the key of a change. An update that carries its old row uses that row as is; otherwise the key is
     * taken from the new row (updates) or the old row (deletes), restricted to the index columns when the table has
     * an identity index.
     *
     * @return the identity, or {@code null} for inserts and for tables without a usable replica identity
     */
    public Identity identityOf(Relation relation, RowChange change) {
        final KeySource source = resolve(relation);
        if (source == KeySource.NONE) {
            return null;
        }
        final Set<String> keyColumns = source == KeySource.INDEX_COLUMNS ? relation.identityIndexColumns() : null;
        switch (change.operation()) {
            case UPDATE:
                if (change.oldRow() != null) {
                    return new Identity(change.oldRow(), null);
                }
                return new Identity(change.newRow(), keyColumns);
            case DELETE:
                return new Identity(change.oldRow(), keyColumns);
            default:
                return null;
        }
    }
}
