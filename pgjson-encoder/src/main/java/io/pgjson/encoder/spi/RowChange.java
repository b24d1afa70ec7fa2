/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.spi;

import java.util.Objects;

import org.postgresql.replication.LogSequenceNumber;

/**
 * A single row-level change with whatever row images the server logged for it. The old image is only present
 * when the replica identity requires it or a key column changed; the new image is missing for deletes.
 */
public final class RowChange {

    private final Operation operation;
    private final RowImage oldRow;
    private final RowImage newRow;
    private final LogSequenceNumber lsn;

    private RowChange(Operation operation, RowImage oldRow, RowImage newRow, LogSequenceNumber lsn) {
        this.operation = Objects.requireNonNull(operation);
        this.oldRow = oldRow;
        this.newRow = newRow;
        this.lsn = lsn != null ? lsn : LogSequenceNumber.INVALID_LSN;
    }

    public static RowChange insert(RowImage newRow) {
        return new RowChange(Operation.INSERT, null, newRow, null);
    }

    public static RowChange update(RowImage oldRow, RowImage newRow) {
        return new RowChange(Operation.UPDATE, oldRow, newRow, null);
    }

    public static RowChange delete(RowImage oldRow) {
        return new RowChange(Operation.DELETE, oldRow, null, null);
    }

    /**
     * @return a copy of this change positioned at the given WAL location
     */
    public RowChange at(LogSequenceNumber lsn) {
        return new RowChange(operation, oldRow, newRow, lsn);
    }

    public Operation operation() {
        return operation;
    }

    /**
     * @return the before image, or {@code null} if none was logged
     */
    public RowImage oldRow() {
        return oldRow;
    }

    /**
     * @return the after image, or {@code null} for deletes
     */
    public RowImage newRow() {
        return newRow;
    }

    public LogSequenceNumber lsn() {
        return lsn;
    }

    @Override
    public String toString() {
        return operation + " at " + lsn.asString();
    }
}
