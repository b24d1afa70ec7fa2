/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.format;

import java.util.List;

import io.pgjson.encoder.JsonEncoderConfig;
import io.pgjson.encoder.spi.LogicalMessage;
import io.pgjson.encoder.spi.OutputSink;
import io.pgjson.encoder.spi.Relation;
import io.pgjson.encoder.spi.RowChange;
import io.pgjson.encoder.spi.TransactionInfo;
import io.pgjson.encoder.tuple.ProjectedColumn;

/**
 * Writes transactions, changes and messages in one output format. A framer moves from idle to an open transaction at
 * {@link #beginTransaction(TransactionInfo)} and back at {@link #commitTransaction(TransactionInfo)}; changes and
 * transactional messages are only accepted while a transaction is open, non-transactional messages at any time.
 */
public interface Framer {

    /**
     * Create the framer for the format version of the given configuration.
     */
    static Framer create(JsonEncoderConfig config, OutputSink sink) {
        switch (config.formatVersion()) {
            case 1:
                return new EnvelopedFramer(config, sink);
            case 2:
                return new StreamingFramer(config, sink);
            default:
                throw new IllegalArgumentException("Unsupported format version " + config.formatVersion());
        }
    }

    void beginTransaction(TransactionInfo transaction);

    /**
     * Write one change.
     *
     * @param transaction the enclosing transaction
     * @param relation the changed table
     * @param change the change
     * @param columns the projected new row, or {@code null} for deletes
     * @param identity the projected key, or {@code null} for inserts
     * @param buffer the buffer to encode into
     */
    void change(TransactionInfo transaction, Relation relation, RowChange change, List<ProjectedColumn> columns,
                List<ProjectedColumn> identity, StringBuilder buffer);

    /**
     * Write one logical decoding message.
     *
     * @param transaction the enclosing transaction, or {@code null} for non-transactional messages
     * @param message the message
     * @param buffer the buffer to encode into
     */
    void message(TransactionInfo transaction, LogicalMessage message, StringBuilder buffer);

    void commitTransaction(TransactionInfo transaction);

    TransactionFrame frame();
}
