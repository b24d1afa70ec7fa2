/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.format;

import java.util.List;

import org.postgresql.replication.LogSequenceNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgjson.annotation.NotThreadSafe;
import io.pgjson.encoder.JsonEncoderConfig;
import io.pgjson.encoder.spi.LogicalMessage;
import io.pgjson.encoder.spi.OutputSink;
import io.pgjson.encoder.spi.Relation;
import io.pgjson.encoder.spi.RowChange;
import io.pgjson.encoder.spi.TransactionInfo;
import io.pgjson.encoder.tuple.ProjectedColumn;
import io.pgjson.encoder.value.JsonStrings;

/**
 * Format version 2: every event is a self-contained JSON object on its own, tagged with an {@code action}:
 * {@code B} and {@code C} for transaction boundaries (when those are included), {@code I}, {@code U} and {@code D}
 * for changes and {@code M} for messages. Each object is a separate write.
 */
@NotThreadSafe
public class StreamingFramer implements Framer {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamingFramer.class);

    private final JsonEncoderConfig config;
    private final OutputSink sink;
    private final TransactionFrame frame = new TransactionFrame();
    private final StringBuilder envelope = new StringBuilder();

    public StreamingFramer(JsonEncoderConfig config, OutputSink sink) {
        this.config = config;
        this.sink = sink;
    }

    @Override
    public TransactionFrame frame() {
        return frame;
    }

    @Override
    public void beginTransaction(TransactionInfo txn) {
        frame.begin();
        if (!config.includeTransaction()) {
            return;
        }
        if (config.skipEmptyTransactions()) {
            frame.deferBegin(txn);
        }
        else {
            writeBoundary("B", txn, txn.firstLsn());
        }
    }

    private void writeDeferredBegin() {
        if (frame.hasDeferredBegin()) {
            TransactionInfo txn = frame.takeDeferredBegin();
            writeBoundary("B", txn, txn.firstLsn());
        }
    }

    private void writeBoundary(String action, TransactionInfo txn, LogSequenceNumber lsn) {
        envelope.setLength(0);
        openRecord(envelope, action);
        if (config.includeXids()) {
            member(envelope, "xid").append(txn.xid());
        }
        if (config.includeTimestamp()) {
            JsonStrings.quoteOrNull(PostgresTimestampFormatter.format(txn.commitTime()), member(envelope, "timestamp"));
        }
        if (config.includeLsn()) {
            JsonStrings.quote(lsn.asString(), member(envelope, "lsn"));
            JsonStrings.quote(txn.endLsn().asString(), member(envelope, "nextlsn"));
        }
        envelope.append('}');
        sink.write(envelope.toString());
    }

    @Override
    public void change(TransactionInfo txn, Relation relation, RowChange change, List<ProjectedColumn> columns,
                       List<ProjectedColumn> identity, StringBuilder buffer) {
        frame.requireOpen("a change");
        writeDeferredBegin();
        frame.increment();

        openRecord(buffer, change.operation().action());
        if (config.includeXids()) {
            member(buffer, "xid").append(txn.xid());
        }
        if (config.includeTimestamp()) {
            JsonStrings.quoteOrNull(PostgresTimestampFormatter.format(txn.commitTime()), member(buffer, "timestamp"));
        }
        if (config.includeLsn()) {
            JsonStrings.quote(change.lsn().asString(), member(buffer, "lsn"));
        }
        if (config.includeSchemas()) {
            JsonStrings.quote(relation.schema(), member(buffer, "schema"));
        }
        JsonStrings.quote(relation.name(), member(buffer, "table"));
        if (columns != null) {
            writeColumns(member(buffer, "columns"), columns, config.includeNotNull());
        }
        if (identity != null) {
            writeColumns(member(buffer, "identity"), identity, false);
        }
        buffer.append('}');
        sink.write(buffer.toString());
    }

    private void writeColumns(StringBuilder buffer, List<ProjectedColumn> columns, boolean includeOptional) {
        buffer.append('[');
        boolean first = true;
        for (ProjectedColumn column : columns) {
            if (!first) {
                buffer.append(',');
            }
            first = false;
            buffer.append('{');
            JsonStrings.quote("name", buffer).append(':');
            JsonStrings.quote(column.name(), buffer);
            if (config.includeTypes()) {
                JsonStrings.quote(column.typeName(), member(buffer, "type"));
            }
            if (config.includeTypeOids()) {
                member(buffer, "typeoid").append(column.typeOid());
            }
            if (includeOptional) {
                member(buffer, "optional").append(!column.isNotNull());
            }
            member(buffer, "value").append(column.literal());
            buffer.append('}');
        }
        buffer.append(']');
    }

    @Override
    public void message(TransactionInfo txn, LogicalMessage message, StringBuilder buffer) {
        if (message.isTransactional()) {
            frame.requireOpen("a transactional message");
            writeDeferredBegin();
            frame.increment();
        }
        openRecord(buffer, "M");
        if (message.isTransactional() && config.includeXids()) {
            member(buffer, "xid").append(txn.xid());
        }
        if (config.includeLsn()) {
            JsonStrings.quote(message.lsn().asString(), member(buffer, "lsn"));
        }
        member(buffer, "transactional").append(message.isTransactional());
        JsonStrings.quote(message.prefix(), member(buffer, "prefix"));
        JsonStrings.quote(message.contentAsString(), member(buffer, "content"));
        buffer.append('}');
        sink.write(buffer.toString());
    }

    @Override
    public void commitTransaction(TransactionInfo txn) {
        frame.requireOpen("a commit");
        if (config.includeTransaction()) {
            if (frame.hasDeferredBegin()) {
                LOGGER.debug("Transaction {} wrote no changes and is skipped", txn.xid());
            }
            else {
                writeBoundary("C", txn, txn.commitLsn());
            }
        }
        frame.end();
    }

    private static void openRecord(StringBuilder buffer, String action) {
        buffer.append("{\"action\":");
        JsonStrings.quote(action, buffer);
    }

    private static StringBuilder member(StringBuilder buffer, String name) {
        buffer.append(',');
        return JsonStrings.quote(name, buffer).append(':');
    }
}
