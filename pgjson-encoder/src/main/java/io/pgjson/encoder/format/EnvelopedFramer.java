/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.format;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgjson.annotation.NotThreadSafe;
import io.pgjson.encoder.JsonEncoderConfig;
import io.pgjson.encoder.JsonEncoderConfig.ColumnLayout;
import io.pgjson.encoder.spi.LogicalMessage;
import io.pgjson.encoder.spi.OutputSink;
import io.pgjson.encoder.spi.Relation;
import io.pgjson.encoder.spi.RowChange;
import io.pgjson.encoder.spi.TransactionInfo;
import io.pgjson.encoder.tuple.ProjectedColumn;
import io.pgjson.encoder.value.JsonStrings;

/**
 * Format version 1: every transaction is one JSON object with a {@code change} array holding its changes and
 * transactional messages. The object is written at commit, or piece by piece when writing in chunks.
 * Non-transactional messages are written at once as their own object.
 */
@NotThreadSafe
public class EnvelopedFramer implements Framer {

    private static final Logger LOGGER = LoggerFactory.getLogger(EnvelopedFramer.class);

    private static final int CHANGE_DEPTH = 3;
    private static final int KEY_DEPTH = 4;

    private final JsonEncoderConfig config;
    private final OutputSink sink;
    private final JsonTokens tokens;
    private final boolean writeInChunks;
    private final TransactionFrame frame = new TransactionFrame();
    private final StringBuilder transaction = new StringBuilder();
    private final StringBuilder envelope = new StringBuilder();

    public EnvelopedFramer(JsonEncoderConfig config, OutputSink sink) {
        this.config = config;
        this.sink = sink;
        this.tokens = JsonTokens.of(config.prettyPrint());
        this.writeInChunks = config.writeInChunks();
    }

    @Override
    public TransactionFrame frame() {
        return frame;
    }

    @Override
    public void beginTransaction(TransactionInfo txn) {
        frame.begin();
        transaction.setLength(0);
        if (config.skipEmptyTransactions()) {
            frame.deferBegin(txn);
        }
        else {
            writeBegin(txn);
        }
    }

    private void writeBegin(TransactionInfo txn) {
        envelope.setLength(0);
        envelope.append('{');
        if (tokens.isPretty()) {
            envelope.append('\n');
        }
        if (config.includeXids()) {
            tokens.field(envelope, 1, "xid", Long.toString(txn.xid()), true);
        }
        if (config.includeLsn()) {
            tokens.stringField(envelope, 1, "nextlsn", txn.endLsn().asString(), true);
        }
        if (config.includeTimestamp()) {
            tokens.stringField(envelope, 1, "timestamp", PostgresTimestampFormatter.format(txn.commitTime()), true);
        }
        if (config.includeXmins()) {
            tokens.field(envelope, 1, "xmin", Long.toString(txn.slotXmin()), true);
            tokens.field(envelope, 1, "catxmin", Long.toString(txn.slotCatalogXmin()), true);
        }
        if (config.includeNextXids()) {
            tokens.field(envelope, 1, "nextxid", Long.toString(txn.nextXid()), true);
            tokens.field(envelope, 1, "epoch", Long.toString(txn.nextXidEpoch()), true);
        }
        tokens.name(envelope, 1, "change").append('[');
        emit(envelope);
    }

    private void writeDeferredBegin() {
        if (frame.hasDeferredBegin()) {
            writeBegin(frame.takeDeferredBegin());
        }
    }

    @Override
    public void change(TransactionInfo txn, Relation relation, RowChange change, List<ProjectedColumn> columns,
                       List<ProjectedColumn> identity, StringBuilder buffer) {
        frame.requireOpen("a change");
        writeDeferredBegin();
        openElement(buffer, frame.increment());

        tokens.stringField(buffer, CHANGE_DEPTH, "kind", change.operation().kind(), true);
        if (config.includeSchemas()) {
            tokens.stringField(buffer, CHANGE_DEPTH, "schema", relation.schema(), true);
        }
        tokens.stringField(buffer, CHANGE_DEPTH, "table", relation.name(), true);
        if (columns != null) {
            writeColumns(buffer, columns, identity != null);
        }
        if (identity != null) {
            writeIdentity(buffer, identity);
        }
        closeElement(buffer);
        emit(buffer);
    }

    private void writeColumns(StringBuilder buffer, List<ProjectedColumn> columns, boolean more) {
        final boolean includeNotNull = config.includeTypes() && config.includeNotNull();
        if (config.columnLayout() == ColumnLayout.MAP) {
            if (config.includeTypes()) {
                tokens.field(buffer, CHANGE_DEPTH, "columntypes", tokens.object(columns, ProjectedColumn::name, c -> JsonStrings.quote(c.typeName())), true);
            }
            if (config.includeTypeOids()) {
                tokens.field(buffer, CHANGE_DEPTH, "columntypeoids", tokens.object(columns, ProjectedColumn::name, c -> Integer.toString(c.typeOid())), true);
            }
            if (includeNotNull) {
                tokens.field(buffer, CHANGE_DEPTH, "columnoptionals", tokens.object(columns, ProjectedColumn::name, c -> Boolean.toString(!c.isNotNull())), true);
            }
            tokens.field(buffer, CHANGE_DEPTH, "columnvalues", tokens.object(columns, ProjectedColumn::name, ProjectedColumn::literal), more);
            return;
        }
        tokens.field(buffer, CHANGE_DEPTH, "columnnames", tokens.array(columns, c -> JsonStrings.quote(c.name())), true);
        if (config.includeTypes()) {
            tokens.field(buffer, CHANGE_DEPTH, "columntypes", tokens.array(columns, c -> JsonStrings.quote(c.typeName())), true);
        }
        if (config.includeTypeOids()) {
            tokens.field(buffer, CHANGE_DEPTH, "columntypeoids", tokens.array(columns, c -> Integer.toString(c.typeOid())), true);
        }
        if (includeNotNull) {
            tokens.field(buffer, CHANGE_DEPTH, "columnoptionals", tokens.array(columns, c -> Boolean.toString(!c.isNotNull())), true);
        }
        tokens.field(buffer, CHANGE_DEPTH, "columnvalues", tokens.array(columns, ProjectedColumn::literal), more);
    }

    private void writeIdentity(StringBuilder buffer, List<ProjectedColumn> identity) {
        tokens.openObject(buffer, CHANGE_DEPTH, "oldkeys");
        if (config.columnLayout() == ColumnLayout.MAP) {
            if (config.includeTypes()) {
                tokens.field(buffer, KEY_DEPTH, "keytypes", tokens.object(identity, ProjectedColumn::name, c -> JsonStrings.quote(c.typeName())), true);
            }
            if (config.includeTypeOids()) {
                tokens.field(buffer, KEY_DEPTH, "keytypeoids", tokens.object(identity, ProjectedColumn::name, c -> Integer.toString(c.typeOid())), true);
            }
            tokens.field(buffer, KEY_DEPTH, "keyvalues", tokens.object(identity, ProjectedColumn::name, ProjectedColumn::literal), false);
        }
        else {
            tokens.field(buffer, KEY_DEPTH, "keynames", tokens.array(identity, c -> JsonStrings.quote(c.name())), true);
            if (config.includeTypes()) {
                tokens.field(buffer, KEY_DEPTH, "keytypes", tokens.array(identity, c -> JsonStrings.quote(c.typeName())), true);
            }
            if (config.includeTypeOids()) {
                tokens.field(buffer, KEY_DEPTH, "keytypeoids", tokens.array(identity, c -> Integer.toString(c.typeOid())), true);
            }
            tokens.field(buffer, KEY_DEPTH, "keyvalues", tokens.array(identity, ProjectedColumn::literal), false);
        }
        tokens.closeObject(buffer, CHANGE_DEPTH, false);
    }

    @Override
    public void message(TransactionInfo txn, LogicalMessage message, StringBuilder buffer) {
        if (!message.isTransactional()) {
            // a complete object of its own, written at once
            if (tokens.isPretty()) {
                buffer.append("{\n\t\"change\": [\n\t\t{\n");
            }
            else {
                buffer.append("{\"change\":[{");
            }
            writeMessageFields(buffer, message);
            closeElement(buffer);
            buffer.append(tokens.isPretty() ? "\n\t]\n}" : "]}");
            sink.write(buffer.toString());
            return;
        }
        frame.requireOpen("a transactional message");
        writeDeferredBegin();
        openElement(buffer, frame.increment());
        writeMessageFields(buffer, message);
        closeElement(buffer);
        emit(buffer);
    }

    private void writeMessageFields(StringBuilder buffer, LogicalMessage message) {
        tokens.stringField(buffer, CHANGE_DEPTH, "kind", "message", true);
        tokens.field(buffer, CHANGE_DEPTH, "transactional", Boolean.toString(message.isTransactional()), true);
        tokens.stringField(buffer, CHANGE_DEPTH, "prefix", message.prefix(), true);
        tokens.stringField(buffer, CHANGE_DEPTH, "content", message.contentAsString(), false);
    }

    @Override
    public void commitTransaction(TransactionInfo txn) {
        frame.requireOpen("a commit");
        if (frame.hasDeferredBegin()) {
            LOGGER.debug("Transaction {} wrote no changes and is skipped", txn.xid());
            frame.end();
            return;
        }
        envelope.setLength(0);
        if (tokens.isPretty()) {
            if (!writeInChunks) {
                envelope.append('\n');
            }
            envelope.append("\t]\n}");
        }
        else {
            envelope.append("]}");
        }
        if (writeInChunks) {
            sink.write(envelope.toString());
        }
        else {
            transaction.append(envelope);
            sink.write(transaction.toString());
            transaction.setLength(0);
        }
        frame.end();
    }

    private void openElement(StringBuilder buffer, long count) {
        if (tokens.isPretty()) {
            if (!writeInChunks) {
                buffer.append('\n');
            }
            buffer.append("\t\t");
            if (count > 1) {
                buffer.append(',');
            }
            buffer.append("{\n");
        }
        else {
            buffer.append(count > 1 ? ",{" : "{");
        }
    }

    private void closeElement(StringBuilder buffer) {
        buffer.append(tokens.isPretty() ? "\t\t}" : "}");
    }

    private void emit(CharSequence part) {
        if (writeInChunks) {
            sink.write(part.toString());
        }
        else {
            transaction.append(part);
        }
    }
}
