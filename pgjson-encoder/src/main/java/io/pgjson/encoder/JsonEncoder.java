/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgjson.annotation.NotThreadSafe;
import io.pgjson.encoder.format.Framer;
import io.pgjson.encoder.format.ScratchBuffer;
import io.pgjson.encoder.format.TransactionFrame;
import io.pgjson.encoder.spi.LogicalMessage;
import io.pgjson.encoder.spi.Operation;
import io.pgjson.encoder.spi.OutputSink;
import io.pgjson.encoder.spi.Relation;
import io.pgjson.encoder.spi.RowChange;
import io.pgjson.encoder.spi.TransactionInfo;
import io.pgjson.encoder.tuple.ProjectedColumn;
import io.pgjson.encoder.tuple.ReplicaIdentityResolver;
import io.pgjson.encoder.tuple.ReplicaIdentityResolver.Identity;
import io.pgjson.encoder.tuple.ReplicaIdentityResolver.KeySource;
import io.pgjson.encoder.tuple.TupleProjector;
import io.pgjson.encoder.types.TypeRegistry;

/**
 * A decoding session. The host calls {@link #begin(TransactionInfo)}, then {@link #change} and {@link #message} for
 * the events of the transaction, and finally {@link #commit(TransactionInfo)}; non-transactional messages may arrive at
 * any time. Calls must not overlap.
 */
@NotThreadSafe
public class JsonEncoder implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonEncoder.class);

    private final JsonEncoderConfig config;
    private final Framer framer;
    private final TupleProjector projector;
    private final ReplicaIdentityResolver identityResolver = new ReplicaIdentityResolver();
    private final RelationInclusionCache inclusionCache;
    private final ScratchBuffer scratch = new ScratchBuffer();

    private long transactions;
    private long changes;
    private long skippedChanges;
    private boolean closed;

    public JsonEncoder(JsonEncoderConfig config, OutputSink sink, TypeRegistry typeRegistry) {
        this.config = Objects.requireNonNull(config);
        this.framer = Framer.create(config, Objects.requireNonNull(sink));
        this.projector = new TupleProjector(typeRegistry, config.includeTypmod(), config.includeUnchangedToast(),
                config.unchangedToastPlaceholder());
        this.inclusionCache = new RelationInclusionCache(config.tableFilter());
        LOGGER.info("Starting JSON encoder with format version {} using table filter {}", config.formatVersion(), config.tableFilter());
    }

    public void begin(TransactionInfo transaction) {
        ensureOpen();
        transactions++;
        framer.beginTransaction(transaction);
    }

    /**
     * Write one row change, unless the table is filtered out or the change lacks the data it needs.
     *
     * @throws io.pgjson.encoder.value.NotANumberException if a numeric value cannot be written as a JSON number
     * @throws io.pgjson.encoder.types.CatalogLookupException if the type of a column is unknown
     */
    public void change(TransactionInfo transaction, Relation relation, RowChange change) {
        ensureOpen();
        try (ScratchBuffer buffer = scratch.lease()) {
            if (!inclusionCache.isIncluded(relation)) {
                LOGGER.trace("Skipping {} of filtered table {}", change.operation().kind(), relation);
                return;
            }
            if (!isWritable(relation, change)) {
                skippedChanges++;
                return;
            }
            final List<ProjectedColumn> columns = change.operation() != Operation.DELETE ? projector.projectColumns(change.newRow()) : null;
            final Identity identity = identityResolver.identityOf(relation, change);
            final List<ProjectedColumn> key = identity != null ? projector.projectIdentity(identity.row(), identity.keyColumns()) : null;
            LOGGER.debug("Writing {} of {} with {} columns", change.operation().kind(), relation, columns != null ? columns.size() : 0);
            framer.change(transaction, relation, change, columns, key, buffer.builder());
            changes++;
        }
    }

    private boolean isWritable(Relation relation, RowChange change) {
        switch (change.operation()) {
            case INSERT:
                if (change.newRow() == null) {
                    LOGGER.warn("no tuple data for INSERT in table \"{}\"", relation.name());
                    return false;
                }
                return true;
            case UPDATE:
                if (identityResolver.resolve(relation) == KeySource.NONE) {
                    LOGGER.warn("table \"{}\" without primary key or replica identity is nothing", relation.name());
                    return false;
                }
                if (change.newRow() == null) {
                    LOGGER.warn("no tuple data for UPDATE in table \"{}\"", relation.name());
                    return false;
                }
                return true;
            case DELETE:
                if (identityResolver.resolve(relation) == KeySource.NONE) {
                    LOGGER.warn("table \"{}\" without primary key or replica identity is nothing", relation.name());
                    return false;
                }
                if (change.oldRow() == null) {
                    LOGGER.warn("no tuple data for DELETE in table \"{}\"", relation.name());
                    return false;
                }
                return true;
            default:
                throw new IllegalArgumentException("Unknown operation " + change.operation());
        }
    }

    /**
     * Write a logical decoding message unless its prefix is filtered out.
     *
     * @param transaction the enclosing transaction; may be null for non-transactional messages
     * @param message the message
     */
    public void message(TransactionInfo transaction, LogicalMessage message) {
        ensureOpen();
        if (!config.messagePrefixFilter().isIncluded(message.prefix())) {
            LOGGER.trace("Skipping message with filtered prefix '{}'", message.prefix());
            return;
        }
        try (ScratchBuffer buffer = scratch.lease()) {
            framer.message(transaction, message, buffer.builder());
        }
    }

    public void commit(TransactionInfo transaction) {
        ensureOpen();
        final long changes = framer.frame().changes();
        framer.commitTransaction(transaction);
        LOGGER.debug("Committed transaction {} with {} changes", transaction.xid(), changes);
    }

    public JsonEncoderConfig config() {
        return config;
    }

    public TransactionFrame transactionFrame() {
        return framer.frame();
    }

    public RelationInclusionCache inclusionCache() {
        return inclusionCache;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("The encoder has been closed");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        LOGGER.info("Stopping JSON encoder after {} transactions, {} changes written and {} changes skipped", transactions, changes, skippedChanges);
        inclusionCache.clear();
    }
}
