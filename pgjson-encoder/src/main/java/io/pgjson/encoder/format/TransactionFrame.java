/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.format;

import io.pgjson.annotation.NotThreadSafe;
import io.pgjson.encoder.spi.TransactionInfo;

/**
 * The state of the transaction being written: whether it is open, how many changes and transactional messages were
 * written so far, and the begin record that is held back until the first of them.
 */
@NotThreadSafe
public final class TransactionFrame {

    private long changes;
    private boolean open;
    private TransactionInfo deferredBegin;

    void begin() {
        changes = 0;
        open = true;
        deferredBegin = null;
    }

    void deferBegin(TransactionInfo transaction) {
        deferredBegin = transaction;
    }

    boolean hasDeferredBegin() {
        return deferredBegin != null;
    }

    TransactionInfo takeDeferredBegin() {
        TransactionInfo transaction = deferredBegin;
        deferredBegin = null;
        return transaction;
    }

    /**
     * Count one more written change or transactional message.
     *
     * @return the number of changes including this one
     */
    long increment() {
        return ++changes;
    }

    void end() {
        open = false;
        deferredBegin = null;
    }

    public long changes() {
        return changes;
    }

    /**
     * @return {@code true} if the change counted last is the first one of the transaction
     */
    public boolean isFirst() {
        return changes == 1;
    }

    public boolean isOpen() {
        return open;
    }

    void requireOpen(String event) {
        if (!open) {
            throw new IllegalStateException("Received " + event + " outside of a transaction");
        }
    }
}
