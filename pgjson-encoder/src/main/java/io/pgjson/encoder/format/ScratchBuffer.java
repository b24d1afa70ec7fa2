/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.format;

import io.pgjson.annotation.NotThreadSafe;

/**
 * A reusable buffer for encoding a single change or message. It is leased with try-with-resources and emptied when the
 * lease is closed, on every exit path.
 */
@NotThreadSafe
public final class ScratchBuffer implements AutoCloseable {

    private static final int INITIAL_CAPACITY = 1024;
    private static final int MAX_RETAINED_CAPACITY = 1024 * 1024;

    private StringBuilder builder = new StringBuilder(INITIAL_CAPACITY);
    private boolean leased;
    private long leases;

    /**
     * @return this buffer, empty and marked as leased
     * @throws IllegalStateException if the buffer is already leased
     */
    public ScratchBuffer lease() {
        if (leased) {
            throw new IllegalStateException("Scratch buffer is already in use");
        }
        leased = true;
        leases++;
        return this;
    }

    public StringBuilder builder() {
        if (!leased) {
            throw new IllegalStateException("Scratch buffer is not leased");
        }
        return builder;
    }

    public boolean isLeased() {
        return leased;
    }

    /**
     * @return how many times the buffer was leased
     */
    public long leases() {
        return leases;
    }

    @Override
    public void close() {
        if (builder.capacity() > MAX_RETAINED_CAPACITY) {
            builder = new StringBuilder(INITIAL_CAPACITY);
        }
        else {
            builder.setLength(0);
        }
        leased = false;
    }
}
