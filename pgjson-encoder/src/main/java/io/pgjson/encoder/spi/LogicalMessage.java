/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.spi;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import org.postgresql.replication.LogSequenceNumber;

/**
 * A generic message written with {@code pg_logical_emit_message()}.
 */
public final class LogicalMessage {

    private final boolean transactional;
    private final String prefix;
    private final byte[] content;
    private final LogSequenceNumber lsn;

    public LogicalMessage(boolean transactional, String prefix, byte[] content, LogSequenceNumber lsn) {
        this.transactional = transactional;
        this.prefix = Objects.requireNonNull(prefix);
        this.content = content != null ? content.clone() : new byte[0];
        this.lsn = lsn != null ? lsn : LogSequenceNumber.INVALID_LSN;
    }

    public static LogicalMessage transactional(String prefix, String content) {
        return new LogicalMessage(true, prefix, content.getBytes(StandardCharsets.UTF_8), null);
    }

    public static LogicalMessage nonTransactional(String prefix, String content) {
        return new LogicalMessage(false, prefix, content.getBytes(StandardCharsets.UTF_8), null);
    }

    public boolean isTransactional() {
        return transactional;
    }

    public String prefix() {
        return prefix;
    }

    public byte[] content() {
        return content.clone();
    }

    /**
     * The content as text. The payload is not required to be NUL-terminated; it is cut at the first NUL byte, if
     * any, and decoded as UTF-8.
     *
     * @return the textual content; never null
     */
    public String contentAsString() {
        int length = 0;
        while (length < content.length && content[length] != 0) {
            length++;
        }
        return new String(Arrays.copyOf(content, length), StandardCharsets.UTF_8);
    }

    public LogSequenceNumber lsn() {
        return lsn;
    }

    @Override
    public String toString() {
        return "LogicalMessage [transactional=" + transactional + ", prefix=" + prefix + ", size=" + content.length + "]";
    }
}
