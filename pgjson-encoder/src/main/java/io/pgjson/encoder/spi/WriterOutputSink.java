/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.spi;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

import io.pgjson.PgJsonException;

/**
 * An {@link OutputSink} that writes every message to a {@link Writer} followed by a newline, flushing after each
 * message.
 */
public class WriterOutputSink implements OutputSink, Closeable {

    private final Writer writer;

    public WriterOutputSink(Writer writer) {
        this.writer = Objects.requireNonNull(writer);
    }

    @Override
    public void write(CharSequence chunk) {
        try {
            writer.append(chunk).append('\n');
            writer.flush();
        }
        catch (IOException e) {
            throw new PgJsonException("Failed to write encoded output", e);
        }
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
