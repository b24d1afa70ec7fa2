/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.spi;

/**
 * The transport behind the encoder. Each call hands over one complete output message; the sink decides how
 * messages are delimited or shipped.
 */
@FunctionalInterface
public interface OutputSink {

    /**
     * Accept one output message.
     *
     * @param chunk the encoded text; never null
     */
    void write(CharSequence chunk);
}
