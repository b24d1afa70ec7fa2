/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.format;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;

/**
 * Formats commit timestamps the way the server prints {@code timestamptz} values, e.g.
 * {@code 2018-03-27 11:58:28.988414-03}.
 */
public final class PostgresTimestampFormatter {

    private static final DateTimeFormatter TIMESTAMP_WITH_TIMEZONE_FORMATTER = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .appendFraction(ChronoField.MICRO_OF_SECOND, 0, 6, true)
            .appendOffset("+HH:mm:ss", "+00")
            .toFormatter();

    private PostgresTimestampFormatter() {
    }

    /**
     * @return the formatted timestamp, or {@code null} if the timestamp is null
     */
    public static String format(OffsetDateTime timestamp) {
        return timestamp != null ? TIMESTAMP_WITH_TIMEZONE_FORMATTER.format(timestamp) : null;
    }
}
