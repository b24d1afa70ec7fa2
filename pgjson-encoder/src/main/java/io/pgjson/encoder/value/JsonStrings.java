/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.value;

import com.fasterxml.jackson.core.io.JsonStringEncoder;

import io.pgjson.annotation.ThreadSafe;

/**
 * Appends JSON string literals to a buffer.
 */
@ThreadSafe
public final class JsonStrings {

    private static final JsonStringEncoder ENCODER = JsonStringEncoder.getInstance();

    private JsonStrings() {
    }

    /**
     * Append the given text as a quoted and escaped JSON string. Quote, backslash and the ASCII control characters
     * are escaped; every other character is copied unchanged.
     *
     * @param text the text; may not be null
     * @param out the buffer to append to
     * @return the buffer
     */
    public static StringBuilder quote(CharSequence text, StringBuilder out) {
        out.append('"');
        ENCODER.quoteAsString(text, out);
        return out.append('"');
    }

    /**
     * Append the quoted text, or the {@code null} literal when the text is null.
     */
    public static StringBuilder quoteOrNull(CharSequence text, StringBuilder out) {
        if (text == null) {
            return out.append("null");
        }
        return quote(text, out);
    }

    public static String quote(CharSequence text) {
        return quote(text, new StringBuilder(text.length() + 2)).toString();
    }
}
