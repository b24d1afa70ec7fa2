/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.value;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgjson.annotation.ThreadSafe;
import io.pgjson.encoder.types.PostgresType;

/**
 * Converts the textual output of a column into a JSON literal. Numbers and booleans are written unquoted,
 * {@code bytea} loses its {@code \x} prefix, and everything else becomes an escaped JSON string.
 */
@ThreadSafe
public final class ValueEncoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ValueEncoder.class);

    private static final String NUMBER_CHARACTERS = "0123456789+-eE.";
    private static final String[] SPECIAL_NUMBERS = { "NaN", "Infinity", "-Infinity" };
    private static final String BYTEA_HEX_PREFIX = "\\x";

    private ValueEncoder() {
    }

    /**
     * Append the JSON literal for the given value.
     *
     * @param type the column type; may not be null
     * @param text the output of the type's output function, or {@code null} for SQL NULL
     * @param out the buffer to append to
     * @return the buffer
     * @throws NotANumberException if a numeric value contains characters that cannot appear in a JSON number
     */
    public static StringBuilder encode(PostgresType type, String text, StringBuilder out) {
        if (text == null) {
            return out.append("null");
        }
        switch (type.getKind()) {
            case NUMBER:
                return encodeNumber(text, out);
            case BOOLEAN:
                return out.append("t".equals(text) ? "true" : "false");
            case BINARY:
                return JsonStrings.quote(text.startsWith(BYTEA_HEX_PREFIX) ? text.substring(BYTEA_HEX_PREFIX.length()) : text, out);
            default:
                return JsonStrings.quote(text, out);
        }
    }

    public static String encode(PostgresType type, String text) {
        return encode(type, text, new StringBuilder()).toString();
    }

    private static StringBuilder encodeNumber(String text, StringBuilder out) {
        if (isSpecial(text)) {
            // NaN and Infinity have no JSON representation
            LOGGER.debug("Value '{}' is special and is written as null", text);
            return out.append("null");
        }
        if (text.isEmpty()) {
            throw new NotANumberException(text);
        }
        for (int i = 0; i < text.length(); i++) {
            if (NUMBER_CHARACTERS.indexOf(text.charAt(i)) < 0) {
                throw new NotANumberException(text);
            }
        }
        return out.append(text);
    }

    private static boolean isSpecial(String text) {
        for (String special : SPECIAL_NUMBERS) {
            if (special.equalsIgnoreCase(text)) {
                return true;
            }
        }
        return false;
    }
}
