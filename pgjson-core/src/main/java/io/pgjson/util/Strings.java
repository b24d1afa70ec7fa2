/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import io.pgjson.annotation.ThreadSafe;

/**
 * String-related utility methods.
 */
@ThreadSafe
public final class Strings {

    private static final char ESCAPE = '\\';

    /**
     * Split a list of identifiers delimited by {@code separator}. Whitespace around each item is ignored, a
     * backslash escapes the following character (including the separator) and is kept in the returned item so
     * that callers can still tell escaped characters apart.
     *
     * @param input the input string; may be null
     * @param separator the character that separates the items
     * @return the raw items in order of appearance; never null
     * @throws IllegalArgumentException if an item is empty or an item contains unescaped whitespace
     */
    public static List<String> splitEscaped(String input, char separator) {
        if (input == null) {
            return Collections.emptyList();
        }
        final List<String> items = new ArrayList<>();
        final int length = input.length();
        int pos = skipWhitespace(input, 0);
        if (pos == length) {
            return items;
        }
        while (true) {
            final int start = pos;
            while (pos < length && input.charAt(pos) != separator && !Character.isWhitespace(input.charAt(pos))) {
                if (input.charAt(pos) == ESCAPE) {
                    pos++;
                }
                pos++;
            }
            final int end = Math.min(pos, length);
            if (start == end) {
                throw new IllegalArgumentException("Empty item at position " + start + " in '" + input + "'");
            }
            items.add(input.substring(start, end));
            pos = skipWhitespace(input, end);
            if (pos == length) {
                return items;
            }
            if (input.charAt(pos) != separator) {
                throw new IllegalArgumentException("Unexpected character '" + input.charAt(pos) + "' at position " + pos + " in '" + input + "'");
            }
            pos = skipWhitespace(input, pos + 1);
        }
    }

    /**
     * Remove the escape characters from an item returned by {@link #splitEscaped(String, char)}.
     *
     * @param item the escaped item; may not be null
     * @return the item with every escaped character replaced by itself
     */
    public static String unescape(String item) {
        if (item.indexOf(ESCAPE) < 0) {
            return item;
        }
        final StringBuilder sb = new StringBuilder(item.length());
        for (int i = 0; i < item.length(); i++) {
            char c = item.charAt(i);
            if (c == ESCAPE) {
                i++;
                if (i == item.length()) {
                    break;
                }
                c = item.charAt(i);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static int skipWhitespace(String input, int pos) {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    /**
     * Returns a new String composed of the supplied values joined together with a copy of the specified {@code delimiter}.
     *
     * @param delimiter the delimiter that separates each element
     * @param values the values to join together.
     * @return a new {@code String} that is composed of the {@code elements} separated by the {@code delimiter}
     *
     * @throws NullPointerException If {@code delimiter} or {@code elements} is {@code null}
     */
    public static <T> String join(CharSequence delimiter, Iterable<T> values) {
        return join(delimiter, values, v -> v != null ? v.toString() : null);
    }

    /**
     * Returns a new String composed of the supplied values joined together with a copy of the specified {@code delimiter}.
     *
     * @param delimiter the delimiter that separates each element
     * @param values the values to join together.
     * @param conversion the function that converts the supplied values into strings, or returns {@code null} if the value
     *            is to be excluded
     * @return a new {@code String} that is composed of the {@code elements} separated by the {@code delimiter}
     */
    public static <T> String join(CharSequence delimiter, Iterable<T> values, Function<T, String> conversion) {
        Objects.requireNonNull(delimiter);
        Objects.requireNonNull(values);
        final StringBuilder sb = new StringBuilder();
        boolean delimit = false;
        Iterator<T> iter = values.iterator();
        while (iter.hasNext()) {
            String next = conversion.apply(iter.next());
            if (next != null) {
                if (delimit) {
                    sb.append(delimiter);
                }
                sb.append(next);
                delimit = true;
            }
        }
        return sb.toString();
    }

    /**
     * Parse a boolean the way the PostgreSQL server parses boolean options: any non-empty, case-insensitive
     * prefix of {@code true}, {@code false}, {@code yes}, {@code no}, at least two characters of {@code on} or
     * {@code off}, and the digits {@code 1} and {@code 0}.
     *
     * @param value the string representation of a boolean value; may be null
     * @return the boolean value, or {@code null} if the value is null or not a recognized boolean literal
     */
    public static Boolean asPostgresBoolean(String value) {
        if (isNullOrEmpty(value)) {
            return null;
        }
        switch (Character.toLowerCase(value.charAt(0))) {
            case 't':
                return isPrefixIgnoreCase(value, "true") ? Boolean.TRUE : null;
            case 'f':
                return isPrefixIgnoreCase(value, "false") ? Boolean.FALSE : null;
            case 'y':
                return isPrefixIgnoreCase(value, "yes") ? Boolean.TRUE : null;
            case 'n':
                return isPrefixIgnoreCase(value, "no") ? Boolean.FALSE : null;
            case 'o':
                if (value.length() < 2) {
                    return null;
                }
                if (isPrefixIgnoreCase(value, "on")) {
                    return Boolean.TRUE;
                }
                return isPrefixIgnoreCase(value, "off") ? Boolean.FALSE : null;
            case '1':
                return value.length() == 1 ? Boolean.TRUE : null;
            case '0':
                return value.length() == 1 ? Boolean.FALSE : null;
            default:
                return null;
        }
    }

    private static boolean isPrefixIgnoreCase(String value, String word) {
        return value.length() <= word.length() && word.regionMatches(true, 0, value, 0, value.length());
    }

    /**
     * Check if the string is empty or null.
     *
     * @param str the string to check
     * @return {@code true} if the string is empty or null
     */
    public static boolean isNullOrEmpty(String str) {
        return str == null || str.isEmpty();
    }

    private Strings() {
    }
}
