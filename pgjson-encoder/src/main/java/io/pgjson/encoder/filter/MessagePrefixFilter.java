/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.filter;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import io.pgjson.function.Predicates;
import io.pgjson.util.Strings;

/**
 * Applies the add/filter lists to logical decoding message prefixes. A filtered prefix is always rejected; when
 * prefixes were added, only those are accepted.
 */
public class MessagePrefixFilter {

    private static final char SEPARATOR = ',';

    private final Predicate<String> filter;

    /**
     * @param addPrefixes comma separated prefixes to accept; may be null or blank to accept all
     * @param filterPrefixes comma separated prefixes to reject; may be null or blank
     * @throws IllegalArgumentException if one of the lists is malformed
     */
    public MessagePrefixFilter(String addPrefixes, String filterPrefixes) {
        List<String> inclusions = parseList(addPrefixes);
        List<String> exclusions = parseList(filterPrefixes);
        this.filter = Predicates.filter(
                !inclusions.isEmpty() ? Predicates.includedIn(inclusions) : null,
                !exclusions.isEmpty() ? Predicates.excludedFrom(exclusions) : null);
    }

    public static List<String> parseList(String value) {
        return Strings.splitEscaped(value, SEPARATOR).stream()
                .map(Strings::unescape)
                .collect(Collectors.toList());
    }

    public boolean isIncluded(String prefix) {
        return filter.test(prefix);
    }
}
