/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.function;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Predicate;

import io.pgjson.annotation.Immutable;

/**
 * Utilities for constructing various predicates.
 */
@Immutable
public class Predicates {

    /**
     * Generate a predicate function that for any supplied value returns {@code true} if it is exactly equal to
     * <i>any</i> of the supplied literals.
     *
     * @param literals the literal values; may not be null
     * @return the predicate function that performs the matching
     */
    public static <T> Predicate<T> includedIn(Collection<T> literals) {
        Set<T> literalSet = new HashSet<>(literals);
        return literalSet::contains;
    }

    /**
     * Generate a predicate function that for any supplied value returns {@code true} if it is equal to
     * <i>none</i> of the supplied literals.
     *
     * @param literals the literal values; may not be null
     * @return the predicate function that performs the matching
     */
    public static <T> Predicate<T> excludedFrom(Collection<T> literals) {
        return Predicates.<T> includedIn(literals).negate();
    }

    /**
     * Create a predicate function that allows only those values that are allowed by the {@code allowed} predicate
     * and not rejected by the {@code disallowed} predicate. The rejection always takes precedence.
     *
     * @param allowed the predicate that defines the allowed values; may be null if every value is allowed
     * @param disallowed the predicate that returns {@code false} for each rejected value; may be null if no value is
     *            rejected
     * @return the predicate function; never null
     */
    public static <T> Predicate<T> filter(Predicate<T> allowed, Predicate<T> disallowed) {
        Predicate<T> accepted = allowed != null ? allowed : always();
        return disallowed != null ? disallowed.and(accepted) : accepted;
    }

    public static <T> Predicate<T> always() {
        return (value) -> true;
    }

    private Predicates() {
    }
}
