/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.filter;

import com.google.re2j.Pattern;
import com.google.re2j.PatternSyntaxException;

import io.pgjson.annotation.Immutable;

/**
 * A compiled table name pattern. Matching searches for the pattern anywhere in the candidate, so patterns that
 * must cover the whole name have to be anchored with {@code ^} and {@code $}.
 */
@Immutable
public final class RegexMatcher {

    private final Pattern pattern;

    private RegexMatcher(Pattern pattern) {
        this.pattern = pattern;
    }

    /**
     * Compile the given pattern.
     *
     * @param pattern the regular expression; may not be null
     * @return the matcher; never null
     * @throws InvalidPatternException if the pattern cannot be compiled
     */
    public static RegexMatcher compile(String pattern) {
        try {
            return new RegexMatcher(Pattern.compile(pattern));
        }
        catch (PatternSyntaxException e) {
            throw new InvalidPatternException(pattern, e);
        }
    }

    /**
     * @param candidate the string to search
     * @return {@code true} if the pattern occurs in the candidate
     * @throws PatternMatchException if the candidate cannot be searched
     */
    public boolean matches(String candidate) {
        try {
            return pattern.matcher(candidate).find();
        }
        catch (RuntimeException e) {
            throw new PatternMatchException(candidate, e);
        }
    }

    public String pattern() {
        return pattern.pattern();
    }

    @Override
    public String toString() {
        return "~" + pattern.pattern();
    }
}
