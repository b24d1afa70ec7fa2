/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.filter;

import java.util.Objects;

import io.pgjson.annotation.Immutable;

/**
 * One include or exclude directive. The type of a command is fixed when it is created.
 */
@Immutable
public final class InclusionCommand {

    public enum Type {
        INCLUDE_ALL(true),
        INCLUDE_TABLE(true),
        INCLUDE_TABLE_PATTERN(true),
        EXCLUDE_TABLE(false),
        EXCLUDE_TABLE_PATTERN(false);

        private final boolean include;

        Type(boolean include) {
            this.include = include;
        }

        public boolean isInclude() {
            return include;
        }
    }

    private static final InclusionCommand INCLUDE_ALL = new InclusionCommand(Type.INCLUDE_ALL, null, null);

    private final Type type;
    private final String tableName;
    private final RegexMatcher matcher;

    private InclusionCommand(Type type, String tableName, RegexMatcher matcher) {
        this.type = type;
        this.tableName = tableName;
        this.matcher = matcher;
    }

    public static InclusionCommand includeAll() {
        return INCLUDE_ALL;
    }

    public static InclusionCommand includeTable(String tableName) {
        return new InclusionCommand(Type.INCLUDE_TABLE, Objects.requireNonNull(tableName), null);
    }

    public static InclusionCommand includeTablePattern(String pattern) {
        return new InclusionCommand(Type.INCLUDE_TABLE_PATTERN, null, RegexMatcher.compile(pattern));
    }

    public static InclusionCommand excludeTable(String tableName) {
        return new InclusionCommand(Type.EXCLUDE_TABLE, Objects.requireNonNull(tableName), null);
    }

    public static InclusionCommand excludeTablePattern(String pattern) {
        return new InclusionCommand(Type.EXCLUDE_TABLE_PATTERN, null, RegexMatcher.compile(pattern));
    }

    public Type type() {
        return type;
    }

    /**
     * @return whether this command applies to the table; {@link Type#INCLUDE_ALL} applies to every table
     */
    public boolean appliesTo(String table) {
        switch (type) {
            case INCLUDE_ALL:
                return true;
            case INCLUDE_TABLE:
            case EXCLUDE_TABLE:
                return tableName.equals(table);
            default:
                return matcher.matches(table);
        }
    }

    /**
     * Fold this command into the decision reached by the preceding commands.
     */
    public boolean apply(boolean current, String table) {
        return appliesTo(table) ? type.isInclude() : current;
    }

    @Override
    public String toString() {
        switch (type) {
            case INCLUDE_ALL:
                return "include *";
            case INCLUDE_TABLE:
                return "include " + tableName;
            case EXCLUDE_TABLE:
                return "exclude " + tableName;
            case INCLUDE_TABLE_PATTERN:
                return "include " + matcher;
            default:
                return "exclude " + matcher;
        }
    }
}
