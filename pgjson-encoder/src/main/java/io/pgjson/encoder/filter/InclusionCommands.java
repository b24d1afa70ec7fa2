/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgjson.annotation.Immutable;
import io.pgjson.encoder.spi.Relation;

/**
 * An ordered list of include and exclude directives evaluated against unqualified table names. Every command is
 * evaluated in order and the last command that applies decides. Without any command every table is included; as soon
 * as there is one, a table is excluded unless a command includes it.
 */
@Immutable
public final class InclusionCommands implements TableFilter {

    private static final Logger LOGGER = LoggerFactory.getLogger(InclusionCommands.class);

    public static final char PATTERN_PREFIX = '~';

    private static final InclusionCommands EMPTY = new InclusionCommands(Collections.emptyList());

    private final List<InclusionCommand> commands;

    private InclusionCommands(List<InclusionCommand> commands) {
        this.commands = commands;
    }

    public static InclusionCommands empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean shouldEmit(String table) {
        if (commands.isEmpty()) {
            return true;
        }
        boolean emit = false;
        for (InclusionCommand command : commands) {
            emit = command.apply(emit, table);
        }
        LOGGER.trace("Table '{}' is {} by {}", table, emit ? "included" : "excluded", commands);
        return emit;
    }

    @Override
    public boolean isIncluded(Relation relation) {
        return shouldEmit(relation.name());
    }

    public List<InclusionCommand> commands() {
        return commands;
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }

    @Override
    public String toString() {
        return commands.toString();
    }

    public static final class Builder {
        private final List<InclusionCommand> commands = new ArrayList<>();

        private Builder() {
        }

        /**
         * Add an include directive; a value starting with {@code ~} is a pattern, anything else an exact table name.
         *
         * @throws InvalidPatternException if the pattern cannot be compiled
         */
        public Builder include(String value) {
            if (isPattern(value)) {
                commands.add(InclusionCommand.includeTablePattern(value.substring(1)));
            }
            else {
                commands.add(InclusionCommand.includeTable(value));
            }
            return this;
        }

        /**
         * Add an exclude directive. When the first directive is an exclusion, every other table stays included.
         *
         * @throws InvalidPatternException if the pattern cannot be compiled
         */
        public Builder exclude(String value) {
            if (commands.isEmpty()) {
                commands.add(InclusionCommand.includeAll());
            }
            if (isPattern(value)) {
                commands.add(InclusionCommand.excludeTablePattern(value.substring(1)));
            }
            else {
                commands.add(InclusionCommand.excludeTable(value));
            }
            return this;
        }

        private static boolean isPattern(String value) {
            return !value.isEmpty() && value.charAt(0) == PATTERN_PREFIX;
        }

        public InclusionCommands build() {
            if (commands.isEmpty()) {
                return EMPTY;
            }
            return new InclusionCommands(Collections.unmodifiableList(new ArrayList<>(commands)));
        }
    }
}
