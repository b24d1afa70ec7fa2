/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.config;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

import io.pgjson.PgJsonException;

/**
 * Details about an invalid {@link Configuration}. Every problem found while validating the configuration is
 * collected so that they can be reported together.
 *
 * @see Configuration#validateAndRecord(Iterable, Consumer)
 */
public class InvalidConfigurationException extends PgJsonException {

    private static final long serialVersionUID = 1L;

    private final List<String> problems;

    /**
     * Create an exception describing a single problem.
     *
     * @param message the message; may not be null
     */
    public InvalidConfigurationException(String message) {
        this(message, Collections.singletonList(message));
    }

    /**
     * Create an exception with a message and the problems that were found.
     *
     * @param message the message; may not be null
     * @param problems the problem descriptions; may not be null or empty
     */
    public InvalidConfigurationException(String message, List<String> problems) {
        super(message);
        assert !problems.isEmpty();
        this.problems = Collections.unmodifiableList(problems);
    }

    /**
     * Get the descriptions of the problems.
     *
     * @return the immutable list of problems; never null
     */
    public List<String> problems() {
        return problems;
    }

    /**
     * Call the specified function on each of the problems.
     *
     * @param consumer the function to be called; may not be null
     */
    public void forEach(Consumer<String> consumer) {
        problems.forEach(consumer);
    }
}
