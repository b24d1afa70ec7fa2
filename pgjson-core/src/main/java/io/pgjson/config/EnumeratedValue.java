/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.config;

/**
 * An option whose value is one of a fixed set of literals. Implemented by enums used with
 * {@link Field#withEnum(Class)}.
 */
public interface EnumeratedValue {

    /**
     * Returns the literal accepted in the configuration for this value
     * @return the option literal; never null
     */
    String getValue();
}
