/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.filter;

import io.pgjson.encoder.spi.Relation;

/**
 * Decides whether the changes of a relation are written.
 */
@FunctionalInterface
public interface TableFilter {

    boolean isIncluded(Relation relation);

}
