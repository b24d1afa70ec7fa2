/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgjson.annotation.NotThreadSafe;
import io.pgjson.encoder.filter.TableFilter;
import io.pgjson.encoder.spi.Relation;

/**
 * Remembers per relation whether its changes are written, so that the table filter runs once per relation and
 * session. Relations are assumed not to be renamed during a session.
 */
@NotThreadSafe
public class RelationInclusionCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelationInclusionCache.class);

    public enum Inclusion {
        UNKNOWN,
        INCLUDED,
        EXCLUDED
    }

    private final TableFilter filter;
    private final Map<Long, Inclusion> inclusions = new HashMap<>();

    public RelationInclusionCache(TableFilter filter) {
        this.filter = filter;
    }

    public boolean isIncluded(Relation relation) {
        Inclusion inclusion = inclusions.get(relation.oid());
        if (inclusion == null) {
            inclusion = filter.isIncluded(relation) ? Inclusion.INCLUDED : Inclusion.EXCLUDED;
            inclusions.put(relation.oid(), inclusion);
            LOGGER.trace("Relation {} with OID {} is {}", relation, relation.oid(), inclusion);
        }
        return inclusion == Inclusion.INCLUDED;
    }

    public Inclusion get(long relationOid) {
        return inclusions.getOrDefault(relationOid, Inclusion.UNKNOWN);
    }

    public int size() {
        return inclusions.size();
    }

    public void clear() {
        inclusions.clear();
    }
}
