/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.types;

import io.pgjson.PgJsonException;

/**
 * A row descriptor referenced a type that the {@link TypeRegistry} does not know.
 */
public class CatalogLookupException extends PgJsonException {

    private static final long serialVersionUID = 1L;

    private final int typeOid;

    public CatalogLookupException(int typeOid) {
        super(String.format("cache lookup failed for type %d", typeOid));
        this.typeOid = typeOid;
    }

    public int typeOid() {
        return typeOid;
    }
}
