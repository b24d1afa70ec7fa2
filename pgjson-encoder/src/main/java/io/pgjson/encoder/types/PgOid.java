/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.types;

import org.postgresql.core.Oid;

/**
 * Extension to the {@link org.postgresql.core.Oid} class with the built-in types the JDBC driver does not name.
 */
public final class PgOid extends Oid {

    public static final int XID = 28;
    public static final int CID = 29;
    public static final int LSEG = 601;
    public static final int PATH = 602;
    public static final int POLYGON = 604;
    public static final int LINE = 628;
    public static final int CIRCLE = 718;
    public static final int CIDR_OID = 650;
    public static final int CIDR_ARRAY = 651;
    public static final int MACADDR8_OID = 774;
    public static final int MACADDR_OID = 829;
    public static final int MACADDR_ARRAY = 1040;
    public static final int INET_OID = 869;
    public static final int INET_ARRAY = 1041;
    public static final int PG_LSN = 3220;
    public static final int TSVECTOR_OID = 3614;
    public static final int JSONB_OID = 3802;
    public static final int JSONB_ARRAY = 3807;
    public static final int INT4RANGE_OID = 3904;
    public static final int NUM_RANGE_OID = 3906;
    public static final int TSRANGE_OID = 3908;
    public static final int TSTZRANGE_OID = 3910;
    public static final int DATERANGE_OID = 3912;
    public static final int INT8RANGE_OID = 3926;

    private PgOid() {
    }
}
