/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.types;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.postgresql.core.Oid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgjson.annotation.NotThreadSafe;

/**
 * A registry of the types that row descriptors may reference. It is primed with the built-in types of the
 * server; the host registers user-defined types (enums, domains, composites and their arrays) as it learns about
 * them. A lookup of an OID that was never registered fails with a {@link CatalogLookupException}.
 */
@NotThreadSafe
public class TypeRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(TypeRegistry.class);

    private final Map<String, PostgresType> nameToType = new HashMap<>();
    private final Map<Integer, PostgresType> oidToType = new HashMap<>();

    public TypeRegistry() {
        prime();
    }

    private void prime() {
        base("bool", Oid.BOOL, ValueKind.BOOLEAN);
        base("bytea", Oid.BYTEA, ValueKind.BINARY);
        base("char", Oid.CHAR, ValueKind.TEXT);
        base("name", Oid.NAME, ValueKind.TEXT);
        base("int8", Oid.INT8, ValueKind.NUMBER);
        base("int2", Oid.INT2, ValueKind.NUMBER);
        base("int4", Oid.INT4, ValueKind.NUMBER);
        base("text", Oid.TEXT, ValueKind.TEXT);
        base("oid", Oid.OID, ValueKind.NUMBER);
        base("xid", PgOid.XID, ValueKind.TEXT);
        base("cid", PgOid.CID, ValueKind.TEXT);
        base("json", Oid.JSON, ValueKind.TEXT);
        base("xml", Oid.XML, ValueKind.TEXT);
        base("point", Oid.POINT, ValueKind.TEXT);
        base("lseg", PgOid.LSEG, ValueKind.TEXT);
        base("path", PgOid.PATH, ValueKind.TEXT);
        base("box", Oid.BOX, ValueKind.TEXT);
        base("polygon", PgOid.POLYGON, ValueKind.TEXT);
        base("line", PgOid.LINE, ValueKind.TEXT);
        base("cidr", PgOid.CIDR_OID, ValueKind.TEXT);
        base("float4", Oid.FLOAT4, ValueKind.NUMBER);
        base("float8", Oid.FLOAT8, ValueKind.NUMBER);
        base("circle", PgOid.CIRCLE, ValueKind.TEXT);
        base("macaddr8", PgOid.MACADDR8_OID, ValueKind.TEXT);
        base("money", Oid.MONEY, ValueKind.TEXT);
        base("macaddr", PgOid.MACADDR_OID, ValueKind.TEXT);
        base("inet", PgOid.INET_OID, ValueKind.TEXT);
        base("bpchar", Oid.BPCHAR, ValueKind.TEXT);
        base("varchar", Oid.VARCHAR, ValueKind.TEXT);
        base("date", Oid.DATE, ValueKind.TEXT);
        base("time", Oid.TIME, ValueKind.TEXT);
        base("timestamp", Oid.TIMESTAMP, ValueKind.TEXT);
        base("timestamptz", Oid.TIMESTAMPTZ, ValueKind.TEXT);
        base("interval", Oid.INTERVAL, ValueKind.TEXT);
        base("timetz", Oid.TIMETZ, ValueKind.TEXT);
        base("bit", Oid.BIT, ValueKind.TEXT);
        base("varbit", Oid.VARBIT, ValueKind.TEXT);
        base("numeric", Oid.NUMERIC, ValueKind.NUMBER);
        base("uuid", Oid.UUID, ValueKind.TEXT);
        base("pg_lsn", PgOid.PG_LSN, ValueKind.TEXT);
        base("tsvector", PgOid.TSVECTOR_OID, ValueKind.TEXT);
        base("jsonb", PgOid.JSONB_OID, ValueKind.TEXT);
        base("int4range", PgOid.INT4RANGE_OID, ValueKind.TEXT);
        base("numrange", PgOid.NUM_RANGE_OID, ValueKind.TEXT);
        base("tsrange", PgOid.TSRANGE_OID, ValueKind.TEXT);
        base("tstzrange", PgOid.TSTZRANGE_OID, ValueKind.TEXT);
        base("daterange", PgOid.DATERANGE_OID, ValueKind.TEXT);
        base("int8range", PgOid.INT8RANGE_OID, ValueKind.TEXT);

        array("_bool", Oid.BOOL_ARRAY, Oid.BOOL);
        array("_bytea", Oid.BYTEA_ARRAY, Oid.BYTEA);
        array("_char", Oid.CHAR_ARRAY, Oid.CHAR);
        array("_name", Oid.NAME_ARRAY, Oid.NAME);
        array("_int2", Oid.INT2_ARRAY, Oid.INT2);
        array("_int4", Oid.INT4_ARRAY, Oid.INT4);
        array("_text", Oid.TEXT_ARRAY, Oid.TEXT);
        array("_bpchar", Oid.BPCHAR_ARRAY, Oid.BPCHAR);
        array("_varchar", Oid.VARCHAR_ARRAY, Oid.VARCHAR);
        array("_int8", Oid.INT8_ARRAY, Oid.INT8);
        array("_point", Oid.POINT_ARRAY, Oid.POINT);
        array("_float4", Oid.FLOAT4_ARRAY, Oid.FLOAT4);
        array("_float8", Oid.FLOAT8_ARRAY, Oid.FLOAT8);
        array("_oid", Oid.OID_ARRAY, Oid.OID);
        array("_json", Oid.JSON_ARRAY, Oid.JSON);
        array("_xml", Oid.XML_ARRAY, Oid.XML);
        array("_money", Oid.MONEY_ARRAY, Oid.MONEY);
        array("_cidr", PgOid.CIDR_ARRAY, PgOid.CIDR_OID);
        array("_macaddr", PgOid.MACADDR_ARRAY, PgOid.MACADDR_OID);
        array("_inet", PgOid.INET_ARRAY, PgOid.INET_OID);
        array("_date", Oid.DATE_ARRAY, Oid.DATE);
        array("_time", Oid.TIME_ARRAY, Oid.TIME);
        array("_timestamp", Oid.TIMESTAMP_ARRAY, Oid.TIMESTAMP);
        array("_timestamptz", Oid.TIMESTAMPTZ_ARRAY, Oid.TIMESTAMPTZ);
        array("_interval", Oid.INTERVAL_ARRAY, Oid.INTERVAL);
        array("_timetz", Oid.TIMETZ_ARRAY, Oid.TIMETZ);
        array("_bit", Oid.BIT_ARRAY, Oid.BIT);
        array("_varbit", Oid.VARBIT_ARRAY, Oid.VARBIT);
        array("_numeric", Oid.NUMERIC_ARRAY, Oid.NUMERIC);
        array("_uuid", Oid.UUID_ARRAY, Oid.UUID);
        array("_jsonb", PgOid.JSONB_ARRAY, PgOid.JSONB_OID);
    }

    private void base(String name, int oid, ValueKind kind) {
        addType(new PostgresType.Builder(this, name, oid).kind(kind).build());
    }

    private void array(String name, int oid, int elementOid) {
        addType(new PostgresType.Builder(this, name, oid).elementType(elementOid).build());
    }

    private void addType(PostgresType type) {
        oidToType.put(type.getOid(), type);
        nameToType.put(type.getName(), type);
    }

    /**
     * Register a type that is not built into the server, replacing any type with the same OID.
     *
     * @param type the type; may not be null
     * @return this registry
     */
    public TypeRegistry register(PostgresType type) {
        LOGGER.debug("Registering type '{}' with OID {}", type.getName(), type.getOid());
        addType(type);
        return this;
    }

    /**
     * Register a user-defined scalar type (enum, composite, extension type) whose values are rendered as strings.
     */
    public TypeRegistry register(String name, int oid) {
        return register(new PostgresType.Builder(this, name, oid).build());
    }

    /**
     * Start building a type bound to this registry, so that element types resolve against it.
     */
    public PostgresType.Builder builder(String name, int oid) {
        return new PostgresType.Builder(this, name, oid);
    }

    /**
     *
     * @param oid - PostgreSQL OID
     * @return type associated with the given OID
     * @throws CatalogLookupException if no type with the given OID is known
     */
    public PostgresType get(int oid) {
        PostgresType r = oidToType.get(oid);
        if (r == null) {
            throw new CatalogLookupException(oid);
        }
        return r;
    }

    /**
     *
     * @param name - catalog name of the type
     * @return type associated with the given name, or {@code null} if there is none
     */
    public PostgresType get(String name) {
        return nameToType.get(name);
    }

    public Map<String, PostgresType> getRegisteredTypes() {
        return Collections.unmodifiableMap(nameToType);
    }
}
