/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.types;

import java.util.Objects;

import org.postgresql.core.Oid;

import io.pgjson.annotation.Immutable;

/**
 * A class that binds together a PostgreSQL OID, the catalog name of the type and the way its values are rendered.
 * The array types contain link to their element type.
 */
@Immutable
public class PostgresType {

    /**
     * Size of the varlena header that {@code character} and {@code character varying} modifiers include.
     */
    private static final int VARHDRSZ = 4;

    private static final int INTERVAL_FULL_RANGE = 0x7FFF;
    private static final int INTERVAL_FULL_PRECISION = 0xFFFF;
    private static final int MONTH = 1 << 1;
    private static final int YEAR = 1 << 2;
    private static final int DAY = 1 << 3;
    private static final int HOUR = 1 << 10;
    private static final int MINUTE = 1 << 11;
    private static final int SECOND = 1 << 12;

    private final String name;
    private final int oid;
    private final ValueKind kind;
    private final PostgresType elementType;

    private PostgresType(String name, int oid, ValueKind kind, PostgresType elementType) {
        this.name = Objects.requireNonNull(name);
        this.oid = oid;
        this.kind = Objects.requireNonNull(kind);
        this.elementType = elementType;
    }

    /**
     * @return true if this type is an array
     */
    public boolean isArrayType() {
        return elementType != null;
    }

    /**
     *
     * @return catalog name of the type ({@code pg_type.typname})
     */
    public String getName() {
        return name;
    }

    /**
     *
     * @return PostgreSQL OID of this type
     */
    public int getOid() {
        return oid;
    }

    public ValueKind getKind() {
        return kind;
    }

    /**
     *
     * @return the type of element in arrays or null for primitive types
     */
    public PostgresType getElementType() {
        return elementType;
    }

    /**
     * Render the SQL name of this type the way {@code format_type(oid, typmod)} does, e.g. {@code character varying(255)}
     * for {@code varchar} with a modifier of 259.
     *
     * @param modifier the type modifier, negative if there is none
     * @return the formatted name; never null
     */
    public String format(int modifier) {
        if (elementType != null) {
            return elementType.format(modifier) + "[]";
        }
        final boolean withModifier = modifier >= 0;
        switch (oid) {
            case Oid.BIT:
                return withModifier ? "bit(" + modifier + ")" : name;
            case Oid.BOOL:
                return "boolean";
            case Oid.BPCHAR:
                // bpchar without a modifier is not character(1), so it keeps its catalog name
                return withModifier ? "character(" + (modifier - VARHDRSZ) + ")" : name;
            case Oid.CHAR:
                return "\"char\"";
            case Oid.FLOAT4:
                return "real";
            case Oid.FLOAT8:
                return "double precision";
            case Oid.INT2:
                return "smallint";
            case Oid.INT4:
                return "integer";
            case Oid.INT8:
                return "bigint";
            case Oid.NUMERIC:
                return withModifier ? "numeric" + numericModifier(modifier) : "numeric";
            case Oid.INTERVAL:
                return withModifier ? "interval" + intervalModifier(modifier) : "interval";
            case Oid.TIME:
                return withModifier ? "time(" + modifier + ") without time zone" : "time without time zone";
            case Oid.TIMETZ:
                return withModifier ? "time(" + modifier + ") with time zone" : "time with time zone";
            case Oid.TIMESTAMP:
                return withModifier ? "timestamp(" + modifier + ") without time zone" : "timestamp without time zone";
            case Oid.TIMESTAMPTZ:
                return withModifier ? "timestamp(" + modifier + ") with time zone" : "timestamp with time zone";
            case Oid.VARBIT:
                return withModifier ? "bit varying(" + modifier + ")" : "bit varying";
            case Oid.VARCHAR:
                return withModifier ? "character varying(" + (modifier - VARHDRSZ) + ")" : "character varying";
            default:
                return name;
        }
    }

    private static String numericModifier(int modifier) {
        final int value = modifier - VARHDRSZ;
        final int precision = (value >> 16) & 0xFFFF;
        final int scale = ((value & 0x7FF) ^ 1024) - 1024;
        return "(" + precision + "," + scale + ")";
    }

    private static String intervalModifier(int modifier) {
        final int precision = modifier & 0xFFFF;
        final String fields = intervalFields((modifier >> 16) & 0x7FFF);
        return precision != INTERVAL_FULL_PRECISION ? fields + "(" + precision + ")" : fields;
    }

    private static String intervalFields(int range) {
        switch (range) {
            case YEAR:
                return " year";
            case MONTH:
                return " month";
            case DAY:
                return " day";
            case HOUR:
                return " hour";
            case MINUTE:
                return " minute";
            case SECOND:
                return " second";
            case YEAR | MONTH:
                return " year to month";
            case DAY | HOUR:
                return " day to hour";
            case DAY | HOUR | MINUTE:
                return " day to minute";
            case DAY | HOUR | MINUTE | SECOND:
                return " day to second";
            case HOUR | MINUTE:
                return " hour to minute";
            case HOUR | MINUTE | SECOND:
                return " hour to second";
            case MINUTE | SECOND:
                return " minute to second";
            case INTERVAL_FULL_RANGE:
            default:
                return "";
        }
    }

    @Override
    public int hashCode() {
        return oid;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return oid == ((PostgresType) obj).oid;
    }

    @Override
    public String toString() {
        return "PostgresType [name=" + name + ", oid=" + oid + ", kind=" + kind + ", elementType=" + elementType + "]";
    }

    public static class Builder {
        private final TypeRegistry typeRegistry;
        private final String name;
        private final int oid;
        private ValueKind kind = ValueKind.TEXT;
        private int elementTypeOid;

        public Builder(TypeRegistry typeRegistry, String name, int oid) {
            this.typeRegistry = typeRegistry;
            this.name = name;
            this.oid = oid;
        }

        public Builder kind(ValueKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder elementType(int elementTypeOid) {
            this.elementTypeOid = elementTypeOid;
            return this;
        }

        /**
         * @throws CatalogLookupException if the element type is not registered
         */
        public PostgresType build() {
            PostgresType elementType = null;
            if (elementTypeOid != 0) {
                elementType = typeRegistry.get(elementTypeOid);
            }
            return new PostgresType(name, oid, kind, elementType);
        }
    }
}
