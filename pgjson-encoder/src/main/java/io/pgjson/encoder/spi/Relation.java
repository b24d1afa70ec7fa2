/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.spi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import io.pgjson.annotation.Immutable;

/**
 * A table whose changes are being decoded: its identity, its row descriptor and its replica identity settings.
 */
@Immutable
public final class Relation {

    private final long oid;
    private final String schema;
    private final String name;
    private final List<ColumnDescriptor> columns;
    private final ReplicaIdentity replicaIdentity;
    private final Set<String> identityIndexColumns;

    private Relation(Builder builder) {
        this.oid = builder.oid;
        this.schema = Objects.requireNonNull(builder.schema, "The schema name is required");
        this.name = Objects.requireNonNull(builder.name, "The table name is required");
        this.columns = Collections.unmodifiableList(new ArrayList<>(builder.columns));
        this.replicaIdentity = builder.replicaIdentity;
        this.identityIndexColumns = Collections.unmodifiableSet(new LinkedHashSet<>(builder.identityIndexColumns));
    }

    public static Builder builder(long oid, String schema, String name) {
        return new Builder(oid, schema, name);
    }

    public long oid() {
        return oid;
    }

    public String schema() {
        return schema;
    }

    public String name() {
        return name;
    }

    /**
     * @return the row descriptor, in attribute order, including dropped and system attributes
     */
    public List<ColumnDescriptor> columns() {
        return columns;
    }

    public ReplicaIdentity replicaIdentity() {
        return replicaIdentity;
    }

    /**
     * The names of the columns of the replica identity index: the primary key under {@link ReplicaIdentity#DEFAULT},
     * the chosen index under {@link ReplicaIdentity#INDEX}, and nothing otherwise.
     *
     * @return the column names; never null
     */
    public Set<String> identityIndexColumns() {
        return identityIndexColumns;
    }

    public boolean hasIdentityIndex() {
        return !identityIndexColumns.isEmpty();
    }

    @Override
    public String toString() {
        return "\"" + schema + "\".\"" + name + "\"";
    }

    public static final class Builder {
        private final long oid;
        private final String schema;
        private final String name;
        private final List<ColumnDescriptor> columns = new ArrayList<>();
        private ReplicaIdentity replicaIdentity = ReplicaIdentity.DEFAULT;
        private final Set<String> identityIndexColumns = new LinkedHashSet<>();

        private Builder(long oid, String schema, String name) {
            this.oid = oid;
            this.schema = schema;
            this.name = name;
        }

        public Builder column(ColumnDescriptor column) {
            columns.add(column);
            return this;
        }

        public Builder column(String name, int typeOid) {
            return column(ColumnDescriptor.builder(name, typeOid).attributeNumber(columns.size() + 1).build());
        }

        public Builder replicaIdentity(ReplicaIdentity replicaIdentity) {
            this.replicaIdentity = Objects.requireNonNull(replicaIdentity);
            return this;
        }

        public Builder identityIndexColumns(String... names) {
            Collections.addAll(identityIndexColumns, names);
            return this;
        }

        public Relation build() {
            return new Relation(this);
        }
    }
}
