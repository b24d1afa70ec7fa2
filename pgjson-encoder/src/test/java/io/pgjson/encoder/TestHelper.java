/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.postgresql.core.Oid;
import org.postgresql.replication.LogSequenceNumber;

import io.pgjson.encoder.spi.ColumnDescriptor;
import io.pgjson.encoder.spi.Relation;
import io.pgjson.encoder.spi.ReplicaIdentity;
import io.pgjson.encoder.spi.TransactionInfo;
import io.pgjson.encoder.types.TypeRegistry;

/**
 * Relations, transactions and sessions shared by the encoder tests.
 */
public final class TestHelper {

    public static final int VARCHAR_255 = 255 + 4;

    private TestHelper() {
    }

    /**
     * {@code public.customers (id integer primary key, name varchar(255), score float8, active boolean)}
     */
    public static Relation customers() {
        return Relation.builder(16384, "public", "customers")
                .column(ColumnDescriptor.builder("id", Oid.INT4).notNull(true).attributeNumber(1).build())
                .column(ColumnDescriptor.builder("name", Oid.VARCHAR).typeModifier(VARCHAR_255).attributeNumber(2).build())
                .column(ColumnDescriptor.builder("score", Oid.FLOAT8).attributeNumber(3).build())
                .column(ColumnDescriptor.builder("active", Oid.BOOL).attributeNumber(4).build())
                .identityIndexColumns("id")
                .build();
    }

    /**
     * {@code public.tags (id integer primary key, label text)}
     */
    public static Relation tags() {
        return Relation.builder(16390, "public", "tags")
                .column(ColumnDescriptor.builder("id", Oid.INT4).notNull(true).attributeNumber(1).build())
                .column(ColumnDescriptor.builder("label", Oid.TEXT).attributeNumber(2).build())
                .identityIndexColumns("id")
                .build();
    }

    /**
     * A table without primary key and with the default replica identity.
     */
    public static Relation auditLog() {
        return Relation.builder(16400, "audit", "log")
                .column("id", Oid.INT8)
                .column("entry", Oid.TEXT)
                .build();
    }

    public static Relation withReplicaIdentity(Relation relation, ReplicaIdentity identity) {
        Relation.Builder builder = Relation.builder(relation.oid(), relation.schema(), relation.name()).replicaIdentity(identity);
        relation.columns().forEach(builder::column);
        builder.identityIndexColumns(relation.identityIndexColumns().toArray(new String[0]));
        return builder.build();
    }

    public static TransactionInfo transaction(long xid) {
        return TransactionInfo.builder(xid)
                .firstLsn(LogSequenceNumber.valueOf("0/16B2340"))
                .endLsn(LogSequenceNumber.valueOf("0/16B2408"))
                .commitLsn(LogSequenceNumber.valueOf("0/16B23D8"))
                .commitTime(OffsetDateTime.of(2018, 3, 27, 11, 58, 28, 988414000, ZoneOffset.ofHours(-3)))
                .build();
    }

    public static List<PluginOption> options(String... namesAndValues) {
        List<PluginOption> options = new ArrayList<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            options.add(PluginOption.of(namesAndValues[i], namesAndValues[i + 1]));
        }
        return options;
    }

    public static JsonEncoder encoder(CollectingOutputSink sink, String... namesAndValues) {
        return new JsonEncoder(JsonEncoderConfig.from(options(namesAndValues)), sink, new TypeRegistry());
    }
}
