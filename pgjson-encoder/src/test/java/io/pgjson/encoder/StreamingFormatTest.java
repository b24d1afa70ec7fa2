/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;

import org.junit.Before;
import org.junit.Test;
import org.postgresql.replication.LogSequenceNumber;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.pgjson.encoder.spi.LogicalMessage;
import io.pgjson.encoder.spi.Relation;
import io.pgjson.encoder.spi.RowChange;
import io.pgjson.encoder.spi.RowImage;
import io.pgjson.encoder.spi.TransactionInfo;

/**
 * Exact output of format version 2, one JSON object per record.
 */
public class StreamingFormatTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CollectingOutputSink sink;
    private Relation customers;
    private Relation tags;
    private TransactionInfo txn;

    @Before
    public void beforeEach() {
        sink = new CollectingOutputSink();
        customers = TestHelper.customers();
        tags = TestHelper.tags();
        txn = TestHelper.transaction(700);
    }

    private JsonEncoder encoder(String... namesAndValues) {
        String[] options = new String[namesAndValues.length + 2];
        options[0] = "format-version";
        options[1] = "2";
        System.arraycopy(namesAndValues, 0, options, 2, namesAndValues.length);
        return TestHelper.encoder(sink, options);
    }

    private RowChange insertTag(String id, String label) {
        return RowChange.insert(RowImage.builder(tags).value("id", id).value("label", label).build());
    }

    @Test
    public void shouldWriteOneRecordPerChangeWithoutBoundaries() {
        try (JsonEncoder encoder = encoder("include-transaction", "false")) {
            encoder.begin(txn);
            encoder.change(txn, tags, insertTag("1", "a"));
            encoder.change(txn, tags, insertTag("2", "b"));
            encoder.change(txn, tags, insertTag("3", "c"));
            encoder.commit(txn);
        }
        assertThat(sink.chunks()).containsExactly(
                "{\"action\":\"I\",\"schema\":\"public\",\"table\":\"tags\",\"columns\":[{\"name\":\"id\",\"type\":\"integer\",\"value\":1},{\"name\":\"label\",\"type\":\"text\",\"value\":\"a\"}]}",
                "{\"action\":\"I\",\"schema\":\"public\",\"table\":\"tags\",\"columns\":[{\"name\":\"id\",\"type\":\"integer\",\"value\":2},{\"name\":\"label\",\"type\":\"text\",\"value\":\"b\"}]}",
                "{\"action\":\"I\",\"schema\":\"public\",\"table\":\"tags\",\"columns\":[{\"name\":\"id\",\"type\":\"integer\",\"value\":3},{\"name\":\"label\",\"type\":\"text\",\"value\":\"c\"}]}");
    }

    @Test
    public void shouldWriteBeginAndCommitRecords() {
        try (JsonEncoder encoder = encoder()) {
            encoder.begin(txn);
            encoder.change(txn, tags, insertTag("1", "a"));
            encoder.commit(txn);
        }
        assertThat(sink.chunks()).hasSize(3);
        assertThat(sink.chunks().get(0)).isEqualTo("{\"action\":\"B\"}");
        assertThat(sink.chunks().get(2)).isEqualTo("{\"action\":\"C\"}");
    }

    @Test
    public void shouldWriteTransactionMetadataOnBoundaries() {
        try (JsonEncoder encoder = encoder("include-xids", "1", "include-timestamp", "1", "include-lsn", "1")) {
            encoder.begin(txn);
            encoder.change(txn, tags, insertTag("1", "a").at(LogSequenceNumber.valueOf("0/16B2388")));
            encoder.commit(txn);
        }
        assertThat(sink.chunks()).containsExactly(
                "{\"action\":\"B\",\"xid\":700,\"timestamp\":\"2018-03-27 11:58:28.988414-03\",\"lsn\":\"0/16B2340\",\"nextlsn\":\"0/16B2408\"}",
                "{\"action\":\"I\",\"xid\":700,\"timestamp\":\"2018-03-27 11:58:28.988414-03\",\"lsn\":\"0/16B2388\",\"schema\":\"public\",\"table\":\"tags\","
                        + "\"columns\":[{\"name\":\"id\",\"type\":\"integer\",\"value\":1},{\"name\":\"label\",\"type\":\"text\",\"value\":\"a\"}]}",
                "{\"action\":\"C\",\"xid\":700,\"timestamp\":\"2018-03-27 11:58:28.988414-03\",\"lsn\":\"0/16B23D8\",\"nextlsn\":\"0/16B2408\"}");
    }

    @Test
    public void shouldWriteTypeOidsAndOptionalOnlyForColumns() {
        RowChange update = RowChange.update(null, RowImage.builder(tags).value("id", "1").value("label", "b").build());
        try (JsonEncoder encoder = encoder("include-transaction", "0", "include-type-oids", "1", "include-not-null", "1", "include-schemas", "0")) {
            encoder.begin(txn);
            encoder.change(txn, tags, update);
            encoder.commit(txn);
        }
        assertThat(sink.chunks()).containsExactly("{\"action\":\"U\",\"table\":\"tags\","
                + "\"columns\":[{\"name\":\"id\",\"type\":\"integer\",\"typeoid\":23,\"optional\":false,\"value\":1},"
                + "{\"name\":\"label\",\"type\":\"text\",\"typeoid\":25,\"optional\":true,\"value\":\"b\"}],"
                + "\"identity\":[{\"name\":\"id\",\"type\":\"integer\",\"typeoid\":23,\"value\":1}]}");
    }

    @Test
    public void shouldWriteOptionalWithoutTypes() {
        try (JsonEncoder encoder = encoder("include-transaction", "0", "include-types", "0", "include-not-null", "1")) {
            encoder.begin(txn);
            encoder.change(txn, tags, insertTag("1", null));
            encoder.commit(txn);
        }
        assertThat(sink.chunks()).containsExactly("{\"action\":\"I\",\"schema\":\"public\",\"table\":\"tags\","
                + "\"columns\":[{\"name\":\"id\",\"optional\":false,\"value\":1},{\"name\":\"label\",\"optional\":true,\"value\":null}]}");
    }

    @Test
    public void shouldWriteDeleteWithIdentityOnly() {
        RowChange delete = RowChange.delete(RowImage.builder(customers).value("id", "5").build());
        try (JsonEncoder encoder = encoder("include-transaction", "0")) {
            encoder.begin(txn);
            encoder.change(txn, customers, delete);
            encoder.commit(txn);
        }
        assertThat(sink.chunks()).containsExactly(
                "{\"action\":\"D\",\"schema\":\"public\",\"table\":\"customers\",\"identity\":[{\"name\":\"id\",\"type\":\"integer\",\"value\":5}]}");
    }

    @Test
    public void shouldWriteRecordsThatParseAsJson() throws IOException {
        RowChange insert = RowChange.insert(RowImage.builder(customers)
                .value("id", "1").value("name", "line\nbreak \"quoted\"").value("score", "NaN").value("active", "f").build());
        try (JsonEncoder encoder = encoder("include-xids", "1")) {
            encoder.begin(txn);
            encoder.change(txn, customers, insert);
            encoder.commit(txn);
        }
        for (String record : sink.chunks()) {
            assertThat(record).doesNotContain("\n");
        }
        JsonNode change = MAPPER.readTree(sink.chunks().get(1));
        assertThat(change.get("action").asText()).isEqualTo("I");
        assertThat(change.get("xid").asLong()).isEqualTo(700L);
        JsonNode columns = change.get("columns");
        assertThat(columns.size()).isEqualTo(4);
        assertThat(columns.get(0).get("value").asInt()).isEqualTo(1);
        assertThat(columns.get(1).get("type").asText()).isEqualTo("character varying(255)");
        assertThat(columns.get(1).get("value").asText()).isEqualTo("line\nbreak \"quoted\"");
        assertThat(columns.get(2).get("value").isNull()).isTrue();
        assertThat(columns.get(3).get("value").asBoolean()).isFalse();
    }

    @Test
    public void shouldIgnorePrettyPrint() {
        try (JsonEncoder encoder = encoder("pretty-print", "1", "include-transaction", "0")) {
            encoder.begin(txn);
            encoder.change(txn, tags, insertTag("1", "a"));
            encoder.commit(txn);
        }
        assertThat(sink.chunks()).containsExactly(
                "{\"action\":\"I\",\"schema\":\"public\",\"table\":\"tags\",\"columns\":[{\"name\":\"id\",\"type\":\"integer\",\"value\":1},{\"name\":\"label\",\"type\":\"text\",\"value\":\"a\"}]}");
    }

    @Test
    public void shouldWriteMessages() {
        try (JsonEncoder encoder = encoder("include-xids", "1")) {
            encoder.message(null, LogicalMessage.nonTransactional("audit", "outside"));
            encoder.begin(txn);
            encoder.message(txn, LogicalMessage.transactional("audit", "inside"));
            encoder.commit(txn);
        }
        assertThat(sink.chunks()).containsExactly(
                "{\"action\":\"M\",\"transactional\":false,\"prefix\":\"audit\",\"content\":\"outside\"}",
                "{\"action\":\"B\",\"xid\":700}",
                "{\"action\":\"M\",\"xid\":700,\"transactional\":true,\"prefix\":\"audit\",\"content\":\"inside\"}",
                "{\"action\":\"C\",\"xid\":700}");
    }

    @Test
    public void shouldWriteMessageLocation() {
        LogicalMessage message = new LogicalMessage(false, "audit", new byte[]{ 'x' }, LogSequenceNumber.valueOf("0/16B2500"));
        try (JsonEncoder encoder = encoder("include-lsn", "1")) {
            encoder.message(null, message);
        }
        assertThat(sink.chunks()).containsExactly(
                "{\"action\":\"M\",\"lsn\":\"0/16B2500\",\"transactional\":false,\"prefix\":\"audit\",\"content\":\"x\"}");
    }

    @Test
    public void shouldFilterMessagesByPrefix() {
        try (JsonEncoder encoder = encoder("filter-msg-prefixes", "noise")) {
            encoder.message(null, LogicalMessage.nonTransactional("noise", "dropped"));
            encoder.message(null, LogicalMessage.nonTransactional("audit", "kept"));
        }
        assertThat(sink.chunks()).hasSize(1);
        assertThat(sink.last()).contains("\"kept\"");
    }

    @Test
    public void shouldSkipEmptyTransactions() {
        try (JsonEncoder encoder = encoder("skip-empty-xacts", "1")) {
            encoder.begin(txn);
            encoder.commit(txn);
            assertThat(sink.chunks()).isEmpty();

            encoder.begin(txn);
            encoder.change(txn, tags, insertTag("1", "a"));
            encoder.commit(txn);
        }
        assertThat(sink.chunks()).hasSize(3);
        assertThat(sink.chunks().get(0)).isEqualTo("{\"action\":\"B\"}");
        assertThat(sink.chunks().get(2)).isEqualTo("{\"action\":\"C\"}");
    }

    @Test
    public void shouldRejectChangeOutsideTransaction() {
        try (JsonEncoder encoder = encoder()) {
            assertThatThrownBy(() -> encoder.change(txn, tags, insertTag("1", "a")))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("Received a change outside of a transaction");
            assertThatThrownBy(() -> encoder.commit(txn))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
