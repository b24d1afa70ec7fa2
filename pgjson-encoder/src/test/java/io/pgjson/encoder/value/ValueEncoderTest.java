/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.value;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Before;
import org.junit.Test;
import org.postgresql.core.Oid;

import io.pgjson.encoder.types.PgOid;
import io.pgjson.encoder.types.PostgresType;
import io.pgjson.encoder.types.TypeRegistry;

public class ValueEncoderTest {

    private TypeRegistry types;

    @Before
    public void beforeEach() {
        types = new TypeRegistry();
    }

    private String encode(int oid, String text) {
        return ValueEncoder.encode(types.get(oid), text);
    }

    @Test
    public void shouldWriteNullForSqlNull() {
        assertThat(encode(Oid.INT4, null)).isEqualTo("null");
        assertThat(encode(Oid.TEXT, null)).isEqualTo("null");
        assertThat(encode(Oid.BOOL, null)).isEqualTo("null");
    }

    @Test
    public void shouldWriteNumbersVerbatim() {
        assertThat(encode(Oid.INT4, "42")).isEqualTo("42");
        assertThat(encode(Oid.INT8, "-9223372036854775808")).isEqualTo("-9223372036854775808");
        assertThat(encode(Oid.FLOAT8, "1.5e+10")).isEqualTo("1.5e+10");
        assertThat(encode(Oid.NUMERIC, "12345678901234567890.000001")).isEqualTo("12345678901234567890.000001");
        assertThat(encode(Oid.OID, "16384")).isEqualTo("16384");
    }

    @Test
    public void shouldWriteSpecialNumbersAsNull() {
        assertThat(encode(Oid.FLOAT8, "NaN")).isEqualTo("null");
        assertThat(encode(Oid.FLOAT4, "Infinity")).isEqualTo("null");
        assertThat(encode(Oid.FLOAT8, "-Infinity")).isEqualTo("null");
        assertThat(encode(Oid.NUMERIC, "nan")).isEqualTo("null");
    }

    @Test
    public void shouldRejectNumbersThatAreNotJson() {
        assertThatThrownBy(() -> encode(Oid.NUMERIC, "12,5"))
                .isInstanceOf(NotANumberException.class)
                .hasMessage("12,5 is not a number")
                .satisfies(e -> assertThat(((NotANumberException) e).text()).isEqualTo("12,5"));
        assertThatThrownBy(() -> encode(Oid.INT4, "")).isInstanceOf(NotANumberException.class);
    }

    @Test
    public void shouldRejectTextThatOnlyStartsWithSpecialNumber() {
        assertThatThrownBy(() -> encode(Oid.FLOAT8, "NaNx")).isInstanceOf(NotANumberException.class);
        assertThatThrownBy(() -> encode(Oid.NUMERIC, "Infinity99")).isInstanceOf(NotANumberException.class);
        assertThatThrownBy(() -> encode(Oid.FLOAT4, "-infinityx")).isInstanceOf(NotANumberException.class);
    }

    @Test
    public void shouldWriteBooleans() {
        assertThat(encode(Oid.BOOL, "t")).isEqualTo("true");
        assertThat(encode(Oid.BOOL, "f")).isEqualTo("false");
    }

    @Test
    public void shouldStripByteaHexPrefix() {
        assertThat(encode(Oid.BYTEA, "\\xdeadbeef")).isEqualTo("\"deadbeef\"");
        assertThat(encode(Oid.BYTEA, "escaped")).isEqualTo("\"escaped\"");
    }

    @Test
    public void shouldQuoteEverythingElse() {
        assertThat(encode(Oid.TEXT, "say \"hi\"")).isEqualTo("\"say \\\"hi\\\"\"");
        assertThat(encode(Oid.DATE, "2018-03-27")).isEqualTo("\"2018-03-27\"");
        assertThat(encode(PgOid.JSONB_OID, "{\"a\": 1}")).isEqualTo("\"{\\\"a\\\": 1}\"");
        assertThat(encode(Oid.INT4_ARRAY, "{1,2,3}")).isEqualTo("\"{1,2,3}\"");
        assertThat(encode(Oid.MONEY, "$1.00")).isEqualTo("\"$1.00\"");
    }

    @Test
    public void shouldQuoteUserDefinedTypes() {
        PostgresType mood = types.register("mood", 70000).get(70000);
        assertThat(ValueEncoder.encode(mood, "happy")).isEqualTo("\"happy\"");
    }

    @Test
    public void shouldAppendToBuffer() {
        StringBuilder out = new StringBuilder("[");
        ValueEncoder.encode(types.get(Oid.INT4), "7", out).append(']');
        assertThat(out.toString()).isEqualTo("[7]");
    }
}
