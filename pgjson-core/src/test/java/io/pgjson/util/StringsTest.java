/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Arrays;

import org.junit.Test;

public class StringsTest {

    @Test
    public void splitEscapedShouldTrimWhitespaceAroundItems() {
        assertThat(Strings.splitEscaped("  public.foo ,\tpublic.bar,s.t  ", ',')).containsExactly("public.foo", "public.bar", "s.t");
    }

    @Test
    public void splitEscapedShouldKeepEscapedSeparators() {
        assertThat(Strings.splitEscaped("a\\,b,c", ',')).containsExactly("a\\,b", "c");
        assertThat(Strings.splitEscaped("my\\ table,c", ',')).containsExactly("my\\ table", "c");
    }

    @Test
    public void splitEscapedShouldAcceptEmptyInput() {
        assertThat(Strings.splitEscaped(null, ',')).isEmpty();
        assertThat(Strings.splitEscaped("", ',')).isEmpty();
        assertThat(Strings.splitEscaped("   ", ',')).isEmpty();
    }

    @Test
    public void splitEscapedShouldRejectEmptyItems() {
        assertThatThrownBy(() -> Strings.splitEscaped("a,,b", ',')).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Strings.splitEscaped("a,", ',')).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void splitEscapedShouldRejectUnescapedInnerWhitespace() {
        assertThatThrownBy(() -> Strings.splitEscaped("a b,c", ',')).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void unescapeShouldDropEscapeCharacters() {
        assertEquals("a,b", Strings.unescape("a\\,b"));
        assertEquals("a\\b", Strings.unescape("a\\\\b"));
        assertEquals("plain", Strings.unescape("plain"));
        assertEquals("x", Strings.unescape("x\\"));
    }

    @Test
    public void shouldParseServerBooleanLiterals() {
        for (String literal : Arrays.asList("t", "TRUE", "tr", "y", "yes", "on", "ON", "1")) {
            assertThat(Strings.asPostgresBoolean(literal)).as(literal).isTrue();
        }
        for (String literal : Arrays.asList("f", "False", "fal", "n", "no", "of", "off", "0")) {
            assertThat(Strings.asPostgresBoolean(literal)).as(literal).isFalse();
        }
    }

    @Test
    public void shouldRejectUnknownBooleanLiterals() {
        for (String literal : Arrays.asList("", "o", "truex", "yess", "2", "10", "enabled")) {
            assertNull(literal, Strings.asPostgresBoolean(literal));
        }
        assertNull(Strings.asPostgresBoolean(null));
    }

    @Test
    public void joinShouldSkipNullConversions() {
        assertEquals("a, c", Strings.join(", ", Arrays.asList("a", null, "c")));
        assertEquals("", Strings.join(",", Arrays.asList()));
    }

    @Test
    public void shouldDetectEmptyStrings() {
        assertThat(Strings.isNullOrEmpty("")).isTrue();
        assertThat(Strings.isNullOrEmpty(" ")).isFalse();
    }
}
