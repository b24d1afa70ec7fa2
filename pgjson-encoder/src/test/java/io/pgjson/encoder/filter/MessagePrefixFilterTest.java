/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

public class MessagePrefixFilterTest {

    @Test
    public void shouldIncludeEveryPrefixByDefault() {
        MessagePrefixFilter filter = new MessagePrefixFilter(null, null);
        assertThat(filter.isIncluded("audit")).isTrue();
        assertThat(filter.isIncluded("")).isTrue();
    }

    @Test
    public void shouldIncludeOnlyAddedPrefixes() {
        MessagePrefixFilter filter = new MessagePrefixFilter("audit, billing", null);
        assertThat(filter.isIncluded("audit")).isTrue();
        assertThat(filter.isIncluded("billing")).isTrue();
        assertThat(filter.isIncluded("auditing")).isFalse();
    }

    @Test
    public void shouldExcludeFilteredPrefixes() {
        MessagePrefixFilter filter = new MessagePrefixFilter(null, "noise");
        assertThat(filter.isIncluded("noise")).isFalse();
        assertThat(filter.isIncluded("audit")).isTrue();
    }

    @Test
    public void shouldLetExclusionWin() {
        MessagePrefixFilter filter = new MessagePrefixFilter("audit,noise", "noise");
        assertThat(filter.isIncluded("audit")).isTrue();
        assertThat(filter.isIncluded("noise")).isFalse();
        assertThat(filter.isIncluded("other")).isFalse();
    }

    @Test
    public void shouldUnescapePrefixes() {
        assertThat(MessagePrefixFilter.parseList("a\\,b,c\\ d")).containsExactly("a,b", "c d");
        assertThat(new MessagePrefixFilter("a\\,b", null).isIncluded("a,b")).isTrue();
    }

    @Test
    public void shouldRejectMalformedList() {
        assertThatThrownBy(() -> MessagePrefixFilter.parseList("a,,b")).isInstanceOf(IllegalArgumentException.class);
    }
}
