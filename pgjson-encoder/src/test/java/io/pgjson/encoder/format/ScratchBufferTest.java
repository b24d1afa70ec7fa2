/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

public class ScratchBufferTest {

    @Test
    public void shouldBeEmptyAfterRelease() {
        ScratchBuffer scratch = new ScratchBuffer();
        try (ScratchBuffer buffer = scratch.lease()) {
            buffer.builder().append("change");
            assertThat(scratch.isLeased()).isTrue();
        }
        assertThat(scratch.isLeased()).isFalse();
        try (ScratchBuffer buffer = scratch.lease()) {
            assertThat(buffer.builder().length()).isZero();
        }
        assertThat(scratch.leases()).isEqualTo(2);
    }

    @Test
    public void shouldBeReleasedWhenWritingFails() {
        ScratchBuffer scratch = new ScratchBuffer();
        assertThatThrownBy(() -> {
            try (ScratchBuffer buffer = scratch.lease()) {
                buffer.builder().append("partial");
                throw new IllegalStateException("boom");
            }
        }).isInstanceOf(IllegalStateException.class).hasMessage("boom");
        assertThat(scratch.isLeased()).isFalse();
    }

    @Test
    public void shouldNotBeLeasedTwice() {
        ScratchBuffer scratch = new ScratchBuffer().lease();
        assertThatThrownBy(scratch::lease).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void shouldNotHandOutBuilderWithoutLease() {
        assertThatThrownBy(() -> new ScratchBuffer().builder()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void shouldShrinkAfterLargeChange() {
        ScratchBuffer scratch = new ScratchBuffer();
        try (ScratchBuffer buffer = scratch.lease()) {
            StringBuilder builder = buffer.builder();
            for (int i = 0; i < 2 * 1024 * 1024; i++) {
                builder.append('x');
            }
        }
        try (ScratchBuffer buffer = scratch.lease()) {
            assertThat(buffer.builder().capacity()).isLessThanOrEqualTo(1024 * 1024);
        }
    }
}
