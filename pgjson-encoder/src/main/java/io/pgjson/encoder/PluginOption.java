/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder;

import java.util.Objects;

/**
 * One option passed when the decoding session starts. The value is {@code null} when the option was given without
 * a value, which boolean options read as {@code true}.
 */
public record PluginOption(String name, String value) {

    public PluginOption {
        Objects.requireNonNull(name, "name");
    }

    public static PluginOption of(String name, String value) {
        return new PluginOption(name, value);
    }

    public static PluginOption of(String name) {
        return new PluginOption(name, null);
    }
}
