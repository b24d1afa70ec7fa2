/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.config;

import java.util.Collections;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.function.IntSupplier;
import java.util.function.Supplier;

import io.pgjson.annotation.Immutable;
import io.pgjson.config.Field.ValidationOutput;
import io.pgjson.util.Strings;

/**
 * An immutable representation of a set of string options, with typed accessors that fall back to the defaults
 * declared by {@link Field} definitions.
 */
@Immutable
public interface Configuration {

    /**
     * A builder of Configuration objects.
     */
    class Builder {
        private final Properties props = new Properties();

        protected Builder() {
        }

        /**
         * Associate the given value with the specified key, replacing any previous value.
         *
         * @param key the key
         * @param value the value
         * @return this builder object so methods can be chained together; never null
         */
        public Builder with(String key, String value) {
            props.setProperty(key, value);
            return this;
        }

        public Builder with(String key, int value) {
            return with(key, Integer.toString(value));
        }

        public Builder with(String key, boolean value) {
            return with(key, Boolean.toString(value));
        }

        public Builder with(Field field, String value) {
            return with(field.name(), value);
        }

        public Builder with(Field field, int value) {
            return with(field.name(), value);
        }

        public Builder with(Field field, boolean value) {
            return with(field.name(), value);
        }

        public Builder with(Field field, EnumeratedValue value) {
            return with(field.name(), value.getValue());
        }

        /**
         * Build and return the immutable configuration.
         *
         * @return the immutable configuration; never null
         */
        public Configuration build() {
            return Configuration.from(props);
        }

        @Override
        public String toString() {
            return props.toString();
        }
    }

    /**
     * Create a new {@link Builder configuration builder}.
     *
     * @return the configuration builder
     */
    static Builder create() {
        return new Builder();
    }

    /**
     * Obtain an empty configuration.
     *
     * @return an empty configuration; never null
     */
    static Configuration empty() {
        return new Configuration() {
            @Override
            public Set<String> keys() {
                return Collections.emptySet();
            }

            @Override
            public String getString(String key) {
                return null;
            }

            @Override
            public String toString() {
                return "{}";
            }
        };
    }

    /**
     * Obtain a configuration instance by copying the supplied Properties object.
     *
     * @param properties the properties; may be null or empty
     * @return the configuration; never null
     */
    static Configuration from(Properties properties) {
        Properties props = new Properties();
        if (properties != null) {
            props.putAll(properties);
        }
        return new Configuration() {
            @Override
            public String getString(String key) {
                return props.getProperty(key);
            }

            @Override
            public Set<String> keys() {
                return props.stringPropertyNames();
            }

            @Override
            public String toString() {
                return asMap().toString();
            }
        };
    }

    /**
     * Obtain a configuration instance by copying the supplied map of string keys and values. Null values are skipped.
     *
     * @param properties the properties; may be null or empty
     * @return the configuration; never null
     */
    static Configuration from(Map<String, ?> properties) {
        Properties props = new Properties();
        if (properties != null) {
            properties.forEach((key, value) -> {
                if (value != null) {
                    props.setProperty(key, value instanceof EnumeratedValue ? ((EnumeratedValue) value).getValue() : value.toString());
                }
            });
        }
        return from(props);
    }

    /**
     * Get the string value associated with the given key.
     *
     * @param key the key for the configuration property
     * @return the value, or null if the key is null or there is no such key-value pair in the configuration
     */
    String getString(String key);

    /**
     * Get the set of keys in this configuration.
     *
     * @return the set of keys; never null but possibly empty
     */
    Set<String> keys();

    /**
     * Determine whether this configuration contains a key-value pair with the given key and the value is non-null
     *
     * @param key the key
     * @return true if the configuration contains the key, or false otherwise
     */
    default boolean hasKey(String key) {
        return getString(key) != null;
    }

    default boolean hasKey(Field field) {
        return hasKey(field.name());
    }

    default String getString(String key, String defaultValue) {
        return getString(key, () -> defaultValue);
    }

    default String getString(String key, Supplier<String> defaultValueSupplier) {
        String value = getString(key);
        return value != null ? value : (defaultValueSupplier != null ? defaultValueSupplier.get() : null);
    }

    /**
     * Get the string value associated with the given field, returning the field's default value if there is no such
     * key-value pair in this configuration.
     *
     * @param field the field; may not be null
     * @return the configuration's value for the field, or the field's {@link Field#defaultValue() default value}
     */
    default String getString(Field field) {
        return getString(field.name(), field::defaultValueAsString);
    }

    /**
     * Get the integer value associated with the given key, using the given supplier to obtain a default value if there is no such
     * key-value pair.
     *
     * @param key the key for the configuration property
     * @param defaultValueSupplier the supplier for the default value; may be null
     * @return the integer value, or null if there is no such key-value pair and the {@code defaultValueSupplier} is null,
     *         or there is a key-value pair in the configuration but the value could not be parsed as an integer
     */
    default Integer getInteger(String key, IntSupplier defaultValueSupplier) {
        String value = getString(key);
        if (value != null) {
            try {
                return Integer.valueOf(value.trim());
            }
            catch (NumberFormatException e) {
                return null;
            }
        }
        return defaultValueSupplier != null ? defaultValueSupplier.getAsInt() : null;
    }

    /**
     * Get the boolean value associated with the given key, accepting every literal the server accepts for boolean
     * options (see {@link Strings#asPostgresBoolean(String)}).
     *
     * @param key the key for the configuration property
     * @param defaultValueSupplier the supplier for the default value; may be null
     * @return the boolean value, or null if there is no such key-value pair and the {@code defaultValueSupplier} is null,
     *         or there is a key-value pair in the configuration but the value could not be parsed as a boolean
     */
    default Boolean getBoolean(String key, Supplier<Boolean> defaultValueSupplier) {
        String value = getString(key);
        if (value != null) {
            return Strings.asPostgresBoolean(value.trim());
        }
        return defaultValueSupplier != null ? defaultValueSupplier.get() : null;
    }

    /**
     * Get the integer value associated with the given field, returning the field's default value if there is no such
     * key-value pair.
     *
     * @param field the field
     * @return the integer value
     * @throws NumberFormatException if there is no name-value pair and the field has no default value
     */
    default int getInteger(Field field) {
        Integer value = getInteger(field.name(), () -> Integer.valueOf(field.defaultValueAsString()));
        if (value == null) {
            throw new NumberFormatException("The '" + field.name() + "' value '" + getString(field) + "' is not an integer");
        }
        return value;
    }

    /**
     * Get the boolean value associated with the given field, returning the field's default value if there is no such
     * key-value pair.
     *
     * @param field the field
     * @return the boolean value
     * @throws IllegalArgumentException if the value is not a boolean literal
     */
    default boolean getBoolean(Field field) {
        Boolean value = getBoolean(field.name(), () -> Boolean.valueOf(field.defaultValueAsString()));
        if (value == null) {
            throw new IllegalArgumentException("The '" + field.name() + "' value '" + getString(field) + "' is not a boolean");
        }
        return value;
    }

    /**
     * Get a copy of these configuration properties as a map sorted by key.
     *
     * @return the map; never null
     */
    default Map<String, String> asMap() {
        Map<String, String> map = new TreeMap<>();
        keys().forEach(key -> map.put(key, getString(key)));
        return map;
    }

    /**
     * Validate the supplied fields in this configuration. Extra fields not described by the supplied {@code fields} parameter
     * are not validated.
     *
     * @param fields the fields
     * @param problems the consumer to be called with each problem; never null
     * @return {@code true} if the value is considered valid, or {@code false} if it is not valid
     */
    default boolean validate(Iterable<Field> fields, ValidationOutput problems) {
        boolean valid = true;
        for (Field field : fields) {
            if (!field.validate(this, problems)) {
                valid = false;
            }
        }
        return valid;
    }

    /**
     * Validate the supplied fields in this configuration, describing each problem with a readable message.
     *
     * @param fields the fields
     * @param problems the consumer to be called with each problem; never null
     * @return {@code true} if the value is considered valid, or {@code false} if it is not valid
     */
    default boolean validateAndRecord(Iterable<Field> fields, Consumer<String> problems) {
        return validate(fields, (f, v, problem) -> {
            if (v == null) {
                problems.accept("The '" + f.name() + "' value is invalid: " + problem);
            }
            else {
                problems.accept("The '" + f.name() + "' value '" + v + "' is invalid: " + problem);
            }
        });
    }
}
