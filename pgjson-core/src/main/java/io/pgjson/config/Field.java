/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import io.pgjson.annotation.Immutable;
import io.pgjson.util.Strings;

/**
 * An immutable definition of a field that may appear within a {@link Configuration} instance.
 */
@Immutable
public final class Field {

    /**
     * The kind of value a field holds; determines the validation applied before any custom validator.
     */
    public enum Type {
        BOOLEAN,
        INT,
        STRING,
        LIST
    }

    public enum Importance {
        HIGH,
        MEDIUM,
        LOW
    }

    /**
     * Create a set of fields.
     * @param fields the fields to include
     * @return the field set; never null
     */
    public static Set setOf(Field... fields) {
        return new Set(Arrays.asList(fields));
    }

    /**
     * A set of fields, in the order in which they were added, addressable by name.
     */
    public static final class Set implements Iterable<Field> {
        private final Map<String, Field> fieldsByName;

        private Set(Iterable<Field> fields) {
            Map<String, Field> byName = new LinkedHashMap<>();
            fields.forEach(field -> byName.put(field.name(), field));
            this.fieldsByName = Collections.unmodifiableMap(byName);
        }

        /**
         * Get the field with the given name.
         * @param name the name of the field
         * @return the field, or {@code null} if there is no field with the given name
         */
        public Field fieldWithName(String name) {
            return fieldsByName.get(name);
        }

        @Override
        public Iterator<Field> iterator() {
            return fieldsByName.values().iterator();
        }

        public java.util.Set<String> allFieldNames() {
            return fieldsByName.keySet();
        }
    }

    /**
     * A functional interface that accepts validation results.
     */
    @FunctionalInterface
    public interface ValidationOutput {
        /**
         * Accept a problem with the given value for the field.
         * @param field the field with the value; may not be null
         * @param value the value that is not valid
         * @param problemMessage the message describing the problem; may not be null
         */
        void accept(Field field, Object value, String problemMessage);
    }

    /**
     * A functional interface that can be used to validate field values.
     */
    @FunctionalInterface
    public interface Validator {

        /**
         * Validate the supplied value for the field, and report any problems to the designated consumer.
         *
         * @param config the configuration containing the field to be validated; may not be null
         * @param field the {@link Field} being validated; never null
         * @param problems the consumer to be called with each problem; never null
         * @return the number of problems that were found, or 0 if the value is valid
         */
        int validate(Configuration config, Field field, ValidationOutput problems);

        /**
         * Obtain a new {@link Validator} object that validates using this validator and the supplied validator.
         *
         * @param other the validation function to call after this
         * @return the new validator, or this validator if {@code other} is {@code null} or equal to {@code this}
         */
        default Validator and(Validator other) {
            if (other == null || other == this) {
                return this;
            }
            return (config, field, problems) -> validate(config, field, problems) + other.validate(config, field, problems);
        }
    }

    /**
     * Create an immutable field that has no default value, no validation and no description.
     *
     * @param name the name of the field; may not be null
     * @return the field; never null
     */
    public static Field create(String name) {
        return new Field(name, null, null, null, null, null, null);
    }

    private final String name;
    private final String displayName;
    private final String desc;
    private final Supplier<Object> defaultValueGenerator;
    private final Validator validator;
    private final Type type;
    private final Importance importance;

    private Field(String name, String displayName, Type type, String description, Importance importance,
                  Supplier<Object> defaultValueGenerator, Validator validator) {
        Objects.requireNonNull(name, "The field name is required");
        this.name = name;
        this.displayName = displayName;
        this.desc = description;
        this.defaultValueGenerator = defaultValueGenerator != null ? defaultValueGenerator : () -> null;
        this.validator = validator;
        this.type = type != null ? type : Type.STRING;
        this.importance = importance != null ? importance : Importance.MEDIUM;
    }

    /**
     * Get the name of the field.
     * @return the name; never null
     */
    public String name() {
        return name;
    }

    /**
     * Get the default value of the field.
     * @return the default value, or {@code null} if there is no default value
     */
    public Object defaultValue() {
        return defaultValueGenerator.get();
    }

    /**
     * Get the string representation of the default value of the field.
     * @return the default value, or {@code null} if there is no default value
     */
    public String defaultValueAsString() {
        Object defaultValue = defaultValue();
        if (defaultValue instanceof EnumeratedValue) {
            return ((EnumeratedValue) defaultValue).getValue();
        }
        return defaultValue != null ? defaultValue.toString() : null;
    }

    public String description() {
        return desc;
    }

    public String displayName() {
        return displayName;
    }

    public Type type() {
        return type;
    }

    public Importance importance() {
        return importance;
    }

    public Validator validator() {
        return validator;
    }

    /**
     * Validate the supplied value for this field, and report any problems to the designated consumer.
     * @param config the field values keyed by their name; may not be null
     * @param problems the consumer to be called with each problem; never null
     * @return {@code true} if the value is considered valid, or {@code false} if it is not valid
     */
    public boolean validate(Configuration config, ValidationOutput problems) {
        Validator typeValidator = validatorForType(type);
        int errors = 0;
        if (typeValidator != null) {
            errors += typeValidator.validate(config, this, problems);
        }
        // custom validators assume a well-typed value
        if (validator != null && errors == 0) {
            errors += validator.validate(config, this, problems);
        }
        return errors == 0;
    }

    public Field withDescription(String description) {
        return new Field(name(), displayName, type(), description, importance(), defaultValueGenerator, validator);
    }

    public Field withDisplayName(String displayName) {
        return new Field(name(), displayName, type(), description(), importance(), defaultValueGenerator, validator);
    }

    public Field withType(Type type) {
        return new Field(name(), displayName, type, description(), importance(), defaultValueGenerator, validator);
    }

    public Field withImportance(Importance importance) {
        return new Field(name(), displayName, type(), description(), importance, defaultValueGenerator, validator);
    }

    /**
     * Create and return a new Field instance that is a copy of this field but that only accepts the literals of the given
     * enumeration, and that uses the given literal as the default value.
     *
     * @param enumType the enumeration type for the field
     * @param defaultOption the default enumeration value; may be null
     * @return the new field; never null
     */
    public <T extends Enum<T>> Field withEnum(Class<T> enumType, T defaultOption) {
        EnumRecommender<T> recommendator = new EnumRecommender<>(enumType);
        Field result = withType(Type.STRING).withValidation(recommendator);
        if (defaultOption != null) {
            result = result.withDefault(defaultOption instanceof EnumeratedValue ? ((EnumeratedValue) defaultOption).getValue()
                    : defaultOption.name().toLowerCase());
        }
        return result;
    }

    public <T extends Enum<T>> Field withEnum(Class<T> enumType) {
        return withEnum(enumType, null);
    }

    public Field withDefault(String defaultValue) {
        return new Field(name(), displayName, type(), description(), importance(), () -> defaultValue, validator);
    }

    public Field withDefault(boolean defaultValue) {
        return new Field(name(), displayName, type(), description(), importance(), () -> Boolean.valueOf(defaultValue), validator);
    }

    public Field withDefault(int defaultValue) {
        return new Field(name(), displayName, type(), description(), importance(), () -> defaultValue, validator);
    }

    /**
     * Create and return a new Field instance that is a copy of this field but that in addition to its existing validation
     * also uses the supplied validation function(s).
     *
     * @param validators the additional validation function(s); may be null
     * @return the new field; never null
     */
    public Field withValidation(Validator... validators) {
        Validator actualValidator = validator;
        for (Validator validator : validators) {
            if (validator != null) {
                actualValidator = actualValidator != null ? actualValidator.and(validator) : validator;
            }
        }
        return new Field(name(), displayName(), type(), description(), importance(), defaultValueGenerator, actualValidator);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Field) {
            Field that = (Field) obj;
            return this.name().equals(that.name());
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }

    /**
     * Validation logic for numeric ranges
     */
    public static class RangeValidator implements Validator {
        private final Number min;
        private final Number max;

        private RangeValidator(Number min, Number max) {
            this.min = min;
            this.max = max;
        }

        /**
         * A validator that checks both the upper and lower bound.
         *
         * @param min the minimum acceptable value; may not be null
         * @param max the maximum acceptable value; may not be null
         * @return the validator; never null
         */
        public static RangeValidator between(Number min, Number max) {
            return new RangeValidator(min, max);
        }

        @Override
        public int validate(Configuration config, Field field, ValidationOutput problems) {
            Integer value = config.getInteger(field.name(), () -> Integer.parseInt(field.defaultValueAsString()));
            if (value == null) {
                problems.accept(field, config.getString(field), "A value must be provided");
                return 1;
            }
            if (min != null && value.doubleValue() < min.doubleValue()) {
                problems.accept(field, value, "Value must be at least " + min);
                return 1;
            }
            if (max != null && value.doubleValue() > max.doubleValue()) {
                problems.accept(field, value, "Value must be no more than " + max);
                return 1;
            }
            return 0;
        }

        @Override
        public String toString() {
            if (min == null) {
                return "[...," + max + "]";
            }
            else {
                if (max == null) {
                    return "[" + min + ",...]";
                }
                else {
                    return "[" + min + ",...," + max + "]";
                }
            }
        }
    }

    private static <T extends Enum<T>> java.util.Set<String> getEnumLiterals(Class<T> enumType) {
        if (EnumeratedValue.class.isAssignableFrom(enumType)) {
            return Arrays.stream(enumType.getEnumConstants())
                    .map(x -> ((EnumeratedValue) x).getValue())
                    .map(String::toLowerCase)
                    .collect(Collectors.toCollection(java.util.LinkedHashSet::new));
        }
        return Arrays.stream(enumType.getEnumConstants())
                .map(Enum::name)
                .map(String::toLowerCase)
                .collect(Collectors.toCollection(java.util.LinkedHashSet::new));
    }

    /**
     * Accepts only the (case-insensitive) literals of an enumeration.
     */
    public static class EnumRecommender<T extends Enum<T>> implements Validator {

        private final List<String> validValues;
        private final java.util.Set<String> literals;
        private final String literalsStr;

        public EnumRecommender(Class<T> enumType) {
            this.literals = getEnumLiterals(enumType);
            this.validValues = Collections.unmodifiableList(new ArrayList<>(this.literals));
            this.literalsStr = Strings.join(", ", validValues);
        }

        public List<String> validValues() {
            return validValues;
        }

        @Override
        public int validate(Configuration config, Field field, ValidationOutput problems) {
            String value = config.getString(field);
            if (value == null) {
                problems.accept(field, value, "Value must be one of " + literalsStr);
                return 1;
            }
            String trimmed = value.trim().toLowerCase();
            if (!literals.contains(trimmed)) {
                problems.accept(field, value, "Value must be one of " + literalsStr);
                return 1;
            }
            return 0;
        }
    }

    public static Validator validatorForType(Type type) {
        switch (type) {
            case BOOLEAN:
                return Field::isBoolean;
            case INT:
                return Field::isInteger;
            case STRING:
            case LIST:
                break;
        }
        return null;
    }

    public static int isBoolean(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null || Strings.asPostgresBoolean(value.trim()) != null) {
            return 0;
        }
        problems.accept(field, value, "A boolean value such as 'true', 'false', 'on', 'off', '1' or '0' is expected");
        return 1;
    }

    public static int isInteger(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            problems.accept(field, value, "An integer is expected");
            return 1;
        }
        return 0;
    }
}
