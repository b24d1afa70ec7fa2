/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgjson.annotation.Immutable;
import io.pgjson.config.Configuration;
import io.pgjson.config.EnumeratedValue;
import io.pgjson.config.Field;
import io.pgjson.config.Field.Importance;
import io.pgjson.config.Field.RangeValidator;
import io.pgjson.config.Field.Type;
import io.pgjson.config.Field.ValidationOutput;
import io.pgjson.config.InvalidConfigurationException;
import io.pgjson.encoder.filter.InclusionCommands;
import io.pgjson.encoder.filter.MessagePrefixFilter;
import io.pgjson.encoder.filter.SelectTable;
import io.pgjson.encoder.filter.TableFilter;
import io.pgjson.encoder.filter.TableSelector;

/**
 * The options of a decoding session. Instances are created once from the options given at session start and never
 * change afterwards.
 */
@Immutable
public class JsonEncoderConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonEncoderConfig.class);

    public static final int MIN_FORMAT_VERSION = 1;
    public static final int MAX_FORMAT_VERSION = 2;
    public static final String DEFAULT_UNCHANGED_TOAST_PLACEHOLDER = "__unchanged_toast_value";

    /**
     * The way column data is laid out in the enveloped format.
     */
    public enum ColumnLayout implements EnumeratedValue {

        /**
         * Parallel arrays of names, types and values.
         */
        ARRAYS("arrays"),

        /**
         * Objects keyed by column name.
         */
        MAP("map");

        private final String value;

        ColumnLayout(String value) {
            this.value = value;
        }

        @Override
        public String getValue() {
            return value;
        }

        /**
         * Determine the layout for the supplied value.
         *
         * @param value the configuration property value; may not be null
         * @return the matching option, or null if no match is found
         */
        public static ColumnLayout parse(String value) {
            if (value == null) {
                return null;
            }
            value = value.trim();
            for (ColumnLayout option : ColumnLayout.values()) {
                if (option.getValue().equalsIgnoreCase(value)) {
                    return option;
                }
            }
            return null;
        }
    }

    public static final Field FORMAT_VERSION = Field.create("format-version")
            .withDisplayName("Format version")
            .withType(Type.INT)
            .withImportance(Importance.HIGH)
            .withDefault(1)
            .withValidation(RangeValidator.between(MIN_FORMAT_VERSION, MAX_FORMAT_VERSION))
            .withDescription("The output format: 1 writes one JSON object per transaction, 2 writes one JSON object per event.");

    public static final Field INCLUDE_TRANSACTION = Field.create("include-transaction")
            .withDisplayName("Include transaction records")
            .withType(Type.BOOLEAN)
            .withImportance(Importance.MEDIUM)
            .withDefault(true)
            .withDescription("Whether the format version 2 writes begin and commit records.");

    public static final Field INCLUDE_XIDS = Field.create("include-xids")
            .withDisplayName("Include transaction ids")
            .withType(Type.BOOLEAN)
            .withImportance(Importance.MEDIUM)
            .withDefault(false)
            .withDescription("Whether the transaction id is written.");

    public static final Field INCLUDE_TIMESTAMP = Field.create("include-timestamp")
            .withDisplayName("Include commit timestamp")
            .withType(Type.BOOLEAN)
            .withImportance(Importance.MEDIUM)
            .withDefault(false)
            .withDescription("Whether the commit timestamp of the transaction is written.");

    public static final Field INCLUDE_LSN = Field.create("include-lsn")
            .withDisplayName("Include LSN")
            .withType(Type.BOOLEAN)
            .withImportance(Importance.MEDIUM)
            .withDefault(false)
            .withDescription("Whether log sequence numbers are written.");

    public static final Field INCLUDE_SCHEMAS = Field.create("include-schemas")
            .withDisplayName("Include schemas")
            .withType(Type.BOOLEAN)
            .withImportance(Importance.MEDIUM)
            .withDefault(true)
            .withDescription("Whether every change names the schema of its table.");

    public static final Field INCLUDE_TYPES = Field.create("include-types")
            .withDisplayName("Include types")
            .withType(Type.BOOLEAN)
            .withImportance(Importance.MEDIUM)
            .withDefault(true)
            .withDescription("Whether the type name of every column is written.");

    public static final Field INCLUDE_TYPE_OIDS = Field.create("include-type-oids")
            .withDisplayName("Include type OIDs")
            .withType(Type.BOOLEAN)
            .withImportance(Importance.LOW)
            .withDefault(false)
            .withDescription("Whether the type OID of every column is written.");

    public static final Field INCLUDE_TYPMOD = Field.create("include-typmod")
            .withDisplayName("Include type modifiers")
            .withType(Type.BOOLEAN)
            .withImportance(Importance.LOW)
            .withDefault(true)
            .withDescription("Whether type names carry their modifiers, e.g. 'character varying(255)' instead of 'varchar'.");

    public static final Field INCLUDE_NOT_NULL = Field.create("include-not-null")
            .withDisplayName("Include not-null flags")
            .withType(Type.BOOLEAN)
            .withImportance(Importance.LOW)
            .withDefault(false)
            .withDescription("Whether every column says whether it may be null.");

    public static final Field INCLUDE_UNCHANGED_TOAST = Field.create("include-unchanged-toast")
            .withDisplayName("Include unchanged TOAST columns")
            .withType(Type.BOOLEAN)
            .withImportance(Importance.LOW)
            .withDefault(false)
            .withDescription("Whether TOASTed columns that did not change are written with a placeholder instead of being left out.");

    public static final Field UNCHANGED_TOAST_PLACEHOLDER = Field.create("unchanged-toast-placeholder")
            .withDisplayName("Unchanged TOAST placeholder")
            .withType(Type.STRING)
            .withImportance(Importance.LOW)
            .withDefault(DEFAULT_UNCHANGED_TOAST_PLACEHOLDER)
            .withDescription("The value written for unchanged TOAST columns when those are included.");

    public static final Field INCLUDE_XMINS = Field.create("include-xmins")
            .withDisplayName("Include slot xmins")
            .withType(Type.BOOLEAN)
            .withImportance(Importance.LOW)
            .withDefault(false)
            .withDescription("Whether the format version 1 writes the xmin and catalog xmin of the slot.");

    public static final Field INCLUDE_NEXT_XIDS = Field.create("include-next-xids")
            .withDisplayName("Include next transaction id")
            .withType(Type.BOOLEAN)
            .withImportance(Importance.LOW)
            .withDefault(false)
            .withDescription("Whether the format version 1 writes the next transaction id and its epoch.");

    public static final Field PRETTY_PRINT = Field.create("pretty-print")
            .withDisplayName("Pretty print")
            .withType(Type.BOOLEAN)
            .withImportance(Importance.LOW)
            .withDefault(false)
            .withDescription("Whether the format version 1 adds indentation and line breaks.");

    public static final Field WRITE_IN_CHUNKS = Field.create("write-in-chunks")
            .withDisplayName("Write in chunks")
            .withType(Type.BOOLEAN)
            .withImportance(Importance.MEDIUM)
            .withDefault(false)
            .withDescription("Whether the format version 1 writes every change as soon as it is encoded instead of once per transaction.");

    public static final Field SKIP_EMPTY_XACTS = Field.create("skip-empty-xacts")
            .withDisplayName("Skip empty transactions")
            .withType(Type.BOOLEAN)
            .withImportance(Importance.MEDIUM)
            .withDefault(false)
            .withDescription("Whether transactions without any written change or message are left out.");

    public static final Field COLUMN_LAYOUT = Field.create("column-layout")
            .withDisplayName("Column layout")
            .withEnum(ColumnLayout.class, ColumnLayout.ARRAYS)
            .withImportance(Importance.LOW)
            .withDescription("How the format version 1 lays out column data: '" + ColumnLayout.ARRAYS.getValue()
                    + "' writes parallel arrays, '" + ColumnLayout.MAP.getValue() + "' writes objects keyed by column name.");

    public static final Field FILTER_TABLES = Field.create("filter-tables")
            .withDisplayName("Filtered tables")
            .withType(Type.LIST)
            .withImportance(Importance.HIGH)
            .withValidation(JsonEncoderConfig::isListOfTables)
            .withDescription("A comma-separated list of schema.table entries whose changes are never written; '*' matches any schema or table.");

    public static final Field ADD_TABLES = Field.create("add-tables")
            .withDisplayName("Added tables")
            .withType(Type.LIST)
            .withImportance(Importance.HIGH)
            .withValidation(JsonEncoderConfig::isListOfTables)
            .withDescription("A comma-separated list of schema.table entries whose changes are written; all tables by default.");

    public static final Field FILTER_MSG_PREFIXES = Field.create("filter-msg-prefixes")
            .withDisplayName("Filtered message prefixes")
            .withType(Type.LIST)
            .withImportance(Importance.MEDIUM)
            .withValidation(JsonEncoderConfig::isListOfPrefixes)
            .withDescription("A comma-separated list of logical decoding message prefixes that are never written.");

    public static final Field ADD_MSG_PREFIXES = Field.create("add-msg-prefixes")
            .withDisplayName("Added message prefixes")
            .withType(Type.LIST)
            .withImportance(Importance.MEDIUM)
            .withValidation(JsonEncoderConfig::isListOfPrefixes)
            .withDescription("A comma-separated list of logical decoding message prefixes that are written; all prefixes by default.");

    /**
     * The table include directive. It may be repeated; a value starting with '~' is a regular expression.
     */
    public static final String INCLUDE_TABLE = "include-table";

    /**
     * The table exclude directive. It may be repeated; a value starting with '~' is a regular expression.
     */
    public static final String EXCLUDE_TABLE = "exclude-table";

    public static final Field.Set ALL_FIELDS = Field.setOf(FORMAT_VERSION, INCLUDE_TRANSACTION, INCLUDE_XIDS, INCLUDE_TIMESTAMP,
            INCLUDE_LSN, INCLUDE_SCHEMAS, INCLUDE_TYPES, INCLUDE_TYPE_OIDS, INCLUDE_TYPMOD, INCLUDE_NOT_NULL,
            INCLUDE_UNCHANGED_TOAST, UNCHANGED_TOAST_PLACEHOLDER, INCLUDE_XMINS, INCLUDE_NEXT_XIDS, PRETTY_PRINT,
            WRITE_IN_CHUNKS, SKIP_EMPTY_XACTS, COLUMN_LAYOUT, FILTER_TABLES, ADD_TABLES, FILTER_MSG_PREFIXES, ADD_MSG_PREFIXES);

    private final Configuration config;
    private final int formatVersion;
    private final boolean includeTransaction;
    private final boolean includeXids;
    private final boolean includeTimestamp;
    private final boolean includeLsn;
    private final boolean includeSchemas;
    private final boolean includeTypes;
    private final boolean includeTypeOids;
    private final boolean includeTypmod;
    private final boolean includeNotNull;
    private final boolean includeUnchangedToast;
    private final String unchangedToastPlaceholder;
    private final boolean includeXmins;
    private final boolean includeNextXids;
    private final boolean prettyPrint;
    private final boolean writeInChunks;
    private final boolean skipEmptyTransactions;
    private final ColumnLayout columnLayout;
    private final InclusionCommands inclusionCommands;
    private final TableFilter tableFilter;
    private final MessagePrefixFilter messagePrefixFilter;

    private JsonEncoderConfig(Configuration config, InclusionCommands inclusionCommands) {
        this.config = config;
        this.formatVersion = config.getInteger(FORMAT_VERSION);
        this.includeTransaction = config.getBoolean(INCLUDE_TRANSACTION);
        this.includeXids = config.getBoolean(INCLUDE_XIDS);
        this.includeTimestamp = config.getBoolean(INCLUDE_TIMESTAMP);
        this.includeLsn = config.getBoolean(INCLUDE_LSN);
        this.includeSchemas = config.getBoolean(INCLUDE_SCHEMAS);
        this.includeTypes = config.getBoolean(INCLUDE_TYPES);
        this.includeTypeOids = config.getBoolean(INCLUDE_TYPE_OIDS);
        this.includeTypmod = config.getBoolean(INCLUDE_TYPMOD);
        this.includeNotNull = config.getBoolean(INCLUDE_NOT_NULL);
        this.includeUnchangedToast = config.getBoolean(INCLUDE_UNCHANGED_TOAST);
        this.unchangedToastPlaceholder = config.getString(UNCHANGED_TOAST_PLACEHOLDER);
        this.includeXmins = config.getBoolean(INCLUDE_XMINS);
        this.includeNextXids = config.getBoolean(INCLUDE_NEXT_XIDS);
        this.prettyPrint = config.getBoolean(PRETTY_PRINT);
        this.writeInChunks = config.getBoolean(WRITE_IN_CHUNKS);
        this.skipEmptyTransactions = config.getBoolean(SKIP_EMPTY_XACTS);
        this.columnLayout = ColumnLayout.parse(config.getString(COLUMN_LAYOUT));
        this.inclusionCommands = inclusionCommands;
        if (!inclusionCommands.isEmpty()) {
            this.tableFilter = inclusionCommands;
        }
        else {
            this.tableFilter = new TableSelector(SelectTable.parseList(config.getString(FILTER_TABLES)),
                    config.hasKey(ADD_TABLES) ? SelectTable.parseList(config.getString(ADD_TABLES)) : TableSelector.all().addTables());
        }
        this.messagePrefixFilter = new MessagePrefixFilter(config.getString(ADD_MSG_PREFIXES), config.getString(FILTER_MSG_PREFIXES));
    }

    /**
     * Create the session configuration from the options given at session start.
     *
     * @param options the options in the order they were given; may not be null
     * @return the configuration; never null
     * @throws InvalidConfigurationException if an option is unknown or has an invalid value; every problem is reported
     * @throws io.pgjson.encoder.filter.InvalidPatternException if a table directive is not a valid regular expression
     */
    public static JsonEncoderConfig from(List<PluginOption> options) {
        final List<String> problems = new ArrayList<>();
        final Configuration.Builder builder = Configuration.create();
        final InclusionCommands.Builder commands = InclusionCommands.builder();
        boolean hasDirectives = false;

        for (PluginOption option : options) {
            final String name = option.name();
            final String value = option.value();
            if (INCLUDE_TABLE.equals(name) || EXCLUDE_TABLE.equals(name)) {
                if (value == null) {
                    problems.add(String.format("parameter \"%s\" requires a value", name));
                    continue;
                }
                if (INCLUDE_TABLE.equals(name)) {
                    commands.include(value);
                }
                else {
                    commands.exclude(value);
                }
                hasDirectives = true;
                continue;
            }
            final Field field = ALL_FIELDS.fieldWithName(name);
            if (field == null) {
                problems.add(String.format("option \"%s\" = \"%s\" is unknown", name, value != null ? value : "(null)"));
                continue;
            }
            if (value == null) {
                if (field.type() != Type.BOOLEAN) {
                    problems.add(String.format("parameter \"%s\" requires a value", name));
                    continue;
                }
                builder.with(field, true);
            }
            else {
                builder.with(field, value);
            }
        }

        final Configuration config = builder.build();
        config.validateAndRecord(ALL_FIELDS, problems::add);
        if (hasDirectives && (config.hasKey(FILTER_TABLES) || config.hasKey(ADD_TABLES))) {
            problems.add(String.format("The '%s'/'%s' directives cannot be combined with the '%s'/'%s' options",
                    INCLUDE_TABLE, EXCLUDE_TABLE, FILTER_TABLES.name(), ADD_TABLES.name()));
        }
        if (!problems.isEmpty()) {
            throw new InvalidConfigurationException("The decoding options are not valid", problems);
        }

        final JsonEncoderConfig result = new JsonEncoderConfig(config, commands.build());
        LOGGER.debug("Decoding options: {}", config);
        return result;
    }

    public static JsonEncoderConfig defaults() {
        return from(new ArrayList<>());
    }

    private static int isListOfTables(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            SelectTable.parseList(value);
            return 0;
        }
        catch (IllegalArgumentException e) {
            problems.accept(field, value, "could not parse value for parameter: " + e.getMessage());
            return 1;
        }
    }

    private static int isListOfPrefixes(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            MessagePrefixFilter.parseList(value);
            return 0;
        }
        catch (IllegalArgumentException e) {
            problems.accept(field, value, "could not parse value for parameter: " + e.getMessage());
            return 1;
        }
    }

    public Configuration getConfig() {
        return config;
    }

    public int formatVersion() {
        return formatVersion;
    }

    public boolean includeTransaction() {
        return includeTransaction;
    }

    public boolean includeXids() {
        return includeXids;
    }

    public boolean includeTimestamp() {
        return includeTimestamp;
    }

    public boolean includeLsn() {
        return includeLsn;
    }

    public boolean includeSchemas() {
        return includeSchemas;
    }

    public boolean includeTypes() {
        return includeTypes;
    }

    public boolean includeTypeOids() {
        return includeTypeOids;
    }

    public boolean includeTypmod() {
        return includeTypmod;
    }

    public boolean includeNotNull() {
        return includeNotNull;
    }

    public boolean includeUnchangedToast() {
        return includeUnchangedToast;
    }

    public String unchangedToastPlaceholder() {
        return unchangedToastPlaceholder;
    }

    public boolean includeXmins() {
        return includeXmins;
    }

    public boolean includeNextXids() {
        return includeNextXids;
    }

    public boolean prettyPrint() {
        return prettyPrint;
    }

    public boolean writeInChunks() {
        return writeInChunks;
    }

    public boolean skipEmptyTransactions() {
        return skipEmptyTransactions;
    }

    public ColumnLayout columnLayout() {
        return columnLayout;
    }

    public InclusionCommands inclusionCommands() {
        return inclusionCommands;
    }

    /**
     * @return the table filter of the session: the include/exclude directives when any were given, the selector lists
     *         otherwise
     */
    public TableFilter tableFilter() {
        return tableFilter;
    }

    public MessagePrefixFilter messagePrefixFilter() {
        return messagePrefixFilter;
    }

    @Override
    public String toString() {
        return config.toString();
    }
}
