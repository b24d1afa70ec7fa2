/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder;

import static io.pgjson.encoder.TestHelper.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import io.pgjson.config.InvalidConfigurationException;
import io.pgjson.encoder.JsonEncoderConfig.ColumnLayout;
import io.pgjson.encoder.filter.InclusionCommands;
import io.pgjson.encoder.filter.InvalidPatternException;
import io.pgjson.encoder.filter.TableSelector;

public class JsonEncoderConfigTest {

    @Test
    public void shouldUseDefaults() {
        JsonEncoderConfig config = JsonEncoderConfig.defaults();
        assertThat(config.formatVersion()).isEqualTo(1);
        assertThat(config.includeTransaction()).isTrue();
        assertThat(config.includeXids()).isFalse();
        assertThat(config.includeTimestamp()).isFalse();
        assertThat(config.includeLsn()).isFalse();
        assertThat(config.includeSchemas()).isTrue();
        assertThat(config.includeTypes()).isTrue();
        assertThat(config.includeTypeOids()).isFalse();
        assertThat(config.includeTypmod()).isTrue();
        assertThat(config.includeNotNull()).isFalse();
        assertThat(config.includeUnchangedToast()).isFalse();
        assertThat(config.unchangedToastPlaceholder()).isEqualTo("__unchanged_toast_value");
        assertThat(config.includeXmins()).isFalse();
        assertThat(config.includeNextXids()).isFalse();
        assertThat(config.prettyPrint()).isFalse();
        assertThat(config.writeInChunks()).isFalse();
        assertThat(config.skipEmptyTransactions()).isFalse();
        assertThat(config.columnLayout()).isEqualTo(ColumnLayout.ARRAYS);
        assertThat(config.inclusionCommands().isEmpty()).isTrue();
        assertThat(config.tableFilter()).isInstanceOf(TableSelector.class);
        assertThat(config.messagePrefixFilter().isIncluded("anything")).isTrue();
    }

    @Test
    public void shouldReadPostgresBooleans() {
        JsonEncoderConfig config = JsonEncoderConfig.from(options(
                "include-xids", "on",
                "include-timestamp", "yes",
                "include-lsn", "1",
                "include-schemas", "off",
                "include-types", "f",
                "pretty-print", "TRUE"));
        assertThat(config.includeXids()).isTrue();
        assertThat(config.includeTimestamp()).isTrue();
        assertThat(config.includeLsn()).isTrue();
        assertThat(config.includeSchemas()).isFalse();
        assertThat(config.includeTypes()).isFalse();
        assertThat(config.prettyPrint()).isTrue();
    }

    @Test
    public void shouldTreatBooleanWithoutValueAsTrue() {
        JsonEncoderConfig config = JsonEncoderConfig.from(Arrays.asList(
                PluginOption.of("include-xids"),
                PluginOption.of("write-in-chunks")));
        assertThat(config.includeXids()).isTrue();
        assertThat(config.writeInChunks()).isTrue();
    }

    @Test
    public void shouldReadFormatVersionAndLayout() {
        JsonEncoderConfig config = JsonEncoderConfig.from(options("format-version", "2", "column-layout", "map"));
        assertThat(config.formatVersion()).isEqualTo(2);
        assertThat(config.columnLayout()).isEqualTo(ColumnLayout.MAP);
    }

    @Test
    public void shouldUseLastValueOfRepeatedOption() {
        JsonEncoderConfig config = JsonEncoderConfig.from(options("include-xids", "true", "include-xids", "false"));
        assertThat(config.includeXids()).isFalse();
    }

    @Test
    public void shouldRejectUnknownOption() {
        assertThatThrownBy(() -> JsonEncoderConfig.from(options("include-everything", "true")))
                .isInstanceOf(InvalidConfigurationException.class)
                .satisfies(e -> assertThat(((InvalidConfigurationException) e).problems())
                        .containsExactly("option \"include-everything\" = \"true\" is unknown"));
    }

    @Test
    public void shouldRejectUnsupportedFormatVersion() {
        assertProblem(options("format-version", "3"), "format-version");
        assertProblem(options("format-version", "0"), "format-version");
        assertProblem(options("format-version", "two"), "format-version");
    }

    @Test
    public void shouldRejectInvalidValues() {
        assertProblem(options("include-xids", "maybe"), "include-xids");
        assertProblem(options("column-layout", "columns"), "column-layout");
        assertProblem(options("filter-tables", "customers"), "could not parse value for parameter");
        assertProblem(options("add-msg-prefixes", "a,,b"), "could not parse value for parameter");
    }

    @Test
    public void shouldRequireValuesForNonBooleanOptions() {
        assertProblem(Arrays.asList(PluginOption.of("format-version")), "parameter \"format-version\" requires a value");
        assertProblem(Arrays.asList(PluginOption.of("include-table")), "parameter \"include-table\" requires a value");
    }

    @Test
    public void shouldReportEveryProblem() {
        assertThatThrownBy(() -> JsonEncoderConfig.from(options(
                "bogus", "1",
                "include-lsn", "perhaps",
                "format-version", "9")))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessage("The decoding options are not valid")
                .satisfies(e -> {
                    List<String> problems = ((InvalidConfigurationException) e).problems();
                    assertThat(problems).hasSizeGreaterThanOrEqualTo(3);
                    assertThat(problems).anySatisfy(p -> assertThat(p).contains("bogus"));
                    assertThat(problems).anySatisfy(p -> assertThat(p).contains("include-lsn"));
                    assertThat(problems).anySatisfy(p -> assertThat(p).contains("format-version"));
                });
    }

    @Test
    public void shouldRejectDirectivesCombinedWithTableLists() {
        assertProblem(options("include-table", "customers", "add-tables", "public.customers"),
                "cannot be combined with the 'filter-tables'/'add-tables' options");
        assertProblem(options("filter-tables", "public.tags", "exclude-table", "tags"),
                "cannot be combined");
    }

    @Test
    public void shouldFailAtOnceForInvalidPattern() {
        assertThatThrownBy(() -> JsonEncoderConfig.from(options("include-table", "~(unclosed")))
                .isInstanceOf(InvalidPatternException.class)
                .hasMessageContaining("(unclosed");
    }

    @Test
    public void shouldUseDirectivesAsTableFilter() {
        JsonEncoderConfig config = JsonEncoderConfig.from(options("include-table", "customers", "exclude-table", "~^tmp_"));
        assertThat(config.tableFilter()).isSameAs(config.inclusionCommands());
        InclusionCommands commands = config.inclusionCommands();
        assertThat(commands.commands()).hasSize(2);
        assertThat(config.tableFilter().isIncluded(TestHelper.customers())).isTrue();
        assertThat(config.tableFilter().isIncluded(TestHelper.tags())).isFalse();
    }

    @Test
    public void shouldBuildSelectorFromTableLists() {
        JsonEncoderConfig config = JsonEncoderConfig.from(options("add-tables", "public.*", "filter-tables", "public.tags"));
        assertThat(config.tableFilter().isIncluded(TestHelper.customers())).isTrue();
        assertThat(config.tableFilter().isIncluded(TestHelper.tags())).isFalse();
        assertThat(config.tableFilter().isIncluded(TestHelper.auditLog())).isFalse();
    }

    @Test
    public void shouldBuildMessagePrefixFilter() {
        JsonEncoderConfig config = JsonEncoderConfig.from(options("add-msg-prefixes", "audit,ops", "filter-msg-prefixes", "ops"));
        assertThat(config.messagePrefixFilter().isIncluded("audit")).isTrue();
        assertThat(config.messagePrefixFilter().isIncluded("ops")).isFalse();
        assertThat(config.messagePrefixFilter().isIncluded("other")).isFalse();
    }

    private static void assertProblem(List<PluginOption> options, String text) {
        assertThatThrownBy(() -> JsonEncoderConfig.from(options))
                .isInstanceOf(InvalidConfigurationException.class)
                .satisfies(e -> assertThat(((InvalidConfigurationException) e).problems())
                        .anySatisfy(p -> assertThat(p).contains(text)));
    }
}
