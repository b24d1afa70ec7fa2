/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

import io.pgjson.encoder.TestHelper;
import io.pgjson.encoder.filter.InclusionCommand.Type;

public class InclusionCommandsTest {

    @Test
    public void shouldIncludeEverythingWithoutCommands() {
        InclusionCommands commands = InclusionCommands.builder().build();
        assertThat(commands.isEmpty()).isTrue();
        assertThat(commands.shouldEmit("customers")).isTrue();
        assertThat(commands.isIncluded(TestHelper.customers())).isTrue();
        assertThat(InclusionCommands.empty().shouldEmit("anything")).isTrue();
    }

    @Test
    public void shouldIncludeOnlyNamedTables() {
        InclusionCommands commands = InclusionCommands.builder().include("customers").build();
        assertThat(commands.shouldEmit("customers")).isTrue();
        assertThat(commands.shouldEmit("orders")).isFalse();
        assertThat(commands.shouldEmit("customers_old")).isFalse();
    }

    @Test
    public void shouldIncludeOnlyTablesMatchingPattern() {
        InclusionCommands commands = InclusionCommands.builder().include("~^public\\.").build();
        assertThat(commands.commands()).extracting(InclusionCommand::type).containsExactly(Type.INCLUDE_TABLE_PATTERN);
        assertThat(commands.shouldEmit("public.x")).isTrue();
        assertThat(commands.shouldEmit("publicity")).isFalse();
    }

    @Test
    public void shouldStartWithIncludeAllWhenFirstCommandExcludes() {
        InclusionCommands commands = InclusionCommands.builder().exclude("orders").build();
        assertThat(commands.commands()).extracting(InclusionCommand::type)
                .containsExactly(Type.INCLUDE_ALL, Type.EXCLUDE_TABLE);
        assertThat(commands.shouldEmit("orders")).isFalse();
        assertThat(commands.shouldEmit("customers")).isTrue();
    }

    @Test
    public void shouldNotAddIncludeAllWhenExcludeFollowsInclude() {
        InclusionCommands commands = InclusionCommands.builder().include("~^cust").exclude("customers_tmp").build();
        assertThat(commands.commands()).extracting(InclusionCommand::type)
                .containsExactly(Type.INCLUDE_TABLE_PATTERN, Type.EXCLUDE_TABLE);
        assertThat(commands.shouldEmit("customers")).isTrue();
        assertThat(commands.shouldEmit("customers_tmp")).isFalse();
        assertThat(commands.shouldEmit("orders")).isFalse();
    }

    @Test
    public void shouldLetLastApplyingCommandWin() {
        InclusionCommands commands = InclusionCommands.builder()
                .exclude("~_tmp$")
                .include("orders_tmp")
                .build();
        assertThat(commands.shouldEmit("customers")).isTrue();
        assertThat(commands.shouldEmit("customers_tmp")).isFalse();
        assertThat(commands.shouldEmit("orders_tmp")).isTrue();

        InclusionCommands reversed = InclusionCommands.builder()
                .include("orders_tmp")
                .exclude("~_tmp$")
                .build();
        assertThat(reversed.shouldEmit("orders_tmp")).isFalse();
    }

    @Test
    public void shouldExcludeWithTrailingExcludeAll() {
        InclusionCommands commands = InclusionCommands.builder()
                .exclude("~.*")
                .build();
        assertThat(commands.shouldEmit("customers")).isFalse();
        assertThat(commands.shouldEmit("")).isFalse();
    }

    @Test
    public void shouldMatchExactNamesLiterally() {
        InclusionCommands commands = InclusionCommands.builder().include("cust.*").build();
        assertThat(commands.shouldEmit("cust.*")).isTrue();
        assertThat(commands.shouldEmit("customers")).isFalse();
    }

    @Test
    public void shouldMatchOnTableNameOnly() {
        InclusionCommands commands = InclusionCommands.builder().include("customers").build();
        assertThat(commands.isIncluded(TestHelper.customers())).isTrue();
        assertThat(InclusionCommands.builder().include("public.customers").build().isIncluded(TestHelper.customers())).isFalse();
    }

    @Test
    public void shouldRejectInvalidPatternWhileBuilding() {
        assertThatThrownBy(() -> InclusionCommands.builder().include("~[a-"))
                .isInstanceOf(InvalidPatternException.class);
        assertThatThrownBy(() -> InclusionCommands.builder().exclude("~(x"))
                .isInstanceOf(InvalidPatternException.class);
    }
}
