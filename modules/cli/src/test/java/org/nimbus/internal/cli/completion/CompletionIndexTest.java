/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.nimbus.internal.cli.completion;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.nimbus.internal.backend.TableColumn;
import org.nimbus.internal.testframework.BaseNimbusAbstractTest;

/**
 * Tests for {@link CompletionIndex}.
 */
public class CompletionIndexTest extends BaseNimbusAbstractTest {
    @ParameterizedTest
    @CsvSource({
            "orders, orders",
            "Orders, Orders",
            "_tmp$1, _tmp$1",
            "my-table, `my-table`",
            "1st, `1st`",
            "select, `select`",
            "Table, `Table`"
    })
    public void escapesNames(String name, String expected) {
        assertThat(CompletionIndex.escapeName(name), equalTo(expected));
    }

    @Test
    public void relationsAreRecordedUnderActiveDatabase() {
        CompletionIndex index = new CompletionIndex();

        index.extendSchemata("sales");
        index.setDbName("sales");
        index.extendRelations(List.of("orders", "order-items"), CompletionIndex.TABLES);
        index.extendColumns(List.of(new TableColumn("orders", "id"), new TableColumn("order-items", "qty")),
                CompletionIndex.TABLES);

        assertThat(index.relationNames(CompletionIndex.TABLES), contains("orders", "`order-items`"));
        assertThat(index.columns("orders", CompletionIndex.TABLES), contains("*", "id"));
        assertThat(index.columns("`order-items`", CompletionIndex.TABLES), contains("*", "qty"));
        assertThat(index.allCompletions(), hasItem("sales"));
    }

    @Test
    public void relationsWithoutSchemaOnlyFeedCompletions() {
        CompletionIndex index = new CompletionIndex();

        index.setDbName("unknown");
        index.extendRelations(List.of("orders"), CompletionIndex.TABLES);
        index.addQualifiedColumn("orders", "id", CompletionIndex.TABLES);

        assertThat(index.relationNames(CompletionIndex.TABLES), is(empty()));
        assertThat(index.columns("orders", CompletionIndex.TABLES), is(nullValue()));
        assertThat(index.allCompletions(), hasItem("orders"));
        assertThat(index.allCompletions(), hasItem("id"));
    }

    @Test
    public void columnsOfUnknownRelationAreIgnored() {
        CompletionIndex index = new CompletionIndex();

        index.extendSchemata("dev");
        index.setDbName("dev");
        index.addQualifiedColumn("public.missing", "id", CompletionIndex.TABLES);

        assertThat(index.relationNames(CompletionIndex.TABLES), is(empty()));
    }

    @Test
    public void findsMatchesIgnoringCase() {
        CompletionIndex index = new CompletionIndex();

        index.extendSchemata("dev");
        index.setDbName("dev");
        index.extendRelations(List.of("selections", "sel-log"), CompletionIndex.TABLES);
        index.extendSpecialCommands(List.of("\\dt"));

        assertThat(index.findMatches("sel"), contains("`sel-log`", "SELECT", "selections"));
        assertThat(index.findMatches("\\d"), contains("\\dt"));
    }

    @Test
    public void keywordsAreSeeded() {
        assertThat(new CompletionIndex().findMatches("fro"), contains("FROM"));
    }
}
