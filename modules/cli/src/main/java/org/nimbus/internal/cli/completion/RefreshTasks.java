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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.nimbus.internal.backend.Backend;
import org.nimbus.internal.backend.TableColumn;
import org.nimbus.internal.logger.Loggers;
import org.nimbus.internal.logger.NimbusLogger;
import org.nimbus.internal.util.Cursor;

/**
 * Built-in refresh tasks.
 */
public final class RefreshTasks {
    private static final NimbusLogger LOG = Loggers.forClass(RefreshTasks.class);

    public static final String DATABASES = "databases";

    public static final String SCHEMATA = "schemata";

    public static final String TABLES = "tables";

    public static final String SPECIAL_COMMANDS = "special_commands";

    private RefreshTasks() {
        // No-op.
    }

    /**
     * Returns the default tasks in execution order.
     *
     * @param specialCommandNames Names of the special commands of the session.
     * @return Tasks.
     */
    public static List<RefreshTask> defaults(Collection<String> specialCommandNames) {
        return List.of(databases(), schemata(), tables(), specialCommands(specialCommandNames));
    }

    /** Database names. */
    public static RefreshTask databases() {
        return RefreshTask.of(DATABASES, (index, backend) -> index.extendDatabaseNames(backend.databases()));
    }

    /** Active database, which becomes the schema relations are recorded under. */
    public static RefreshTask schemata() {
        return RefreshTask.of(SCHEMATA, (index, backend) -> {
            String db = backend.database();

            index.extendSchemata(db);
            index.setDbName(db);
        });
    }

    /** Relations and columns of the active database. */
    public static RefreshTask tables() {
        return RefreshTask.of(TABLES, RefreshTasks::refreshTables);
    }

    /**
     * Special command names.
     *
     * @param names Names and aliases.
     * @return Task.
     */
    public static RefreshTask specialCommands(Collection<String> names) {
        List<String> copy = List.copyOf(names);

        return RefreshTask.of(SPECIAL_COMMANDS, (index, backend) -> index.extendSpecialCommands(copy));
    }

    private static void refreshTables(CompletionIndex index, Backend backend) {
        List<String> tables = new ArrayList<>();

        try (Cursor<String> cur = backend.tables()) {
            cur.forEachRemaining(tables::add);
        }

        List<TableColumn> columns = columns(backend);

        if (backend.preQualifiedIdentifiers()) {
            for (String table : tables) {
                index.addQualifiedRelation(table, CompletionIndex.TABLES);
            }

            for (TableColumn col : columns) {
                index.addQualifiedColumn(col.tableName(), col.columnName(), CompletionIndex.TABLES);
            }
        } else {
            index.extendRelations(tables, CompletionIndex.TABLES);
            index.extendColumns(columns, CompletionIndex.TABLES);
        }
    }

    /** Columns are optional: a failure leaves the relations without columns. */
    private static List<TableColumn> columns(Backend backend) {
        List<TableColumn> columns = new ArrayList<>();

        try (Cursor<TableColumn> cur = backend.tableColumns()) {
            cur.forEachRemaining(columns::add);
        } catch (RuntimeException e) {
            LOG.warn("Failed to load columns, completion will only offer relation names", e);

            return List.of();
        }

        return columns;
    }
}
