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

package org.nimbus.internal.cli.sql;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.jetbrains.annotations.Nullable;
import org.nimbus.internal.backend.Backend;
import org.nimbus.internal.backend.StatementCursor;
import org.nimbus.internal.backend.TableColumn;
import org.nimbus.internal.cli.special.DisplayState;
import org.nimbus.internal.cli.special.LookupResult;
import org.nimbus.internal.cli.special.SpecialCommandRegistry;
import org.nimbus.internal.logger.Loggers;
import org.nimbus.internal.logger.NimbusLogger;
import org.nimbus.internal.util.Cursor;

/**
 * Executes blocks of SQL typed by the user.
 *
 * <p>A block is split into statements which are executed one by one as the returned cursor is advanced. Each statement
 * is first offered to the special commands and sent to the engine only when none of them claims it. A failing
 * statement ends the batch: its exception is thrown from the cursor and no later statement runs.
 */
public class SqlExecutor {
    private static final NimbusLogger LOG = Loggers.forClass(SqlExecutor.class);

    /** Terminator requesting vertical display of the result. */
    static final String EXPANDED_TERMINATOR = "\\G";

    private final Backend backend;

    private final StatementSplitter splitter;

    private final SpecialCommandRegistry specialCommands;

    private final DisplayState display;

    /**
     * Constructor.
     *
     * @param backend Backend statements run on.
     * @param splitter Statement splitter.
     * @param specialCommands Special commands.
     * @param display Display state.
     */
    public SqlExecutor(Backend backend, StatementSplitter splitter, SpecialCommandRegistry specialCommands, DisplayState display) {
        this.backend = backend;
        this.splitter = splitter;
        this.specialCommands = specialCommands;
        this.display = display;
    }

    /**
     * Runs a block of SQL.
     *
     * @param text Raw input.
     * @return Lazy sequence of results, one per statement (special commands may produce several). Blank input yields
     *      the single {@link QueryResult#EMPTY} result.
     */
    public Cursor<QueryResult> run(String text) {
        String trimmed = text.strip();

        if (trimmed.isEmpty()) {
            return Cursor.fromIterable(List.of(QueryResult.EMPTY));
        }

        return Cursor.fromBareIterator(new BatchIterator(splitter.split(trimmed).iterator()));
    }

    /**
     * Switches the active database.
     *
     * @param database Database, {@code null} to reconnect to the active one only when disconnected.
     */
    public void connect(@Nullable String database) {
        backend.connect(database);
    }

    /** Active database. */
    public @Nullable String database() {
        return backend.database();
    }

    public List<String> databases() {
        return backend.databases();
    }

    public Cursor<String> tables() {
        return backend.tables();
    }

    public Cursor<TableColumn> tableColumns() {
        return backend.tableColumns();
    }

    public Backend backend() {
        return backend;
    }

    public DisplayState display() {
        return display;
    }

    private List<QueryResult> execute(String statement) {
        String sql = stripSemicolons(statement);

        if (sql.endsWith(EXPANDED_TERMINATOR)) {
            display.expandedOutput(true);

            sql = sql.substring(0, sql.length() - EXPANDED_TERMINATOR.length()).strip();
        }

        if (sql.isEmpty()) {
            return List.of();
        }

        String stmt = sql;

        LOG.debug("Executing statement [sql={}]", stmt);

        return backend.withCursor(cursor -> {
            LookupResult lookup = specialCommands.tryExecute(cursor, stmt);

            if (lookup.isFound()) {
                return lookup.results();
            }

            cursor.execute(stmt);

            return List.of(result(cursor));
        });
    }

    private QueryResult result(StatementCursor cursor) {
        if (backend.supportsSpecialCommand(Backend.OUTPUT_LOCATION)) {
            String location = cursor.outputLocation();

            if (location != null) {
                display.outputLocation(location);
            }
        }

        List<String> headers = cursor.columnNames();

        if (headers != null) {
            List<List<Object>> rows = cursor.fetchAll();

            return new QueryResult(null, rows, headers, StatusFormatter.status(rows.size(), cursor, backend));
        }

        LOG.debug("No rows in result");

        return new QueryResult(null, null, null, StatusFormatter.status(0, cursor, backend));
    }

    private static String stripSemicolons(String statement) {
        int end = statement.length();

        while (end > 0 && statement.charAt(end - 1) == ';') {
            end--;
        }

        return statement.substring(0, end).strip();
    }

    /** Executes statements on demand and stops at the first failure. */
    private class BatchIterator implements Iterator<QueryResult> {
        private final Iterator<String> statements;

        private final Deque<QueryResult> pending = new ArrayDeque<>();

        private boolean failed;

        BatchIterator(Iterator<String> statements) {
            this.statements = statements;
        }

        @Override
        public boolean hasNext() {
            while (pending.isEmpty() && !failed && statements.hasNext()) {
                try {
                    pending.addAll(execute(statements.next()));
                } catch (RuntimeException e) {
                    failed = true;

                    throw e;
                }
            }

            return !pending.isEmpty();
        }

        @Override
        public QueryResult next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }

            return pending.poll();
        }
    }
}
