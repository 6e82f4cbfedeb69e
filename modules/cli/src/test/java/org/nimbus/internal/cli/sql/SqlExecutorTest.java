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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.nimbus.internal.testframework.NimbusTestUtils.assertThrowsWithCode;
import static org.nimbus.lang.ErrorGroups.Sql.STATEMENT_EXECUTION_ERR;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nimbus.internal.backend.Backend;
import org.nimbus.internal.backend.CursorCallback;
import org.nimbus.internal.backend.StatementCursor;
import org.nimbus.internal.backend.StatementExecutionException;
import org.nimbus.internal.cli.special.DisplayState;
import org.nimbus.internal.cli.special.SpecialCommand;
import org.nimbus.internal.cli.special.SpecialCommandRegistry;
import org.nimbus.internal.testframework.BaseNimbusAbstractTest;
import org.nimbus.internal.util.Cursor;

/**
 * Tests for {@link SqlExecutor}.
 */
@ExtendWith(MockitoExtension.class)
public class SqlExecutorTest extends BaseNimbusAbstractTest {
    @Mock
    private Backend backend;

    @Mock
    private StatementCursor cursor;

    private final DisplayState display = new DisplayState();

    private final SpecialCommandRegistry registry = new SpecialCommandRegistry();

    private SqlExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new SqlExecutor(backend, new SqlStatementSplitter(), registry, display);
    }

    @Test
    public void blankInputYieldsEmptyResult() {
        List<QueryResult> results = collect(executor.run("  \n "));

        assertThat(results, hasSize(1));
        assertThat(results.get(0), sameInstance(QueryResult.EMPTY));
        verifyNoInteractions(backend);
    }

    @Test
    public void executesStatementsInOrder() {
        stubCursor();
        when(backend.formatStatistics(cursor)).thenReturn("");
        when(cursor.columnNames()).thenReturn(List.of("c"));
        when(cursor.fetchAll()).thenReturn(List.of(Arrays.<Object>asList(1L)));

        List<QueryResult> results = collect(executor.run("select 1; select 2;\nselect 3"));

        assertThat(results, hasSize(3));

        for (QueryResult res : results) {
            assertThat(res.headers(), contains("c"));
            assertThat(res.status(), equalTo("1 row in set"));
        }

        InOrder order = inOrder(cursor);

        order.verify(cursor).execute("select 1");
        order.verify(cursor).execute("select 2");
        order.verify(cursor).execute("select 3");
    }

    @Test
    public void statementsRunLazily() {
        Cursor<QueryResult> results = executor.run("select 1; select 2");

        verifyNoInteractions(backend);

        results.close();
    }

    @Test
    public void expandedTerminatorIsStripped() {
        stubCursor();
        when(backend.formatStatistics(cursor)).thenReturn("");
        when(cursor.columnNames()).thenReturn(List.of("c"));
        when(cursor.fetchAll()).thenReturn(List.of());

        List<QueryResult> results = collect(executor.run("select * from t\\G"));

        assertThat(results, hasSize(1));
        assertThat(results.get(0).status(), equalTo(StatusFormatter.QUERY_OK));
        assertTrue(display.expandedOutput());
        verify(cursor).execute("select * from t");
    }

    @Test
    public void statementWithoutRowsReportsQueryOk() {
        stubCursor();
        when(cursor.columnNames()).thenReturn(null);
        when(backend.formatStatistics(cursor)).thenReturn("\nExecution time: 5 ms");

        List<QueryResult> results = collect(executor.run("create table t (a int);"));

        assertThat(results, hasSize(1));
        assertFalse(results.get(0).hasRows());
        assertThat(results.get(0).headers(), is(nullValue()));
        assertThat(results.get(0).status(), equalTo("Query OK\nExecution time: 5 ms"));
        verify(cursor).execute("create table t (a int)");
    }

    @Test
    public void failureAbortsBatch() {
        stubCursor();
        when(backend.formatStatistics(cursor)).thenReturn("");
        when(cursor.columnNames()).thenReturn(List.of("c"));
        when(cursor.fetchAll()).thenReturn(List.of());
        doAnswer(inv -> {
            if ("select x".equals(inv.getArgument(0))) {
                throw new StatementExecutionException("bad statement");
            }

            return null;
        }).when(cursor).execute(any());

        Cursor<QueryResult> results = executor.run("select 1; select x; select 3");

        assertTrue(results.hasNext());
        results.next();

        assertThrowsWithCode(StatementExecutionException.class, STATEMENT_EXECUTION_ERR, results::hasNext, "bad statement");

        assertFalse(results.hasNext());
        verify(cursor, never()).execute("select 3");
    }

    @Test
    public void specialCommandIsNotSentToEngine() {
        stubCursor();

        registry.register(new SpecialCommand() {
            @Override
            public String name() {
                return "\\echo";
            }

            @Override
            public String description() {
                return "Echo.";
            }

            @Override
            public List<QueryResult> execute(StatementCursor cursor, String arg) {
                return List.of(QueryResult.status(arg), QueryResult.status("done"));
            }
        });

        List<QueryResult> results = collect(executor.run("\\echo hi;"));

        assertThat(results, hasSize(2));
        assertThat(results.get(0).status(), equalTo("hi"));
        assertThat(results.get(1).status(), equalTo("done"));
        verify(cursor, never()).execute(any());
    }

    @Test
    public void outputLocationIsPublished() {
        stubCursor();
        when(backend.supportsSpecialCommand(Backend.OUTPUT_LOCATION)).thenReturn(true);
        when(cursor.outputLocation()).thenReturn("s3://bucket/results/1.csv");
        when(cursor.columnNames()).thenReturn(null);
        when(backend.formatStatistics(cursor)).thenReturn("");

        collect(executor.run("insert into t values (1)"));

        assertThat(display.outputLocation(), equalTo("s3://bucket/results/1.csv"));
    }

    @SuppressWarnings("unchecked")
    private void stubCursor() {
        when(backend.withCursor(any())).thenAnswer(inv -> ((CursorCallback<Object>) inv.getArgument(0)).apply(cursor));
    }

    private static List<QueryResult> collect(Cursor<QueryResult> cursor) {
        List<QueryResult> res = new ArrayList<>();

        try (cursor) {
            cursor.forEachRemaining(res::add);
        }

        return res;
    }
}
