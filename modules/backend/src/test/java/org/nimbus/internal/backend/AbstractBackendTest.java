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

package org.nimbus.internal.backend;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.nimbus.internal.testframework.NimbusTestUtils.assertThrowsWithCode;
import static org.nimbus.lang.ErrorGroups.Connection.NOT_CONNECTED_ERR;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nimbus.internal.testframework.BaseNimbusAbstractTest;
import org.nimbus.internal.util.Cursor;

/**
 * Tests for the connection bookkeeping and metadata listing of {@link AbstractBackend}.
 */
@ExtendWith(MockitoExtension.class)
public class AbstractBackendTest extends BaseNimbusAbstractTest {
    @Mock
    private BackendConnection conn1;

    @Mock
    private BackendConnection conn2;

    @Mock
    private StatementCursor cursor;

    private final TestBackend backend = new TestBackend();

    @Test
    public void connectIsNoOpForActiveDatabase() {
        when(conn1.database()).thenReturn("db1");

        backend.willOpen(conn1);

        backend.connect(null);
        backend.connect(null);
        backend.connect("db1");

        assertThat(backend.requested, contains("db1"));
        assertThat(backend.database(), equalTo("db1"));
        verify(conn1, never()).close();
    }

    @Test
    public void switchingDatabaseClosesPreviousConnection() {
        when(conn1.database()).thenReturn("db1");
        when(conn2.database()).thenReturn("db2");

        backend.willOpen(conn1);
        backend.willOpen(conn2);

        backend.connect(null);
        backend.connect("db2");

        assertThat(backend.requested, contains("db1", "db2"));
        assertThat(backend.database(), equalTo("db2"));
        verify(conn1).close();
    }

    @Test
    public void failedReconnectKeepsPreviousConnection() {
        when(conn1.database()).thenReturn("db1");
        when(conn1.cursor()).thenReturn(cursor);

        backend.willOpen(conn1);
        backend.willFail(new ConnectionException("boom", null));

        backend.connect(null);

        assertThrows(ConnectionException.class, backend::reconnect);

        assertTrue(backend.connected());
        assertThat(backend.database(), equalTo("db1"));
        assertThat(backend.getCursor(), sameInstance(cursor));
        verify(conn1, never()).close();
    }

    @Test
    public void closeFailureIsNotPropagated() {
        when(conn1.database()).thenReturn("db1");
        when(conn2.database()).thenReturn("db2");
        doThrow(new ConnectionException("close failed", null)).when(conn1).close();

        backend.willOpen(conn1);
        backend.willOpen(conn2);

        backend.connect(null);
        backend.connect("db2");

        assertThat(backend.database(), equalTo("db2"));
    }

    @Test
    public void cursorRequiresConnection() {
        assertThrowsWithCode(NotConnectedException.class, NOT_CONNECTED_ERR, backend::getCursor, "Not connected");
    }

    @Test
    public void closeIsIdempotent() {
        when(conn1.database()).thenReturn("db1");

        backend.willOpen(conn1);
        backend.connect(null);

        backend.close();
        backend.close();

        assertFalse(backend.connected());
        verify(conn1, times(1)).close();
    }

    @Test
    public void databasesAreReturnedAsListed() {
        connectWithCursor();

        when(cursor.fetchOne()).thenReturn(row("zeta"), row("alpha"), row("mid"), null);

        assertThat(backend.databases(), contains("zeta", "alpha", "mid"));
        verify(cursor).execute(TestBackend.DATABASES_QUERY);
        verify(cursor).close();
    }

    @Test
    public void emptyDatabaseListIsReturned() {
        connectWithCursor();

        when(cursor.fetchOne()).thenReturn(null);

        assertThat(backend.databases(), is(empty()));
    }

    @Test
    public void tablesHoldCursorLockUntilExhausted() {
        connectWithCursor();

        when(cursor.fetchOne()).thenReturn(row("a"), row("b"), null);

        List<String> names = new ArrayList<>();

        try (Cursor<String> tables = backend.tables()) {
            assertTrue(backend.lock.isLocked());

            tables.forEachRemaining(names::add);

            assertFalse(backend.lock.isLocked());
        }

        assertThat(names, contains("a", "b"));
        verify(cursor).execute(TestBackend.TABLES_QUERY);
        verify(cursor, times(1)).close();
    }

    @Test
    public void closingTablesEarlyReleasesCursorLock() {
        connectWithCursor();

        when(cursor.fetchOne()).thenReturn(row("a"));

        try (Cursor<String> tables = backend.tables()) {
            assertThat(tables.next(), equalTo("a"));
        }

        assertFalse(backend.lock.isLocked());
        verify(cursor).close();
    }

    @Test
    public void failedMetadataQueryReleasesCursorLock() {
        connectWithCursor();

        doThrow(new StatementExecutionException("no such schema")).when(cursor).execute(TestBackend.COLUMNS_QUERY);

        assertThrows(MetadataDiscoveryException.class, backend::tableColumns);

        assertFalse(backend.lock.isLocked());
        verify(cursor).close();
    }

    @Test
    public void tableColumnsAreMapped() {
        connectWithCursor();

        when(cursor.fetchOne()).thenReturn(row("t1", "c1"), row("t1", "c2"), null);

        List<TableColumn> cols = new ArrayList<>();

        try (Cursor<TableColumn> it = backend.tableColumns()) {
            it.forEachRemaining(cols::add);
        }

        assertThat(cols, contains(new TableColumn("t1", "c1"), new TableColumn("t1", "c2")));
    }

    private void connectWithCursor() {
        when(conn1.database()).thenReturn("db1");
        when(conn1.cursor()).thenReturn(cursor);

        backend.willOpen(conn1);
        backend.connect(null);
    }

    private static List<Object> row(Object... vals) {
        return Arrays.asList(vals);
    }

    private static class TestBackend extends AbstractBackend {
        static final String DATABASES_QUERY = "list databases";

        static final String TABLES_QUERY = "list tables";

        static final String COLUMNS_QUERY = "list columns";

        final List<String> requested = new ArrayList<>();

        private final Deque<Object> outcomes = new ArrayDeque<>();

        TestBackend() {
            super("db1");
        }

        void willOpen(BackendConnection conn) {
            outcomes.add(conn);
        }

        void willFail(RuntimeException err) {
            outcomes.add(err);
        }

        @Override
        public BackendType type() {
            return BackendType.REDSHIFT;
        }

        @Override
        protected BackendConnection openConnection(@Nullable String database) {
            requested.add(database);

            Object next = outcomes.poll();

            if (next instanceof RuntimeException) {
                throw (RuntimeException) next;
            }

            return (BackendConnection) next;
        }

        @Override
        protected String databasesQuery() {
            return DATABASES_QUERY;
        }

        @Override
        protected String tablesQuery() {
            return TABLES_QUERY;
        }

        @Override
        protected String tableColumnsQuery() {
            return COLUMNS_QUERY;
        }
    }
}
