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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import org.nimbus.internal.logger.Loggers;
import org.nimbus.internal.logger.NimbusLogger;
import org.nimbus.internal.util.Cursor;

/**
 * Connection bookkeeping and metadata listing shared by the backends. Subclasses open connections and provide the
 * metadata queries.
 */
public abstract class AbstractBackend implements Backend {
    private static final NimbusLogger LOG = Loggers.forClass(AbstractBackend.class);

    /** Serializes cursor use and connection swaps. */
    protected final ReentrantLock lock = new ReentrantLock();

    private volatile @Nullable BackendConnection connection;

    private volatile @Nullable String database;

    protected AbstractBackend(@Nullable String database) {
        this.database = database;
    }

    /**
     * Opens a new connection. Must not touch the current one.
     *
     * @param database Database to connect to, {@code null} for the engine default.
     * @return New connection.
     * @throws ConnectionException If the connection can't be established.
     */
    protected abstract BackendConnection openConnection(@Nullable String database);

    /** Query listing databases, one name per row. */
    protected abstract String databasesQuery();

    /** Query listing tables of the active database. */
    protected abstract String tablesQuery();

    /** Query listing columns of the active database. */
    protected abstract String tableColumnsQuery();

    /** Maps a row of {@link #tablesQuery()} to a table identifier. */
    protected String tableName(List<Object> row) {
        return String.valueOf(row.get(0));
    }

    /** Maps a row of {@link #tableColumnsQuery()} to a column. */
    protected TableColumn tableColumn(List<Object> row) {
        return new TableColumn(String.valueOf(row.get(0)), String.valueOf(row.get(1)));
    }

    @Override
    public void connect(@Nullable String database) {
        lock.lock();

        try {
            if (connection != null && (database == null || database.equals(this.database))) {
                LOG.debug("Already connected [database={}]", this.database);

                return;
            }

            swapConnection(openConnection(database != null ? database : this.database));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reconnect() {
        lock.lock();

        try {
            swapConnection(openConnection(database));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Makes {@code newConn} the live connection and closes the previous one.
     *
     * @param newConn Established connection.
     */
    protected void swapConnection(BackendConnection newConn) {
        assert lock.isHeldByCurrentThread();

        BackendConnection old = connection;

        connection = newConn;
        database = newConn.database();

        LOG.info("Connected [type={}, database={}]", type(), database);

        if (old != null) {
            closeConnection(old);
        }
    }

    /** Live connection, {@code null} when not connected. */
    protected @Nullable BackendConnection connection() {
        return connection;
    }

    @Override
    public boolean connected() {
        return connection != null;
    }

    @Override
    public @Nullable String database() {
        return database;
    }

    @Override
    public StatementCursor getCursor() {
        BackendConnection conn = connection;

        if (conn == null) {
            throw new NotConnectedException();
        }

        return conn.cursor();
    }

    @Override
    public <T> T withCursor(CursorCallback<T> callback) {
        lock.lock();

        try (StatementCursor cursor = getCursor()) {
            return callback.apply(cursor);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Cursor<String> tables() {
        return query(tablesQuery(), this::tableName);
    }

    @Override
    public Cursor<TableColumn> tableColumns() {
        return query(tableColumnsQuery(), this::tableColumn);
    }

    @Override
    public List<String> databases() {
        try {
            return withCursor(cursor -> {
                cursor.execute(databasesQuery());

                List<String> names = new ArrayList<>();

                for (List<Object> row = cursor.fetchOne(); row != null; row = cursor.fetchOne()) {
                    names.add(String.valueOf(row.get(0)));
                }

                return names;
            });
        } catch (MetadataDiscoveryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MetadataDiscoveryException("Failed to list databases", e);
        }
    }

    @Override
    public String formatStatistics(StatementCursor cursor) {
        return "";
    }

    @Override
    public boolean supportsSpecialCommand(String name) {
        return false;
    }

    @Override
    public boolean preQualifiedIdentifiers() {
        return false;
    }

    @Override
    public void close() {
        lock.lock();

        try {
            BackendConnection conn = connection;

            if (conn != null) {
                connection = null;

                closeConnection(conn);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Executes a metadata query and returns its rows lazily. The cursor lock is held until the returned cursor is closed
     * or exhausted.
     */
    private <T> Cursor<T> query(String sql, Function<List<Object>, T> mapper) {
        lock.lock();

        StatementCursor cursor = null;

        try {
            cursor = getCursor();

            cursor.execute(sql);
        } catch (RuntimeException e) {
            try {
                if (cursor != null) {
                    cursor.close();
                }
            } finally {
                lock.unlock();
            }

            throw new MetadataDiscoveryException("Failed to execute metadata query", e);
        }

        return new MetadataCursor<>(cursor, mapper);
    }

    private void closeConnection(BackendConnection conn) {
        try {
            conn.close();
        } catch (RuntimeException e) {
            LOG.warn("Failed to close connection [database={}]", e, conn.database());
        }
    }

    /** Rows of a metadata query, releasing the engine cursor and the cursor lock on close. */
    private class MetadataCursor<T> implements Cursor<T> {
        private final StatementCursor cursor;

        private final Function<List<Object>, T> mapper;

        private @Nullable List<Object> nextRow;

        private boolean closed;

        MetadataCursor(StatementCursor cursor, Function<List<Object>, T> mapper) {
            this.cursor = cursor;
            this.mapper = mapper;
        }

        @Override
        public boolean hasNext() {
            if (closed) {
                return false;
            }

            if (nextRow == null) {
                try {
                    nextRow = cursor.fetchOne();
                } catch (RuntimeException e) {
                    close();

                    throw new MetadataDiscoveryException("Failed to fetch metadata", e);
                }

                if (nextRow == null) {
                    close();

                    return false;
                }
            }

            return true;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }

            List<Object> row = nextRow;

            nextRow = null;

            return mapper.apply(row);
        }

        @Override
        public Iterator<T> iterator() {
            return this;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }

            closed = true;

            try {
                cursor.close();
            } finally {
                lock.unlock();
            }
        }
    }
}
