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

import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.nimbus.internal.util.Cursor;

/**
 * Engine-agnostic connection to a cloud query engine.
 *
 * <p>A backend owns at most one live connection. All cursor use, both by statements typed by the user and by the
 * background metadata discovery, goes through the backend's cursor lock: see {@link #withCursor}, {@link #tables()} and
 * {@link #tableColumns()}.
 */
public interface Backend extends AutoCloseable {
    /** Capability: the engine stores results at a location that can be shown to the user. */
    String OUTPUT_LOCATION = "output_location";

    /** Capability: the engine reports scanned bytes and execution time per statement. */
    String QUERY_COST_STATISTICS = "query_cost_statistics";

    /** Engine of this backend. */
    BackendType type();

    /**
     * Establishes a connection, or switches the active database. Does nothing when already connected and
     * {@code database} is {@code null} or equal to the active database.
     *
     * <p>The previous connection is closed only after the new one is established; when the new attempt fails the
     * previous one stays active.
     *
     * @param database Database (schema) to connect to, {@code null} to keep the configured one.
     * @throws ConnectionException If the connection can't be established.
     * @throws AuthenticationException If temporary credentials can't be derived.
     */
    void connect(@Nullable String database);

    /**
     * Unconditionally opens a fresh connection to the active database. Failure semantics are those of
     * {@link #connect}.
     */
    void reconnect();

    /** Returns {@code true} when a live connection is held. */
    boolean connected();

    /** Active database (schema), or {@code null} when not known yet. */
    @Nullable String database();

    /**
     * Opens a cursor on the live connection. Callers sharing the backend with other threads should prefer
     * {@link #withCursor}.
     *
     * @return Cursor.
     * @throws NotConnectedException If there is no live connection.
     */
    StatementCursor getCursor();

    /**
     * Runs {@code callback} with a fresh cursor while holding the cursor lock. The cursor is closed afterwards.
     *
     * @param callback Work to do.
     * @param <T> Result type.
     * @return Callback result.
     */
    <T> T withCursor(CursorCallback<T> callback);

    /**
     * Lists tables and views of the active database. The returned cursor holds the cursor lock until it is closed or
     * exhausted, so it must be closed by the thread that obtained it.
     *
     * @return Lazy, single-pass sequence of table identifiers.
     * @throws MetadataDiscoveryException If the listing can't be obtained.
     */
    Cursor<String> tables();

    /**
     * Lists columns of the active database ordered by table, then by column position. Locking is the same as for
     * {@link #tables()}.
     *
     * @return Lazy, single-pass sequence of columns.
     * @throws MetadataDiscoveryException If the listing can't be obtained.
     */
    Cursor<TableColumn> tableColumns();

    /**
     * Lists databases in the order the engine returns them.
     *
     * @return Database names, possibly empty.
     * @throws MetadataDiscoveryException If the listing can't be obtained.
     */
    List<String> databases();

    /**
     * Formats engine statistics of the last statement executed on {@code cursor}.
     *
     * @param cursor Cursor.
     * @return Statistics suffix, or an empty string.
     */
    String formatStatistics(StatementCursor cursor);

    /**
     * Tells whether an optional capability is supported, see {@link #OUTPUT_LOCATION} and
     * {@link #QUERY_COST_STATISTICS}.
     *
     * @param name Capability name.
     * @return {@code true} if supported.
     */
    boolean supportsSpecialCommand(String name);

    /**
     * Returns {@code true} when {@link #tables()} and {@link #tableColumns()} produce {@code schema.relation} display
     * names that must be used as they are.
     */
    boolean preQualifiedIdentifiers();

    /** Releases the connection. Does nothing when already closed. */
    @Override
    void close();
}
