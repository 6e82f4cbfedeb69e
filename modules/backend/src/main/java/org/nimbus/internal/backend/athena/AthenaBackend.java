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

package org.nimbus.internal.backend.athena;

import org.jetbrains.annotations.Nullable;
import org.nimbus.internal.backend.AbstractBackend;
import org.nimbus.internal.backend.BackendConnection;
import org.nimbus.internal.backend.BackendType;
import org.nimbus.internal.backend.ConnectionException;
import org.nimbus.internal.backend.QueryStatistics;
import org.nimbus.internal.backend.StatementCursor;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Amazon Athena backend.
 *
 * <p>A database may be given as {@code catalog.database}; it is split at the first dot and the catalog part is used
 * for that connection only. A plain database name connects within the configured catalog.
 */
public class AthenaBackend extends AbstractBackend {
    /** Database used by Athena when none is given. */
    static final String DEFAULT_DATABASE = "default";

    private static final String DATABASES_QUERY = "SHOW DATABASES";

    private static final String TABLES_QUERY = "SHOW TABLES";

    private static final String TABLE_COLUMNS_QUERY = "SELECT table_name, column_name FROM information_schema.columns"
            + " WHERE table_schema = '%s' ORDER BY table_name, ordinal_position";

    private final AthenaConnectionParameters params;

    private final AthenaClientFactory clientFactory;

    /** Catalog used for plain database names. */
    private final String defaultCatalog;

    /**
     * Constructor.
     *
     * @param params Connection parameters.
     */
    public AthenaBackend(AthenaConnectionParameters params) {
        this(params, new DefaultAthenaClientFactory());
    }

    /**
     * Constructor.
     *
     * @param params Connection parameters.
     * @param clientFactory Factory of service clients.
     */
    public AthenaBackend(AthenaConnectionParameters params, AthenaClientFactory clientFactory) {
        super(databasePart(params.database()));

        this.params = params;
        this.clientFactory = clientFactory;
        this.defaultCatalog = catalogPart(params.database(), params.catalogName());
    }

    @Override
    public BackendType type() {
        return BackendType.ATHENA;
    }

    /** Catalog of the live connection, or the configured one when not connected. */
    public String catalogName() {
        AthenaConnection conn = (AthenaConnection) connection();

        return conn != null ? conn.catalogName() : defaultCatalog;
    }

    @Override
    public void connect(@Nullable String database) {
        String catalog = catalogPart(database, defaultCatalog);
        String db = databasePart(database);

        lock.lock();

        try {
            boolean same = catalog.equals(catalogName()) && (db == null || db.equals(database()));

            if (connected() && (database == null || same)) {
                return;
            }

            swapConnection(openConnection(catalog, db != null ? db : database()));
        } finally {
            lock.unlock();
        }
    }

    /** Opens a connection to {@code database} within the catalog of the live connection. */
    @Override
    protected BackendConnection openConnection(@Nullable String database) {
        return openConnection(catalogName(), database);
    }

    private BackendConnection openConnection(String catalog, @Nullable String database) {
        AthenaClientHandle handle;

        try {
            handle = clientFactory.create(params);
        } catch (SdkException e) {
            throw new ConnectionException("Failed to create Athena client: " + e.getMessage(), e);
        }

        return new AthenaConnection(handle, catalog, database != null ? database : DEFAULT_DATABASE, params);
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
        String schema = database() != null ? database() : DEFAULT_DATABASE;

        return String.format(TABLE_COLUMNS_QUERY, schema.replace("'", "''"));
    }

    @Override
    public String formatStatistics(StatementCursor cursor) {
        QueryStatistics stats = cursor.statistics();

        return stats == null ? "" : AthenaStatisticsFormatter.format(stats);
    }

    @Override
    public boolean supportsSpecialCommand(String name) {
        return OUTPUT_LOCATION.equals(name) || QUERY_COST_STATISTICS.equals(name);
    }

    private static @Nullable String databasePart(@Nullable String database) {
        if (database == null) {
            return null;
        }

        int dot = database.indexOf('.');

        String db = dot < 0 ? database : database.substring(dot + 1);

        return db.isEmpty() ? null : db;
    }

    private static String catalogPart(@Nullable String database, String defaultCatalog) {
        if (database == null) {
            return defaultCatalog;
        }

        int dot = database.indexOf('.');

        return dot <= 0 ? defaultCatalog : database.substring(0, dot);
    }
}
