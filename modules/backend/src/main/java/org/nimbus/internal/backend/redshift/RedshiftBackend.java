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

package org.nimbus.internal.backend.redshift;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Properties;
import org.jetbrains.annotations.Nullable;
import org.nimbus.internal.backend.AbstractBackend;
import org.nimbus.internal.backend.AuthenticationException;
import org.nimbus.internal.backend.BackendConnection;
import org.nimbus.internal.backend.BackendType;
import org.nimbus.internal.backend.ConnectionException;
import org.nimbus.internal.backend.TableColumn;
import org.nimbus.internal.backend.jdbc.JdbcBackendConnection;
import org.nimbus.internal.backend.jdbc.JdbcConnectionFactory;
import org.nimbus.internal.logger.Loggers;
import org.nimbus.internal.logger.NimbusLogger;

/**
 * Amazon Redshift backend over the PostgreSQL JDBC driver.
 *
 * <p>When no password is configured, or the user carries the {@code IAM:} prefix, temporary credentials are derived
 * for every new connection. Table and column listings span all user schemas and name relations as
 * {@code schema.relation}.
 */
public class RedshiftBackend extends AbstractBackend {
    private static final NimbusLogger LOG = Loggers.forClass(RedshiftBackend.class);

    private static final String DATABASES_QUERY = "SELECT datname FROM pg_database WHERE datistemplate = false ORDER BY datname";

    private static final String SYSTEM_SCHEMAS = "('pg_catalog', 'information_schema', 'pg_internal')";

    private static final String TABLES_QUERY = "SELECT schemaname, tablename FROM pg_tables"
            + " WHERE schemaname NOT IN " + SYSTEM_SCHEMAS
            + " UNION ALL"
            + " SELECT schemaname, viewname FROM pg_views"
            + " WHERE schemaname NOT IN " + SYSTEM_SCHEMAS
            + " ORDER BY 1, 2";

    private static final String TABLE_COLUMNS_QUERY = "SELECT c.table_schema, c.table_name, c.column_name"
            + " FROM information_schema.columns c"
            + " WHERE c.table_schema NOT IN " + SYSTEM_SCHEMAS
            + " AND (EXISTS (SELECT 1 FROM pg_tables t WHERE c.table_schema = t.schemaname AND c.table_name = t.tablename)"
            + " OR EXISTS (SELECT 1 FROM pg_views v WHERE c.table_schema = v.schemaname AND c.table_name = v.viewname))"
            + " ORDER BY c.table_schema, c.table_name, c.ordinal_position";

    private final RedshiftConnectionParameters params;

    private final JdbcConnectionFactory connectionFactory;

    private final ClusterCredentialsProvider credentialsProvider;

    private final @Nullable String user;

    private final boolean useIam;

    /**
     * Constructor.
     *
     * @param params Connection parameters.
     */
    public RedshiftBackend(RedshiftConnectionParameters params) {
        this(params, JdbcConnectionFactory.DRIVER_MANAGER, new AwsClusterCredentialsProvider(params.awsProfile(), params.region()));
    }

    /**
     * Constructor.
     *
     * @param params Connection parameters.
     * @param connectionFactory JDBC connection factory.
     * @param credentialsProvider Provider of temporary credentials.
     */
    public RedshiftBackend(
            RedshiftConnectionParameters params,
            JdbcConnectionFactory connectionFactory,
            ClusterCredentialsProvider credentialsProvider
    ) {
        super(params.database());

        this.params = params;
        this.connectionFactory = connectionFactory;
        this.credentialsProvider = credentialsProvider;

        String configuredUser = params.user();

        if (configuredUser != null && configuredUser.startsWith(RedshiftConnectionParameters.IAM_USER_PREFIX)) {
            user = configuredUser.substring(RedshiftConnectionParameters.IAM_USER_PREFIX.length());
            useIam = true;
        } else {
            user = configuredUser;
            useIam = params.password() == null && configuredUser != null && !configuredUser.isEmpty();
        }
    }

    @Override
    public BackendType type() {
        return BackendType.REDSHIFT;
    }

    /** Returns {@code true} when connections authenticate with temporary IAM credentials. */
    public boolean usesIam() {
        return useIam;
    }

    /** Database user without the IAM prefix. */
    public @Nullable String user() {
        return user;
    }

    /** Connection parameters. */
    public RedshiftConnectionParameters parameters() {
        return params;
    }

    @Override
    protected BackendConnection openConnection(@Nullable String database) {
        String dbName = database != null ? database : RedshiftConnectionParameters.DEFAULT_DATABASE;
        String dbUser = user;
        String dbPassword = params.password();

        if (useIam && dbPassword == null) {
            ClusterCredentials creds = credentialsProvider.credentials(clusterId(), dbUser, dbName);

            dbUser = creds.dbUser();
            dbPassword = creds.dbPassword();
        }

        Properties props = new Properties();

        putIfNotNull(props, "user", dbUser);
        putIfNotNull(props, "password", dbPassword);
        props.setProperty("sslmode", params.sslMode());

        if (params.connectTimeout() != null) {
            props.setProperty("connectTimeout", String.valueOf(params.connectTimeout()));
        }

        props.putAll(params.extraProperties());

        String url = jdbcUrl(dbName);

        Connection conn;

        try {
            conn = connectionFactory.connect(url, props);
        } catch (SQLException e) {
            LOG.error("Failed to connect to Redshift [url={}]", e, url);

            throw new ConnectionException("Failed to connect to Redshift: " + e.getMessage(), e);
        }

        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            try {
                conn.close();
            } catch (SQLException closeErr) {
                e.addSuppressed(closeErr);
            }

            throw new ConnectionException("Failed to enable autocommit: " + e.getMessage(), e);
        }

        LOG.debug("Connected to Redshift [user={}, url={}]", dbUser, url);

        return new JdbcBackendConnection(conn, dbName);
    }

    /** JDBC URL of the given database. */
    String jdbcUrl(String dbName) {
        return "jdbc:postgresql://" + params.host() + ':' + params.port() + '/' + dbName;
    }

    /** Cluster identifier: first label of the host name. */
    String clusterId() {
        String host = params.host();

        String id = host == null ? "" : host.split("\\.", -1)[0];

        if (id.isEmpty()) {
            throw new AuthenticationException("Cannot extract cluster identifier from host: " + host, null);
        }

        return id;
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
        return TABLE_COLUMNS_QUERY;
    }

    @Override
    protected String tableName(List<Object> row) {
        return row.get(0) + "." + row.get(1);
    }

    @Override
    protected TableColumn tableColumn(List<Object> row) {
        return new TableColumn(row.get(0) + "." + row.get(1), String.valueOf(row.get(2)));
    }

    @Override
    public boolean preQualifiedIdentifiers() {
        return true;
    }

    private static void putIfNotNull(Properties props, String key, @Nullable String val) {
        if (val != null) {
            props.setProperty(key, val);
        }
    }
}
