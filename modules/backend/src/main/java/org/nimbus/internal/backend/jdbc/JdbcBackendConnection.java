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

package org.nimbus.internal.backend.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import org.nimbus.internal.backend.BackendConnection;
import org.nimbus.internal.backend.ConnectionException;
import org.nimbus.internal.backend.StatementCursor;
import org.nimbus.internal.backend.StatementExecutionException;

/**
 * Backend connection over a JDBC connection.
 */
public class JdbcBackendConnection implements BackendConnection {
    private final Connection conn;

    private final String database;

    public JdbcBackendConnection(Connection conn, String database) {
        this.conn = conn;
        this.database = database;
    }

    @Override
    public String database() {
        return database;
    }

    @Override
    public StatementCursor cursor() {
        try {
            return new JdbcStatementCursor(conn.createStatement());
        } catch (SQLException e) {
            throw new StatementExecutionException("Failed to create statement: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            conn.close();
        } catch (SQLException e) {
            throw new ConnectionException("Failed to close connection: " + e.getMessage(), e);
        }
    }
}
