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

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.nimbus.internal.backend.StatementCursor;
import org.nimbus.internal.backend.StatementExecutionException;
import org.nimbus.internal.logger.Loggers;
import org.nimbus.internal.logger.NimbusLogger;

/**
 * Statement cursor over a JDBC {@link Statement}.
 */
public class JdbcStatementCursor implements StatementCursor {
    private static final NimbusLogger LOG = Loggers.forClass(JdbcStatementCursor.class);

    private final Statement stmt;

    private @Nullable ResultSet rs;

    private @Nullable List<String> columnNames;

    public JdbcStatementCursor(Statement stmt) {
        this.stmt = stmt;
    }

    @Override
    public void execute(String sql) {
        closeResultSet();

        try {
            if (stmt.execute(sql)) {
                ResultSet resultSet = stmt.getResultSet();
                ResultSetMetaData meta = resultSet.getMetaData();

                List<String> names = new ArrayList<>(meta.getColumnCount());

                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    names.add(meta.getColumnLabel(i));
                }

                rs = resultSet;
                columnNames = names;
            }
        } catch (SQLException e) {
            throw new StatementExecutionException(e.getMessage(), e);
        }
    }

    @Override
    public @Nullable List<String> columnNames() {
        return columnNames;
    }

    @Override
    public @Nullable List<Object> fetchOne() {
        ResultSet resultSet = rs;

        if (resultSet == null) {
            return null;
        }

        try {
            if (!resultSet.next()) {
                return null;
            }

            int cnt = columnNames == null ? 0 : columnNames.size();

            List<Object> row = new ArrayList<>(cnt);

            for (int i = 1; i <= cnt; i++) {
                row.add(resultSet.getObject(i));
            }

            return row;
        } catch (SQLException e) {
            throw new StatementExecutionException(e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        closeResultSet();

        try {
            stmt.close();
        } catch (SQLException e) {
            LOG.warn("Failed to close statement", e);
        }
    }

    private void closeResultSet() {
        ResultSet resultSet = rs;

        rs = null;
        columnNames = null;

        if (resultSet != null) {
            try {
                resultSet.close();
            } catch (SQLException e) {
                LOG.warn("Failed to close result set", e);
            }
        }
    }
}
