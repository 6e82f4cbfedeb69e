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
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens JDBC connections.
 */
@FunctionalInterface
public interface JdbcConnectionFactory {
    /** Factory backed by {@link DriverManager}. */
    JdbcConnectionFactory DRIVER_MANAGER = DriverManager::getConnection;

    /**
     * Opens a connection.
     *
     * @param url JDBC URL.
     * @param props Driver properties.
     * @return Connection.
     * @throws SQLException If the driver fails to connect.
     */
    Connection connect(String url, Properties props) throws SQLException;
}
