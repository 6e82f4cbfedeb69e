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
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Engine cursor: executes one statement at a time and fetches its rows.
 */
public interface StatementCursor extends AutoCloseable {
    /**
     * Executes a statement, discarding the result of the previous one.
     *
     * @param sql Statement text.
     * @throws StatementExecutionException If the engine rejects or fails the statement.
     */
    void execute(String sql);

    /**
     * Returns column names of the current result, or {@code null} when the last statement produced no result set.
     */
    @Nullable List<String> columnNames();

    /**
     * Fetches the next row of the current result.
     *
     * @return Row values, or {@code null} when the result is exhausted or there is none.
     */
    @Nullable List<Object> fetchOne();

    /**
     * Fetches all remaining rows of the current result.
     *
     * @return Rows, empty when there are none.
     */
    default List<List<Object>> fetchAll() {
        List<List<Object>> rows = new ArrayList<>();

        for (List<Object> row = fetchOne(); row != null; row = fetchOne()) {
            rows.add(row);
        }

        return rows;
    }

    /**
     * Returns engine statistics of the last statement, or {@code null} when the engine exposes none.
     */
    default @Nullable QueryStatistics statistics() {
        return null;
    }

    /**
     * Returns the location the engine stored the last result at, or {@code null} when it does not store results.
     */
    default @Nullable String outputLocation() {
        return null;
    }

    @Override
    void close();
}
