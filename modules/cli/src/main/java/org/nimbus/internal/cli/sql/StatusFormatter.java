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

import org.nimbus.internal.backend.Backend;
import org.nimbus.internal.backend.StatementCursor;

/**
 * Builds status lines of executed statements.
 */
public final class StatusFormatter {
    /** Status of a statement without rows. */
    public static final String QUERY_OK = "Query OK";

    private StatusFormatter() {
        // No-op.
    }

    /**
     * Formats the row count part of a status.
     *
     * @param rowCount Number of rows, {@code 0} when the statement returned none.
     * @return {@code "<N> row(s) in set"}, or {@link #QUERY_OK} when there are no rows.
     */
    public static String rowsStatus(int rowCount) {
        if (rowCount <= 0) {
            return QUERY_OK;
        }

        return rowCount + (rowCount == 1 ? " row in set" : " rows in set");
    }

    /**
     * Formats the full status: row count followed by engine statistics.
     *
     * @param rowCount Number of rows.
     * @param cursor Cursor the statement was executed on.
     * @param backend Backend.
     * @return Status.
     */
    public static String status(int rowCount, StatementCursor cursor, Backend backend) {
        return rowsStatus(rowCount) + backend.formatStatistics(cursor);
    }
}
