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

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of one statement: an optional title, rows with their headers, and a status line.
 *
 * <p>Rows and headers are either both present or both absent. The status is {@code null} only for {@link #EMPTY}, the
 * result of blank input.
 */
public class QueryResult {
    /** Result of blank input. */
    public static final QueryResult EMPTY = new QueryResult(null, null, null, null);

    private final @Nullable String title;

    private final @Nullable List<List<Object>> rows;

    private final @Nullable List<String> headers;

    private final @Nullable String status;

    /**
     * Constructor.
     *
     * @param title Title printed above the rows.
     * @param rows Rows.
     * @param headers Column headers.
     * @param status Status line.
     */
    public QueryResult(
            @Nullable String title,
            @Nullable List<List<Object>> rows,
            @Nullable List<String> headers,
            @Nullable String status
    ) {
        if ((rows == null) != (headers == null)) {
            throw new IllegalArgumentException("Rows and headers must be both present or both absent");
        }

        this.title = title;
        this.rows = rows;
        this.headers = headers;
        this.status = status;
    }

    /**
     * Creates a result carrying only a status line.
     *
     * @param status Status line.
     * @return Result.
     */
    public static QueryResult status(String status) {
        return new QueryResult(null, null, null, status);
    }

    public @Nullable String title() {
        return title;
    }

    public @Nullable List<List<Object>> rows() {
        return rows;
    }

    public @Nullable List<String> headers() {
        return headers;
    }

    public @Nullable String status() {
        return status;
    }

    /** Returns {@code true} when the result carries rows. */
    public boolean hasRows() {
        return rows != null;
    }

    @Override
    public String toString() {
        return "QueryResult [title=" + title + ", headers=" + headers + ", rows=" + (rows == null ? null : rows.size())
                + ", status=" + status + ']';
    }
}
