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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import org.jetbrains.annotations.Nullable;
import org.nimbus.internal.backend.QueryStatistics;
import org.nimbus.internal.backend.StatementCursor;
import org.nimbus.internal.backend.StatementExecutionException;
import org.nimbus.internal.logger.Loggers;
import org.nimbus.internal.logger.NimbusLogger;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.athena.model.ColumnInfo;
import software.amazon.awssdk.services.athena.model.Datum;
import software.amazon.awssdk.services.athena.model.GetQueryExecutionRequest;
import software.amazon.awssdk.services.athena.model.GetQueryResultsRequest;
import software.amazon.awssdk.services.athena.model.GetQueryResultsResponse;
import software.amazon.awssdk.services.athena.model.QueryExecution;
import software.amazon.awssdk.services.athena.model.QueryExecutionContext;
import software.amazon.awssdk.services.athena.model.QueryExecutionState;
import software.amazon.awssdk.services.athena.model.QueryExecutionStatistics;
import software.amazon.awssdk.services.athena.model.ResultConfiguration;
import software.amazon.awssdk.services.athena.model.ResultReuseByAgeConfiguration;
import software.amazon.awssdk.services.athena.model.ResultReuseConfiguration;
import software.amazon.awssdk.services.athena.model.Row;
import software.amazon.awssdk.services.athena.model.StartQueryExecutionRequest;
import software.amazon.awssdk.services.athena.model.StatementType;
import software.amazon.awssdk.services.athena.model.StopQueryExecutionRequest;

/**
 * Starts a query execution, polls it until it reaches a terminal state and pages through its results.
 */
class AthenaCursor implements StatementCursor {
    private static final NimbusLogger LOG = Loggers.forClass(AthenaCursor.class);

    private static final int PAGE_SIZE = 1000;

    private final AthenaConnection conn;

    private @Nullable QueryExecution execution;

    private @Nullable List<ColumnInfo> columns;

    private Iterator<Row> pageRows = Collections.emptyIterator();

    private @Nullable String nextToken;

    AthenaCursor(AthenaConnection conn) {
        this.conn = conn;
    }

    @Override
    public void execute(String sql) {
        execution = null;
        columns = null;
        pageRows = Collections.emptyIterator();
        nextToken = null;

        String queryId;

        try {
            queryId = conn.client().startQueryExecution(startRequest(sql)).queryExecutionId();
        } catch (SdkException e) {
            throw new StatementExecutionException(e.getMessage(), e);
        }

        LOG.debug("Query started [queryId={}]", queryId);

        QueryExecution exec = awaitCompletion(queryId);

        QueryExecutionState state = exec.status().state();

        if (state != QueryExecutionState.SUCCEEDED) {
            String reason = exec.status().stateChangeReason();

            throw new StatementExecutionException(reason != null ? reason : "Query " + queryId + " finished in state " + state);
        }

        execution = exec;

        GetQueryResultsResponse firstPage = fetchPage(queryId, null);

        List<ColumnInfo> columnInfo = firstPage.resultSet().resultSetMetadata().columnInfo();

        columns = columnInfo.isEmpty() ? null : columnInfo;

        List<Row> rows = firstPage.resultSet().rows();

        if (exec.statementType() == StatementType.DML && !rows.isEmpty() && isHeaderRow(rows.get(0))) {
            rows = rows.subList(1, rows.size());
        }

        pageRows = rows.iterator();
        nextToken = firstPage.nextToken();
    }

    @Override
    public @Nullable List<String> columnNames() {
        List<ColumnInfo> cols = columns;

        if (cols == null) {
            return null;
        }

        List<String> names = new ArrayList<>(cols.size());

        for (ColumnInfo col : cols) {
            names.add(col.name());
        }

        return names;
    }

    @Override
    public @Nullable List<Object> fetchOne() {
        QueryExecution exec = execution;

        if (exec == null || columns == null) {
            return null;
        }

        while (!pageRows.hasNext() && nextToken != null) {
            GetQueryResultsResponse page = fetchPage(exec.queryExecutionId(), nextToken);

            pageRows = page.resultSet().rows().iterator();
            nextToken = page.nextToken();
        }

        return pageRows.hasNext() ? convert(pageRows.next()) : null;
    }

    @Override
    public @Nullable QueryStatistics statistics() {
        QueryExecution exec = execution;

        if (exec == null || exec.statistics() == null) {
            return null;
        }

        QueryExecutionStatistics stats = exec.statistics();

        return new QueryStatistics(
                stats.dataScannedInBytes() == null ? 0 : stats.dataScannedInBytes(),
                stats.engineExecutionTimeInMillis() == null ? 0 : stats.engineExecutionTimeInMillis());
    }

    @Override
    public @Nullable String outputLocation() {
        QueryExecution exec = execution;

        if (exec == null || exec.resultConfiguration() == null) {
            return null;
        }

        return exec.resultConfiguration().outputLocation();
    }

    @Override
    public void close() {
        execution = null;
        columns = null;
        pageRows = Collections.emptyIterator();
        nextToken = null;
    }

    private StartQueryExecutionRequest startRequest(String sql) {
        AthenaConnectionParameters params = conn.parameters();

        StartQueryExecutionRequest.Builder req = StartQueryExecutionRequest.builder()
                .queryString(sql)
                .queryExecutionContext(QueryExecutionContext.builder()
                        .catalog(conn.catalogName())
                        .database(conn.database())
                        .build());

        if (params.s3StagingDir() != null) {
            req.resultConfiguration(ResultConfiguration.builder().outputLocation(params.s3StagingDir()).build());
        }

        if (params.workGroup() != null) {
            req.workGroup(params.workGroup());
        }

        if (params.resultReuseEnable()) {
            req.resultReuseConfiguration(ResultReuseConfiguration.builder()
                    .resultReuseByAgeConfiguration(ResultReuseByAgeConfiguration.builder()
                            .enabled(true)
                            .maxAgeInMinutes(params.resultReuseMinutes())
                            .build())
                    .build());
        }

        return req.build();
    }

    private QueryExecution awaitCompletion(String queryId) {
        long pollMillis = conn.parameters().pollInterval().toMillis();

        try {
            while (true) {
                QueryExecution exec = conn.client().getQueryExecution(GetQueryExecutionRequest.builder()
                        .queryExecutionId(queryId)
                        .build()).queryExecution();

                QueryExecutionState state = exec.status().state();

                if (state != QueryExecutionState.QUEUED && state != QueryExecutionState.RUNNING) {
                    return exec;
                }

                Thread.sleep(pollMillis);
            }
        } catch (SdkException e) {
            throw new StatementExecutionException(e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();

            cancel(queryId);

            throw new StatementExecutionException("Query was interrupted [queryId=" + queryId + ']', e);
        }
    }

    private void cancel(String queryId) {
        try {
            conn.client().stopQueryExecution(StopQueryExecutionRequest.builder().queryExecutionId(queryId).build());
        } catch (SdkException e) {
            LOG.warn("Failed to stop query [queryId={}]", e, queryId);
        }
    }

    private GetQueryResultsResponse fetchPage(String queryId, @Nullable String token) {
        try {
            return conn.client().getQueryResults(GetQueryResultsRequest.builder()
                    .queryExecutionId(queryId)
                    .nextToken(token)
                    .maxResults(PAGE_SIZE)
                    .build());
        } catch (SdkException e) {
            throw new StatementExecutionException(e.getMessage(), e);
        }
    }

    private boolean isHeaderRow(Row row) {
        List<String> names = columnNames();

        if (names == null || names.size() != row.data().size()) {
            return false;
        }

        for (int i = 0; i < names.size(); i++) {
            if (!names.get(i).equals(row.data().get(i).varCharValue())) {
                return false;
            }
        }

        return true;
    }

    private List<Object> convert(Row row) {
        List<ColumnInfo> cols = columns;
        List<Datum> data = row.data();
        List<Object> values = new ArrayList<>(data.size());

        for (int i = 0; i < data.size(); i++) {
            String type = cols != null && i < cols.size() ? cols.get(i).type() : null;

            values.add(convert(data.get(i).varCharValue(), type));
        }

        return values;
    }

    private static @Nullable Object convert(@Nullable String value, @Nullable String type) {
        if (value == null || type == null) {
            return value;
        }

        try {
            switch (type.toLowerCase(Locale.ROOT)) {
                case "tinyint":
                case "smallint":
                case "integer":
                case "bigint":
                    return Long.parseLong(value);

                case "float":
                case "real":
                case "double":
                    return Double.parseDouble(value);

                case "decimal":
                    return new BigDecimal(value);

                case "boolean":
                    return Boolean.parseBoolean(value);

                default:
                    return value;
            }
        } catch (NumberFormatException e) {
            LOG.debug("Failed to convert value, keeping text [type={}, value={}]", type, value);

            return value;
        }
    }
}
