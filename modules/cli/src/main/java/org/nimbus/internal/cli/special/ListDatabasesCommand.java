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

package org.nimbus.internal.cli.special;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.nimbus.internal.backend.Backend;
import org.nimbus.internal.backend.StatementCursor;
import org.nimbus.internal.cli.sql.QueryResult;
import org.nimbus.internal.cli.sql.StatusFormatter;

/**
 * Lists databases.
 */
class ListDatabasesCommand implements SpecialCommand {
    private final Backend backend;

    ListDatabasesCommand(Backend backend) {
        this.backend = backend;
    }

    @Override
    public String name() {
        return "\\l";
    }

    @Override
    public String description() {
        return "List databases.";
    }

    @Override
    public boolean caseSensitive() {
        return true;
    }

    @Override
    public List<QueryResult> execute(StatementCursor cursor, String arg) {
        List<List<Object>> rows = new ArrayList<>();

        for (String db : backend.databases()) {
            rows.add(Arrays.<Object>asList(db));
        }

        return List.of(new QueryResult(null, rows, List.of("Database"), StatusFormatter.rowsStatus(rows.size())));
    }
}
