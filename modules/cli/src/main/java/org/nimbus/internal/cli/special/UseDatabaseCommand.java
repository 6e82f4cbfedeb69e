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

import static org.nimbus.lang.ErrorGroups.Common.ILLEGAL_ARGUMENT_ERR;

import java.util.List;
import org.nimbus.internal.backend.Backend;
import org.nimbus.internal.backend.StatementCursor;
import org.nimbus.internal.cli.sql.QueryResult;
import org.nimbus.lang.NimbusException;

/**
 * Switches the active database.
 */
class UseDatabaseCommand implements SpecialCommand {
    private final Backend backend;

    UseDatabaseCommand(Backend backend) {
        this.backend = backend;
    }

    @Override
    public String name() {
        return "use";
    }

    @Override
    public List<String> aliases() {
        return List.of("\\u");
    }

    @Override
    public String syntax() {
        return "use <database>";
    }

    @Override
    public String description() {
        return "Change to a new database.";
    }

    @Override
    public List<QueryResult> execute(StatementCursor cursor, String arg) {
        String database = unquote(arg);

        if (database.isEmpty()) {
            throw new NimbusException(ILLEGAL_ARGUMENT_ERR, "No database selected");
        }

        backend.connect(database);

        return List.of(QueryResult.status("You are now connected to database \"" + backend.database() + "\""));
    }

    private static String unquote(String name) {
        if (name.length() >= 2) {
            char first = name.charAt(0);
            char last = name.charAt(name.length() - 1);

            if (first == last && (first == '"' || first == '`' || first == '\'')) {
                return name.substring(1, name.length() - 1);
            }
        }

        return name;
    }
}
