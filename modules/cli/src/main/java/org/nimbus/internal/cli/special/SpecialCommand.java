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

import java.util.List;
import org.nimbus.internal.backend.StatementCursor;
import org.nimbus.internal.cli.sql.QueryResult;

/**
 * Client-side command handled without sending the text to the engine.
 */
public interface SpecialCommand {
    /** Command name, e.g. {@code help}. */
    String name();

    /** Alternative names, e.g. {@code \?}. */
    default List<String> aliases() {
        return List.of();
    }

    /** Usage shown by the help command. */
    default String syntax() {
        return name();
    }

    /** One-line description shown by the help command. */
    String description();

    /** Whether the name must match case. */
    default boolean caseSensitive() {
        return false;
    }

    /**
     * Executes the command.
     *
     * @param cursor Cursor of the current statement.
     * @param arg Text after the command name, trimmed, possibly empty.
     * @return Results to print.
     */
    List<QueryResult> execute(StatementCursor cursor, String arg);
}
