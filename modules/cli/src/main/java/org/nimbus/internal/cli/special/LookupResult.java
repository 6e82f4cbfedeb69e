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
import org.nimbus.internal.cli.sql.QueryResult;

/**
 * Outcome of a special command lookup.
 */
public final class LookupResult {
    private static final LookupResult NOT_FOUND = new LookupResult(false, List.of());

    private final boolean found;

    private final List<QueryResult> results;

    private LookupResult(boolean found, List<QueryResult> results) {
        this.found = found;
        this.results = results;
    }

    /**
     * The text was a special command.
     *
     * @param results Results the command produced.
     * @return Lookup result.
     */
    public static LookupResult found(List<QueryResult> results) {
        return new LookupResult(true, List.copyOf(results));
    }

    /** The text is not a special command and should be sent to the engine. */
    public static LookupResult notFound() {
        return NOT_FOUND;
    }

    public boolean isFound() {
        return found;
    }

    /** Results of the command, empty when not found. */
    public List<QueryResult> results() {
        return results;
    }
}
