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

package org.nimbus.internal.cli.completion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;
import org.nimbus.internal.backend.TableColumn;

/**
 * Names known to the completer: databases, the relations and columns of the active database, special commands and
 * keywords.
 *
 * <p>An index is filled by a single refresh worker and published only once complete, so it is not thread-safe.
 */
public class CompletionIndex {
    /** Relation kind of tables. */
    public static final String TABLES = "tables";

    /** Relation kind of views. */
    public static final String VIEWS = "views";

    /** Column placeholder every relation starts with. */
    public static final String ALL_COLUMNS = "*";

    private static final List<String> KINDS = List.of(TABLES, VIEWS);

    /** Plain identifier, anything else needs quoting. */
    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("^[_a-z][_a-z0-9$]*$", Pattern.CASE_INSENSITIVE);

    private final Set<String> databases = new LinkedHashSet<>();

    private final Set<String> schemata = new LinkedHashSet<>();

    /** Kind to database to relation to columns. */
    private final Map<String, Map<String, Map<String, List<String>>>> metadata = new HashMap<>();

    private final Set<String> specialCommands = new LinkedHashSet<>();

    private final Set<String> allCompletions = new LinkedHashSet<>();

    private @Nullable String dbName;

    /** Constructor. */
    public CompletionIndex() {
        for (String kind : KINDS) {
            metadata.put(kind, new HashMap<>());
        }

        allCompletions.addAll(SqlKeywords.KEYWORDS);
    }

    /**
     * Quotes a name with backticks unless it is a plain identifier that is not a reserved word.
     *
     * @param name Name.
     * @return Name usable in a statement.
     */
    public static String escapeName(String name) {
        if (name.isEmpty() || !PLAIN_IDENTIFIER.matcher(name).matches() || SqlKeywords.isReserved(name)) {
            return '`' + name + '`';
        }

        return name;
    }

    public void extendDatabaseNames(Iterable<String> names) {
        for (String name : names) {
            databases.add(name);
            allCompletions.add(name);
        }
    }

    /**
     * Registers a schema so that relations can be recorded under it.
     *
     * @param schema Schema, ignored when {@code null}.
     */
    public void extendSchemata(@Nullable String schema) {
        if (schema == null) {
            return;
        }

        schemata.add(schema);

        for (String kind : KINDS) {
            metadata.get(kind).putIfAbsent(schema, new LinkedHashMap<>());
        }

        allCompletions.add(schema);
    }

    public void setDbName(@Nullable String dbName) {
        this.dbName = dbName;
    }

    /**
     * Adds relations of the active database, escaping their names.
     *
     * @param names Bare relation names.
     * @param kind Relation kind.
     */
    public void extendRelations(Iterable<String> names, String kind) {
        for (String name : names) {
            addQualifiedRelation(escapeName(name), kind);
        }
    }

    /**
     * Adds columns of relations of the active database, escaping both names.
     *
     * @param columns Relation and column pairs.
     * @param kind Relation kind.
     */
    public void extendColumns(Iterable<TableColumn> columns, String kind) {
        for (TableColumn col : columns) {
            addQualifiedColumn(escapeName(col.tableName()), escapeName(col.columnName()), kind);
        }
    }

    /**
     * Adds a relation under the name it is displayed with, without escaping.
     *
     * @param relation Relation name.
     * @param kind Relation kind.
     */
    public void addQualifiedRelation(String relation, String kind) {
        Map<String, List<String>> relations = relations(kind);

        if (relations != null) {
            List<String> cols = new ArrayList<>();

            cols.add(ALL_COLUMNS);

            relations.put(relation, cols);
        }

        allCompletions.add(relation);
    }

    /**
     * Adds a column of a relation previously added with its display name, without escaping.
     *
     * @param relation Relation name.
     * @param column Column name.
     * @param kind Relation kind.
     */
    public void addQualifiedColumn(String relation, String column, String kind) {
        Map<String, List<String>> relations = relations(kind);

        if (relations != null) {
            List<String> cols = relations.get(relation);

            if (cols != null) {
                cols.add(column);
            }
        }

        allCompletions.add(column);
    }

    public void extendSpecialCommands(Iterable<String> names) {
        for (String name : names) {
            specialCommands.add(name);
            allCompletions.add(name);
        }
    }

    /**
     * Finds completion candidates.
     *
     * @param prefix Typed word, matched case-insensitively; quoted candidates also match on their unquoted name.
     * @return Sorted candidates.
     */
    public List<String> findMatches(String prefix) {
        String lower = prefix.toLowerCase(Locale.ROOT);

        Set<String> res = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

        for (String candidate : allCompletions) {
            String cmp = candidate.toLowerCase(Locale.ROOT);

            if (cmp.startsWith(lower) || (cmp.startsWith("`") && cmp.substring(1).startsWith(lower))) {
                res.add(candidate);
            }
        }

        return new ArrayList<>(res);
    }

    public Set<String> databases() {
        return Collections.unmodifiableSet(databases);
    }

    public Set<String> schemata() {
        return Collections.unmodifiableSet(schemata);
    }

    public Set<String> specialCommands() {
        return Collections.unmodifiableSet(specialCommands);
    }

    public Set<String> allCompletions() {
        return Collections.unmodifiableSet(allCompletions);
    }

    public @Nullable String dbName() {
        return dbName;
    }

    /**
     * Columns of a relation of the active database.
     *
     * @param relation Relation name as stored.
     * @param kind Relation kind.
     * @return Columns starting with {@link #ALL_COLUMNS}, or {@code null} if the relation is unknown.
     */
    public @Nullable List<String> columns(String relation, String kind) {
        Map<String, List<String>> relations = relations(kind);

        if (relations == null) {
            return null;
        }

        List<String> cols = relations.get(relation);

        return cols == null ? null : Collections.unmodifiableList(cols);
    }

    /**
     * Relations of the active database.
     *
     * @param kind Relation kind.
     * @return Relation names.
     */
    public Set<String> relationNames(String kind) {
        Map<String, List<String>> relations = relations(kind);

        return relations == null ? Set.of() : Collections.unmodifiableSet(relations.keySet());
    }

    private @Nullable Map<String, List<String>> relations(String kind) {
        Map<String, Map<String, List<String>>> byDb = metadata.get(kind);

        if (byDb == null) {
            throw new IllegalArgumentException("Unknown relation kind: " + kind);
        }

        return dbName == null ? null : byDb.get(dbName);
    }
}
