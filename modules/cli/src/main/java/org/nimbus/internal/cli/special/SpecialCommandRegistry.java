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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.nimbus.internal.backend.StatementCursor;
import org.nimbus.internal.logger.Loggers;
import org.nimbus.internal.logger.NimbusLogger;

/**
 * Dispatches text to the special command it names.
 */
public class SpecialCommandRegistry {
    private static final NimbusLogger LOG = Loggers.forClass(SpecialCommandRegistry.class);

    /** Commands by lookup key: the name as is for case-sensitive commands, lower-cased otherwise. */
    private final Map<String, SpecialCommand> commands = new LinkedHashMap<>();

    private final Collection<SpecialCommand> registered = new LinkedHashSet<>();

    /**
     * Registers a command under its name and aliases.
     *
     * @param command Command.
     * @throws IllegalArgumentException If a name is already taken.
     */
    public synchronized void register(SpecialCommand command) {
        List<String> names = new ArrayList<>();

        names.add(command.name());
        names.addAll(command.aliases());

        for (String name : names) {
            String key = key(name, command.caseSensitive());

            if (commands.containsKey(key)) {
                throw new IllegalArgumentException("Special command already registered: " + name);
            }
        }

        for (String name : names) {
            commands.put(key(name, command.caseSensitive()), command);
        }

        registered.add(command);
    }

    /**
     * Executes {@code text} if it starts with a registered command name.
     *
     * @param cursor Cursor of the current statement.
     * @param text Statement text.
     * @return Found with the command results, or not found when the text is plain SQL.
     */
    public LookupResult tryExecute(StatementCursor cursor, String text) {
        String trimmed = text.strip();

        int sep = 0;

        while (sep < trimmed.length() && !Character.isWhitespace(trimmed.charAt(sep))) {
            sep++;
        }

        String name = trimmed.substring(0, sep);
        String arg = trimmed.substring(sep).strip();

        SpecialCommand command = lookup(name);

        if (command == null) {
            return LookupResult.notFound();
        }

        LOG.debug("Executing special command [name={}, arg={}]", command.name(), arg);

        return LookupResult.found(command.execute(cursor, arg));
    }

    /** Names and aliases of all registered commands, in registration order. */
    public synchronized List<String> commandNames() {
        List<String> names = new ArrayList<>();

        for (SpecialCommand cmd : registered) {
            names.add(cmd.name());
            names.addAll(cmd.aliases());
        }

        return names;
    }

    /** Registered commands in registration order. */
    public synchronized Collection<SpecialCommand> commands() {
        return Collections.unmodifiableList(new ArrayList<>(registered));
    }

    private synchronized @Nullable SpecialCommand lookup(String name) {
        SpecialCommand cmd = commands.get(name);

        if (cmd != null && cmd.caseSensitive()) {
            return cmd;
        }

        cmd = commands.get(name.toLowerCase(Locale.ROOT));

        return cmd != null && !cmd.caseSensitive() ? cmd : null;
    }

    private static String key(String name, boolean caseSensitive) {
        return caseSensitive ? name : name.toLowerCase(Locale.ROOT);
    }
}
