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

package org.nimbus.internal.cli.config;

import com.typesafe.config.Config;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;

/**
 * Resolves a setting from, in order of priority, the command line, a configuration section and the environment.
 * Empty values count as absent at every level.
 */
public class ValueResolver {
    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "on");

    private final Config section;

    private final Function<String, String> env;

    /**
     * Constructor.
     *
     * @param section Configuration section.
     * @param env Environment lookup, usually {@code System::getenv}.
     */
    public ValueResolver(Config section, Function<String, String> env) {
        this.section = section;
        this.env = env;
    }

    /**
     * Resolves a string.
     *
     * @param cli Command line value.
     * @param key Configuration key.
     * @param envNames Environment variables, first set one wins.
     * @return Value or {@code null}.
     */
    public @Nullable String string(@Nullable String cli, String key, String... envNames) {
        if (!isEmpty(cli)) {
            return cli;
        }

        String cfg = configValue(key);

        if (!isEmpty(cfg)) {
            return cfg;
        }

        for (String name : envNames) {
            String val = env.apply(name);

            if (!isEmpty(val)) {
                return val;
            }
        }

        return null;
    }

    /**
     * Resolves a string with a default.
     *
     * @param cli Command line value.
     * @param key Configuration key.
     * @param dflt Default.
     * @param envNames Environment variables.
     * @return Value.
     */
    public String stringOrDefault(@Nullable String cli, String key, String dflt, String... envNames) {
        String val = string(cli, key, envNames);

        return val != null ? val : dflt;
    }

    /**
     * Resolves an integer; an unparsable value is skipped in favour of the next level.
     *
     * @param cli Command line value.
     * @param key Configuration key.
     * @param dflt Default.
     * @param envNames Environment variables.
     * @return Value.
     */
    public int integer(@Nullable Integer cli, String key, int dflt, String... envNames) {
        if (cli != null) {
            return cli;
        }

        Integer cfg = parseInt(configValue(key));

        if (cfg != null) {
            return cfg;
        }

        for (String name : envNames) {
            Integer val = parseInt(env.apply(name));

            if (val != null) {
                return val;
            }
        }

        return dflt;
    }

    /**
     * Resolves a flag.
     *
     * @param cli Command line value.
     * @param key Configuration key.
     * @param dflt Default.
     * @return Value.
     */
    public boolean bool(@Nullable Boolean cli, String key, boolean dflt) {
        if (cli != null) {
            return cli;
        }

        String cfg = configValue(key);

        return cfg == null ? dflt : parseBool(cfg);
    }

    /** {@code true}, {@code 1}, {@code yes} and {@code on} in any case are true, anything else is false. */
    public static boolean parseBool(String val) {
        return TRUE_VALUES.contains(val.strip().toLowerCase(Locale.ROOT));
    }

    /**
     * Parses an integer.
     *
     * @param val Text.
     * @return Value or {@code null} if absent or not a number.
     */
    public static @Nullable Integer parseInt(@Nullable String val) {
        if (isEmpty(val)) {
            return null;
        }

        try {
            return Integer.parseInt(val.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private @Nullable String configValue(String key) {
        if (!section.hasPath(key)) {
            return null;
        }

        // Unwrapped so that numbers and booleans written without quotes are accepted as well.
        Object val = section.getValue(key).unwrapped();

        return val == null ? null : val.toString();
    }

    private static boolean isEmpty(@Nullable String val) {
        return val == null || val.isEmpty();
    }
}
