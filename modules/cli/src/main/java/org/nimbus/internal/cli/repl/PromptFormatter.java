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

package org.nimbus.internal.cli.repl;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import org.jetbrains.annotations.Nullable;
import org.nimbus.internal.backend.Backend;
import org.nimbus.internal.backend.athena.AthenaBackend;
import org.nimbus.internal.backend.redshift.RedshiftBackend;
import org.nimbus.internal.backend.redshift.RedshiftConnectionParameters;

/**
 * Expands prompt placeholders.
 *
 * <ul>
 *     <li>{@code \d} active database;</li>
 *     <li>{@code \c} Athena catalog;</li>
 *     <li>{@code \h}, {@code \p}, {@code \u005Cu} Redshift host, port and user;</li>
 *     <li>{@code \t} current time;</li>
 *     <li>{@code \n} line break.</li>
 * </ul>
 * Values that do not apply to the backend render as {@code (none)}.
 */
public final class PromptFormatter {
    static final String NONE = "(none)";

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private PromptFormatter() {
        // No-op.
    }

    /**
     * Expands a template.
     *
     * @param template Template.
     * @param backend Backend.
     * @param now Time for {@code \t}.
     * @return Prompt.
     */
    public static String format(String template, Backend backend, LocalTime now) {
        String host = null;
        String port = null;
        String user = null;
        String catalog = null;

        if (backend instanceof RedshiftBackend) {
            RedshiftBackend redshift = (RedshiftBackend) backend;
            RedshiftConnectionParameters params = redshift.parameters();

            host = params.host();
            port = String.valueOf(params.port());
            user = redshift.user();
        } else if (backend instanceof AthenaBackend) {
            catalog = ((AthenaBackend) backend).catalogName();
        }

        return template
                .replace("\\d", orNone(backend.database()))
                .replace("\\c", orNone(catalog))
                .replace("\\h", orNone(host))
                .replace("\\p", orNone(port))
                .replace("\\u", orNone(user))
                .replace("\\t", TIME.format(now))
                .replace("\\n", "\n");
    }

    private static String orNone(@Nullable String val) {
        return val == null || val.isEmpty() ? NONE : val;
    }
}
