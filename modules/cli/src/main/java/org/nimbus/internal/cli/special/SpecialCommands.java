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

import org.nimbus.internal.backend.Backend;

/**
 * Built-in special commands.
 */
public final class SpecialCommands {
    private SpecialCommands() {
        // No-op.
    }

    /**
     * Creates a registry with the built-in commands.
     *
     * @param backend Backend of the session.
     * @param display Display state of the session.
     * @return Registry.
     */
    public static SpecialCommandRegistry defaults(Backend backend, DisplayState display) {
        SpecialCommandRegistry registry = new SpecialCommandRegistry();

        registry.register(new HelpCommand(registry));
        registry.register(new UseDatabaseCommand(backend));
        registry.register(new ListDatabasesCommand(backend));
        registry.register(new ListTablesCommand(backend));
        registry.register(new ExpandedOutputCommand(display));

        if (backend.supportsSpecialCommand(Backend.OUTPUT_LOCATION)) {
            registry.register(new OutputLocationCommand(display));
        }

        return registry;
    }
}
