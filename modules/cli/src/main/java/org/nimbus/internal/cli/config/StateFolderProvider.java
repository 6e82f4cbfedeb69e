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

import java.io.File;
import java.nio.file.Path;

/**
 * Folder for files the CLI writes: logs and history.
 */
public final class StateFolderProvider {
    private StateFolderProvider() {

    }

    /** {@code $XDG_STATE_HOME/nimbuscli}, or {@code ~/.local/state/nimbuscli}. */
    public static Path getStateFolder() {
        String xdgStateHome = System.getenv(ConfigConstants.XDG_STATE_HOME);
        Path root = xdgStateHome != null
                ? Path.of(xdgStateHome)
                : Path.of(System.getProperty("user.home"), ".local", "state");

        return root.resolve(ConfigConstants.PARENT_FOLDER_NAME);
    }

    public static File getStateFile(String name) {
        return getStateFolder().resolve(name).toFile();
    }

    /** Logs folder: {@code $NIMBUS_CLI_LOGS_DIR} if set, {@code logs} in the state folder otherwise. */
    public static File getLogsDir() {
        String envLogsDir = System.getenv(ConfigConstants.NIMBUS_CLI_LOGS_DIR);

        return envLogsDir != null ? new File(envLogsDir) : getStateFile("logs");
    }
}
