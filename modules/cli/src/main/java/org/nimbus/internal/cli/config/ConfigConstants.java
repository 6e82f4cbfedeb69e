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
 * Locations and keys of the CLI configuration.
 */
public final class ConfigConstants {
    private static final String XDG_CONFIG_HOME = "XDG_CONFIG_HOME";
    static final String XDG_STATE_HOME = "XDG_STATE_HOME";
    static final String PARENT_FOLDER_NAME = "nimbuscli";
    private static final String CONFIG_FILE_NAME = "nimbus.conf";

    /** Classpath resource with the default configuration. */
    public static final String DEFAULTS_RESOURCE = "nimbus-defaults.conf";

    /** Environment variable overriding the logs directory. */
    public static final String NIMBUS_CLI_LOGS_DIR = "NIMBUS_CLI_LOGS_DIR";

    public static final String ATHENA = "nimbus.athena";
    public static final String REDSHIFT = "nimbus.redshift";
    public static final String CLI = "nimbus.cli";

    public static final String HISTORY_FILE = "history-file";
    public static final String REFRESH_ON_START = "refresh-on-start";
    public static final String PROMPT = "prompt";
    public static final String TABLE_FORMAT = "table-format";
    public static final String PROFILES = "profiles";

    private ConfigConstants() {

    }

    public static File getConfigFile() {
        return getConfigRoot().resolve(PARENT_FOLDER_NAME).resolve(CONFIG_FILE_NAME).toFile();
    }

    private static Path getConfigRoot() {
        String xdgConfigHome = System.getenv(XDG_CONFIG_HOME);
        if (xdgConfigHome != null) {
            return Path.of(xdgConfigHome);
        } else {
            return Path.of(System.getProperty("user.home"), ".config");
        }
    }
}
