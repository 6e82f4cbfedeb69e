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
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import java.io.File;
import org.jetbrains.annotations.Nullable;
import org.nimbus.internal.backend.BackendType;
import org.nimbus.internal.logger.Loggers;
import org.nimbus.internal.logger.NimbusLogger;

/**
 * CLI configuration: the user's HOCON file over the bundled defaults.
 */
public class CliConfig {
    private static final NimbusLogger LOG = Loggers.forClass(CliConfig.class);

    /** Prompt used when the backend section sets none. */
    public static final String DEFAULT_PROMPT = "\\d> ";

    private final Config config;

    private final File file;

    CliConfig(Config config, File file) {
        this.config = config;
        this.file = file;
    }

    /**
     * Loads the configuration.
     *
     * @param explicitFile File given on the command line, must exist; {@code null} to use the default location, which
     *      may be missing.
     * @return Configuration.
     * @throws ConfigException If a file cannot be parsed.
     */
    public static CliConfig load(@Nullable File explicitFile) {
        File file = explicitFile != null ? explicitFile : ConfigConstants.getConfigFile();

        try {
            Config defaults = ConfigFactory.parseResources(CliConfig.class.getClassLoader(), ConfigConstants.DEFAULTS_RESOURCE);

            Config user = ConfigFactory.parseFile(
                    file,
                    ConfigParseOptions.defaults().setAllowMissing(explicitFile == null)
            );

            LOG.info("Configuration loaded [file={}, exists={}]", file, file.exists());

            return new CliConfig(user.withFallback(defaults).resolve(), file);
        } catch (com.typesafe.config.ConfigException e) {
            throw new ConfigException("Failed to read configuration file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Creates a configuration from an already parsed tree, falling back to the bundled defaults.
     *
     * @param config Tree.
     * @param file File the tree is attributed to in messages.
     * @return Configuration.
     */
    public static CliConfig of(Config config, File file) {
        Config defaults = ConfigFactory.parseResources(CliConfig.class.getClassLoader(), ConfigConstants.DEFAULTS_RESOURCE);

        return new CliConfig(config.withFallback(defaults).resolve(), file);
    }

    /** File the user configuration is read from. */
    public File file() {
        return file;
    }

    /**
     * Settings of an Athena profile.
     *
     * @param profile Profile name.
     * @return Profile section, empty when the profile is not configured.
     */
    public Config athena(String profile) {
        return section(ConfigConstants.ATHENA + '.' + ConfigConstants.PROFILES + ".\"" + profile + '"');
    }

    /** Redshift settings. */
    public Config redshift() {
        return section(ConfigConstants.REDSHIFT);
    }

    /**
     * Prompt template of a backend.
     *
     * @param type Backend type.
     * @return Template.
     */
    public String prompt(BackendType type) {
        Config section = section("nimbus." + type.typeName());

        return section.hasPath(ConfigConstants.PROMPT) ? section.getString(ConfigConstants.PROMPT) : DEFAULT_PROMPT;
    }

    /** Settings of the interactive shell. */
    public Config cli() {
        return section(ConfigConstants.CLI);
    }

    private Config section(String path) {
        try {
            return config.hasPath(path) ? config.getConfig(path) : ConfigFactory.empty();
        } catch (com.typesafe.config.ConfigException e) {
            throw new ConfigException("Invalid configuration section " + path + " in " + file + ": " + e.getMessage(), e);
        }
    }
}
