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

package org.nimbus.internal.cli;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import org.nimbus.internal.cli.commands.TopLevelCommand;
import org.nimbus.internal.cli.config.StateFolderProvider;
import org.nimbus.internal.logger.Loggers;
import org.nimbus.internal.logger.NimbusLogger;
import org.nimbus.lang.NimbusException;
import picocli.CommandLine;

/**
 * Nimbus CLI entry point.
 */
public class Main {
    private static final NimbusLogger LOG = Loggers.forClass(Main.class);

    /**
     * Entry point.
     *
     * @param args Command line arguments.
     */
    public static void main(String[] args) {
        initJavaLoggerProps();

        System.exit(commandLine().execute(args));
    }

    /** Creates the command line with the error handling shared by all commands. */
    static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new TopLevelCommand());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            LOG.error("Command failed", ex);

            String msg = ex instanceof NimbusException ? ((NimbusException) ex).rawMessage() : ex.getMessage();

            commandLine.getErr().println("error: " + msg);
            commandLine.getErr().flush();

            return 1;
        });
        cmd.setTrimQuotes(true);
        cmd.setCaseInsensitiveEnumValuesAllowed(true);

        return cmd;
    }

    /**
     * Sends logs to a file in the logs folder; the console only receives SEVERE records.
     */
    private static void initJavaLoggerProps() {
        try (InputStream propsFile = Main.class.getResourceAsStream("/cli.java.util.logging.properties")) {
            if (propsFile != null) {
                LogManager.getLogManager().updateConfiguration(propsFile, configurationKey -> {
                    // Merge default configuration with configuration read from propsFile
                    // and append the path to logs to the file pattern if propsFile have the corresponding key
                    if (configurationKey.equals("java.util.logging.FileHandler.pattern")) {
                        return (oldConfigValue, newConfigValue) -> {
                            if (newConfigValue == null) {
                                return oldConfigValue;
                            }
                            try {
                                return getLogsDir() + "/" + newConfigValue;
                            } catch (IOException e) {
                                return newConfigValue;
                            }
                        };
                    }
                    return (o, n) -> n == null ? o : n;
                });
            }
        } catch (IOException ignored) {
            // No-op
        }
    }

    private static String getLogsDir() throws IOException {
        File logsDirFile = StateFolderProvider.getLogsDir();
        String logsDir = logsDirFile.getAbsolutePath();
        if (!logsDirFile.exists()) {
            if (!logsDirFile.mkdirs()) {
                throw new IOException("Failed to create directory " + logsDir);
            }
        }

        if (logsDirFile.isDirectory()) {
            return logsDir;
        } else {
            throw new IOException(logsDir + " is not a directory");
        }
    }
}
