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

package org.nimbus.internal.cli.commands;

import com.typesafe.config.Config;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.nimbus.internal.backend.Backend;
import org.nimbus.internal.backend.BackendParameters;
import org.nimbus.internal.backend.BackendType;
import org.nimbus.internal.backend.Backends;
import org.nimbus.internal.backend.ConnectionException;
import org.nimbus.internal.cli.completion.CompletionIndex;
import org.nimbus.internal.cli.completion.CompletionRefresher;
import org.nimbus.internal.cli.completion.RefreshTasks;
import org.nimbus.internal.cli.config.CliConfig;
import org.nimbus.internal.cli.config.ConfigConstants;
import org.nimbus.internal.cli.config.ConfigException;
import org.nimbus.internal.cli.config.StateFolderProvider;
import org.nimbus.internal.cli.config.ValueResolver;
import org.nimbus.internal.cli.repl.Repl;
import org.nimbus.internal.cli.repl.ResultPrinter;
import org.nimbus.internal.cli.repl.TableFormat;
import org.nimbus.internal.cli.special.DisplayState;
import org.nimbus.internal.cli.special.SpecialCommandRegistry;
import org.nimbus.internal.cli.special.SpecialCommands;
import org.nimbus.internal.cli.sql.QueryResult;
import org.nimbus.internal.cli.sql.SqlExecutor;
import org.nimbus.internal.cli.sql.SqlStatementSplitter;
import org.nimbus.internal.logger.Loggers;
import org.nimbus.internal.logger.NimbusLogger;
import org.nimbus.internal.util.Cursor;
import org.nimbus.lang.NimbusException;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Connects to a backend and either runs the given SQL or starts the interactive shell.
 */
public abstract class AbstractBackendCommand implements Callable<Integer> {
    private static final NimbusLogger LOG = Loggers.forClass(AbstractBackendCommand.class);

    /** Value of {@code -e} that reads the statements from the standard input. */
    static final String STDIN = "-";

    @Spec
    private CommandSpec spec;

    @Option(names = "--help", usageHelp = true, description = "Show this help message and exit.")
    private boolean help;

    @Option(names = {"-e", "--execute"}, description = "Execute a statement, a file of statements or '-' for stdin, and quit.")
    private String execute;

    @Option(names = "--config", description = "Path to the configuration file in HOCON format.")
    private File configFile;

    @Option(names = "--table-format", description = "Table format used with -e: ascii or csv.")
    private String tableFormat;

    @Parameters(index = "0", arity = "0..1", paramLabel = "DATABASE", description = "Database to use.")
    private String database;

    private Function<String, String> env = System::getenv;

    private InputStream stdin = System.in;

    private Function<BackendParameters, Backend> backendFactory = params -> Backends.create(params.type().typeName(), params);

    /** Backend the command connects to. */
    protected abstract BackendType backendType();

    /**
     * Resolves the connection parameters from the options, the configuration and the environment.
     *
     * @param config Configuration.
     * @param env Environment lookup.
     * @return Parameters.
     */
    protected abstract BackendParameters connectionParameters(CliConfig config, Function<String, String> env);

    /** Database given as the positional argument. */
    protected @Nullable String database() {
        return database;
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        CliConfig config;
        BackendParameters params;

        try {
            config = CliConfig.load(configFile);
            params = connectionParameters(config, env);
        } catch (ConfigException e) {
            LOG.error("Failed to read configuration", e);

            err.println(e.rawMessage());

            return 1;
        }

        Backend backend;

        try {
            backend = backendFactory.apply(params);
        } catch (ConnectionException e) {
            LOG.error("Failed to connect [params={}]", e, params);

            err.println(e.rawMessage());
            err.println(connectionHelp(config));

            return 1;
        }

        try (backend) {
            DisplayState display = new DisplayState();
            SpecialCommandRegistry registry = SpecialCommands.defaults(backend, display);
            SqlExecutor executor = new SqlExecutor(backend, new SqlStatementSplitter(), registry, display);

            if (execute != null) {
                return runBatch(executor, readQuery(execute), tableFormat(config), out, err);
            }

            return runRepl(executor, registry, config);
        }
    }

    /**
     * Runs the statements and prints their results.
     *
     * @return Exit code: {@code 0} if every statement succeeded.
     */
    int runBatch(SqlExecutor executor, String query, TableFormat format, PrintWriter out, PrintWriter err) {
        ResultPrinter printer = new ResultPrinter(out, format);

        try (Cursor<QueryResult> results = executor.run(query)) {
            while (results.hasNext()) {
                printer.print(results.next(), executor.display().expandedOutput());

                executor.display().resetExpandedOutput();
            }

            return 0;
        } catch (NimbusException e) {
            LOG.warn("Statement failed", e);

            err.println(e.rawMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected error", e);

            err.println(e.getMessage());
        }

        err.flush();

        return 1;
    }

    private int runRepl(SqlExecutor executor, SpecialCommandRegistry registry, CliConfig config) throws IOException {
        ValueResolver cli = new ValueResolver(config.cli(), env);

        Path historyFile = StateFolderProvider.getStateFolder()
                .resolve(cli.stringOrDefault(null, ConfigConstants.HISTORY_FILE, "history"));

        AtomicReference<CompletionIndex> index = new AtomicReference<>(new CompletionIndex());
        CompletionRefresher refresher = new CompletionRefresher(RefreshTasks.defaults(registry.commandNames()));

        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            Repl repl = new Repl(executor, refresher, index, config.prompt(backendType()), terminal.writer());

            return repl.run(terminal, historyFile, cli.bool(null, ConfigConstants.REFRESH_ON_START, true));
        }
    }

    /**
     * Reads the text of {@code -e}: standard input for {@code -}, the file contents if it names a file, the text itself
     * otherwise.
     */
    String readQuery(String execute) throws IOException {
        if (STDIN.equals(execute)) {
            String query = new String(stdin.readAllBytes(), StandardCharsets.UTF_8);

            if (query.isBlank()) {
                throw new IllegalArgumentException("No query to execute on stdin");
            }

            return query;
        }

        Path file;

        try {
            file = Path.of(execute);
        } catch (InvalidPathException e) {
            return execute;
        }

        return Files.isRegularFile(file) ? Files.readString(file) : execute;
    }

    private TableFormat tableFormat(CliConfig config) {
        Config cli = config.cli();

        String name = new ValueResolver(cli, env).stringOrDefault(tableFormat, ConfigConstants.TABLE_FORMAT, "ascii");

        return TableFormat.fromString(name);
    }

    private String connectionHelp(CliConfig config) {
        File logFile = new File(StateFolderProvider.getLogsDir(), "nimbus-cli.log");

        return "\nThere was an error while connecting to " + backendType().typeName() + ". It could be caused by"
                + " missing or incomplete configuration. Please verify the configuration in " + config.file()
                + " and run nimbus again.\n\nFor more details about the error, you can check the log file: " + logFile;
    }

    void env(Function<String, String> env) {
        this.env = env;
    }

    void stdin(InputStream stdin) {
        this.stdin = stdin;
    }

    void backendFactory(Function<BackendParameters, Backend> backendFactory) {
        this.backendFactory = backendFactory;
    }
}
