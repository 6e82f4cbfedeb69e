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

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalTime;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.nimbus.internal.cli.completion.CompletionIndex;
import org.nimbus.internal.cli.completion.CompletionRefresher;
import org.nimbus.internal.cli.completion.RefreshAck;
import org.nimbus.internal.cli.sql.QueryResult;
import org.nimbus.internal.cli.sql.SqlExecutor;
import org.nimbus.internal.logger.Loggers;
import org.nimbus.internal.logger.NimbusLogger;
import org.nimbus.internal.util.Cursor;
import org.nimbus.lang.NimbusException;

/**
 * Interactive shell: reads a line, executes it and prints the results until the user leaves.
 */
public class Repl {
    private static final NimbusLogger LOG = Loggers.forClass(Repl.class);

    /** Words that end the session. */
    private static final Set<String> EXIT_COMMANDS = Set.of("exit", "quit", "\\q");

    /** First words of statements after which the completion index is stale. */
    private static final Set<String> REFRESH_TRIGGERS = Set.of("use", "\\u", "create", "drop", "alter");

    private final SqlExecutor executor;

    private final CompletionRefresher refresher;

    private final AtomicReference<CompletionIndex> index;

    private final String promptTemplate;

    private final PrintWriter out;

    private final ResultPrinter printer;

    /**
     * Constructor.
     *
     * @param executor Statement executor.
     * @param refresher Completion refresher.
     * @param index Index the completer reads, replaced after every refresh.
     * @param promptTemplate Prompt template, see {@link PromptFormatter}.
     * @param out Output.
     */
    public Repl(
            SqlExecutor executor,
            CompletionRefresher refresher,
            AtomicReference<CompletionIndex> index,
            String promptTemplate,
            PrintWriter out
    ) {
        this.executor = executor;
        this.refresher = refresher;
        this.index = index;
        this.promptTemplate = promptTemplate;
        this.out = out;
        this.printer = new ResultPrinter(out, TableFormat.ASCII);
    }

    /**
     * Runs the read-eval-print loop.
     *
     * @param terminal Terminal.
     * @param historyFile History file.
     * @param refreshOnStart Whether to build the completion index before the first prompt.
     * @return Exit code.
     */
    public int run(Terminal terminal, Path historyFile, boolean refreshOnStart) {
        try {
            Files.createDirectories(historyFile.getParent());
        } catch (IOException e) {
            LOG.warn("Could not create history folder [file={}]", e, historyFile);
        }

        DefaultParser parser = new DefaultParser();
        parser.setEscapeChars(null);
        parser.setEofOnUnclosedQuote(true);

        LineReader reader = LineReaderBuilder.builder()
                .terminal(terminal)
                .completer(new IndexCompleter(index))
                .parser(parser)
                .variable(LineReader.HISTORY_FILE, historyFile)
                .history(new DefaultHistory())
                .option(LineReader.Option.CASE_INSENSITIVE, true)
                .option(LineReader.Option.AUTO_FRESH_LINE, true)
                .build();

        if (refreshOnStart) {
            refreshCompletions();
        }

        boolean running = true;

        while (running) {
            try {
                String line = reader.readLine(PromptFormatter.format(promptTemplate, executor.backend(), LocalTime.now()));

                running = handle(line);
            } catch (UserInterruptException e) {
                out.println("^C");
            } catch (EndOfFileException e) {
                running = false;
            }
        }

        out.println("Goodbye!");
        out.flush();

        return 0;
    }

    /**
     * Handles one line of input.
     *
     * @param line Input.
     * @return {@code false} if the user asked to leave.
     */
    boolean handle(String line) {
        String text = line.strip();

        if (EXIT_COMMANDS.contains(stripSemicolon(text).toLowerCase(Locale.ROOT))) {
            return false;
        }

        if (text.isEmpty()) {
            return true;
        }

        boolean succeeded = execute(text);

        if (succeeded && needsRefresh(text)) {
            RefreshAck ack = refreshCompletions();

            printer.print(ack.asResult(), false);
        }

        return true;
    }

    /**
     * Requests a rebuild of the completion index; the new index is published when complete.
     *
     * @return Acknowledgement.
     */
    RefreshAck refreshCompletions() {
        return refresher.refresh(executor.backend(), List.of(index::set));
    }

    private boolean execute(String text) {
        try (Cursor<QueryResult> results = executor.run(text)) {
            while (results.hasNext()) {
                QueryResult res = results.next();

                printer.print(res, executor.display().expandedOutput());

                executor.display().resetExpandedOutput();
            }

            return true;
        } catch (NimbusException e) {
            LOG.warn("Statement failed [sql={}]", e, text);

            printError(e.rawMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected error [sql={}]", e, text);

            printError(e.getMessage());
        } finally {
            executor.display().resetExpandedOutput();
        }

        return false;
    }

    private void printError(String msg) {
        out.println("error: " + msg);
        out.flush();
    }

    /**
     * Checks whether any statement of the input changes the set of names known to the completer.
     *
     * @param text Input.
     * @return {@code true} if a refresh is due.
     */
    static boolean needsRefresh(String text) {
        for (String stmt : text.split(";")) {
            String trimmed = stmt.strip();

            if (trimmed.isEmpty()) {
                continue;
            }

            String first = trimmed.split("\\s+", 2)[0].toLowerCase(Locale.ROOT);

            if (REFRESH_TRIGGERS.contains(first)) {
                return true;
            }
        }

        return false;
    }

    private static String stripSemicolon(String text) {
        return text.endsWith(";") ? text.substring(0, text.length() - 1).strip() : text;
    }
}
