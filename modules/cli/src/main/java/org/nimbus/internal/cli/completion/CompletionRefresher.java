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

package org.nimbus.internal.cli.completion;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.function.Consumer;
import org.nimbus.internal.backend.Backend;
import org.nimbus.internal.logger.Loggers;
import org.nimbus.internal.logger.NimbusLogger;
import org.nimbus.internal.thread.NamedThreadFactory;

/**
 * Rebuilds the completion index in the background.
 *
 * <p>At most one worker runs at a time. A refresh requested while a worker is running makes that worker start over
 * from the first task once its current task completes; the names collected so far are kept. When a pass completes
 * without such a request, every callback receives the finished index exactly once.
 */
public class CompletionRefresher {
    private static final NimbusLogger LOG = Loggers.forClass(CompletionRefresher.class);

    private final List<RefreshTask> tasks;

    private final ThreadFactory threadFactory;

    private final Object mux = new Object();

    /** Guarded by {@link #mux}. */
    private boolean refreshing;

    /** Guarded by {@link #mux}. */
    private boolean restartRequested;

    /**
     * Constructor.
     *
     * @param tasks Tasks in execution order.
     */
    public CompletionRefresher(List<RefreshTask> tasks) {
        this(tasks, new NamedThreadFactory("completion-refresh-", true, LOG));
    }

    /**
     * Constructor.
     *
     * @param tasks Tasks in execution order.
     * @param threadFactory Factory of worker threads.
     */
    public CompletionRefresher(List<RefreshTask> tasks, ThreadFactory threadFactory) {
        this.tasks = List.copyOf(tasks);
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
    }

    /**
     * Requests a refresh.
     *
     * @param backend Backend to query.
     * @param callbacks Consumers of the finished index.
     * @return {@link RefreshAck#STARTED} if a worker was started, {@link RefreshAck#RESTARTED} if the running one will
     *      start over. In the latter case the given callbacks are ignored in favour of the running worker's.
     */
    public RefreshAck refresh(Backend backend, List<Consumer<CompletionIndex>> callbacks) {
        List<Consumer<CompletionIndex>> cbs = List.copyOf(callbacks);

        synchronized (mux) {
            if (refreshing) {
                restartRequested = true;

                LOG.debug("Completion refresh restart requested");

                return RefreshAck.RESTARTED;
            }

            refreshing = true;
            restartRequested = false;
        }

        try {
            threadFactory.newThread(() -> run(backend, cbs)).start();
        } catch (RuntimeException | Error e) {
            synchronized (mux) {
                refreshing = false;
            }

            throw e;
        }

        return RefreshAck.STARTED;
    }

    /** Whether a worker is collecting names. */
    public boolean isRefreshing() {
        synchronized (mux) {
            return refreshing;
        }
    }

    private void run(Backend backend, List<Consumer<CompletionIndex>> callbacks) {
        CompletionIndex index = new CompletionIndex();

        long start = System.nanoTime();
        int passes = 0;

        boolean finished = false;

        try {
            while (!finished) {
                passes++;

                if (runPass(index, backend)) {
                    continue;
                }

                synchronized (mux) {
                    if (restartRequested) {
                        restartRequested = false;
                    } else {
                        // Cleared before the callbacks run so that a callback may request a new refresh.
                        refreshing = false;
                        finished = true;
                    }
                }
            }
        } finally {
            if (!finished) {
                synchronized (mux) {
                    refreshing = false;
                }
            }
        }

        LOG.debug("Completion refresh finished [passes={}, took={}ms]", passes, (System.nanoTime() - start) / 1_000_000);

        for (Consumer<CompletionIndex> callback : callbacks) {
            try {
                callback.accept(index);
            } catch (RuntimeException e) {
                LOG.error("Completion refresh callback failed", e);
            }
        }
    }

    /**
     * Runs every task once.
     *
     * @return {@code true} if a restart was requested.
     */
    private boolean runPass(CompletionIndex index, Backend backend) {
        for (RefreshTask task : tasks) {
            try {
                task.refresh(index, backend);
            } catch (RuntimeException e) {
                LOG.warn("Completion refresh task failed [task={}]", e, task.name());
            }

            synchronized (mux) {
                if (restartRequested) {
                    restartRequested = false;

                    LOG.debug("Completion refresh restarted [afterTask={}]", task.name());

                    return true;
                }
            }
        }

        return false;
    }
}
