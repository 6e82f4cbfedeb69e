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

package org.nimbus.internal.thread;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.nimbus.internal.logger.NimbusLogger;

/**
 * Thread factory producing threads named {@code <prefix><counter>}.
 */
public class NamedThreadFactory implements ThreadFactory {
    /** Thread name prefix. */
    private final String prefix;

    /** Thread counter. */
    private final AtomicInteger counter = new AtomicInteger(0);

    /** Daemon flag. */
    private final boolean daemon;

    /** Exception handler. */
    private final Thread.UncaughtExceptionHandler exHnd;

    /**
     * Constructor.
     *
     * @param prefix Thread name prefix.
     * @param daemon Daemon flag.
     * @param log Logger used for uncaught exceptions.
     */
    public NamedThreadFactory(String prefix, boolean daemon, NimbusLogger log) {
        this(prefix, daemon, new LogUncaughtExceptionHandler(log));
    }

    /**
     * Constructor.
     *
     * @param prefix Thread name prefix.
     * @param daemon Daemon flag.
     * @param exHnd Uncaught exception handler.
     */
    public NamedThreadFactory(String prefix, boolean daemon, Thread.UncaughtExceptionHandler exHnd) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.daemon = daemon;
        this.exHnd = Objects.requireNonNull(exHnd, "exHnd");
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r, prefix + counter.getAndIncrement());

        t.setDaemon(daemon);
        t.setUncaughtExceptionHandler(exHnd);

        return t;
    }
}
