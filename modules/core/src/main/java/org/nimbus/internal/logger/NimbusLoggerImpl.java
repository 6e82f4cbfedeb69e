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

package org.nimbus.internal.logger;

import java.lang.System.Logger.Level;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;
import org.nimbus.internal.lang.NimbusStringFormatter;

/**
 * {@link NimbusLogger} on top of a {@link System.Logger}.
 */
class NimbusLoggerImpl implements NimbusLogger {
    /** Backend logger. */
    private final System.Logger delegate;

    NimbusLoggerImpl(System.Logger delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void info(String msg, Object... params) {
        log(Level.INFO, msg, null, params);
    }

    @Override
    public void info(String msg, @Nullable Throwable th, Object... params) {
        log(Level.INFO, msg, th, params);
    }

    @Override
    public void debug(String msg, Object... params) {
        log(Level.DEBUG, msg, null, params);
    }

    @Override
    public void debug(String msg, @Nullable Throwable th, Object... params) {
        log(Level.DEBUG, msg, th, params);
    }

    @Override
    public void warn(String msg, Object... params) {
        log(Level.WARNING, msg, null, params);
    }

    @Override
    public void warn(String msg, @Nullable Throwable th, Object... params) {
        log(Level.WARNING, msg, th, params);
    }

    @Override
    public void error(String msg, Object... params) {
        log(Level.ERROR, msg, null, params);
    }

    @Override
    public void error(String msg, @Nullable Throwable th, Object... params) {
        log(Level.ERROR, msg, th, params);
    }

    @Override
    public void trace(String msg, Object... params) {
        log(Level.TRACE, msg, null, params);
    }

    @Override
    public boolean isDebugEnabled() {
        return delegate.isLoggable(Level.DEBUG);
    }

    @Override
    public boolean isTraceEnabled() {
        return delegate.isLoggable(Level.TRACE);
    }

    /**
     * Formats the message only when the level is enabled, so callers may pass arbitrary parameters cheaply.
     */
    private void log(Level level, String msg, @Nullable Throwable th, Object... params) {
        if (!delegate.isLoggable(level)) {
            return;
        }

        String formatted = NimbusStringFormatter.format(msg, params);

        if (th != null) {
            delegate.log(level, formatted, th);
        } else {
            delegate.log(level, formatted);
        }
    }
}
