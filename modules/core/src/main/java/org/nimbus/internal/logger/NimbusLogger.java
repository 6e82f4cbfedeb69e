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

import org.jetbrains.annotations.Nullable;

/**
 * Logger facade used across the project. Messages are patterns in {@code NimbusStringFormatter} format, i.e. every
 * {@code {}} anchor is replaced by the next parameter.
 */
public interface NimbusLogger {
    /**
     * Logs a message on {@code INFO} level.
     *
     * @param msg Message pattern.
     * @param params Arguments substituted in place of the formatting anchors.
     */
    void info(String msg, Object... params);

    /**
     * Logs a message on {@code INFO} level with an associated throwable.
     *
     * @param msg Message pattern.
     * @param th Throwable associated with the message; can be {@code null}.
     * @param params Arguments substituted in place of the formatting anchors.
     */
    void info(String msg, @Nullable Throwable th, Object... params);

    /**
     * Logs a message on {@code DEBUG} level.
     *
     * @param msg Message pattern.
     * @param params Arguments substituted in place of the formatting anchors.
     */
    void debug(String msg, Object... params);

    /**
     * Logs a message on {@code DEBUG} level with an associated throwable.
     *
     * @param msg Message pattern.
     * @param th Throwable associated with the message; can be {@code null}.
     * @param params Arguments substituted in place of the formatting anchors.
     */
    void debug(String msg, @Nullable Throwable th, Object... params);

    /**
     * Logs a message on {@code WARNING} level.
     *
     * @param msg Message pattern.
     * @param params Arguments substituted in place of the formatting anchors.
     */
    void warn(String msg, Object... params);

    /**
     * Logs a message on {@code WARNING} level with an associated throwable.
     *
     * @param msg Message pattern.
     * @param th Throwable associated with the message; can be {@code null}.
     * @param params Arguments substituted in place of the formatting anchors.
     */
    void warn(String msg, @Nullable Throwable th, Object... params);

    /**
     * Logs a message on {@code ERROR} level.
     *
     * @param msg Message pattern.
     * @param params Arguments substituted in place of the formatting anchors.
     */
    void error(String msg, Object... params);

    /**
     * Logs a message on {@code ERROR} level with an associated throwable.
     *
     * @param msg Message pattern.
     * @param th Throwable associated with the message; can be {@code null}.
     * @param params Arguments substituted in place of the formatting anchors.
     */
    void error(String msg, @Nullable Throwable th, Object... params);

    /**
     * Logs a message on {@code TRACE} level.
     *
     * @param msg Message pattern.
     * @param params Arguments substituted in place of the formatting anchors.
     */
    void trace(String msg, Object... params);

    /** Whether {@code DEBUG} messages reach the backend. */
    boolean isDebugEnabled();

    /** Whether {@code TRACE} messages reach the backend. */
    boolean isTraceEnabled();
}
