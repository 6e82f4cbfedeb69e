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

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Static factory methods for {@link NimbusLogger}.
 */
public final class Loggers {
    private static final NimbusLogger VOID = new NimbusLogger() {
        @Override
        public void info(String msg, Object... params) {
            // No-op.
        }

        @Override
        public void info(String msg, @Nullable Throwable th, Object... params) {
            // No-op.
        }

        @Override
        public void debug(String msg, Object... params) {
            // No-op.
        }

        @Override
        public void debug(String msg, @Nullable Throwable th, Object... params) {
            // No-op.
        }

        @Override
        public void warn(String msg, Object... params) {
            // No-op.
        }

        @Override
        public void warn(String msg, @Nullable Throwable th, Object... params) {
            // No-op.
        }

        @Override
        public void error(String msg, Object... params) {
            // No-op.
        }

        @Override
        public void error(String msg, @Nullable Throwable th, Object... params) {
            // No-op.
        }

        @Override
        public void trace(String msg, Object... params) {
            // No-op.
        }

        @Override
        public boolean isDebugEnabled() {
            return false;
        }

        @Override
        public boolean isTraceEnabled() {
            return false;
        }
    };

    private Loggers() {
    }

    /**
     * Creates a logger named after the given class, backed by the system logger.
     *
     * @param cls The class for a logger.
     * @return Logger.
     */
    public static NimbusLogger forClass(Class<?> cls) {
        return forName(Objects.requireNonNull(cls, "cls").getName());
    }

    /**
     * Creates a logger with the given name, backed by the system logger.
     *
     * @param name Logger name.
     * @return Logger.
     */
    public static NimbusLogger forName(String name) {
        return new NimbusLoggerImpl(System.getLogger(name));
    }

    /**
     * Returns a logger which outputs nothing.
     *
     * @return Void logger.
     */
    public static NimbusLogger voidLogger() {
        return VOID;
    }
}
