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

import java.util.Objects;
import java.util.function.BiConsumer;
import org.nimbus.internal.backend.Backend;

/**
 * Step of a completion refresh contributing names to the index.
 */
public interface RefreshTask {
    /** Task name, used in logs. */
    String name();

    /**
     * Queries the backend and records the result in the index.
     *
     * @param index Index being built.
     * @param backend Backend.
     */
    void refresh(CompletionIndex index, Backend backend);

    /**
     * Creates a task from a function.
     *
     * @param name Task name.
     * @param action Task body.
     * @return Task.
     */
    static RefreshTask of(String name, BiConsumer<CompletionIndex, Backend> action) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(action, "action");

        return new RefreshTask() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void refresh(CompletionIndex index, Backend backend) {
                action.accept(index, backend);
            }

            @Override
            public String toString() {
                return "RefreshTask [name=" + name + ']';
            }
        };
    }
}
