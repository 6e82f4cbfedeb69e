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

package org.nimbus.internal.cli.special;

import org.jetbrains.annotations.Nullable;

/**
 * Display flags shared by the statement pipeline, the special commands and the result printer.
 *
 * <p>Expanded output requested by a {@code \G} terminator lasts until {@link #resetExpandedOutput()}; the toggle
 * command changes the default it is reset to.
 */
public class DisplayState {
    private volatile boolean expandedOutput;

    private volatile boolean expandedByDefault;

    private volatile @Nullable String outputLocation;

    public boolean expandedOutput() {
        return expandedOutput;
    }

    public void expandedOutput(boolean expanded) {
        this.expandedOutput = expanded;
    }

    /**
     * Flips the default expanded mode and applies it.
     *
     * @return New mode.
     */
    public boolean toggleExpandedOutput() {
        expandedByDefault = !expandedByDefault;
        expandedOutput = expandedByDefault;

        return expandedByDefault;
    }

    /** Restores the default expanded mode after a result was printed. */
    public void resetExpandedOutput() {
        expandedOutput = expandedByDefault;
    }

    /** Location the engine stored the last result at, if it reported one. */
    public @Nullable String outputLocation() {
        return outputLocation;
    }

    public void outputLocation(@Nullable String outputLocation) {
        this.outputLocation = outputLocation;
    }
}
