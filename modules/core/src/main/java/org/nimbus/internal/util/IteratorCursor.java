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

package org.nimbus.internal.util;

import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Adapter of an {@link Iterator} to {@link Cursor} with a close action run at most once.
 *
 * @param <T> Element type.
 */
class IteratorCursor<T> implements Cursor<T> {
    private final Iterator<? extends T> it;

    private final Runnable onClose;

    private final AtomicBoolean closed = new AtomicBoolean();

    IteratorCursor(Iterator<? extends T> it, Runnable onClose) {
        this.it = Objects.requireNonNull(it, "Iterator is null");
        this.onClose = Objects.requireNonNull(onClose, "onClose");
    }

    @Override
    public boolean hasNext() {
        return !closed.get() && it.hasNext();
    }

    @Override
    public T next() {
        return it.next();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            onClose.run();
        }
    }
}
