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

/**
 * Closeable, single-pass iterator over a result that may hold resources (a driver cursor, a lock).
 *
 * @param <T> Type of elements.
 */
public interface Cursor<T> extends Iterator<T>, Iterable<T>, AutoCloseable {
    @Override
    default Iterator<T> iterator() {
        return this;
    }

    /**
     * Creates a cursor over an iterator that holds no resources.
     *
     * @param it Iterator.
     * @param <T> Type of elements.
     * @return Cursor.
     */
    static <T> Cursor<T> fromBareIterator(Iterator<? extends T> it) {
        return fromIterator(it, () -> {});
    }

    /**
     * Creates a cursor over an iterable that holds no resources.
     *
     * @param iterable Iterable.
     * @param <T> Type of elements.
     * @return Cursor.
     */
    static <T> Cursor<T> fromIterable(Iterable<? extends T> iterable) {
        return fromBareIterator(iterable.iterator());
    }

    /**
     * Creates a cursor over an iterator; {@code onClose} is run once when the cursor is closed.
     *
     * @param it Iterator.
     * @param onClose Action releasing the resources behind the iterator.
     * @param <T> Type of elements.
     * @return Cursor.
     */
    static <T> Cursor<T> fromIterator(Iterator<? extends T> it, Runnable onClose) {
        return new IteratorCursor<>(it, onClose);
    }

    /**
     * Closes the cursor releasing all underlying resources. Must be idempotent.
     */
    @Override
    void close();
}
