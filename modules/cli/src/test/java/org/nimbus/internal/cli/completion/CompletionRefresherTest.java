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

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;
import org.nimbus.internal.backend.Backend;
import org.nimbus.internal.testframework.BaseNimbusAbstractTest;

/**
 * Tests for {@link CompletionRefresher}.
 */
public class CompletionRefresherTest extends BaseNimbusAbstractTest {
    private final Backend backend = mock(Backend.class);

    @Test
    public void secondRequestRestartsRunningWorker() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();

        RefreshTask blocking = RefreshTask.of("blocking", (index, backend) -> {
            runs.incrementAndGet();
            entered.countDown();
            awaitLatch(release);
        });

        CompletionRefresher refresher = new CompletionRefresher(List.of(blocking));

        List<CompletionIndex> received = new CopyOnWriteArrayList<>();
        List<CompletionIndex> ignored = new CopyOnWriteArrayList<>();

        assertThat(refresher.refresh(backend, List.of(received::add)), is(RefreshAck.STARTED));

        assertTrue(entered.await(10, SECONDS));
        assertTrue(refresher.isRefreshing());

        assertThat(refresher.refresh(backend, List.of(ignored::add)), is(RefreshAck.RESTARTED));

        release.countDown();

        await().atMost(10, SECONDS).until(() -> !refresher.isRefreshing() && received.size() == 1);

        assertThat(runs.get(), equalTo(2));
        assertThat(ignored.size(), equalTo(0));
    }

    @Test
    public void restartAfterLastTaskRunsOneMorePassAndKeepsNames() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger firstRuns = new AtomicInteger();
        AtomicInteger lastRuns = new AtomicInteger();

        RefreshTask first = RefreshTask.of("first", (index, backend) ->
                index.extendDatabaseNames(List.of("db" + firstRuns.incrementAndGet())));

        RefreshTask last = RefreshTask.of("last", (index, backend) -> {
            if (lastRuns.incrementAndGet() == 1) {
                entered.countDown();
                awaitLatch(release);
            }
        });

        CompletionRefresher refresher = new CompletionRefresher(List.of(first, last));

        AtomicReference<CompletionIndex> published = new AtomicReference<>();

        refresher.refresh(backend, List.of(published::set));

        assertTrue(entered.await(10, SECONDS));
        assertThat(refresher.refresh(backend, List.of()), is(RefreshAck.RESTARTED));

        release.countDown();

        await().atMost(10, SECONDS).until(() -> published.get() != null);

        assertThat(firstRuns.get(), equalTo(2));
        assertThat(lastRuns.get(), equalTo(2));
        assertThat(published.get().databases(), contains("db1", "db2"));
    }

    @Test
    public void failingTaskDoesNotStopPass() {
        RefreshTask failing = RefreshTask.of("failing", (index, backend) -> {
            throw new IllegalStateException("boom");
        });

        RefreshTask working = RefreshTask.of("working", (index, backend) ->
                index.extendDatabaseNames(List.of("sales")));

        CompletionRefresher refresher = new CompletionRefresher(List.of(failing, working));

        AtomicReference<CompletionIndex> published = new AtomicReference<>();

        assertThat(refresher.refresh(backend, List.of(published::set)), is(RefreshAck.STARTED));

        await().atMost(10, SECONDS).until(() -> published.get() != null);

        assertThat(published.get().databases(), contains("sales"));
    }

    @Test
    public void everyCallbackIsInvokedOnceEvenIfOneFails() {
        CompletionRefresher refresher = new CompletionRefresher(List.of(RefreshTasks.specialCommands(List.of("\\x"))));

        AtomicInteger calls = new AtomicInteger();

        Consumer<CompletionIndex> failing = index -> {
            calls.incrementAndGet();

            throw new IllegalStateException("callback failure");
        };

        Consumer<CompletionIndex> counting = index -> calls.incrementAndGet();

        refresher.refresh(backend, List.of(failing, counting));

        await().atMost(10, SECONDS).until(() -> calls.get() == 2);

        assertThat(calls.get(), equalTo(2));
    }

    @Test
    public void callbackCanStartNewRefresh() {
        CompletionRefresher refresher = new CompletionRefresher(List.of(RefreshTasks.specialCommands(List.of("\\x"))));

        List<RefreshAck> acks = new CopyOnWriteArrayList<>();
        AtomicInteger completed = new AtomicInteger();

        Consumer<CompletionIndex> chaining = index -> {
            if (completed.incrementAndGet() == 1) {
                acks.add(refresher.refresh(backend, List.of(i -> completed.incrementAndGet())));
            }
        };

        refresher.refresh(backend, List.of(chaining));

        await().atMost(10, SECONDS).until(() -> completed.get() == 2);

        assertThat(acks, contains(RefreshAck.STARTED));
        await().atMost(10, SECONDS).until(() -> !refresher.isRefreshing());
    }

    @Test
    public void idleRefresherIsNotRefreshing() {
        CompletionRefresher refresher = new CompletionRefresher(List.of());

        assertFalse(refresher.isRefreshing());

        AtomicReference<CompletionIndex> published = new AtomicReference<>();

        refresher.refresh(backend, List.of(published::set));

        await().atMost(10, SECONDS).until(() -> published.get() != null);

        assertFalse(refresher.isRefreshing());
        assertThat(published.get().allCompletions(), hasItems("SELECT", "FROM"));
    }

    private static void awaitLatch(CountDownLatch latch) {
        try {
            assertTrue(latch.await(10, SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();

            throw new IllegalStateException(e);
        }
    }
}
