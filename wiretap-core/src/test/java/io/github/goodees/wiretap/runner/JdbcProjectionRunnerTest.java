package io.github.goodees.wiretap.runner;

/*-
 * #%L
 * wiretap
 * %%
 * Copyright (C) 2026 The Wiretap Authors
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.wiretap.core.StoredEvent;
import io.github.goodees.wiretap.core.StreamId;
import io.github.goodees.wiretap.core.store.EventLog;
import io.github.goodees.wiretap.core.store.EventStore;
import io.github.goodees.wiretap.core.store.EventStoreException;
import io.github.goodees.wiretap.core.store.StreamSelector;
import io.github.goodees.wiretap.immutables.events.DepositedEvent;
import io.github.goodees.wiretap.immutables.events.LedgerEvent;
import io.github.goodees.wiretap.projection.Balances;
import io.github.goodees.wiretap.projection.inmemory.InMemoryProjection;
import io.github.goodees.wiretap.store.jdbc.JdbcEventStore;
import io.github.goodees.wiretap.store.jdbc.JdbcTest;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class JdbcProjectionRunnerTest extends JdbcTest {
    private static final Logger logger = LoggerFactory.getLogger(JdbcProjectionRunnerTest.class);
    @Rule
    public ErrorCollector collector = new ErrorCollector();

    private StreamId account(String owner) {
        return StreamId.of("account", name() + "-" + owner);
    }

    private ProjectionRunner<LedgerEvent> runner(InMemoryProjection<Balances, LedgerEvent> projection,
            StreamId... streams) {
        return new ProjectionRunner<>(projection, eventLog, new ProjectionConfiguration.Builder()
                .selector(StreamSelector.streams(streams)).build());
    }

    @Test
    public void event_committed_after_a_later_append_is_not_skipped() throws Exception {
        /*
            ALICE                       BOB                         RUNNER

            take position, insert
            < release "alice commits" >
            < wait for "alice may commit" >
                                        wait for position row
                                                                    batch reads nothing
            < release "alice may commit" >
            commit
                                        take position, commit
                                                                    batch reads alice, then bob
         */
        CountDownLatch aliceCommits = new CountDownLatch(1);
        CountDownLatch aliceMayCommit = new CountDownLatch(1);
        JdbcEventStore<LedgerEvent> slowStore = new JdbcEventStore<>(ds, schema, serialization,
                new JdbcEventStore.TxHandler() {
                    @Override
                    public Connection enroll(Connection connection) throws SQLException {
                        return JdbcEventStore.LOCAL_TRANSACTIONS.enroll(connection);
                    }

                    @Override
                    public void commit(Connection connection) throws SQLException {
                        aliceCommits.countDown();
                        try {
                            aliceMayCommit.await();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw new SQLException("Interrupted before commit", e);
                        }
                        JdbcEventStore.LOCAL_TRANSACTIONS.commit(connection);
                    }

                    @Override
                    public void rollback(Connection connection) throws SQLException {
                        JdbcEventStore.LOCAL_TRANSACTIONS.rollback(connection);
                    }
                });
        StreamId alice = account("alice");
        StreamId bob = account("bob");
        InMemoryProjection<Balances, LedgerEvent> projection = new InMemoryProjection<>(name(), Balances::empty,
                Balances::apply);
        ProjectionRunner<LedgerEvent> runner = runner(projection, alice, bob);

        Thread aliceThread = new Thread(() -> {
            try {
                slowStore.append(alice, EventStore.NO_STREAM, deposit("alice", 100));
            } catch (EventStoreException e) {
                collector.addError(e);
            } finally {
                aliceCommits.countDown();
            }
        }, "alice");
        aliceThread.start();
        assertTrue(aliceCommits.await(10, TimeUnit.SECONDS));

        Thread bobThread = new Thread(() -> {
            try {
                eventStore.append(bob, EventStore.NO_STREAM, deposit("bob", 7));
            } catch (EventStoreException e) {
                collector.addError(e);
            }
        }, "bob");
        bobThread.start();
        awaitBlocked(bobThread);

        assertEquals(0, runner.processBatch());

        aliceMayCommit.countDown();
        aliceThread.join();
        bobThread.join();

        assertEquals(2, runner.processBatch());
        assertEquals(100, projection.getState().balance("alice"));
        assertEquals(7, projection.getState().balance("bob"));
        List<StoredEvent<LedgerEvent>> events;
        try (EventLog.StoredEvents<LedgerEvent> stored = eventLog.readStreams(Arrays.asList(alice, bob))) {
            events = stored.toList();
        }
        // alice committed first, and her position directly precedes bob's
        assertEquals(alice, events.get(0).getStreamId());
        assertEquals(bob, events.get(1).getStreamId());
        assertEquals(events.get(0).getPosition() + 1, events.get(1).getPosition());
    }

    @Test
    public void runner_catches_up_with_appends_across_streams() throws Exception {
        StreamId alice = account("alice");
        StreamId bob = account("bob");
        InMemoryProjection<Balances, LedgerEvent> projection = new InMemoryProjection<>(name(), Balances::empty,
                Balances::apply);
        ProjectionRunner<LedgerEvent> runner = runner(projection, alice, bob);
        for (int i = 1; i <= 5; i++) {
            eventStore.append(alice, EventStore.ANY_VERSION, deposit("alice", i));
            eventStore.append(bob, EventStore.ANY_VERSION, deposit("bob", 10 * i));
        }
        assertEquals(10, runner.processBatch());
        assertEquals(0, runner.processBatch());
        assertEquals(15, projection.getState().balance("alice"));
        assertEquals(150, projection.getState().balance("bob"));
        assertEquals(eventLog.headPosition(), runner.health().getCheckpoint().get().getPosition());
    }

    private static List<LedgerEvent> deposit(String account, int amount) {
        return Collections.singletonList(DepositedEvent.of(account, amount));
    }

    private void awaitBlocked(Thread thread) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            Thread.State state = thread.getState();
            if (state == Thread.State.WAITING || state == Thread.State.TIMED_WAITING
                    || state == Thread.State.BLOCKED) {
                return;
            }
            Thread.sleep(10);
        }
        logger.warn("{} did not block on the position row", thread.getName());
    }
}
