package io.github.goodees.wiretap.store.jdbc;

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

import io.github.goodees.wiretap.core.StreamId;
import io.github.goodees.wiretap.core.store.EventStore;
import io.github.goodees.wiretap.core.store.EventStoreException;
import io.github.goodees.wiretap.core.store.StreamWrite;
import io.github.goodees.wiretap.immutables.events.DepositedEvent;
import io.github.goodees.wiretap.immutables.events.LedgerEvent;
import io.github.goodees.wiretap.immutables.events.WithdrawnEvent;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class JdbcEventStoreTest extends JdbcTest {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStoreTest.class);
    @Rule
    public ErrorCollector collector = new ErrorCollector();

    @Test
    public void events_for_new_stream_are_persisted() throws EventStoreException {
        long version = eventStore.append(stream(), EventStore.NO_STREAM, deposits(100, 200));
        assertEquals(2, version);
        assertDb(2, "select count(*) from event where stream_id = ?", stream().toString());
        assertDb(2, "select version from stream_version where stream_id = ?", stream().toString());
        assertDb(2, "select count(*) from event where stream_id = ? and stream_kind = 'account'",
            stream().toString());
    }

    @Test
    public void events_for_existing_stream_are_persisted() throws EventStoreException {
        eventStore.append(stream(), EventStore.NO_STREAM, deposits(100, 200));
        eventStore.append(stream(), 2, deposits(300, 400));
        assertDb(4, "select count(*) from event where stream_id = ?", stream().toString());
        assertDb(4, "select version from stream_version where stream_id = ?", stream().toString());
        assertDb(1, "select count(*) from event where stream_id = ? and version = 4 and payload like '%400%'",
            stream().toString());
    }

    @Test
    @SuppressWarnings({ "unchecked", "rawtypes" })
    public void persisting_unsupported_events_fails() {
        EventStore untyped = eventStore;
        try {
            untyped.append(stream(), EventStore.NO_STREAM, Collections.singletonList("not an event"));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
        }
        assertDb(0, "select count(*) from event where stream_id = ?", stream().toString());
    }

    @Test
    public void persisting_stale_events_throws_early() {
        template.update("insert into stream_version (stream_id, version) values(?, 10)", stream().toString());
        try {
            eventStore.append(stream(), 9, deposits(100, 200));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
        }
        assertDb(0, "select count(*) from event where stream_id = ?", stream().toString());
        assertDb(10, "select version from stream_version where stream_id = ?", stream().toString());
    }

    @Test
    public void creating_existing_stream_fails() throws EventStoreException {
        eventStore.append(stream(), EventStore.NO_STREAM, deposits(100));
        try {
            eventStore.append(stream(), EventStore.NO_STREAM, deposits(200));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
        }
        assertDb(1, "select count(*) from event where stream_id = ?", stream().toString());
    }

    @Test
    public void multi_stream_append_is_atomic() throws EventStoreException {
        StreamId source = StreamId.of("account", name() + "-source");
        StreamId target = StreamId.of("account", name() + "-target");
        eventStore.append(target, EventStore.NO_STREAM, deposits(1));
        try {
            eventStore.append(Arrays.asList(
                StreamWrite.of(source, EventStore.NO_STREAM, Collections.singletonList(
                    WithdrawnEvent.builder().account("source").amount(50).build())),
                StreamWrite.of(target, EventStore.NO_STREAM, deposits(50))));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
        }
        assertDb(0, "select count(*) from event where stream_id = ?", source.toString());
        assertDb(0, "select count(*) from stream_version where stream_id = ?", source.toString());
        assertDb(1, "select version from stream_version where stream_id = ?", target.toString());

        Map<StreamId, Long> versions = eventStore.append(Arrays.asList(
            StreamWrite.of(source, EventStore.NO_STREAM, Collections.singletonList(
                WithdrawnEvent.builder().account("source").amount(50).note("transfer").build())),
            StreamWrite.of(target, 1, deposits(50))));
        assertEquals(Long.valueOf(1), versions.get(source));
        assertEquals(Long.valueOf(2), versions.get(target));
        // positions follow the order of writes
        assertDb(1, "select count(*) from event s, event t where s.stream_id = ? and t.stream_id = ? "
                + "and t.version = 2 and s.global_position < t.global_position", source.toString(),
            target.toString());
    }

    @Test
    public void metadata_is_stored_with_events() throws EventStoreException {
        eventStore.append(Collections.singletonList(new StreamWrite<>(stream(), EventStore.NO_STREAM, deposits(1),
                Collections.singletonMap("command", "Deposit"))));
        assertDb(1, "select count(*) from event where stream_id = ? and metadata like '%\"command\":\"Deposit\"%'",
            stream().toString());
    }

    @Test
    public void rolled_back_append_leaves_no_position_gap() throws EventStoreException {
        StreamId first = StreamId.of("account", name() + "-first");
        StreamId failing = StreamId.of("account", name() + "-failing");
        StreamId second = StreamId.of("account", name() + "-second");
        eventStore.append(first, EventStore.NO_STREAM, deposits(1));
        long head = eventLog.headPosition();
        JdbcSchema brokenInsert = new DefaultJdbcSchema("event", "stream_version") {
            @Override
            protected PreparedStatement insertEvent(Connection connection) throws SQLException {
                throw new SQLException("disk full");
            }
        };
        try {
            new JdbcEventStore<>(ds, brokenInsert, serialization).append(failing, EventStore.NO_STREAM,
                deposits(2, 3));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.TX_ERROR, e.getFault());
        }
        assertDb(0, "select count(*) from stream_version where stream_id = ?", failing.toString());

        eventStore.append(second, EventStore.NO_STREAM, deposits(4));
        assertEquals(head + 1, eventLog.headPosition());
    }

    @Test
    public void append_takes_part_in_transaction_of_caller() throws Exception {
        try (Connection shared = ds.getConnection()) {
            shared.setAutoCommit(false);
            Connection uncloseable = (Connection) Proxy.newProxyInstance(getClass().getClassLoader(),
                new Class<?>[] { Connection.class }, (p, m, a) -> "close".equals(m.getName()) ? null
                        : m.invoke(shared, a));
            DataSource callerDataSource = (DataSource) Proxy.newProxyInstance(getClass().getClassLoader(),
                new Class<?>[] { DataSource.class }, (p, m, a) -> "getConnection".equals(m.getName()) ? uncloseable
                        : m.invoke(ds, a));
            JdbcEventStore<LedgerEvent> store = new JdbcEventStore<>(callerDataSource, schema, serialization,
                    JdbcEventStore.CONTAINER_TRANSACTIONS);

            assertEquals(1, store.append(stream(), EventStore.NO_STREAM, deposits(100)));
            // not committed yet
            assertDb(0, "select count(*) from event where stream_id = ?", stream().toString());
            shared.rollback();
        }
        assertDb(0, "select count(*) from event where stream_id = ?", stream().toString());
        assertDb(0, "select count(*) from stream_version where stream_id = ?", stream().toString());
        assertEquals(1, eventStore.append(stream(), EventStore.NO_STREAM, deposits(200)));
    }

    @Test
    public void persisting_stale_events_fails_optimistic_lock() throws InterruptedException {
        /*
            THREAD 1                 THREAD 2

            checkSourceVersions
            < release "T1 has stream version" >
                                     < wait for "T1 has stream version" >
                                     checkSourceVersions
                                     < release "T2 has stream version" >
            < wait for "T2 has stream version" >
            updateVersion
            insert "10", commit
            < release "T1 has committed" >
                                     < wait for "T1 has committed" >
                                     updateVersion

            Thread 1 wins, thread 2 fails at the version update.
         */
        CountDownLatch thread1hasStreamVersion = new CountDownLatch(1);
        CountDownLatch thread2hasStreamVersion = new CountDownLatch(1);
        CountDownLatch thread1committed = new CountDownLatch(1);

        JdbcSchema race1 = new DefaultJdbcSchema("event", "stream_version") {
            @Override
            protected long readStreamVersion(ResultSet rs) throws SQLException {
                try {
                    return super.readStreamVersion(rs);
                } finally {
                    logger.info("Thread 1 has read stream version");
                    thread1hasStreamVersion.countDown();
                }
            }

            @Override
            protected PreparedStatement updateStreamVersion(Connection connection, StreamId streamId,
                    long startVersion, long endVersion) throws SQLException {
                PreparedStatement delegate = super.updateStreamVersion(connection, streamId, startVersion,
                    endVersion);
                return (PreparedStatement) Proxy.newProxyInstance(delegate.getClass().getClassLoader(),
                    new Class<?>[] { PreparedStatement.class }, (p, m, a) -> {
                        if ("executeUpdate".equals(m.getName())) {
                            logger.info("Waiting for thread 2 to read stream version");
                            thread2hasStreamVersion.await();
                        }
                        return m.invoke(delegate, a);
                    });
            }
        };

        JdbcSchema race2 = new DefaultJdbcSchema("event", "stream_version") {
            @Override
            protected long readStreamVersion(ResultSet rs) throws SQLException {
                try {
                    logger.info("Thread 2 waits for thread 1 to read stream version");
                    thread1hasStreamVersion.await();
                } catch (InterruptedException e) {
                    collector.addError(e);
                }
                try {
                    return super.readStreamVersion(rs);
                } finally {
                    thread2hasStreamVersion.countDown();
                }
            }

            @Override
            protected PreparedStatement updateStreamVersion(Connection connection, StreamId streamId,
                    long startVersion, long endVersion) throws SQLException {
                PreparedStatement delegate = super.updateStreamVersion(connection, streamId, startVersion,
                    endVersion);
                return (PreparedStatement) Proxy.newProxyInstance(delegate.getClass().getClassLoader(),
                    new Class<?>[] { PreparedStatement.class }, (p, m, a) -> {
                        if ("executeUpdate".equals(m.getName())) {
                            logger.info("Waiting for thread 1 to commit");
                            thread1committed.await();
                        }
                        return m.invoke(delegate, a);
                    });
            }
        };

        JdbcEventStore<LedgerEvent> store1 = new JdbcEventStore<>(ds, race1, serialization);
        JdbcEventStore<LedgerEvent> store2 = new JdbcEventStore<>(ds, race2, serialization);

        template.update("insert into stream_version (stream_id, version) values (?, 1)", stream().toString());
        Thread thread1 = new Thread(() -> {
            try {
                store1.append(stream(), 1, deposits(10));
                logger.info("Thread 1 committed");
            } catch (Exception e) {
                logger.error("Thread 1 failed", e);
                collector.addError(e);
            } finally {
                // release all latches in case we failed
                thread1hasStreamVersion.countDown();
                thread1committed.countDown();
            }
        });
        thread1.setName("Thread 1");
        thread1.start();
        try {
            store2.append(stream(), 1, deposits(20));
            fail("Should have failed");
        } catch (EventStoreException e) {
            logger.info("Thread 2 got (expected) event store exception", e);
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
        } finally {
            thread2hasStreamVersion.countDown();
        }
        thread1.join();
        assertDb(1, "select count(*) from event where stream_id = ?", stream().toString());
        assertDb(2, "select version from stream_version where stream_id = ?", stream().toString());
        assertDb(1, "select count(*) from event where stream_id = ? and payload like '%\"amount\":10%'",
            stream().toString());
        assertDb(0, "select count(*) from event where stream_id = ? and payload like '%\"amount\":20%'",
            stream().toString());
    }

    private List<LedgerEvent> deposits(int... amounts) {
        LedgerEvent[] events = new LedgerEvent[amounts.length];
        for (int i = 0; i < amounts.length; i++) {
            events[i] = DepositedEvent.of(name(), amounts[i]);
        }
        return Arrays.asList(events);
    }
}
