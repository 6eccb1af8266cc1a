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

import io.github.goodees.wiretap.core.EventIds;
import io.github.goodees.wiretap.core.StreamId;
import io.github.goodees.wiretap.core.store.EventStore;
import io.github.goodees.wiretap.core.store.EventStoreException;
import io.github.goodees.wiretap.core.store.Serialization;
import io.github.goodees.wiretap.core.store.StreamWrite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Event store persisting into relational database.
 *
 * <p>Every stream has a row in version table. An append reads the versions of all written streams and moves each
 * of them forward with compare-and-swap update, in sorted order of streams. A writer that lost the race either
 * updates no row, or violates unique key of a stream version, and gets
 * {@link EventStoreException.Fault#OPTIMISTIC_LOCK}.
 *
 * <p>Global positions are taken from the position row only after the versions were moved, and the row stays locked
 * until the append commits. Appends therefore commit in the order of their positions, and a reader of the global
 * feed never sees a position while a lower one is still to be committed. A rolled back append returns its positions,
 * so the feed has no gaps. Appends to distinct streams serialize only between the position update and commit.
 *
 * @param <E> type of event payloads
 */
public class JdbcEventStore<E> implements EventStore<E> {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final Serialization<E> serialization;
    private final TxHandler txHandler;
    private final Clock clock;

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<E> serialization) {
        this(dataSource, schema, serialization, LOCAL_TRANSACTIONS);
    }

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<E> serialization,
            TxHandler handler) {
        this(dataSource, schema, serialization, handler, Clock.systemUTC());
    }

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<E> serialization,
            TxHandler handler, Clock clock) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.serialization = serialization;
        this.txHandler = handler;
        this.clock = clock;
    }

    protected E checkCast(Object event) throws EventStoreException {
        E cast = serialization.toSerializable(event);
        if (cast == null) {
            throw EventStoreException.unsupported(event);
        } else {
            return cast;
        }
    }

    @Override
    public Map<StreamId, Long> append(Collection<StreamWrite<E>> writes) throws EventStoreException {
        if (writes.isEmpty()) {
            return Collections.emptyMap();
        }
        PersistTemplate template = createTemplate();
        for (StreamWrite<E> write : writes) {
            template.addWrite(write);
        }
        return template.persist();
    }

    protected PersistTemplate createTemplate() {
        return new PersistTemplate();
    }

    protected class PersistTemplate {
        // sorted, so that concurrent writers lock version rows in the same order
        private final Map<StreamId, StreamWrite<E>> writes = new TreeMap<>();
        // in the order given, so that global positions follow it
        private final Map<StreamId, List<PreparedEvent>> events = new LinkedHashMap<>();
        private int eventCount;

        void addWrite(StreamWrite<E> write) throws EventStoreException {
            if (writes.put(write.getStreamId(), write) != null) {
                throw EventStoreException.duplicateStream(write.getStreamId());
            }
            String metadata = MetadataCodec.write(write.getMetadata());
            List<PreparedEvent> prepared = new ArrayList<>();
            for (Object payload : write.getEvents()) {
                E event = checkCast(payload);
                prepared.add(new PreparedEvent(serialization.typeOf(event), serialization.payloadVersion(event),
                        serialization.serialize(event), metadata));
            }
            events.put(write.getStreamId(), prepared);
            eventCount += prepared.size();
        }

        public Map<StreamId, Long> persist() throws EventStoreException {
            try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
                try {
                    Map<StreamId, Long> startVersions = checkSourceVersions(connection);
                    Map<StreamId, Long> endVersions = endVersions(startVersions);
                    updateVersions(connection, startVersions, endVersions);
                    long firstPosition = reservePositions(connection);
                    storeEvents(connection, startVersions, firstPosition);
                    txHandler.commit(connection);
                    logger.debug("Stored {} events to {} from position {}", eventCount, endVersions, firstPosition);
                    return endVersions;
                } catch (SQLException | EventStoreException | RuntimeException e) {
                    rollback(connection, e);
                    throw e;
                }
            } catch (SQLException ex) {
                if (schema.isConcurrencyConflict(ex)) {
                    throw EventStoreException.concurrentWrite(describe(), ex);
                }
                throw EventStoreException.storeFailed(describe(), ex);
            }
        }

        private void rollback(Connection connection, Exception cause) {
            try {
                txHandler.rollback(connection);
            } catch (SQLException re) {
                cause.addSuppressed(re);
            }
        }

        private Map<StreamId, Long> checkSourceVersions(Connection connection)
                throws SQLException, EventStoreException {
            Map<StreamId, Long> result = new LinkedHashMap<>();
            for (StreamWrite<E> write : writes.values()) {
                long version = readOrCreateVersion(connection, write.getStreamId());
                long expected = write.getExpectedVersion();
                if (expected != ANY_VERSION && version != expected) {
                    throw EventStoreException.optimisticLock(write.getStreamId(), version, expected);
                }
                result.put(write.getStreamId(), version);
            }
            return result;
        }

        private long readOrCreateVersion(Connection connection, StreamId streamId) throws SQLException {
            try (PreparedStatement selectVersion = schema.selectStreamVersion(connection, streamId);
                    ResultSet rs = selectVersion.executeQuery()) {
                if (rs.next()) {
                    return schema.readStreamVersion(rs);
                }
            }
            // no stream version - create a new one.
            try (PreparedStatement createVersion = schema.createStreamVersion(connection, streamId, NO_STREAM)) {
                createVersion.executeUpdate();
            }
            return NO_STREAM;
        }

        private Map<StreamId, Long> endVersions(Map<StreamId, Long> startVersions) {
            Map<StreamId, Long> versions = new LinkedHashMap<>();
            for (Map.Entry<StreamId, List<PreparedEvent>> stream : events.entrySet()) {
                versions.put(stream.getKey(), startVersions.get(stream.getKey()) + stream.getValue().size());
            }
            return versions;
        }

        private long reservePositions(Connection connection) throws SQLException {
            try (PreparedStatement advance = schema.advancePosition(connection, eventCount)) {
                if (advance.executeUpdate() == 0) {
                    // first append ever, a concurrent one fails on the primary key of the position row
                    try (PreparedStatement create = schema.createPosition(connection, eventCount)) {
                        create.executeUpdate();
                    }
                }
            }
            try (PreparedStatement select = schema.selectPosition(connection);
                    ResultSet rs = select.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Position row of event table is missing");
                }
                return schema.readPosition(rs) - eventCount + 1;
            }
        }

        private void storeEvents(Connection connection, Map<StreamId, Long> startVersions, long firstPosition)
                throws SQLException {
            Instant timestamp = clock.instant().truncatedTo(ChronoUnit.MILLIS);
            long position = firstPosition;
            try (PreparedStatement insertEvent = schema.insertEvent(connection)) {
                for (Map.Entry<StreamId, List<PreparedEvent>> stream : events.entrySet()) {
                    StreamId streamId = stream.getKey();
                    long version = startVersions.get(streamId);
                    for (PreparedEvent event : stream.getValue()) {
                        schema.prepareInsert(insertEvent, position++, streamId, ++version, EventIds.next(),
                            timestamp, event.type, event.payloadVersion, event.payload, event.metadata);
                        insertEvent.addBatch();
                    }
                }
                insertEvent.executeBatch();
            }
        }

        private void updateVersions(Connection connection, Map<StreamId, Long> startVersions,
                Map<StreamId, Long> endVersions) throws SQLException, EventStoreException {
            for (Map.Entry<StreamId, Long> start : startVersions.entrySet()) {
                StreamId streamId = start.getKey();
                try (PreparedStatement updateVersion = schema.updateStreamVersion(connection, streamId,
                    start.getValue(), endVersions.get(streamId))) {
                    int result = updateVersion.executeUpdate();
                    if (result != 1) {
                        throw EventStoreException.optimisticLock(streamId, start.getValue());
                    }
                }
            }
        }

        private String describe() {
            return writes.keySet().toString();
        }
    }

    private static class PreparedEvent {
        final String type;
        final int payloadVersion;
        final String payload;
        final String metadata;

        PreparedEvent(String type, int payloadVersion, String payload, String metadata) {
            this.type = type;
            this.payloadVersion = payloadVersion;
            this.payload = payload;
            this.metadata = metadata;
        }
    }

    /**
     * Demarcates the transaction of an append.
     */
    public interface TxHandler {

        Connection enroll(Connection connection) throws SQLException;

        void commit(Connection connection) throws SQLException;

        void rollback(Connection connection) throws SQLException;
    }

    /**
     * Transaction local to the connection of each append.
     */
    public static final TxHandler LOCAL_TRANSACTIONS = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) throws SQLException {
            connection.setAutoCommit(false);
            return connection;
        }

        @Override
        public void commit(Connection connection) throws SQLException {
            connection.commit();
        }

        @Override
        public void rollback(Connection connection) throws SQLException {
            connection.rollback();
        }
    };

    /**
     * Container or caller manages the transaction the connection takes part in.
     */
    public static final TxHandler CONTAINER_TRANSACTIONS = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) {
            return connection;
        }

        @Override
        public void commit(Connection connection) {
        }

        @Override
        public void rollback(Connection connection) {
        }
    };
}
