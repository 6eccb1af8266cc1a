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

import io.github.goodees.wiretap.core.StoredEvent;
import io.github.goodees.wiretap.core.StreamId;
import io.github.goodees.wiretap.core.store.EventLog;
import io.github.goodees.wiretap.core.store.EventStore;
import io.github.goodees.wiretap.core.store.EventStoreException;
import io.github.goodees.wiretap.core.store.Serialization;
import io.github.goodees.wiretap.core.store.StoredEventList;
import io.github.goodees.wiretap.core.store.StreamSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Reads events stored by {@link JdbcEventStore}.
 *
 * <p>Events are read lazily from an open result set; the returned {@link EventLog.StoredEvents} must be closed.
 * Failures while iterating are reported as {@link IllegalStateException} with cause
 * {@link EventStoreException}.
 *
 * @param <E> type of event payloads
 */
public class JdbcEventLog<E> implements EventLog<E> {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventLog.class);

    private final DataSource ds;
    private final JdbcSchema schema;
    private final Serialization<E> serialization;
    private final boolean strict;

    /**
     * Create instance that will read from provided datasource, delegating queries to JdbcSchema, deserializing events
     * by serialization, while being or not being strict.
     *
     * <p>When event log is in strict mode, it will throw an exception when an event being read cannot be deserialized.
     * This can usually happen in two cases: Either there was an error in payload serialization, or an event could have
     * belong to a future version of the system, code was rolled back and currently running code doesn't yet know such event.
     * <p>When {@code strict} is false, such event is skipped.
     *
     * @param ds data source
     * @param schema SQL dialect
     * @param serialization payload serialization
     * @param strict whether unknown events fail the read
     */
    public JdbcEventLog(DataSource ds, JdbcSchema schema, Serialization<E> serialization, boolean strict) {
        this.ds = ds;
        this.schema = schema;
        this.serialization = serialization;
        this.strict = strict;
    }

    @Override
    public StoredEvents<E> readStreams(Collection<StreamId> streamIds) throws EventStoreException {
        if (streamIds.isEmpty()) {
            return StoredEventList.empty();
        }
        Collection<StreamId> distinct = new ArrayList<>(new LinkedHashSet<>(streamIds));
        try {
            return new JdbcStoredEvents(c -> schema.selectStreams(c, distinct));
        } catch (SQLException e) {
            throw EventStoreException.readFailed("streams " + distinct, e);
        }
    }

    @Override
    public StoredEvents<E> readAfter(StreamSelector selector, long afterPosition, int limit)
            throws EventStoreException {
        try {
            return new JdbcStoredEvents(c -> schema.selectAfter(c, selector, afterPosition, limit));
        } catch (SQLException e) {
            throw EventStoreException.readFailed(selector + " after " + afterPosition, e);
        }
    }

    @Override
    public long streamVersion(StreamId streamId) throws EventStoreException {
        try (Connection connection = ds.getConnection();
                PreparedStatement streamVersion = schema.selectStreamVersion(connection, streamId);
                ResultSet rs = streamVersion.executeQuery()) {
            return rs.next() ? schema.readStreamVersion(rs) : EventStore.NO_STREAM;
        } catch (SQLException sqle) {
            throw EventStoreException.readFailed("version of " + streamId, sqle);
        }
    }

    @Override
    public long headPosition() throws EventStoreException {
        try (Connection connection = ds.getConnection();
                PreparedStatement head = schema.selectHeadPosition(connection);
                ResultSet rs = head.executeQuery()) {
            return rs.next() ? schema.readHeadPosition(rs) : 0;
        } catch (SQLException sqle) {
            throw EventStoreException.readFailed("head position", sqle);
        }
    }

    /**
     * Indicate whether failure to deserialize event causes exception to be thrown.
     * @return true if unknown events fail the read
     */
    public boolean isStrict() {
        return strict;
    }

    interface Query {
        PreparedStatement prepare(Connection connection) throws SQLException;
    }

    class JdbcStoredEvents implements EventLog.StoredEvents<E> {
        private Connection connection;
        private PreparedStatement statement;
        private ResultSet resultSet;
        private boolean iterating;
        private boolean stop;

        JdbcStoredEvents(Query query) throws SQLException {
            try {
                connection = ds.getConnection();
                statement = query.prepare(connection);
                resultSet = statement.executeQuery();
            } catch (SQLException e) {
                close();
                throw e;
            }
        }

        @Override
        public void foreach(Consumer<? super StoredEvent<E>> consumer) {
            reduce(null, (r, e) -> {
                consumer.accept(e);
                return null;
            });
        }

        @Override
        public <R> R reduce(R initial, BiFunction<R, ? super StoredEvent<E>, R> reducer) {
            if (iterating) {
                throw new IllegalStateException("Iteration has already been done");
            }
            iterating = true;
            try {
                R result = initial;
                while (!stop && resultSet.next()) {
                    StoredEvent<E> event = readEvent();
                    if (event != null) {
                        result = reducer.apply(result, event);
                    }
                }
                return result;
            } catch (SQLException e) {
                throw new IllegalStateException("Cannot access datastore", EventStoreException.readFailed("events", e));
            } catch (EventStoreException e) {
                throw new IllegalStateException(e.getMessage(), e);
            }
        }

        private StoredEvent<E> readEvent() throws SQLException, EventStoreException {
            StreamId streamId = schema.readEventStream(resultSet);
            long version = schema.readEventVersion(resultSet);
            String type = schema.readEventType(resultSet);
            E payload = serialization.deserialize(schema.readEventPayloadVersion(resultSet),
                schema.readEventPayload(resultSet), type);
            if (payload == null) {
                if (isStrict()) {
                    throw EventStoreException.unknownEvent(streamId, version, type);
                } else {
                    logger.error("{} Could not deserialize event {} of type {}", streamId, version, type);
                    return null;
                }
            }
            return new StoredEvent<>(streamId, schema.readEventId(resultSet), version,
                    schema.readEventPosition(resultSet), schema.readEventTimestamp(resultSet), payload,
                    MetadataCodec.read(schema.readEventMetadata(resultSet)));
        }

        @Override
        public void stop() {
            stop = true;
        }

        @Override
        public void close() {
            cleanup(resultSet);
            cleanup(statement);
            cleanup(connection);
        }

        protected void cleanup(AutoCloseable resource) {
            if (resource != null) {
                try {
                    resource.close();
                } catch (Exception e) {
                    logger.warn("Suppressing cleanup exception", e);
                }
            }
        }
    }

}
