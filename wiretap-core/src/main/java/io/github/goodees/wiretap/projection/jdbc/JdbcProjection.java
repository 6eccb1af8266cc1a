package io.github.goodees.wiretap.projection.jdbc;

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
import io.github.goodees.wiretap.core.projection.Checkpoint;
import io.github.goodees.wiretap.core.projection.Projection;
import io.github.goodees.wiretap.core.projection.ProjectionException;
import io.github.goodees.wiretap.core.store.EventStoreException;
import io.github.goodees.wiretap.core.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Projection persisting its state and checkpoint in database, so that it survives restarts and can be shared by
 * several instances of the same name.
 *
 * <p>Every applied event is a read-modify-write of the state row, guarded by the position of the last applied
 * event. An instance that lost a race with another instance fails with {@link ProjectionException.Fault#STORAGE};
 * a retry then skips the event the other instance applied.
 */
public class JdbcProjection<S, E> implements Projection<S, E> {
    private static final Logger logger = LoggerFactory.getLogger(JdbcProjection.class);

    private final DataSource ds;
    private final JdbcProjectionSchema schema;
    private final String name;
    private final Serialization<S> serialization;
    private final Supplier<S> initialState;
    private final BiFunction<S, StoredEvent<E>, S> reducer;

    public JdbcProjection(DataSource ds, JdbcProjectionSchema schema, String name, Serialization<S> serialization,
            Supplier<S> initialState, BiFunction<S, StoredEvent<E>, S> reducer) {
        this.ds = Objects.requireNonNull(ds);
        this.schema = Objects.requireNonNull(schema);
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.serialization = Objects.requireNonNull(serialization);
        this.initialState = Objects.requireNonNull(initialState);
        this.reducer = Objects.requireNonNull(reducer);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public S getState() throws ProjectionException {
        try (Connection connection = ds.getConnection()) {
            StateRecord record = loadState(connection);
            return record == null ? initialState.get() : record.state;
        } catch (SQLException e) {
            throw ProjectionException.storageFailed(name, e);
        }
    }

    @Override
    public void applyEvent(StoredEvent<E> event) throws ProjectionException {
        try (Connection connection = ds.getConnection()) {
            StateRecord record = loadState(connection);
            long lastPosition = record == null ? 0 : record.lastPosition;
            if (event.getPosition() <= lastPosition) {
                logger.debug("{} skips {}, already applied up to {}", name, event, lastPosition);
                return;
            }
            S newState;
            try {
                newState = reducer.apply(record == null ? initialState.get() : record.state, event);
            } catch (RuntimeException e) {
                throw ProjectionException.applyFailed(name, event, e);
            }
            String payload = serialization.serialize(newState);
            try (PreparedStatement store = record == null
                    ? schema.insertState(connection, name, payload, event.getPosition())
                    : schema.updateState(connection, name, payload, event.getPosition(), lastPosition)) {
                if (store.executeUpdate() != 1) {
                    throw ProjectionException.concurrentUpdate(name, lastPosition);
                }
            }
        } catch (SQLException | EventStoreException e) {
            throw ProjectionException.storageFailed(name, e);
        }
    }

    private StateRecord loadState(Connection connection) throws SQLException, ProjectionException {
        try (PreparedStatement st = schema.selectState(connection, name);
                ResultSet rs = st.executeQuery()) {
            if (!rs.next()) {
                return null;
            }
            long lastPosition = schema.readLastPosition(rs);
            S state = serialization.deserialize(0, schema.readState(rs), null);
            if (state == null) {
                throw ProjectionException.storageFailed(name, new IllegalStateException("Stored state of " + name
                        + " cannot be read"));
            }
            return new StateRecord(state, lastPosition);
        } catch (EventStoreException e) {
            throw ProjectionException.storageFailed(name, e);
        }
    }

    @Override
    public Optional<Checkpoint> lastCheckpoint() throws ProjectionException {
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.selectCheckpoint(connection, name);
                ResultSet rs = st.executeQuery()) {
            return rs.next() ? Optional.of(schema.readCheckpoint(rs)) : Optional.empty();
        } catch (SQLException e) {
            throw ProjectionException.checkpointFailed(name, e);
        }
    }

    @Override
    public void setCheckpoint(Checkpoint checkpoint) throws ProjectionException {
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.selectCheckpoint(connection, name);
                ResultSet rs = st.executeQuery()) {
            boolean exists = rs.next();
            if (exists) {
                Checkpoint current = schema.readCheckpoint(rs);
                if (checkpoint.isBefore(current)) {
                    throw ProjectionException.checkpointRegression(name, current, checkpoint);
                }
            }
            try (PreparedStatement store = exists ? schema.updateCheckpoint(connection, name, checkpoint)
                    : schema.insertCheckpoint(connection, name, checkpoint)) {
                if (store.executeUpdate() != 1) {
                    throw ProjectionException.checkpointFailed(name, new IllegalStateException(
                            "Checkpoint " + checkpoint + " did not create or update a row"));
                }
            }
        } catch (SQLException e) {
            throw ProjectionException.checkpointFailed(name, e);
        }
    }

    @Override
    public void reset() throws ProjectionException {
        try (Connection connection = ds.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try (PreparedStatement deleteState = schema.deleteState(connection, name);
                    PreparedStatement deleteCheckpoint = schema.deleteCheckpoint(connection, name)) {
                deleteState.executeUpdate();
                deleteCheckpoint.executeUpdate();
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
            logger.info("Projection {} was reset", name);
        } catch (SQLException e) {
            throw ProjectionException.storageFailed(name, e);
        }
    }

    @Override
    public String toString() {
        return "JdbcProjection[" + name + "]";
    }

    private class StateRecord {
        final S state;
        final long lastPosition;

        StateRecord(S state, long lastPosition) {
            this.state = state;
            this.lastPosition = lastPosition;
        }
    }
}
