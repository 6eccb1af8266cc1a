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

import io.github.goodees.wiretap.core.projection.Checkpoint;
import io.github.goodees.wiretap.core.projection.ProjectionException;
import io.github.goodees.wiretap.core.store.JacksonSerialization;
import io.github.goodees.wiretap.immutables.events.DepositedEvent;
import io.github.goodees.wiretap.immutables.events.LedgerEvent;
import io.github.goodees.wiretap.immutables.events.WithdrawnEvent;
import io.github.goodees.wiretap.projection.Balances;
import io.github.goodees.wiretap.store.jdbc.JdbcTest;
import org.junit.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;

import static io.github.goodees.wiretap.projection.Balances.stored;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;

public class JdbcProjectionTest extends JdbcTest {
    private final JdbcProjectionSchema projectionSchema = new JdbcProjectionSchema();

    private JdbcProjection<Balances, LedgerEvent> projection() {
        return new JdbcProjection<>(ds, projectionSchema, name(), JacksonSerialization.of(Balances.class),
                Balances::empty, Balances::apply);
    }

    @Test
    public void state_is_persisted_per_event() throws ProjectionException {
        JdbcProjection<Balances, LedgerEvent> projection = projection();
        assertEquals(Balances.empty(), projection.getState());
        projection.applyEvent(stored(1, DepositedEvent.of("alice", 100)));
        projection.applyEvent(stored(2, WithdrawnEvent.builder().account("alice").amount(40).build()));
        assertEquals(60, projection.getState().balance("alice"));
        assertDb(2, "select last_position from projection_state where name = ?", name());
    }

    @Test
    public void state_and_checkpoint_survive_restart() throws ProjectionException {
        JdbcProjection<Balances, LedgerEvent> first = projection();
        first.applyEvent(stored(1, DepositedEvent.of("alice", 100)));
        first.applyEvent(stored(2, DepositedEvent.of("bob", 7)));
        first.setCheckpoint(Checkpoint.of(stored(2, DepositedEvent.of("bob", 7))));

        JdbcProjection<Balances, LedgerEvent> second = projection();
        assertEquals(first.getState(), second.getState());
        assertEquals(2, second.lastCheckpoint().get().getPosition());
        assertEquals(first.lastCheckpoint(), second.lastCheckpoint());
    }

    @Test
    public void redelivered_events_are_ignored() throws ProjectionException {
        JdbcProjection<Balances, LedgerEvent> projection = projection();
        projection.applyEvent(stored(1, DepositedEvent.of("alice", 100)));
        projection.applyEvent(stored(2, DepositedEvent.of("alice", 10)));
        // another instance of the same projection gets the batch again
        projection().applyEvent(stored(2, DepositedEvent.of("alice", 10)));
        assertEquals(110, projection.getState().balance("alice"));
    }

    @Test
    public void checkpoint_cannot_move_back() throws ProjectionException {
        JdbcProjection<Balances, LedgerEvent> projection = projection();
        projection.setCheckpoint(Checkpoint.of(stored(3, DepositedEvent.of("alice", 1))));
        projection.setCheckpoint(Checkpoint.of(stored(5, DepositedEvent.of("alice", 1))));
        try {
            projection().setCheckpoint(Checkpoint.of(stored(4, DepositedEvent.of("alice", 1))));
            fail("Checkpoint regression should fail");
        } catch (ProjectionException e) {
            assertEquals(ProjectionException.Fault.CHECKPOINT, e.getFault());
        }
        assertDb(5, "select global_position from projection_checkpoint where name = ?", name());
    }

    @Test
    public void checkpoint_write_missing_its_row_fails() throws ProjectionException {
        JdbcProjectionSchema lostRow = new JdbcProjectionSchema() {
            @Override
            protected PreparedStatement updateCheckpoint(Connection connection, String name, Checkpoint checkpoint)
                    throws SQLException {
                // as if the row was deleted concurrently
                return super.updateCheckpoint(connection, name + "-deleted", checkpoint);
            }
        };
        JdbcProjection<Balances, LedgerEvent> projection = new JdbcProjection<>(ds, lostRow, name(),
                JacksonSerialization.of(Balances.class), Balances::empty, Balances::apply);
        projection.setCheckpoint(Checkpoint.of(stored(1, DepositedEvent.of("alice", 1))));
        try {
            projection.setCheckpoint(Checkpoint.of(stored(2, DepositedEvent.of("alice", 1))));
            fail("Lost checkpoint row should fail");
        } catch (ProjectionException e) {
            assertEquals(ProjectionException.Fault.CHECKPOINT, e.getFault());
        }
        assertDb(1, "select global_position from projection_checkpoint where name = ?", name());
    }

    @Test
    public void failing_reducer_does_not_store_state() throws ProjectionException {
        JdbcProjection<Balances, LedgerEvent> failing = new JdbcProjection<>(ds, projectionSchema, name(),
                JacksonSerialization.of(Balances.class), Balances::empty, (state, event) -> {
                    throw new IllegalStateException("boom");
                });
        try {
            failing.applyEvent(stored(1, DepositedEvent.of("alice", 1)));
            fail("Reducer failure should propagate");
        } catch (ProjectionException e) {
            assertEquals(ProjectionException.Fault.APPLY, e.getFault());
        }
        assertDb(0, "select count(*) from projection_state where name = ?", name());
    }

    @Test
    public void reset_removes_state_and_checkpoint() throws ProjectionException {
        JdbcProjection<Balances, LedgerEvent> projection = projection();
        projection.applyEvent(stored(1, DepositedEvent.of("alice", 100)));
        projection.setCheckpoint(Checkpoint.of(stored(1, DepositedEvent.of("alice", 100))));
        projection.reset();
        assertEquals(Balances.empty(), projection.getState());
        assertFalse(projection.lastCheckpoint().isPresent());
        assertDb(0, "select count(*) from projection_checkpoint where name = ?", name());
    }

    @Test
    public void unreadable_state_is_reported() {
        template.update("insert into projection_state (name, state, last_position, updated) values (?, ?, 1, ?)",
            name(), "{\"accounts\":", new Timestamp(System.currentTimeMillis()));
        try {
            projection().getState();
            fail("Corrupt state should fail");
        } catch (ProjectionException e) {
            assertEquals(ProjectionException.Fault.STORAGE, e.getFault());
        }
    }
}
