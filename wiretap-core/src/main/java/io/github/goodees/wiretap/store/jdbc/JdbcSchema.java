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
import io.github.goodees.wiretap.core.store.StreamSelector;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Instant;
import java.util.Collection;
import java.util.UUID;

/**
 * SQL dialect of the JDBC event store. Subclasses create the statements and read the result sets, the store only
 * sequences them within a transaction.
 */
public abstract class JdbcSchema {
    // unique constraint violation and serialization failure
    private static final String SQLSTATE_DUPLICATE_KEY = "23505";
    private static final String SQLSTATE_SERIALIZATION_FAILURE = "40001";
    // H2 specific: row was concurrently updated
    private static final String SQLSTATE_CONCURRENT_UPDATE = "90131";

    protected abstract PreparedStatement selectStreamVersion(Connection connection, StreamId streamId)
            throws SQLException;

    protected abstract PreparedStatement createStreamVersion(Connection connection, StreamId streamId,
            long startVersion) throws SQLException;

    protected abstract long readStreamVersion(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement updateStreamVersion(Connection connection, StreamId streamId,
            long startVersion, long endVersion) throws SQLException;

    protected abstract PreparedStatement insertEvent(Connection connection) throws SQLException;

    /**
     * Move the global position forward by {@code count}. The updated row stays locked until the append commits,
     * so that positions become visible in the order they were assigned.
     */
    protected abstract PreparedStatement advancePosition(Connection connection, int count) throws SQLException;

    protected abstract PreparedStatement createPosition(Connection connection, long position) throws SQLException;

    protected abstract PreparedStatement selectPosition(Connection connection) throws SQLException;

    protected abstract long readPosition(ResultSet rs) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, long position, StreamId streamId,
            long version, UUID eventId, Instant timestamp, String type, int payloadVersion, String payload,
            String metadata) throws SQLException;

    protected abstract PreparedStatement selectStreams(Connection connection, Collection<StreamId> streamIds)
            throws SQLException;

    protected abstract PreparedStatement selectAfter(Connection connection, StreamSelector selector,
            long afterPosition, int limit) throws SQLException;

    protected abstract PreparedStatement selectHeadPosition(Connection connection) throws SQLException;

    protected abstract long readHeadPosition(ResultSet rs) throws SQLException;

    protected abstract long readEventPosition(ResultSet rs) throws SQLException;

    protected abstract StreamId readEventStream(ResultSet rs) throws SQLException;

    protected abstract long readEventVersion(ResultSet rs) throws SQLException;

    protected abstract UUID readEventId(ResultSet rs) throws SQLException;

    protected abstract Instant readEventTimestamp(ResultSet rs) throws SQLException;

    protected abstract String readEventType(ResultSet rs) throws SQLException;

    protected abstract int readEventPayloadVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventPayload(ResultSet rs) throws SQLException;

    protected abstract String readEventMetadata(ResultSet rs) throws SQLException;

    /**
     * Decide whether a failed write lost a race with another writer of the same stream.
     * @param e exception of the write
     * @return true when the write should be reported as optimistic lock failure
     */
    protected boolean isConcurrencyConflict(SQLException e) {
        for (SQLException ex = e; ex != null; ex = ex.getNextException()) {
            if (ex instanceof SQLIntegrityConstraintViolationException) {
                return true;
            }
            String state = ex.getSQLState();
            if (SQLSTATE_DUPLICATE_KEY.equals(state) || SQLSTATE_SERIALIZATION_FAILURE.equals(state)
                    || SQLSTATE_CONCURRENT_UPDATE.equals(state)) {
                return true;
            }
        }
        return false;
    }
}
