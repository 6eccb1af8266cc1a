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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;

/**
 * Tables of persistent projections.
 *
 * <pre>
 * CREATE TABLE projection_state (NAME VARCHAR(255) PRIMARY KEY, STATE CLOB NOT NULL,
 *     LAST_POSITION BIGINT NOT NULL, UPDATED TIMESTAMP NOT NULL)
 * CREATE TABLE projection_checkpoint (NAME VARCHAR(255) PRIMARY KEY, GLOBAL_POSITION BIGINT NOT NULL,
 *     EVENT_TIMESTAMP TIMESTAMP NOT NULL, UPDATED TIMESTAMP NOT NULL)
 * </pre>
 */
public class JdbcProjectionSchema {
    private final String stateTable;
    private final String checkpointTable;

    public JdbcProjectionSchema() {
        this("projection_state", "projection_checkpoint");
    }

    public JdbcProjectionSchema(String stateTable, String checkpointTable) {
        this.stateTable = stateTable;
        this.checkpointTable = checkpointTable;
    }

    protected String getStateTable() {
        return stateTable;
    }

    protected String getCheckpointTable() {
        return checkpointTable;
    }

    protected PreparedStatement selectState(Connection connection, String name) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("SELECT STATE, LAST_POSITION FROM " + getStateTable()
                + " WHERE NAME = ?");
        ps.setString(1, name);
        return ps;
    }

    protected String readState(ResultSet rs) throws SQLException {
        return rs.getString(1);
    }

    protected long readLastPosition(ResultSet rs) throws SQLException {
        return rs.getLong(2);
    }

    protected PreparedStatement updateState(Connection connection, String name, String state, long lastPosition,
            long expectedPosition) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("UPDATE " + getStateTable()
                + " SET STATE=?, LAST_POSITION=?, UPDATED=? WHERE NAME=? AND LAST_POSITION=?");
        ps.setString(1, state);
        ps.setLong(2, lastPosition);
        ps.setTimestamp(3, new Timestamp(System.currentTimeMillis()));
        ps.setString(4, name);
        ps.setLong(5, expectedPosition);
        return ps;
    }

    protected PreparedStatement insertState(Connection connection, String name, String state, long lastPosition)
            throws SQLException {
        PreparedStatement ps = connection.prepareStatement("INSERT INTO " + getStateTable()
                + " (NAME, STATE, LAST_POSITION, UPDATED) VALUES (?, ?, ?, ?)");
        ps.setString(1, name);
        ps.setString(2, state);
        ps.setLong(3, lastPosition);
        ps.setTimestamp(4, new Timestamp(System.currentTimeMillis()));
        return ps;
    }

    protected PreparedStatement deleteState(Connection connection, String name) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("DELETE FROM " + getStateTable() + " WHERE NAME = ?");
        ps.setString(1, name);
        return ps;
    }

    protected PreparedStatement selectCheckpoint(Connection connection, String name) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("SELECT GLOBAL_POSITION, EVENT_TIMESTAMP FROM "
                + getCheckpointTable() + " WHERE NAME = ?");
        ps.setString(1, name);
        return ps;
    }

    protected Checkpoint readCheckpoint(ResultSet rs) throws SQLException {
        return new Checkpoint(rs.getLong(1), rs.getTimestamp(2).toInstant());
    }

    protected PreparedStatement updateCheckpoint(Connection connection, String name, Checkpoint checkpoint)
            throws SQLException {
        PreparedStatement ps = connection.prepareStatement("UPDATE " + getCheckpointTable()
                + " SET GLOBAL_POSITION=?, EVENT_TIMESTAMP=?, UPDATED=? WHERE NAME=?");
        ps.setLong(1, checkpoint.getPosition());
        ps.setTimestamp(2, Timestamp.from(checkpoint.getTimestamp()));
        ps.setTimestamp(3, new Timestamp(System.currentTimeMillis()));
        ps.setString(4, name);
        return ps;
    }

    protected PreparedStatement insertCheckpoint(Connection connection, String name, Checkpoint checkpoint)
            throws SQLException {
        PreparedStatement ps = connection.prepareStatement("INSERT INTO " + getCheckpointTable()
                + " (NAME, GLOBAL_POSITION, EVENT_TIMESTAMP, UPDATED) VALUES (?, ?, ?, ?)");
        ps.setString(1, name);
        ps.setLong(2, checkpoint.getPosition());
        ps.setTimestamp(3, Timestamp.from(checkpoint.getTimestamp()));
        ps.setTimestamp(4, new Timestamp(System.currentTimeMillis()));
        return ps;
    }

    protected PreparedStatement deleteCheckpoint(Connection connection, String name) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("DELETE FROM " + getCheckpointTable() + " WHERE NAME = ?");
        ps.setString(1, name);
        return ps;
    }
}
