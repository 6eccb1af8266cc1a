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
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Schema with an event table, a stream version table and a position table, in plain SQL understood by H2,
 * PostgreSQL and MySQL.
 *
 * <pre>
 * CREATE TABLE event (GLOBAL_POSITION BIGINT PRIMARY KEY,
 *     STREAM_ID VARCHAR(255) NOT NULL, STREAM_KIND VARCHAR(64) NOT NULL, VERSION BIGINT NOT NULL,
 *     EVENT_ID VARCHAR(36) NOT NULL, TIMESTAMP TIMESTAMP NOT NULL, TYPE VARCHAR(255) NOT NULL,
 *     PAYLOAD_VERSION INT NOT NULL, PAYLOAD CLOB NOT NULL, METADATA CLOB,
 *     UNIQUE (STREAM_ID, VERSION))
 * CREATE TABLE stream_version (STREAM_ID VARCHAR(255) PRIMARY KEY, VERSION BIGINT NOT NULL)
 * CREATE TABLE event_position (NAME VARCHAR(255) PRIMARY KEY, POSITION BIGINT NOT NULL)
 * INSERT INTO event_position (NAME, POSITION) VALUES ('event', 0)
 * </pre>
 *
 * <p>The position table holds one row per event table, named after it, with the last assigned global position.
 * The first append creates a missing row, concurrent first appends then fail with optimistic lock.
 */
public class DefaultJdbcSchema extends JdbcSchema {
    private static final String EVENT_COLUMNS = "GLOBAL_POSITION, STREAM_ID, VERSION, EVENT_ID, TIMESTAMP, TYPE, "
            + "PAYLOAD_VERSION, PAYLOAD, METADATA";

    private final String eventTable;
    private final String versionTable;
    private final String positionTable;

    public DefaultJdbcSchema(String eventTable, String versionTable) {
        this(eventTable, versionTable, "event_position");
    }

    public DefaultJdbcSchema(String eventTable, String versionTable, String positionTable) {
        this.eventTable = eventTable;
        this.versionTable = versionTable;
        this.positionTable = positionTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getVersionTable() {
        return versionTable;
    }

    protected String getPositionTable() {
        return positionTable;
    }

    @Override
    protected PreparedStatement selectStreamVersion(Connection connection, StreamId streamId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT VERSION FROM " + getVersionTable()
                + " WHERE STREAM_ID=?");
        st.setString(1, streamId.toString());
        return st;
    }

    @Override
    protected PreparedStatement createStreamVersion(Connection connection, StreamId streamId, long startVersion)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getVersionTable()
                + " (STREAM_ID, VERSION) VALUES (?, ?)");
        st.setString(1, streamId.toString());
        st.setLong(2, startVersion);
        return st;
    }

    @Override
    protected long readStreamVersion(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement updateStreamVersion(Connection connection, StreamId streamId, long startVersion,
            long endVersion) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getVersionTable()
                + " SET VERSION=? WHERE STREAM_ID=? AND VERSION=?");
        st.setLong(1, endVersion);
        st.setString(2, streamId.toString());
        st.setLong(3, startVersion);
        return st;
    }

    @Override
    protected PreparedStatement advancePosition(Connection connection, int count) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getPositionTable()
                + " SET POSITION=POSITION+? WHERE NAME=?");
        st.setInt(1, count);
        st.setString(2, getEventTable());
        return st;
    }

    @Override
    protected PreparedStatement createPosition(Connection connection, long position) throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getPositionTable()
                + " (NAME, POSITION) VALUES (?, ?)");
        st.setString(1, getEventTable());
        st.setLong(2, position);
        return st;
    }

    @Override
    protected PreparedStatement selectPosition(Connection connection) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT POSITION FROM " + getPositionTable()
                + " WHERE NAME=?");
        st.setString(1, getEventTable());
        return st;
    }

    @Override
    protected long readPosition(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable()
                + " (GLOBAL_POSITION, STREAM_ID, STREAM_KIND, VERSION, EVENT_ID, TIMESTAMP, TYPE, PAYLOAD_VERSION,"
                + " PAYLOAD, METADATA) VALUES (?,?,?,?,?,?,?,?,?,?)");
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, long position, StreamId streamId, long version,
            UUID eventId, Instant timestamp, String type, int payloadVersion, String payload, String metadata)
            throws SQLException {
        insertEvent.setLong(1, position);
        insertEvent.setString(2, streamId.toString());
        insertEvent.setString(3, streamId.kind());
        insertEvent.setLong(4, version);
        insertEvent.setString(5, eventId.toString());
        insertEvent.setTimestamp(6, Timestamp.from(timestamp));
        insertEvent.setString(7, type);
        insertEvent.setInt(8, payloadVersion);
        insertEvent.setString(9, payload);
        insertEvent.setString(10, metadata);
    }

    @Override
    protected PreparedStatement selectStreams(Connection connection, Collection<StreamId> streamIds)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventTable()
                + " WHERE STREAM_ID IN (" + placeholders(streamIds.size()) + ") ORDER BY GLOBAL_POSITION");
        int i = 1;
        for (StreamId streamId : streamIds) {
            st.setString(i++, streamId.toString());
        }
        return st;
    }

    @Override
    protected PreparedStatement selectAfter(Connection connection, StreamSelector selector, long afterPosition,
            int limit) throws SQLException {
        List<String> streams = new ArrayList<>();
        selector.getStreams().forEach(s -> streams.add(s.toString()));
        List<String> kinds = new ArrayList<>(selector.getKinds());
        StringBuilder sql = new StringBuilder("SELECT ").append(EVENT_COLUMNS).append(" FROM ")
                .append(getEventTable()).append(" WHERE GLOBAL_POSITION > ?");
        if (!selector.isAll()) {
            sql.append(" AND (");
            if (!streams.isEmpty()) {
                sql.append("STREAM_ID IN (").append(placeholders(streams.size())).append(")");
            }
            if (!kinds.isEmpty()) {
                sql.append(streams.isEmpty() ? "" : " OR ").append("STREAM_KIND IN (")
                        .append(placeholders(kinds.size())).append(")");
            }
            sql.append(")");
        }
        sql.append(" ORDER BY GLOBAL_POSITION LIMIT ?");
        PreparedStatement st = connection.prepareStatement(sql.toString());
        int i = 1;
        st.setLong(i++, afterPosition);
        for (String stream : streams) {
            st.setString(i++, stream);
        }
        for (String kind : kinds) {
            st.setString(i++, kind);
        }
        st.setInt(i, limit);
        return st;
    }

    @Override
    protected PreparedStatement selectHeadPosition(Connection connection) throws SQLException {
        return connection.prepareStatement("SELECT MAX(GLOBAL_POSITION) FROM " + getEventTable());
    }

    @Override
    protected long readHeadPosition(ResultSet rs) throws SQLException {
        // MAX of empty table is NULL, read as 0
        return rs.getLong(1);
    }

    @Override
    protected long readEventPosition(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected StreamId readEventStream(ResultSet rs) throws SQLException {
        return StreamId.parse(rs.getString(2));
    }

    @Override
    protected long readEventVersion(ResultSet rs) throws SQLException {
        return rs.getLong(3);
    }

    @Override
    protected UUID readEventId(ResultSet rs) throws SQLException {
        return UUID.fromString(rs.getString(4));
    }

    @Override
    protected Instant readEventTimestamp(ResultSet rs) throws SQLException {
        return rs.getTimestamp(5).toInstant();
    }

    @Override
    protected String readEventType(ResultSet rs) throws SQLException {
        return rs.getString(6);
    }

    @Override
    protected int readEventPayloadVersion(ResultSet rs) throws SQLException {
        return rs.getInt(7);
    }

    @Override
    protected String readEventPayload(ResultSet rs) throws SQLException {
        return rs.getString(8);
    }

    @Override
    protected String readEventMetadata(ResultSet rs) throws SQLException {
        return rs.getString(9);
    }

    private static String placeholders(int count) {
        return String.join(",", Collections.nCopies(count, "?"));
    }
}
