package io.github.goodees.esa.store.jdbc;

/*-
 * #%L
 * esa
 * %%
 * Copyright (C) 2017 Patrik Duditš
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

import io.github.goodees.esa.core.AggregateEventMetadata;
import io.github.goodees.esa.core.AggregateIdentity;
import io.github.goodees.esa.core.CorrelationId;
import io.github.goodees.esa.core.EventId;
import io.github.goodees.esa.core.IdempotencyId;
import io.github.goodees.esa.core.store.AggregateSnapshot;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * JDBC schema with one table for events, versions and snapshots of all aggregates. Following tables are expected to
 * exist:
 * <ul>
 * <li><em>eventTable</em>(AGGREGATE_ID, AGGREGATE_VERSION, AGGREGATE_TYPE, EVENT_ID, EVENT_TIMESTAMP, CORRELATION_ID,
 * IDEMPOTENCY_ID, TYPE_NAME, TYPE_VERSION, PAYLOAD) primary key (AGGREGATE_ID, AGGREGATE_VERSION)</li>
 * <li><em>versionTable</em>(AGGREGATE_ID, AGGREGATE_VERSION) primary key (AGGREGATE_ID)</li>
 * <li><em>snapshotTable</em>(AGGREGATE_ID, AGGREGATE_VERSION, AGGREGATE_TYPE, SNAPSHOT_TIMESTAMP, TYPE_NAME,
 * TYPE_VERSION, PAYLOAD) primary key (AGGREGATE_ID, AGGREGATE_VERSION)</li>
 * </ul>
 * Timestamp columns are of type {@code TIMESTAMP WITH TIME ZONE} and are written in UTC.
 */
public class DefaultJdbcSchema extends JdbcSchema {

    private final String eventTable;
    private final String versionTable;
    private final String snapshotTable;

    public DefaultJdbcSchema(String eventTable, String versionTable, String snapshotTable) {
        this.eventTable = eventTable;
        this.versionTable = versionTable;
        this.snapshotTable = snapshotTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getVersionTable() {
        return versionTable;
    }

    protected String getSnapshotTable() {
        return snapshotTable;
    }

    @Override
    protected PreparedStatement selectAggregateVersion(Connection connection, String aggregateId)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT AGGREGATE_VERSION FROM " + getVersionTable()
                + " WHERE AGGREGATE_ID=?");
        st.setString(1, aggregateId);
        return st;
    }

    @Override
    protected PreparedStatement createAggregateVersion(Connection connection, String aggregateId, long version)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getVersionTable()
                + " (AGGREGATE_ID, AGGREGATE_VERSION) VALUES (?, ?)");
        st.setString(1, aggregateId);
        st.setLong(2, version);
        return st;
    }

    @Override
    protected long readAggregateVersion(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement updateAggregateVersion(Connection connection, String aggregateId,
            long expectedVersion, long newVersion) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getVersionTable()
                + " SET AGGREGATE_VERSION=? WHERE AGGREGATE_ID=? AND AGGREGATE_VERSION=?");
        st.setLong(1, newVersion);
        st.setString(2, aggregateId);
        st.setLong(3, expectedVersion);
        return st;
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable()
                + " (AGGREGATE_ID, AGGREGATE_VERSION, AGGREGATE_TYPE, EVENT_ID, EVENT_TIMESTAMP, CORRELATION_ID,"
                + " IDEMPOTENCY_ID, TYPE_NAME, TYPE_VERSION, PAYLOAD) VALUES (?,?,?,?,?,?,?,?,?,?)");
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, AggregateEventMetadata metadata, String payload)
            throws SQLException {
        insertEvent.setString(1, metadata.getAggregateId().toString());
        insertEvent.setLong(2, metadata.getAggregateVersion());
        insertEvent.setString(3, metadata.getAggregateTypeName());
        insertEvent.setString(4, metadata.getEventId().toString());
        setTimestamp(insertEvent, 5, metadata.getTimestamp());
        insertEvent.setString(6, metadata.getCorrelationId().toString());
        insertEvent.setString(7, metadata.getIdempotencyId().toString());
        insertEvent.setString(8, metadata.getEventTypeName());
        insertEvent.setInt(9, metadata.getEventTypeVersion());
        insertEvent.setString(10, payload);
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, String aggregateId, long versionStart,
            long versionEnd) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT AGGREGATE_VERSION, AGGREGATE_TYPE, EVENT_ID,"
                + " EVENT_TIMESTAMP, CORRELATION_ID, IDEMPOTENCY_ID, TYPE_NAME, TYPE_VERSION, PAYLOAD FROM "
                + getEventTable() + " WHERE AGGREGATE_ID=? AND AGGREGATE_VERSION >= ? AND AGGREGATE_VERSION <= ?"
                + " ORDER BY AGGREGATE_VERSION");
        st.setString(1, aggregateId);
        st.setLong(2, versionStart);
        st.setLong(3, versionEnd);
        return st;
    }

    @Override
    protected AggregateEventMetadata readEventMetadata(ResultSet rs, AggregateIdentity aggregateId)
            throws SQLException {
        return AggregateEventMetadata.builder()
                .aggregateId(aggregateId)
                .aggregateVersion(rs.getLong(1))
                .aggregateTypeName(rs.getString(2))
                .eventId(EventId.parse(rs.getString(3)))
                .timestamp(getTimestamp(rs, 4))
                .correlationId(CorrelationId.parse(rs.getString(5)))
                .idempotencyId(IdempotencyId.parse(rs.getString(6)))
                .eventTypeName(rs.getString(7))
                .eventTypeVersion(rs.getInt(8))
                .build();
    }

    @Override
    protected String readEventPayload(ResultSet rs) throws SQLException {
        return rs.getString(9);
    }

    @Override
    protected PreparedStatement selectSnapshot(Connection connection, String aggregateId, long maxVersion)
            throws SQLException {
        PreparedStatement ps = connection.prepareStatement("SELECT AGGREGATE_VERSION, AGGREGATE_TYPE,"
                + " SNAPSHOT_TIMESTAMP, TYPE_NAME, TYPE_VERSION, PAYLOAD FROM " + getSnapshotTable()
                + " WHERE AGGREGATE_ID=? AND AGGREGATE_VERSION <= ? ORDER BY AGGREGATE_VERSION DESC");
        ps.setMaxRows(1);
        ps.setString(1, aggregateId);
        ps.setLong(2, maxVersion);
        return ps;
    }

    @Override
    protected PreparedStatement insertSnapshot(Connection connection, AggregateSnapshot snapshot, String payload)
            throws SQLException {
        PreparedStatement ps = connection.prepareStatement("INSERT INTO " + getSnapshotTable()
                + " (AGGREGATE_ID, AGGREGATE_VERSION, AGGREGATE_TYPE, SNAPSHOT_TIMESTAMP, TYPE_NAME, TYPE_VERSION,"
                + " PAYLOAD) VALUES (?, ?, ?, ?, ?, ?, ?)");
        ps.setString(1, snapshot.getAggregateId().toString());
        ps.setLong(2, snapshot.getAggregateVersion());
        ps.setString(3, snapshot.getAggregateTypeName());
        setTimestamp(ps, 4, snapshot.getTimestamp());
        ps.setString(5, snapshot.getPayload().typeName());
        ps.setInt(6, snapshot.getPayload().typeVersion());
        ps.setString(7, payload);
        return ps;
    }

    @Override
    protected SnapshotHeader readSnapshotHeader(ResultSet rs) throws SQLException {
        return new SnapshotHeader(rs.getLong(1), rs.getString(2), getTimestamp(rs, 3), rs.getString(4),
            rs.getInt(5));
    }

    @Override
    protected String readSnapshotPayload(ResultSet rs) throws SQLException {
        return rs.getString(6);
    }

    protected void setTimestamp(PreparedStatement st, int index, Instant timestamp) throws SQLException {
        st.setObject(index, timestamp.atOffset(ZoneOffset.UTC));
    }

    protected Instant getTimestamp(ResultSet rs, int index) throws SQLException {
        return rs.getObject(index, OffsetDateTime.class).toInstant();
    }
}
