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
import io.github.goodees.esa.core.store.AggregateSnapshot;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

/**
 * Statements and result mapping of JDBC stores. Aggregates are keyed by string form of their identity.
 *
 * @see DefaultJdbcSchema
 */
public abstract class JdbcSchema {

    protected abstract PreparedStatement selectAggregateVersion(Connection connection, String aggregateId)
            throws SQLException;

    protected abstract PreparedStatement createAggregateVersion(Connection connection, String aggregateId,
            long version) throws SQLException;

    protected abstract long readAggregateVersion(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement updateAggregateVersion(Connection connection, String aggregateId,
            long expectedVersion, long newVersion) throws SQLException;

    protected abstract PreparedStatement insertEvent(Connection connection) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, AggregateEventMetadata metadata,
            String payload) throws SQLException;

    /**
     * Select events in version range, ordered by version.
     * @param versionStart lowest version
     * @param versionEnd highest version
     */
    protected abstract PreparedStatement selectEvents(Connection connection, String aggregateId, long versionStart,
            long versionEnd) throws SQLException;

    protected abstract AggregateEventMetadata readEventMetadata(ResultSet rs, AggregateIdentity aggregateId)
            throws SQLException;

    protected abstract String readEventPayload(ResultSet rs) throws SQLException;

    /**
     * Select snapshots at or below version, most recent first.
     */
    protected abstract PreparedStatement selectSnapshot(Connection connection, String aggregateId, long maxVersion)
            throws SQLException;

    protected abstract PreparedStatement insertSnapshot(Connection connection, AggregateSnapshot snapshot,
            String payload) throws SQLException;

    protected abstract SnapshotHeader readSnapshotHeader(ResultSet rs) throws SQLException;

    protected abstract String readSnapshotPayload(ResultSet rs) throws SQLException;

    /**
     * Stored attributes of a snapshot, except for its payload.
     */
    public static class SnapshotHeader {
        private final long aggregateVersion;
        private final String aggregateTypeName;
        private final Instant timestamp;
        private final String typeName;
        private final int typeVersion;

        public SnapshotHeader(long aggregateVersion, String aggregateTypeName, Instant timestamp, String typeName,
                int typeVersion) {
            this.aggregateVersion = aggregateVersion;
            this.aggregateTypeName = aggregateTypeName;
            this.timestamp = timestamp;
            this.typeName = typeName;
            this.typeVersion = typeVersion;
        }

        public long getAggregateVersion() {
            return aggregateVersion;
        }

        public String getAggregateTypeName() {
            return aggregateTypeName;
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        public String getTypeName() {
            return typeName;
        }

        public int getTypeVersion() {
            return typeVersion;
        }
    }
}
