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

import io.github.goodees.esa.core.AggregateIdentity;
import io.github.goodees.esa.core.store.AggregateSnapshot;
import io.github.goodees.esa.core.store.SnapshotStore;
import io.github.goodees.esa.core.types.Versioned;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot store keeping every stored snapshot of an aggregate. Failures are logged, and reported as missing
 * snapshot on read.
 */
public class JdbcSnapshotStore implements SnapshotStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcSnapshotStore.class);

    private final DataSource ds;
    private final JdbcSchema schema;
    private final Serialization<Versioned<?>> serialization;

    public JdbcSnapshotStore(DataSource ds, JdbcSchema schema, Serialization<Versioned<?>> serialization) {
        this.ds = ds;
        this.schema = schema;
        this.serialization = Objects.requireNonNull(serialization);
    }

    @Override
    public Optional<AggregateSnapshot> read(AggregateIdentity aggregateId, long maxVersion) {
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.selectSnapshot(connection, aggregateId.toString(),
                    maxVersion == 0 ? Long.MAX_VALUE : maxVersion);
                ResultSet rs = st.executeQuery()) {
            if (rs.next()) {
                JdbcSchema.SnapshotHeader header = schema.readSnapshotHeader(rs);
                Versioned<?> payload = serialization.deserialize(header.getTypeName(), header.getTypeVersion(),
                    schema.readSnapshotPayload(rs));
                if (payload == null) {
                    logger.warn("Snapshot of {} at version {} has unknown type {} v{}", aggregateId,
                        header.getAggregateVersion(), header.getTypeName(), header.getTypeVersion());
                    return Optional.empty();
                }
                return Optional.of(new AggregateSnapshot(payload, aggregateId, header.getAggregateTypeName(),
                    header.getAggregateVersion(), header.getTimestamp()));
            }
        } catch (SQLException | RuntimeException e) {
            logger.error("Cannot read snapshot of {}", aggregateId, e);
        }
        return Optional.empty();
    }

    @Override
    public void write(AggregateSnapshot snapshot) {
        AggregateIdentity aggregateId = snapshot.getAggregateId();
        Versioned<?> payload = serialization.toSerializable(snapshot.getPayload());
        if (payload == null) {
            logger.error("Unsupported snapshot type {} of {}", snapshot.getPayload().getClass().getName(),
                aggregateId);
            return;
        }
        try (Connection connection = ds.getConnection();
                PreparedStatement store = schema.insertSnapshot(connection, snapshot,
                    serialization.serialize(payload))) {
            int result = store.executeUpdate();
            if (result != 1) {
                logger.error("Snapshot insert did not create a row for aggregate {}", aggregateId);
            }
        } catch (SQLException se) {
            if (JdbcEventStore.isConstraintViolation(se)) {
                logger.debug("Snapshot of {} at version {} is already stored", aggregateId,
                    snapshot.getAggregateVersion());
            } else {
                logger.error("Failed to store snapshot for {}", aggregateId, se);
            }
        } catch (RuntimeException e) {
            logger.error("Failed to serialize snapshot for {}", aggregateId, e);
        }
    }
}
