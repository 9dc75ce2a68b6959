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

import io.github.goodees.esa.core.AggregateEvent;
import io.github.goodees.esa.core.AggregateEventMetadata;
import io.github.goodees.esa.core.AggregateIdentity;
import io.github.goodees.esa.core.CommittedEvent;
import io.github.goodees.esa.core.UncommittedEvent;
import io.github.goodees.esa.core.store.AggregateBatch;
import io.github.goodees.esa.core.store.Cancellation;
import io.github.goodees.esa.core.store.EventReader;
import io.github.goodees.esa.core.store.EventSequences;
import io.github.goodees.esa.core.store.EventStoreException;
import io.github.goodees.esa.core.store.EventWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Event store backed by {@link JdbcSchema} and {@link Serialization}.
 *
 * <p>Every aggregate has a row in version table, that is updated with optimistic lock after its events are inserted.
 * Write of multiple aggregates happens in single transaction managed by {@link TxHandler}. When the database does not
 * support transactions, a warning is logged and aggregates are appended one by one.
 */
public class JdbcEventStore implements EventWriter, EventReader {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final Serialization<AggregateEvent<?>> serialization;
    private final TxHandler txHandler;
    private final boolean strict;

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<AggregateEvent<?>> serialization) {
        this(dataSource, schema, serialization, LOCAL_HANDLER, false);
    }

    /**
     * Create store reading and writing through provided datasource.
     *
     * <p>When store is in strict mode, it will throw an exception when an event being read cannot be deserialized.
     * This happens when event type is not cataloged, e.g. the event belongs to a future version of the system and
     * code was rolled back. When {@code strict} is false, such event is delivered as
     * {@link CommittedEvent#unreadable(AggregateEventMetadata) unreadable}, keeping its version.
     *
     * @param dataSource datasource to use
     * @param schema statements for tables
     * @param serialization event serialization
     * @param handler transaction handling, {@link #LOCAL_HANDLER} or {@link #CONTAINER_HANDLER}
     * @param strict whether undeserializable events fail the read
     */
    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<AggregateEvent<?>> serialization,
            TxHandler handler, boolean strict) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.serialization = serialization;
        this.txHandler = handler;
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    protected AggregateEvent<?> checkCast(AggregateEvent<?> event) throws EventStoreException {
        AggregateEvent<?> cast = serialization.toSerializable(event);
        if (cast == null) {
            throw EventStoreException.unsupported(event);
        } else {
            return cast;
        }
    }

    protected String serializePayload(AggregateEvent<?> event) throws EventStoreException {
        try {
            return serialization.serialize(checkCast(event));
        } catch (RuntimeException e) {
            throw EventStoreException.serializationFailed(event, e);
        }
    }

    @Override
    public void write(List<UncommittedEvent> events, Cancellation cancellation) throws EventStoreException {
        List<AggregateBatch> batches = EventSequences.groupByAggregate(events);
        if (batches.isEmpty()) {
            return;
        }
        Map<UncommittedEvent, String> payloads = new IdentityHashMap<>();
        for (AggregateBatch batch : batches) {
            for (UncommittedEvent event : batch.getEvents()) {
                payloads.put(event, serializePayload(event.getEvent()));
            }
        }
        createTemplate(batches, payloads, cancellation).persist();
    }

    protected PersistTemplate createTemplate(List<AggregateBatch> batches, Map<UncommittedEvent, String> payloads,
            Cancellation cancellation) {
        return new PersistTemplate(batches, payloads, cancellation);
    }

    static boolean isConstraintViolation(SQLException e) {
        for (SQLException ex = e; ex != null; ex = ex.getNextException()) {
            if (ex instanceof SQLIntegrityConstraintViolationException
                    || (ex.getSQLState() != null && ex.getSQLState().startsWith("23"))) {
                return true;
            }
            if (ex.getCause() instanceof SQLException && ex.getCause() != ex.getNextException()
                    && isConstraintViolation((SQLException) ex.getCause())) {
                return true;
            }
        }
        return false;
    }

    protected class PersistTemplate {
        private final List<AggregateBatch> batches;
        private final Map<UncommittedEvent, String> payloads;
        private final Cancellation cancellation;
        private AggregateBatch current;

        protected PersistTemplate(List<AggregateBatch> batches, Map<UncommittedEvent, String> payloads,
                Cancellation cancellation) {
            this.batches = batches;
            this.payloads = payloads;
            this.cancellation = cancellation;
        }

        public void persist() throws EventStoreException {
            try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
                try {
                    if (connection.getMetaData().supportsTransactions()) {
                        persistAtomically(connection);
                    } else {
                        persistSeparately(connection);
                    }
                    txHandler.commit(connection);
                } catch (SQLException | EventStoreException | RuntimeException e) {
                    txHandler.rollback(connection);
                    throw e;
                }
            } catch (SQLException ex) {
                if (current != null && isConstraintViolation(ex)) {
                    throw EventStoreException.outOfSync(current.getAggregateId(), current.getStartVersion(),
                        current.getEndVersion(), ex);
                }
                throw EventStoreException.storeFailed(current == null ? "<none>"
                        : current.getAggregateId().toString(), ex);
            }
        }

        private void persistAtomically(Connection connection) throws SQLException, EventStoreException {
            for (AggregateBatch batch : batches) {
                current = batch;
                checkSourceVersion(connection, batch);
            }
            if (cancellation.isCancellationRequested()) {
                throw EventStoreException.cancelled();
            }
            for (AggregateBatch batch : batches) {
                current = batch;
                storeEvents(connection, batch);
                updateVersion(connection, batch);
            }
        }

        private void persistSeparately(Connection connection) throws SQLException, EventStoreException {
            if (batches.size() > 1) {
                logger.warn("Store does not support transactions, write of {} aggregates is not atomic",
                    batches.size());
            }
            if (cancellation.isCancellationRequested()) {
                throw EventStoreException.cancelled();
            }
            for (AggregateBatch batch : batches) {
                current = batch;
                checkSourceVersion(connection, batch);
                storeEvents(connection, batch);
                updateVersion(connection, batch);
            }
        }

        private void checkSourceVersion(Connection connection, AggregateBatch batch)
                throws SQLException, EventStoreException {
            String aggregateId = batch.getAggregateId().toString();
            try (PreparedStatement selectVersion = schema.selectAggregateVersion(connection, aggregateId);
                    ResultSet rs = selectVersion.executeQuery()) {
                if (!rs.next()) {
                    if (batch.getExpectedVersion() != 0) {
                        throw EventStoreException.outOfSync(batch.getAggregateId(), 0, batch.getStartVersion(),
                            batch.getEndVersion());
                    }
                    // first write of the aggregate
                    try (PreparedStatement createVersion = schema.createAggregateVersion(connection, aggregateId, 0)) {
                        createVersion.executeUpdate();
                    }
                } else {
                    long version = schema.readAggregateVersion(rs);
                    if (version != batch.getExpectedVersion()) {
                        logger.debug("Rejecting versions {}-{} of {}, stored version is {}", batch.getStartVersion(),
                            batch.getEndVersion(), aggregateId, version);
                        throw EventStoreException.outOfSync(batch.getAggregateId(), version, batch.getStartVersion(),
                            batch.getEndVersion());
                    }
                }
            }
        }

        private void storeEvents(Connection connection, AggregateBatch batch) throws SQLException {
            try (PreparedStatement insertEvent = schema.insertEvent(connection)) {
                for (UncommittedEvent event : batch.getEvents()) {
                    schema.prepareInsert(insertEvent, event.getMetadata(), payloads.get(event));
                    insertEvent.addBatch();
                }
                insertEvent.executeBatch();
            }
        }

        private void updateVersion(Connection connection, AggregateBatch batch)
                throws SQLException, EventStoreException {
            try (PreparedStatement updateVersion = schema.updateAggregateVersion(connection,
                batch.getAggregateId().toString(), batch.getExpectedVersion(), batch.getEndVersion())) {
                int result = updateVersion.executeUpdate();
                if (result != 1) {
                    throw EventStoreException.outOfSync(batch.getAggregateId(), batch.getStartVersion(),
                        batch.getEndVersion(), null);
                }
            }
        }
    }

    @Override
    public StoredEvents read(AggregateIdentity aggregateId, long versionStart, long versionEnd,
            Cancellation cancellation) {
        try {
            return new JdbcStoredEvents(aggregateId, versionStart, versionEnd == 0 ? Long.MAX_VALUE : versionEnd,
                cancellation);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    /**
     * Highest stored version of an aggregate.
     * @param aggregateId identity of the aggregate
     * @return stored version, 0 if the aggregate has no events
     */
    public long storedVersion(AggregateIdentity aggregateId) {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.selectAggregateVersion(connection, aggregateId.toString());
                ResultSet rs = st.executeQuery()) {
            return rs.next() ? schema.readAggregateVersion(rs) : 0;
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    class JdbcStoredEvents implements StoredEvents {
        private final AggregateIdentity aggregateId;
        private final Cancellation cancellation;
        private Connection connection;
        private PreparedStatement statement;
        private ResultSet resultSet;
        private boolean iterating;
        private boolean stop;

        JdbcStoredEvents(AggregateIdentity aggregateId, long versionStart, long versionEnd,
                Cancellation cancellation) throws SQLException {
            this.aggregateId = aggregateId;
            this.cancellation = cancellation;
            try {
                connection = dataSource.getConnection();
                statement = schema.selectEvents(connection, aggregateId.toString(), versionStart, versionEnd);
                resultSet = statement.executeQuery();
            } catch (SQLException e) {
                close();
                throw e;
            }
        }

        @Override
        public void foreach(Consumer<? super CommittedEvent> consumer) {
            reduce(null, (r, e) -> {
                consumer.accept(e);
                return null;
            });
        }

        @Override
        public <R> R reduce(R initial, BiFunction<R, ? super CommittedEvent, R> reducer) {
            if (iterating) {
                throw new IllegalStateException("Iteration has already been done");
            }
            iterating = true;
            try {
                R result = initial;
                while (!stop && !cancellation.isCancellationRequested() && resultSet.next()) {
                    result = reducer.apply(result, readEvent());
                }
                return result;
            } catch (SQLException e) {
                throw new IllegalStateException("Cannot access datastore", e);
            }
        }

        private CommittedEvent readEvent() throws SQLException {
            AggregateEventMetadata metadata = schema.readEventMetadata(resultSet, aggregateId);
            AggregateEvent<?> event = serialization.deserialize(metadata.getEventTypeName(),
                metadata.getEventTypeVersion(), schema.readEventPayload(resultSet));
            if (event != null) {
                return new CommittedEvent(event, metadata);
            }
            if (isStrict()) {
                throw new IllegalStateException(aggregateId + " Could not deserialize event "
                        + metadata.getAggregateVersion() + " of type " + metadata.getEventTypeName() + " v"
                        + metadata.getEventTypeVersion());
            }
            logger.error("{} Could not deserialize event {} of type {} v{}", aggregateId,
                metadata.getAggregateVersion(), metadata.getEventTypeName(), metadata.getEventTypeVersion());
            return CommittedEvent.unreadable(metadata);
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

    /**
     * Transaction demarcation of writes.
     */
    public interface TxHandler {

        Connection enroll(Connection connection) throws SQLException;

        void commit(Connection connection) throws SQLException;

        void rollback(Connection connection) throws SQLException;
    }

    /**
     * Demarcates local JDBC transaction, when the database supports them.
     */
    public static final TxHandler LOCAL_HANDLER = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) throws SQLException {
            if (connection.getMetaData().supportsTransactions()) {
                connection.setAutoCommit(false);
            }
            return connection;
        }

        @Override
        public void commit(Connection connection) throws SQLException {
            if (!connection.getAutoCommit()) {
                connection.commit();
                connection.setAutoCommit(true);
            }
        }

        @Override
        public void rollback(Connection connection) throws SQLException {
            if (!connection.getAutoCommit()) {
                connection.rollback();
                connection.setAutoCommit(true);
            }
        }
    };

    /**
     * Leaves transaction demarcation to the caller, e.g. to a container managed transaction.
     */
    public static final TxHandler CONTAINER_HANDLER = new TxHandler() {
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
