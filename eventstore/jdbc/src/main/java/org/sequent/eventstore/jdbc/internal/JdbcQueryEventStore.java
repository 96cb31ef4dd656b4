/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.sequent.eventstore.jdbc.internal;

import org.jspecify.annotations.Nullable;
import org.sequent.eventstore.api.AggregateOptions;
import org.sequent.eventstore.api.Event;
import org.sequent.eventstore.api.FetchOptions;
import org.sequent.eventstore.api.QueryEventStore;
import org.sequent.eventstore.api.StreamIdentity;
import org.sequent.eventstore.api.StreamState;
import org.sequent.eventstore.jdbc.DocumentStore;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads streams of one tenant.
 */
public class JdbcQueryEventStore implements QueryEventStore {
    private static final UUID NIL_UUID = new UUID(0, 0);

    protected final DocumentStore store;
    protected final String tenantId;
    private final Aggregator aggregator;

    public JdbcQueryEventStore(DocumentStore store, String tenantId) {
        this.store = Objects.requireNonNull(store, DocumentStore.class.getSimpleName() + " cannot be null");
        this.tenantId = Objects.requireNonNull(tenantId, "Tenant id cannot be null");
        this.aggregator = new Aggregator(store, this);
    }

    @Override
    public List<Event> fetchStream(UUID streamId, FetchOptions options) {
        return fetch(streamId, options);
    }

    @Override
    public List<Event> fetchStream(String streamKey, FetchOptions options) {
        return fetch(streamKey, options);
    }

    @Override
    public Optional<StreamState> fetchStreamState(UUID streamId) {
        return fetchState(streamId);
    }

    @Override
    public Optional<StreamState> fetchStreamState(String streamKey) {
        return fetchState(streamKey);
    }

    @Override
    public <T> @Nullable T aggregateStream(Class<T> aggregateType, UUID streamId, AggregateOptions options) {
        return aggregator.aggregate(aggregateType, requireStreamIdentity(streamId), options);
    }

    @Override
    public <T> @Nullable T aggregateStream(Class<T> aggregateType, String streamKey, AggregateOptions options) {
        return aggregator.aggregate(aggregateType, requireStreamIdentity(streamKey), options);
    }

    public String getTenantId() {
        return tenantId;
    }

    List<Event> fetch(Object streamIdentity, FetchOptions options) {
        requireStreamIdentity(streamIdentity);
        Objects.requireNonNull(options, FetchOptions.class.getSimpleName() + " cannot be null");
        MapSqlParameterSource parameters = new MapSqlParameterSource()
                .addValue("id", streamIdentity)
                .addValue("tenantId", tenantId);
        StringBuilder sql = new StringBuilder("SELECT ").append(EventReader.EVENT_COLUMNS).append(" FROM ").append(store.getTables().events())
                .append(" WHERE stream_id = :id AND tenant_id = :tenantId");
        if (options.getMaxVersion() > 0) {
            sql.append(" AND version <= :maxVersion");
            parameters.addValue("maxVersion", options.getMaxVersion());
        }
        if (options.getTimestamp() != null) {
            sql.append(" AND timestamp <= :timestamp");
            parameters.addValue("timestamp", options.getTimestamp());
        }
        if (options.getFromVersion() > 0) {
            sql.append(" AND version >= :fromVersion");
            parameters.addValue("fromVersion", options.getFromVersion());
        }
        sql.append(" ORDER BY version");

        EventReader reader = store.getEventReader();
        List<Event> events = new ArrayList<>();
        store.getJdbc().query(sql.toString(), parameters,
                (RowCallbackHandler) rs -> reader.read(rs, store.getOptions().getUnknownEventTypePolicy(), false).ifPresent(events::add));
        return events;
    }

    Optional<StreamState> fetchState(Object streamIdentity) {
        requireStreamIdentity(streamIdentity);
        boolean uuidIdentity = store.getOptions().getStreamIdentity() == StreamIdentity.AS_UUID;
        List<StreamState> states = store.getJdbc().query(
                "SELECT id, type, version, timestamp, created, is_archived FROM " + store.getTables().streams() + " WHERE id = :id AND tenant_id = :tenantId",
                new MapSqlParameterSource().addValue("id", streamIdentity).addValue("tenantId", tenantId),
                (rs, rowNum) -> new StreamState(
                        uuidIdentity ? rs.getObject("id", UUID.class) : null,
                        uuidIdentity ? null : rs.getString("id"),
                        rs.getLong("version"),
                        rs.getString("type"),
                        rs.getObject("timestamp", OffsetDateTime.class),
                        rs.getObject("created", OffsetDateTime.class),
                        rs.getBoolean("is_archived")));
        return states.stream().findFirst();
    }

    /**
     * @throws IllegalArgumentException If the identity is {@code null}, the nil UUID, a blank string or doesn't match the stream identity of the store.
     */
    protected Object requireStreamIdentity(Object streamIdentity) {
        if (streamIdentity == null) {
            throw new IllegalArgumentException("Stream identity cannot be null");
        } else if (NIL_UUID.equals(streamIdentity)) {
            throw new IllegalArgumentException("Stream id cannot be the nil UUID");
        } else if (streamIdentity instanceof String key && key.isBlank()) {
            throw new IllegalArgumentException("Stream key cannot be blank");
        }
        StreamIdentity identity = store.getOptions().getStreamIdentity();
        if (!identity.identityType().isInstance(streamIdentity)) {
            throw new IllegalArgumentException("The store identifies streams " + identity + " but got a " + streamIdentity.getClass().getSimpleName() + " (" + streamIdentity + ")");
        }
        return streamIdentity;
    }
}
