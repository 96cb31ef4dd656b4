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
import org.sequent.eventstore.api.Event;
import org.sequent.eventstore.api.EventSerializer;
import org.sequent.eventstore.api.ExistingStreamIdCollisionException;
import org.sequent.eventstore.api.InvalidStreamException;
import org.sequent.eventstore.api.StreamAction;
import org.sequent.eventstore.api.UnexpectedStreamVersionException;
import org.sequent.eventstore.jdbc.schema.Tables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.Types;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Writes stream actions to the streams and events tables. Must be called inside a transaction, the version check
 * of an append holds a lock on the stream row until the transaction ends.
 */
public class StreamWriter {
    private static final Logger log = LoggerFactory.getLogger(StreamWriter.class);

    private final NamedParameterJdbcOperations jdbc;
    private final Tables tables;
    private final EventSerializer serializer;
    private final Clock clock;

    public StreamWriter(NamedParameterJdbcOperations jdbc, Tables tables, EventSerializer serializer, Clock clock) {
        this.jdbc = jdbc;
        this.tables = tables;
        this.serializer = serializer;
        this.clock = clock;
    }

    public void write(StreamAction stream) {
        OffsetDateTime now = Timestamps.now(clock);
        stream.setTimestamp(now);
        switch (stream.getActionType()) {
            case START -> start(stream, now);
            case APPEND -> append(stream, now);
        }
        log.debug("Wrote {} event(s) to stream {}, version is now {}", stream.getEvents().size(), stream.getStreamIdentity(), stream.getVersion());
    }

    /**
     * Read the version of the stream and lock the stream row until the current transaction ends.
     *
     * @return The version and archived flag of the stream, {@code null} if the stream doesn't exist.
     */
    public @Nullable LockedStream lockStream(Object streamIdentity, String tenantId) {
        List<Map<String, Object>> rows = jdbc.queryForList("SELECT version, is_archived FROM " + tables.streams() + " WHERE id = :id AND tenant_id = :tenantId FOR UPDATE",
                new MapSqlParameterSource().addValue("id", streamIdentity).addValue("tenantId", tenantId));
        if (rows.isEmpty()) {
            return null;
        }
        Map<String, Object> row = rows.get(0);
        return new LockedStream(((Number) row.get("version")).longValue(), Boolean.TRUE.equals(row.get("is_archived")));
    }

    private void start(StreamAction stream, OffsetDateTime now) {
        long version = stream.getEvents().size();
        try {
            jdbc.update("INSERT INTO " + tables.streams() + " (id, tenant_id, type, version, timestamp, created, is_archived) " +
                    "VALUES (:id, :tenantId, :type, :version, :timestamp, :created, FALSE)", streamParameters(stream, version, now));
        } catch (DuplicateKeyException e) {
            throw new ExistingStreamIdCollisionException(stream.getStreamIdentity(), stream.getTenantId(), e);
        }
        insertEvents(stream, 0, now);
        stream.setVersion(version);
    }

    private void append(StreamAction stream, OffsetDateTime now) {
        Object streamIdentity = stream.getStreamIdentity();
        LockedStream locked = lockStream(streamIdentity, stream.getTenantId());
        long currentVersion = locked == null ? 0 : locked.version();
        if (locked != null && locked.archived()) {
            throw new InvalidStreamException(streamIdentity, "Attempted to append event to archived stream with id '" + streamIdentity + "'");
        }

        Long expectedVersion = stream.getExpectedVersionOnServer();
        if (expectedVersion != null && expectedVersion != currentVersion) {
            throw new UnexpectedStreamVersionException(streamIdentity, expectedVersion, currentVersion);
        }

        long newVersion = currentVersion + stream.getEvents().size();
        if (locked == null) {
            try {
                jdbc.update("INSERT INTO " + tables.streams() + " (id, tenant_id, type, version, timestamp, created, is_archived) " +
                        "VALUES (:id, :tenantId, :type, :version, :timestamp, :created, FALSE)", streamParameters(stream, newVersion, now));
            } catch (DuplicateKeyException e) {
                throw new ExistingStreamIdCollisionException(streamIdentity, stream.getTenantId(), e);
            }
        } else {
            jdbc.update("UPDATE " + tables.streams() + " SET version = :version, timestamp = :timestamp WHERE id = :id AND tenant_id = :tenantId",
                    streamParameters(stream, newVersion, now));
        }
        insertEvents(stream, currentVersion, now);
        stream.setVersion(newVersion);
    }

    private void insertEvents(StreamAction stream, long currentVersion, OffsetDateTime now) {
        long version = currentVersion;
        for (Event event : stream.getEvents()) {
            version++;
            if (event.getId() == null) {
                event.setId(UUID.randomUUID());
            }
            if (stream.getId() != null) {
                event.setStreamId(stream.getId());
            } else {
                event.setStreamKey(stream.getKey());
            }
            event.setVersion(version);
            event.setTimestamp(now);
            event.setTenantId(stream.getTenantId());
            event.setSequence(insertEvent(event));
        }
    }

    private long insertEvent(Event event) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", event.getId())
                .addValue("streamId", event.getStreamIdentity())
                .addValue("version", event.getVersion())
                .addValue("data", serializer.toJson(event.getData()))
                .addValue("type", event.getEventTypeName())
                .addValue("javaType", event.getJavaTypeName())
                .addValue("timestamp", event.getTimestamp())
                .addValue("tenantId", event.getTenantId());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update("INSERT INTO " + tables.events() + " (id, stream_id, version, data, type, java_type, timestamp, tenant_id, is_archived) " +
                "VALUES (:id, :streamId, :version, :data, :type, :javaType, :timestamp, :tenantId, FALSE)", params, keyHolder, new String[]{"seq_id"});
        Number sequence = keyHolder.getKey();
        if (sequence == null) {
            throw new IllegalStateException("No sequence was generated for event " + event.getId());
        }
        return sequence.longValue();
    }

    private MapSqlParameterSource streamParameters(StreamAction stream, long version, OffsetDateTime now) {
        return new MapSqlParameterSource()
                .addValue("id", stream.getStreamIdentity())
                .addValue("tenantId", stream.getTenantId())
                .addValue("type", stream.getAggregateTypeName(), Types.VARCHAR)
                .addValue("version", version)
                .addValue("timestamp", now)
                .addValue("created", now);
    }

    public record LockedStream(long version, boolean archived) {
    }
}
