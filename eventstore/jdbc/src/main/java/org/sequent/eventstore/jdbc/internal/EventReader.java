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

import org.sequent.eventstore.api.Event;
import org.sequent.eventstore.api.EventSerializationException;
import org.sequent.eventstore.api.EventSerializer;
import org.sequent.eventstore.api.StreamIdentity;
import org.sequent.eventstore.api.UnknownEventTypeException;
import org.sequent.eventstore.api.UnknownEventTypePolicy;
import org.sequent.eventstore.jdbc.EventGraph;
import org.sequent.eventstore.jdbc.EventMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps rows of the events table to {@link Event}s. Events whose type cannot be resolved, or whose payload cannot be
 * deserialized, are either skipped or cause an exception depending on how the reader is called.
 */
public class EventReader {
    private static final Logger log = LoggerFactory.getLogger(EventReader.class);

    public static final String EVENT_COLUMNS = "seq_id, id, stream_id, version, data, type, java_type, timestamp, tenant_id, is_archived";

    private final EventGraph eventGraph;
    private final EventSerializer serializer;
    private final StreamIdentity streamIdentity;

    public EventReader(EventGraph eventGraph, EventSerializer serializer, StreamIdentity streamIdentity) {
        this.eventGraph = eventGraph;
        this.serializer = serializer;
        this.streamIdentity = streamIdentity;
    }

    /**
     * Read the event at the current row of {@code rs}.
     *
     * @return The event, or empty if it was skipped.
     * @throws UnknownEventTypeException    If the type cannot be resolved and {@code unknownEventTypePolicy} is {@link UnknownEventTypePolicy#FAIL}.
     * @throws EventSerializationException If the payload cannot be deserialized and {@code skipSerializationErrors} is {@code false}.
     */
    public Optional<Event> read(ResultSet rs, UnknownEventTypePolicy unknownEventTypePolicy, boolean skipSerializationErrors) throws SQLException {
        long sequence = rs.getLong("seq_id");
        String eventTypeName = rs.getString("type");
        String javaTypeName = rs.getString("java_type");

        Optional<EventMapping> mapping = javaTypeName == null ? Optional.empty() : eventGraph.resolve(javaTypeName);
        if (mapping.isEmpty()) {
            if (unknownEventTypePolicy == UnknownEventTypePolicy.FAIL) {
                throw new UnknownEventTypeException(sequence, eventTypeName, javaTypeName);
            }
            log.warn("Skipping event with sequence {} since its type '{}' ({}) is not registered", sequence, javaTypeName, eventTypeName);
            return Optional.empty();
        }

        Object data;
        try {
            data = serializer.fromJson(mapping.get().eventType(), rs.getString("data"));
        } catch (EventSerializationException e) {
            if (!skipSerializationErrors) {
                throw e;
            }
            log.warn("Skipping event with sequence {} since it could not be deserialized to {}", sequence, javaTypeName, e);
            return Optional.empty();
        }

        Event event = new Event(data, eventTypeName, javaTypeName);
        event.setSequence(sequence);
        event.setId(rs.getObject("id", UUID.class));
        if (streamIdentity == StreamIdentity.AS_UUID) {
            event.setStreamId(rs.getObject("stream_id", UUID.class));
        } else {
            event.setStreamKey(rs.getString("stream_id"));
        }
        event.setVersion(rs.getLong("version"));
        event.setTimestamp(rs.getObject("timestamp", OffsetDateTime.class));
        event.setTenantId(rs.getString("tenant_id"));
        event.setArchived(rs.getBoolean("is_archived"));
        return Optional.of(event);
    }
}
