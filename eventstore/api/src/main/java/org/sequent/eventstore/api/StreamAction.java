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

package org.sequent.eventstore.api;

import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * A pending batch of events for one stream. Created by the session, written to the database when the session is saved.
 */
public class StreamAction {
    private final @Nullable UUID id;
    private final @Nullable String key;
    private final StreamActionType actionType;
    private final String tenantId;
    private final List<Event> events = new ArrayList<>();
    private @Nullable Long expectedVersionOnServer;
    private @Nullable String aggregateTypeName;
    private long version;
    private @Nullable OffsetDateTime timestamp;

    private StreamAction(@Nullable UUID id, @Nullable String key, StreamActionType actionType, String tenantId) {
        if (id == null && key == null) {
            throw new IllegalArgumentException("Either a stream id or a stream key must be defined");
        }
        Objects.requireNonNull(actionType, StreamActionType.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(tenantId, "Tenant id cannot be null");
        this.id = id;
        this.key = key;
        this.actionType = actionType;
        this.tenantId = tenantId;
    }

    /**
     * @param streamIdentity A {@link UUID} or a {@link String}
     */
    public static StreamAction start(Object streamIdentity, String tenantId, List<Event> events) {
        StreamAction action = create(streamIdentity, StreamActionType.START, tenantId);
        action.addEvents(events);
        return action;
    }

    /**
     * @param streamIdentity A {@link UUID} or a {@link String}
     */
    public static StreamAction append(Object streamIdentity, String tenantId, List<Event> events) {
        StreamAction action = create(streamIdentity, StreamActionType.APPEND, tenantId);
        action.addEvents(events);
        return action;
    }

    private static StreamAction create(Object streamIdentity, StreamActionType actionType, String tenantId) {
        if (streamIdentity instanceof UUID uuid) {
            return new StreamAction(uuid, null, actionType, tenantId);
        } else if (streamIdentity instanceof String key) {
            return new StreamAction(null, key, actionType, tenantId);
        }
        throw new IllegalArgumentException("Stream identity must be a UUID or a String but was " + (streamIdentity == null ? null : streamIdentity.getClass().getName()));
    }

    public StreamAction addEvents(List<Event> events) {
        this.events.addAll(events);
        return this;
    }

    public @Nullable UUID getId() {
        return id;
    }

    public @Nullable String getKey() {
        return key;
    }

    public Object getStreamIdentity() {
        return id != null ? id : key;
    }

    public boolean hasIdentity(Object streamIdentity) {
        return getStreamIdentity().equals(streamIdentity);
    }

    public StreamActionType getActionType() {
        return actionType;
    }

    public String getTenantId() {
        return tenantId;
    }

    public List<Event> getEvents() {
        return Collections.unmodifiableList(events);
    }

    /**
     * @return The version the stream is expected to have before this action is applied, {@code null} if any version is accepted.
     */
    public @Nullable Long getExpectedVersionOnServer() {
        return expectedVersionOnServer;
    }

    public void setExpectedVersionOnServer(@Nullable Long expectedVersionOnServer) {
        this.expectedVersionOnServer = expectedVersionOnServer;
    }

    public @Nullable String getAggregateTypeName() {
        return aggregateTypeName;
    }

    public void setAggregateTypeName(@Nullable String aggregateTypeName) {
        this.aggregateTypeName = aggregateTypeName;
    }

    /**
     * @return The version of the stream after this action has been written.
     */
    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    public @Nullable OffsetDateTime getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(@Nullable OffsetDateTime timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", StreamAction.class.getSimpleName() + "[", "]")
                .add("stream=" + getStreamIdentity())
                .add("actionType=" + actionType)
                .add("tenantId='" + tenantId + "'")
                .add("expectedVersionOnServer=" + expectedVersionOnServer)
                .add("events=" + events.size())
                .add("version=" + version)
                .toString();
    }
}
