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
import java.util.Objects;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * The envelope of a domain event. The payload is kept in {@link #getData()}, everything else is metadata that is
 * either assigned when the event is wrapped (type names) or when the event is written to the database
 * (id, version, sequence, timestamp and tenant).
 */
public class Event {
    private long sequence;
    private @Nullable UUID id;
    private @Nullable UUID streamId;
    private @Nullable String streamKey;
    private long version;
    private String eventTypeName;
    private String javaTypeName;
    private final Object data;
    private @Nullable OffsetDateTime timestamp;
    private @Nullable String tenantId;
    private boolean archived;

    public Event(Object data, String eventTypeName, String javaTypeName) {
        Objects.requireNonNull(data, "Event data cannot be null");
        this.data = data;
        this.eventTypeName = eventTypeName;
        this.javaTypeName = javaTypeName;
    }

    public Object getData() {
        return data;
    }

    public <T> T getData(Class<T> type) {
        return type.cast(data);
    }

    public Class<?> getEventType() {
        return data.getClass();
    }

    /**
     * @return The global sequence number assigned by the database, {@code 0} until the event has been written.
     */
    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public @Nullable UUID getId() {
        return id;
    }

    public void setId(@Nullable UUID id) {
        this.id = id;
    }

    public @Nullable UUID getStreamId() {
        return streamId;
    }

    public void setStreamId(@Nullable UUID streamId) {
        this.streamId = streamId;
    }

    public @Nullable String getStreamKey() {
        return streamKey;
    }

    public void setStreamKey(@Nullable String streamKey) {
        this.streamKey = streamKey;
    }

    /**
     * @return The stream id or the stream key, depending on the {@link StreamIdentity} of the store.
     */
    public @Nullable Object getStreamIdentity() {
        return streamId != null ? streamId : streamKey;
    }

    /**
     * @return The 1-based position of this event in its stream.
     */
    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    /**
     * @return The stable alias of the event type, for example {@code quest_started}.
     */
    public String getEventTypeName() {
        return eventTypeName;
    }

    public void setEventTypeName(String eventTypeName) {
        this.eventTypeName = eventTypeName;
    }

    public String getJavaTypeName() {
        return javaTypeName;
    }

    public void setJavaTypeName(String javaTypeName) {
        this.javaTypeName = javaTypeName;
    }

    public @Nullable OffsetDateTime getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(@Nullable OffsetDateTime timestamp) {
        this.timestamp = timestamp;
    }

    public @Nullable String getTenantId() {
        return tenantId;
    }

    public void setTenantId(@Nullable String tenantId) {
        this.tenantId = tenantId;
    }

    public boolean isArchived() {
        return archived;
    }

    public void setArchived(boolean archived) {
        this.archived = archived;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", Event.class.getSimpleName() + "[", "]")
                .add("sequence=" + sequence)
                .add("id=" + id)
                .add("stream=" + getStreamIdentity())
                .add("version=" + version)
                .add("eventTypeName='" + eventTypeName + "'")
                .add("tenantId='" + tenantId + "'")
                .add("archived=" + archived)
                .add("data=" + data)
                .toString();
    }
}
