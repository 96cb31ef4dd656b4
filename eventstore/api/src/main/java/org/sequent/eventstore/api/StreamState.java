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
 * The current state of a stream as stored in the streams table.
 */
public final class StreamState {
    private final @Nullable UUID id;
    private final @Nullable String key;
    private final long version;
    private final @Nullable String aggregateTypeName;
    private final OffsetDateTime lastTimestamp;
    private final OffsetDateTime created;
    private final boolean archived;

    public StreamState(@Nullable UUID id, @Nullable String key, long version, @Nullable String aggregateTypeName,
                       OffsetDateTime lastTimestamp, OffsetDateTime created, boolean archived) {
        this.id = id;
        this.key = key;
        this.version = version;
        this.aggregateTypeName = aggregateTypeName;
        this.lastTimestamp = lastTimestamp;
        this.created = created;
        this.archived = archived;
    }

    public @Nullable UUID getId() {
        return id;
    }

    public @Nullable String getKey() {
        return key;
    }

    public long getVersion() {
        return version;
    }

    public @Nullable String getAggregateTypeName() {
        return aggregateTypeName;
    }

    public OffsetDateTime getLastTimestamp() {
        return lastTimestamp;
    }

    public OffsetDateTime getCreated() {
        return created;
    }

    public boolean isArchived() {
        return archived;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StreamState)) return false;
        StreamState that = (StreamState) o;
        return version == that.version && archived == that.archived && Objects.equals(id, that.id) && Objects.equals(key, that.key)
                && Objects.equals(aggregateTypeName, that.aggregateTypeName) && Objects.equals(lastTimestamp, that.lastTimestamp) && Objects.equals(created, that.created);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, key, version, aggregateTypeName, lastTimestamp, created, archived);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", StreamState.class.getSimpleName() + "[", "]")
                .add("id=" + id)
                .add("key='" + key + "'")
                .add("version=" + version)
                .add("aggregateTypeName='" + aggregateTypeName + "'")
                .add("lastTimestamp=" + lastTimestamp)
                .add("created=" + created)
                .add("archived=" + archived)
                .toString();
    }
}
