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

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read operations on event streams. Use the {@link UUID} variants when the store is configured with
 * {@link StreamIdentity#AS_UUID} and the {@link String} variants when it's configured with {@link StreamIdentity#AS_STRING}.
 */
public interface QueryEventStore {

    /**
     * @return All events of the stream ordered by version, including archived events. An empty list if the stream doesn't exist.
     */
    default List<Event> fetchStream(UUID streamId) {
        return fetchStream(streamId, FetchOptions.none());
    }

    List<Event> fetchStream(UUID streamId, FetchOptions options);

    default List<Event> fetchStream(String streamKey) {
        return fetchStream(streamKey, FetchOptions.none());
    }

    List<Event> fetchStream(String streamKey, FetchOptions options);

    Optional<StreamState> fetchStreamState(UUID streamId);

    Optional<StreamState> fetchStreamState(String streamKey);

    /**
     * Replay the events of a stream into an aggregate of type {@code T}. Nothing is written to the database.
     *
     * @return The aggregate or {@code null} if the stream has no events in range or if the aggregate was deleted by one of the events.
     */
    default <T> @Nullable T aggregateStream(Class<T> aggregateType, UUID streamId) {
        return aggregateStream(aggregateType, streamId, AggregateOptions.none());
    }

    <T> @Nullable T aggregateStream(Class<T> aggregateType, UUID streamId, AggregateOptions options);

    default <T> @Nullable T aggregateStream(Class<T> aggregateType, String streamKey) {
        return aggregateStream(aggregateType, streamKey, AggregateOptions.none());
    }

    <T> @Nullable T aggregateStream(Class<T> aggregateType, String streamKey, AggregateOptions options);

    /**
     * @return The latest state of the aggregate, using the cached snapshot when the aggregate is projected inline.
     */
    default <T> @Nullable T fetchLatest(Class<T> aggregateType, UUID streamId) {
        return aggregateStream(aggregateType, streamId);
    }

    default <T> @Nullable T fetchLatest(Class<T> aggregateType, String streamKey) {
        return aggregateStream(aggregateType, streamKey);
    }
}
