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

import java.util.UUID;
import java.util.function.Consumer;

/**
 * Write operations on event streams. Every operation is queued in the current session and executed in one
 * transaction when {@link DocumentSession#saveChanges()} is called.
 */
public interface EventOperations extends QueryEventStore {

    /**
     * Start a new stream. Fails with {@link ExistingStreamIdCollisionException} when the session is saved if the stream already exists.
     */
    StreamAction startStream(UUID streamId, Object... events);

    StreamAction startStream(String streamKey, Object... events);

    StreamAction startStream(Class<?> aggregateType, UUID streamId, Object... events);

    StreamAction startStream(Class<?> aggregateType, String streamKey, Object... events);

    /**
     * Start a new stream with a generated id. Only supported when streams are identified by {@link UUID}.
     */
    StreamAction startStream(Object... events);

    StreamAction startStream(Class<?> aggregateType, Object... events);

    /**
     * Append events to a stream. The stream is created if it doesn't exist. Appends to the same stream in the same
     * session are combined into one {@link StreamAction}.
     */
    StreamAction append(UUID streamId, Object... events);

    StreamAction append(String streamKey, Object... events);

    /**
     * Append events to a stream with an optimistic concurrency check.
     *
     * @param expectedVersion The version the stream is expected to have in the database <i>before</i> the events are appended.
     * @throws IllegalArgumentException         if {@code expectedVersion} is negative. Nothing is queued in that case.
     * @throws UnexpectedStreamVersionException when the session is saved and the stream doesn't have version {@code expectedVersion}.
     */
    StreamAction appendOptimistic(UUID streamId, long expectedVersion, Object... events);

    StreamAction appendOptimistic(String streamKey, long expectedVersion, Object... events);

    /**
     * Mark the stream and all its events as archived. Archived streams cannot be appended to.
     */
    void archiveStream(UUID streamId);

    void archiveStream(String streamKey);

    void unArchiveStream(UUID streamId);

    void unArchiveStream(String streamKey);

    /**
     * Delete the stream and all its events. The identity can be reused once the session has been saved.
     */
    void tombstoneStream(UUID streamId);

    void tombstoneStream(String streamKey);

    /**
     * Fetch the current state of an aggregate in order to append new events to its stream. When the session is saved
     * the stream must still have the version it had when it was fetched.
     */
    <T> EventStream<T> fetchForWriting(Class<T> aggregateType, UUID streamId);

    <T> EventStream<T> fetchForWriting(Class<T> aggregateType, String streamKey);

    /**
     * Same as {@link #fetchForWriting(Class, UUID)} but fails immediately with {@link UnexpectedStreamVersionException} if
     * the stream doesn't have {@code expectedVersion}.
     */
    <T> EventStream<T> fetchForWriting(Class<T> aggregateType, UUID streamId, long expectedVersion);

    <T> EventStream<T> fetchForWriting(Class<T> aggregateType, String streamKey, long expectedVersion);

    /**
     * Same as {@link #fetchForWriting(Class, UUID)} but locks the stream row until the session is saved or closed, so
     * that no other writer can append to the stream in the meantime.
     */
    <T> EventStream<T> fetchForExclusiveWriting(Class<T> aggregateType, UUID streamId);

    <T> EventStream<T> fetchForExclusiveWriting(Class<T> aggregateType, String streamKey);

    /**
     * Fetch the aggregate for writing, let {@code writer} append events and save the session.
     */
    <T> void writeToAggregate(Class<T> aggregateType, UUID streamId, Consumer<EventStream<T>> writer);

    <T> void writeToAggregate(Class<T> aggregateType, String streamKey, Consumer<EventStream<T>> writer);
}
