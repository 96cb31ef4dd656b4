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
import org.sequent.eventstore.api.EventOperations;
import org.sequent.eventstore.api.EventStream;
import org.sequent.eventstore.api.StreamAction;
import org.sequent.eventstore.api.StreamIdentity;
import org.sequent.eventstore.api.StreamState;
import org.sequent.eventstore.api.UnexpectedStreamVersionException;
import org.sequent.eventstore.jdbc.DocumentStore;
import org.sequent.eventstore.jdbc.operation.ArchiveStreamOperation;
import org.sequent.eventstore.jdbc.operation.TombstoneStreamOperation;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Queues stream actions and stream operations in the {@link WorkTracker} of a session. Nothing is written until the session is saved.
 */
public class JdbcEventOperations extends JdbcQueryEventStore implements EventOperations {
    private final JdbcDocumentSession session;
    private final WorkTracker workTracker;

    JdbcEventOperations(DocumentStore store, JdbcDocumentSession session, WorkTracker workTracker) {
        super(store, session.getTenantId());
        this.session = session;
        this.workTracker = workTracker;
    }

    @Override
    public StreamAction startStream(UUID streamId, Object... events) {
        return start(null, streamId, events);
    }

    @Override
    public StreamAction startStream(String streamKey, Object... events) {
        return start(null, streamKey, events);
    }

    @Override
    public StreamAction startStream(Class<?> aggregateType, UUID streamId, Object... events) {
        return start(aggregateType, streamId, events);
    }

    @Override
    public StreamAction startStream(Class<?> aggregateType, String streamKey, Object... events) {
        return start(aggregateType, streamKey, events);
    }

    @Override
    public StreamAction startStream(Object... events) {
        return start(null, generateStreamId(), events);
    }

    @Override
    public StreamAction startStream(Class<?> aggregateType, Object... events) {
        return start(aggregateType, generateStreamId(), events);
    }

    @Override
    public StreamAction append(UUID streamId, Object... events) {
        return appendTo(streamId, events);
    }

    @Override
    public StreamAction append(String streamKey, Object... events) {
        return appendTo(streamKey, events);
    }

    @Override
    public StreamAction appendOptimistic(UUID streamId, long expectedVersion, Object... events) {
        return appendOptimisticTo(streamId, expectedVersion, events);
    }

    @Override
    public StreamAction appendOptimistic(String streamKey, long expectedVersion, Object... events) {
        return appendOptimisticTo(streamKey, expectedVersion, events);
    }

    @Override
    public void archiveStream(UUID streamId) {
        workTracker.add(new ArchiveStreamOperation(store.getTables(), requireStreamIdentity(streamId), tenantId, true));
    }

    @Override
    public void archiveStream(String streamKey) {
        workTracker.add(new ArchiveStreamOperation(store.getTables(), requireStreamIdentity(streamKey), tenantId, true));
    }

    @Override
    public void unArchiveStream(UUID streamId) {
        workTracker.add(new ArchiveStreamOperation(store.getTables(), requireStreamIdentity(streamId), tenantId, false));
    }

    @Override
    public void unArchiveStream(String streamKey) {
        workTracker.add(new ArchiveStreamOperation(store.getTables(), requireStreamIdentity(streamKey), tenantId, false));
    }

    @Override
    public void tombstoneStream(UUID streamId) {
        workTracker.add(new TombstoneStreamOperation(store.getTables(), requireStreamIdentity(streamId), tenantId));
    }

    @Override
    public void tombstoneStream(String streamKey) {
        workTracker.add(new TombstoneStreamOperation(store.getTables(), requireStreamIdentity(streamKey), tenantId));
    }

    @Override
    public <T> EventStream<T> fetchForWriting(Class<T> aggregateType, UUID streamId) {
        return fetchForWriting(aggregateType, streamId, null, false);
    }

    @Override
    public <T> EventStream<T> fetchForWriting(Class<T> aggregateType, String streamKey) {
        return fetchForWriting(aggregateType, streamKey, null, false);
    }

    @Override
    public <T> EventStream<T> fetchForWriting(Class<T> aggregateType, UUID streamId, long expectedVersion) {
        return fetchForWriting(aggregateType, streamId, expectedVersion, false);
    }

    @Override
    public <T> EventStream<T> fetchForWriting(Class<T> aggregateType, String streamKey, long expectedVersion) {
        return fetchForWriting(aggregateType, streamKey, expectedVersion, false);
    }

    @Override
    public <T> EventStream<T> fetchForExclusiveWriting(Class<T> aggregateType, UUID streamId) {
        return fetchForWriting(aggregateType, streamId, null, true);
    }

    @Override
    public <T> EventStream<T> fetchForExclusiveWriting(Class<T> aggregateType, String streamKey) {
        return fetchForWriting(aggregateType, streamKey, null, true);
    }

    @Override
    public <T> void writeToAggregate(Class<T> aggregateType, UUID streamId, Consumer<EventStream<T>> writer) {
        writer.accept(fetchForWriting(aggregateType, streamId));
        session.saveChanges();
    }

    @Override
    public <T> void writeToAggregate(Class<T> aggregateType, String streamKey, Consumer<EventStream<T>> writer) {
        writer.accept(fetchForWriting(aggregateType, streamKey));
        session.saveChanges();
    }

    private StreamAction start(@Nullable Class<?> aggregateType, Object streamIdentity, Object[] events) {
        requireStreamIdentity(streamIdentity);
        List<Event> wrapped = wrap(events);
        StreamAction stream = workTracker.tryFindStream(streamIdentity)
                .map(existing -> existing.addEvents(wrapped))
                .orElseGet(() -> {
                    StreamAction started = StreamAction.start(streamIdentity, tenantId, wrapped);
                    workTracker.addStream(started);
                    return started;
                });
        if (aggregateType != null) {
            stream.setAggregateTypeName(store.getEventGraph().aggregateAliasFor(aggregateType));
        }
        return stream;
    }

    private StreamAction appendTo(Object streamIdentity, Object[] events) {
        requireStreamIdentity(streamIdentity);
        List<Event> wrapped = wrap(events);
        return workTracker.tryFindStream(streamIdentity)
                .map(existing -> existing.addEvents(wrapped))
                .orElseGet(() -> {
                    StreamAction appended = StreamAction.append(streamIdentity, tenantId, wrapped);
                    workTracker.addStream(appended);
                    return appended;
                });
    }

    private StreamAction appendOptimisticTo(Object streamIdentity, long expectedVersion, Object[] events) {
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("Expected version of stream " + streamIdentity + " cannot be negative (was " + expectedVersion + ")");
        }
        StreamAction stream = appendTo(streamIdentity, events);
        stream.setExpectedVersionOnServer(expectedVersion);
        return stream;
    }

    private <T> EventStream<T> fetchForWriting(Class<T> aggregateType, Object streamIdentity, @Nullable Long expectedVersion, boolean exclusive) {
        requireStreamIdentity(streamIdentity);
        long version;
        if (exclusive) {
            session.beginExclusiveTransaction();
            StreamWriter.LockedStream locked = session.streamWriter().lockStream(streamIdentity, tenantId);
            version = locked == null ? 0 : locked.version();
        } else {
            version = fetchState(streamIdentity).map(StreamState::getVersion).orElse(0L);
        }

        if (expectedVersion != null && expectedVersion != version) {
            throw new UnexpectedStreamVersionException(streamIdentity, expectedVersion, version);
        }

        T aggregate = version == 0 ? null : aggregateAt(aggregateType, streamIdentity, version);
        Optional<StreamAction> tracked = workTracker.tryFindStream(streamIdentity);
        StreamAction stream;
        if (tracked.isPresent()) {
            stream = tracked.get();
        } else {
            stream = version == 0 ? StreamAction.start(streamIdentity, tenantId, List.of()) : StreamAction.append(streamIdentity, tenantId, List.of());
            workTracker.addStream(stream);
        }
        if (version > 0) {
            stream.setExpectedVersionOnServer(version);
        }
        stream.setAggregateTypeName(store.getEventGraph().aggregateAliasFor(aggregateType));
        return new EventStream<>(stream, aggregate, version, store.getEventGraph()::wrap);
    }

    private <T> @Nullable T aggregateAt(Class<T> aggregateType, Object streamIdentity, long version) {
        AggregateOptions options = AggregateOptions.none().maxVersion(version);
        return streamIdentity instanceof UUID id ? aggregateStream(aggregateType, id, options) : aggregateStream(aggregateType, (String) streamIdentity, options);
    }

    private Object generateStreamId() {
        if (store.getOptions().getStreamIdentity() != StreamIdentity.AS_UUID) {
            throw new IllegalStateException("Stream ids can only be generated when streams are identified " + StreamIdentity.AS_UUID);
        }
        return UUID.randomUUID();
    }

    private List<Event> wrap(Object[] events) {
        Objects.requireNonNull(events, "Events cannot be null");
        return Arrays.stream(events).map(store.getEventGraph()::wrap).toList();
    }
}
