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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.UUID;
import java.util.function.Function;

/**
 * An aggregate fetched for writing together with the stream it was derived from. Events appended to the
 * {@code EventStream} are written with an optimistic concurrency check against {@link #getStartingVersion()}.
 */
public final class EventStream<T> {
    private final StreamAction streamAction;
    private final @Nullable T aggregate;
    private final long startingVersion;
    private final Function<Object, Event> eventWrapper;

    public EventStream(StreamAction streamAction, @Nullable T aggregate, long startingVersion, Function<Object, Event> eventWrapper) {
        Objects.requireNonNull(streamAction, StreamAction.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(eventWrapper, "Event wrapper cannot be null");
        this.streamAction = streamAction;
        this.aggregate = aggregate;
        this.startingVersion = startingVersion;
        this.eventWrapper = eventWrapper;
    }

    public @Nullable UUID getId() {
        return streamAction.getId();
    }

    public @Nullable String getKey() {
        return streamAction.getKey();
    }

    /**
     * @return The aggregate at the time it was fetched, {@code null} if the stream didn't exist.
     */
    public @Nullable T getAggregate() {
        return aggregate;
    }

    /**
     * @return The version of the stream when it was fetched, {@code 0} for a new stream.
     */
    public long getStartingVersion() {
        return startingVersion;
    }

    /**
     * @return The version the stream will have after the appended events have been written.
     */
    public long getCurrentVersion() {
        return startingVersion + streamAction.getEvents().size();
    }

    public List<Event> getEvents() {
        return streamAction.getEvents();
    }

    public EventStream<T> appendOne(Object event) {
        streamAction.addEvents(List.of(eventWrapper.apply(event)));
        return this;
    }

    public EventStream<T> appendMany(Object... events) {
        streamAction.addEvents(Arrays.stream(events).map(eventWrapper).toList());
        return this;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", EventStream.class.getSimpleName() + "[", "]")
                .add("stream=" + streamAction.getStreamIdentity())
                .add("startingVersion=" + startingVersion)
                .add("aggregate=" + aggregate)
                .toString();
    }
}
