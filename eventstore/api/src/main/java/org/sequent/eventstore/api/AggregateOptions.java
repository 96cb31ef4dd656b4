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
import java.util.StringJoiner;

/**
 * Options for {@link QueryEventStore#aggregateStream(Class, java.util.UUID, AggregateOptions)}.
 * Supplying a seed {@code state}, a {@code timestamp} or a {@code fromVersion} disables the use of cached snapshots.
 */
public final class AggregateOptions {
    private static final AggregateOptions NONE = new AggregateOptions(FetchOptions.none(), null);

    private final FetchOptions fetchOptions;
    private final @Nullable Object state;

    private AggregateOptions(FetchOptions fetchOptions, @Nullable Object state) {
        this.fetchOptions = fetchOptions;
        this.state = state;
    }

    public static AggregateOptions none() {
        return NONE;
    }

    public AggregateOptions maxVersion(long maxVersion) {
        return new AggregateOptions(fetchOptions.maxVersion(maxVersion), state);
    }

    public AggregateOptions timestamp(@Nullable OffsetDateTime timestamp) {
        return new AggregateOptions(fetchOptions.timestamp(timestamp), state);
    }

    public AggregateOptions fromVersion(long fromVersion) {
        return new AggregateOptions(fetchOptions.fromVersion(fromVersion), state);
    }

    /**
     * Start the aggregation from {@code state} instead of from scratch.
     */
    public AggregateOptions state(@Nullable Object state) {
        return new AggregateOptions(fetchOptions, state);
    }

    public FetchOptions getFetchOptions() {
        return fetchOptions;
    }

    public long getMaxVersion() {
        return fetchOptions.getMaxVersion();
    }

    public @Nullable OffsetDateTime getTimestamp() {
        return fetchOptions.getTimestamp();
    }

    public long getFromVersion() {
        return fetchOptions.getFromVersion();
    }

    public @Nullable Object getState() {
        return state;
    }

    /**
     * @return {@code true} if a cached snapshot may be used as the starting point of the aggregation.
     */
    public boolean isSnapshotEligible() {
        return state == null && fetchOptions.getTimestamp() == null && fetchOptions.getFromVersion() == 0;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", AggregateOptions.class.getSimpleName() + "[", "]")
                .add("fetchOptions=" + fetchOptions)
                .add("state=" + state)
                .toString();
    }
}
