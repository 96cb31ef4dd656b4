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
 * Bounds applied when reading the events of a stream. Immutable, every method returns a new instance.
 * <pre>
 * FetchOptions.none().maxVersion(5).fromVersion(2);
 * </pre>
 */
public final class FetchOptions {
    private static final FetchOptions NONE = new FetchOptions(0, null, 0);

    private final long maxVersion;
    private final @Nullable OffsetDateTime timestamp;
    private final long fromVersion;

    private FetchOptions(long maxVersion, @Nullable OffsetDateTime timestamp, long fromVersion) {
        if (maxVersion < 0) {
            throw new IllegalArgumentException("maxVersion cannot be negative");
        }
        if (fromVersion < 0) {
            throw new IllegalArgumentException("fromVersion cannot be negative");
        }
        this.maxVersion = maxVersion;
        this.timestamp = timestamp;
        this.fromVersion = fromVersion;
    }

    public static FetchOptions none() {
        return NONE;
    }

    /**
     * Only include events with a version less than or equal to {@code maxVersion}. {@code 0} means no limit.
     */
    public FetchOptions maxVersion(long maxVersion) {
        return new FetchOptions(maxVersion, timestamp, fromVersion);
    }

    /**
     * Only include events written at or before {@code timestamp}.
     */
    public FetchOptions timestamp(@Nullable OffsetDateTime timestamp) {
        return new FetchOptions(maxVersion, timestamp, fromVersion);
    }

    /**
     * Only include events with a version greater than or equal to {@code fromVersion}. {@code 0} means from the start.
     */
    public FetchOptions fromVersion(long fromVersion) {
        return new FetchOptions(maxVersion, timestamp, fromVersion);
    }

    public long getMaxVersion() {
        return maxVersion;
    }

    public @Nullable OffsetDateTime getTimestamp() {
        return timestamp;
    }

    public long getFromVersion() {
        return fromVersion;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", FetchOptions.class.getSimpleName() + "[", "]")
                .add("maxVersion=" + maxVersion)
                .add("timestamp=" + timestamp)
                .add("fromVersion=" + fromVersion)
                .toString();
    }
}
