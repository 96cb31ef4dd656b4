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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Thrown when a stream doesn't have the version that the writer expected. Nothing in the unit of work is written.
 */
public class UnexpectedStreamVersionException extends RuntimeException {
    public final Object streamIdentity;
    public final long expectedVersion;
    public final long actualVersion;

    public UnexpectedStreamVersionException(Object streamIdentity, long expectedVersion, long actualVersion) {
        super("Unexpected version for stream '" + streamIdentity + "', expected " + expectedVersion + " but was " + actualVersion);
        this.streamIdentity = streamIdentity;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnexpectedStreamVersionException)) return false;
        UnexpectedStreamVersionException that = (UnexpectedStreamVersionException) o;
        return expectedVersion == that.expectedVersion && actualVersion == that.actualVersion && Objects.equals(streamIdentity, that.streamIdentity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamIdentity, expectedVersion, actualVersion);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", UnexpectedStreamVersionException.class.getSimpleName() + "[", "]")
                .add("streamIdentity=" + streamIdentity)
                .add("expectedVersion=" + expectedVersion)
                .add("actualVersion=" + actualVersion)
                .toString();
    }
}
