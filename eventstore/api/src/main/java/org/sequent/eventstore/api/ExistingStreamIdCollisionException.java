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
 * Thrown when starting a stream whose id (or key) is already used by another stream.
 */
public class ExistingStreamIdCollisionException extends RuntimeException {
    public final Object streamIdentity;
    public final String tenantId;

    public ExistingStreamIdCollisionException(Object streamIdentity, String tenantId, Throwable cause) {
        super("Stream '" + streamIdentity + "' already exists for tenant '" + tenantId + "'", cause);
        this.streamIdentity = streamIdentity;
        this.tenantId = tenantId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExistingStreamIdCollisionException)) return false;
        ExistingStreamIdCollisionException that = (ExistingStreamIdCollisionException) o;
        return Objects.equals(streamIdentity, that.streamIdentity) && Objects.equals(tenantId, that.tenantId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamIdentity, tenantId);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ExistingStreamIdCollisionException.class.getSimpleName() + "[", "]")
                .add("streamIdentity=" + streamIdentity)
                .add("tenantId='" + tenantId + "'")
                .toString();
    }
}
