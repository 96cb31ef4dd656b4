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

package org.sequent.eventstore.jdbc.projection;

import org.jspecify.annotations.Nullable;
import org.sequent.eventstore.api.DocumentOperations;
import org.sequent.eventstore.api.StreamAction;
import org.sequent.eventstore.jdbc.operation.StorageOperation;

import java.util.Optional;

/**
 * What a projection can do while it's being applied. All writes are queued and executed in the transaction that applies the projection.
 */
public interface ProjectionContext extends DocumentOperations {

    String getTenantId();

    void queue(StorageOperation operation);

    /**
     * Execute the queued operations right away, within the current transaction, so that they're visible to subsequent reads.
     */
    void flush();

    /**
     * Run {@code action} once the transaction applying the projection has been committed. Nothing is run if it's rolled back.
     */
    void afterCommit(Runnable action);

    /**
     * @return The stream action that produced the events being applied. Only available when the projection is applied inline.
     */
    Optional<StreamAction> findStream(Object streamIdentity);

    /**
     * Cache {@code snapshot} on the stream row at the version the stream has after {@code stream} was written.
     */
    void updateSnapshot(StreamAction stream, @Nullable Object snapshot);

    /**
     * Set the {@code id} field of {@code document} if it has a compatible one.
     */
    void assignIdentity(Object document, Object id);
}
