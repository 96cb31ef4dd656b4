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

/**
 * A unit of work bound to one tenant. Stream actions and document operations are queued and then written atomically by {@link #saveChanges()}.
 */
public interface DocumentSession extends QuerySession, DocumentOperations {

    @Override
    EventOperations events();

    /**
     * Write all pending stream actions, inline projections and document operations in one transaction.
     * Nothing is written if any part fails.
     */
    void saveChanges();

    /**
     * @return {@code true} if there are stream actions or document operations that haven't been saved.
     */
    boolean hasPendingChanges();
}
