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
 * Hooks around {@link DocumentSession#saveChanges()}. Listeners registered with the store are called for every
 * session, listeners given when a session is opened only for that session. Neither is called when there's nothing to save.
 */
public interface DocumentSessionListener {

    /**
     * Called before the transaction starts. Changes made to {@code session} here are saved with the rest of the unit of work.
     */
    default void beforeSaveChanges(DocumentSession session) {
    }

    /**
     * Called once the transaction has been committed and the pending changes have been cleared.
     */
    default void afterCommit(DocumentSession session) {
    }
}
