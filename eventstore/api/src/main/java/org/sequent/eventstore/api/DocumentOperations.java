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

import java.util.Optional;

/**
 * Storage of projected documents. Documents are identified by a field named {@code id}.
 */
public interface DocumentOperations {

    <T> Optional<T> load(Class<T> documentType, Object id);

    /**
     * Insert or replace the document. Written when the session is saved.
     */
    void store(Object document);

    <T> void delete(Class<T> documentType, Object id);

    void delete(Object document);
}
