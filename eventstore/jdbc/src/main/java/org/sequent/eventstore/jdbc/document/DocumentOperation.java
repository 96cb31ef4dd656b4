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

package org.sequent.eventstore.jdbc.document;

import org.jspecify.annotations.Nullable;
import org.sequent.eventstore.jdbc.operation.StorageOperation;

/**
 * A pending write of one document.
 */
public interface DocumentOperation extends StorageOperation {

    Class<?> getDocumentType();

    String getTenantId();

    String getStoredId();

    /**
     * @return The document that will be stored, {@code null} if the document will be deleted.
     */
    @Nullable Object getDocument();
}
