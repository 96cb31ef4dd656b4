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

package org.sequent.eventstore.jdbc.internal;

import org.sequent.eventstore.api.QueryEventStore;
import org.sequent.eventstore.api.QuerySession;
import org.sequent.eventstore.jdbc.DocumentStore;

import java.util.Optional;

public class JdbcQuerySession implements QuerySession {
    protected final DocumentStore store;
    protected final String tenantId;
    private final QueryEventStore events;

    public JdbcQuerySession(DocumentStore store, String tenantId) {
        this.store = store;
        this.tenantId = tenantId;
        this.events = new JdbcQueryEventStore(store, tenantId);
    }

    @Override
    public String getTenantId() {
        return tenantId;
    }

    @Override
    public QueryEventStore events() {
        return events;
    }

    @Override
    public <T> Optional<T> load(Class<T> documentType, Object id) {
        return store.getDocuments().load(documentType, tenantId, id);
    }

    @Override
    public void close() {
        // Reads don't hold on to any connection
    }
}
