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

import org.sequent.eventstore.api.EventSerializer;
import org.sequent.eventstore.jdbc.internal.Timestamps;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;

import java.time.Clock;
import java.util.StringJoiner;

/**
 * Inserts a document, or replaces it if it already exists. The document is serialized when the operation is executed.
 */
public class UpsertDocumentOperation implements DocumentOperation {
    private final DocumentMapping<?> mapping;
    private final EventSerializer serializer;
    private final Clock clock;
    private final String tenantId;
    private final String storedId;
    private final Object document;

    UpsertDocumentOperation(DocumentMapping<?> mapping, EventSerializer serializer, Clock clock, String tenantId, Object document) {
        this.mapping = mapping;
        this.serializer = serializer;
        this.clock = clock;
        this.tenantId = tenantId;
        this.storedId = mapping.storedIdOf(document);
        this.document = document;
    }

    @Override
    public void execute(NamedParameterJdbcOperations jdbc) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", storedId)
                .addValue("tenantId", tenantId)
                .addValue("data", serializer.toJson(document))
                .addValue("lastModified", Timestamps.now(clock));
        String table = mapping.getTableName();
        int updated = jdbc.update("UPDATE " + table + " SET data = :data, last_modified = :lastModified WHERE tenant_id = :tenantId AND id = :id", params);
        if (updated == 0) {
            jdbc.update("INSERT INTO " + table + " (id, tenant_id, data, last_modified) VALUES (:id, :tenantId, :data, :lastModified)", params);
        }
    }

    @Override
    public Class<?> getDocumentType() {
        return mapping.getDocumentType();
    }

    @Override
    public String getTenantId() {
        return tenantId;
    }

    @Override
    public String getStoredId() {
        return storedId;
    }

    @Override
    public Object getDocument() {
        return document;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", UpsertDocumentOperation.class.getSimpleName() + "[", "]")
                .add("table=" + mapping.getTableName())
                .add("id='" + storedId + "'")
                .add("tenantId='" + tenantId + "'")
                .toString();
    }
}
