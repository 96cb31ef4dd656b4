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
import org.sequent.eventstore.jdbc.schema.EventStoreSchema;
import org.sequent.eventstore.jdbc.schema.Tables;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Reads documents and creates the operations that write them. Every document type is stored as JSON in a table of its own.
 */
public class DocumentStorage {
    private final NamedParameterJdbcOperations jdbc;
    private final Tables tables;
    private final EventSerializer serializer;
    private final Clock clock;
    private final EventStoreSchema schema;
    private final boolean autoCreateTables;
    private final ConcurrentMap<Class<?>, DocumentMapping<?>> mappings = new ConcurrentHashMap<>();

    public DocumentStorage(NamedParameterJdbcOperations jdbc, Tables tables, EventSerializer serializer, Clock clock, EventStoreSchema schema, boolean autoCreateTables) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc cannot be null");
        this.tables = Objects.requireNonNull(tables, "tables cannot be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.schema = Objects.requireNonNull(schema, "schema cannot be null");
        this.autoCreateTables = autoCreateTables;
    }

    /**
     * @return The mapping of the document type. The table of the document is created the first time a mapping is requested.
     */
    @SuppressWarnings("unchecked")
    public <T> DocumentMapping<T> mappingFor(Class<T> documentType) {
        return (DocumentMapping<T>) mappings.computeIfAbsent(documentType, type -> {
            DocumentMapping<?> mapping = new DocumentMapping<>(type, tables);
            if (autoCreateTables) {
                schema.ensureDocumentTable(mapping.getTableName());
            }
            return mapping;
        });
    }

    public <T> Optional<T> load(Class<T> documentType, String tenantId, Object id) {
        Objects.requireNonNull(id, "Document id cannot be null");
        DocumentMapping<T> mapping = mappingFor(documentType);
        List<String> json = jdbc.queryForList("SELECT data FROM " + mapping.getTableName() + " WHERE tenant_id = :tenantId AND id = :id",
                new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("id", DocumentMapping.toStoredId(id)), String.class);
        return json.stream().findFirst().map(data -> serializer.fromJson(documentType, data));
    }

    public DocumentOperation upsert(Object document, String tenantId) {
        Objects.requireNonNull(document, "Document cannot be null");
        return new UpsertDocumentOperation(mappingFor(document.getClass()), serializer, clock, tenantId, document);
    }

    public DocumentOperation delete(Class<?> documentType, String tenantId, Object id) {
        Objects.requireNonNull(id, "Document id cannot be null");
        return new DeleteDocumentOperation(mappingFor(documentType), tenantId, DocumentMapping.toStoredId(id));
    }

    public DocumentOperation delete(Object document, String tenantId) {
        Objects.requireNonNull(document, "Document cannot be null");
        DocumentMapping<?> mapping = mappingFor(document.getClass());
        return new DeleteDocumentOperation(mapping, tenantId, mapping.storedIdOf(document));
    }

    /**
     * Delete every stored document of the given type, for all tenants.
     */
    public void deleteAll(Class<?> documentType) {
        jdbc.getJdbcOperations().update("DELETE FROM " + mappingFor(documentType).getTableName());
    }
}
