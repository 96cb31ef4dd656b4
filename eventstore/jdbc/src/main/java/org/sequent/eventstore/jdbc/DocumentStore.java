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

package org.sequent.eventstore.jdbc;

import org.sequent.eventstore.api.DocumentSession;
import org.sequent.eventstore.api.DocumentSessionListener;
import org.sequent.eventstore.api.EventSerializer;
import org.sequent.eventstore.api.QuerySession;
import org.sequent.eventstore.jdbc.document.DocumentStorage;
import org.sequent.eventstore.jdbc.internal.EventReader;
import org.sequent.eventstore.jdbc.internal.InlineProjectionApplier;
import org.sequent.eventstore.jdbc.internal.JdbcDocumentSession;
import org.sequent.eventstore.jdbc.internal.JdbcQuerySession;
import org.sequent.eventstore.jdbc.projection.ProjectionOptions;
import org.sequent.eventstore.jdbc.schema.EventStoreSchema;
import org.sequent.eventstore.jdbc.schema.Tables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The entry point of the event store. Create one per database and open a session per unit of work:
 * <pre>
 * DocumentStore store = new DocumentStore(StoreOptions.forDataSource(dataSource));
 * try (DocumentSession session = store.lightweightSession()) {
 *     session.events().startStream(questId, new QuestStarted(questId, "Destroy the ring"));
 *     session.saveChanges();
 * }
 * </pre>
 * The store is thread-safe, sessions are not.
 */
public class DocumentStore {
    private static final Logger log = LoggerFactory.getLogger(DocumentStore.class);

    private final StoreOptions options;
    private final Tables tables;
    private final EventGraph eventGraph;
    private final NamedParameterJdbcTemplate jdbc;
    private final PlatformTransactionManager transactionManager;
    private final TransactionTemplate transactionTemplate;
    private final EventStoreSchema schema;
    private final DocumentStorage documents;
    private final EventReader eventReader;
    private final InlineProjectionApplier inlineProjections;

    public DocumentStore(StoreOptions options) {
        this.options = Objects.requireNonNull(options, StoreOptions.class.getSimpleName() + " cannot be null");
        this.tables = options.getTables();
        this.eventGraph = new EventGraph();
        this.jdbc = new NamedParameterJdbcTemplate(options.getDataSource());
        this.transactionManager = new DataSourceTransactionManager(options.getDataSource());
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.schema = new EventStoreSchema(jdbc.getJdbcOperations(), tables, options.getStreamIdentity());
        this.documents = new DocumentStorage(jdbc, tables, options.getSerializer(), options.getClock(), schema, options.isAutoCreateSchema());
        this.eventReader = new EventReader(eventGraph, options.getSerializer(), options.getStreamIdentity());

        ProjectionOptions projections = options.projections();
        this.inlineProjections = new InlineProjectionApplier(projections.inline());
        eventGraph.register(options.getEventTypes());
        eventGraph.register(projections.allEventTypes());

        if (options.isAutoCreateSchema()) {
            applyAllConfiguredChangesToDatabase();
        }
        log.info("Created document store with tables prefixed '{}', {} stream identity, {} tenancy, {} inline and {} async projection(s)",
                tables.getPrefix(), options.getStreamIdentity(), options.getTenancy(), projections.inline().size(), projections.async().size());
    }

    /**
     * Create the event tables, the tables of all registered and projected document types and the tables of flat table
     * projections, unless they already exist.
     */
    public void applyAllConfiguredChangesToDatabase() {
        schema.ensureEventTables();
        Set<Class<?>> documentTypes = new LinkedHashSet<>(options.getDocumentTypes());
        documentTypes.addAll(options.projections().allPublishedTypes());
        for (Class<?> documentType : documentTypes) {
            schema.ensureDocumentTable(documents.mappingFor(documentType).getTableName());
        }
        schema.execute(options.projections().allStorageDefinitions());
    }

    public DocumentSession lightweightSession() {
        return lightweightSession(TenancyStyle.DEFAULT_TENANT_ID);
    }

    public DocumentSession lightweightSession(String tenantId) {
        return lightweightSession(tenantId, List.of());
    }

    /**
     * Open a session with {@code sessionListeners} called after the listeners registered in {@link StoreOptions}.
     */
    public DocumentSession lightweightSession(String tenantId, List<DocumentSessionListener> sessionListeners) {
        List<DocumentSessionListener> listeners = new ArrayList<>(options.getListeners());
        listeners.addAll(sessionListeners);
        return new JdbcDocumentSession(this, requireTenant(tenantId), inlineProjections, listeners);
    }

    /**
     * Open a session that projections are applied to directly, without running the inline projections or the session listeners.
     */
    public JdbcDocumentSession projectionSession(String tenantId) {
        return new JdbcDocumentSession(this, requireTenant(tenantId), new InlineProjectionApplier(List.of()), List.of());
    }

    public QuerySession querySession() {
        return querySession(TenancyStyle.DEFAULT_TENANT_ID);
    }

    public QuerySession querySession(String tenantId) {
        return new JdbcQuerySession(this, requireTenant(tenantId));
    }

    public StoreOptions getOptions() {
        return options;
    }

    public Tables getTables() {
        return tables;
    }

    public EventGraph getEventGraph() {
        return eventGraph;
    }

    public NamedParameterJdbcOperations getJdbc() {
        return jdbc;
    }

    public PlatformTransactionManager getTransactionManager() {
        return transactionManager;
    }

    public TransactionTemplate getTransactionTemplate() {
        return transactionTemplate;
    }

    public DocumentStorage getDocuments() {
        return documents;
    }

    public EventReader getEventReader() {
        return eventReader;
    }

    public EventSerializer getSerializer() {
        return options.getSerializer();
    }

    public Clock getClock() {
        return options.getClock();
    }

    private String requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant id cannot be blank");
        } else if (options.getTenancy() == TenancyStyle.SINGLE && !TenancyStyle.DEFAULT_TENANT_ID.equals(tenantId)) {
            throw new IllegalArgumentException("Cannot open a session for tenant '" + tenantId + "' since the store isn't multi-tenanted");
        }
        return tenantId;
    }
}
