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

import org.jspecify.annotations.Nullable;
import org.sequent.eventstore.api.DocumentSession;
import org.sequent.eventstore.api.DocumentSessionListener;
import org.sequent.eventstore.api.EventOperations;
import org.sequent.eventstore.api.StreamAction;
import org.sequent.eventstore.jdbc.DocumentStore;
import org.sequent.eventstore.jdbc.document.DocumentMapping;
import org.sequent.eventstore.jdbc.document.DocumentOperation;
import org.sequent.eventstore.jdbc.operation.StorageOperation;
import org.sequent.eventstore.jdbc.operation.UpdateSnapshotOperation;
import org.sequent.eventstore.jdbc.projection.ProjectionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A unit of work. Stream actions and document operations are tracked in memory and written in one transaction by
 * {@link #saveChanges()}, together with the output of the inline projections. If saving fails nothing is written and
 * the pending work is kept.
 * <p>
 * A session is not thread-safe.
 */
public class JdbcDocumentSession extends JdbcQuerySession implements DocumentSession, ProjectionContext {
    private static final Logger log = LoggerFactory.getLogger(JdbcDocumentSession.class);

    private final WorkTracker workTracker = new WorkTracker();
    private final JdbcEventOperations events;
    private final InlineProjectionApplier inlineProjections;
    private final List<DocumentSessionListener> listeners;
    private @Nullable TransactionStatus exclusiveTransaction;

    public JdbcDocumentSession(DocumentStore store, String tenantId, InlineProjectionApplier inlineProjections, List<DocumentSessionListener> listeners) {
        super(store, tenantId);
        this.inlineProjections = inlineProjections;
        this.listeners = List.copyOf(listeners);
        this.events = new JdbcEventOperations(store, this, workTracker);
    }

    @Override
    public EventOperations events() {
        return events;
    }

    /**
     * Pending writes in this session take precedence over what's stored.
     */
    @Override
    public <T> Optional<T> load(Class<T> documentType, Object id) {
        Objects.requireNonNull(id, "Document id cannot be null");
        String storedId = DocumentMapping.toStoredId(id);
        List<StorageOperation> operations = workTracker.operations();
        for (int i = operations.size() - 1; i >= 0; i--) {
            if (operations.get(i) instanceof DocumentOperation operation && operation.getDocumentType().equals(documentType)
                    && operation.getTenantId().equals(tenantId) && operation.getStoredId().equals(storedId)) {
                return Optional.ofNullable(documentType.cast(operation.getDocument()));
            }
        }
        return super.load(documentType, id);
    }

    @Override
    public void store(Object document) {
        workTracker.add(store.getDocuments().upsert(document, tenantId));
    }

    @Override
    public <T> void delete(Class<T> documentType, Object id) {
        workTracker.add(store.getDocuments().delete(documentType, tenantId, id));
    }

    @Override
    public void delete(Object document) {
        workTracker.add(store.getDocuments().delete(document, tenantId));
    }

    @Override
    public void queue(StorageOperation operation) {
        workTracker.add(Objects.requireNonNull(operation, StorageOperation.class.getSimpleName() + " cannot be null"));
    }

    @Override
    public void flush() {
        for (StorageOperation operation : workTracker.takeUnexecutedOperations()) {
            operation.execute(store.getJdbc());
        }
    }

    @Override
    public void afterCommit(Runnable action) {
        Objects.requireNonNull(action, "Action cannot be null");
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            throw new IllegalStateException("After commit actions can only be registered while a projection is being applied");
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    @Override
    public Optional<StreamAction> findStream(Object streamIdentity) {
        return workTracker.tryFindStream(streamIdentity);
    }

    @Override
    public void updateSnapshot(StreamAction stream, @Nullable Object snapshot) {
        queue(new UpdateSnapshotOperation(store.getTables(), store.getSerializer(), stream.getStreamIdentity(), stream.getTenantId(), snapshot, stream.getVersion()));
    }

    @Override
    public void assignIdentity(Object document, Object id) {
        store.getDocuments().mappingFor(document.getClass()).assignId(document, id);
    }

    @Override
    public boolean hasPendingChanges() {
        return workTracker.hasOutstandingWork();
    }

    @Override
    public void saveChanges() {
        if (!workTracker.hasOutstandingWork() && exclusiveTransaction == null) {
            return;
        }

        WorkTracker.Savepoint savepoint = workTracker.savepoint();
        List<StreamAction> streams;
        try {
            listeners.forEach(listener -> listener.beforeSaveChanges(this));
            streams = List.copyOf(workTracker.streams());
            store.getTransactionTemplate().executeWithoutResult(status -> {
                StreamWriter writer = streamWriter();
                for (StreamAction stream : streams) {
                    if (WorkTracker.isWritable(stream)) {
                        writer.write(stream);
                    }
                }
                inlineProjections.apply(this, streams);
                flush();
            });
            commitExclusiveTransaction();
        } catch (RuntimeException e) {
            workTracker.rollbackTo(savepoint);
            rollbackExclusiveTransaction();
            throw e;
        }
        log.debug("Saved {} stream(s) for tenant {}", streams.size(), tenantId);
        workTracker.reset();
        listeners.forEach(listener -> listener.afterCommit(this));
    }

    @Override
    public void close() {
        rollbackExclusiveTransaction();
        workTracker.reset();
    }

    StreamWriter streamWriter() {
        return new StreamWriter(store.getJdbc(), store.getTables(), store.getSerializer(), store.getClock());
    }

    /**
     * Start the transaction that holds stream locks until the session is saved or closed. The transaction is bound to the calling thread.
     */
    void beginExclusiveTransaction() {
        if (exclusiveTransaction == null) {
            exclusiveTransaction = store.getTransactionManager().getTransaction(TransactionDefinition.withDefaults());
        }
    }

    private void commitExclusiveTransaction() {
        TransactionStatus transaction = exclusiveTransaction;
        if (transaction != null) {
            exclusiveTransaction = null;
            store.getTransactionManager().commit(transaction);
        }
    }

    private void rollbackExclusiveTransaction() {
        TransactionStatus transaction = exclusiveTransaction;
        if (transaction != null && !transaction.isCompleted()) {
            exclusiveTransaction = null;
            store.getTransactionManager().rollback(transaction);
        }
    }
}
