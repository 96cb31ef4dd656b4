package org.sequent.eventstore.jdbc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.sequent.domain.QuestParty;
import org.sequent.domain.QuestStarted;
import org.sequent.eventstore.api.DocumentSession;
import org.sequent.eventstore.api.DocumentSessionListener;
import org.sequent.eventstore.api.ExistingStreamIdCollisionException;
import org.sequent.testsupport.h2.H2DatabaseExtension;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class DocumentSessionListenerTest {

    @RegisterExtension
    static H2DatabaseExtension database = new H2DatabaseExtension();

    private RecordingListener storeListener;
    private DocumentStore store;

    @BeforeEach
    void create_document_store() {
        storeListener = new RecordingListener("store");
        store = new DocumentStore(StoreOptions.forDataSource(database.getDataSource()).registerDocumentTypes(QuestParty.class).listeners(storeListener));
    }

    @Test
    void store_and_session_listeners_are_called_around_save_changes() {
        // Given
        RecordingListener sessionListener = new RecordingListener("session");
        UUID questId = UUID.randomUUID();

        // When
        try (DocumentSession session = store.lightweightSession(TenancyStyle.DEFAULT_TENANT_ID, List.of(sessionListener))) {
            session.store(QuestParty.start(new QuestStarted(questId, "Destroy the ring")));
            session.saveChanges();
        }

        // Then
        assertAll(
                () -> assertThat(storeListener.calls).containsExactly("store before save, pending=true", "store after commit, pending=false"),
                () -> assertThat(sessionListener.calls).containsExactly("session before save, pending=true", "session after commit, pending=false")
        );
    }

    @Test
    void listeners_are_not_called_when_there_is_nothing_to_save() {
        // When
        try (DocumentSession session = store.lightweightSession()) {
            session.saveChanges();
        }

        // Then
        assertThat(storeListener.calls).isEmpty();
    }

    @Test
    void documents_stored_before_save_are_saved_with_the_unit_of_work() {
        // Given
        UUID questId = UUID.randomUUID();
        UUID addedQuestId = UUID.randomUUID();
        QuestParty added = QuestParty.start(new QuestStarted(addedQuestId, "Added before save"));
        DocumentSessionListener adding = new DocumentSessionListener() {
            @Override
            public void beforeSaveChanges(DocumentSession session) {
                session.store(added);
            }
        };

        // When
        try (DocumentSession session = store.lightweightSession(TenancyStyle.DEFAULT_TENANT_ID, List.of(adding))) {
            session.store(QuestParty.start(new QuestStarted(questId, "Destroy the ring")));
            session.saveChanges();
        }

        // Then
        assertAll(
                () -> assertThat(store.querySession().load(QuestParty.class, questId)).isPresent(),
                () -> assertThat(store.querySession().load(QuestParty.class, addedQuestId)).hasValue(added)
        );
    }

    @Test
    void after_commit_is_not_called_when_saving_fails() {
        // Given
        UUID questId = UUID.randomUUID();
        try (DocumentSession session = store.lightweightSession()) {
            session.events().startStream(questId, new QuestStarted(questId, "Destroy the ring"));
            session.saveChanges();
        }
        storeListener.calls.clear();

        // When
        Throwable throwable;
        try (DocumentSession session = store.lightweightSession()) {
            session.events().startStream(questId, new QuestStarted(questId, "Destroy the ring again"));
            throwable = catchThrowable(session::saveChanges);
        }

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(ExistingStreamIdCollisionException.class),
                () -> assertThat(storeListener.calls).containsExactly("store before save, pending=true")
        );
    }

    private static class RecordingListener implements DocumentSessionListener {
        private final String name;
        private final List<String> calls = new CopyOnWriteArrayList<>();

        private RecordingListener(String name) {
            this.name = name;
        }

        @Override
        public void beforeSaveChanges(DocumentSession session) {
            calls.add(name + " before save, pending=" + session.hasPendingChanges());
        }

        @Override
        public void afterCommit(DocumentSession session) {
            calls.add(name + " after commit, pending=" + session.hasPendingChanges());
        }
    }
}
