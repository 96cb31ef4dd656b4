package org.sequent.subscription.daemon;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.sequent.domain.MonsterSlain;
import org.sequent.domain.QuestStarted;
import org.sequent.eventstore.api.DocumentSession;
import org.sequent.eventstore.api.Event;
import org.sequent.eventstore.api.EventSerializationException;
import org.sequent.eventstore.api.UnknownEventTypeException;
import org.sequent.eventstore.api.UnknownEventTypePolicy;
import org.sequent.eventstore.jdbc.DocumentStore;
import org.sequent.eventstore.jdbc.StoreOptions;
import org.sequent.testsupport.h2.H2DatabaseExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class EventLoaderTest {

    @RegisterExtension
    static H2DatabaseExtension database = new H2DatabaseExtension();

    private static final ShardName SHARD = new ShardName("QuestParty");

    private DocumentStore store;
    private EventLoader loader;
    private List<UUID> questIds;

    @BeforeEach
    void start_five_quests() {
        store = new DocumentStore(StoreOptions.forDataSource(database.getDataSource()).registerEventTypes(QuestStarted.class));
        loader = new EventLoader(store);
        questIds = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            UUID questId = UUID.randomUUID();
            try (DocumentSession session = store.lightweightSession()) {
                session.events().startStream(questId, new QuestStarted(questId, "Quest " + i));
                session.saveChanges();
            }
            questIds.add(questId);
        }
    }

    @Test
    void loads_the_events_between_the_floor_and_the_high_water_mark_in_order() {
        // When
        EventPage page = loader.load(request(1, 4, 10));

        // Then
        assertAll(
                () -> assertThat(page.events()).extracting(Event::getSequence).containsExactly(2L, 3L, 4L),
                () -> assertThat(page.events()).extracting(event -> event.getData(QuestStarted.class).getName()).containsExactly("Quest 2", "Quest 3", "Quest 4"),
                () -> assertThat(page.floor()).isEqualTo(1),
                () -> assertThat(page.ceiling()).isEqualTo(4)
        );
    }

    @Test
    void ceiling_is_the_last_loaded_sequence_when_the_page_is_full() {
        // When
        EventPage page = loader.load(request(0, 5, 2));

        // Then
        assertAll(
                () -> assertThat(page.events()).extracting(Event::getSequence).containsExactly(1L, 2L),
                () -> assertThat(page.ceiling()).isEqualTo(2)
        );
    }

    @Test
    void ceiling_is_the_high_water_mark_when_the_page_is_not_full() {
        // Given
        database.jdbcTemplate().update("DELETE FROM sq_events WHERE seq_id >= 4");

        // When
        EventPage page = loader.load(request(0, 5, 10));

        // Then
        assertAll(
                () -> assertThat(page.events()).hasSize(3),
                () -> assertThat(page.ceiling()).isEqualTo(5)
        );
    }

    @Test
    void empty_range_gives_an_empty_page() {
        // When
        EventPage page = loader.load(request(5, 5, 10));

        // Then
        assertAll(
                () -> assertThat(page.isEmpty()).isTrue(),
                () -> assertThat(page.advances()).isFalse(),
                () -> assertThat(page.ceiling()).isEqualTo(5)
        );
    }

    @Test
    void archived_events_are_not_loaded() {
        // Given
        try (DocumentSession session = store.lightweightSession()) {
            session.events().archiveStream(questIds.get(1));
            session.saveChanges();
        }

        // When
        EventPage page = loader.load(request(0, 5, 10));

        // Then
        assertThat(page.events()).extracting(Event::getSequence).containsExactly(1L, 3L, 4L, 5L);
    }

    @Nested
    class UnreadableEvents {

        @Test
        void events_of_unknown_types_are_skipped_and_counted() {
            // Given
            EventLoader otherLoader = new EventLoader(new DocumentStore(StoreOptions.forDataSource(database.getDataSource()).registerEventTypes(MonsterSlain.class)));

            // When
            EventPage page = otherLoader.load(request(0, 5, 10));

            // Then
            assertAll(
                    () -> assertThat(page.events()).isEmpty(),
                    () -> assertThat(page.skipped()).isEqualTo(5),
                    () -> assertThat(page.ceiling()).isEqualTo(5)
            );
        }

        @Test
        void events_of_unknown_types_fail_the_page_when_the_policy_is_fail() {
            // Given
            EventLoader otherLoader = new EventLoader(new DocumentStore(StoreOptions.forDataSource(database.getDataSource())));

            // When
            Throwable throwable = catchThrowable(() -> otherLoader.load(new EventRequest(0, 5, 10, SHARD, UnknownEventTypePolicy.FAIL, true)));

            // Then
            assertThat(throwable).isExactlyInstanceOf(UnknownEventTypeException.class);
        }

        @Test
        void events_that_cannot_be_deserialized_are_skipped_when_serialization_errors_are_skipped() {
            // Given
            database.jdbcTemplate().update("UPDATE sq_events SET data = 'not json' WHERE seq_id = 3");

            // When
            EventPage page = loader.load(request(0, 5, 10));

            // Then
            assertAll(
                    () -> assertThat(page.events()).extracting(Event::getSequence).containsExactly(1L, 2L, 4L, 5L),
                    () -> assertThat(page.skipped()).isEqualTo(1)
            );
        }

        @Test
        void events_that_cannot_be_deserialized_fail_the_page_otherwise() {
            // Given
            database.jdbcTemplate().update("UPDATE sq_events SET data = 'not json' WHERE seq_id = 3");

            // When
            Throwable throwable = catchThrowable(() -> loader.load(new EventRequest(0, 5, 10, SHARD, UnknownEventTypePolicy.SKIP, false)));

            // Then
            assertThat(throwable).isExactlyInstanceOf(EventSerializationException.class);
        }
    }

    private static EventRequest request(long floor, long highWater, int batchSize) {
        return new EventRequest(floor, highWater, batchSize, SHARD, UnknownEventTypePolicy.SKIP, true);
    }
}
