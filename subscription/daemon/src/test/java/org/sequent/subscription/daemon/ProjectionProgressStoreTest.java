package org.sequent.subscription.daemon;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.sequent.eventstore.jdbc.DocumentStore;
import org.sequent.eventstore.jdbc.StoreOptions;
import org.sequent.testsupport.h2.H2DatabaseExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ProjectionProgressStoreTest {

    @RegisterExtension
    static H2DatabaseExtension database = new H2DatabaseExtension();

    private static final ShardName QUEST_PARTY = new ShardName("QuestParty");

    private DocumentStore store;
    private ProjectionProgressStore progressStore;

    @BeforeEach
    void create_progress_store() {
        store = new DocumentStore(StoreOptions.forDataSource(database.getDataSource()));
        progressStore = new ProjectionProgressStore(store);
    }

    @Test
    void progress_is_zero_for_shards_that_have_not_processed_anything() {
        assertThat(progressStore.fetchProgress(QUEST_PARTY)).isZero();
    }

    @Test
    void rewind_moves_the_progress_regardless_of_where_it_is() {
        // Given
        progressStore.rewind(QUEST_PARTY, 42);

        // When
        progressStore.rewind(QUEST_PARTY, 7);

        // Then
        assertThat(progressStore.fetchProgress(QUEST_PARTY)).isEqualTo(7);
    }

    @Test
    void all_progress_leaves_out_the_high_water_mark() {
        // Given
        progressStore.rewind(QUEST_PARTY, 3);
        progressStore.rewind(new ShardName("MonsterTally"), 5);
        new HighWaterDetector(store, DaemonSettings.defaults()).detect();

        // When
        List<ShardState> progress = progressStore.allProgress();

        // Then
        assertThat(progress).extracting(ShardState::name, ShardState::sequence)
                .containsExactly(tuple("MonsterTally:All", 5L), tuple("QuestParty:All", 3L));
    }

    @Test
    void delete_progress_removes_every_version_of_the_projection_only() {
        // Given
        progressStore.rewind(QUEST_PARTY, 3);
        progressStore.rewind(new ShardName("QuestParty", ShardName.ALL, 2), 4);
        progressStore.rewind(new ShardName("Quest"), 5);

        // When
        progressStore.deleteProgress("QuestParty");

        // Then
        assertThat(progressStore.allProgress()).extracting(ShardState::name).containsExactly("Quest:All");
    }

    @Nested
    class ProgressOperations {

        @Test
        void insert_records_the_first_progress_of_a_shard() {
            // When
            progressStore.progressOperation(QUEST_PARTY, false, 0, 10).execute(store.getJdbc());

            // Then
            assertThat(progressStore.fetchProgress(QUEST_PARTY)).isEqualTo(10);
        }

        @Test
        void insert_fails_when_another_agent_already_recorded_progress() {
            // Given
            progressStore.rewind(QUEST_PARTY, 5);

            // When
            Throwable throwable = catchThrowable(() -> progressStore.progressOperation(QUEST_PARTY, false, 0, 10).execute(store.getJdbc()));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(ProgressionProgressOutOfOrderException.class),
                    () -> assertThat(progressStore.fetchProgress(QUEST_PARTY)).isEqualTo(5)
            );
        }

        @Test
        void update_moves_the_progress_from_the_floor_to_the_ceiling() {
            // Given
            progressStore.rewind(QUEST_PARTY, 5);

            // When
            progressStore.progressOperation(QUEST_PARTY, true, 5, 12).execute(store.getJdbc());

            // Then
            assertThat(progressStore.fetchProgress(QUEST_PARTY)).isEqualTo(12);
        }

        @Test
        void update_fails_when_the_progress_is_not_at_the_floor() {
            // Given
            progressStore.rewind(QUEST_PARTY, 8);

            // When
            Throwable throwable = catchThrowable(() -> progressStore.progressOperation(QUEST_PARTY, true, 5, 12).execute(store.getJdbc()));

            // Then
            assertAll(
                    () -> assertThat(throwable).isEqualTo(new ProgressionProgressOutOfOrderException(QUEST_PARTY, 5, 12)),
                    () -> assertThat(progressStore.fetchProgress(QUEST_PARTY)).isEqualTo(8)
            );
        }
    }
}
