/*
 *
 *  Copyright 2024 Johan Haleby
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package org.sequent.subscription.daemon;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.sequent.domain.QuestStarted;
import org.sequent.eventstore.api.DocumentSession;
import org.sequent.eventstore.jdbc.DocumentStore;
import org.sequent.eventstore.jdbc.StoreOptions;
import org.sequent.testsupport.h2.H2DatabaseExtension;
import org.sequent.testsupport.time.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class HighWaterDetectorTest {

    @RegisterExtension
    static H2DatabaseExtension database = new H2DatabaseExtension();

    private MutableClock clock;
    private DocumentStore store;
    private HighWaterDetector detector;

    @BeforeEach
    void create_detector() {
        clock = MutableClock.startingAt(Instant.parse("2024-03-01T10:00:00Z"));
        store = new DocumentStore(StoreOptions.forDataSource(database.getDataSource()).clock(clock));
        detector = new HighWaterDetector(store, DaemonSettings.defaults().staleSequenceThreshold(Duration.ofSeconds(3)));
    }

    @Test
    void mark_is_zero_when_there_are_no_events() {
        // When
        HighWaterStatistics statistics = detector.detect();

        // Then
        assertAll(
                () -> assertThat(statistics.currentMark()).isZero(),
                () -> assertThat(statistics.highestSequence()).isZero(),
                () -> assertThat(persistedMark()).isZero()
        );
    }

    @Test
    void mark_follows_contiguous_sequences_to_the_highest_one() {
        // Given
        startQuests(4);

        // When
        HighWaterStatistics statistics = detector.detect();

        // Then
        assertAll(
                () -> assertThat(statistics.lastMark()).isZero(),
                () -> assertThat(statistics.currentMark()).isEqualTo(4),
                () -> assertThat(statistics.hasChanged()).isTrue(),
                () -> assertThat(statistics.includesSkipping()).isFalse(),
                () -> assertThat(persistedMark()).isEqualTo(4)
        );
    }

    @Test
    void mark_stops_before_the_first_gap() {
        // Given
        startQuestsWithGapAt(4, 6);

        // When
        HighWaterStatistics statistics = detector.detect();

        // Then
        assertAll(
                () -> assertThat(statistics.currentMark()).isEqualTo(3),
                () -> assertThat(statistics.highestSequence()).isEqualTo(6),
                () -> assertThat(statistics.hasGap()).isTrue(),
                () -> assertThat(persistedMark()).isEqualTo(3)
        );
    }

    @Test
    void mark_never_moves_backwards() {
        // Given
        startQuests(2);
        database.jdbcTemplate().update("INSERT INTO sq_event_progression (name, last_seq_id, last_updated) VALUES ('HighWaterMark', 10, CURRENT_TIMESTAMP)");

        // When
        HighWaterStatistics statistics = detector.detect();

        // Then
        assertAll(
                () -> assertThat(statistics.currentMark()).isEqualTo(10),
                () -> assertThat(persistedMark()).isEqualTo(10)
        );
    }

    @Nested
    class SafeZone {

        @Test
        void skips_a_gap_that_has_been_open_longer_than_the_stale_sequence_threshold() {
            // Given
            startQuestsWithGapAt(4, 10);
            detector.detect();
            clock.advance(Duration.ofSeconds(4));

            // When
            HighWaterStatistics statistics = detector.detectInSafeZone();

            // Then
            assertAll(
                    () -> assertThat(statistics.lastMark()).isEqualTo(3),
                    () -> assertThat(statistics.currentMark()).isEqualTo(10),
                    () -> assertThat(statistics.includesSkipping()).isTrue(),
                    () -> assertThat(persistedMark()).isEqualTo(10)
            );
        }

        @Test
        void keeps_waiting_for_a_gap_that_is_still_fresh() {
            // Given
            startQuestsWithGapAt(4, 10);
            detector.detect();
            clock.advance(Duration.ofSeconds(1));

            // When
            HighWaterStatistics statistics = detector.detectInSafeZone();

            // Then
            assertAll(
                    () -> assertThat(statistics.currentMark()).isEqualTo(3),
                    () -> assertThat(statistics.includesSkipping()).isFalse()
            );
        }

        @Test
        void does_not_skip_when_no_mark_has_been_persisted_yet() {
            // Given
            startQuestsWithGapAt(2, 5);

            // When
            HighWaterStatistics statistics = detector.detectInSafeZone();

            // Then
            assertAll(
                    () -> assertThat(statistics.currentMark()).isEqualTo(1),
                    () -> assertThat(statistics.includesSkipping()).isFalse(),
                    () -> assertThat(persistedMark()).isEqualTo(1)
            );
        }
    }

    private List<UUID> startQuests(int count) {
        List<UUID> questIds = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            UUID questId = UUID.randomUUID();
            try (DocumentSession session = store.lightweightSession()) {
                session.events().startStream(questId, new QuestStarted(questId, "Quest " + i));
                session.saveChanges();
            }
            questIds.add(questId);
        }
        return questIds;
    }

    // Rolled back appends leave holes in the sequence, removing an event has the same effect
    private void startQuestsWithGapAt(int missingSequence, int count) {
        startQuests(count);
        database.jdbcTemplate().update("DELETE FROM sq_events WHERE seq_id = ?", missingSequence);
    }

    private long persistedMark() {
        return new ProjectionProgressStore(store).fetch(HighWaterDetector.HIGH_WATER_MARK).map(ShardState::sequence).orElseThrow();
    }
}
