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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.sequent.domain.MembersDeparted;
import org.sequent.domain.MembersJoined;
import org.sequent.domain.MonsterSlain;
import org.sequent.domain.QuestEnded;
import org.sequent.domain.QuestParty;
import org.sequent.domain.QuestStarted;
import org.sequent.eventstore.api.AggregateOptions;
import org.sequent.eventstore.api.DocumentSession;
import org.sequent.eventstore.api.EventStream;
import org.sequent.eventstore.api.QueryEventStore;
import org.sequent.eventstore.api.UnexpectedStreamVersionException;
import org.sequent.eventstore.jdbc.projection.ProjectionLifecycle;
import org.sequent.testsupport.h2.H2DatabaseExtension;
import org.sequent.testsupport.time.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class AggregateStreamTest {

    @RegisterExtension
    static H2DatabaseExtension database = new H2DatabaseExtension();

    private MutableClock clock;
    private DocumentStore store;
    private UUID questId;

    @BeforeEach
    void create_document_store() {
        clock = MutableClock.startingAt(Instant.parse("2024-03-01T10:00:00Z"));
        StoreOptions options = StoreOptions.forDataSource(database.getDataSource()).clock(clock);
        options.projections().liveStreamAggregation(Quests.questPartyRules());
        store = new DocumentStore(options);
        questId = UUID.randomUUID();
    }

    @Nested
    class Live {

        @Test
        void aggregate_stream_folds_all_events_into_the_aggregate() {
            // Given
            write(new QuestStarted(questId, "Destroy the ring"), new MembersJoined(questId, 1, "Hobbiton", "Frodo", "Sam"),
                    new MembersJoined(questId, 5, "Rivendell", "Aragorn", "Gandalf"), new MembersDeparted(questId, 10, "Moria", "Gandalf"), new MonsterSlain(questId, "Balrog"));

            // When
            QuestParty party = events().aggregateStream(QuestParty.class, questId);

            // Then
            assertAll(
                    () -> assertThat(party.getId()).isEqualTo(questId),
                    () -> assertThat(party.getName()).isEqualTo("Destroy the ring"),
                    () -> assertThat(party.getMembers()).containsExactly("Frodo", "Sam", "Aragorn"),
                    () -> assertThat(party.getMonstersSlain()).isEqualTo(1)
            );
        }

        @Test
        void aggregate_stream_returns_null_when_the_stream_does_not_exist() {
            assertThat(events().aggregateStream(QuestParty.class, questId)).isNull();
        }

        @Test
        void aggregate_stream_returns_null_when_the_aggregate_is_deleted() {
            // Given
            write(new QuestStarted(questId, "Destroy the ring"), new QuestEnded(questId));

            // When
            QuestParty party = events().aggregateStream(QuestParty.class, questId);

            // Then
            assertThat(party).isNull();
        }

        @Test
        void aggregate_stream_stops_at_max_version() {
            // Given
            write(new QuestStarted(questId, "Destroy the ring"), new MembersJoined(questId, 1, "Hobbiton", "Frodo"), new MembersJoined(questId, 2, "Bree", "Aragorn"));

            // When
            QuestParty party = events().aggregateStream(QuestParty.class, questId, AggregateOptions.none().maxVersion(2));

            // Then
            assertThat(party.getMembers()).containsExactly("Frodo");
        }

        @Test
        void aggregate_stream_stops_at_timestamp() {
            // Given
            write(new QuestStarted(questId, "Destroy the ring"), new MembersJoined(questId, 1, "Hobbiton", "Frodo"));
            OffsetDateTime before = OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
            clock.advance(Duration.ofHours(1));
            write(new MembersJoined(questId, 2, "Bree", "Aragorn"));

            // When
            QuestParty party = events().aggregateStream(QuestParty.class, questId, AggregateOptions.none().timestamp(before));

            // Then
            assertThat(party.getMembers()).containsExactly("Frodo");
        }

        @Test
        void aggregate_stream_continues_from_the_supplied_state() {
            // Given
            write(new QuestStarted(questId, "Destroy the ring"), new MembersJoined(questId, 1, "Hobbiton", "Frodo"), new MembersJoined(questId, 2, "Bree", "Aragorn"));
            QuestParty state = QuestParty.start(new QuestStarted(questId, "Seeded")).join(new MembersJoined(questId, 1, "Hobbiton", "Frodo"));

            // When
            QuestParty party = events().aggregateStream(QuestParty.class, questId, AggregateOptions.none().state(state).fromVersion(3));

            // Then
            assertAll(
                    () -> assertThat(party.getName()).isEqualTo("Seeded"),
                    () -> assertThat(party.getMembers()).containsExactly("Frodo", "Aragorn")
            );
        }

        @Test
        void aggregate_stream_without_registered_aggregation_throws_IllegalArgumentException() {
            // When
            Throwable throwable = catchThrowable(() -> events().aggregateStream(String.class, questId));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessageContaining(String.class.getName());
        }
    }

    @Nested
    class InlineSnapshot {

        @BeforeEach
        void create_document_store_with_inline_snapshot() {
            StoreOptions options = StoreOptions.forDataSource(database.getDataSource()).tablePrefix("snap_");
            options.projections().snapshot(Quests.questPartyRules(), ProjectionLifecycle.INLINE);
            store = new DocumentStore(options);
        }

        @Test
        void the_snapshot_is_written_with_the_events() {
            // When
            write(new QuestStarted(questId, "Destroy the ring"), new MembersJoined(questId, 1, "Hobbiton", "Frodo"));

            // Then
            assertAll(
                    () -> assertThat(database.jdbcTemplate().queryForObject("SELECT snapshot_version FROM snap_streams WHERE id = ?", Long.class, questId)).isEqualTo(2),
                    () -> assertThat(store.querySession().load(QuestParty.class, questId)).hasValueSatisfying(party -> assertThat(party.getMembers()).containsExactly("Frodo"))
            );
        }

        @Test
        void aggregate_stream_starts_from_the_snapshot() {
            // Given
            write(new QuestStarted(questId, "Destroy the ring"), new MembersJoined(questId, 1, "Hobbiton", "Frodo"));
            replaceSnapshot(QuestParty.start(new QuestStarted(questId, "From snapshot")));
            DocumentStore withoutSnapshots = new DocumentStore(StoreOptions.forDataSource(database.getDataSource()).tablePrefix("snap_"));
            try (DocumentSession session = withoutSnapshots.lightweightSession()) {
                session.events().append(questId, new MembersJoined(questId, 2, "Bree", "Aragorn"));
                session.saveChanges();
            }

            // When
            QuestParty party = events().aggregateStream(QuestParty.class, questId);

            // Then
            assertAll(
                    () -> assertThat(party.getName()).isEqualTo("From snapshot"),
                    () -> assertThat(party.getMembers()).containsExactly("Aragorn")
            );
        }

        @Test
        void aggregate_stream_returns_the_snapshot_when_max_version_is_the_snapshot_version() {
            // Given
            write(new QuestStarted(questId, "Destroy the ring"), new MembersJoined(questId, 1, "Hobbiton", "Frodo"));
            replaceSnapshot(QuestParty.start(new QuestStarted(questId, "From snapshot")));

            // When
            QuestParty party = events().aggregateStream(QuestParty.class, questId, AggregateOptions.none().maxVersion(2));

            // Then
            assertThat(party.getName()).isEqualTo("From snapshot");
        }

        @Test
        void aggregate_stream_replays_all_events_when_max_version_is_before_the_snapshot() {
            // Given
            write(new QuestStarted(questId, "Destroy the ring"), new MembersJoined(questId, 1, "Hobbiton", "Frodo"), new MembersJoined(questId, 2, "Bree", "Aragorn"));
            replaceSnapshot(QuestParty.start(new QuestStarted(questId, "From snapshot")));

            // When
            QuestParty party = events().aggregateStream(QuestParty.class, questId, AggregateOptions.none().maxVersion(2));

            // Then
            assertAll(
                    () -> assertThat(party.getName()).isEqualTo("Destroy the ring"),
                    () -> assertThat(party.getMembers()).containsExactly("Frodo")
            );
        }

        @Test
        void deleting_the_aggregate_clears_the_snapshot() {
            // When
            write(new QuestStarted(questId, "Destroy the ring"), new QuestEnded(questId));

            // Then
            assertAll(
                    () -> assertThat(database.jdbcTemplate().queryForObject("SELECT snapshot FROM snap_streams WHERE id = ?", String.class, questId)).isNull(),
                    () -> assertThat(store.querySession().load(QuestParty.class, questId)).isEmpty(),
                    () -> assertThat(events().aggregateStream(QuestParty.class, questId)).isNull()
            );
        }

        private void replaceSnapshot(QuestParty snapshot) {
            database.jdbcTemplate().update("UPDATE snap_streams SET snapshot = ? WHERE id = ?", store.getSerializer().toJson(snapshot), questId);
        }
    }

    @Nested
    class FetchForWriting {

        @Test
        void fetch_for_writing_returns_the_aggregate_and_its_version() {
            // Given
            write(new QuestStarted(questId, "Destroy the ring"), new MembersJoined(questId, 1, "Hobbiton", "Frodo"));

            try (DocumentSession session = store.lightweightSession()) {
                // When
                EventStream<QuestParty> stream = session.events().fetchForWriting(QuestParty.class, questId);
                stream.appendOne(new MonsterSlain(questId, "Troll"));
                session.saveChanges();

                // Then
                assertAll(
                        () -> assertThat(stream.getAggregate().getMembers()).containsExactly("Frodo"),
                        () -> assertThat(stream.getStartingVersion()).isEqualTo(2),
                        () -> assertThat(stream.getCurrentVersion()).isEqualTo(3),
                        () -> assertThat(events().aggregateStream(QuestParty.class, questId).getMonstersSlain()).isEqualTo(1)
                );
            }
        }

        @Test
        void fetch_for_writing_a_new_stream_starts_it() {
            try (DocumentSession session = store.lightweightSession()) {
                // When
                EventStream<QuestParty> stream = session.events().fetchForWriting(QuestParty.class, questId);
                stream.appendMany(new QuestStarted(questId, "Destroy the ring"), new MembersJoined(questId, 1, "Hobbiton", "Frodo"));
                session.saveChanges();

                // Then
                assertAll(
                        () -> assertThat(stream.getAggregate()).isNull(),
                        () -> assertThat(events().fetchStreamState(questId)).hasValueSatisfying(state -> assertThat(state.getAggregateTypeName()).isEqualTo("QuestParty")),
                        () -> assertThat(events().aggregateStream(QuestParty.class, questId).getMembers()).containsExactly("Frodo")
                );
            }
        }

        @Test
        void saving_fails_when_the_stream_was_changed_after_it_was_fetched() {
            // Given
            write(new QuestStarted(questId, "Destroy the ring"));

            try (DocumentSession session = store.lightweightSession()) {
                EventStream<QuestParty> stream = session.events().fetchForWriting(QuestParty.class, questId);
                write(new MembersJoined(questId, 1, "Hobbiton", "Frodo"));

                // When
                stream.appendOne(new MonsterSlain(questId, "Troll"));
                Throwable throwable = catchThrowable(session::saveChanges);

                // Then
                assertAll(
                        () -> assertThat(throwable).isExactlyInstanceOf(UnexpectedStreamVersionException.class),
                        () -> assertThat(events().fetchStream(questId)).hasSize(2)
                );
            }
        }

        @Test
        void fetch_for_writing_with_an_unexpected_version_fails_immediately() {
            // Given
            write(new QuestStarted(questId, "Destroy the ring"));

            try (DocumentSession session = store.lightweightSession()) {
                // When
                Throwable throwable = catchThrowable(() -> session.events().fetchForWriting(QuestParty.class, questId, 4));

                // Then
                assertAll(
                        () -> assertThat(throwable).isExactlyInstanceOf(UnexpectedStreamVersionException.class),
                        () -> assertThat(((UnexpectedStreamVersionException) throwable).actualVersion).isEqualTo(1)
                );
            }
        }

        @Test
        void write_to_aggregate_appends_and_saves() {
            // Given
            write(new QuestStarted(questId, "Destroy the ring"));

            // When
            try (DocumentSession session = store.lightweightSession()) {
                session.events().writeToAggregate(QuestParty.class, questId, stream -> stream.appendOne(new MembersJoined(questId, 1, "Hobbiton", stream.getAggregate().getName() + " bearer")));
            }

            // Then
            assertThat(events().aggregateStream(QuestParty.class, questId).getMembers()).containsExactly("Destroy the ring bearer");
        }

        @Test
        void exclusive_writing_appends_to_the_locked_stream() {
            // Given
            write(new QuestStarted(questId, "Destroy the ring"));

            // When
            try (DocumentSession session = store.lightweightSession()) {
                EventStream<QuestParty> stream = session.events().fetchForExclusiveWriting(QuestParty.class, questId);
                stream.appendOne(new MembersJoined(questId, 1, "Hobbiton", "Frodo"));
                session.saveChanges();
            }

            // Then
            assertThat(events().fetchStream(questId)).hasSize(2);
        }

        @Test
        void closing_a_session_releases_the_exclusive_lock_without_writing() {
            // Given
            write(new QuestStarted(questId, "Destroy the ring"));
            try (DocumentSession session = store.lightweightSession()) {
                session.events().fetchForExclusiveWriting(QuestParty.class, questId).appendOne(new MonsterSlain(questId, "Troll"));
            }

            // When
            write(new MembersJoined(questId, 1, "Hobbiton", "Frodo"));

            // Then
            assertThat(events().aggregateStream(QuestParty.class, questId)).satisfies(party -> {
                assertThat(party.getMembers()).containsExactly("Frodo");
                assertThat(party.getMonstersSlain()).isZero();
            });
        }
    }

    private void write(Object... events) {
        try (DocumentSession session = store.lightweightSession()) {
            session.events().append(questId, events);
            session.saveChanges();
        }
    }

    private QueryEventStore events() {
        return store.querySession().events();
    }
}
