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

package org.sequent.subscription.daemon;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.sequent.domain.MembersJoined;
import org.sequent.domain.MonsterSlain;
import org.sequent.domain.QuestParty;
import org.sequent.domain.QuestStarted;
import org.sequent.eventstore.api.DocumentSession;
import org.sequent.eventstore.jdbc.DocumentStore;
import org.sequent.eventstore.jdbc.StoreOptions;
import org.sequent.eventstore.jdbc.TenancyStyle;
import org.sequent.eventstore.jdbc.projection.EventProjection;
import org.sequent.eventstore.jdbc.projection.ProjectionLifecycle;
import org.sequent.eventstore.jdbc.projection.ProjectionOptions;
import org.sequent.retry.RetryStrategy;
import org.sequent.testsupport.h2.H2DatabaseExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertAll;

@Timeout(value = 30, unit = SECONDS)
@DisplayNameGeneration(ReplaceUnderscores.class)
class ProjectionDaemonTest {

    @RegisterExtension
    static H2DatabaseExtension database = new H2DatabaseExtension();

    private static final Duration CATCH_UP_TIMEOUT = Duration.ofSeconds(10);

    private final UUID questId = UUID.randomUUID();
    private final List<ProjectionDaemon> daemons = new ArrayList<>();

    @AfterEach
    void close_daemons() {
        daemons.forEach(ProjectionDaemon::close);
    }

    @Nested
    class CatchingUp {

        @Test
        void applies_appended_events_to_async_projections() throws InterruptedException {
            // Given
            DocumentStore store = storeWith(ProjectionDaemonTest::questPartyAndMonsterTally);
            ProjectionDaemon daemon = daemonFor(store);
            daemon.startAll();

            // When
            append(store, new QuestStarted(questId, "Destroy the ring"), new MembersJoined(questId, 1, "Hobbiton", "Frodo", "Sam"), new MonsterSlain(questId, "Troll"));
            daemon.catchUp(CATCH_UP_TIMEOUT);

            // Then
            assertAll(
                    () -> assertThat(store.querySession().load(QuestParty.class, questId)).hasValueSatisfying(party -> assertThat(party.getMembers()).containsExactly("Frodo", "Sam")),
                    () -> assertThat(monstersSlain()).isEqualTo(1),
                    () -> assertThat(daemon.progress().fetchProgress(new ShardName("QuestParty"))).isEqualTo(3),
                    () -> assertThat(daemon.progress().fetchProgress(new ShardName("MonsterTally"))).isEqualTo(3)
            );
        }

        @Test
        void projections_are_updated_in_the_background() {
            // Given
            DocumentStore store = storeWith(ProjectionDaemonTest::questPartyAndMonsterTally);
            daemonFor(store).startAll();

            // When
            append(store, new QuestStarted(questId, "Destroy the ring"));
            append(store, new MembersJoined(questId, 5, "Rivendell", "Aragorn"));

            // Then
            await().atMost(10, SECONDS).untilAsserted(() ->
                    assertThat(store.querySession().load(QuestParty.class, questId)).hasValueSatisfying(party -> assertThat(party.getMembers()).containsExactly("Aragorn")));
        }

        @Test
        void events_are_read_in_pages() throws InterruptedException {
            // Given
            DocumentStore store = storeWith(ProjectionDaemonTest::questPartyAndMonsterTally);
            ProjectionDaemon daemon = daemonFor(store, settings().batchSize(2));
            daemon.startAll();

            // When
            append(store, new QuestStarted(questId, "Destroy the ring"));
            for (int i = 0; i < 7; i++) {
                append(store, new MonsterSlain(questId, "Orc " + i));
            }
            daemon.catchUp(CATCH_UP_TIMEOUT);

            // Then
            assertAll(
                    () -> assertThat(monstersSlain()).isEqualTo(7),
                    () -> assertThat(store.querySession().load(QuestParty.class, questId)).hasValueSatisfying(party -> assertThat(party.getMonstersSlain()).isEqualTo(7))
            );
        }

        @Test
        void resumes_from_the_recorded_progress_after_a_restart() throws InterruptedException {
            // Given
            DocumentStore store = storeWith(ProjectionDaemonTest::questPartyAndMonsterTally);
            ProjectionDaemon first = daemonFor(store);
            first.startAll();
            append(store, new QuestStarted(questId, "Destroy the ring"), new MonsterSlain(questId, "Troll"));
            first.catchUp(CATCH_UP_TIMEOUT);
            first.close();

            // When
            append(store, new MonsterSlain(questId, "Balrog"));
            ProjectionDaemon second = daemonFor(store);
            second.startAll();
            second.catchUp(CATCH_UP_TIMEOUT);

            // Then
            assertThat(monstersSlain()).isEqualTo(2);
        }

        @Test
        void keeps_tenants_apart() throws InterruptedException {
            // Given
            StoreOptions options = StoreOptions.forDataSource(database.getDataSource()).tenancy(TenancyStyle.CONJOINED);
            options.projections().add(QuestProjections.questParty(), ProjectionLifecycle.ASYNC);
            DocumentStore store = new DocumentStore(options);
            ProjectionDaemon daemon = daemonFor(store);
            daemon.startAll();

            // When
            try (DocumentSession session = store.lightweightSession("shire")) {
                session.events().startStream(questId, new QuestStarted(questId, "Destroy the ring"), new MembersJoined(questId, 1, "Hobbiton", "Frodo"));
                session.saveChanges();
            }
            try (DocumentSession session = store.lightweightSession("erebor")) {
                session.events().startStream(questId, new QuestStarted(questId, "Find the arkenstone"), new MembersJoined(questId, 1, "Bag End", "Bilbo"));
                session.saveChanges();
            }
            daemon.catchUp(CATCH_UP_TIMEOUT);

            // Then
            assertAll(
                    () -> assertThat(store.querySession("shire").load(QuestParty.class, questId)).hasValueSatisfying(party -> assertThat(party.getMembers()).containsExactly("Frodo")),
                    () -> assertThat(store.querySession("erebor").load(QuestParty.class, questId)).hasValueSatisfying(party -> assertThat(party.getMembers()).containsExactly("Bilbo"))
            );
        }
    }

    @Nested
    class Lifecycle {

        @Test
        void shards_are_stopped_until_they_are_started() {
            // Given
            DocumentStore store = storeWith(ProjectionDaemonTest::questPartyAndMonsterTally);

            // When
            ProjectionDaemon daemon = daemonFor(store);

            // Then
            assertAll(
                    () -> assertThat(daemon.shards()).containsExactly(new ShardName("QuestParty"), new ShardName("MonsterTally")),
                    () -> assertThat(daemon.statusFor("QuestParty")).isEqualTo(ShardStatus.STOPPED),
                    () -> assertThat(daemon.isRunning()).isFalse()
            );
        }

        @Test
        void stopped_shard_does_not_apply_new_events_until_it_is_started_again() throws InterruptedException {
            // Given
            DocumentStore store = storeWith(ProjectionDaemonTest::questPartyAndMonsterTally);
            ProjectionDaemon daemon = daemonFor(store);
            daemon.startAll();
            append(store, new QuestStarted(questId, "Destroy the ring"), new MonsterSlain(questId, "Troll"));
            daemon.catchUp(CATCH_UP_TIMEOUT);

            // When
            daemon.stopAgent("MonsterTally");
            append(store, new MonsterSlain(questId, "Balrog"));
            daemon.catchUp(CATCH_UP_TIMEOUT);

            // Then
            assertAll(
                    () -> assertThat(daemon.statusFor("MonsterTally")).isEqualTo(ShardStatus.STOPPED),
                    () -> assertThat(monstersSlain()).isEqualTo(1),
                    () -> assertThat(store.querySession().load(QuestParty.class, questId)).hasValueSatisfying(party -> assertThat(party.getMonstersSlain()).isEqualTo(2))
            );

            // When
            daemon.startAgent("MonsterTally");
            daemon.catchUp(CATCH_UP_TIMEOUT);

            // Then
            assertThat(monstersSlain()).isEqualTo(2);
        }

        @Test
        void unknown_projections_are_rejected() {
            // Given
            ProjectionDaemon daemon = daemonFor(storeWith(ProjectionDaemonTest::questPartyAndMonsterTally));

            // When
            Throwable throwable = catchThrowable(() -> daemon.startAgent("DragonHoard"));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessageContaining("DragonHoard");
        }

        @Test
        void closed_daemon_cannot_be_started() {
            // Given
            ProjectionDaemon daemon = daemonFor(storeWith(ProjectionDaemonTest::questPartyAndMonsterTally));
            daemon.close();

            // When
            Throwable throwable = catchThrowable(daemon::startAll);

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    class Failures {

        @Test
        void shard_is_paused_when_retries_are_exhausted_and_catch_up_times_out() {
            // Given
            DocumentStore store = storeWith(projections -> projections
                    .add(QuestProjections.questParty(), ProjectionLifecycle.ASYNC)
                    .add(new EventProjection("Doomed").project(MonsterSlain.class, (slain, documents) -> {
                        throw new IllegalStateException("Cannot project " + slain.getMonster());
                    }), ProjectionLifecycle.ASYNC));
            ProjectionDaemon daemon = daemonFor(store, settings().retryStrategy(RetryStrategy.fixed(10).maxAttempts(2)));
            daemon.startAll();

            // When
            append(store, new QuestStarted(questId, "Destroy the ring"), new MonsterSlain(questId, "Troll"));

            // Then
            await().atMost(10, SECONDS).untilAsserted(() -> assertThat(daemon.statusFor("Doomed")).isEqualTo(ShardStatus.PAUSED));
            Throwable throwable = catchThrowable(() -> daemon.catchUp(Duration.ofMillis(300)));
            assertAll(
                    () -> assertThat(throwable).isEqualTo(new CatchUpTimeoutException(Duration.ofMillis(300))),
                    () -> assertThat(daemon.progress().fetchProgress(new ShardName("Doomed"))).isZero(),
                    () -> assertThat(daemon.statusFor("QuestParty")).isEqualTo(ShardStatus.RUNNING),
                    () -> assertThat(store.querySession().load(QuestParty.class, questId)).hasValueSatisfying(party -> assertThat(party.getMonstersSlain()).isEqualTo(1))
            );
        }

        @Test
        void shard_continues_from_rewound_progress() throws InterruptedException {
            // Given
            DocumentStore store = storeWith(ProjectionDaemonTest::questPartyAndMonsterTally);
            append(store, new QuestStarted(questId, "Destroy the ring"), new MonsterSlain(questId, "Troll"));
            ProjectionDaemon daemon = daemonFor(store);
            daemon.progress().rewind(new ShardName("MonsterTally"), 2);

            // When
            daemon.startAll();
            append(store, new MonsterSlain(questId, "Balrog"));
            daemon.catchUp(CATCH_UP_TIMEOUT);

            // Then
            assertThat(monstersSlain()).isEqualTo(1);
        }

        @Test
        void running_shard_replays_events_when_its_progress_is_rewound() throws InterruptedException {
            // Given
            DocumentStore store = storeWith(ProjectionDaemonTest::questPartyAndMonsterTally);
            ProjectionDaemon daemon = daemonFor(store);
            daemon.startAll();
            append(store, new QuestStarted(questId, "Destroy the ring"), new MonsterSlain(questId, "Troll"));
            daemon.catchUp(CATCH_UP_TIMEOUT);

            // When
            daemon.progress().rewind(new ShardName("MonsterTally"), 0);
            daemon.catchUp(CATCH_UP_TIMEOUT);

            // Then
            assertAll(
                    () -> assertThat(daemon.statusFor("MonsterTally")).isEqualTo(ShardStatus.RUNNING),
                    () -> assertThat(daemon.progress().fetchProgress(new ShardName("MonsterTally"))).isEqualTo(2),
                    () -> assertThat(monstersSlain()).isEqualTo(2)
            );
        }

        @Test
        void page_is_discarded_and_shard_continues_from_progress_moved_by_someone_else_while_applying_it() throws InterruptedException {
            // Given
            CountDownLatch applying = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            AtomicBoolean blocked = new AtomicBoolean();
            List<String> committed = new CopyOnWriteArrayList<>();
            DocumentStore store = storeWith(projections -> projections.subscribe("Slayers", (events, context) -> {
                List<String> monsters = events.stream().map(event -> ((MonsterSlain) event.getData()).getMonster()).toList();
                if (monsters.contains("Balrog") && blocked.compareAndSet(false, true)) {
                    applying.countDown();
                    awaitUninterruptibly(release);
                }
                context.afterCommit(() -> committed.addAll(monsters));
            }, MonsterSlain.class));
            ProjectionDaemon daemon = daemonFor(store);
            daemon.startAll();
            append(store, new QuestStarted(questId, "Destroy the ring"), new MonsterSlain(questId, "Troll"));
            daemon.catchUp(CATCH_UP_TIMEOUT);

            // When
            append(store, new MonsterSlain(questId, "Balrog"), new MonsterSlain(questId, "Orc"));
            assertThat(applying.await(10, SECONDS)).isTrue();
            daemon.progress().rewind(new ShardName("Slayers"), 4);
            release.countDown();
            append(store, new MonsterSlain(questId, "Nazgul"));
            daemon.catchUp(CATCH_UP_TIMEOUT);

            // Then
            assertAll(
                    () -> assertThat(committed).containsExactly("Troll", "Nazgul"),
                    () -> assertThat(daemon.progress().fetchProgress(new ShardName("Slayers"))).isEqualTo(5),
                    () -> assertThat(daemon.statusFor("Slayers")).isEqualTo(ShardStatus.RUNNING)
            );
        }
    }

    @Nested
    class Subscriptions {

        @Test
        void subscription_receives_all_events_and_tracks_its_progress() throws InterruptedException {
            // Given
            List<Object> received = new CopyOnWriteArrayList<>();
            DocumentStore store = storeWith(projections -> projections.subscribe("Chronicle", (events, context) -> events.forEach(event -> received.add(event.getData()))));
            ProjectionDaemon daemon = daemonFor(store, settings().batchSize(2));
            daemon.startAll();
            QuestStarted started = new QuestStarted(questId, "Destroy the ring");
            MembersJoined joined = new MembersJoined(questId, 1, "Hobbiton", "Frodo");
            MonsterSlain slain = new MonsterSlain(questId, "Troll");

            // When
            append(store, started, joined);
            append(store, slain);
            daemon.catchUp(CATCH_UP_TIMEOUT);

            // Then
            assertAll(
                    () -> assertThat(daemon.shards()).containsExactly(new ShardName("Chronicle")),
                    () -> assertThat(received).containsExactly(started, joined, slain),
                    () -> assertThat(daemon.progress().fetchProgress(new ShardName("Chronicle"))).isEqualTo(3)
            );
        }

        @Test
        void subscription_only_receives_the_event_types_it_subscribes_to() throws InterruptedException {
            // Given
            List<Object> received = new CopyOnWriteArrayList<>();
            DocumentStore store = storeWith(projections -> projections.subscribe("Bounties", (events, context) -> events.forEach(event -> received.add(event.getData())), MonsterSlain.class));
            ProjectionDaemon daemon = daemonFor(store);
            daemon.startAll();

            // When
            append(store, new QuestStarted(questId, "Destroy the ring"), new MonsterSlain(questId, "Troll"), new MembersJoined(questId, 1, "Bree", "Aragorn"));
            daemon.catchUp(CATCH_UP_TIMEOUT);

            // Then
            assertAll(
                    () -> assertThat(received).containsExactly(new MonsterSlain(questId, "Troll")),
                    () -> assertThat(daemon.progress().fetchProgress(new ShardName("Bounties"))).isEqualTo(3)
            );
        }

        @Test
        void documents_stored_by_a_subscription_are_committed_with_its_progress() throws InterruptedException {
            // Given
            StoreOptions options = StoreOptions.forDataSource(database.getDataSource()).registerDocumentTypes(QuestParty.class);
            options.projections().subscribe("Herald", (events, context) -> events.stream()
                    .filter(event -> event.getData() instanceof QuestStarted)
                    .forEach(event -> context.store(QuestParty.start((QuestStarted) event.getData()))));
            DocumentStore store = new DocumentStore(options);
            ProjectionDaemon daemon = daemonFor(store);
            daemon.startAll();

            // When
            append(store, new QuestStarted(questId, "Destroy the ring"));
            daemon.catchUp(CATCH_UP_TIMEOUT);

            // Then
            assertThat(store.querySession().load(QuestParty.class, questId)).hasValueSatisfying(party -> assertThat(party.getName()).isEqualTo("Destroy the ring"));
        }
    }

    @Nested
    class Rebuild {

        @Test
        void rebuild_replaces_what_the_projection_produced_with_a_replay_of_all_events() throws InterruptedException {
            // Given
            DocumentStore store = storeWith(ProjectionDaemonTest::questPartyAndMonsterTally);
            ProjectionDaemon daemon = daemonFor(store);
            daemon.startAll();
            append(store, new QuestStarted(questId, "Destroy the ring"), new MonsterSlain(questId, "Troll"), new MonsterSlain(questId, "Balrog"));
            daemon.catchUp(CATCH_UP_TIMEOUT);
            database.jdbcTemplate().update("UPDATE monster_tally SET monsters = 99");
            database.jdbcTemplate().update("INSERT INTO monster_tally (quest_id, monsters) VALUES (?, 1)", UUID.randomUUID());

            // When
            daemon.rebuildProjection("MonsterTally", CATCH_UP_TIMEOUT);

            // Then
            assertAll(
                    () -> assertThat(monstersSlain()).isEqualTo(2),
                    () -> assertThat(database.jdbcTemplate().queryForObject("SELECT COUNT(*) FROM monster_tally", Integer.class)).isEqualTo(1),
                    () -> assertThat(daemon.statusFor("MonsterTally")).isEqualTo(ShardStatus.RUNNING),
                    () -> assertThat(daemon.progress().fetchProgress(new ShardName("MonsterTally"))).isEqualTo(3)
            );
        }

        @Test
        void rebuild_of_documents_starts_from_an_empty_table() throws InterruptedException {
            // Given
            DocumentStore store = storeWith(ProjectionDaemonTest::questPartyAndMonsterTally);
            ProjectionDaemon daemon = daemonFor(store);
            daemon.startAll();
            append(store, new QuestStarted(questId, "Destroy the ring"), new MembersJoined(questId, 1, "Hobbiton", "Frodo"));
            daemon.catchUp(CATCH_UP_TIMEOUT);
            UUID strayId = UUID.randomUUID();
            try (DocumentSession session = store.lightweightSession()) {
                session.store(QuestParty.start(new QuestStarted(strayId, "Stray")));
                session.saveChanges();
            }

            // When
            daemon.rebuildProjection("QuestParty", CATCH_UP_TIMEOUT);

            // Then
            assertAll(
                    () -> assertThat(store.querySession().load(QuestParty.class, strayId)).isEmpty(),
                    () -> assertThat(store.querySession().load(QuestParty.class, questId)).hasValueSatisfying(party -> assertThat(party.getMembers()).containsExactly("Frodo"))
            );
        }
    }

    private DocumentStore storeWith(Consumer<ProjectionOptions> configuration) {
        StoreOptions options = StoreOptions.forDataSource(database.getDataSource());
        configuration.accept(options.projections());
        return new DocumentStore(options);
    }

    private static void questPartyAndMonsterTally(ProjectionOptions projections) {
        projections.add(QuestProjections.questParty(), ProjectionLifecycle.ASYNC)
                .add(QuestProjections.monsterTally(), ProjectionLifecycle.ASYNC);
    }

    private static DaemonSettings settings() {
        return DaemonSettings.defaults()
                .pollingInterval(Duration.ofMillis(50))
                .highWaterPollingInterval(Duration.ofMillis(50))
                .catchUpPollingInterval(Duration.ofMillis(20));
    }

    private ProjectionDaemon daemonFor(DocumentStore store) {
        return daemonFor(store, settings());
    }

    private ProjectionDaemon daemonFor(DocumentStore store, DaemonSettings settings) {
        ProjectionDaemon daemon = new ProjectionDaemon(store, settings);
        daemons.add(daemon);
        return daemon;
    }

    private void append(DocumentStore store, Object... events) {
        try (DocumentSession session = store.lightweightSession()) {
            if (session.events().fetchStreamState(questId).isPresent()) {
                session.events().append(questId, events);
            } else {
                session.events().startStream(questId, events);
            }
            session.saveChanges();
        }
    }

    private static void awaitUninterruptibly(CountDownLatch latch) {
        try {
            if (!latch.await(10, SECONDS)) {
                throw new IllegalStateException("Timed out waiting to be released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static int monstersSlain() {
        return database.jdbcTemplate().queryForObject("SELECT monsters FROM monster_tally", Integer.class);
    }
}
