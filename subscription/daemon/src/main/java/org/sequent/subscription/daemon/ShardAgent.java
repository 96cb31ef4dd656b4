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

import org.jspecify.annotations.Nullable;
import org.sequent.eventstore.api.Event;
import org.sequent.eventstore.jdbc.DocumentStore;
import org.sequent.eventstore.jdbc.internal.JdbcDocumentSession;
import org.sequent.eventstore.jdbc.projection.ProjectionSource;
import org.sequent.retry.RetryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Applies the events below the high water mark to one projection, a page at a time. Each page is applied in one
 * transaction together with the progress of the shard, so a page is either fully applied and recorded or not at all.
 */
public class ShardAgent implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ShardAgent.class);

    private final ShardName shardName;
    private final ProjectionSource projection;
    private final DocumentStore store;
    private final ProjectionProgressStore progressStore;
    private final EventLoader eventLoader;
    private final HighWaterAgent highWater;
    private final DaemonSettings settings;
    private final RetryStrategy retryStrategy;
    private final AtomicReference<ShardStatus> status = new AtomicReference<>(ShardStatus.STOPPED);

    private volatile long position;
    private volatile @Nullable Throwable lastError;

    public ShardAgent(ProjectionSource projection, DocumentStore store, ProjectionProgressStore progressStore, EventLoader eventLoader,
                      HighWaterAgent highWater, DaemonSettings settings) {
        this.projection = Objects.requireNonNull(projection, ProjectionSource.class.getSimpleName() + " cannot be null");
        this.shardName = ShardName.forProjection(projection);
        this.store = store;
        this.progressStore = progressStore;
        this.eventLoader = eventLoader;
        this.highWater = highWater;
        this.settings = settings;
        RetryStrategy configured = settings.getRetryStrategy();
        this.retryStrategy = configured instanceof RetryStrategy.Retry retry
                ? retry.onError((info, throwable) -> log.warn("Failed to apply events to {} (attempt {})", shardName.identity(), info.getAttemptNumber(), throwable))
                : configured;
    }

    /**
     * Mark the agent as starting. Returns {@code false} if it's already starting or running.
     */
    boolean prepareStart() {
        ShardStatus current = status.get();
        return current != ShardStatus.STARTING && current != ShardStatus.RUNNING && current != ShardStatus.STOPPING
                && status.compareAndSet(current, ShardStatus.STARTING);
    }

    @Override
    public void run() {
        if (!status.compareAndSet(ShardStatus.STARTING, ShardStatus.RUNNING)) {
            return;
        }
        lastError = null;
        log.info("Started shard {}", shardName.identity());
        try {
            position = progressStore.fetchProgress(shardName);
            while (status.get() == ShardStatus.RUNNING && !Thread.currentThread().isInterrupted()) {
                long mark = highWater.currentMark();
                if (mark <= position) {
                    highWater.awaitMarkBeyond(position, settings.getPollingInterval());
                    // The stored progress may have been rewound while idle
                    position = progressStore.fetchProgress(shardName);
                    continue;
                }
                position = retryStrategy.execute(() -> processPage(mark));
            }
            status.set(ShardStatus.STOPPED);
            log.info("Stopped shard {} at sequence {}", shardName.identity(), position);
        } catch (InterruptedException e) {
            status.set(ShardStatus.STOPPED);
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            lastError = e;
            status.set(ShardStatus.PAUSED);
            log.error("Paused shard {} at sequence {} since it failed to apply events", shardName.identity(), position, e);
        }
    }

    // Returns the new position of the shard
    private long processPage(long mark) {
        Optional<ShardState> progress = progressStore.fetch(shardName.identity());
        long floor = progress.map(ShardState::sequence).orElse(0L);
        EventPage page = eventLoader.load(new EventRequest(floor, mark, settings.getBatchSize(), shardName,
                store.getOptions().getUnknownEventTypePolicy(), settings.isSkipSerializationErrors()));
        if (!page.advances()) {
            return floor;
        }
        try {
            apply(page, progress.isPresent());
            return page.ceiling();
        } catch (ProgressionProgressOutOfOrderException e) {
            long actual = progressStore.fetchProgress(shardName);
            log.warn("Progress of {} was moved to {} by someone else while applying {} to {}, continuing from there",
                    shardName.identity(), actual, e.floor, e.ceiling);
            return actual;
        }
    }

    private void apply(EventPage page, boolean hasProgress) {
        store.getTransactionTemplate().executeWithoutResult(transaction -> {
            for (Map.Entry<String, List<Event>> tenantEvents : groupByTenant(page.events()).entrySet()) {
                try (JdbcDocumentSession session = store.projectionSession(tenantEvents.getKey())) {
                    projection.apply(session, tenantEvents.getValue());
                    session.saveChanges();
                }
            }
            progressStore.progressOperation(shardName, hasProgress, page.floor(), page.ceiling()).execute(store.getJdbc());
        });
        log.debug("Applied {} event(s) to {}, progress is now {}", page.events().size(), shardName.identity(), page.ceiling());
    }

    private static Map<String, List<Event>> groupByTenant(List<Event> events) {
        Map<String, List<Event>> byTenant = new LinkedHashMap<>();
        for (Event event : events) {
            byTenant.computeIfAbsent(event.getTenantId(), __ -> new ArrayList<>()).add(event);
        }
        return byTenant;
    }

    /**
     * Ask the agent to stop after the page it's applying. Does nothing unless it's running.
     */
    void requestStop() {
        if (status.compareAndSet(ShardStatus.RUNNING, ShardStatus.STOPPING) || status.compareAndSet(ShardStatus.STARTING, ShardStatus.STOPPED)) {
            log.debug("Stopping shard {}", shardName.identity());
        }
    }

    public ShardName getShardName() {
        return shardName;
    }

    public ProjectionSource getProjection() {
        return projection;
    }

    public ShardStatus getStatus() {
        return status.get();
    }

    public long getPosition() {
        return position;
    }

    /**
     * @return The error that paused the agent, or {@code null} if it isn't paused.
     */
    public @Nullable Throwable getLastError() {
        return lastError;
    }
}
