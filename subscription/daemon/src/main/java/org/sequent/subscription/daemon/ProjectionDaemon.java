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

import org.sequent.eventstore.jdbc.DocumentStore;
import org.sequent.eventstore.jdbc.projection.ProjectionLifecycle;
import org.sequent.eventstore.jdbc.projection.ProjectionSource;
import org.sequent.eventstore.jdbc.schema.Tables;
import org.sequent.subscription.daemon.internal.ExecutorShutdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the {@link ProjectionLifecycle#ASYNC asynchronous} projections of a {@link DocumentStore} up to date. Every
 * projection gets a {@link ShardAgent} that runs on a thread of its own, next to a {@link HighWaterAgent} that tells
 * the shards how far it's safe to read.
 * <pre>
 * try (ProjectionDaemon daemon = new ProjectionDaemon(store, DaemonSettings.defaults())) {
 *     daemon.startAll();
 *     ...
 *     daemon.catchUp(Duration.ofSeconds(10));
 * }
 * </pre>
 */
public class ProjectionDaemon implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProjectionDaemon.class);

    private final DocumentStore store;
    private final DaemonSettings settings;
    private final ExecutorService executor;
    private final HighWaterDetector detector;
    private final HighWaterAgent highWaterAgent;
    private final ProjectionProgressStore progressStore;
    private final Map<ShardName, ShardAgent> agents = new LinkedHashMap<>();

    private volatile boolean shutdown;

    public ProjectionDaemon(DocumentStore store, DaemonSettings settings) {
        if (store == null) {
            throw new IllegalArgumentException(DocumentStore.class.getSimpleName() + " cannot be null");
        } else if (settings == null) {
            throw new IllegalArgumentException(DaemonSettings.class.getSimpleName() + " cannot be null");
        }
        this.store = store;
        this.settings = settings;
        this.executor = Executors.newCachedThreadPool();
        this.detector = new HighWaterDetector(store, settings);
        this.highWaterAgent = new HighWaterAgent(detector, settings, store.getClock());
        this.progressStore = new ProjectionProgressStore(store);
        EventLoader eventLoader = new EventLoader(store);
        for (ProjectionSource projection : store.getOptions().projections().async()) {
            ShardAgent agent = new ShardAgent(projection, store, progressStore, eventLoader, highWaterAgent, settings);
            agents.put(agent.getShardName(), agent);
        }
        log.info("Created projection daemon for shards {} with {}", agents.keySet(), settings);
    }

    public synchronized void startAll() {
        for (ShardName shardName : agents.keySet()) {
            startAgent(shardName);
        }
    }

    public void startAgent(String projectionName) {
        startAgent(shardFor(projectionName));
    }

    /**
     * Start the agent of the shard, also if it's paused. Does nothing if it's already running.
     */
    public synchronized void startAgent(ShardName shardName) {
        requireNotShutdown();
        ShardAgent agent = agentFor(shardName);
        ensureHighWaterAgentIsRunning();
        if (agent.prepareStart()) {
            executor.execute(agent);
        }
    }

    /**
     * Stop the agent of the shard once it's done with its current page and wait for it.
     */
    public void stopAgent(ShardName shardName) {
        ShardAgent agent = agentFor(shardName);
        agent.requestStop();
        highWaterAgent.publish(highWaterAgent.currentStatistics());
        awaitStopped(List.of(agent), settings.getShutdownTimeout());
    }

    public void stopAgent(String projectionName) {
        stopAgent(shardFor(projectionName));
    }

    public synchronized void stopAll() {
        List<ShardAgent> all = new ArrayList<>(agents.values());
        all.forEach(ShardAgent::requestStop);
        highWaterAgent.stop();
        awaitStopped(all, settings.getShutdownTimeout());
        log.info("Stopped all shards");
    }

    /**
     * @return {@code true} if at least one shard is running.
     */
    public boolean isRunning() {
        return agents.values().stream().anyMatch(agent -> agent.getStatus() == ShardStatus.RUNNING);
    }

    public ShardStatus statusFor(ShardName shardName) {
        return agentFor(shardName).getStatus();
    }

    public ShardStatus statusFor(String projectionName) {
        return statusFor(shardFor(projectionName));
    }

    public List<ShardName> shards() {
        return List.copyOf(agents.keySet());
    }

    public ProjectionProgressStore progress() {
        return progressStore;
    }

    /**
     * Block until every running shard has processed all events up to the high water mark as it is when this method
     * is called.
     *
     * @throws CatchUpTimeoutException If the shards didn't catch up within {@code timeout}.
     */
    public void catchUp(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "Timeout cannot be null");
        long deadline = System.nanoTime() + timeout.toNanos();
        HighWaterStatistics statistics = detector.detect();
        if (statistics.hasGap()) {
            statistics = detector.detectInSafeZone();
        }
        highWaterAgent.publish(statistics);
        long target = statistics.currentMark();
        log.debug("Waiting for shards to reach sequence {}", target);

        while (!isCaughtUp(target)) {
            if (System.nanoTime() >= deadline) {
                throw new CatchUpTimeoutException(timeout);
            }
            TimeUnit.MILLISECONDS.sleep(settings.getCatchUpPollingInterval().toMillis());
        }
    }

    private boolean isCaughtUp(long target) {
        for (ShardAgent agent : agents.values()) {
            ShardStatus status = agent.getStatus();
            if (status == ShardStatus.STOPPED) {
                continue;
            } else if (status == ShardStatus.PAUSED || progressStore.fetchProgress(agent.getShardName()) < target) {
                return false;
            }
        }
        return true;
    }

    /**
     * Throw away everything the projection has produced and replay all events to it.
     *
     * @throws CatchUpTimeoutException If the projection didn't catch up within {@code timeout}.
     */
    public void rebuildProjection(String projectionName, Duration timeout) throws InterruptedException {
        ShardName shardName = shardFor(projectionName);
        ProjectionSource projection = agentFor(shardName).getProjection();
        log.info("Rebuilding projection {}", projectionName);
        stopAgent(shardName);

        store.getTransactionTemplate().executeWithoutResult(transaction -> {
            for (Class<?> documentType : projection.publishedTypes()) {
                store.getDocuments().deleteAll(documentType);
            }
            for (String table : projection.publishedTables()) {
                store.getJdbc().getJdbcOperations().update("DELETE FROM " + Tables.requireValidName(table));
            }
            progressStore.deleteProgress(projectionName);
        });

        startAgent(shardName);
        catchUp(timeout);
        log.info("Rebuilt projection {}", projectionName);
    }

    /**
     * Stop all shards and the high water agent and release the threads of the daemon.
     */
    @Override
    public synchronized void close() {
        if (shutdown) {
            return;
        }
        stopAll();
        shutdown = true;
        ExecutorShutdown.shutdownSafely(executor, settings.getShutdownTimeout());
        log.info("Closed projection daemon");
    }

    private void ensureHighWaterAgentIsRunning() {
        if (!highWaterAgent.isRunning()) {
            highWaterAgent.prepareStart();
            executor.execute(highWaterAgent);
        }
    }

    private void awaitStopped(List<ShardAgent> toStop, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (ShardAgent agent : toStop) {
            while (agent.getStatus() == ShardStatus.STOPPING || agent.getStatus() == ShardStatus.STARTING) {
                if (System.nanoTime() >= deadline) {
                    log.warn("Shard {} didn't stop within {}", agent.getShardName().identity(), timeout);
                    return;
                }
                try {
                    TimeUnit.MILLISECONDS.sleep(10);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    private ShardName shardFor(String projectionName) {
        Optional<ShardName> shardName = agents.keySet().stream().filter(name -> name.name().equals(projectionName)).findFirst();
        return shardName.orElseThrow(() -> new IllegalArgumentException("No asynchronous projection named '" + projectionName + "' is registered"));
    }

    private ShardAgent agentFor(ShardName shardName) {
        Objects.requireNonNull(shardName, ShardName.class.getSimpleName() + " cannot be null");
        ShardAgent agent = agents.get(shardName);
        if (agent == null) {
            throw new IllegalArgumentException("Unknown shard " + shardName.identity());
        }
        return agent;
    }

    private void requireNotShutdown() {
        if (shutdown) {
            throw new IllegalStateException("Cannot start shards since the projection daemon is closed");
        }
    }
}
