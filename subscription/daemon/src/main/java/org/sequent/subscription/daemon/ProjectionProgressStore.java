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
import org.sequent.eventstore.jdbc.internal.Timestamps;
import org.sequent.eventstore.jdbc.operation.StorageOperation;
import org.sequent.eventstore.jdbc.schema.Tables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads and writes the progress of shards in the progression table.
 */
public class ProjectionProgressStore {
    private static final Logger log = LoggerFactory.getLogger(ProjectionProgressStore.class);

    private static final RowMapper<ShardState> SHARD_STATE_MAPPER = (rs, rowNum) ->
            new ShardState(rs.getString("name"), rs.getLong("last_seq_id"), rs.getObject("last_updated", OffsetDateTime.class));

    private final NamedParameterJdbcOperations jdbc;
    private final Tables tables;
    private final Clock clock;

    public ProjectionProgressStore(DocumentStore store) {
        Objects.requireNonNull(store, DocumentStore.class.getSimpleName() + " cannot be null");
        this.jdbc = store.getJdbc();
        this.tables = store.getTables();
        this.clock = store.getClock();
    }

    /**
     * @return The last sequence processed by the shard, {@code 0} if it hasn't processed anything yet.
     */
    public long fetchProgress(ShardName shardName) {
        return fetch(shardName.identity()).map(ShardState::sequence).orElse(0L);
    }

    public Optional<ShardState> fetch(String name) {
        List<ShardState> states = jdbc.query("SELECT name, last_seq_id, last_updated FROM " + tables.eventProgression() + " WHERE name = :name",
                new MapSqlParameterSource("name", name), SHARD_STATE_MAPPER);
        return states.stream().findFirst();
    }

    /**
     * @return The progress of all shards, without the high water mark.
     */
    public List<ShardState> allProgress() {
        return jdbc.query("SELECT name, last_seq_id, last_updated FROM " + tables.eventProgression() + " WHERE name <> :highWaterMark ORDER BY name",
                new MapSqlParameterSource("highWaterMark", HighWaterDetector.HIGH_WATER_MARK), SHARD_STATE_MAPPER);
    }

    /**
     * Move the progress of a shard to {@code floor} regardless of where it is now. The shard replays everything after
     * {@code floor} the next time it runs.
     */
    public void rewind(ShardName shardName, long floor) {
        if (floor < 0) {
            throw new IllegalArgumentException("Floor cannot be negative");
        }
        MapSqlParameterSource parameters = new MapSqlParameterSource()
                .addValue("name", shardName.identity())
                .addValue("floor", floor)
                .addValue("now", Timestamps.now(clock));
        int updated = jdbc.update("UPDATE " + tables.eventProgression() + " SET last_seq_id = :floor, last_updated = :now WHERE name = :name", parameters);
        if (updated == 0) {
            jdbc.update("INSERT INTO " + tables.eventProgression() + " (name, last_seq_id, last_updated) VALUES (:name, :floor, :now)", parameters);
        }
        log.info("Rewound {} to sequence {}", shardName.identity(), floor);
    }

    /**
     * Delete the progress of every shard of the projection with the given name.
     */
    public void deleteProgress(String projectionName) {
        for (ShardState state : allProgress()) {
            if (state.name().startsWith(projectionName + ":")) {
                jdbc.update("DELETE FROM " + tables.eventProgression() + " WHERE name = :name", new MapSqlParameterSource("name", state.name()));
                log.debug("Deleted progress of {}", state.name());
            }
        }
    }

    /**
     * @return The operation that moves the progress of a shard from {@code floor} to {@code ceiling}. It's executed in
     * the same transaction as the projected changes.
     */
    StorageOperation progressOperation(ShardName shardName, boolean hasProgress, long floor, long ceiling) {
        return hasProgress
                ? new UpdateProjectionProgress(tables, clock, shardName, floor, ceiling)
                : new InsertProjectionProgress(tables, clock, shardName, ceiling);
    }
}
