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
import org.sequent.eventstore.jdbc.schema.Tables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the highest sequence below which every event is committed. Sequences are handed out before the appending
 * transaction commits, so a newer event can be visible while an older one is still in flight. Shards never read past
 * the mark and can't miss such events.
 * <p>
 * A gap that stays unfilled (the transaction rolled back) would stop the mark forever. {@link #detectInSafeZone()}
 * skips gaps that are older than {@link DaemonSettings#getStaleSequenceThreshold()}.
 * </p>
 */
public class HighWaterDetector {
    private static final Logger log = LoggerFactory.getLogger(HighWaterDetector.class);

    public static final String HIGH_WATER_MARK = "HighWaterMark";
    private static final int PAGE_SIZE = 1000;

    private final NamedParameterJdbcOperations jdbc;
    private final Tables tables;
    private final Clock clock;
    private final ProjectionProgressStore progressStore;
    private final Duration staleSequenceThreshold;

    public HighWaterDetector(DocumentStore store, DaemonSettings settings) {
        Objects.requireNonNull(store, DocumentStore.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(settings, DaemonSettings.class.getSimpleName() + " cannot be null");
        this.jdbc = store.getJdbc();
        this.tables = store.getTables();
        this.clock = store.getClock();
        this.progressStore = new ProjectionProgressStore(store);
        this.staleSequenceThreshold = settings.getStaleSequenceThreshold();
    }

    /**
     * Advance the mark through the contiguous sequences after it and stop before the first gap.
     */
    public HighWaterStatistics detect() {
        return detect(false);
    }

    /**
     * Like {@link #detect()}, but moves the mark to the highest sequence if it's been stuck at a gap for longer than
     * the stale sequence threshold.
     */
    public HighWaterStatistics detectInSafeZone() {
        return detect(true);
    }

    private HighWaterStatistics detect(boolean safeZone) {
        OffsetDateTime now = Timestamps.now(clock);
        long highestSequence = highestSequence();
        Optional<ShardState> persisted = progressStore.fetch(HIGH_WATER_MARK);
        long lastMark = persisted.map(ShardState::sequence).orElse(0L);

        long mark = contiguousSequenceAfter(lastMark);
        boolean includesSkipping = false;
        if (safeZone && mark < highestSequence && persisted.isPresent() && isStale(persisted.get(), now)) {
            log.warn("Skipping the gap after sequence {} since it hasn't been filled since {}, moving the high water mark to {}",
                    mark, persisted.get().lastUpdated(), highestSequence);
            mark = highestSequence;
            includesSkipping = true;
        }

        if (mark > lastMark || persisted.isEmpty()) {
            persist(mark, now, persisted.isPresent());
        }
        log.debug("Detected high water mark {} (was {}, highest sequence is {})", mark, lastMark, highestSequence);
        return new HighWaterStatistics(lastMark, Math.max(mark, lastMark), highestSequence, includesSkipping, now);
    }

    private long highestSequence() {
        Long highest = jdbc.getJdbcOperations().queryForObject("SELECT MAX(seq_id) FROM " + tables.events(), Long.class);
        return highest == null ? 0 : highest;
    }

    private long contiguousSequenceAfter(long mark) {
        long current = mark;
        while (true) {
            List<Long> sequences = jdbc.queryForList("SELECT seq_id FROM " + tables.events() + " WHERE seq_id > :mark ORDER BY seq_id LIMIT :limit",
                    new MapSqlParameterSource().addValue("mark", current).addValue("limit", PAGE_SIZE), Long.class);
            for (long sequence : sequences) {
                if (sequence != current + 1) {
                    return current;
                }
                current = sequence;
            }
            if (sequences.size() < PAGE_SIZE) {
                return current;
            }
        }
    }

    private boolean isStale(ShardState persisted, OffsetDateTime now) {
        return persisted.lastUpdated().plus(staleSequenceThreshold).isBefore(now);
    }

    // The mark only ever moves forward, even if another detector is running against the same database
    private void persist(long mark, OffsetDateTime now, boolean exists) {
        MapSqlParameterSource parameters = new MapSqlParameterSource()
                .addValue("name", HIGH_WATER_MARK)
                .addValue("mark", mark)
                .addValue("now", now);
        String update = "UPDATE " + tables.eventProgression() + " SET last_seq_id = :mark, last_updated = :now WHERE name = :name AND last_seq_id < :mark";
        if (exists) {
            jdbc.update(update, parameters);
            return;
        }
        try {
            jdbc.update("INSERT INTO " + tables.eventProgression() + " (name, last_seq_id, last_updated) VALUES (:name, :mark, :now)", parameters);
        } catch (DuplicateKeyException e) {
            log.debug("High water mark was inserted concurrently, updating it instead");
            jdbc.update(update, parameters);
        }
    }
}
