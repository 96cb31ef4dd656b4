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

import org.sequent.eventstore.jdbc.internal.Timestamps;
import org.sequent.eventstore.jdbc.operation.StorageOperation;
import org.sequent.eventstore.jdbc.schema.Tables;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;

import java.time.Clock;

/**
 * Moves the progress of a shard from {@code floor} to {@code ceiling}, but only if it's still at {@code floor}.
 */
class UpdateProjectionProgress implements StorageOperation {
    private final Tables tables;
    private final Clock clock;
    private final ShardName shardName;
    private final long floor;
    private final long ceiling;

    UpdateProjectionProgress(Tables tables, Clock clock, ShardName shardName, long floor, long ceiling) {
        this.tables = tables;
        this.clock = clock;
        this.shardName = shardName;
        this.floor = floor;
        this.ceiling = ceiling;
    }

    @Override
    public void execute(NamedParameterJdbcOperations jdbc) {
        int updated = jdbc.update("UPDATE " + tables.eventProgression() + " SET last_seq_id = :ceiling, last_updated = :now WHERE name = :name AND last_seq_id = :floor",
                new MapSqlParameterSource()
                        .addValue("name", shardName.identity())
                        .addValue("floor", floor)
                        .addValue("ceiling", ceiling)
                        .addValue("now", Timestamps.now(clock)));
        if (updated == 0) {
            throw new ProgressionProgressOutOfOrderException(shardName, floor, ceiling);
        }
    }
}
