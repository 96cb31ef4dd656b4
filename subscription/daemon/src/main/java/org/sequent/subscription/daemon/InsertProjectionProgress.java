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
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;

import java.time.Clock;

/**
 * Records the first progress of a shard. Fails with {@link ProgressionProgressOutOfOrderException} if another
 * agent got there first.
 */
class InsertProjectionProgress implements StorageOperation {
    private final Tables tables;
    private final Clock clock;
    private final ShardName shardName;
    private final long ceiling;

    InsertProjectionProgress(Tables tables, Clock clock, ShardName shardName, long ceiling) {
        this.tables = tables;
        this.clock = clock;
        this.shardName = shardName;
        this.ceiling = ceiling;
    }

    @Override
    public void execute(NamedParameterJdbcOperations jdbc) {
        try {
            jdbc.update("INSERT INTO " + tables.eventProgression() + " (name, last_seq_id, last_updated) VALUES (:name, :ceiling, :now)",
                    new MapSqlParameterSource()
                            .addValue("name", shardName.identity())
                            .addValue("ceiling", ceiling)
                            .addValue("now", Timestamps.now(clock)));
        } catch (DuplicateKeyException e) {
            ProgressionProgressOutOfOrderException exception = new ProgressionProgressOutOfOrderException(shardName, 0, ceiling);
            exception.initCause(e);
            throw exception;
        }
    }
}
