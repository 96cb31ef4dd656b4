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

import org.sequent.eventstore.api.Event;
import org.sequent.eventstore.jdbc.DocumentStore;
import org.sequent.eventstore.jdbc.internal.EventReader;
import org.sequent.eventstore.jdbc.schema.Tables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Loads pages of events for the shards. Archived events are never loaded.
 */
public class EventLoader {
    private static final Logger log = LoggerFactory.getLogger(EventLoader.class);

    private final NamedParameterJdbcOperations jdbc;
    private final Tables tables;
    private final EventReader eventReader;

    public EventLoader(DocumentStore store) {
        Objects.requireNonNull(store, DocumentStore.class.getSimpleName() + " cannot be null");
        this.jdbc = store.getJdbc();
        this.tables = store.getTables();
        this.eventReader = store.getEventReader();
    }

    public EventPage load(EventRequest request) {
        if (request.highWater() <= request.floor()) {
            return new EventPage(request.floor(), request.floor(), List.of(), 0);
        }

        List<Event> events = new ArrayList<>();
        AtomicInteger rows = new AtomicInteger();
        AtomicInteger skipped = new AtomicInteger();
        AtomicLong lastSequence = new AtomicLong(request.floor());
        jdbc.query("SELECT " + EventReader.EVENT_COLUMNS + " FROM " + tables.events() +
                        " WHERE seq_id > :floor AND seq_id <= :highWater AND is_archived = FALSE ORDER BY seq_id LIMIT :batchSize",
                new MapSqlParameterSource()
                        .addValue("floor", request.floor())
                        .addValue("highWater", request.highWater())
                        .addValue("batchSize", request.batchSize()),
                (RowCallbackHandler) rs -> {
                    rows.incrementAndGet();
                    lastSequence.set(rs.getLong("seq_id"));
                    eventReader.read(rs, request.unknownEventTypePolicy(), request.skipSerializationErrors())
                            .ifPresentOrElse(events::add, skipped::incrementAndGet);
                });

        long ceiling = rows.get() == request.batchSize() ? lastSequence.get() : request.highWater();
        log.debug("Loaded {} event(s) for {} between {} and {}, skipped {}", events.size(), request.shardName().identity(), request.floor(), ceiling, skipped.get());
        return new EventPage(request.floor(), ceiling, events, skipped.get());
    }
}
