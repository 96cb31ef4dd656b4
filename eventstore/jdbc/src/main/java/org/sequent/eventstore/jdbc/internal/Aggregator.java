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

package org.sequent.eventstore.jdbc.internal;

import org.jspecify.annotations.Nullable;
import org.sequent.eventstore.api.AggregateOptions;
import org.sequent.eventstore.api.Event;
import org.sequent.eventstore.api.FetchOptions;
import org.sequent.eventstore.jdbc.DocumentStore;
import org.sequent.eventstore.jdbc.document.DocumentMapping;
import org.sequent.eventstore.jdbc.projection.AggregationRules;
import org.sequent.eventstore.jdbc.projection.ProjectionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.util.List;
import java.util.Optional;

/**
 * Replays a stream into an aggregate, starting from the cached snapshot of the stream when the aggregate is projected inline.
 * Never writes anything.
 */
class Aggregator {
    private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

    private final DocumentStore store;
    private final JdbcQueryEventStore query;

    Aggregator(DocumentStore store, JdbcQueryEventStore query) {
        this.store = store;
        this.query = query;
    }

    <T> @Nullable T aggregate(Class<T> aggregateType, Object streamIdentity, AggregateOptions options) {
        ProjectionOptions projections = store.getOptions().projections();
        AggregationRules<T> rules = projections.aggregationFor(aggregateType)
                .orElseThrow(() -> new IllegalArgumentException("No aggregation is registered for " + aggregateType.getName()));

        T seed = initialState(aggregateType, options);
        FetchOptions fetchOptions = options.getFetchOptions();
        if (options.isSnapshotEligible() && projections.usesInlineSnapshot(aggregateType)) {
            Optional<Snapshot<T>> snapshot = loadSnapshot(aggregateType, streamIdentity);
            long maxVersion = options.getMaxVersion();
            if (snapshot.isPresent() && (maxVersion == 0 || maxVersion >= snapshot.get().version())) {
                log.debug("Using snapshot of stream {} at version {}", streamIdentity, snapshot.get().version());
                if (maxVersion == snapshot.get().version()) {
                    return withIdentity(snapshot.get().state(), streamIdentity);
                }
                seed = snapshot.get().state();
                fetchOptions = fetchOptions.fromVersion(snapshot.get().version() + 1);
            }
        }

        List<Event> events = query.fetch(streamIdentity, fetchOptions);
        T state = rules.fold(seed, events).state();
        return state == null ? null : withIdentity(state, streamIdentity);
    }

    private <T> @Nullable T initialState(Class<T> aggregateType, AggregateOptions options) {
        Object state = options.getState();
        if (state == null) {
            return null;
        } else if (!aggregateType.isInstance(state)) {
            throw new IllegalArgumentException("Initial state must be a " + aggregateType.getName() + " but was a " + state.getClass().getName());
        }
        return aggregateType.cast(state);
    }

    private <T> Optional<Snapshot<T>> loadSnapshot(Class<T> aggregateType, Object streamIdentity) {
        List<Snapshot<T>> snapshots = store.getJdbc().query(
                "SELECT snapshot, snapshot_version FROM " + store.getTables().streams() + " WHERE id = :id AND tenant_id = :tenantId AND snapshot IS NOT NULL",
                new MapSqlParameterSource().addValue("id", streamIdentity).addValue("tenantId", query.getTenantId()),
                (rs, rowNum) -> new Snapshot<>(store.getSerializer().fromJson(aggregateType, rs.getString("snapshot")), rs.getLong("snapshot_version")));
        return snapshots.stream().findFirst();
    }

    private <T> T withIdentity(T aggregate, Object streamIdentity) {
        new DocumentMapping<>(aggregate.getClass(), store.getTables()).assignId(aggregate, streamIdentity);
        return aggregate;
    }

    private record Snapshot<T>(T state, long version) {
    }
}
