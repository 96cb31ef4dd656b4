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

package org.sequent.eventstore.jdbc.projection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * The projections and aggregations known by a store.
 */
public class ProjectionOptions {
    private final Map<String, ProjectionSource> projections = new LinkedHashMap<>();
    private final Map<Class<?>, AggregationRules<?>> aggregations = new LinkedHashMap<>();

    /**
     * Register a single stream projection of {@code T}. With the {@link ProjectionLifecycle#INLINE INLINE} lifecycle
     * the projected document is also cached as a snapshot on the stream row and used by {@code aggregateStream}.
     */
    public <T> ProjectionOptions snapshot(SingleStreamProjection<T> projection, ProjectionLifecycle lifecycle) {
        Objects.requireNonNull(projection, "Projection cannot be null");
        if (lifecycle == ProjectionLifecycle.LIVE) {
            return liveStreamAggregation(projection.getRules());
        }
        projection.setInlineSnapshot(lifecycle == ProjectionLifecycle.INLINE);
        return add(projection, lifecycle);
    }

    public <T> ProjectionOptions snapshot(AggregationRules<T> rules, ProjectionLifecycle lifecycle) {
        return snapshot(new SingleStreamProjection<>(rules), lifecycle);
    }

    public ProjectionOptions add(ProjectionSource projection, ProjectionLifecycle lifecycle) {
        Objects.requireNonNull(projection, "Projection cannot be null");
        Objects.requireNonNull(lifecycle, ProjectionLifecycle.class.getSimpleName() + " cannot be null");
        if (lifecycle == ProjectionLifecycle.LIVE) {
            if (projection instanceof SingleStreamProjection<?> single) {
                return liveStreamAggregation(single.getRules());
            }
            throw new IllegalArgumentException("Only single stream projections can be live but " + projection + " is a " + projection.getClass().getSimpleName());
        }
        if (projections.containsKey(projection.getProjectionName())) {
            throw new IllegalArgumentException("A projection named '" + projection.getProjectionName() + "' is already registered");
        }
        projection.setLifecycle(lifecycle);
        projections.put(projection.getProjectionName(), projection);
        if (projection instanceof SingleStreamProjection<?> single) {
            aggregations.putIfAbsent(single.getAggregateType(), single.getRules());
        }
        return this;
    }

    /**
     * Register a subscription that the projection daemon runs as an asynchronous shard named {@code subscriptionName}.
     *
     * @param eventTypes The event types handed to the subscription. All events are handed to it if none are given.
     */
    public ProjectionOptions subscribe(String subscriptionName, Subscription subscription, Class<?>... eventTypes) {
        return add(new SubscriptionSource(subscriptionName, subscription, eventTypes), ProjectionLifecycle.ASYNC);
    }

    /**
     * Register how to aggregate streams into {@code T} on demand, without storing anything.
     */
    public <T> ProjectionOptions liveStreamAggregation(AggregationRules<T> rules) {
        Objects.requireNonNull(rules, AggregationRules.class.getSimpleName() + " cannot be null");
        aggregations.put(rules.getAggregateType(), rules);
        return this;
    }

    public List<ProjectionSource> all() {
        return List.copyOf(projections.values());
    }

    public List<ProjectionSource> inline() {
        return withLifecycle(ProjectionLifecycle.INLINE);
    }

    public List<ProjectionSource> async() {
        return withLifecycle(ProjectionLifecycle.ASYNC);
    }

    public Optional<ProjectionSource> byName(String projectionName) {
        return Optional.ofNullable(projections.get(projectionName));
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<AggregationRules<T>> aggregationFor(Class<T> aggregateType) {
        return Optional.ofNullable((AggregationRules<T>) aggregations.get(aggregateType));
    }

    /**
     * @return {@code true} if streams aggregated into {@code aggregateType} have an inline snapshot.
     */
    public boolean usesInlineSnapshot(Class<?> aggregateType) {
        return projections.values().stream()
                .anyMatch(p -> p instanceof SingleStreamProjection<?> single && single.isInlineSnapshot() && single.getAggregateType().equals(aggregateType));
    }

    public Set<Class<?>> allEventTypes() {
        Set<Class<?>> eventTypes = collect(ProjectionSource::includedEventTypes);
        aggregations.values().forEach(rules -> eventTypes.addAll(rules.eventTypes()));
        return Collections.unmodifiableSet(eventTypes);
    }

    public Set<Class<?>> allPublishedTypes() {
        return Collections.unmodifiableSet(collect(ProjectionSource::publishedTypes));
    }

    public List<String> allStorageDefinitions() {
        return new ArrayList<>(collect(ProjectionSource::storageDefinitions));
    }

    private List<ProjectionSource> withLifecycle(ProjectionLifecycle lifecycle) {
        return projections.values().stream().filter(p -> p.getLifecycle() == lifecycle).toList();
    }

    private <T> Set<T> collect(Function<ProjectionSource, ? extends Collection<T>> extractor) {
        Set<T> result = new LinkedHashSet<>();
        projections.values().forEach(p -> result.addAll(extractor.apply(p)));
        return result;
    }
}
