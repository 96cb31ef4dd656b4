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

import org.jspecify.annotations.Nullable;
import org.sequent.eventstore.api.Event;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The rules that fold events into an aggregate of type {@code T}:
 * <ul>
 *     <li><i>create</i> rules build the aggregate from the first event,</li>
 *     <li><i>apply</i> rules evolve an existing aggregate,</li>
 *     <li><i>delete</i> rules remove the aggregate.</li>
 * </ul>
 * If the first event has no create rule but an apply rule, the aggregate is created with its no-arg constructor (if any) before the rule is applied.
 * <pre>
 * AggregationRules.forType(QuestParty.class)
 *         .createOn(QuestStarted.class, e -> new QuestParty(e.name()))
 *         .applyOn(MembersJoined.class, (party, e) -> party.join(e.members()))
 *         .deleteOn(QuestEnded.class);
 * </pre>
 * Rules are configured once, before the store is created.
 */
public final class AggregationRules<T> {
    private final Class<T> aggregateType;
    private final @Nullable Supplier<T> defaultConstructor;
    private final Map<Class<?>, Function<Object, T>> creators = new LinkedHashMap<>();
    private final Map<Class<?>, BiFunction<T, Object, T>> appliers = new LinkedHashMap<>();
    private final Map<Class<?>, BiPredicate<T, Object>> deleters = new LinkedHashMap<>();

    private AggregationRules(Class<T> aggregateType) {
        Objects.requireNonNull(aggregateType, "Aggregate type cannot be null");
        this.aggregateType = aggregateType;
        this.defaultConstructor = defaultConstructorOf(aggregateType);
    }

    public static <T> AggregationRules<T> forType(Class<T> aggregateType) {
        return new AggregationRules<>(aggregateType);
    }

    public <E> AggregationRules<T> createOn(Class<E> eventType, Function<E, T> creator) {
        Objects.requireNonNull(creator, "Creator cannot be null");
        creators.put(eventType, event -> creator.apply(eventType.cast(event)));
        return this;
    }

    /**
     * @param applier Returns the new state of the aggregate, which may be the same (mutated) instance.
     */
    public <E> AggregationRules<T> applyOn(Class<E> eventType, BiFunction<T, E, T> applier) {
        Objects.requireNonNull(applier, "Applier cannot be null");
        appliers.put(eventType, (state, event) -> applier.apply(state, eventType.cast(event)));
        return this;
    }

    public <E> AggregationRules<T> deleteOn(Class<E> eventType) {
        return deleteOn(eventType, (state, event) -> true);
    }

    /**
     * @param shouldDelete Receives the current state, which is {@code null} if the aggregate doesn't exist.
     */
    public <E> AggregationRules<T> deleteOn(Class<E> eventType, BiPredicate<@Nullable T, E> shouldDelete) {
        Objects.requireNonNull(shouldDelete, "Delete predicate cannot be null");
        deleters.put(eventType, (state, event) -> shouldDelete.test(state, eventType.cast(event)));
        return this;
    }

    public Class<T> getAggregateType() {
        return aggregateType;
    }

    public Set<Class<?>> eventTypes() {
        Set<Class<?>> eventTypes = new LinkedHashSet<>();
        eventTypes.addAll(creators.keySet());
        eventTypes.addAll(appliers.keySet());
        eventTypes.addAll(deleters.keySet());
        return Collections.unmodifiableSet(eventTypes);
    }

    public boolean handles(Class<?> eventType) {
        return Handlers.find(creators, eventType) != null || Handlers.find(appliers, eventType) != null || Handlers.find(deleters, eventType) != null;
    }

    /**
     * Fold {@code events}, in order, into {@code state}.
     */
    public Aggregation<T> fold(@Nullable T state, List<Event> events) {
        T current = state;
        boolean deleted = false;
        for (Event event : events) {
            Object data = event.getData();
            Class<?> eventType = data.getClass();

            BiPredicate<T, Object> deleter = Handlers.find(deleters, eventType);
            if (deleter != null && deleter.test(current, data)) {
                current = null;
                deleted = true;
                continue;
            }

            BiFunction<T, Object, T> applier = Handlers.find(appliers, eventType);
            if (current == null) {
                Function<Object, T> creator = Handlers.find(creators, eventType);
                if (creator != null) {
                    current = creator.apply(data);
                    deleted = false;
                    continue;
                } else if (applier != null && defaultConstructor != null) {
                    current = defaultConstructor.get();
                    deleted = false;
                } else {
                    continue;
                }
            }

            if (applier != null) {
                current = applier.apply(current, data);
            }
        }
        return new Aggregation<>(current, deleted);
    }

    private static <T> @Nullable Supplier<T> defaultConstructorOf(Class<T> type) {
        Constructor<T> constructor;
        try {
            constructor = type.getDeclaredConstructor();
        } catch (NoSuchMethodException e) {
            return null;
        }
        constructor.setAccessible(true);
        return () -> {
            try {
                return constructor.newInstance();
            } catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
                throw new IllegalStateException("Failed to create an instance of " + type.getName(), e);
            }
        };
    }

    /**
     * The outcome of a fold.
     *
     * @param state   The aggregate, {@code null} if it doesn't exist.
     * @param deleted {@code true} if the aggregate was removed by a delete rule and not created again.
     */
    public record Aggregation<T>(@Nullable T state, boolean deleted) {
    }
}
