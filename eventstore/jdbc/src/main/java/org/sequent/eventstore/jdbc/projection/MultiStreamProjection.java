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

import org.sequent.eventstore.api.Event;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Projects events from any number of streams into documents of type {@code T}. The document(s) an event belongs to are
 * found by the identity functions registered per event type. Events without an identity function are ignored.
 * <pre>
 * new MultiStreamProjection&lt;&gt;("member-quests", AggregationRules.forType(MemberQuests.class)
 *             .applyOn(MembersJoined.class, MemberQuests::joined))
 *         .identities(MembersJoined.class, MembersJoined::members);
 * </pre>
 */
public class MultiStreamProjection<T> extends AggregateProjection<T> {
    private final Map<Class<?>, Function<Object, Collection<?>>> identities = new LinkedHashMap<>();

    public MultiStreamProjection(String projectionName, AggregationRules<T> rules) {
        super(projectionName, rules);
    }

    public <E> MultiStreamProjection<T> identity(Class<E> eventType, Function<E, ?> identity) {
        Objects.requireNonNull(identity, "Identity function cannot be null");
        identities.put(eventType, event -> Collections.singletonList(identity.apply(eventType.cast(event))));
        return this;
    }

    public <E> MultiStreamProjection<T> identities(Class<E> eventType, Function<E, ? extends Collection<?>> identities) {
        Objects.requireNonNull(identities, "Identities function cannot be null");
        this.identities.put(eventType, event -> identities.apply(eventType.cast(event)));
        return this;
    }

    @Override
    public Set<Class<?>> includedEventTypes() {
        Set<Class<?>> eventTypes = new LinkedHashSet<>(identities.keySet());
        eventTypes.addAll(getRules().eventTypes());
        return Collections.unmodifiableSet(eventTypes);
    }

    @Override
    public void apply(ProjectionContext context, List<Event> events) {
        Map<Object, List<Event>> eventsByDocument = new LinkedHashMap<>();
        for (Event event : events) {
            Function<Object, Collection<?>> identity = Handlers.find(identities, event.getEventType());
            if (identity == null) {
                continue;
            }
            for (Object documentId : identity.apply(event.getData())) {
                if (documentId != null) {
                    eventsByDocument.computeIfAbsent(documentId, __ -> new ArrayList<>()).add(event);
                }
            }
        }
        eventsByDocument.forEach((documentId, documentEvents) -> applyToDocument(context, documentId, documentEvents));
    }
}
