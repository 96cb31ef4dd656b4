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

import org.sequent.eventstore.api.DocumentOperations;
import org.sequent.eventstore.api.Event;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Runs an arbitrary handler per event. Handlers write documents through the supplied {@link DocumentOperations}, and
 * documents stored by earlier events in the same batch can be loaded by later ones.
 * <pre>
 * new EventProjection("quest-log")
 *         .project(QuestStarted.class, (e, documents) -&gt; documents.store(new QuestLog(e.questId(), e.name())))
 *         .publishes(QuestLog.class);
 * </pre>
 */
public class EventProjection extends ProjectionSource {
    private final Map<Class<?>, BiConsumer<Object, DocumentOperations>> handlers = new LinkedHashMap<>();
    private final Set<Class<?>> publishedTypes = new LinkedHashSet<>();

    public EventProjection(String projectionName) {
        super(projectionName);
    }

    public <E> EventProjection project(Class<E> eventType, BiConsumer<E, DocumentOperations> handler) {
        Objects.requireNonNull(handler, "Handler cannot be null");
        handlers.put(eventType, (event, documents) -> handler.accept(eventType.cast(event), documents));
        return this;
    }

    public EventProjection publishes(Class<?>... documentTypes) {
        publishedTypes.addAll(Arrays.asList(documentTypes));
        return this;
    }

    @Override
    public Set<Class<?>> includedEventTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    @Override
    public Set<Class<?>> publishedTypes() {
        return Collections.unmodifiableSet(publishedTypes);
    }

    @Override
    public void apply(ProjectionContext context, List<Event> events) {
        for (Event event : events) {
            BiConsumer<Object, DocumentOperations> handler = Handlers.find(handlers, event.getEventType());
            if (handler != null) {
                handler.accept(event.getData(), context);
            }
        }
    }
}
