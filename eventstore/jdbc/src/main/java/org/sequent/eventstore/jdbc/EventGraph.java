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

package org.sequent.eventstore.jdbc;

import org.sequent.eventstore.api.Event;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of the event types known to the store. Maps event classes to their aliases and resolves the stored
 * java type name of an event back to its class when reading.
 * <p>
 * Registrations are kept for the lifetime of the registry. Types are registered up front through
 * {@link StoreOptions#registerEventTypes(Class[])} and by the projections that handle them, and also the first time
 * an event of a new type is written.
 */
public class EventGraph {
    private final ConcurrentMap<Class<?>, EventMapping> mappingsByType = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, EventMapping> mappingsByJavaTypeName = new ConcurrentHashMap<>();
    private final ConcurrentMap<Class<?>, String> aggregateAliases = new ConcurrentHashMap<>();

    public EventMapping eventMappingFor(Class<?> eventType) {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        if (Event.class.isAssignableFrom(eventType)) {
            throw new IllegalArgumentException(Event.class.getName() + " is an envelope and cannot be registered as an event type");
        }
        return mappingsByType.computeIfAbsent(eventType, type -> {
            EventMapping mapping = new EventMapping(toEventTypeName(type), type.getName(), type);
            mappingsByJavaTypeName.putIfAbsent(mapping.javaTypeName(), mapping);
            return mapping;
        });
    }

    public void register(Collection<Class<?>> eventTypes) {
        eventTypes.forEach(this::eventMappingFor);
    }

    /**
     * Wrap a domain event in an {@link Event} envelope with the type names assigned. Id, version and sequence are left
     * unassigned. An event that is already wrapped gets its type names refreshed.
     */
    public Event wrap(Object data) {
        Objects.requireNonNull(data, "Event cannot be null");
        if (data instanceof Event event) {
            EventMapping mapping = eventMappingFor(event.getEventType());
            event.setEventTypeName(mapping.eventTypeName());
            event.setJavaTypeName(mapping.javaTypeName());
            return event;
        }
        return eventMappingFor(data.getClass()).wrap(data);
    }

    /**
     * @return The mapping of a stored java type name, empty if the type isn't registered.
     */
    public Optional<EventMapping> resolve(String javaTypeName) {
        return Optional.ofNullable(mappingsByJavaTypeName.get(javaTypeName));
    }

    public String aggregateAliasFor(Class<?> aggregateType) {
        return aggregateAliases.computeIfAbsent(aggregateType, Class::getSimpleName);
    }

    /**
     * {@code QuestStarted} becomes {@code quest_started}.
     */
    public static String toEventTypeName(Class<?> eventType) {
        return toSnakeCase(eventType.getSimpleName());
    }

    public static String toSnakeCase(String name) {
        StringBuilder builder = new StringBuilder(name.length() + 8);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) {
                    builder.append('_');
                }
                builder.append(Character.toLowerCase(c));
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }
}
