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

import java.util.Objects;

/**
 * The registered names of an event type.
 *
 * @param eventTypeName The alias stored in the {@code type} column, for example {@code quest_started}
 * @param javaTypeName  The fully qualified class name stored in the {@code java_type} column
 * @param eventType     The event class
 */
public record EventMapping(String eventTypeName, String javaTypeName, Class<?> eventType) {

    public EventMapping {
        Objects.requireNonNull(eventTypeName, "eventTypeName cannot be null");
        Objects.requireNonNull(javaTypeName, "javaTypeName cannot be null");
        Objects.requireNonNull(eventType, "eventType cannot be null");
    }

    public Event wrap(Object data) {
        if (!eventType.isInstance(data)) {
            throw new IllegalArgumentException("Expected an event of type " + eventType.getName() + " but was " + data.getClass().getName());
        }
        return new Event(data, eventTypeName, javaTypeName);
    }
}
