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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Projects each stream into one document of type {@code T} whose id is the stream identity.
 * <p>
 * When registered as an inline snapshot the projected document is also cached on the stream row, so that
 * aggregating the stream doesn't need to replay all of its events.
 */
public class SingleStreamProjection<T> extends AggregateProjection<T> {
    private boolean inlineSnapshot;

    public SingleStreamProjection(AggregationRules<T> rules) {
        this(rules.getAggregateType().getSimpleName(), rules);
    }

    public SingleStreamProjection(String projectionName, AggregationRules<T> rules) {
        super(projectionName, rules);
    }

    public boolean isInlineSnapshot() {
        return inlineSnapshot;
    }

    void setInlineSnapshot(boolean inlineSnapshot) {
        this.inlineSnapshot = inlineSnapshot;
    }

    @Override
    public Set<Class<?>> includedEventTypes() {
        return getRules().eventTypes();
    }

    @Override
    public void apply(ProjectionContext context, List<Event> events) {
        Map<Object, List<Event>> eventsByStream = new LinkedHashMap<>();
        for (Event event : events) {
            Object streamIdentity = event.getStreamIdentity();
            if (streamIdentity != null && getRules().handles(event.getEventType())) {
                eventsByStream.computeIfAbsent(streamIdentity, __ -> new ArrayList<>()).add(event);
            }
        }

        eventsByStream.forEach((streamIdentity, streamEvents) -> {
            @Nullable T state = applyToDocument(context, streamIdentity, streamEvents);
            if (inlineSnapshot) {
                context.findStream(streamIdentity).ifPresent(stream -> context.updateSnapshot(stream, state));
            }
        });
    }
}
