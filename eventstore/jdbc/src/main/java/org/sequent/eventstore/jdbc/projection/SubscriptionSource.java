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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs a {@link Subscription} as an asynchronous shard. If event types are given, only events of those types (or their
 * sub types) are handed to the subscription.
 */
public class SubscriptionSource extends ProjectionSource {
    private final Subscription subscription;
    private final Map<Class<?>, Boolean> eventTypes = new LinkedHashMap<>();

    public SubscriptionSource(String subscriptionName, Subscription subscription, Class<?>... eventTypes) {
        super(subscriptionName);
        this.subscription = Objects.requireNonNull(subscription, Subscription.class.getSimpleName() + " cannot be null");
        Arrays.stream(eventTypes).forEach(type -> this.eventTypes.put(type, Boolean.TRUE));
    }

    @Override
    public Set<Class<?>> includedEventTypes() {
        return Set.copyOf(eventTypes.keySet());
    }

    @Override
    public Set<Class<?>> publishedTypes() {
        return Set.of();
    }

    @Override
    public void apply(ProjectionContext context, List<Event> events) {
        List<Event> included = eventTypes.isEmpty() ? events : events.stream().filter(event -> Handlers.find(eventTypes, event.getEventType()) != null).toList();
        if (!included.isEmpty()) {
            subscription.processEvents(included, context);
        }
    }
}
