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

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A projection that folds events into documents of type {@code T} using {@link AggregationRules}.
 * Subclasses decide which document each event belongs to.
 */
public abstract class AggregateProjection<T> extends ProjectionSource {
    private final AggregationRules<T> rules;

    protected AggregateProjection(String projectionName, AggregationRules<T> rules) {
        super(projectionName);
        this.rules = Objects.requireNonNull(rules, AggregationRules.class.getSimpleName() + " cannot be null");
    }

    public AggregationRules<T> getRules() {
        return rules;
    }

    public Class<T> getAggregateType() {
        return rules.getAggregateType();
    }

    @Override
    public Set<Class<?>> publishedTypes() {
        return Set.of(rules.getAggregateType());
    }

    /**
     * Load the current document with the given id, fold {@code events} into it and store or delete the result.
     *
     * @return The new state of the document, {@code null} if it doesn't exist.
     */
    protected @Nullable T applyToDocument(ProjectionContext context, Object documentId, List<Event> events) {
        Class<T> type = rules.getAggregateType();
        Optional<T> existing = context.load(type, documentId);
        AggregationRules.Aggregation<T> aggregation = rules.fold(existing.orElse(null), events);
        T state = aggregation.state();
        if (state == null) {
            if (existing.isPresent() || aggregation.deleted()) {
                context.delete(type, documentId);
            }
        } else {
            context.assignIdentity(state, documentId);
            context.store(state);
        }
        return state;
    }
}
