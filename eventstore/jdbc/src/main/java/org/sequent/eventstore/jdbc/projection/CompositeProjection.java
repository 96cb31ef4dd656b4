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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Applies groups of projections in stages. Everything written by one stage is flushed before the next stage runs, so
 * a later stage can read the documents produced by an earlier one.
 */
public class CompositeProjection extends ProjectionSource {
    private final List<List<ProjectionSource>> stages = new ArrayList<>();

    public CompositeProjection(String projectionName) {
        super(projectionName);
    }

    public CompositeProjection stage(ProjectionSource... projections) {
        if (projections.length == 0) {
            throw new IllegalArgumentException("A stage must contain at least one projection");
        }
        stages.add(List.of(projections));
        return this;
    }

    public List<List<ProjectionSource>> getStages() {
        return Collections.unmodifiableList(stages);
    }

    @Override
    public Set<Class<?>> includedEventTypes() {
        return union(ProjectionSource::includedEventTypes);
    }

    @Override
    public Set<Class<?>> publishedTypes() {
        return union(ProjectionSource::publishedTypes);
    }

    @Override
    public List<String> publishedTables() {
        return new ArrayList<>(union(ProjectionSource::publishedTables));
    }

    @Override
    public List<String> storageDefinitions() {
        return new ArrayList<>(union(ProjectionSource::storageDefinitions));
    }

    @Override
    public void apply(ProjectionContext context, List<Event> events) {
        for (List<ProjectionSource> stage : stages) {
            for (ProjectionSource projection : stage) {
                projection.apply(context, events);
            }
            context.flush();
        }
    }

    private <T> Set<T> union(Function<ProjectionSource, ? extends Collection<T>> extractor) {
        Set<T> result = new LinkedHashSet<>();
        stages.forEach(stage -> stage.forEach(projection -> result.addAll(extractor.apply(projection))));
        return result;
    }
}
