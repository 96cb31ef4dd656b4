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

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Base class of all projections. A projection is registered with a {@link ProjectionLifecycle} in {@link ProjectionOptions}
 * and is then applied to new events either inline or by the projection daemon.
 */
public abstract class ProjectionSource {
    private final String projectionName;
    private int version = 1;
    private ProjectionLifecycle lifecycle = ProjectionLifecycle.ASYNC;

    protected ProjectionSource(String projectionName) {
        Objects.requireNonNull(projectionName, "Projection name cannot be null");
        if (projectionName.isBlank() || projectionName.contains(":")) {
            throw new IllegalArgumentException("Invalid projection name: '" + projectionName + "'");
        }
        this.projectionName = projectionName;
    }

    public String getProjectionName() {
        return projectionName;
    }

    /**
     * @return The version of the projection. Bumping the version makes the daemon rebuild the projection from the first event.
     */
    public int getVersion() {
        return version;
    }

    public ProjectionSource version(int version) {
        if (version < 1) {
            throw new IllegalArgumentException("Projection version must be greater than zero");
        }
        this.version = version;
        return this;
    }

    public ProjectionLifecycle getLifecycle() {
        return lifecycle;
    }

    void setLifecycle(ProjectionLifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    /**
     * @return The event types this projection reacts to. They're registered in the store so that they can be read back.
     */
    public abstract Set<Class<?>> includedEventTypes();

    /**
     * @return The document types written by this projection.
     */
    public abstract Set<Class<?>> publishedTypes();

    /**
     * @return Plain tables written by this projection, cleared when the projection is rebuilt.
     */
    public List<String> publishedTables() {
        return List.of();
    }

    /**
     * @return DDL statements creating the plain tables written by this projection.
     */
    public List<String> storageDefinitions() {
        return List.of();
    }

    /**
     * Apply {@code events}, all belonging to the tenant of {@code context}, in the order they were written.
     */
    public abstract void apply(ProjectionContext context, List<Event> events);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + projectionName + ", version=" + version + ", lifecycle=" + lifecycle + "]";
    }
}
