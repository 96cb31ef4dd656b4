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

package org.sequent.subscription.daemon;

import org.sequent.eventstore.jdbc.projection.ProjectionSource;

import java.util.Objects;

/**
 * Identifies the progress of one projection. The identity is stored as the name of the progression row.
 *
 * @param name    The name of the projection
 * @param key     The shard key, {@value #ALL} for projections that aren't sharded
 * @param version The version of the projection, bumping it makes the projection rebuild from the start
 */
public record ShardName(String name, String key, int version) {
    public static final String ALL = "All";

    public ShardName {
        Objects.requireNonNull(name, "Shard name cannot be null");
        Objects.requireNonNull(key, "Shard key cannot be null");
        if (version < 1) {
            throw new IllegalArgumentException("Shard version must be greater than zero");
        }
    }

    public ShardName(String name) {
        this(name, ALL, 1);
    }

    public static ShardName forProjection(ProjectionSource projection) {
        return new ShardName(projection.getProjectionName(), ALL, projection.getVersion());
    }

    /**
     * @return {@code name:key}, or {@code name:V<version>:key} when the version is greater than one.
     */
    public String identity() {
        return version > 1 ? name + ":V" + version + ":" + key : name + ":" + key;
    }

    @Override
    public String toString() {
        return identity();
    }
}
