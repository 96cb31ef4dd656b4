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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Thrown when the progress of a shard isn't at the floor of the page that was applied, which means that someone else
 * moved it. The transaction of the page is rolled back.
 */
public class ProgressionProgressOutOfOrderException extends RuntimeException {
    public final ShardName shardName;
    public final long floor;
    public final long ceiling;

    public ProgressionProgressOutOfOrderException(ShardName shardName, long floor, long ceiling) {
        super("Progress of " + shardName.identity() + " was expected to be at " + floor + " when moving it to " + ceiling);
        this.shardName = shardName;
        this.floor = floor;
        this.ceiling = ceiling;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProgressionProgressOutOfOrderException)) return false;
        ProgressionProgressOutOfOrderException that = (ProgressionProgressOutOfOrderException) o;
        return floor == that.floor && ceiling == that.ceiling && Objects.equals(shardName, that.shardName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shardName, floor, ceiling);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ProgressionProgressOutOfOrderException.class.getSimpleName() + "[", "]")
                .add("shardName=" + shardName)
                .add("floor=" + floor)
                .add("ceiling=" + ceiling)
                .toString();
    }
}
