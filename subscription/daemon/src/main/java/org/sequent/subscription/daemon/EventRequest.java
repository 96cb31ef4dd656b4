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

import org.sequent.eventstore.api.UnknownEventTypePolicy;

/**
 * A request for the events with {@code floor < sequence <= highWater}.
 */
public record EventRequest(long floor, long highWater, int batchSize, ShardName shardName,
                           UnknownEventTypePolicy unknownEventTypePolicy, boolean skipSerializationErrors) {

    public EventRequest {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be greater than zero");
        }
    }
}
