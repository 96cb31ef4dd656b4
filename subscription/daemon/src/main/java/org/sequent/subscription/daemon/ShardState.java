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

import java.time.OffsetDateTime;

/**
 * A row of the progression table.
 *
 * @param name        The shard identity, or {@value HighWaterDetector#HIGH_WATER_MARK}
 * @param sequence    The last sequence that was processed
 * @param lastUpdated When the row was last changed
 */
public record ShardState(String name, long sequence, OffsetDateTime lastUpdated) {
}
