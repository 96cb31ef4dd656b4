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

public enum ProjectionLifecycle {
    /**
     * Applied in the same transaction as the events it's derived from.
     */
    INLINE,
    /**
     * Applied in the background by the projection daemon.
     */
    ASYNC,
    /**
     * Never stored, only used when aggregating streams on demand.
     */
    LIVE
}
