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

import org.sequent.eventstore.api.Event;

import java.util.List;

/**
 * The events a shard applies in one transaction. After it's applied the progress of the shard is {@code ceiling}.
 *
 * @param skipped The number of events in the range that couldn't be read
 */
public record EventPage(long floor, long ceiling, List<Event> events, int skipped) {

    public EventPage {
        events = List.copyOf(events);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public boolean advances() {
        return ceiling > floor;
    }
}
