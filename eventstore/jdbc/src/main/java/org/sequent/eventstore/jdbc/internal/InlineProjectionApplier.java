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

package org.sequent.eventstore.jdbc.internal;

import org.sequent.eventstore.api.Event;
import org.sequent.eventstore.api.StreamAction;
import org.sequent.eventstore.jdbc.projection.ProjectionContext;
import org.sequent.eventstore.jdbc.projection.ProjectionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Applies the inline projections to the events written by a session, in the transaction that writes them.
 */
public class InlineProjectionApplier {
    private static final Logger log = LoggerFactory.getLogger(InlineProjectionApplier.class);

    private final List<ProjectionSource> projections;

    public InlineProjectionApplier(List<ProjectionSource> projections) {
        this.projections = List.copyOf(projections);
    }

    public void apply(ProjectionContext context, List<StreamAction> streams) {
        if (projections.isEmpty()) {
            return;
        }
        List<Event> events = streams.stream().flatMap(stream -> stream.getEvents().stream()).toList();
        if (events.isEmpty()) {
            return;
        }
        for (ProjectionSource projection : projections) {
            log.debug("Applying {} event(s) to inline projection {}", events.size(), projection.getProjectionName());
            projection.apply(context, events);
        }
    }
}
