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

/**
 * Processes events for side effects, such as publishing them to a message broker, instead of building documents.
 * Subscriptions are registered with {@link ProjectionOptions#subscribe(String, Subscription, Class[])} and are run by the
 * projection daemon, which records how far each subscription has come just like it does for asynchronous projections.
 * <p>
 * {@code processEvents} is called once per tenant and page, inside the transaction that records the progress. Documents
 * written through {@code context} are committed together with the progress. Work that must only happen once the page is
 * committed should be registered with {@link ProjectionContext#afterCommit(Runnable)}.
 */
@FunctionalInterface
public interface Subscription {

    void processEvents(List<Event> events, ProjectionContext context);
}
