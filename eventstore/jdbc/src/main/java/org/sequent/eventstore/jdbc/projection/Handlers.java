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

import org.jspecify.annotations.Nullable;

import java.util.Map;

final class Handlers {

    private Handlers() {
    }

    /**
     * Find the handler registered for {@code eventType}, or for the closest registered super type.
     */
    static <H> @Nullable H find(Map<Class<?>, H> handlers, Class<?> eventType) {
        H handler = handlers.get(eventType);
        if (handler != null) {
            return handler;
        }
        for (Map.Entry<Class<?>, H> entry : handlers.entrySet()) {
            if (entry.getKey().isAssignableFrom(eventType)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
