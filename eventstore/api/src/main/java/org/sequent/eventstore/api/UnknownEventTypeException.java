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

package org.sequent.eventstore.api;

import java.util.StringJoiner;

/**
 * Thrown when a stored event refers to a type that isn't registered, and unknown event types are configured to fail.
 */
public class UnknownEventTypeException extends RuntimeException {
    public final long sequence;
    public final String eventTypeName;
    public final String javaTypeName;

    public UnknownEventTypeException(long sequence, String eventTypeName, String javaTypeName) {
        super("Cannot resolve event type '" + javaTypeName + "' (" + eventTypeName + ") of event with sequence " + sequence);
        this.sequence = sequence;
        this.eventTypeName = eventTypeName;
        this.javaTypeName = javaTypeName;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", UnknownEventTypeException.class.getSimpleName() + "[", "]")
                .add("sequence=" + sequence)
                .add("eventTypeName='" + eventTypeName + "'")
                .add("javaTypeName='" + javaTypeName + "'")
                .toString();
    }
}
