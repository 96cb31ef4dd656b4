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

package org.sequent.eventstore.jdbc.schema;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Names of the tables used by the event store.
 */
public final class Tables {
    private static final Pattern VALID_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    private final String prefix;

    public Tables(String prefix) {
        Objects.requireNonNull(prefix, "Table prefix cannot be null");
        if (!prefix.isEmpty() && !VALID_NAME.matcher(prefix).matches()) {
            throw new IllegalArgumentException("Invalid table prefix: " + prefix);
        }
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    public String events() {
        return prefix + "events";
    }

    public String streams() {
        return prefix + "streams";
    }

    public String eventProgression() {
        return prefix + "event_progression";
    }

    public String document(String documentAlias) {
        return requireValidName(prefix + "doc_" + documentAlias);
    }

    public static String requireValidName(String name) {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid table or column name: " + name);
        }
        return name;
    }

    @Override
    public String toString() {
        return "Tables[prefix='" + prefix + "']";
    }
}
