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

package org.sequent.eventstore.jdbc;

/**
 * How tenants share the event store tables.
 */
public enum TenancyStyle {
    /**
     * Every row belongs to {@link #DEFAULT_TENANT_ID}.
     */
    SINGLE,
    /**
     * Rows of all tenants live in the same tables, distinguished by the {@code tenant_id} column.
     */
    CONJOINED;

    public static final String DEFAULT_TENANT_ID = "*DEFAULT*";
}
