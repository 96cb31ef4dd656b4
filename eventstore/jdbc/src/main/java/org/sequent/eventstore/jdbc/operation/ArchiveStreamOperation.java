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

package org.sequent.eventstore.jdbc.operation;

import org.sequent.eventstore.jdbc.schema.Tables;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;

import java.util.StringJoiner;

/**
 * Sets the archived flag of a stream and all of its events.
 */
public class ArchiveStreamOperation implements StorageOperation {
    private final Tables tables;
    private final Object streamIdentity;
    private final String tenantId;
    private final boolean archived;

    public ArchiveStreamOperation(Tables tables, Object streamIdentity, String tenantId, boolean archived) {
        this.tables = tables;
        this.streamIdentity = streamIdentity;
        this.tenantId = tenantId;
        this.archived = archived;
    }

    @Override
    public void execute(NamedParameterJdbcOperations jdbc) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", streamIdentity)
                .addValue("tenantId", tenantId)
                .addValue("archived", archived);
        jdbc.update("UPDATE " + tables.streams() + " SET is_archived = :archived WHERE id = :id AND tenant_id = :tenantId", params);
        jdbc.update("UPDATE " + tables.events() + " SET is_archived = :archived WHERE stream_id = :id AND tenant_id = :tenantId", params);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ArchiveStreamOperation.class.getSimpleName() + "[", "]")
                .add("stream=" + streamIdentity)
                .add("tenantId='" + tenantId + "'")
                .add("archived=" + archived)
                .toString();
    }
}
