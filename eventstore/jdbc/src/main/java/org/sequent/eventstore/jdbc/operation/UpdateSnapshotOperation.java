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

import org.jspecify.annotations.Nullable;
import org.sequent.eventstore.api.EventSerializer;
import org.sequent.eventstore.jdbc.schema.Tables;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;

import java.sql.Types;
import java.util.StringJoiner;

/**
 * Caches the aggregated state of a stream on the stream row, so that it can be used as the starting point of later aggregations.
 * A {@code null} snapshot clears the cache.
 */
public class UpdateSnapshotOperation implements StorageOperation {
    private final Tables tables;
    private final EventSerializer serializer;
    private final Object streamIdentity;
    private final String tenantId;
    private final @Nullable Object snapshot;
    private final long snapshotVersion;

    public UpdateSnapshotOperation(Tables tables, EventSerializer serializer, Object streamIdentity, String tenantId, @Nullable Object snapshot, long snapshotVersion) {
        this.tables = tables;
        this.serializer = serializer;
        this.streamIdentity = streamIdentity;
        this.tenantId = tenantId;
        this.snapshot = snapshot;
        this.snapshotVersion = snapshotVersion;
    }

    @Override
    public void execute(NamedParameterJdbcOperations jdbc) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", streamIdentity)
                .addValue("tenantId", tenantId)
                .addValue("snapshot", snapshot == null ? null : serializer.toJson(snapshot), Types.VARCHAR)
                .addValue("snapshotVersion", snapshot == null ? null : snapshotVersion, Types.BIGINT);
        jdbc.update("UPDATE " + tables.streams() + " SET snapshot = :snapshot, snapshot_version = :snapshotVersion WHERE id = :id AND tenant_id = :tenantId", params);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", UpdateSnapshotOperation.class.getSimpleName() + "[", "]")
                .add("stream=" + streamIdentity)
                .add("tenantId='" + tenantId + "'")
                .add("snapshotVersion=" + snapshotVersion)
                .toString();
    }
}
