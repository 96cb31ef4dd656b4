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

package org.sequent.eventstore.jdbc.document;

import org.jspecify.annotations.Nullable;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;

import java.util.StringJoiner;

public class DeleteDocumentOperation implements DocumentOperation {
    private final DocumentMapping<?> mapping;
    private final String tenantId;
    private final String storedId;

    DeleteDocumentOperation(DocumentMapping<?> mapping, String tenantId, String storedId) {
        this.mapping = mapping;
        this.tenantId = tenantId;
        this.storedId = storedId;
    }

    @Override
    public void execute(NamedParameterJdbcOperations jdbc) {
        jdbc.update("DELETE FROM " + mapping.getTableName() + " WHERE tenant_id = :tenantId AND id = :id",
                new MapSqlParameterSource().addValue("id", storedId).addValue("tenantId", tenantId));
    }

    @Override
    public Class<?> getDocumentType() {
        return mapping.getDocumentType();
    }

    @Override
    public String getTenantId() {
        return tenantId;
    }

    @Override
    public String getStoredId() {
        return storedId;
    }

    @Override
    public @Nullable Object getDocument() {
        return null;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", DeleteDocumentOperation.class.getSimpleName() + "[", "]")
                .add("table=" + mapping.getTableName())
                .add("id='" + storedId + "'")
                .add("tenantId='" + tenantId + "'")
                .toString();
    }
}
