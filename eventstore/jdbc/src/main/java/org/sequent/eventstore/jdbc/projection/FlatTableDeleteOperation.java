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

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;

final class FlatTableDeleteOperation implements FlatTableOperation {
    private final String tableName;
    private final String primaryKeyColumn;
    private final Object primaryKey;

    FlatTableDeleteOperation(String tableName, String primaryKeyColumn, Object primaryKey) {
        this.tableName = tableName;
        this.primaryKeyColumn = primaryKeyColumn;
        this.primaryKey = primaryKey;
    }

    @Override
    public void execute(NamedParameterJdbcOperations jdbc) {
        jdbc.update("DELETE FROM " + tableName + " WHERE " + primaryKeyColumn + " = :pk", new MapSqlParameterSource("pk", primaryKey));
    }

    @Override
    public String toString() {
        return "FlatTableDeleteOperation[" + tableName + ", " + primaryKeyColumn + "=" + primaryKey + "]";
    }
}
