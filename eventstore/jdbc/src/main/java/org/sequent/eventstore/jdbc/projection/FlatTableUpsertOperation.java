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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Updates the row if it exists, inserts it otherwise. Incremented columns are updated relative to their current value.
 */
final class FlatTableUpsertOperation implements FlatTableOperation {
    private final String tableName;
    private final String primaryKeyColumn;
    private final Object primaryKey;
    private final Map<String, Object> values;
    private final Map<String, Number> increments;

    FlatTableUpsertOperation(String tableName, String primaryKeyColumn, Object primaryKey, Map<String, Object> values, Map<String, Number> increments) {
        this.tableName = tableName;
        this.primaryKeyColumn = primaryKeyColumn;
        this.primaryKey = primaryKey;
        this.values = values;
        this.increments = increments;
    }

    @Override
    public void execute(NamedParameterJdbcOperations jdbc) {
        MapSqlParameterSource parameters = new MapSqlParameterSource().addValue("pk", primaryKey);
        List<String> columns = new ArrayList<>();
        List<String> assignments = new ArrayList<>();
        int index = 0;
        for (Map.Entry<String, Object> value : values.entrySet()) {
            String parameter = "v" + index++;
            parameters.addValue(parameter, value.getValue());
            columns.add(value.getKey());
            assignments.add(value.getKey() + " = :" + parameter);
        }
        for (Map.Entry<String, Number> increment : increments.entrySet()) {
            String parameter = "v" + index++;
            parameters.addValue(parameter, increment.getValue());
            columns.add(increment.getKey());
            assignments.add(increment.getKey() + " = COALESCE(" + increment.getKey() + ", 0) + :" + parameter);
        }

        int updated;
        if (assignments.isEmpty()) {
            Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM " + tableName + " WHERE " + primaryKeyColumn + " = :pk", parameters, Integer.class);
            updated = count == null ? 0 : count;
        } else {
            updated = jdbc.update("UPDATE " + tableName + " SET " + String.join(", ", assignments) + " WHERE " + primaryKeyColumn + " = :pk", parameters);
        }

        if (updated == 0) {
            StringJoiner names = new StringJoiner(", ", "(", ")").add(primaryKeyColumn);
            StringJoiner placeholders = new StringJoiner(", ", "(", ")").add(":pk");
            for (int i = 0; i < columns.size(); i++) {
                names.add(columns.get(i));
                placeholders.add(":v" + i);
            }
            jdbc.update("INSERT INTO " + tableName + " " + names + " VALUES " + placeholders, parameters);
        }
    }

    @Override
    public String toString() {
        return "FlatTableUpsertOperation[" + tableName + ", " + primaryKeyColumn + "=" + primaryKey + "]";
    }
}
