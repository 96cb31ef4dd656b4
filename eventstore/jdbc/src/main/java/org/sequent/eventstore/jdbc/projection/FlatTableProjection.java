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
import org.sequent.eventstore.jdbc.schema.Tables;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Projects events into rows of a plain table instead of JSON documents.
 * <pre>
 * new FlatTableProjection("quest_stats", "quest_id", "UUID")
 *         .column("name", "VARCHAR(250)")
 *         .column("members", "INTEGER")
 *         .project(QuestStarted.class, QuestStarted::questId, row -&gt; row.set("name", QuestStarted::name))
 *         .project(MembersJoined.class, MembersJoined::questId, row -&gt; row.increment("members", e -&gt; e.members().size()))
 *         .delete(QuestEnded.class, QuestEnded::questId);
 * </pre>
 * A row is created by the first event mapped to it, columns that are incremented start from the first delta.
 */
public class FlatTableProjection extends ProjectionSource {
    private final String tableName;
    private final String primaryKeyColumn;
    private final String primaryKeyType;
    private final Map<String, String> columns = new LinkedHashMap<>();
    private final Map<Class<?>, Function<Object, FlatTableOperation>> rules = new LinkedHashMap<>();

    public FlatTableProjection(String tableName, String primaryKeyColumn, String primaryKeyType) {
        this(tableName, tableName, primaryKeyColumn, primaryKeyType);
    }

    public FlatTableProjection(String projectionName, String tableName, String primaryKeyColumn, String primaryKeyType) {
        super(projectionName);
        this.tableName = Tables.requireValidName(tableName);
        this.primaryKeyColumn = Tables.requireValidName(primaryKeyColumn);
        this.primaryKeyType = Objects.requireNonNull(primaryKeyType, "Primary key type cannot be null");
    }

    public FlatTableProjection column(String name, String sqlType) {
        Objects.requireNonNull(sqlType, "Column type cannot be null");
        columns.put(Tables.requireValidName(name), sqlType);
        return this;
    }

    public <E> FlatTableProjection project(Class<E> eventType, Function<E, ?> primaryKey, Consumer<RowMapping<E>> mapping) {
        Objects.requireNonNull(primaryKey, "Primary key function cannot be null");
        RowMapping<E> row = new RowMapping<>();
        mapping.accept(row);
        rules.put(eventType, event -> {
            E typed = eventType.cast(event);
            Map<String, Object> values = new LinkedHashMap<>();
            row.values.forEach((column, value) -> values.put(column, value.apply(typed)));
            Map<String, Number> increments = new LinkedHashMap<>();
            row.increments.forEach((column, delta) -> increments.put(column, delta.apply(typed)));
            return new FlatTableUpsertOperation(tableName, primaryKeyColumn, requireKey(primaryKey.apply(typed), eventType), values, increments);
        });
        return this;
    }

    public <E> FlatTableProjection delete(Class<E> eventType, Function<E, ?> primaryKey) {
        Objects.requireNonNull(primaryKey, "Primary key function cannot be null");
        rules.put(eventType, event -> new FlatTableDeleteOperation(tableName, primaryKeyColumn, requireKey(primaryKey.apply(eventType.cast(event)), eventType)));
        return this;
    }

    public String getTableName() {
        return tableName;
    }

    @Override
    public Set<Class<?>> includedEventTypes() {
        return Collections.unmodifiableSet(rules.keySet());
    }

    @Override
    public Set<Class<?>> publishedTypes() {
        return Set.of();
    }

    @Override
    public List<String> publishedTables() {
        return List.of(tableName);
    }

    @Override
    public List<String> storageDefinitions() {
        StringJoiner definition = new StringJoiner(", ", "CREATE TABLE IF NOT EXISTS " + tableName + " (", ")");
        definition.add(primaryKeyColumn + " " + primaryKeyType + " PRIMARY KEY");
        columns.forEach((name, type) -> definition.add(name + " " + type));
        return List.of(definition.toString());
    }

    @Override
    public void apply(ProjectionContext context, List<Event> events) {
        for (Event event : events) {
            Function<Object, FlatTableOperation> rule = Handlers.find(rules, event.getEventType());
            if (rule != null) {
                context.queue(rule.apply(event.getData()));
            }
        }
    }

    private Object requireKey(Object key, Class<?> eventType) {
        if (key == null) {
            throw new IllegalArgumentException("Primary key of " + tableName + " derived from " + eventType.getName() + " cannot be null");
        }
        return key;
    }

    /**
     * Maps the values of one event to columns of the row.
     */
    public final class RowMapping<E> {
        private final Map<String, Function<E, ?>> values = new LinkedHashMap<>();
        private final Map<String, Function<E, ? extends Number>> increments = new LinkedHashMap<>();

        private RowMapping() {
        }

        public RowMapping<E> set(String column, Function<E, ?> value) {
            values.put(requireColumn(column), Objects.requireNonNull(value, "Value function cannot be null"));
            return this;
        }

        public RowMapping<E> increment(String column) {
            return increment(column, __ -> 1);
        }

        public RowMapping<E> increment(String column, Function<E, ? extends Number> delta) {
            increments.put(requireColumn(column), Objects.requireNonNull(delta, "Delta function cannot be null"));
            return this;
        }

        public RowMapping<E> decrement(String column) {
            return increment(column, __ -> -1);
        }

        private String requireColumn(String column) {
            if (!columns.containsKey(column)) {
                throw new IllegalArgumentException("Column '" + column + "' is not defined in " + tableName);
            }
            return column;
        }
    }
}
