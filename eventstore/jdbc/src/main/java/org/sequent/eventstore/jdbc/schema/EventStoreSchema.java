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

import org.sequent.eventstore.api.StreamIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcOperations;

import java.util.List;
import java.util.Objects;

/**
 * Creates the tables used by the event store if they don't already exist.
 */
public class EventStoreSchema {
    private static final Logger log = LoggerFactory.getLogger(EventStoreSchema.class);

    private final JdbcOperations jdbc;
    private final Tables tables;
    private final StreamIdentity streamIdentity;

    public EventStoreSchema(JdbcOperations jdbc, Tables tables, StreamIdentity streamIdentity) {
        Objects.requireNonNull(jdbc, JdbcOperations.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(tables, Tables.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(streamIdentity, StreamIdentity.class.getSimpleName() + " cannot be null");
        this.jdbc = jdbc;
        this.tables = tables;
        this.streamIdentity = streamIdentity;
    }

    public void ensureEventTables() {
        execute(eventTableStatements());
    }

    public void ensureDocumentTable(String tableName) {
        execute(List.of(documentTableStatement(tableName)));
    }

    public void execute(List<String> statements) {
        for (String statement : statements) {
            log.debug("Executing DDL: {}", statement);
            jdbc.execute(statement);
        }
    }

    public List<String> eventTableStatements() {
        String streamIdType = streamIdentity == StreamIdentity.AS_UUID ? "UUID" : "VARCHAR(250)";
        return List.of(
                "CREATE TABLE IF NOT EXISTS " + tables.streams() + " (" +
                        "id " + streamIdType + " NOT NULL, " +
                        "tenant_id VARCHAR(250) NOT NULL, " +
                        "type VARCHAR(500), " +
                        "version BIGINT NOT NULL, " +
                        "timestamp TIMESTAMP WITH TIME ZONE NOT NULL, " +
                        "created TIMESTAMP WITH TIME ZONE NOT NULL, " +
                        "snapshot VARCHAR, " +
                        "snapshot_version BIGINT, " +
                        "is_archived BOOLEAN DEFAULT FALSE NOT NULL, " +
                        "PRIMARY KEY (tenant_id, id))",
                "CREATE TABLE IF NOT EXISTS " + tables.events() + " (" +
                        "seq_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
                        "id UUID NOT NULL, " +
                        "stream_id " + streamIdType + " NOT NULL, " +
                        "version BIGINT NOT NULL, " +
                        "data VARCHAR NOT NULL, " +
                        "type VARCHAR(500) NOT NULL, " +
                        "java_type VARCHAR(1000), " +
                        "timestamp TIMESTAMP WITH TIME ZONE NOT NULL, " +
                        "tenant_id VARCHAR(250) NOT NULL, " +
                        "is_archived BOOLEAN DEFAULT FALSE NOT NULL, " +
                        "CONSTRAINT " + tables.events() + "_stream_version_uk UNIQUE (tenant_id, stream_id, version))",
                "CREATE TABLE IF NOT EXISTS " + tables.eventProgression() + " (" +
                        "name VARCHAR(250) NOT NULL PRIMARY KEY, " +
                        "last_seq_id BIGINT NOT NULL, " +
                        "last_updated TIMESTAMP WITH TIME ZONE NOT NULL)"
        );
    }

    public String documentTableStatement(String tableName) {
        return "CREATE TABLE IF NOT EXISTS " + Tables.requireValidName(tableName) + " (" +
                "id VARCHAR(250) NOT NULL, " +
                "tenant_id VARCHAR(250) NOT NULL, " +
                "data VARCHAR NOT NULL, " +
                "last_modified TIMESTAMP WITH TIME ZONE NOT NULL, " +
                "PRIMARY KEY (tenant_id, id))";
    }
}
