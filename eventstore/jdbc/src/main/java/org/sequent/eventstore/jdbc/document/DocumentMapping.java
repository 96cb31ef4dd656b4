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
import org.sequent.eventstore.jdbc.EventGraph;
import org.sequent.eventstore.jdbc.schema.Tables;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Objects;

/**
 * How a document type is stored: the name of its table and the field that holds its identity.
 * The identity is the field named {@code id}, declared by the document class or one of its super classes.
 */
public final class DocumentMapping<T> {
    private static final String ID_FIELD_NAME = "id";

    private final Class<T> documentType;
    private final String alias;
    private final String tableName;
    private final @Nullable Field idField;

    public DocumentMapping(Class<T> documentType, Tables tables) {
        Objects.requireNonNull(documentType, "Document type cannot be null");
        this.documentType = documentType;
        this.alias = EventGraph.toSnakeCase(documentType.getSimpleName());
        this.tableName = tables.document(alias);
        this.idField = findIdField(documentType);
    }

    public Class<T> getDocumentType() {
        return documentType;
    }

    public String getAlias() {
        return alias;
    }

    public String getTableName() {
        return tableName;
    }

    /**
     * @return The identity of {@code document} as it's stored in the {@code id} column.
     * @throws IllegalArgumentException If the document has no {@code id} field or if it's {@code null}.
     */
    public String storedIdOf(Object document) {
        if (idField == null) {
            throw new IllegalArgumentException(documentType.getName() + " doesn't declare a field named '" + ID_FIELD_NAME + "'");
        }
        Object id;
        try {
            id = idField.get(document);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read the id of " + documentType.getName(), e);
        }
        if (id == null) {
            throw new IllegalArgumentException("The id of " + documentType.getName() + " cannot be null");
        }
        return toStoredId(id);
    }

    /**
     * Set the {@code id} field of {@code document} to {@code id}. Nothing happens if the document has no writable
     * {@code id} field of a compatible type.
     */
    public void assignId(Object document, Object id) {
        if (idField == null || Modifier.isFinal(idField.getModifiers()) || !idField.getType().isInstance(id)) {
            return;
        }
        try {
            idField.set(document, id);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot assign the id of " + documentType.getName(), e);
        }
    }

    public static String toStoredId(Object id) {
        return id.toString();
    }

    private static @Nullable Field findIdField(Class<?> type) {
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (field.getName().equals(ID_FIELD_NAME) && !Modifier.isStatic(field.getModifiers())) {
                    field.setAccessible(true);
                    return field;
                }
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "DocumentMapping[" + documentType.getName() + " -> " + tableName + "]";
    }
}
