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

import org.sequent.eventstore.api.DocumentSessionListener;
import org.sequent.eventstore.api.EventSerializer;
import org.sequent.eventstore.api.StreamIdentity;
import org.sequent.eventstore.api.UnknownEventTypePolicy;
import org.sequent.eventstore.jdbc.projection.ProjectionOptions;
import org.sequent.eventstore.jdbc.schema.Tables;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration of a {@link DocumentStore}.
 * <pre>
 * StoreOptions options = StoreOptions.forDataSource(dataSource)
 *         .streamIdentity(StreamIdentity.AS_STRING)
 *         .tenancy(TenancyStyle.CONJOINED);
 * options.projections().snapshot(new QuestPartyProjection(), ProjectionLifecycle.INLINE);
 * </pre>
 */
public class StoreOptions {
    private final DataSource dataSource;
    private final ProjectionOptions projections = new ProjectionOptions();
    private final Set<Class<?>> eventTypes = new LinkedHashSet<>();
    private final Set<Class<?>> documentTypes = new LinkedHashSet<>();
    private final List<DocumentSessionListener> listeners = new ArrayList<>();
    private String tablePrefix = "sq_";
    private StreamIdentity streamIdentity = StreamIdentity.AS_UUID;
    private TenancyStyle tenancy = TenancyStyle.SINGLE;
    private EventSerializer serializer = new JacksonEventSerializer();
    private Clock clock = Clock.systemUTC();
    private UnknownEventTypePolicy unknownEventTypePolicy = UnknownEventTypePolicy.SKIP;
    private boolean autoCreateSchema = true;

    private StoreOptions(DataSource dataSource) {
        Objects.requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        this.dataSource = dataSource;
    }

    public static StoreOptions forDataSource(DataSource dataSource) {
        return new StoreOptions(dataSource);
    }

    /**
     * Prefix of all tables created by the store, {@code sq_} by default.
     */
    public StoreOptions tablePrefix(String tablePrefix) {
        this.tablePrefix = requireNonNull(tablePrefix, "Table prefix");
        return this;
    }

    public StoreOptions streamIdentity(StreamIdentity streamIdentity) {
        this.streamIdentity = requireNonNull(streamIdentity, StreamIdentity.class.getSimpleName());
        return this;
    }

    public StoreOptions tenancy(TenancyStyle tenancy) {
        this.tenancy = requireNonNull(tenancy, TenancyStyle.class.getSimpleName());
        return this;
    }

    public StoreOptions serializer(EventSerializer serializer) {
        this.serializer = requireNonNull(serializer, EventSerializer.class.getSimpleName());
        return this;
    }

    /**
     * The clock used for event, stream and progress timestamps.
     */
    public StoreOptions clock(Clock clock) {
        this.clock = requireNonNull(clock, Clock.class.getSimpleName());
        return this;
    }

    public StoreOptions unknownEventTypePolicy(UnknownEventTypePolicy unknownEventTypePolicy) {
        this.unknownEventTypePolicy = requireNonNull(unknownEventTypePolicy, UnknownEventTypePolicy.class.getSimpleName());
        return this;
    }

    /**
     * Create the event, stream, progression, document and flat tables when the store is created. Enabled by default.
     */
    public StoreOptions autoCreateSchema(boolean autoCreateSchema) {
        this.autoCreateSchema = autoCreateSchema;
        return this;
    }

    /**
     * Register event types up front so that stored events of these types can be resolved when read.
     */
    public StoreOptions registerEventTypes(Class<?>... eventTypes) {
        this.eventTypes.addAll(Arrays.asList(eventTypes));
        return this;
    }

    /**
     * Register document types up front so that their tables are created with the schema.
     */
    public StoreOptions registerDocumentTypes(Class<?>... documentTypes) {
        this.documentTypes.addAll(Arrays.asList(documentTypes));
        return this;
    }

    /**
     * Register listeners that are called around {@code saveChanges} of every session opened by the store.
     */
    public StoreOptions listeners(DocumentSessionListener... listeners) {
        Arrays.stream(listeners).forEach(listener -> this.listeners.add(requireNonNull(listener, DocumentSessionListener.class.getSimpleName())));
        return this;
    }

    public ProjectionOptions projections() {
        return projections;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public Tables getTables() {
        return new Tables(tablePrefix);
    }

    public StreamIdentity getStreamIdentity() {
        return streamIdentity;
    }

    public TenancyStyle getTenancy() {
        return tenancy;
    }

    public EventSerializer getSerializer() {
        return serializer;
    }

    public Clock getClock() {
        return clock;
    }

    public UnknownEventTypePolicy getUnknownEventTypePolicy() {
        return unknownEventTypePolicy;
    }

    public boolean isAutoCreateSchema() {
        return autoCreateSchema;
    }

    public Set<Class<?>> getEventTypes() {
        return Collections.unmodifiableSet(eventTypes);
    }

    public List<DocumentSessionListener> getListeners() {
        return Collections.unmodifiableList(listeners);
    }

    public Set<Class<?>> getDocumentTypes() {
        return Collections.unmodifiableSet(documentTypes);
    }

    private static <T> T requireNonNull(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        return value;
    }
}
