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

package org.sequent.eventstore.jdbc.internal;

import org.sequent.eventstore.api.StreamAction;
import org.sequent.eventstore.api.StreamActionType;
import org.sequent.eventstore.jdbc.operation.StorageOperation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The pending work of one session: stream actions and storage operations that are written together by {@code saveChanges}.
 * Not thread-safe, a session is used by one thread at a time.
 */
public class WorkTracker {
    private final List<StreamAction> streams = new ArrayList<>();
    private final List<StorageOperation> operations = new ArrayList<>();
    private int executed;

    public List<StreamAction> streams() {
        return Collections.unmodifiableList(streams);
    }

    public Optional<StreamAction> tryFindStream(Object streamIdentity) {
        return streams.stream().filter(stream -> stream.hasIdentity(streamIdentity)).findFirst();
    }

    public void addStream(StreamAction stream) {
        streams.add(stream);
    }

    public void add(StorageOperation operation) {
        operations.add(operation);
    }

    public List<StorageOperation> operations() {
        return Collections.unmodifiableList(operations);
    }

    /**
     * Return the storage operations that haven't been executed yet, in the order they were added, and mark them as executed.
     * They stay tracked until {@link #reset()} or {@link #rollbackTo(Savepoint)}.
     */
    public List<StorageOperation> takeUnexecutedOperations() {
        List<StorageOperation> unexecuted = new ArrayList<>(operations.subList(executed, operations.size()));
        executed = operations.size();
        return unexecuted;
    }

    public Savepoint savepoint() {
        return new Savepoint(streams.size(), operations.size(), executed);
    }

    /**
     * Forget the streams and operations added after {@code savepoint} and mark the ones before it as unexecuted again, as they were when
     * the savepoint was taken.
     */
    public void rollbackTo(Savepoint savepoint) {
        streams.subList(savepoint.streamCount(), streams.size()).clear();
        operations.subList(savepoint.operationCount(), operations.size()).clear();
        executed = savepoint.executedCount();
    }

    public boolean hasOutstandingWork() {
        return executed < operations.size() || streams.stream().anyMatch(WorkTracker::isWritable);
    }

    /**
     * A started stream is written even without events, an append without events is only a version check that is skipped.
     */
    public static boolean isWritable(StreamAction stream) {
        return stream.getActionType() == StreamActionType.START || !stream.getEvents().isEmpty();
    }

    public void reset() {
        streams.clear();
        operations.clear();
        executed = 0;
    }

    public record Savepoint(int streamCount, int operationCount, int executedCount) {
    }
}
