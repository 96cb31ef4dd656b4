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

package org.sequent.domain;

import java.util.Objects;
import java.util.UUID;

public class QuestEnded implements QuestEvent {
    private UUID questId;

    @SuppressWarnings("unused")
    QuestEnded() {
    }

    public QuestEnded(UUID questId) {
        this.questId = questId;
    }

    @Override
    public UUID getQuestId() {
        return questId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QuestEnded)) return false;
        return Objects.equals(questId, ((QuestEnded) o).questId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(questId);
    }

    @Override
    public String toString() {
        return "QuestEnded{questId=" + questId + '}';
    }
}
