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

public class QuestStarted implements QuestEvent {
    private UUID questId;
    private String name;

    @SuppressWarnings("unused")
    QuestStarted() {
    }

    public QuestStarted(UUID questId, String name) {
        this.questId = questId;
        this.name = name;
    }

    @Override
    public UUID getQuestId() {
        return questId;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QuestStarted)) return false;
        QuestStarted that = (QuestStarted) o;
        return Objects.equals(questId, that.questId) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(questId, name);
    }

    @Override
    public String toString() {
        return "QuestStarted{" +
                "questId=" + questId +
                ", name='" + name + '\'' +
                '}';
    }
}
