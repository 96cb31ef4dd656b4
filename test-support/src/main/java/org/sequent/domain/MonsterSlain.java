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

public class MonsterSlain implements QuestEvent {
    private UUID questId;
    private String monster;

    @SuppressWarnings("unused")
    MonsterSlain() {
    }

    public MonsterSlain(UUID questId, String monster) {
        this.questId = questId;
        this.monster = monster;
    }

    @Override
    public UUID getQuestId() {
        return questId;
    }

    public String getMonster() {
        return monster;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MonsterSlain)) return false;
        MonsterSlain that = (MonsterSlain) o;
        return Objects.equals(questId, that.questId) && Objects.equals(monster, that.monster);
    }

    @Override
    public int hashCode() {
        return Objects.hash(questId, monster);
    }

    @Override
    public String toString() {
        return "MonsterSlain{" +
                "questId=" + questId +
                ", monster='" + monster + '\'' +
                '}';
    }
}
