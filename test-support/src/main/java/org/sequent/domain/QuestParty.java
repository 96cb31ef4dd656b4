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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * The members of a quest, aggregated from its stream.
 */
public class QuestParty {
    private UUID id;
    private String name;
    private List<String> members = new ArrayList<>();
    private int monstersSlain;

    @SuppressWarnings("unused")
    QuestParty() {
    }

    public QuestParty(String name) {
        this.name = name;
    }

    public static QuestParty start(QuestStarted started) {
        QuestParty party = new QuestParty(started.getName());
        party.id = started.getQuestId();
        return party;
    }

    public QuestParty join(MembersJoined joined) {
        joined.getMembers().stream().filter(member -> !members.contains(member)).forEach(members::add);
        return this;
    }

    public QuestParty depart(MembersDeparted departed) {
        members.removeAll(departed.getMembers());
        return this;
    }

    public QuestParty slay(MonsterSlain slain) {
        monstersSlain++;
        return this;
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<String> getMembers() {
        return members;
    }

    public int getMonstersSlain() {
        return monstersSlain;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QuestParty)) return false;
        QuestParty that = (QuestParty) o;
        return monstersSlain == that.monstersSlain && Objects.equals(id, that.id) && Objects.equals(name, that.name) && Objects.equals(members, that.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, members, monstersSlain);
    }

    @Override
    public String toString() {
        return "QuestParty{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", members=" + members +
                ", monstersSlain=" + monstersSlain +
                '}';
    }
}
