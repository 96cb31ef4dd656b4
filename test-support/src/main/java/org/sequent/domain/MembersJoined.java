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

import java.util.List;
import java.util.Objects;
import java.util.UUID;

public class MembersJoined implements QuestEvent {
    private UUID questId;
    private int day;
    private String location;
    private List<String> members;

    @SuppressWarnings("unused")
    MembersJoined() {
    }

    public MembersJoined(UUID questId, int day, String location, List<String> members) {
        this.questId = questId;
        this.day = day;
        this.location = location;
        this.members = List.copyOf(members);
    }

    public MembersJoined(UUID questId, int day, String location, String... members) {
        this(questId, day, location, List.of(members));
    }

    @Override
    public UUID getQuestId() {
        return questId;
    }

    public int getDay() {
        return day;
    }

    public String getLocation() {
        return location;
    }

    public List<String> getMembers() {
        return members;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MembersJoined)) return false;
        MembersJoined that = (MembersJoined) o;
        return day == that.day && Objects.equals(questId, that.questId) && Objects.equals(location, that.location) && Objects.equals(members, that.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(questId, day, location, members);
    }

    @Override
    public String toString() {
        return "MembersJoined{" +
                "questId=" + questId +
                ", day=" + day +
                ", location='" + location + '\'' +
                ", members=" + members +
                '}';
    }
}
