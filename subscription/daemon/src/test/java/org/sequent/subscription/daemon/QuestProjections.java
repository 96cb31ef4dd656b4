package org.sequent.subscription.daemon;

import org.sequent.domain.MembersDeparted;
import org.sequent.domain.MembersJoined;
import org.sequent.domain.MonsterSlain;
import org.sequent.domain.QuestEnded;
import org.sequent.domain.QuestParty;
import org.sequent.domain.QuestStarted;
import org.sequent.eventstore.jdbc.projection.AggregationRules;
import org.sequent.eventstore.jdbc.projection.FlatTableProjection;
import org.sequent.eventstore.jdbc.projection.SingleStreamProjection;

class QuestProjections {

    static SingleStreamProjection<QuestParty> questParty() {
        return new SingleStreamProjection<>(AggregationRules.forType(QuestParty.class)
                .createOn(QuestStarted.class, QuestParty::start)
                .applyOn(MembersJoined.class, QuestParty::join)
                .applyOn(MembersDeparted.class, QuestParty::depart)
                .applyOn(MonsterSlain.class, QuestParty::slay)
                .deleteOn(QuestEnded.class));
    }

    static FlatTableProjection monsterTally() {
        return new FlatTableProjection("MonsterTally", "monster_tally", "quest_id", "UUID")
                .column("monsters", "INTEGER")
                .project(MonsterSlain.class, MonsterSlain::getQuestId, row -> row.increment("monsters"));
    }
}
