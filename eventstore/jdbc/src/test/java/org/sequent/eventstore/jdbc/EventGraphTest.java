package org.sequent.eventstore.jdbc;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.sequent.domain.MembersJoined;
import org.sequent.domain.QuestParty;
import org.sequent.domain.QuestStarted;
import org.sequent.eventstore.api.Event;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class EventGraphTest {

    private final EventGraph eventGraph = new EventGraph();

    @Test
    void event_type_names_are_the_snake_cased_simple_names() {
        assertAll(
                () -> assertThat(EventGraph.toEventTypeName(QuestStarted.class)).isEqualTo("quest_started"),
                () -> assertThat(EventGraph.toEventTypeName(MembersJoined.class)).isEqualTo("members_joined"),
                () -> assertThat(eventGraph.aggregateAliasFor(QuestParty.class)).isEqualTo("QuestParty")
        );
    }

    @Test
    void wrapping_an_event_assigns_its_type_names() {
        // When
        Event event = eventGraph.wrap(new QuestStarted(UUID.randomUUID(), "Destroy the ring"));

        // Then
        assertAll(
                () -> assertThat(event.getEventTypeName()).isEqualTo("quest_started"),
                () -> assertThat(event.getJavaTypeName()).isEqualTo(QuestStarted.class.getName()),
                () -> assertThat(event.getSequence()).isZero()
        );
    }

    @Test
    void wrapped_types_can_be_resolved_by_java_type_name() {
        // Given
        eventGraph.register(List.of(MembersJoined.class));

        // Then
        assertAll(
                () -> assertThat(eventGraph.resolve(MembersJoined.class.getName())).hasValueSatisfying(mapping -> assertThat(mapping.eventType()).isEqualTo(MembersJoined.class)),
                () -> assertThat(eventGraph.resolve("com.example.Unknown")).isEmpty()
        );
    }

    @Test
    void the_envelope_cannot_be_registered_as_an_event_type() {
        // When
        Throwable throwable = catchThrowable(() -> eventGraph.eventMappingFor(Event.class));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrent_lookups_return_the_same_mapping() {
        // When
        ConcurrentLinkedQueue<EventMapping> mappings = new ConcurrentLinkedQueue<>();
        IntStream.range(0, 100).parallel().forEach(__ -> mappings.add(eventGraph.eventMappingFor(QuestStarted.class)));

        // Then
        assertThat(mappings).hasSize(100).allMatch(mapping -> mapping == mappings.peek());
    }
}
