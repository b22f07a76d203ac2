package com.example.protocolrebuild.partition;

import com.example.protocolrebuild.document.ProtocolDocument;
import com.example.protocolrebuild.suggestion.InvalidSuggestionException;
import com.example.protocolrebuild.suggestion.ModificationType;
import com.example.protocolrebuild.suggestion.Suggestion;
import com.example.protocolrebuild.support.Protocols;
import com.example.protocolrebuild.validation.ValidationError;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("SectionPartitioner")
class SectionPartitionerTest {

    private static final SectionSizeTable TWO_PER_SECTION = new SectionSizeTable(List.of(new SectionSizeTable.Tier(1_000_000, 2)), 1);

    private final ProtocolDocument triage = Protocols.triage();

    @Test
    @DisplayName("metadata section first, then contiguous node sections of the configured size")
    void twoTwoOne() {
        SectionPartitioner partitioner = new SectionPartitioner(Protocols.CODEC, TWO_PER_SECTION, 100_000);

        List<Section> sections = partitioner.partition(triage, List.of(
                Protocols.modify("s1", "n3", "description", "Adult check"),
                Protocols.modify("s2", "metadata", "changelog", "reviewed")));

        assertThat(sections).extracting(Section::kind)
                .containsExactly(SectionKind.METADATA, SectionKind.NODES, SectionKind.NODES, SectionKind.NODES);
        assertThat(sections).extracting(Section::nodeIds)
                .containsExactly(List.of(), List.of("n1", "n2"), List.of("n3", "n4"), List.of("n5"));
        assertThat(sections.get(0).suggestions()).extracting(Suggestion::id).containsExactly("s2");
        assertThat(sections.get(2).suggestions()).extracting(Suggestion::id).containsExactly("s1");
        assertThat(sections.get(1).hasSuggestions()).isFalse();
        assertThat(sections).extracting(Section::index).containsExactly(0, 1, 2, 3);
    }

    @Test
    @DisplayName("same input yields the same sections")
    void deterministic() {
        SectionPartitioner partitioner = new SectionPartitioner(Protocols.CODEC, SectionSizeTable.defaults(), 12_000);
        List<Suggestion> suggestions = List.of(Protocols.modify("s1", "n5", "description", "Rest at home"));

        assertEquals(partitioner.partition(triage, suggestions), partitioner.partition(Protocols.triage(), suggestions));
    }

    @Test
    @DisplayName("small documents use the first tier of the default table")
    void defaultTable() {
        SectionPartitioner partitioner = new SectionPartitioner(Protocols.CODEC, SectionSizeTable.defaults(), 12_000);

        List<Section> sections = partitioner.partition(triage, List.of());

        assertThat(sections).extracting(Section::nodeIds)
                .containsExactly(List.of(), List.of("n1", "n2", "n3"), List.of("n4", "n5"));
    }

    @Test
    @DisplayName("character budget closes a section early")
    void characterBudget() {
        SectionPartitioner partitioner = new SectionPartitioner(Protocols.CODEC, TWO_PER_SECTION, 1);

        List<Section> sections = partitioner.partition(triage, List.of());

        assertThat(sections).hasSize(6);
        assertThat(sections.subList(1, 6)).allMatch(s -> s.nodeIds().size() == 1);
    }

    @Test
    @DisplayName("size table picks tiers by document size")
    void sizeTable() {
        SectionSizeTable table = SectionSizeTable.defaults();

        assertEquals(3, table.nodesPerSection(20_000));
        assertEquals(2, table.nodesPerSection(20_001));
        assertEquals(1, table.nodesPerSection(60_001));
    }

    @Nested
    @DisplayName("target checks")
    class Targets {

        private final SectionPartitioner partitioner = new SectionPartitioner(Protocols.CODEC, SectionSizeTable.defaults(), 12_000);

        @Test
        @DisplayName("unknown node is rejected with a hint")
        void unknownNode() {
            assertThatThrownBy(() -> partitioner.partition(triage, List.of(Protocols.modify("s1", "n55", "description", "x"))))
                    .isInstanceOfSatisfying(InvalidSuggestionException.class, e -> assertThat(e.getErrors())
                            .extracting(ValidationError::message)
                            .containsExactly("unknown node 'n55' (did you mean 'n5'?)"));
        }

        @Test
        @DisplayName("every problem in the batch is reported")
        void allProblems() {
            List<Suggestion> suggestions = List.of(
                    Protocols.modify("s1", "n1", "questions[", "x"),
                    Protocols.modify("s1", "metadata", "name", "renamed"),
                    new Suggestion("s3", "n2", "description", ModificationType.ADD, null, null, null));

            assertThatThrownBy(() -> partitioner.checkTargets(triage, suggestions))
                    .isInstanceOfSatisfying(InvalidSuggestionException.class, e -> assertThat(e.getErrors())
                            .extracting(ValidationError::location)
                            .containsExactly(
                                    "suggestions[s1].target_field",
                                    "suggestions[s1].id",
                                    "suggestions[s1].target_field",
                                    "suggestions[s3].proposed_value"));
        }

        @Test
        @DisplayName("removals need no proposed value")
        void removal() {
            partitioner.checkTargets(triage, List.of(
                    Protocols.remove("s1", "n4", "effects[e1]"),
                    Protocols.modify("s2", "metadata", "changelog", "x")));
        }
    }
}
