package com.example.protocolrebuild.audit;

import com.example.protocolrebuild.assembly.SectionAssembler;
import com.example.protocolrebuild.document.ChangelogMarker;
import com.example.protocolrebuild.document.FieldPath;
import com.example.protocolrebuild.document.ProtocolDocument;
import com.example.protocolrebuild.document.ProtocolNode;
import com.example.protocolrebuild.document.ProtocolVersion;
import com.example.protocolrebuild.partition.Section;
import com.example.protocolrebuild.partition.SectionKind;
import com.example.protocolrebuild.regeneration.FieldFlag;
import com.example.protocolrebuild.regeneration.SectionOutcome;
import com.example.protocolrebuild.regeneration.SectionStatus;
import com.example.protocolrebuild.suggestion.RejectedSuggestion;
import com.example.protocolrebuild.suggestion.Suggestion;
import com.example.protocolrebuild.support.Protocols;
import com.example.protocolrebuild.validation.ErrorKind;
import com.example.protocolrebuild.validation.ValidationError;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tools.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ChangeVerifier")
class ChangeVerifierTest {

    private static final ProtocolVersion TARGET = ProtocolVersion.parse("1.0.1");

    private final ProtocolDocument triage = Protocols.triage();
    private final ChangeVerifier verifier = new ChangeVerifier();

    private final Suggestion changelog = Protocols.modify("s0", "metadata", "changelog", "reviewed");
    private final Suggestion unchanged = Protocols.modify("s5", "n1", "description", "Patient basics");
    private final Suggestion applied = Protocols.modify("s1", "n3", "description", "Adult check");
    private final Suggestion stillPresent = Protocols.remove("s4", "n4", "condition");
    private final Suggestion inFailedSection = Protocols.modify("s2", "n5", "description", "Rest");
    private final Suggestion withheld = Protocols.modify("s3", "n1", "condition", "helper(q_age)");

    private final FieldFlag strayFlag = new FieldFlag("n4", FieldPath.parse("effects[e1].condition"),
            "unknown identifier 'q_x'; reverted to no value");

    private List<SectionOutcome> outcomes;
    private ProtocolDocument result;

    private ProtocolNode node(String id) {
        return triage.node(id).orElseThrow();
    }

    @BeforeEach
    void setUp() {
        ObjectNode metadata = triage.metadata().fields().deepCopy();
        metadata.putArray("changelog").add("reviewed");
        ObjectNode n3 = node("n3").fieldsCopy();
        n3.put("description", "Adult check [CHANGELOG v1.0.1] s1");

        outcomes = List.of(
                new SectionOutcome(new Section(0, SectionKind.METADATA, List.of(), List.of(changelog), 0),
                        SectionStatus.REGENERATED, List.of(), metadata, List.of(), List.of(), null),
                new SectionOutcome(new Section(1, SectionKind.NODES, List.of("n1", "n2"), List.of(unchanged), 0),
                        SectionStatus.REGENERATED, List.of(node("n1"), node("n2")), null, List.of(), List.of(), null),
                new SectionOutcome(new Section(2, SectionKind.NODES, List.of("n3", "n4"), List.of(applied, stillPresent), 0),
                        SectionStatus.REGENERATED, List.of(node("n3").withFields(n3), node("n4")), null, List.of(strayFlag), List.of(), null),
                new SectionOutcome(new Section(3, SectionKind.NODES, List.of("n5"), List.of(inFailedSection), 0),
                        SectionStatus.FAILED, List.of(node("n5")), null, List.of(), List.of(),
                        new ValidationError(ErrorKind.ORACLE, "section[3]", "model not found")));
        result = new SectionAssembler().assemble(triage, outcomes, TARGET);
    }

    private AuditReport verify() {
        RejectedSuggestion rejected = new RejectedSuggestion(withheld,
                new ValidationError(ErrorKind.EXPRESSION_SAFETY, "suggestions[s3].proposed_value", "disallowed call helper(...)"));
        return verifier.verify(triage, result, List.of(changelog, unchanged, applied, stillPresent, inFailedSection, withheld),
                List.of(rejected), outcomes);
    }

    @Test
    @DisplayName("each suggestion is judged by comparing the documents")
    void outcomes() {
        AuditReport report = verify();
        Map<String, AuditEntry> bySuggestion = report.entries().stream()
                .filter(e -> !e.isSectionProblem())
                .collect(Collectors.toMap(AuditEntry::suggestionId, Function.identity()));

        assertEquals(AuditOutcome.APPLIED, bySuggestion.get("s0").outcome());
        assertEquals(AuditOutcome.APPLIED, bySuggestion.get("s1").outcome());
        assertEquals("Derived flags", bySuggestion.get("s1").before());
        assertEquals("Adult check [CHANGELOG v1.0.1] s1", bySuggestion.get("s1").after());
        assertTrue(bySuggestion.get("s1").changelogMarker());

        assertEquals(AuditOutcome.SKIPPED, bySuggestion.get("s5").outcome());
        assertEquals("field value is unchanged", bySuggestion.get("s5").reason());
        assertEquals(AuditOutcome.SKIPPED, bySuggestion.get("s4").outcome());
        assertEquals("field is still present", bySuggestion.get("s4").reason());

        assertEquals(AuditOutcome.FAILED, bySuggestion.get("s2").outcome());
        assertEquals("section 3 failed after 0 attempt(s): model not found", bySuggestion.get("s2").reason());
        assertEquals(AuditOutcome.FAILED, bySuggestion.get("s3").outcome());
        assertEquals("withheld before regeneration: disallowed call helper(...)", bySuggestion.get("s3").reason());

        assertEquals(2, report.count(AuditOutcome.APPLIED));
        assertEquals(2, report.count(AuditOutcome.SKIPPED));
        assertEquals(2, report.count(AuditOutcome.FAILED));
        assertTrue(report.hasFailures());
    }

    @Test
    @DisplayName("failed sections and unexplained reverted fields need manual follow-up")
    void sectionProblems() {
        List<AuditEntry> problems = verify().entries().stream().filter(AuditEntry::isSectionProblem).toList();

        assertThat(problems).extracting(AuditEntry::sectionIndex).containsExactly(2, 3);
        assertEquals("effects[e1].condition", problems.get(0).targetField());
        assertEquals("section kept its original content: [ORACLE] section[3]: model not found", problems.get(1).reason());
    }

    @Test
    @DisplayName("reverted field explains the suggestion that targeted it")
    void flaggedSuggestion() {
        Suggestion condition = Protocols.modify("s7", "n4", "condition", "eval(q_age)");
        FieldFlag flag = new FieldFlag("n4", FieldPath.of("condition"), "disallowed keyword 'eval'; reverted to original value");
        SectionOutcome outcome = new SectionOutcome(new Section(2, SectionKind.NODES, List.of("n3", "n4"), List.of(condition), 0),
                SectionStatus.REGENERATED, List.of(node("n3"), node("n4")), null, List.of(flag), List.of(), null);
        ProtocolDocument assembled = new SectionAssembler().assemble(triage, List.of(outcome), TARGET);

        AuditReport report = verifier.verify(triage, assembled, List.of(condition), List.of(), List.of(outcome));

        assertThat(report.entries()).singleElement().satisfies(entry -> {
            assertEquals(AuditOutcome.FAILED, entry.outcome());
            assertEquals("rejected: disallowed keyword 'eval'; reverted to original value", entry.reason());
        });
    }

    @Test
    @DisplayName("rendered ledger")
    void render() {
        String text = verify().render();

        assertThat(text)
                .startsWith("RECONSTRUCTION AUDIT: triage v1.0.0 -> v1.0.1\n")
                .contains("Result: COMPLETED WITH FAILURES - manual follow-up required")
                .contains("Suggestions: 2 applied, 2 skipped, 2 failed")
                .contains("[APPLIED] s1 n3 description")
                .contains("changelog marker: present")
                .contains("section 3 [n5] FAILED attempts=0 retries=0")
                .contains("MANUAL FOLLOW-UP")
                .contains("- section 2 node n4 field effects[e1].condition: unknown identifier 'q_x'; reverted to no value");
    }

    @Test
    @DisplayName("clean run has no failures")
    void clean() {
        SectionOutcome outcome = outcomes.get(2);
        SectionOutcome withoutFlags = new SectionOutcome(new Section(2, SectionKind.NODES, List.of("n3", "n4"), List.of(applied), 0),
                SectionStatus.REGENERATED, outcome.nodes(), null, List.of(), List.of(), null);
        ProtocolDocument assembled = new SectionAssembler().assemble(triage, List.of(withoutFlags), TARGET);

        AuditReport report = verifier.verify(triage, assembled, List.of(applied), List.of(), List.of(withoutFlags));

        assertFalse(report.hasFailures());
        assertThat(report.render()).contains("Result: COMPLETED\n").doesNotContain("MANUAL FOLLOW-UP");
    }

    private AuditEntry verifySingle(Suggestion suggestion, String n3Description) {
        ObjectNode n3 = node("n3").fieldsCopy();
        if (n3Description == null) {
            n3.remove("description");
        } else {
            n3.put("description", n3Description);
        }
        SectionOutcome outcome = new SectionOutcome(new Section(2, SectionKind.NODES, List.of("n3", "n4"), List.of(suggestion), 0),
                SectionStatus.REGENERATED, List.of(node("n3").withFields(n3), node("n4")), null, List.of(), List.of(), null);
        ProtocolDocument assembled = new SectionAssembler().assemble(triage, List.of(outcome), TARGET);
        return verifier.verify(triage, assembled, List.of(suggestion), List.of(), List.of(outcome)).entries().get(0);
    }

    @Test
    @DisplayName("a changelog note alone does not count as the requested change")
    void noteOnlyIsSkipped() {
        AuditEntry entry = verifySingle(applied, "Derived flags\n\n[CHANGELOG v1.0.1]: updated - Suggestion ID: s1");

        assertEquals(AuditOutcome.SKIPPED, entry.outcome());
        assertEquals("field value is unchanged", entry.reason());
        assertTrue(entry.changelogMarker());
    }

    @Test
    @DisplayName("a rewrite that leaves out the proposed text is skipped")
    void differentTextIsSkipped() {
        AuditEntry entry = verifySingle(applied, "Flags for adults [CHANGELOG v1.0.1] s1");

        assertEquals(AuditOutcome.SKIPPED, entry.outcome());
        assertEquals("field changed but does not carry the proposed value", entry.reason());
    }

    @Test
    @DisplayName("removing a description succeeds when only the changelog note is left")
    void removedDescriptionKeepsNote() {
        Suggestion removal = Protocols.remove("s6", "n3", "description");

        assertEquals(AuditOutcome.APPLIED, verifySingle(removal, "[CHANGELOG v1.0.1]: removed - Suggestion ID: s6").outcome());
        assertEquals(AuditOutcome.SKIPPED, verifySingle(removal, "Derived flags [CHANGELOG v1.0.1] s6").outcome());
    }

    @Test
    @DisplayName("changelog notes are stripped to the end of their line")
    void stripsNotes() {
        assertEquals("Derived flags", ChangelogMarker.strip("Derived flags\n\n[CHANGELOG v1.0.1]: updated - Suggestion ID: s1"));
        assertEquals("Adult check\nsecond line", ChangelogMarker.strip("Adult check [CHANGELOG v1.0.1] s1\nsecond line"));
        assertEquals("", ChangelogMarker.strip("[CHANGELOG v2.0.0] s9"));
    }
}
