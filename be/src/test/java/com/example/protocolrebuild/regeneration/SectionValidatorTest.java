package com.example.protocolrebuild.regeneration;

import com.example.protocolrebuild.document.ProtocolDocument;
import com.example.protocolrebuild.document.ProtocolNode;
import com.example.protocolrebuild.partition.Section;
import com.example.protocolrebuild.partition.SectionKind;
import com.example.protocolrebuild.support.Protocols;
import com.example.protocolrebuild.validation.ErrorKind;
import com.example.protocolrebuild.validation.ValidationError;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SectionValidator")
class SectionValidatorTest {

    private final ProtocolDocument triage = Protocols.triage();
    private final SectionValidator validator = new SectionValidator(Protocols.CODEC, Protocols.expressionValidator());

    private final Section affected = new Section(2, SectionKind.NODES, List.of("n3", "n4"),
            List.of(Protocols.modify("s1", "n4", "condition", "is_adult")), 0);
    private final Section unaffected = new Section(2, SectionKind.NODES, List.of("n3", "n4"), List.of(), 0);

    private ArrayNode echo() {
        return Protocols.CODEC.nodesToTree(List.of(triage.node("n3").orElseThrow(), triage.node("n4").orElseThrow()));
    }

    private static ObjectNode fields(ArrayNode nodes, int index) {
        return (ObjectNode) nodes.get(index).get("fields");
    }

    @Nested
    @DisplayName("structure")
    class Structure {

        @Test
        @DisplayName("echoed section is valid and keeps original positions")
        void echoIsValid() {
            ArrayNode nodes = echo();
            ((ObjectNode) nodes.get(0).get("position")).put("y", 9999);

            SectionCheck check = validator.validate(unaffected, triage, Protocols.MAPPER.createObjectNode().set("nodes", nodes));

            assertTrue(check.isValid());
            assertThat(check.nodes()).extracting(ProtocolNode::id).containsExactly("n3", "n4");
            assertEquals(triage.node("n3").orElseThrow().position(), check.nodes().get(0).position());
        }

        @Test
        @DisplayName("missing and invented ids are both reported")
        void missingAndInvented() {
            ArrayNode nodes = echo();
            ((ObjectNode) nodes.get(1)).put("id", "n4-new");

            SectionCheck check = validator.validate(affected, triage, nodes);

            assertFalse(check.isValid());
            assertThat(check.structuralErrors()).extracting(ValidationError::message)
                    .anyMatch(m -> m.contains("'n4-new' is not part of this section"))
                    .anyMatch(m -> m.contains("'n4' is missing from the response"));
        }

        @Test
        @DisplayName("kind change and shape errors are structural")
        void kindAndShape() {
            ArrayNode nodes = echo();
            ((ObjectNode) nodes.get(0)).put("kind", "action");
            fields(nodes, 1).put("condition", 5);

            SectionCheck check = validator.validate(affected, triage, nodes);

            assertThat(check.structuralErrors()).extracting(ValidationError::location)
                    .contains("nodes[n3].kind", "nodes[n4].fields.condition");
            assertThat(check.structuralErrors()).allMatch(e -> e.kind() == ErrorKind.SECTION_STRUCTURE);
        }

        @Test
        @DisplayName("unaffected section must keep its field names")
        void unaffectedFieldSet() {
            ArrayNode nodes = echo();
            fields(nodes, 1).remove("effects");

            SectionCheck check = validator.validate(unaffected, triage, nodes);

            assertThat(check.structuralErrors()).extracting(ValidationError::location).containsExactly("nodes[n4].fields");
        }

        @Test
        @DisplayName("response without a node list")
        void noNodeList() {
            SectionCheck check = validator.validate(affected, triage, Protocols.json("{\"answer\": 42}"));

            assertThat(check.describeErrors()).contains("response contains no node list");
        }
    }

    @Nested
    @DisplayName("expressions")
    class Expressions {

        @Test
        @DisplayName("sanitizable expression is rewritten in place")
        void sanitizedInPlace() {
            ArrayNode nodes = echo();
            fields(nodes, 1).put("condition", "is_adult && contains(q_symptoms, 'fever')");

            SectionCheck check = validator.validate(affected, triage, nodes);

            assertTrue(check.isValid());
            assertEquals("is_adult and 'fever' in q_symptoms", check.nodes().get(1).fields().get("condition").asString());
        }

        @Test
        @DisplayName("identifier introduced in the same section is known")
        void sameSectionIdentifier() {
            ArrayNode nodes = echo();
            ((ArrayNode) fields(nodes, 0).get("expressions")).addObject().put("name", "is_senior").put("expression", "q_age >= 65");
            fields(nodes, 1).put("condition", "is_senior");

            assertTrue(validator.validate(affected, triage, nodes).isValid());
        }

        @Test
        @DisplayName("violations can be reverted to the original value and flagged")
        void revert() {
            ArrayNode nodes = echo();
            fields(nodes, 1).put("condition", "eval(q_age)");
            fields(nodes, 1).put("description", "Refer adults with fever, updated");
            ((ObjectNode) fields(nodes, 1).get("effects").get(0)).put("condition", "q_unknown == 1");

            SectionCheck check = validator.validate(affected, triage, nodes);
            assertTrue(check.hasOnlyExpressionViolations());
            assertEquals(2, check.expressionViolations().size());

            SectionCheck reverted = validator.revertViolations(check, triage);

            ObjectNode n4 = reverted.nodes().get(1).fields();
            assertEquals("is_adult and 'fever' in q_symptoms", n4.get("condition").asString());
            assertNull(n4.get("effects").get(0).get("condition"));
            assertEquals("Refer adults with fever, updated", n4.get("description").asString());
            assertThat(reverted.flags()).extracting(f -> f.path().toString())
                    .containsExactlyInAnyOrder("condition", "effects[e1].condition");
            assertTrue(reverted.isValid());
        }
    }

    @Nested
    @DisplayName("metadata")
    class Metadata {

        private final Section metadata = new Section(0, SectionKind.METADATA, List.of(),
                List.of(Protocols.modify("s9", "metadata", "changelog", "x")), 0);

        @Test
        @DisplayName("only the changelog is taken from the response")
        void changelogOnly() {
            SectionCheck check = validator.validate(metadata, triage,
                    Protocols.json("{\"metadata\": {\"name\": \"renamed\", \"changelog\": [\"reviewed\"]}}"));

            assertTrue(check.isValid());
            assertEquals("triage", check.metadataFields().get("name").asString());
            assertEquals("reviewed", check.metadataFields().get("changelog").get(0).asString());
        }

        @Test
        @DisplayName("missing changelog is structural")
        void missingChangelog() {
            assertFalse(validator.validate(metadata, triage, Protocols.json("{\"metadata\": {\"name\": \"x\"}}")).isValid());
        }
    }
}
