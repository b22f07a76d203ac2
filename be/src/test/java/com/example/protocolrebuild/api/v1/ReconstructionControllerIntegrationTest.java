package com.example.protocolrebuild.api.v1;

import com.example.protocolrebuild.regeneration.RewriteOracle;
import com.example.protocolrebuild.support.Protocols;
import com.example.protocolrebuild.support.ScriptedRewriteOracle;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.RestTemplate;

import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import(ReconstructionControllerIntegrationTest.TestConfig.class)
@DisplayName("Reconstruction API")
class ReconstructionControllerIntegrationTest {

    @TestConfiguration
    static class TestConfig {
        @Bean
        public tools.jackson.databind.json.JsonMapper jsonMapper() {
            return tools.jackson.databind.json.JsonMapper.builder().build();
        }

        @Bean
        @Primary
        public ScriptedRewriteOracle scriptedRewriteOracle() {
            return new ScriptedRewriteOracle();
        }

        @Bean
        public RestTemplate restTemplate() {
            RestTemplate rest = new RestTemplate();
            rest.setErrorHandler(new org.springframework.web.client.ResponseErrorHandler() {
                @Override
                public boolean hasError(ClientHttpResponse response) {
                    return false;
                }

                @Override
                public void handleError(java.net.URI url, HttpMethod method, ClientHttpResponse response) throws java.io.IOException {
                }
            });
            return rest;
        }
    }

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {};

    @LocalServerPort
    private int port;

    @Autowired
    private RestTemplate restTemplate;

    @Autowired
    private ScriptedRewriteOracle oracle;

    @Autowired
    private RewriteOracle wiredOracle;

    @BeforeEach
    void resetOracle() {
        oracle.reset();
    }

    private String url(String path) {
        return "http://localhost:" + port + "/api/v1" + path;
    }

    /** Triage document under a unique protocol name so runs in this class never share a version history. */
    private static ObjectNode document(String protocolName) {
        ObjectNode document = (ObjectNode) Protocols.json(Protocols.triageJson());
        ((ObjectNode) document.get("metadata")).put("name", protocolName);
        return document;
    }

    private static ObjectNode suggestion(String id, String node, String field, String type, String value) {
        ObjectNode s = Protocols.MAPPER.createObjectNode();
        s.put("id", id);
        s.put("target_node_id", node);
        s.put("target_field", field);
        s.put("modification_type", type);
        if (value != null) {
            s.put("proposed_value", value);
        }
        s.put("rationale", "protocol review");
        return s;
    }

    private static String body(ObjectNode document, ObjectNode... suggestions) {
        ObjectNode body = Protocols.MAPPER.createObjectNode();
        body.set("document", document);
        ArrayNode list = body.putArray("suggestions");
        for (ObjectNode s : suggestions) {
            list.add(s);
        }
        return Protocols.MAPPER.writeValueAsString(body);
    }

    private ResponseEntity<Map<String, Object>> post(String json) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return restTemplate.exchange(url("/reconstructions"), HttpMethod.POST, new HttpEntity<>(json, headers), JSON_OBJECT);
    }

    private static String protocolName() {
        return "triage-" + UUID.randomUUID();
    }

    @Test
    @DisplayName("test oracle replaces the chat-model oracle")
    void wiring() {
        assertThat(wiredOracle).isSameAs(oracle);
    }

    @Nested
    @DisplayName("POST /reconstructions")
    class Reconstruct {

        @Test
        @DisplayName("returns the rebuilt document, stores it, and the next run bumps past the stored version")
        @SuppressWarnings("unchecked")
        void reconstructAndStore() {
            String name = protocolName();
            String json = body(document(name), suggestion("s1", "n4", "description", "modify", "Refer adults with fever urgently"));

            ResponseEntity<Map<String, Object>> first = post(json);

            assertThat(first.getStatusCode()).isEqualTo(HttpStatus.OK);
            Map<String, Object> response = first.getBody();
            assertThat(response).isNotNull();
            assertThat(response.get("status")).isEqualTo("COMPLETED");
            assertThat(response.get("version")).isEqualTo("1.0.1");
            assertThat((String) response.get("audit")).startsWith("RECONSTRUCTION AUDIT: " + name + " v1.0.0 -> v1.0.1");
            List<Map<String, Object>> entries = (List<Map<String, Object>>) response.get("entries");
            assertThat(entries).singleElement().satisfies(e -> {
                assertThat(e.get("suggestionId")).isEqualTo("s1");
                assertThat(e.get("outcome")).isEqualTo("APPLIED");
            });
            Map<String, Object> document = (Map<String, Object>) response.get("document");
            assertThat((List<Object>) document.get("nodes")).hasSize(5);
            assertThat((List<Object>) document.get("edges")).hasSize(1);
            String revisionId = (String) response.get("revisionId");
            assertThat(revisionId).isNotBlank();

            ResponseEntity<Map<String, Object>> stored = restTemplate.exchange(url("/revisions/" + revisionId), HttpMethod.GET, null, JSON_OBJECT);
            assertThat(stored.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(stored.getBody()).isNotNull();
            assertThat(stored.getBody().get("protocolName")).isEqualTo(name);
            assertThat(stored.getBody().get("version")).isEqualTo("1.0.1");
            Map<String, Object> storedMetadata = (Map<String, Object>) ((Map<String, Object>) stored.getBody().get("document")).get("metadata");
            assertThat(storedMetadata.get("version")).isEqualTo("1.0.1");

            ResponseEntity<Map<String, Object>> second = post(json);
            assertThat(second.getBody()).isNotNull();
            assertThat(second.getBody().get("version")).isEqualTo("1.0.2");

            ResponseEntity<Map<String, Object>> list = restTemplate.exchange(url("/revisions?protocol=" + name), HttpMethod.GET, null, JSON_OBJECT);
            assertThat(list.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(list.getBody()).isNotNull();
            List<Map<String, Object>> revisions = (List<Map<String, Object>>) list.getBody().get("revisions");
            assertThat(revisions).extracting(r -> r.get("version")).containsExactly("1.0.2", "1.0.1");
        }

        @Test
        @DisplayName("unsafe expression is withheld and reported while the run completes")
        @SuppressWarnings("unchecked")
        void unsafeExpression() {
            ResponseEntity<Map<String, Object>> resp = post(body(document(protocolName()),
                    suggestion("s1", "n5", "condition", "modify", "'x' in answers and helper(answers)")));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody()).isNotNull();
            assertThat(resp.getBody().get("status")).isEqualTo("COMPLETED_WITH_FAILURES");
            List<Map<String, Object>> entries = (List<Map<String, Object>>) resp.getBody().get("entries");
            assertThat(entries.get(0).get("outcome")).isEqualTo("FAILED");
            assertThat((String) entries.get(0).get("reason")).contains("disallowed call helper(...)");
            assertThat(oracle.requests()).isEmpty();
        }

        @Test
        @DisplayName("suggestion for an unknown node returns 400 with a hint")
        @SuppressWarnings("unchecked")
        void unknownNode() {
            ResponseEntity<Map<String, Object>> resp = post(body(document(protocolName()),
                    suggestion("s1", "n44", "description", "modify", "x")));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(resp.getBody()).isNotNull();
            List<Map<String, Object>> errors = (List<Map<String, Object>>) resp.getBody().get("errors");
            assertThat(errors).singleElement().satisfies(e -> {
                assertThat(e.get("location")).isEqualTo("suggestions[s1].target_node_id");
                assertThat((String) e.get("message")).contains("did you mean 'n4'?");
            });
        }

        @Test
        @DisplayName("missing suggestion fields return 400")
        void beanValidation() {
            ResponseEntity<Map<String, Object>> resp = post(body(document(protocolName()),
                    suggestion("", "n4", "description", "modify", "x")));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(resp.getBody()).isNotNull();
            assertThat(resp.getBody().get("message")).isEqualTo("Validation failed");
        }

        @Test
        @DisplayName("unknown modification type returns 400")
        void unknownType() {
            ResponseEntity<Map<String, Object>> resp = post(body(document(protocolName()),
                    suggestion("s1", "n4", "description", "rewrite", "x")));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        }

        @Test
        @DisplayName("body that is not JSON returns 400")
        void notJson() {
            ResponseEntity<Map<String, Object>> resp = post("{\"document\": ");

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(resp.getBody()).isNotNull();
            assertThat(resp.getBody().get("message")).isEqualTo("Request body is not valid JSON");
        }

        @Test
        @DisplayName("removing a question other rules depend on returns 422 and stores nothing")
        @SuppressWarnings("unchecked")
        void crossReference() {
            String name = protocolName();
            ResponseEntity<Map<String, Object>> resp = post(body(document(name),
                    suggestion("s1", "n2", "questions[q_symptoms]", "remove", null)));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
            assertThat(resp.getBody()).isNotNull();
            assertThat((List<Object>) resp.getBody().get("errors")).hasSize(2);

            ResponseEntity<Map<String, Object>> list = restTemplate.exchange(url("/revisions?protocol=" + name), HttpMethod.GET, null, JSON_OBJECT);
            assertThat(list.getBody()).isNotNull();
            assertThat((List<Object>) list.getBody().get("revisions")).isEmpty();
        }
    }

    @Test
    @DisplayName("GET unknown revision returns 404")
    void revisionNotFound() {
        ResponseEntity<Map<String, Object>> resp = restTemplate.exchange(url("/revisions/" + UUID.randomUUID()), HttpMethod.GET, null, JSON_OBJECT);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody()).isNotNull();
        assertThat((String) resp.getBody().get("message")).startsWith("Revision not found: ");
    }

    @Test
    @DisplayName("GET /health returns UP")
    void health() {
        ResponseEntity<Map<String, Object>> resp = restTemplate.exchange(url("/health"), HttpMethod.GET, null, JSON_OBJECT);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).containsEntry("status", "UP").containsEntry("service", "protocol-rebuild-be");
    }
}
