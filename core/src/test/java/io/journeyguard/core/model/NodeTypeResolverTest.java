package io.journeyguard.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.journeyguard.core.Journeys;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class NodeTypeResolverTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static NodeType resolve(String node) throws IOException {
        JsonNode json = JSON.readTree(node);
        return NodeTypeResolver.resolve("n1", json, Journeys.REGISTRY);
    }

    @Test
    void plainNodeUsesItsOwnType() throws IOException {
        NodeType type = resolve("{\"type\": \"loop\"}");

        assertThat(type.kind()).isEqualTo(NodeKind.LOOP);
        assertThat(type.key()).isEqualTo("loop");
        assertThat(type.isResolved()).isTrue();
    }

    @Test
    void actionNodeUsesActionType() throws IOException {
        NodeType type = resolve("{\"type\": \"action\", \"action\": {\"type\": \"information\"}}");

        assertThat(type.kind()).isEqualTo(NodeKind.ACTION);
        assertThat(type.key()).isEqualTo("information");
        assertThat(type.problems()).isEmpty();
    }

    @Test
    void formActionUsesMetadataType() throws IOException {
        NodeType type = resolve(
                "{\"type\": \"action\", \"action\": {\"type\": \"form\", \"metadata\": {\"type\": \"login_form\"}}}");

        assertThat(type.key()).isEqualTo("login_form");
    }

    @Test
    void formWithoutMetadataKeepsActionTypeAndReportsProblem() throws IOException {
        NodeType type = resolve("{\"type\": \"action\", \"action\": {\"type\": \"form\"}}");

        assertThat(type.key()).isEqualTo("form");
        assertThat(type.problems()).containsExactly("Node n1 is missing a 'metadata' key in the 'action' key.");
    }

    @Test
    void missingTypeIsUntyped() throws IOException {
        NodeType type = resolve("{\"id\": \"n1\"}");

        assertThat(type.kind()).isEqualTo(NodeKind.UNTYPED);
        assertThat(type.key()).isNull();
        assertThat(type.problems()).containsExactly("Node n1 is missing a 'type' key.");
    }

    @Test
    void actionTypeInNodeTypeIsReported() throws IOException {
        NodeType type = resolve("{\"type\": \"information\"}");

        assertThat(type.key()).isNull();
        assertThat(type.problems())
                .containsExactly("Node n1 has an action type: information in its type which is not valid.");
    }

    @Test
    void actionWithoutActionObjectIsReported() throws IOException {
        NodeType type = resolve("{\"type\": \"action\"}");

        assertThat(type.key()).isNull();
        assertThat(type.problems()).containsExactly("Node n1 is missing an 'action' key.");
    }

    @Test
    void actionWithoutActionTypeIsReported() throws IOException {
        NodeType type = resolve("{\"type\": \"action\", \"action\": {}}");

        assertThat(type.problems()).containsExactly("Node n1 is missing a 'type' key in the 'action' key.");
    }
}
