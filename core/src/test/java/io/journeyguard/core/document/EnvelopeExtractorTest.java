package io.journeyguard.core.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.journeyguard.core.error.EnvelopeException;
import io.journeyguard.core.error.JourneyException;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

@DisplayName("EnvelopeExtractor")
class EnvelopeExtractorTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static ObjectNode root(String json) throws Exception {
        return (ObjectNode) JSON.readTree(json);
    }

    @Test
    void exportedJourneyWorkflowIsSharedWithRoot() throws Exception {
        var root = root("{\"exports\": [{\"data\": {\"versions\": [{\"workflow\": {\"id\": \"w\"}}]}}]}");

        var workflow = EnvelopeExtractor.extract(root, "j.json");
        workflow.put("head", "h");

        assertThat(root.at("/exports/0/data/versions/0/workflow/head").asText()).isEqualTo("h");
    }

    @Test
    void bareWorkflowIsAccepted() throws Exception {
        var root = root("{\"workflow\": {\"id\": \"w\"}}");

        assertThat(EnvelopeExtractor.extract(root, "j.json").get("id").asText()).isEqualTo("w");
    }

    static Stream<Arguments> brokenEnvelopes() {
        return Stream.of(
                Arguments.of("{}", "The journey JSON should have an 'exports' or 'workflow' key."),
                Arguments.of("{\"exports\": {}}", "The 'exports' key should have a list value."),
                Arguments.of("{\"exports\": []}", "The 'exports' key should have included a 'data' key."),
                Arguments.of("{\"exports\": [{}]}", "The 'exports' key should have included a 'data' key."),
                Arguments.of("{\"exports\": [{\"data\": {}}]}",
                        "The 'data' key should have included a 'versions' key."),
                Arguments.of("{\"exports\": [{\"data\": {\"versions\": []}}]}",
                        "The 'versions' key should have included a 'workflow' key."),
                Arguments.of("{\"workflow\": \"x\"}",
                        "The 'workflow' key should have an object value, found STRING"));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("brokenEnvelopes")
    void firstMissingKeyIsNamed(String json, String message) throws Exception {
        var root = root(json);

        assertThatThrownBy(() -> EnvelopeExtractor.extract(root, "j.json"))
                .isInstanceOf(EnvelopeException.class)
                .hasMessage(message)
                .satisfies(e -> {
                    var error = (EnvelopeException) e;
                    assertThat(error.documentName()).isEqualTo("j.json");
                    assertThat(error.source()).isEqualTo("j.json");
                    assertThat(error.phase()).isEqualTo(JourneyException.Phase.LOAD);
                });
    }
}
