package io.journeyguard.core.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.journeyguard.core.error.FieldReplacementException;
import io.journeyguard.core.error.JourneyException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FieldReplacer")
class FieldReplacerTest {

    private static final String TEXT = """
            {"workflow": {"nodes": {
              "n1": {"action": {
                "text": {"type": "expression", "value": "old"},
                "variables": [{"name": "v", "value": {"type": "expression", "value": "1"}}]}},
              "n2": {"action": {"text": {"value": "other"}}}}}}
            """;

    @Nested
    @DisplayName("replace")
    class Replace {

        @Test
        void replacesOnlyTheAddressedString() {
            String updated = FieldReplacer.replace(TEXT, "n1/action/text/value", "new");

            assertThat(updated)
                    .contains("\"value\": \"new\"")
                    .contains("\"value\": \"other\"")
                    .contains("\"value\": \"1\"")
                    .doesNotContain("\"old\"");
        }

        @Test
        void searchStartsAtTheNamedNode() {
            String updated = FieldReplacer.replace(TEXT, "n2/action/text/value", "changed");

            assertThat(updated).contains("\"value\": \"old\"").contains("\"value\": \"changed\"");
        }

        @Test
        void dotsSeparateSegmentsAndIndicesAreSkipped() {
            String updated = FieldReplacer.replace(TEXT, "n1.action.variables.0.value.value", "2");

            assertThat(updated).contains("\"value\": \"2\"").doesNotContain("\"value\": \"1\"");
        }

        @Test
        void escapedValueIsInsertedVerbatim() {
            String updated = FieldReplacer.replace(TEXT, "n1/action/text/value",
                    FieldReplacer.escape("say \"hi\"\n"));

            assertThat(updated).contains("\"value\": \"say \\\"hi\\\"\\n\"");
        }

        @Test
        void escapedQuotesInTheOldValueAreSkipped() {
            String text = "{\"n1\": {\"a\": \"x \\\" y\", \"b\": \"z\"}}";

            assertThat(FieldReplacer.replace(text, "n1/a", "w")).isEqualTo("{\"n1\": {\"a\": \"w\", \"b\": \"z\"}}");
        }

        @Test
        void malformedJsonIsStillEditable() {
            String text = "{\"n1\": {\"a\": \"x\", }";

            assertThat(FieldReplacer.replace(text, "n1/a", "y")).isEqualTo("{\"n1\": {\"a\": \"y\", }");
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        void unknownNode() {
            assertThatThrownBy(() -> FieldReplacer.replace(TEXT, "n9/action/text", "x"))
                    .isInstanceOf(FieldReplacementException.class)
                    .hasMessage("Could not find node \"n9\" in nodes section")
                    .satisfies(e -> {
                        var error = (FieldReplacementException) e;
                        assertThat(error.fieldPath()).isEqualTo("n9/action/text");
                        assertThat(error.phase()).isEqualTo(JourneyException.Phase.REPAIR);
                    });
        }

        @Test
        void unknownField() {
            assertThatThrownBy(() -> FieldReplacer.replace(TEXT, "n2/action/title", "x"))
                    .isInstanceOf(FieldReplacementException.class)
                    .hasMessage("Could not find field \"title\" after previous position");
        }

        @Test
        void nonStringValue() {
            assertThatThrownBy(() -> FieldReplacer.replace(TEXT, "n1/action/text", "x"))
                    .isInstanceOf(FieldReplacementException.class)
                    .hasMessage("Field does not contain a string value");
        }

        @Test
        void unterminatedString() {
            assertThatThrownBy(() -> FieldReplacer.replace("{\"n1\": {\"a\": \"abc", "n1/a", "x"))
                    .isInstanceOf(FieldReplacementException.class)
                    .hasMessage("String value is not terminated");
        }

        @Test
        void pathNeedsNodeAndField() {
            assertThatThrownBy(() -> FieldReplacer.replace(TEXT, "n1", "x"))
                    .isInstanceOf(FieldReplacementException.class)
                    .hasMessage("Path must have at least a node id and one field");
            assertThatThrownBy(() -> FieldReplacer.replace(TEXT, "n1//text", "x"))
                    .isInstanceOf(FieldReplacementException.class)
                    .hasMessage("Path contains an empty segment");
        }
    }

    @Test
    void stringifyIndentsWithTwoSpaces() throws Exception {
        var tree = new ObjectMapper().readTree("{\"a\": [1, {}], \"b\": []}");

        assertThat(FieldReplacer.stringify(tree)).isEqualTo("""
                {
                  "a": [
                    1,
                    {}
                  ],
                  "b": []
                }""");
    }
}
