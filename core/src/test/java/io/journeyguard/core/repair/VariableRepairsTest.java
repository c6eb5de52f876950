package io.journeyguard.core.repair;

import static io.journeyguard.core.Journeys.action;
import static io.journeyguard.core.Journeys.authPass;
import static io.journeyguard.core.Journeys.expr;
import static io.journeyguard.core.Journeys.id;
import static io.journeyguard.core.Journeys.workflow;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.journeyguard.core.Journeys;
import io.journeyguard.core.model.Category;
import io.journeyguard.core.model.Finding;
import io.journeyguard.core.model.FixHint;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("VariableRepairs")
class VariableRepairsTest {

    private static final String INFORMATION = "{\"type\": \"information\", \"title\": " + expr("\"t\"")
            + ", \"text\": " + expr("\"x\"") + ", \"button_text\": " + expr("\"OK\"") + "}";

    private final VariableRepairs repairs = new VariableRepairs(Journeys.sequentialUuids());

    private static Finding undefined(String name) {
        return Finding.error(Category.VARIABLES, id(2), "Variable '" + name + "' is not defined")
                .withHint(FixHint.declareVariable(name));
    }

    private static Finding incomplete(String name, String... fields) {
        return Finding.error(Category.VARIABLES, id(2), "Variable '" + name + "' lacks fields")
                .withHint(FixHint.initializeFields(name, List.of(fields)));
    }

    private static ObjectNode node(ObjectNode workflow, int n) {
        return (ObjectNode) workflow.get("nodes").get(id(n));
    }

    private static String setVariables(String name, String value) {
        return "{\"type\": \"set_variables\", \"variables\": [{\"name\": \"" + name + "\", \"value\": "
                + expr(value) + "}]}";
    }

    @Nested
    @DisplayName("declare")
    class Declare {

        @Test
        void addsToHeadSetVariables() {
            var workflow = Journeys.parse(Journeys.resource("clean.json")).workflow();

            var records = repairs.declare(workflow, List.of(undefined("count"), undefined("count")));

            assertThat(records).containsExactly(new FixRecord(Category.VARIABLES, id(1),
                    "Added variable 'count' with value 'null' to set_variables node " + id(1)));
            assertThat(node(workflow, 1).at("/action/variables/1/name").asText()).isEqualTo("count");
            assertThat(node(workflow, 1).at("/action/variables/1/value/type").asText()).isEqualTo("expression");
            assertThat(node(workflow, 1).at("/action/variables/1/value/value").asText()).isEqualTo("null");
        }

        @Test
        void skipsNamesAlreadyDeclared() {
            var workflow = Journeys.parse(Journeys.resource("clean.json")).workflow();

            assertThat(repairs.declare(workflow, List.of(undefined("greeting")))).isEmpty();
        }

        @Test
        void ignoresFindingsWithoutDeclareHint() {
            var workflow = Journeys.parse(Journeys.resource("clean.json")).workflow();

            assertThat(repairs.declare(workflow, List.of(incomplete("greeting", "a")))).isEmpty();
        }

        @Test
        void usesSetVariablesRightAfterTheHead() {
            var workflow = Journeys.parse(workflow(action(1, INFORMATION, 2) + ","
                    + action(2, setVariables("a", "1"), 3) + "," + authPass(3))).workflow();

            var records = repairs.declare(workflow, List.of(undefined("b")));

            assertThat(records).extracting(FixRecord::nodeId).containsExactly(id(2));
            assertThat(node(workflow, 2).at("/action/variables/1/name").asText()).isEqualTo("b");
        }

        @Test
        void createsSetVariablesAfterTheHead() {
            var workflow = Journeys.parse(workflow(action(1, INFORMATION, 2) + "," + authPass(2))).workflow();

            var records = repairs.declare(workflow, List.of(undefined("x"), undefined("y")));

            String created = id(900);
            assertThat(records).extracting(FixRecord::description).containsExactly(
                    "Created new set_variables node " + created + " at the start of the journey",
                    "Added variable 'x' with value 'null' to set_variables node " + created,
                    "Added variable 'y' with value 'null' to set_variables node " + created);
            assertThat(node(workflow, 1).at("/links/0/target").asText()).isEqualTo(created);
            ObjectNode inserted = node(workflow, 900);
            assertThat(inserted.get("id").asText()).isEqualTo(created);
            assertThat(inserted.at("/action/type").asText()).isEqualTo("set_variables");
            assertThat(inserted.at("/links/0/name").asText()).isEqualTo("child");
            assertThat(inserted.at("/links/0/type").asText()).isEqualTo("branch");
            assertThat(inserted.at("/links/0/target").asText()).isEqualTo(id(2));
            assertThat(inserted.at("/action/variables")).hasSize(2);
        }

        @Test
        void missingHeadNodeMeansNoChange() {
            var workflow = Journeys.parse(workflow(authPass(2))).workflow();

            assertThat(repairs.declare(workflow, List.of(undefined("x")))).isEmpty();
        }
    }

    @Nested
    @DisplayName("initialize fields")
    class InitializeFields {

        @Test
        void nullInitializerBecomesObject() {
            var workflow = Journeys.parse(workflow(action(1, setVariables("profile", "null"), 2) + ","
                    + authPass(2))).workflow();

            var records = repairs.initializeFields(workflow,
                    List.of(incomplete("profile", "name"), incomplete("profile", "email")));

            assertThat(records).containsExactly(new FixRecord(Category.VARIABLES, id(1),
                    "Updated variable 'profile' initialization from null to object with fields: [email, name]"));
            assertThat(node(workflow, 1).at("/action/variables/0/value/value").asText())
                    .isEqualTo("{\"email\": \"\", \"name\": \"\"}");
        }

        @Test
        void existingObjectGainsOnlyMissingFields() {
            var workflow = Journeys.parse(workflow(action(1, setVariables("profile", "{\"name\": \"x\"}"), 2) + ","
                    + authPass(2))).workflow();

            var records = repairs.initializeFields(workflow, List.of(incomplete("profile", "email", "name")));

            assertThat(records).extracting(FixRecord::description)
                    .containsExactly("Added missing fields [email] to variable 'profile' initialization");
            assertThat(node(workflow, 1).at("/action/variables/0/value/value").asText())
                    .isEqualTo("{\"name\": \"x\", \"email\": \"\"}");
        }

        @Test
        void withFields() {
            assertThat(VariableRepairs.withFields("{}", List.of("a"))).isEqualTo("{\"a\": \"\"}");
            assertThat(VariableRepairs.withFields("`{\"a\": 1}`", List.of("b")))
                    .isEqualTo("{\"a\": 1, \"b\": \"\"}");
            assertThat(VariableRepairs.withFields("{\"a\": 1}", List.of("a"))).isNull();
            assertThat(VariableRepairs.withFields("lookup(", List.of("a"))).isNull();
            assertThat(VariableRepairs.withFields("[1]", List.of("a"))).isNull();
        }
    }
}
