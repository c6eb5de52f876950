package io.journeyguard.core.repair;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.journeyguard.core.Journeys;
import io.journeyguard.core.document.JourneyDocument;
import io.journeyguard.core.model.Category;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DocumentRepairs")
class DocumentRepairsTest {

    private final DocumentRepairs repairs =
            new DocumentRepairs(Journeys.fixedClock(), Journeys.REGISTRY.constants());

    private JourneyDocument document;

    @BeforeEach
    void loadFixture() {
        document = Journeys.parse(Journeys.resource("clean.json"));
    }

    private ObjectNode data() {
        return (ObjectNode) document.root().get("exports").get(0).get("data");
    }

    private ObjectNode version() {
        return (ObjectNode) data().get("versions").get(0);
    }

    private List<String> descriptions() {
        return repairs.apply(document.root()).stream().map(FixRecord::description).toList();
    }

    @Test
    void currentDocumentIsLeftAlone() {
        assertThat(repairs.apply(document.root())).isEmpty();
    }

    @Test
    void bareWorkflowDocumentIsLeftAlone() {
        var bare = Journeys.parse(Journeys.workflow(Journeys.authPass(1)));

        assertThat(repairs.apply(bare.root())).isEmpty();
    }

    @Test
    void missingTypeIsAddedAsDocumentLevelMetadataFix() {
        data().remove("type");

        var records = repairs.apply(document.root());

        assertThat(records).containsExactly(
                new FixRecord(Category.METADATA, null, "Added missing journey type to 'anonymous'"));
        assertThat(data().get("type").asText()).isEqualTo("anonymous");
    }

    @Test
    void invalidTypeIsReplaced() {
        data().put("type", "named");

        assertThat(descriptions()).containsExactly("Changed invalid journey type 'named' to 'anonymous'");
    }

    @Test
    void staleDataTimestampIsRefreshed() {
        data().put("created_date", Journeys.NOW_MILLIS - 7_200_000L);

        assertThat(descriptions()).containsExactly(
                "Updated 'created_date' from 2024-05-31 22:00:00 to current time: " + Journeys.NOW_MILLIS);
        assertThat(data().get("created_date").asLong()).isEqualTo(Journeys.NOW_MILLIS);
    }

    @Test
    void timestampsWithinToleranceAreKept() {
        data().put("created_date", Journeys.NOW_MILLIS - 3_000_000L);
        version().put("last_modified", Journeys.NOW_SECONDS + 30);

        assertThat(descriptions()).isEmpty();
    }

    @Test
    void futureVersionTimestampIsPulledBack() {
        version().put("last_modified", Journeys.NOW_SECONDS + 120);

        assertThat(descriptions()).containsExactly("Updated version 'last_modified' from future timestamp "
                + (Journeys.NOW_SECONDS + 120) + " to current time: " + Journeys.NOW_SECONDS);
    }

    @Test
    void missingTimestampsAreAdded() {
        data().remove("last_modified_date");
        version().remove("created_at");

        assertThat(descriptions()).containsExactly(
                "Added missing 'last_modified_date' timestamp to data: " + Journeys.NOW_MILLIS,
                "Added missing 'created_at' timestamp to version: " + Journeys.NOW_SECONDS);
    }

    @Test
    void versionDefaultsAreFilledIn() {
        version().remove("state");
        version().remove("desc");

        assertThat(descriptions()).containsExactly(
                "Added missing 'state' field with default value 'version'",
                "Added missing 'desc' field with default description");
        assertThat(version().get("desc").asText()).isEqualTo("Generated journey");
    }

    @Test
    void invalidStateIsReset() {
        version().put("state", "draft");

        assertThat(descriptions()).containsExactly("Changed invalid state 'draft' to 'version'");
        assertThat(version().get("state").asText()).isEqualTo("version");
    }

    @Test
    void missingVersionsArrayIsAdded() {
        data().remove("versions");

        assertThat(descriptions()).containsExactly("Added missing 'versions' array to journey data");
        assertThat(data().get("versions").isArray()).isTrue();
    }
}
