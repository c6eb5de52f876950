package io.journeyguard.core.engine;

import static io.journeyguard.core.Journeys.id;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.journeyguard.core.Journeys;
import io.journeyguard.core.document.JourneyReader;
import io.journeyguard.core.document.JourneyWriter;
import io.journeyguard.core.error.DocumentParseException;
import io.journeyguard.core.model.Category;
import io.journeyguard.core.model.Finding;
import io.journeyguard.core.repair.FixRecord;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

@DisplayName("JourneyValidator")
class JourneyValidatorTest {

    private static final List<String> BROKEN_FIXES = List.of(
            "Added missing journey type to 'anonymous'",
            "Node " + id(3) + ": Added missing 'metadata' field to auth_pass action node",
            "Node " + id(2) + " field 'action.text': Fixed strict equality operators: === → == (1 occurrence)",
            "Node " + id(2) + ": Added missing 'title' field to information node with empty string value",
            "Added variable 'count' with value 'null' to set_variables node " + id(1));

    private JourneyValidator validator;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger validatorLogger;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        validator = new JourneyValidator(Journeys.REGISTRY, new JourneyReader(), new JourneyWriter(),
                Journeys.fixedClock(), Journeys.sequentialUuids());

        validatorLogger = (Logger) LoggerFactory.getLogger(JourneyValidator.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        validatorLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        validatorLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private static List<String> descriptions(ValidationOutcome outcome) {
        return outcome.fixes().stream().map(FixRecord::description).toList();
    }

    private List<String> logged(Level level) {
        return logAppender.list.stream()
                .filter(e -> e.getLevel() == level)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }

    @Nested
    @DisplayName("auto-fix")
    class AutoFix {

        @Test
        void brokenJourneyConvergesInOneCycle() {
            Path file = Journeys.copy("broken.json", tempDir);

            var outcome = validator.validate(file, ValidationOptions.defaults());

            assertThat(descriptions(outcome)).containsExactlyElementsOf(BROKEN_FIXES);
            assertThat(outcome.fixes()).extracting(FixRecord::category).containsExactly(
                    Category.METADATA, Category.REQUIRED_FIELDS, Category.EXPRESSIONS,
                    Category.REQUIRED_FIELDS, Category.VARIABLES);
            assertThat(outcome.documentName()).isEqualTo("broken.json");
            assertThat(outcome.repairCycles()).isEqualTo(1);
            assertThat(outcome.persisted()).isTrue();
            assertThat(outcome.isClean()).isTrue();
        }

        @Test
        void secondRunFindsNothingToDo() throws IOException {
            Path file = Journeys.copy("broken.json", tempDir);
            validator.validate(file, ValidationOptions.defaults());
            String repaired = Files.readString(file, StandardCharsets.UTF_8);

            var outcome = validator.validate(file, ValidationOptions.defaults());

            assertThat(outcome.fixes()).isEmpty();
            assertThat(outcome.persisted()).isFalse();
            assertThat(outcome.isClean()).isTrue();
            assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(repaired);
        }

        @Test
        void cleanJourneyIsNotRewritten() throws IOException {
            Path file = Journeys.copy("clean.json", tempDir);
            String original = Files.readString(file, StandardCharsets.UTF_8);

            var outcome = validator.validate(file, ValidationOptions.defaults());

            assertThat(outcome.isClean()).isTrue();
            assertThat(outcome.fixes()).isEmpty();
            assertThat(outcome.persisted()).isFalse();
            assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(original);
        }

        @Test
        void everyAppliedFixIsLogged() {
            Path file = Journeys.copy("broken.json", tempDir);

            validator.validate(file, ValidationOptions.defaults());

            assertThat(logged(Level.INFO))
                    .filteredOn(m -> m.startsWith("Auto-fix applied:"))
                    .hasSize(BROKEN_FIXES.size())
                    .first().asString()
                    .isEqualTo("Auto-fix applied: document=broken.json, category=metadata, node=null, "
                            + "fix=Added missing journey type to 'anonymous'");
            assertThat(logged(Level.WARN)).isEmpty();
        }

        @Test
        void zeroCyclesMeansReportOnly() throws IOException {
            Path file = Journeys.copy("broken.json", tempDir);
            String original = Files.readString(file, StandardCharsets.UTF_8);

            var outcome = validator.validate(file, ValidationOptions.defaults().withMaxRepairCycles(0));

            assertThat(outcome.repairCycles()).isZero();
            assertThat(outcome.fixes()).isEmpty();
            assertThat(outcome.report().fixable()).isNotEmpty();
            assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(original);
            assertThat(logged(Level.WARN)).singleElement().asString()
                    .startsWith("Fixable findings remain after repair: document=broken.json");
        }
    }

    @Nested
    @DisplayName("report only")
    class ReportOnly {

        @Test
        void brokenJourneyIsReportedButNotTouched() throws IOException {
            Path file = Journeys.copy("broken.json", tempDir);
            String original = Files.readString(file, StandardCharsets.UTF_8);

            var outcome = validator.validate(file, ValidationOptions.defaults().withAutoFix(false));

            assertThat(outcome.isClean()).isFalse();
            assertThat(outcome.persisted()).isFalse();
            assertThat(outcome.repairCycles()).isZero();
            assertThat(outcome.report().findings(Category.METADATA)).extracting(Finding::isFixable).contains(true);
            assertThat(outcome.report().findings(Category.VARIABLES))
                    .anySatisfy(f -> assertThat(f.message()).contains("count"));
            assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(original);
        }

        @Test
        void onlyFilterNarrowsTheReport() {
            Path file = Journeys.copy("broken.json", tempDir);

            var outcome = validator.validate(file,
                    ValidationOptions.defaults().withAutoFix(false).withOnly(Category.VARIABLES));

            assertThat(outcome.report().findings()).isNotEmpty()
                    .allSatisfy(f -> assertThat(f.category()).isEqualTo(Category.VARIABLES));
        }

        @Test
        void scanNeverMutatesTheDocument() {
            var document = Journeys.parse(Journeys.resource("broken.json"));
            var before = document.root().deepCopy();

            var report = validator.scan(document);

            assertThat(report.isClean()).isFalse();
            assertThat(document.root()).isEqualTo(before);
        }

        @Test
        void repeatedScansProduceIdenticalReports() {
            var clean = Journeys.parse(Journeys.resource("clean.json"));
            var broken = Journeys.parse(Journeys.resource("broken.json"));

            assertThat(validator.scan(clean)).isEqualTo(validator.scan(clean));
            assertThat(validator.scan(broken)).isEqualTo(validator.scan(broken));
        }

        @Test
        void longLinearJourneyScansWithoutStructuralFindings() {
            var document = Journeys.parse(Journeys.chain(12_000));

            var report = validator.scan(document);

            assertThat(report.findings(Category.STRUCTURE)).isEmpty();
            assertThat(report.findings(Category.VARIABLES)).isEmpty();
        }
    }

    @Nested
    @DisplayName("fix")
    class Fix {

        @Test
        void appliesTheCatalogueOnceAndPersists() throws IOException {
            Path file = Journeys.copy("broken.json", tempDir);

            var outcome = validator.fix(file);

            assertThat(descriptions(outcome)).containsExactlyElementsOf(BROKEN_FIXES);
            assertThat(outcome.persisted()).isTrue();
            assertThat(outcome.report().isClean()).isTrue();
            assertThat(Files.readString(file, StandardCharsets.UTF_8)).contains("\"type\": \"anonymous\"");
        }

        @Test
        void rawTextRepairIsRecorded() {
            var document = Journeys.parse(Journeys.resource("clean.json")
                    .replace("\"Clean journey\"", "\"Clean \\\\\"quoted\\\\\" journey\""));

            var records = validator.repair(document);

            assertThat(records).containsExactly(new FixRecord(Category.EXPRESSIONS, null,
                    "Fixed 2 over-escaped sequence(s) in raw JSON"));
        }
    }

    @Test
    void missingFileFailsToLoad() {
        assertThatThrownBy(() -> validator.validate(tempDir.resolve("absent.json"), ValidationOptions.defaults()))
                .isInstanceOf(DocumentParseException.class);
    }

    @Test
    void negativeCycleBudgetIsRejected() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ValidationOptions.defaults().withMaxRepairCycles(-1))
                .withMessage("maxRepairCycles must be >= 0, got -1");
    }
}
