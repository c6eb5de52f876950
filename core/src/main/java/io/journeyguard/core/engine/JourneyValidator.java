package io.journeyguard.core.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.journeyguard.core.document.JourneyDocument;
import io.journeyguard.core.document.JourneyReader;
import io.journeyguard.core.document.JourneyWriter;
import io.journeyguard.core.expressions.ExpressionLinter;
import io.journeyguard.core.fields.RequiredFieldsAnalyzer;
import io.journeyguard.core.metadata.MetadataAnalyzer;
import io.journeyguard.core.model.Category;
import io.journeyguard.core.model.Finding;
import io.journeyguard.core.model.ValidationReport;
import io.journeyguard.core.model.Workflow;
import io.journeyguard.core.registry.NodeRegistry;
import io.journeyguard.core.repair.DocumentRepairs;
import io.journeyguard.core.repair.FixRecord;
import io.journeyguard.core.repair.VariableRepairs;
import io.journeyguard.core.repair.WorkflowRepairs;
import io.journeyguard.core.spi.AnalysisContext;
import io.journeyguard.core.spi.JourneyAnalyzer;
import io.journeyguard.core.structure.StructureAnalyzer;
import io.journeyguard.core.variables.VariableAnalyzer;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates and repairs journey documents.
 *
 * <p>
 * A run is a small state machine. {@code SCAN} runs every analyzer read-only over a freshly
 * loaded document. {@code REPAIR} is entered while auto-fix is enabled and the repair budget is not
 * spent; it applies the repair catalogue and, if anything changed, persists the document and
 * returns to {@code SCAN} from load. Otherwise the run is {@code DONE}.
 *
 * <p>
 * Thread-safe: immutable after construction. Runs over different files may share an instance.
 */
public final class JourneyValidator {

    private static final Logger LOG = LoggerFactory.getLogger(JourneyValidator.class);

    private enum State {
        SCAN,
        REPAIR,
        DONE
    }

    private final NodeRegistry registry;
    private final JourneyReader reader;
    private final JourneyWriter writer;
    private final List<JourneyAnalyzer> analyzers;
    private final VariableAnalyzer variableAnalyzer;
    private final DocumentRepairs documentRepairs;
    private final WorkflowRepairs workflowRepairs;
    private final VariableRepairs variableRepairs;

    public JourneyValidator(
            NodeRegistry registry, JourneyReader reader, JourneyWriter writer, Clock clock, Supplier<UUID> uuids) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(uuids, "uuids must not be null");
        this.variableAnalyzer = new VariableAnalyzer();
        this.analyzers = List.of(
                new MetadataAnalyzer(),
                new StructureAnalyzer(),
                new RequiredFieldsAnalyzer(),
                new ExpressionLinter(),
                variableAnalyzer);
        this.documentRepairs = new DocumentRepairs(clock, registry.constants());
        this.workflowRepairs = new WorkflowRepairs(registry, uuids);
        this.variableRepairs = new VariableRepairs(uuids);
    }

    /** Creates a validator with the system clock, random UUIDs and the default file I/O. */
    public static JourneyValidator create(NodeRegistry registry) {
        return new JourneyValidator(
                registry, new JourneyReader(), new JourneyWriter(), Clock.systemDefaultZone(), UUID::randomUUID);
    }

    /**
     * Validates a journey file, repairing and re-validating it as the options allow.
     *
     * @param path    the journey file
     * @param options run options
     * @return the final report and every fix applied
     * @throws io.journeyguard.core.error.JourneyLoadException if the document cannot be loaded
     * @throws io.journeyguard.core.error.PersistException if a repaired document cannot be written
     */
    public ValidationOutcome validate(Path path, ValidationOptions options) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(options, "options must not be null");

        JourneyDocument document = reader.read(path);
        ValidationReport report = ValidationReport.empty();
        List<FixRecord> fixes = new ArrayList<>();
        int cycles = 0;
        boolean persisted = false;

        State state = State.SCAN;
        while (state != State.DONE) {
            switch (state) {
                case SCAN -> {
                    report = scan(document);
                    state = options.autoFix() && cycles < options.maxRepairCycles() ? State.REPAIR : State.DONE;
                }
                case REPAIR -> {
                    cycles++;
                    List<FixRecord> applied = repair(document);
                    if (applied.isEmpty()) {
                        state = State.DONE;
                    } else {
                        fixes.addAll(applied);
                        writer.write(document);
                        persisted = true;
                        document = reader.read(path);
                        state = State.SCAN;
                    }
                }
                default -> throw new IllegalStateException("Unexpected state: " + state);
            }
        }

        logConvergence(document.documentName(), report, cycles, options);
        ValidationReport returned = options.onlyCategory().map(report::only).orElse(report);
        return new ValidationOutcome(document.documentName(), returned, fixes, cycles, persisted);
    }

    /**
     * Applies the repair catalogue to a journey file once, without scanning, and persists the
     * result if anything changed. The returned outcome carries an empty report.
     */
    public ValidationOutcome fix(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        JourneyDocument document = reader.read(path);
        List<FixRecord> applied = repair(document);
        if (!applied.isEmpty()) {
            writer.write(document);
        }
        LOG.info("Fix run complete: document={}, fixes={}", document.documentName(), applied.size());
        return new ValidationOutcome(
                document.documentName(), ValidationReport.empty(), applied, 1, !applied.isEmpty());
    }

    /** Runs every analyzer over a loaded document. Never mutates it. */
    public ValidationReport scan(JourneyDocument document) {
        AnalysisContext context = context(document);
        List<Finding> findings = new ArrayList<>();
        for (JourneyAnalyzer analyzer : analyzers) {
            List<Finding> found = analyzer.analyze(context);
            LOG.debug("Analyzer finished: document={}, category={}, findings={}",
                    document.documentName(), analyzer.category().id(), found.size());
            findings.addAll(found);
        }
        ValidationReport report = ValidationReport.of(findings);
        LOG.info("Scan complete: document={}, findings={}, errors={}, warnings={}",
                document.documentName(), report.size(), report.errorCount(), report.warningCount());
        return report;
    }

    /**
     * Applies the repair catalogue to a loaded document in place.
     *
     * @return the changes made; empty if the document needed none
     */
    public List<FixRecord> repair(JourneyDocument document) {
        ObjectNode root = document.root();
        ObjectNode workflow = document.workflow();
        List<FixRecord> records = new ArrayList<>();

        if (document.rawTextRepairs() > 0) {
            records.add(new FixRecord(Category.EXPRESSIONS, null,
                    "Fixed " + document.rawTextRepairs() + " over-escaped sequence(s) in raw JSON"));
        }
        records.addAll(documentRepairs.apply(root));
        records.addAll(workflowRepairs.apply(workflow));

        List<Finding> variables = variableAnalyzer.analyze(context(document));
        records.addAll(variableRepairs.declare(workflow, variables));
        variables = variableAnalyzer.analyze(context(document));
        records.addAll(variableRepairs.initializeFields(workflow, variables));
        records.addAll(workflowRepairs.resyncBodies(workflow));

        for (FixRecord record : records) {
            LOG.info("Auto-fix applied: document={}, category={}, node={}, fix={}",
                    document.documentName(), record.category().id(), record.nodeId(), record.description());
        }
        return records;
    }

    private AnalysisContext context(JourneyDocument document) {
        return new AnalysisContext(document.root(), Workflow.of(document.workflow(), registry), registry);
    }

    private static void logConvergence(
            String documentName, ValidationReport report, int cycles, ValidationOptions options) {
        if (!options.autoFix() || report.fixable().isEmpty()) {
            LOG.info("Validation finished: document={}, findings={}, repair_cycles={}",
                    documentName, report.size(), cycles);
        } else {
            LOG.warn("Fixable findings remain after repair: document={}, fixable={}, repair_cycles={}",
                    documentName, report.fixable().size(), cycles);
        }
    }
}
