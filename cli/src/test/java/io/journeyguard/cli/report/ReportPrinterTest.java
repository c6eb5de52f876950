package io.journeyguard.cli.report;

import static org.assertj.core.api.Assertions.assertThat;

import io.journeyguard.core.engine.ValidationOutcome;
import io.journeyguard.core.model.Category;
import io.journeyguard.core.model.Finding;
import io.journeyguard.core.model.ValidationReport;
import io.journeyguard.core.repair.FixRecord;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ReportPrinter")
class ReportPrinterTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final ReportPrinter printer = new ReportPrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8));

    private List<String> lines() {
        return buffer.toString(StandardCharsets.UTF_8).lines().toList();
    }

    private static ValidationOutcome outcome(List<Finding> findings, List<FixRecord> fixes) {
        return new ValidationOutcome("j.json", ValidationReport.of(findings), fixes, 1, !fixes.isEmpty());
    }

    @Test
    void findingsAreGroupedByCategoryAfterFixes() {
        var findings = List.of(
                Finding.error(Category.STRUCTURE, "n1", "Node n1 has no terminal path."),
                Finding.warning(Category.EXPRESSIONS, "n2", "Deeply nested template."));
        var fixes = List.of(new FixRecord(Category.METADATA, null, "Added missing journey type to 'anonymous'"));

        printer.printValidation(outcome(findings, fixes), null);

        assertThat(lines()).containsExactly(
                "Validating j.json",
                "Applied 1 auto-fix(es):",
                "  - [metadata] Added missing journey type to 'anonymous'",
                "Journey Metadata Validation passed - no issues found.",
                ReportPrinter.RULE,
                "Journey Structure Validation Errors",
                ReportPrinter.RULE,
                "ERROR: Node n1 has no terminal path.",
                ReportPrinter.RULE,
                "Journey Required Fields Validation passed - no issues found.",
                ReportPrinter.RULE,
                "Journey Expression Validation Errors",
                ReportPrinter.RULE,
                "WARNING: Deeply nested template.",
                ReportPrinter.RULE,
                "Journey Variable Validation passed - no issues found.",
                "Summary: 1 error(s), 1 warning(s), 1 fix(es) applied");
    }

    @Test
    void onlyLimitsTheSections() {
        printer.printValidation(outcome(List.of(), List.of()), Category.VARIABLES);

        assertThat(lines()).containsExactly(
                "Validating j.json",
                "Journey Variable Validation passed - no issues found.",
                "Summary: 0 error(s), 0 warning(s), 0 fix(es) applied");
    }

    @Test
    void fixRunListsFixesAndSave() {
        var fixes = List.of(new FixRecord(Category.STRUCTURE, "n1", "Fixed mismatched id for node n1"));

        printer.printFixRun(outcome(List.of(), fixes));

        assertThat(lines()).containsExactly(
                "Applied 1 auto-fix(es):",
                "  - [structure] Fixed mismatched id for node n1",
                "Saved j.json");
    }
}
