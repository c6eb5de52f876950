package io.journeyguard.cli.report;

import io.journeyguard.core.engine.ValidationOutcome;
import io.journeyguard.core.model.Category;
import io.journeyguard.core.model.Finding;
import io.journeyguard.core.model.Severity;
import io.journeyguard.core.model.ValidationReport;
import io.journeyguard.core.repair.FixRecord;
import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/** Renders validation outcomes as plain text, applied fixes first, then findings per category. */
public final class ReportPrinter {

    static final String RULE = "--------------------------------";

    private final PrintStream out;

    public ReportPrinter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    /**
     * Prints a validation outcome.
     *
     * @param outcome the outcome
     * @param only    the single category to report, or {@code null} for all
     */
    public void printValidation(ValidationOutcome outcome, Category only) {
        out.println("Validating " + outcome.documentName());
        printFixes(outcome.fixes());

        ValidationReport report = outcome.report();
        for (Category category : Category.values()) {
            if (only != null && category != only) {
                continue;
            }
            List<Finding> findings = report.findings(category);
            if (findings.isEmpty()) {
                out.println(category.title() + " passed - no issues found.");
                continue;
            }
            out.println(RULE);
            out.println(category.title() + " Errors");
            out.println(RULE);
            for (Finding finding : findings) {
                out.println(label(finding.severity()) + finding.message());
            }
            out.println(RULE);
        }

        out.println("Summary: " + report.errorCount() + " error(s), " + report.warningCount() + " warning(s), "
                + outcome.fixes().size() + " fix(es) applied");
    }

    /** Prints the result of a repair-only run. */
    public void printFixRun(ValidationOutcome outcome) {
        if (outcome.fixes().isEmpty()) {
            out.println("No fixes needed for " + outcome.documentName());
            return;
        }
        printFixes(outcome.fixes());
        out.println("Saved " + outcome.documentName());
    }

    private void printFixes(List<FixRecord> fixes) {
        if (fixes.isEmpty()) {
            return;
        }
        out.println("Applied " + fixes.size() + " auto-fix(es):");
        for (FixRecord fix : fixes) {
            out.println("  - [" + fix.category().id() + "] " + fix.description());
        }
    }

    private static String label(Severity severity) {
        return severity == Severity.WARNING ? "WARNING: " : "ERROR: ";
    }
}
