package io.journeyguard.core.engine;

import io.journeyguard.core.model.ValidationReport;
import io.journeyguard.core.repair.FixRecord;
import java.util.List;
import java.util.Objects;

/**
 * Result of a {@link JourneyValidator} run.
 *
 * @param documentName the validated file
 * @param report       findings of the final scan
 * @param fixes        every fix applied, across all repair cycles, in application order
 * @param repairCycles number of repair cycles that ran
 * @param persisted    whether the document was written back
 */
public record ValidationOutcome(
        String documentName, ValidationReport report, List<FixRecord> fixes, int repairCycles, boolean persisted) {

    public ValidationOutcome {
        Objects.requireNonNull(documentName, "documentName must not be null");
        Objects.requireNonNull(report, "report must not be null");
        fixes = List.copyOf(fixes);
    }

    public boolean isClean() {
        return report.isClean();
    }
}
