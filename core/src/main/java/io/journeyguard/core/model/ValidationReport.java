package io.journeyguard.core.model;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, ordered collection of findings produced by one scan.
 */
public final class ValidationReport {

    private static final ValidationReport EMPTY = new ValidationReport(List.of());

    private final List<Finding> findings;

    private ValidationReport(List<Finding> findings) {
        this.findings = findings;
    }

    public static ValidationReport of(List<Finding> findings) {
        Objects.requireNonNull(findings, "findings must not be null");
        return findings.isEmpty() ? EMPTY : new ValidationReport(List.copyOf(findings));
    }

    public static ValidationReport empty() {
        return EMPTY;
    }

    public List<Finding> findings() {
        return findings;
    }

    /** Findings of one category, in report order. */
    public List<Finding> findings(Category category) {
        return findings.stream().filter(f -> f.category() == category).toList();
    }

    /** Findings grouped by category, in category declaration order; empty groups are omitted. */
    public Map<Category, List<Finding>> byCategory() {
        Map<Category, List<Finding>> grouped = new EnumMap<>(Category.class);
        for (Finding finding : findings) {
            grouped.computeIfAbsent(finding.category(), c -> new ArrayList<>()).add(finding);
        }
        return grouped;
    }

    /** Returns a report containing only the given category. */
    public ValidationReport only(Category category) {
        return of(findings(category));
    }

    public List<Finding> fixable() {
        return findings.stream().filter(Finding::isFixable).toList();
    }

    public long errorCount() {
        return findings.stream().filter(f -> f.severity() == Severity.ERROR).count();
    }

    public long warningCount() {
        return findings.stream().filter(f -> f.severity() == Severity.WARNING).count();
    }

    public boolean isClean() {
        return findings.isEmpty();
    }

    public int size() {
        return findings.size();
    }

    // --- equals / hashCode (ordered findings) ---

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationReport that)) return false;
        return findings.equals(that.findings);
    }

    @Override
    public int hashCode() {
        return findings.hashCode();
    }

    @Override
    public String toString() {
        return "ValidationReport{findings=" + findings.size() + ", errors=" + errorCount() + "}";
    }
}
