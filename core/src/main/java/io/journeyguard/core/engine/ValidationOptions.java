package io.journeyguard.core.engine;

import io.journeyguard.core.model.Category;
import java.util.Optional;

/**
 * Options for one validation run.
 *
 * @param autoFix         whether repairs are applied and persisted
 * @param maxRepairCycles upper bound on repair-then-rescan cycles
 * @param only            restricts the returned report to one category, or {@code null} for all;
 *                        repairs always cover the whole document
 */
public record ValidationOptions(boolean autoFix, int maxRepairCycles, Category only) {

    public static final int DEFAULT_MAX_REPAIR_CYCLES = 1;

    public ValidationOptions {
        if (maxRepairCycles < 0) {
            throw new IllegalArgumentException("maxRepairCycles must be >= 0, got " + maxRepairCycles);
        }
    }

    /** Auto-fix enabled, one repair cycle, all categories. */
    public static ValidationOptions defaults() {
        return new ValidationOptions(true, DEFAULT_MAX_REPAIR_CYCLES, null);
    }

    public ValidationOptions withAutoFix(boolean autoFix) {
        return new ValidationOptions(autoFix, maxRepairCycles, only);
    }

    public ValidationOptions withMaxRepairCycles(int maxRepairCycles) {
        return new ValidationOptions(autoFix, maxRepairCycles, only);
    }

    public ValidationOptions withOnly(Category only) {
        return new ValidationOptions(autoFix, maxRepairCycles, only);
    }

    public Optional<Category> onlyCategory() {
        return Optional.ofNullable(only);
    }
}
