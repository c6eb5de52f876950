package io.journeyguard.core.repair;

import io.journeyguard.core.model.Category;
import java.util.Objects;

/**
 * One change applied by a repair.
 *
 * @param category    the finding family the change addresses
 * @param nodeId      the node that was changed, or {@code null} for document-level changes
 * @param description human-readable description of the change
 */
public record FixRecord(Category category, String nodeId, String description) {

    public FixRecord {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(description, "description must not be null");
    }
}
