package io.journeyguard.core.spi;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.journeyguard.core.model.Workflow;
import io.journeyguard.core.registry.NodeRegistry;
import java.util.Objects;

/**
 * Input handed to every {@link JourneyAnalyzer}.
 *
 * @param root     the whole document (the {@code exports} envelope, or a bare {@code workflow} holder)
 * @param workflow view over the extracted workflow
 * @param registry node type registry
 */
public record AnalysisContext(ObjectNode root, Workflow workflow, NodeRegistry registry) {

    public AnalysisContext {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(workflow, "workflow must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
    }

    /** Returns {@code true} if the document uses the {@code exports} envelope. */
    public boolean isExportsDocument() {
        return root.has("exports");
    }
}
