package io.journeyguard.core.spi;

import io.journeyguard.core.model.Category;
import io.journeyguard.core.model.Finding;
import java.util.List;

/**
 * A read-only analysis pass over a journey document. Implementations never mutate the tree and
 * never throw for problems in the document; every problem becomes a {@link Finding}.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe.
 */
public interface JourneyAnalyzer {

    /** The category every finding of this analyzer carries. */
    Category category();

    /**
     * Analyzes a document.
     *
     * @param context the document, its workflow view and the registry
     * @return findings in detection order, never {@code null}
     */
    List<Finding> analyze(AnalysisContext context);
}
