package io.journeyguard.core.structure;

import io.journeyguard.core.model.JourneyNode;
import io.journeyguard.core.model.Workflow;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Computes the body set of loop and block containers: every node reachable from the body entry
 * through {@code links} only.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class BodySets {

    private BodySets() {
        // utility class
    }

    /**
     * Body sets of every container that names a body entry, keyed by container id in document
     * order.
     */
    public static Map<String, Set<String>> of(Workflow workflow) {
        Map<String, Set<String>> sets = new LinkedHashMap<>();
        for (JourneyNode container : workflow.containers()) {
            container.bodyRef()
                    .filter(ref -> ref.hasEntryId())
                    .ifPresent(ref -> sets.put(container.key(), closure(workflow, ref.entryId(), Set.of())));
        }
        return sets;
    }

    /** Union of all body sets. */
    public static Set<String> union(Workflow workflow) {
        Set<String> all = new HashSet<>();
        of(workflow).values().forEach(all::addAll);
        return all;
    }

    /**
     * Nodes reachable from {@code entryId} by following link targets. Nodes in {@code excluded}
     * are neither entered nor included; unknown ids are skipped.
     */
    public static Set<String> closure(Workflow workflow, String entryId, Set<String> excluded) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> toVisit = new ArrayDeque<>();
        toVisit.push(entryId);
        while (!toVisit.isEmpty()) {
            String current = toVisit.pop();
            if (visited.contains(current) || excluded.contains(current) || !workflow.contains(current)) {
                continue;
            }
            visited.add(current);
            for (String target : workflow.nodes().get(current).targets()) {
                if (!visited.contains(target)) {
                    toVisit.push(target);
                }
            }
        }
        return visited;
    }
}
