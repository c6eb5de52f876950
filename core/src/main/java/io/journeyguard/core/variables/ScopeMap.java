package io.journeyguard.core.variables;

import io.journeyguard.core.model.BodyRef;
import io.journeyguard.core.model.JourneyNode;
import io.journeyguard.core.model.NodeKind;
import io.journeyguard.core.model.Workflow;
import io.journeyguard.core.structure.BodySets;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Which loop and which block (if any) each node executes in, as seen by a depth-first walk from
 * the head.
 *
 * <p>
 * Entering a loop body sets the loop, entering a block body sets the block, and following a
 * link out of the current loop's body set clears the loop. Each node is visited once, so a node
 * reachable both inside and outside a loop keeps the scope of its first visit.
 */
public final class ScopeMap {

    private final Map<String, String> loopOf;
    private final Map<String, String> blockOf;

    private ScopeMap(Map<String, String> loopOf, Map<String, String> blockOf) {
        this.loopOf = Collections.unmodifiableMap(loopOf);
        this.blockOf = Collections.unmodifiableMap(blockOf);
    }

    /** Builds the scope map of a workflow; an absent or dangling head yields an empty map. */
    public static ScopeMap of(Workflow workflow) {
        Walker walker = new Walker(workflow);
        String head = workflow.head();
        if (workflow.contains(head)) {
            walker.mark(head);
        }
        return new ScopeMap(walker.loopOf, walker.blockOf);
    }

    /** The innermost loop the node executes in. */
    public Optional<String> loopOf(String nodeId) {
        return Optional.ofNullable(loopOf.get(nodeId));
    }

    /** The innermost block the node executes in. */
    public Optional<String> blockOf(String nodeId) {
        return Optional.ofNullable(blockOf.get(nodeId));
    }

    public boolean inLoop(String nodeId) {
        return loopOf.containsKey(nodeId);
    }

    private static final class Walker {

        private final Workflow workflow;
        private final Set<String> visited = new HashSet<>();
        private final Map<String, Set<String>> loopBodies = new HashMap<>();
        private final Map<String, String> loopOf = new HashMap<>();
        private final Map<String, String> blockOf = new HashMap<>();

        Walker(Workflow workflow) {
            this.workflow = workflow;
        }

        /** Preorder walk: the body entry first, then link targets in order. */
        void mark(String headId) {
            Deque<Scoped> pending = new ArrayDeque<>();
            pending.push(new Scoped(headId, null, null));
            while (!pending.isEmpty()) {
                Scoped current = pending.pop();
                String nodeId = current.nodeId();
                if (visited.contains(nodeId) || !workflow.contains(nodeId)) {
                    continue;
                }
                visited.add(nodeId);
                JourneyNode node = workflow.nodes().get(nodeId);
                String loopId = current.loopId();
                String blockId = current.blockId();
                if (loopId != null) {
                    loopOf.put(nodeId, loopId);
                }
                if (blockId != null) {
                    blockOf.put(nodeId, blockId);
                }

                List<String> targets = node.targets();
                for (int i = targets.size() - 1; i >= 0; i--) {
                    String target = targets.get(i);
                    boolean leavesLoop = loopId != null && !bodyOf(loopId).contains(target);
                    pending.push(new Scoped(target, leavesLoop ? null : loopId, blockId));
                }

                Optional<String> entry = node.bodyRef().filter(BodyRef::hasEntryId).map(BodyRef::entryId);
                if (entry.isPresent()) {
                    if (node.kind() == NodeKind.LOOP) {
                        pending.push(new Scoped(entry.get(), nodeId, blockId));
                    } else {
                        pending.push(new Scoped(entry.get(), loopId, nodeId));
                    }
                }
            }
        }

        /** Link-closure of the loop's body entry, never including the loop itself. */
        private Set<String> bodyOf(String loopId) {
            return loopBodies.computeIfAbsent(loopId, id -> workflow.node(id)
                    .flatMap(JourneyNode::bodyRef)
                    .filter(BodyRef::hasEntryId)
                    .map(ref -> BodySets.closure(workflow, ref.entryId(), Set.of(id)))
                    .orElse(Set.of()));
        }
    }

    private record Scoped(String nodeId, String loopId, String blockId) {}
}
