package io.journeyguard.core.structure;

import io.journeyguard.core.model.JourneyNode;
import io.journeyguard.core.model.Workflow;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Answers whether a path from a node eventually reaches a terminal node ({@code is_terminal} in
 * the registry).
 *
 * <p>
 * Depth-first with an on-stack marker: a node that is already on the current path counts as
 * not reaching. Results are memoized, except results that depended on a node still on the stack
 * above the one being evaluated. The walk keeps its own frame stack, so path length is not
 * limited by the call stack.
 *
 * <p>
 * Not thread-safe; create one instance per analysis.
 */
public final class TerminalReachability {

    private final Workflow workflow;
    private final Map<String, Boolean> memo = new HashMap<>();
    private final Map<String, Integer> onStack = new HashMap<>();

    public TerminalReachability(Workflow workflow) {
        this.workflow = workflow;
    }

    /** Returns {@code true} if some path from {@code nodeId} reaches a terminal node. */
    public boolean reachesTerminal(String nodeId) {
        Boolean settled = settle(nodeId);
        if (settled != null) {
            return settled;
        }
        Deque<Frame> stack = new ArrayDeque<>();
        push(stack, nodeId);

        boolean result = false;
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (!top.reaches && top.targets.hasNext()) {
                String target = top.targets.next();
                Integer stackDepth = onStack.get(target);
                if (stackDepth != null) {
                    top.cut = Math.min(top.cut, stackDepth);
                    continue;
                }
                Boolean known = settle(target);
                if (known == null) {
                    push(stack, target);
                } else if (known) {
                    top.reaches = true;
                }
                continue;
            }

            stack.pop();
            onStack.remove(top.nodeId);
            // A negative answer that leaned on an ancestor still being explored is only provisional.
            if (top.reaches || top.cut >= top.depth) {
                memo.put(top.nodeId, top.reaches);
            }
            result = top.reaches;
            Frame parent = stack.peek();
            if (parent != null) {
                parent.cut = Math.min(parent.cut, top.cut);
                parent.reaches |= top.reaches;
            }
        }
        return result;
    }

    /** Memoized, unknown or terminal nodes answer without a frame; {@code null} means explore. */
    private Boolean settle(String nodeId) {
        Boolean known = memo.get(nodeId);
        if (known != null) {
            return known;
        }
        JourneyNode node = workflow.nodes().get(nodeId);
        if (node == null) {
            memo.put(nodeId, false);
            return false;
        }
        if (workflow.registry().isTerminal(node.typeKey())) {
            memo.put(nodeId, true);
            return true;
        }
        return null;
    }

    private void push(Deque<Frame> stack, String nodeId) {
        int depth = stack.size();
        onStack.put(nodeId, depth);
        stack.push(new Frame(nodeId, depth, workflow.nodes().get(nodeId).targets().iterator()));
    }

    private static final class Frame {

        private final String nodeId;
        private final int depth;
        private final Iterator<String> targets;
        private int cut = Integer.MAX_VALUE;
        private boolean reaches;

        Frame(String nodeId, int depth, Iterator<String> targets) {
            this.nodeId = nodeId;
            this.depth = depth;
            this.targets = targets;
        }
    }
}
