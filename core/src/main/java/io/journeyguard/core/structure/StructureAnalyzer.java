package io.journeyguard.core.structure;

import com.fasterxml.jackson.databind.JsonNode;
import io.journeyguard.core.model.BodyRef;
import io.journeyguard.core.model.Category;
import io.journeyguard.core.model.Finding;
import io.journeyguard.core.model.FixHint;
import io.journeyguard.core.model.JourneyNode;
import io.journeyguard.core.model.Link;
import io.journeyguard.core.model.LinkKind;
import io.journeyguard.core.model.NodeKind;
import io.journeyguard.core.model.Workflow;
import io.journeyguard.core.registry.NodeRegistry;
import io.journeyguard.core.registry.NodeTypeDefinition;
import io.journeyguard.core.registry.RegistryConstants;
import io.journeyguard.core.spi.AnalysisContext;
import io.journeyguard.core.spi.JourneyAnalyzer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Structural integrity of the workflow graph: identifiers, node types, reachability, embedded
 * body synchronization, self-referential recursion, link shape, terminal reachability and
 * required links.
 *
 * <p>
 * Thread-safe: all state lives on the stack of {@link #analyze}.
 */
public final class StructureAnalyzer implements JourneyAnalyzer {

    /** Lower-case, hyphenated UUID form required for node ids, head and workflow id. */
    public static final Pattern UUID_PATTERN =
            Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$");

    static final List<String> LOGIN_METHODS =
            List.of("email_otp", "native_biometrics", "passkeys", "password", "sms_otp", "totp", "web_to_mobile");

    private static final int MAX_TRACE = 10;

    @Override
    public Category category() {
        return Category.STRUCTURE;
    }

    @Override
    public List<Finding> analyze(AnalysisContext context) {
        Workflow workflow = context.workflow();
        List<Finding> findings = new ArrayList<>();
        if (!workflow.hasNodes()) {
            findings.add(error(null, "Workflow is missing a 'nodes' object."));
            return findings;
        }
        for (String key : workflow.malformedKeys()) {
            findings.add(error(key, "Node " + key + " is not a valid object."));
        }

        checkIdentity(workflow, findings);
        checkNodeTypes(workflow, context.registry(), findings);
        checkReachability(workflow, findings);
        checkBodies(workflow, findings);
        checkRecursion(workflow, findings);
        checkLinkShape(workflow, context.registry().constants(), findings);
        checkTerminals(workflow, findings);
        checkRequiredLinks(workflow, context.registry(), findings);
        return findings;
    }

    /** Returns {@code true} if the value is a lower-case hyphenated UUID. */
    public static boolean isValidUuid(String value) {
        return value != null && UUID_PATTERN.matcher(value).matches();
    }

    // --- Identity ---

    private void checkIdentity(Workflow workflow, List<Finding> findings) {
        for (JourneyNode node : workflow.nodes().values()) {
            String key = node.key();
            if (!isValidUuid(key)) {
                findings.add(fixable(key, "Node " + key + " does not have a valid UUID."));
            }
            if (node.hasDeclaredId()) {
                String declared = node.declaredId();
                if (!key.equals(declared)) {
                    findings.add(fixable(
                                    key, "Node " + key + " has mismatched id field: " + node.json().get("id") + ".")
                            .withField("id"));
                } else if (!isValidUuid(declared)) {
                    findings.add(fixable(key, "The node id for node " + key + " is not a valid UUID: " + declared)
                            .withField("id"));
                }
            } else {
                findings.add(fixable(key, "Node " + key + " is missing 'id' field.").withField("id"));
            }
        }

        if (workflow.hasHead()) {
            if (!isValidUuid(workflow.head())) {
                findings.add(fixable(null, "Workflow head " + workflow.json().get("head") + " is not a valid UUID.")
                        .withField("head"));
            }
        } else {
            findings.add(error(null, "Workflow is missing 'head' field.").withField("head"));
        }

        if (workflow.hasId()) {
            if (!isValidUuid(workflow.id())) {
                findings.add(fixable(null, "Workflow ID is not a valid UUID: " + workflow.json().get("id") + ".")
                        .withField("id"));
            }
        } else {
            findings.add(fixable(null, "Workflow is missing 'id' field.").withField("id"));
        }
    }

    // --- Node types ---

    private void checkNodeTypes(Workflow workflow, NodeRegistry registry, List<Finding> findings) {
        for (JourneyNode node : workflow.nodes().values()) {
            for (String problem : node.type().problems()) {
                findings.add(error(node.key(), problem).withField("type"));
            }
            String key = node.typeKey();
            if (key == null) {
                continue;
            }
            if (!registry.isEmpty() && !registry.contains(key)) {
                findings.add(error(node.key(), "Node " + node.key() + " has an invalid type: " + key + ".")
                        .withField("type"));
            }
            if (node.isAction("get_information")) {
                findings.add(fixable(
                                node.key(),
                                "Node " + node.key() + " uses 'get_information' as action type, which is invalid. "
                                        + "Use form structure instead: "
                                        + "{\"type\": \"form\", \"metadata\": {\"type\": \"get_information\"}, ...}")
                        .withField("action.type"));
            }
        }
    }

    // --- Reachability ---

    private void checkReachability(Workflow workflow, List<Finding> findings) {
        if (!workflow.hasHead()) {
            return;
        }
        String head = workflow.head();
        if (!workflow.contains(head)) {
            findings.add(error(null, "Workflow head '" + head + "' does not exist in the nodes.")
                    .withField("head"));
            return;
        }

        Set<String> visited = new HashSet<>();
        visit(workflow, head, visited, findings);

        Set<String> unreachable = new TreeSet<>(workflow.nodes().keySet());
        unreachable.removeAll(visited);
        if (unreachable.isEmpty()) {
            return;
        }
        for (String key : unreachable) {
            findings.add(error(key, "Node " + key + " is not reachable from the head node."));
        }
        List<JourneyNode> containers = workflow.containers();
        if (!containers.isEmpty()) {
            findings.add(Finding.warning(Category.STRUCTURE, null, unreachableSuggestion(unreachable, containers)));
        }
    }

    /**
     * Preorder walk over link targets, then the body entry, of each node. A container's body
     * checks run once its link targets have been walked, matching a recursive visit.
     */
    private void visit(Workflow workflow, String headId, Set<String> visited, List<Finding> findings) {
        Deque<Step> steps = new ArrayDeque<>();
        steps.push(new Step(headId, false));
        while (!steps.isEmpty()) {
            Step step = steps.pop();
            String nodeId = step.nodeId();
            if (step.bodyCheck()) {
                visitBody(workflow.nodes().get(nodeId), steps, findings);
                continue;
            }
            if (visited.contains(nodeId)) {
                continue;
            }
            JourneyNode node = workflow.nodes().get(nodeId);
            if (node == null) {
                findings.add(error(nodeId, "Node " + nodeId + " is referenced but does not exist in the journey."));
                continue;
            }
            visited.add(nodeId);
            if (node.isContainer()) {
                steps.push(new Step(nodeId, true));
            }
            List<String> targets = node.targets();
            for (int i = targets.size() - 1; i >= 0; i--) {
                steps.push(new Step(targets.get(i), false));
            }
        }
    }

    private void visitBody(JourneyNode container, Deque<Step> steps, List<Finding> findings) {
        String nodeId = container.key();
        BodyRef body = container.bodyRef().orElseThrow();
        String kind = capitalize(container.kind().wireName());
        if (!body.hasBody()) {
            findings.add(error(nodeId, kind + " node " + nodeId + " is missing a '" + body.bodyKey() + "' key.")
                    .withField(body.bodyKey()));
        } else if (!body.hasEntryId()) {
            findings.add(error(
                            nodeId,
                            kind + " node " + nodeId + " is missing an 'id' key in the '" + body.bodyKey()
                                    + "' key.")
                    .withField(body.bodyKey() + ".id"));
        } else {
            steps.push(new Step(body.entryId(), false));
        }
    }

    private record Step(String nodeId, boolean bodyCheck) {}

    private static String unreachableSuggestion(Set<String> unreachable, List<JourneyNode> containers) {
        String firstUnreachable = unreachable.iterator().next();
        StringBuilder text = new StringBuilder()
                .append("SUGGESTION: Found ")
                .append(unreachable.size())
                .append(" unreachable node(s) and ")
                .append(containers.size())
                .append(" loop/block node(s). Unreachable nodes are often caused by missing or incorrect ")
                .append("loop_body/block references.\n");
        for (JourneyNode container : containers) {
            BodyRef body = container.bodyRef().orElseThrow();
            text.append("  - ").append(container.kind().wireName()).append(" node ").append(container.key());
            if (body.hasEntryId()) {
                text.append(" references ").append(body.bodyKey()).append(".id = ").append(body.entryId());
                if (unreachable.contains(body.entryId())) {
                    text.append(" (but this node is NOT reachable - check if the container is reachable)");
                }
            } else {
                text.append(" is missing ")
                        .append(body.bodyKey())
                        .append(".id reference - consider if first unreachable node (")
                        .append(firstUnreachable)
                        .append(") should be referenced here");
            }
            text.append('\n');
        }
        text.append("  FIX: ensure each loop/block node is reachable from the head node, that its loop_body/block ")
                .append("field holds the full node definition, and that the same node exists in the nodes map ")
                .append("with a matching id and identical content.");
        return text.toString();
    }

    // --- Embedded bodies ---

    private void checkBodies(Workflow workflow, List<Finding> findings) {
        for (JourneyNode container : workflow.containers()) {
            BodyRef body = container.bodyRef().orElseThrow();
            String key = container.key();
            String bodyKey = body.bodyKey();
            if (!body.hasBody() || body.body().isEmpty()) {
                findings.add(error(key, "Node " + key + " is missing a '" + bodyKey + "' field.")
                        .withField(bodyKey));
            } else if (!body.hasEntryId()) {
                findings.add(error(key, "Node " + key + " is missing an 'id' key in the '" + bodyKey + "' field.")
                        .withField(bodyKey + ".id"));
            } else if (!workflow.contains(body.entryId())) {
                findings.add(error(
                                key,
                                "Node " + key + " references node " + body.entryId() + " in '" + bodyKey
                                        + "', but that node doesn't exist in the nodes dictionary.")
                        .withField(bodyKey + ".id"));
            } else if (!workflow.nodes().get(body.entryId()).json().equals(body.body())) {
                findings.add(fixable(
                                key,
                                "Node " + key + ": '" + bodyKey + "' field does not match node " + body.entryId()
                                        + " in nodes dictionary.")
                        .withField(bodyKey));
            }
        }
    }

    // --- Self-referential recursion ---

    private void checkRecursion(Workflow workflow, List<Finding> findings) {
        Map<String, Set<String>> bodySets = BodySets.of(workflow);
        for (JourneyNode node : workflow.nodes().values()) {
            for (Link link : node.links()) {
                if (!link.hasTarget()) {
                    continue;
                }
                String target = link.target();
                Set<String> targetBody = bodySets.get(target);
                if (targetBody != null) {
                    if (targetBody.contains(node.key())) {
                        JourneyNode container = workflow.nodes().get(target);
                        findings.add(error(
                                        node.key(),
                                        "Node " + node.key() + " has link '" + link.displayName()
                                                + "' that incorrectly targets the " + container.kind().wireName()
                                                + " node itself (" + target + "), which creates infinite structural "
                                                + "recursion and freezes the editor.\n  Loop body nodes: "
                                                + trace(workflow, container)
                                                + "\n  FIX: change the link target to null or remove the 'target' "
                                                + "field; loop nodes are conditional branch containers and retry "
                                                + "through links with no target.")
                                .withField("links[" + link.index() + "].target"));
                    }
                    continue;
                }
                for (Map.Entry<String, Set<String>> entry : bodySets.entrySet()) {
                    JourneyNode container = workflow.nodes().get(entry.getKey());
                    String entryId = container.bodyRef().orElseThrow().entryId();
                    if (target.equals(entryId) && entry.getValue().contains(node.key())) {
                        String kind = container.kind().wireName();
                        findings.add(error(
                                        node.key(),
                                        "Node " + node.key() + " has link '" + link.displayName()
                                                + "' that incorrectly targets the first node in the " + kind
                                                + " body (" + target + "), which creates infinite structural "
                                                + "recursion.\n  " + capitalize(kind) + " node: " + container.key()
                                                + "\n  Loop body nodes: " + trace(workflow, container)
                                                + "\n  FIX: change the link target to null or remove the 'target' "
                                                + "field.")
                                .withField("links[" + link.index() + "].target"));
                        break;
                    }
                }
            }
        }
    }

    /** Follows first links from the body entry, marking a revisit as a cycle. */
    private static String trace(Workflow workflow, JourneyNode container) {
        String current = container.bodyRef().map(BodyRef::entryId).orElse(null);
        List<String> path = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        while (current != null && workflow.contains(current) && path.size() < MAX_TRACE) {
            if (!seen.add(current)) {
                path.add(current + " (cycle detected)");
                break;
            }
            path.add(current);
            List<Link> links = workflow.nodes().get(current).links();
            if (links.isEmpty()) {
                break;
            }
            current = links.get(0).hasTarget() ? links.get(0).target() : null;
        }
        if (path.size() >= MAX_TRACE) {
            path.add("...");
        }
        return path.isEmpty() ? "(unable to trace)" : String.join(" -> ", path);
    }

    // --- Link shape ---

    private void checkLinkShape(Workflow workflow, RegistryConstants constants, List<Finding> findings) {
        List<String> linkTypes = constants.validLinkTypes();
        List<String> presentations = constants.validPresentationValues();
        for (JourneyNode node : workflow.nodes().values()) {
            String key = node.key();
            for (Link link : node.links()) {
                String field = "links[" + link.index() + "]";
                String prefix = "Node " + key + " " + field;
                if (!link.isObject()) {
                    findings.add(error(key, prefix + " is not a valid object.").withField(field));
                    continue;
                }
                if (!link.hasType()) {
                    findings.add(error(
                                    key,
                                    prefix + " is missing required 'type' field. Links must specify a type "
                                            + "(e.g., 'branch' or 'escape').\n  Current link: " + link.json()
                                            + "\n  Add: \"type\": \"branch\" (or \"escape\" for error/alternative "
                                            + "paths)")
                            .withField(field + ".type"));
                } else if (!RegistryConstants.allows(linkTypes, link.rawType())) {
                    findings.add(error(
                                    key,
                                    prefix + " has invalid type '" + displayValue(link.json().get("type"))
                                            + "'. Valid types are: " + String.join(", ", linkTypes))
                            .withField(field + ".type"));
                }
                if (!link.hasName() && link.hasTarget()) {
                    findings.add(Finding.warning(
                                    Category.STRUCTURE,
                                    key,
                                    prefix + " is missing 'name' field. While not strictly required, links should "
                                            + "have descriptive names (e.g., 'success_child', 'failure', 'child').")
                            .withField(field + ".name"));
                }
                if (link.hasPresentation() && !RegistryConstants.allows(presentations, link.presentation())) {
                    findings.add(error(
                                    key,
                                    prefix + " ('" + (link.name() != null ? link.name() : "unnamed")
                                            + "') has invalid presentation value '"
                                            + displayValue(link.json().get("presentation")) + "'. Must be one of: "
                                            + String.join(", ", presentations))
                            .withField(field + ".presentation"));
                }
            }
        }
    }

    // --- Terminal reachability ---

    private void checkTerminals(Workflow workflow, List<Finding> findings) {
        NodeRegistry registry = workflow.registry();
        if (registry.terminalTypes().isEmpty()) {
            return;
        }
        Set<String> inBodies = BodySets.union(workflow);
        TerminalReachability reachability = new TerminalReachability(workflow);
        for (JourneyNode node : workflow.nodes().values()) {
            if (inBodies.contains(node.key()) || node.isContainer() || registry.isTerminal(node.typeKey())) {
                continue;
            }
            String label = node.typeKey() != null ? node.typeKey() : "unknown";
            if (node.links().isEmpty()) {
                findings.add(error(
                        node.key(),
                        "Node " + node.key() + " (" + label + ") is in outer scope but has no links and is not a "
                                + "terminal node (" + String.join("/", registry.terminalTypes()) + "). All outer "
                                + "scope paths must eventually reach a terminal node."));
                continue;
            }
            boolean terminates = node.targets().stream().anyMatch(reachability::reachesTerminal);
            if (!terminates) {
                findings.add(error(
                        node.key(),
                        "Node " + node.key() + " (" + label + ") is in outer scope but none of its paths reach a "
                                + "terminal node (" + String.join("/", registry.terminalTypes()) + "). All outer "
                                + "scope branches must eventually terminate."));
            }
        }
    }

    // --- Required links ---

    private void checkRequiredLinks(Workflow workflow, NodeRegistry registry, List<Finding> findings) {
        for (JourneyNode node : workflow.nodes().values()) {
            String type = node.typeKey();
            if (type == null) {
                continue;
            }
            if ("login_form".equals(type)) {
                checkLoginForm(node, findings);
                continue;
            }
            NodeTypeDefinition definition = registry.find(type).orElse(null);
            if (definition == null || !definition.hasRequiredLinks()) {
                continue;
            }
            Set<String> branches = namesOf(node, LinkKind.BRANCH);
            Set<String> escapes = namesOf(node, LinkKind.ESCAPE);
            String prefix = "Node " + node.key() + " (" + type + ")";
            for (String name : definition.requiredBranchLinks()) {
                if (branches.contains(name)) {
                    continue;
                }
                if (escapes.contains(name)) {
                    findings.add(kindMismatch(node, registry, name, LinkKind.ESCAPE, LinkKind.BRANCH, prefix));
                } else {
                    findings.add(error(node.key(), prefix + " is missing required branch link: '" + name + "'")
                            .withField("links"));
                }
            }
            for (String name : definition.requiredEscapeLinks()) {
                if (escapes.contains(name)) {
                    continue;
                }
                if (branches.contains(name)) {
                    findings.add(kindMismatch(node, registry, name, LinkKind.BRANCH, LinkKind.ESCAPE, prefix));
                } else {
                    findings.add(error(node.key(), prefix + " is missing required escape link: '" + name + "'")
                            .withField("links"));
                }
            }
        }
    }

    private static void checkLoginForm(JourneyNode node, List<Finding> findings) {
        boolean hasEscape = node.links().stream().anyMatch(l -> l.is(LinkKind.ESCAPE));
        if (!hasEscape) {
            findings.add(error(
                            node.key(),
                            "Node " + node.key() + " (login_form) must have at least one escape link for an "
                                    + "authentication method. Valid methods: " + String.join(", ", LOGIN_METHODS))
                    .withField("links"));
        }
        boolean hasChild = node.links().stream().anyMatch(l -> l.is(LinkKind.BRANCH) && "child".equals(l.name()));
        if (hasChild) {
            findings.add(error(
                            node.key(),
                            "Node " + node.key() + " (login_form) must NOT use generic 'child' branch links. Use "
                                    + "escape links with specific authentication method names instead.")
                    .withField("links"));
        }
    }

    private static Finding kindMismatch(
            JourneyNode node, NodeRegistry registry, String name, LinkKind actual, LinkKind expected, String prefix) {
        Finding finding = Finding.warning(
                        Category.STRUCTURE,
                        node.key(),
                        prefix + " has '" + name + "' as " + actual.wireName() + " link, but it should be a "
                                + expected.wireName() + " link.")
                .withField("links");
        // The repair looks link kinds up by action.type, which differs from the effective type for forms.
        String repairKey = node.kind() == NodeKind.ACTION ? node.actionType() : node.rawType();
        boolean repairable = registry.find(repairKey)
                .map(def -> expected.wireName().equals(def.expectedLinkType(name)))
                .orElse(false);
        return repairable ? finding.withHint(FixHint.catalogue()) : finding;
    }

    private static Set<String> namesOf(JourneyNode node, LinkKind kind) {
        Set<String> names = new HashSet<>();
        for (Link link : node.links()) {
            if (link.is(kind) && link.name() != null && !link.name().isEmpty()) {
                names.add(link.name());
            }
        }
        return names;
    }

    private static String displayValue(JsonNode value) {
        return value == null ? "null" : value.isTextual() ? value.asText() : value.toString();
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    private static Finding error(String nodeId, String message) {
        return Finding.error(Category.STRUCTURE, nodeId, message);
    }

    private static Finding fixable(String nodeId, String message) {
        return Finding.error(Category.STRUCTURE, nodeId, message).withHint(FixHint.catalogue());
    }
}
