package org.neuralchilli.tickflow.store;

import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.MaskSubgraph;
import org.jgrapht.graph.builder.GraphTypeBuilder;
import org.jgrapht.traverse.BreadthFirstIterator;
import org.neuralchilli.tickflow.domain.Flow;
import org.neuralchilli.tickflow.domain.JoinBehavior;
import org.neuralchilli.tickflow.domain.JoinType;
import org.neuralchilli.tickflow.domain.Node;
import org.neuralchilli.tickflow.domain.NodeKind;
import org.neuralchilli.tickflow.domain.SplitType;
import org.neuralchilli.tickflow.domain.TriggerMode;
import org.neuralchilli.tickflow.domain.Workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Static structure of a loaded workflow: the adjacency index the verbs query,
 * backed by a JGraphT graph for reachability and cycle analysis.
 * Immutable once built.
 */
public final class Topology {

    private final Workflow workflow;
    private final Graph<String, DefaultEdge> graph;
    private final Map<String, List<Flow>> flowsOut;
    private final Map<String, List<Flow>> flowsIn;
    private final Set<String> cyclicNodes;

    public Topology(Workflow workflow) {
        this.workflow = workflow;

        Graph<String, DefaultEdge> g = GraphTypeBuilder
                .<String, DefaultEdge>directed()
                .allowingSelfLoops(true)
                .allowingMultipleEdges(false)
                .edgeClass(DefaultEdge.class)
                .buildGraph();
        workflow.nodes().forEach(n -> g.addVertex(n.id()));

        Map<String, Integer> declarationOrder = new HashMap<>();
        Map<String, List<Flow>> out = new HashMap<>();
        Map<String, List<Flow>> in = new HashMap<>();
        List<Flow> flows = workflow.flows();
        for (int i = 0; i < flows.size(); i++) {
            Flow flow = flows.get(i);
            declarationOrder.put(flow.key(), i);
            out.computeIfAbsent(flow.source(), k -> new ArrayList<>()).add(flow);
            in.computeIfAbsent(flow.target(), k -> new ArrayList<>()).add(flow);
            g.addEdge(flow.source(), flow.target());
        }

        // Priority first, declaration order breaks ties
        Comparator<Flow> order = Comparator
                .comparingInt(Flow::priority)
                .thenComparing(f -> declarationOrder.get(f.key()));
        out.values().forEach(list -> list.sort(order));
        in.values().forEach(list -> list.sort(order));

        this.graph = g;
        this.flowsOut = freeze(out);
        this.flowsIn = freeze(in);
        this.cyclicNodes = Collections.unmodifiableSet(new CycleDetector<>(g).findCycles());
    }

    private static Map<String, List<Flow>> freeze(Map<String, List<Flow>> index) {
        Map<String, List<Flow>> frozen = new HashMap<>();
        index.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(frozen);
    }

    public Workflow workflow() {
        return workflow;
    }

    /**
     * Read-only view of the JGraphT graph
     */
    public Graph<String, DefaultEdge> graph() {
        return graph;
    }

    public Node node(String id) {
        return workflow.requireNode(id);
    }

    public boolean hasNode(String id) {
        return workflow.hasNode(id);
    }

    public List<Node> nodes() {
        return workflow.nodes();
    }

    /**
     * Outgoing flows in evaluation order (priority, then declaration)
     */
    public List<Flow> flowsOut(String nodeId) {
        return flowsOut.getOrDefault(nodeId, List.of());
    }

    public List<Flow> flowsIn(String nodeId) {
        return flowsIn.getOrDefault(nodeId, List.of());
    }

    public List<String> predecessors(String nodeId) {
        return flowsIn(nodeId).stream().map(Flow::source).toList();
    }

    public List<String> successors(String nodeId) {
        return flowsOut(nodeId).stream().map(Flow::target).toList();
    }

    public boolean isOnCycle(String nodeId) {
        return cyclicNodes.contains(nodeId);
    }

    /**
     * A gated node is never activated by its predecessors' routing verbs.
     * Units of work wait in front of it until its own Await or Filter
     * consumes them.
     */
    public boolean isGated(String nodeId) {
        Node node = node(nodeId);
        JoinBehavior behavior = node.options().joinBehavior();
        return node.join() == JoinType.AND
                || node.join() == JoinType.OR
                || (behavior != JoinBehavior.STANDARD && behavior != JoinBehavior.MULTI_MERGE)
                || node.options().milestone() != null
                || node.options().trigger() != TriggerMode.NONE
                || node.options().mutex() != null;
    }

    /**
     * A plain predecessor hands its work to a gated target simply by holding
     * its token after completion: no split, one outgoing flow, no
     * thread or instance spawning.
     */
    public boolean isPlainPredecessor(String predecessor, String target) {
        Node node = node(predecessor);
        List<Flow> out = flowsOut(predecessor);
        return node.split() == SplitType.NONE
                && out.size() == 1
                && out.get(0).target().equals(target)
                && !out.get(0).isSelfLoop()
                && !out.get(0).loopBack()
                && node.kind() != NodeKind.OUTPUT_CONDITION
                && !node.isMultiInstance()
                && node.options().threads() == null
                && !node.options().deferred();
    }

    /**
     * OR-join with standard behavior: synchronizes the branches its multi-choice activated
     */
    public boolean isStructuredMerge(String nodeId) {
        Node node = node(nodeId);
        return node.join() == JoinType.OR && node.options().joinBehavior() == JoinBehavior.STANDARD;
    }

    /**
     * Branches that taking {@code flow} out of a multi-choice opens towards
     * structured merges downstream. A merge predecessor belongs to the branch
     * when it is the split itself on a direct flow, or when it is reachable
     * from the flow's target without passing through the split again.
     */
    public Set<BranchFact> branchesOpenedBy(Flow flow) {
        String split = flow.source();
        Graph<String, DefaultEdge> masked = new MaskSubgraph<>(graph, v -> v.equals(split), e -> false);
        Set<String> reached = new HashSet<>();
        if (masked.containsVertex(flow.target())) {
            new BreadthFirstIterator<>(masked, flow.target()).forEachRemaining(reached::add);
        }

        Set<BranchFact> branches = new TreeSet<>(Comparator.comparing(BranchFact::key));
        for (String join : reached) {
            if (!isStructuredMerge(join)) {
                continue;
            }
            for (Flow in : flowsIn(join)) {
                boolean direct = join.equals(flow.target()) && in.source().equals(split);
                if (direct || (reached.contains(in.source()) && !in.source().equals(join))) {
                    branches.add(new BranchFact(join, in.source()));
                }
            }
        }
        return branches;
    }

    /**
     * Nodes sharing a mutual-exclusion lock, in declaration order
     */
    public List<Node> lockMembers(String lock) {
        return workflow.nodes().stream()
                .filter(n -> n.options().mutex() != null && n.options().mutex().lock().equals(lock))
                .toList();
    }
}
