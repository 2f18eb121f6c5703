package com.pyflow.model.graph;

import com.pyflow.model.Dataset;
import com.pyflow.model.Flow;
import com.pyflow.model.Recipe;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bipartite dataset/recipe graph derived from a {@link Flow} on demand. Edges run dataset → recipe
 * for recipe inputs and recipe → dataset for recipe outputs. References to datasets that are not
 * in the flow are ignored here (validation reports them). Node order follows flow order so every
 * traversal is deterministic.
 */
public final class FlowGraph {

    /** Kind of a graph node. */
    public enum NodeKind { DATASET, RECIPE }

    /** Graph node; datasets and recipes live in separate name spaces. */
    public record Node(String name, NodeKind kind) {
        @Override
        public String toString() {
            return name;
        }
    }

    private final Map<Node, Set<Node>> successors = new LinkedHashMap<>();
    private final Map<Node, Set<Node>> predecessors = new LinkedHashMap<>();

    private FlowGraph() {
    }

    public static FlowGraph of(Flow flow) {
        FlowGraph g = new FlowGraph();
        for (Dataset d : flow.getDatasets()) g.addNode(new Node(d.getName(), NodeKind.DATASET));
        for (Recipe r : flow.getRecipes()) g.addNode(new Node(r.getName(), NodeKind.RECIPE));
        for (Recipe r : flow.getRecipes()) {
            Node recipe = new Node(r.getName(), NodeKind.RECIPE);
            for (String in : r.getInputs()) {
                Node ds = new Node(in, NodeKind.DATASET);
                if (g.successors.containsKey(ds)) g.addEdge(ds, recipe);
            }
            for (String out : r.getOutputs()) {
                Node ds = new Node(out, NodeKind.DATASET);
                if (g.successors.containsKey(ds)) g.addEdge(recipe, ds);
            }
        }
        return g;
    }

    private void addNode(Node node) {
        successors.putIfAbsent(node, new LinkedHashSet<>());
        predecessors.putIfAbsent(node, new LinkedHashSet<>());
    }

    private void addEdge(Node from, Node to) {
        successors.get(from).add(to);
        predecessors.get(to).add(from);
    }

    public List<Node> nodes() {
        return List.copyOf(successors.keySet());
    }

    public int nodeCount() {
        return successors.size();
    }

    public int edgeCount() {
        int n = 0;
        for (Set<Node> s : successors.values()) n += s.size();
        return n;
    }

    public Set<Node> successorsOf(Node node) {
        return Collections.unmodifiableSet(successors.getOrDefault(node, Set.of()));
    }

    public Set<Node> predecessorsOf(Node node) {
        return Collections.unmodifiableSet(predecessors.getOrDefault(node, Set.of()));
    }

    /** Nodes without predecessors (typically input datasets). */
    public List<Node> roots() {
        List<Node> out = new ArrayList<>();
        for (Map.Entry<Node, Set<Node>> e : predecessors.entrySet()) {
            if (e.getValue().isEmpty()) out.add(e.getKey());
        }
        return out;
    }

    /** Nodes without successors (typically output datasets). */
    public List<Node> leaves() {
        List<Node> out = new ArrayList<>();
        for (Map.Entry<Node, Set<Node>> e : successors.entrySet()) {
            if (e.getValue().isEmpty()) out.add(e.getKey());
        }
        return out;
    }

    /**
     * Weakly connected components, edges taken in both directions. Components are ordered by
     * their first node in flow order; a well-formed flow has exactly one.
     */
    public List<Set<Node>> disconnectedSubgraphs() {
        Set<Node> seen = new HashSet<>();
        List<Set<Node>> components = new ArrayList<>();
        for (Node start : successors.keySet()) {
            if (seen.contains(start)) continue;
            Set<Node> component = new LinkedHashSet<>();
            Deque<Node> queue = new ArrayDeque<>();
            queue.add(start);
            while (!queue.isEmpty()) {
                Node n = queue.poll();
                if (!component.add(n)) continue;
                for (Node s : successors.get(n)) {
                    if (!component.contains(s)) queue.add(s);
                }
                for (Node p : predecessors.get(n)) {
                    if (!component.contains(p)) queue.add(p);
                }
            }
            seen.addAll(component);
            components.add(Collections.unmodifiableSet(component));
        }
        return components;
    }

    /**
     * Shortest directed path by breadth-first search.
     *
     * @return node names from {@code from} to {@code to} inclusive; null when either node is
     *         unknown or {@code to} is not reachable
     */
    public List<String> path(Node from, Node to) {
        if (!successors.containsKey(from) || !successors.containsKey(to)) return null;
        Map<Node, Node> parent = new HashMap<>();
        Deque<Node> queue = new ArrayDeque<>();
        parent.put(from, from);
        queue.add(from);
        while (!queue.isEmpty()) {
            Node n = queue.poll();
            if (n.equals(to)) {
                List<String> names = new ArrayList<>();
                for (Node cur = to; ; cur = parent.get(cur)) {
                    names.add(cur.name());
                    if (cur.equals(from)) break;
                }
                Collections.reverse(names);
                return names;
            }
            for (Node s : successors.get(n)) {
                if (parent.putIfAbsent(s, n) == null) queue.add(s);
            }
        }
        return null;
    }

    /**
     * Finds cycles with a colored depth-first search. Each cycle is returned once as the node names
     * along the back edge path, starting and ending at the same node. Empty for a DAG.
     */
    public List<List<String>> detectCycles() {
        Map<Node, Integer> color = new HashMap<>();
        List<List<String>> cycles = new ArrayList<>();
        for (Node start : successors.keySet()) {
            if (color.getOrDefault(start, 0) != 0) continue;
            // iterative DFS: stack of (node, successor iterator)
            Deque<Node> path = new ArrayDeque<>();
            Deque<Iterator<Node>> iterators = new ArrayDeque<>();
            color.put(start, 1);
            path.push(start);
            iterators.push(successors.get(start).iterator());
            while (!path.isEmpty()) {
                Iterator<Node> it = iterators.peek();
                if (it.hasNext()) {
                    Node next = it.next();
                    int c = color.getOrDefault(next, 0);
                    if (c == 0) {
                        color.put(next, 1);
                        path.push(next);
                        iterators.push(successors.get(next).iterator());
                    } else if (c == 1) {
                        cycles.add(cyclePath(path, next));
                    }
                } else {
                    color.put(path.pop(), 2);
                    iterators.pop();
                }
            }
        }
        return cycles;
    }

    private static List<String> cyclePath(Deque<Node> path, Node back) {
        List<String> names = new ArrayList<>();
        List<Node> ordered = new ArrayList<>(path);
        Collections.reverse(ordered);
        boolean inCycle = false;
        for (Node n : ordered) {
            if (n.equals(back)) inCycle = true;
            if (inCycle) names.add(n.name());
        }
        names.add(back.name());
        return names;
    }

    /**
     * Kahn topological order over all nodes. Ties are broken by flow order.
     *
     * @return node names, every edge pointing forward; null when the graph has a cycle
     */
    public List<String> topologicalOrder() {
        Map<Node, Integer> inDegree = new LinkedHashMap<>();
        for (Map.Entry<Node, Set<Node>> e : predecessors.entrySet()) inDegree.put(e.getKey(), e.getValue().size());
        Deque<Node> ready = new ArrayDeque<>();
        for (Map.Entry<Node, Integer> e : inDegree.entrySet()) {
            if (e.getValue() == 0) ready.add(e.getKey());
        }
        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            Node n = ready.poll();
            order.add(n.name());
            for (Node s : successors.get(n)) {
                int d = inDegree.merge(s, -1, Integer::sum);
                if (d == 0) ready.add(s);
            }
        }
        return order.size() == successors.size() ? order : null;
    }
}
