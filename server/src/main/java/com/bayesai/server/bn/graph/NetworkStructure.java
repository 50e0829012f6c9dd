package com.bayesai.server.bn.graph;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable DAG of a Bayesian network. Parent and child lists are sorted by
 * name; {@link #nodes()} lists every variable parents-first.
 */
public class NetworkStructure {

    private final Map<String, List<String>> parents;
    private final Map<String, List<String>> children;
    private final List<String> nodes;
    private final Set<String> nodeSet;

    NetworkStructure(Map<String, List<String>> parents, Map<String, List<String>> children, List<String> nodes) {
        this.parents = parents;
        this.children = children;
        this.nodes = List.copyOf(nodes);
        this.nodeSet = Set.copyOf(nodes);
    }

    /** Topological order, ties broken by name. */
    public List<String> nodes() {
        return nodes;
    }

    public boolean contains(String node) {
        return nodeSet.contains(node);
    }

    public List<String> parents(String node) {
        return parents.getOrDefault(node, List.of());
    }

    public List<String> children(String node) {
        return children.getOrDefault(node, List.of());
    }

    public boolean isRoot(String node) {
        return parents(node).isEmpty();
    }

    public Set<String> ancestors(String node) {
        return new AncestorIndex(this).ancestorsOf(node);
    }

    @Override
    public String toString() {
        return "NetworkStructure{nodes=" + nodes + ", parents=" + parents + '}';
    }
}
