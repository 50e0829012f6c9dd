package com.bayesai.server.bn.graph;

import java.util.List;

/**
 * One entry of a network structure: either a bare node, or an edge descriptor
 * whose parent side and child side may each name several variables. A
 * descriptor with several variables on a side stands for every parent to child
 * pair.
 */
public class StructureItem {

    private final List<String> parents;
    private final List<String> children;

    private StructureItem(List<String> parents, List<String> children) {
        this.parents = parents;
        this.children = children;
    }

    public static StructureItem node(String name) {
        requireName(name);
        return new StructureItem(List.of(), List.of(name));
    }

    public static StructureItem edge(String parent, String child) {
        return edges(List.of(parent), List.of(child));
    }

    public static StructureItem edges(List<String> parents, List<String> children) {
        if (parents == null || parents.isEmpty() || children == null || children.isEmpty()) {
            throw new IllegalArgumentException("Edge descriptor needs at least one parent and one child");
        }
        parents.forEach(StructureItem::requireName);
        children.forEach(StructureItem::requireName);
        return new StructureItem(List.copyOf(parents), List.copyOf(children));
    }

    private static void requireName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Variable names must be non-empty");
        }
    }

    public boolean isNode() {
        return parents.isEmpty();
    }

    public List<String> getParents() {
        return parents;
    }

    public List<String> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        if (isNode()) {
            return children.get(0);
        }
        return parents + " -> " + children;
    }
}
