package com.bayesai.server.bn.graph;

import com.bayesai.server.bn.CyclicGraphException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Collects structure items and turns them into an immutable
 * {@link NetworkStructure}.
 */
public class NetworkBuilder {

    private static final Logger logger = LoggerFactory.getLogger(NetworkBuilder.class);

    private final List<StructureItem> items = new ArrayList<>();

    public NetworkBuilder add(StructureItem item) {
        items.add(item);
        return this;
    }

    public NetworkBuilder addAll(List<StructureItem> more) {
        items.addAll(more);
        return this;
    }

    public NetworkBuilder node(String name) {
        return add(StructureItem.node(name));
    }

    public NetworkBuilder edge(String parent, String child) {
        return add(StructureItem.edge(parent, child));
    }

    public NetworkBuilder edges(List<String> parents, List<String> children) {
        return add(StructureItem.edges(parents, children));
    }

    public NetworkStructure build() {
        Map<String, Set<String>> parents = new TreeMap<>();
        Map<String, Set<String>> children = new TreeMap<>();
        Set<String> all = new TreeSet<>();

        for (StructureItem item : items) {
            if (item.isNode()) {
                all.addAll(item.getChildren());
                continue;
            }
            for (String parent : item.getParents()) {
                for (String child : item.getChildren()) {
                    parents.computeIfAbsent(child, k -> new TreeSet<>()).add(parent);
                    children.computeIfAbsent(parent, k -> new TreeSet<>()).add(child);
                    all.add(parent);
                    all.add(child);
                }
            }
        }

        List<String> order = topologicalOrder(all, parents, children);
        logger.info("Network structure built with {} nodes and {} edges", order.size(),
                parents.values().stream().mapToInt(Set::size).sum());
        return new NetworkStructure(freeze(parents), freeze(children), order);
    }

    // Kahn's algorithm; the ready queue is ordered by name so ties resolve lexically.
    private static List<String> topologicalOrder(Set<String> all, Map<String, Set<String>> parents,
            Map<String, Set<String>> children) {
        Map<String, Integer> pending = new HashMap<>();
        PriorityQueue<String> ready = new PriorityQueue<>();
        for (String node : all) {
            int inDegree = parents.getOrDefault(node, Set.of()).size();
            pending.put(node, inDegree);
            if (inDegree == 0) {
                ready.add(node);
            }
        }

        List<String> order = new ArrayList<>(all.size());
        while (!ready.isEmpty()) {
            String node = ready.poll();
            order.add(node);
            for (String child : children.getOrDefault(node, Set.of())) {
                int left = pending.merge(child, -1, Integer::sum);
                if (left == 0) {
                    ready.add(child);
                }
            }
        }

        if (order.size() != all.size()) {
            List<String> unresolved = new ArrayList<>();
            for (String node : all) {
                if (pending.get(node) > 0) {
                    unresolved.add(node);
                }
            }
            throw new CyclicGraphException(unresolved);
        }
        return order;
    }

    private static Map<String, List<String>> freeze(Map<String, Set<String>> adjacency) {
        Map<String, List<String>> frozen = new TreeMap<>();
        for (Map.Entry<String, Set<String>> e : adjacency.entrySet()) {
            frozen.put(e.getKey(), List.copyOf(e.getValue()));
        }
        return Collections.unmodifiableMap(frozen);
    }
}
