package com.bayesai.server.bn.graph;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Transitive ancestor sets over a {@link NetworkStructure}. Results are memoized
 * per node, so siblings sharing ancestry walk it only once. Not thread-safe;
 * create one per query.
 */
public class AncestorIndex {

    private final NetworkStructure structure;
    private final Map<String, Set<String>> memo = new HashMap<>();

    public AncestorIndex(NetworkStructure structure) {
        this.structure = structure;
    }

    public Set<String> ancestorsOf(String node) {
        Set<String> known = memo.get(node);
        if (known != null) {
            return known;
        }

        Set<String> found = new HashSet<>();
        Deque<String> worklist = new ArrayDeque<>(structure.parents(node));
        while (!worklist.isEmpty()) {
            String current = worklist.pop();
            if (!found.add(current)) {
                continue;
            }
            Set<String> memoized = memo.get(current);
            if (memoized != null) {
                found.addAll(memoized);
                continue;
            }
            for (String parent : structure.parents(current)) {
                if (!found.contains(parent)) {
                    worklist.push(parent);
                }
            }
        }

        Set<String> result = Collections.unmodifiableSet(found);
        memo.put(node, result);
        return result;
    }

    /** The given nodes together with all of their ancestors. */
    public Set<String> closure(Set<String> nodes) {
        Set<String> closed = new HashSet<>(nodes);
        for (String node : nodes) {
            closed.addAll(ancestorsOf(node));
        }
        return closed;
    }
}
