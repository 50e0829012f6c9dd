package com.bayesai.server.bn.cpt;

import com.bayesai.server.bn.LabelMismatchException;
import com.bayesai.server.bn.MissingTableException;
import com.bayesai.server.bn.factor.Factor;
import com.bayesai.server.bn.graph.NetworkStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Conditional probability tables keyed by node. Tables are registered by the
 * caller, then {@link #prepare()} puts each one in canonical form: parents in
 * sorted order followed by the node, rows sorted, named {@code P(node | ...)}.
 * After preparation the store is read-only.
 */
public class CptStore {

    private static final Logger logger = LoggerFactory.getLogger(CptStore.class);
    private static final double SUM_TOLERANCE = 1e-6;

    private final NetworkStructure structure;
    private final Map<String, Factor> tables = new LinkedHashMap<>();
    private volatile boolean prepared = false;

    public CptStore(NetworkStructure structure) {
        this.structure = structure;
    }

    public NetworkStructure getStructure() {
        return structure;
    }

    /**
     * Registers a positional table. Each key lists the parents' values in sorted
     * parent order, then the node's own value.
     */
    public CptStore define(String node, Map<List<Object>, Double> rows) {
        requireNode(node);
        List<String> labels = canonicalScope(node);
        for (List<Object> key : rows.keySet()) {
            if (key.size() != labels.size()) {
                throw new LabelMismatchException("Row " + key + " of the table for '" + node + "' has "
                        + key.size() + " values, expected " + labels.size() + " for " + labels);
            }
        }
        return put(node, new Factor(null, labels, rows));
    }

    /**
     * Registers an explicitly labeled table. Its scope must name exactly the
     * node and its parents, in any order.
     */
    public CptStore define(String node, Factor table) {
        requireNode(node);
        List<String> labels = canonicalScope(node);
        if (!new HashSet<>(table.getScope()).equals(new HashSet<>(labels))) {
            throw new LabelMismatchException("Table for '" + node + "' is labeled " + table.getScope()
                    + " but the network expects " + labels);
        }
        return put(node, table);
    }

    private CptStore put(String node, Factor table) {
        if (prepared) {
            throw new IllegalStateException("CPT store is already prepared; table for '" + node + "' rejected");
        }
        tables.put(node, table);
        return this;
    }

    private void requireNode(String node) {
        if (!structure.contains(node)) {
            throw new IllegalArgumentException("Unknown node '" + node + "'");
        }
    }

    /** Parents in sorted order followed by the node itself. */
    public List<String> canonicalScope(String node) {
        List<String> labels = new ArrayList<>(structure.parents(node));
        labels.add(node);
        return labels;
    }

    public synchronized CptStore prepare() {
        if (prepared) {
            return this;
        }
        for (Map.Entry<String, Factor> e : tables.entrySet()) {
            String node = e.getKey();
            Factor canonical = e.getValue()
                    .reorder(canonicalScope(node))
                    .sorted()
                    .named(displayName(node));
            checkRowSums(node, canonical);
            e.setValue(canonical);
        }
        for (String node : structure.nodes()) {
            if (!tables.containsKey(node)) {
                logger.warn("Node '{}' has no conditional probability table; queries touching it will fail", node);
            }
        }
        prepared = true;
        logger.info("Prepared {} conditional probability tables", tables.size());
        return this;
    }

    public boolean isPrepared() {
        return prepared;
    }

    public boolean contains(String node) {
        return tables.containsKey(node);
    }

    public Factor table(String node) {
        Factor table = tables.get(node);
        if (table == null) {
            throw new MissingTableException(node);
        }
        return table;
    }

    public Set<String> nodes() {
        return tables.keySet();
    }

    String displayName(String node) {
        List<String> parents = structure.parents(node);
        if (parents.isEmpty()) {
            return "P(" + node + ")";
        }
        return "P(" + node + " | " + String.join(", ", parents) + ")";
    }

    // Rows are expected to sum to one per parent assignment; only reported, never enforced.
    private void checkRowSums(String node, Factor table) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        Factor perParents = table.marginalize(node);
        Map<List<Object>, Double> off = new HashMap<>();
        for (Map.Entry<List<Object>, Double> row : perParents.getRows().entrySet()) {
            if (Math.abs(row.getValue() - 1.0) > SUM_TOLERANCE) {
                off.put(row.getKey(), row.getValue());
            }
        }
        if (!off.isEmpty()) {
            logger.debug("{} does not sum to 1 for parent assignments {}", table.getName(), off);
        }
    }
}
