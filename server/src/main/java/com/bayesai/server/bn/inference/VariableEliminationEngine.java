package com.bayesai.server.bn.inference;

import com.bayesai.server.bn.cpt.CptStore;
import com.bayesai.server.bn.factor.Factor;
import com.bayesai.server.bn.graph.AncestorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Exact inference by variable elimination.
 *
 * <p>
 * Only the query variables, the evidence variables and their ancestors take
 * part; every other node is barren and its table is never touched. Hidden
 * variables are summed out one at a time in the order chosen by the
 * configured {@link EliminationOrder}.
 */
public class VariableEliminationEngine implements InferenceEngine {

    private static final Logger logger = LoggerFactory.getLogger(VariableEliminationEngine.class);

    private final CptStore cpts;
    private final EliminationOrder order;

    public VariableEliminationEngine(CptStore cpts, EliminationOrder order) {
        if (!cpts.isPrepared()) {
            throw new IllegalStateException("CPT store must be prepared before inference");
        }
        this.cpts = cpts;
        this.order = order;
    }

    public VariableEliminationEngine(CptStore cpts) {
        this(cpts, new LexicalEliminationOrder());
    }

    public EliminationOrder getOrder() {
        return order;
    }

    @Override
    public Factor eliminate(Set<String> queryVars, Map<String, ?> evidence) {
        // 1. Relevance pruning
        Set<String> observed = new HashSet<>(queryVars);
        observed.addAll(evidence.keySet());
        Set<String> relevant = new AncestorIndex(cpts.getStructure()).closure(observed);

        // 2. Hidden variables
        Set<String> hidden = new TreeSet<>(relevant);
        hidden.removeAll(observed);

        logger.debug("Eliminating for query={} evidence={}: relevant={} hidden={} order={}",
                queryVars, evidence.keySet(), relevant.size(), hidden, order.getName());

        // 3. Restricted tables of every relevant node
        List<Factor> factors = new ArrayList<>();
        for (String node : new TreeSet<>(relevant)) {
            factors.add(cpts.table(node).restrict(evidence));
        }

        // 4. Sum out hidden variables
        while (!hidden.isEmpty()) {
            String variable = order.next(hidden, factors);
            hidden.remove(variable);

            List<Factor> touching = new ArrayList<>();
            Iterator<Factor> it = factors.iterator();
            while (it.hasNext()) {
                Factor f = it.next();
                if (f.mentions(variable)) {
                    touching.add(f);
                    it.remove();
                }
            }
            if (touching.isEmpty()) {
                continue;
            }
            Factor joined = Factor.joinAll(touching);
            Factor summed = joined.marginalize(variable);
            factors.add(summed);

            if (logger.isTraceEnabled()) {
                logger.trace("Eliminated {}: joined {} factors into {} rows over {}, {} factors left",
                        variable, touching.size(), joined.size(), summed.getScope(), factors.size());
            }
        }

        // 5. Final join, projection onto the query variables, normalization
        Factor joint = Factor.joinAll(factors);
        for (String extra : new ArrayList<>(joint.getScope())) {
            if (!queryVars.contains(extra)) {
                joint = joint.marginalize(extra);
            }
        }
        return joint.normalize();
    }
}
