package com.bayesai.server.bn.inference;

import com.bayesai.server.bn.factor.Factor;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Greedy min-degree heuristic: picks the hidden variable whose elimination
 * touches the fewest other variables, ties broken by name.
 */
public class MinDegreeEliminationOrder implements EliminationOrder {

    public static final String NAME = "min_degree";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String next(Set<String> remaining, List<Factor> factors) {
        String best = null;
        int bestDegree = Integer.MAX_VALUE;
        for (String candidate : new TreeSet<>(remaining)) {
            int degree = degree(candidate, factors);
            if (degree < bestDegree) {
                best = candidate;
                bestDegree = degree;
            }
        }
        return best;
    }

    static int degree(String variable, List<Factor> factors) {
        Set<String> neighbours = new HashSet<>();
        for (Factor f : factors) {
            if (f.mentions(variable)) {
                neighbours.addAll(f.getScope());
            }
        }
        neighbours.remove(variable);
        return neighbours.size();
    }
}
