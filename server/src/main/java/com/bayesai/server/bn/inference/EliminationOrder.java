package com.bayesai.server.bn.inference;

import com.bayesai.server.bn.factor.Factor;

import java.util.List;
import java.util.Set;

/**
 * Chooses which hidden variable to sum out next. The choice affects the size
 * of intermediate factors, never the normalized answer.
 */
public interface EliminationOrder {

    String getName();

    // remaining is never empty; factors is the current working set.
    String next(Set<String> remaining, List<Factor> factors);
}
