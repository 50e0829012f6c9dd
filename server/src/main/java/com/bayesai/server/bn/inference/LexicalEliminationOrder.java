package com.bayesai.server.bn.inference;

import com.bayesai.server.bn.factor.Factor;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/** Eliminates hidden variables in ascending name order. */
public class LexicalEliminationOrder implements EliminationOrder {

    public static final String NAME = "lexical";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String next(Set<String> remaining, List<Factor> factors) {
        return Collections.min(remaining);
    }
}
