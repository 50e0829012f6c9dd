package com.bayesai.server.bn.inference;

import com.bayesai.server.bn.factor.Factor;

import java.util.Map;
import java.util.Set;

public interface InferenceEngine {
    /**
     * Posterior distribution over exactly the query variables given the
     * evidence. The result is normalized; scope and row order are unspecified.
     */
    Factor eliminate(Set<String> queryVars, Map<String, ?> evidence);
}
