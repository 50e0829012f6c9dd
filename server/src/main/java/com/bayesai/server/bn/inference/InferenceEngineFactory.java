package com.bayesai.server.bn.inference;

import com.bayesai.server.bn.cpt.CptStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class InferenceEngineFactory {

    private static final Logger logger = LoggerFactory.getLogger(InferenceEngineFactory.class);

    public static EliminationOrder order(String name) {
        if (name == null || name.trim().isEmpty()) {
            logger.warn("Elimination order not specified, defaulting to '{}'", LexicalEliminationOrder.NAME);
            return new LexicalEliminationOrder();
        }

        switch (name.trim().toLowerCase()) {
            case LexicalEliminationOrder.NAME:
                return new LexicalEliminationOrder();
            case MinDegreeEliminationOrder.NAME:
            case "min-degree":
                return new MinDegreeEliminationOrder();
            default:
                logger.warn("Unknown elimination order '{}', defaulting to '{}'", name, LexicalEliminationOrder.NAME);
                return new LexicalEliminationOrder();
        }
    }

    public static InferenceEngine create(CptStore cpts, String orderName) {
        return new VariableEliminationEngine(cpts, order(orderName));
    }
}
