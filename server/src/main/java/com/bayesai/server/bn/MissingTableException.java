package com.bayesai.server.bn;

public class MissingTableException extends BayesNetException {

    private final String node;

    public MissingTableException(String node) {
        super("No conditional probability table registered for '" + node + "'");
        this.node = node;
    }

    public String getNode() {
        return node;
    }
}
