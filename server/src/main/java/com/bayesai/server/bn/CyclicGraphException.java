package com.bayesai.server.bn;

import java.util.List;

public class CyclicGraphException extends BayesNetException {

    private final List<String> unresolvedNodes;

    public CyclicGraphException(List<String> unresolvedNodes) {
        super("Network structure contains a cycle through " + unresolvedNodes);
        this.unresolvedNodes = List.copyOf(unresolvedNodes);
    }

    // Nodes that could not be placed in the topological order.
    public List<String> getUnresolvedNodes() {
        return unresolvedNodes;
    }
}
