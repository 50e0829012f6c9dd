package com.bayesai.server.bn;

import java.util.Set;

public class VariableConflictException extends BayesNetException {

    private final Set<String> conflicting;

    public VariableConflictException(Set<String> conflicting) {
        super("A query variable cannot be part of the evidence: " + conflicting);
        this.conflicting = Set.copyOf(conflicting);
    }

    public Set<String> getConflicting() {
        return conflicting;
    }
}
