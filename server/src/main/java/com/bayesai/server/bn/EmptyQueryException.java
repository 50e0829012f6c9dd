package com.bayesai.server.bn;

public class EmptyQueryException extends BayesNetException {

    public EmptyQueryException() {
        super("At least one query variable has to be specified");
    }
}
