package com.bayesai.server.bn;

public class LabelMismatchException extends BayesNetException {

    public LabelMismatchException(String message) {
        super(message);
    }
}
