package com.bayesai.server.bn;

/**
 * Base type for every failure raised while building or querying a Bayesian
 * network. All subclasses are deterministic for a given input; there is nothing
 * to retry.
 */
public class BayesNetException extends RuntimeException {

    public BayesNetException(String message) {
        super(message);
    }

    public BayesNetException(String message, Throwable cause) {
        super(message, cause);
    }
}
