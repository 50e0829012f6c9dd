package com.bayesai.server.bn;

/**
 * Raised when a factor with total weight zero is normalized. For a query this
 * means the evidence is impossible under the model.
 */
public class DegenerateNormalizationException extends BayesNetException {

    public DegenerateNormalizationException(String factorName) {
        super("Cannot normalize " + factorName + ": total weight is zero (evidence is impossible under the model)");
    }
}
