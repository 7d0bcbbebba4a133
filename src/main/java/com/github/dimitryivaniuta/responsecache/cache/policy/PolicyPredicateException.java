package com.github.dimitryivaniuta.responsecache.cache.policy;

import com.github.dimitryivaniuta.responsecache.cache.ResponseCacheException;

/**
 * A caller-registered read/write predicate threw or completed exceptionally.
 * The gate treats it as a denial.
 */
public class PolicyPredicateException extends ResponseCacheException {

    private final PolicyGate.Decision decision;

    public PolicyPredicateException(PolicyGate.Decision decision, String message, Throwable cause) {
        super(message, cause);
        this.decision = decision;
    }

    public PolicyGate.Decision getDecision() {
        return decision;
    }

    @Override
    public String errorType() {
        return "policy_predicate";
    }
}
