package com.jreinhal.edbot.rag.tier;

import com.jreinhal.edbot.model.Tier;

/**
 * Why a tier produced no candidate because of a fault rather than a lack of matches.
 */
public record TierError(Tier tier, Kind kind, String message) {

    public enum Kind {
        TIMEOUT,
        STORE_UNAVAILABLE,
        STORE_FAILURE,
        CIRCUIT_OPEN,
        REJECTED,
        INTERRUPTED
    }

    /**
     * Kinds that indicate a sick store and count against the tier's circuit breaker. A collaborator
     * that is simply not configured is not one of them.
     */
    public boolean countsAsStoreFailure() {
        return kind == Kind.TIMEOUT || kind == Kind.STORE_FAILURE;
    }

    @Override
    public String toString() {
        return tier + " " + kind + ": " + message;
    }
}
