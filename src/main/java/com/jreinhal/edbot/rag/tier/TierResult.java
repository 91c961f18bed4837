package com.jreinhal.edbot.rag.tier;

import com.jreinhal.edbot.model.CandidateAnswer;
import com.jreinhal.edbot.model.Tier;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one tier call: a candidate, nothing, or a failure. The orchestrator switches on
 * {@link #kind()} instead of catching exceptions.
 */
public final class TierResult {

    public enum Kind {
        CANDIDATE,
        EMPTY,
        FAILURE
    }

    private final Tier tier;
    private final Kind kind;
    private final CandidateAnswer candidate;
    private final TierError error;
    private final String reason;

    private TierResult(Tier tier, Kind kind, CandidateAnswer candidate, TierError error, String reason) {
        this.tier = Objects.requireNonNull(tier, "tier");
        this.kind = kind;
        this.candidate = candidate;
        this.error = error;
        this.reason = reason;
    }

    public static TierResult candidate(CandidateAnswer candidate) {
        Objects.requireNonNull(candidate, "candidate");
        return new TierResult(candidate.tier(), Kind.CANDIDATE, candidate, null, "candidate");
    }

    public static TierResult empty(Tier tier, String reason) {
        return new TierResult(tier, Kind.EMPTY, null, null, reason);
    }

    public static TierResult failure(TierError error) {
        Objects.requireNonNull(error, "error");
        return new TierResult(error.tier(), Kind.FAILURE, null, error, error.message());
    }

    public static TierResult failure(Tier tier, TierError.Kind kind, String message) {
        return failure(new TierError(tier, kind, message));
    }

    public Tier tier() {
        return tier;
    }

    public Kind kind() {
        return kind;
    }

    public Optional<CandidateAnswer> candidate() {
        return Optional.ofNullable(candidate);
    }

    public Optional<TierError> error() {
        return Optional.ofNullable(error);
    }

    public String reason() {
        return reason;
    }

    public boolean isFailure() {
        return kind == Kind.FAILURE;
    }

    @Override
    public String toString() {
        return "TierResult{" + tier + ", " + kind + ", " + reason + "}";
    }
}
