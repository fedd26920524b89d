package com.tidewaysystems.saga;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a saga instance.
 * RUNNING moves to COMPLETED or COMPENSATING; COMPENSATING moves to COMPENSATED or FAILED.
 */
public enum SagaStatus {
    RUNNING,
    COMPLETED,
    COMPENSATING,
    COMPENSATED,
    /**
     * A compensating command failed. Needs operator intervention.
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == COMPENSATED || this == FAILED;
    }

    public boolean canTransitionTo(SagaStatus next) {
        return allowedNext().contains(next);
    }

    private Set<SagaStatus> allowedNext() {
        switch (this) {
            case RUNNING:
                return EnumSet.of(COMPLETED, COMPENSATING);
            case COMPENSATING:
                return EnumSet.of(COMPENSATED, FAILED);
            default:
                return EnumSet.noneOf(SagaStatus.class);
        }
    }
}
