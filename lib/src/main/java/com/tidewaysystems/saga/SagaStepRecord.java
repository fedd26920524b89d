package com.tidewaysystems.saga;

import com.tidewaysystems.message.Event;

import java.time.Instant;
import java.util.Objects;

/**
 * A committed saga step as kept in the instance's history.
 *
 * @param stepIndex       position of the step in the definition
 * @param stepName        name of the step
 * @param completionEvent the event that committed the step
 * @param committedAt     when the step was committed
 * @param compensated     whether its compensation has been issued
 */
public record SagaStepRecord(
    int stepIndex,
    String stepName,
    Event completionEvent,
    Instant committedAt,
    boolean compensated
) {

    public SagaStepRecord {
        Objects.requireNonNull(stepName, "stepName cannot be null");
        Objects.requireNonNull(completionEvent, "completionEvent cannot be null");
        Objects.requireNonNull(committedAt, "committedAt cannot be null");
    }

    public static SagaStepRecord committed(int stepIndex, String stepName, Event completionEvent) {
        return new SagaStepRecord(stepIndex, stepName, completionEvent, Instant.now(), false);
    }

    public SagaStepRecord markCompensated() {
        return new SagaStepRecord(stepIndex, stepName, completionEvent, committedAt, true);
    }
}
