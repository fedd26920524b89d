package com.tidewaysystems.saga;

import com.tidewaysystems.message.Event;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable state of one saga run, keyed by saga name and correlation id.
 * Every transition returns a new instance; the orchestrator persists it before acting on it.
 *
 * @param sagaId        unique id of this run
 * @param sagaName      name of the definition
 * @param correlationId correlation id of the trigger event, shared by all messages of the run
 * @param status        current status
 * @param stepHistory   committed steps in commit order
 * @param triggerEvent  the event that started the run
 * @param failureReason why compensation started or failed, null otherwise
 * @param updatedAt     time of the last transition
 */
public record SagaInstance(
    UUID sagaId,
    String sagaName,
    String correlationId,
    SagaStatus status,
    List<SagaStepRecord> stepHistory,
    Event triggerEvent,
    String failureReason,
    Instant updatedAt
) {

    public SagaInstance {
        Objects.requireNonNull(sagaId, "sagaId cannot be null");
        Objects.requireNonNull(sagaName, "sagaName cannot be null");
        Objects.requireNonNull(correlationId, "correlationId cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(triggerEvent, "triggerEvent cannot be null");
        Objects.requireNonNull(updatedAt, "updatedAt cannot be null");
        stepHistory = List.copyOf(stepHistory);
    }

    /**
     * Creates a RUNNING instance for a trigger event.
     */
    public static SagaInstance start(String sagaName, Event trigger) {
        return new SagaInstance(UUID.randomUUID(), sagaName, trigger.correlationId(), SagaStatus.RUNNING,
            List.of(), trigger, null, Instant.now());
    }

    public SagaInstance withStepCommitted(SagaStepRecord record) {
        if (status != SagaStatus.RUNNING) {
            throw new IllegalStateException("Cannot commit a step of a saga in status " + status);
        }
        List<SagaStepRecord> history = new ArrayList<>(stepHistory);
        history.add(record);
        return new SagaInstance(sagaId, sagaName, correlationId, status, history, triggerEvent,
            failureReason, Instant.now());
    }

    /**
     * Moves to another status.
     *
     * @param next   the new status
     * @param reason failure reason to record, or null to keep the current one
     * @throws IllegalStateException if the transition is not allowed
     */
    public SagaInstance withStatus(SagaStatus next, String reason) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(String.format("Saga %s (%s) cannot move from %s to %s",
                sagaName, correlationId, status, next));
        }
        return new SagaInstance(sagaId, sagaName, correlationId, next, stepHistory, triggerEvent,
            reason != null ? reason : failureReason, Instant.now());
    }

    public SagaInstance withStepCompensated(int stepIndex) {
        List<SagaStepRecord> history = new ArrayList<>(stepHistory.size());
        for (SagaStepRecord record : stepHistory) {
            history.add(record.stepIndex() == stepIndex ? record.markCompensated() : record);
        }
        return new SagaInstance(sagaId, sagaName, correlationId, status, history, triggerEvent,
            failureReason, Instant.now());
    }

    /**
     * Gets the index of the step waiting to be committed.
     */
    public int nextStepIndex() {
        return stepHistory.size();
    }

    /**
     * Gets the most recently committed step that is not compensated yet.
     */
    public Optional<SagaStepRecord> nextCompensation() {
        for (int i = stepHistory.size() - 1; i >= 0; i--) {
            if (!stepHistory.get(i).compensated()) {
                return Optional.of(stepHistory.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * Gets the event that caused the most recent progress: the last completion event or the trigger.
     */
    public Event lastEvent() {
        return stepHistory.isEmpty() ? triggerEvent : stepHistory.get(stepHistory.size() - 1).completionEvent();
    }
}
