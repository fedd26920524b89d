package com.tidewaysystems.saga;

import com.tidewaysystems.bus.MessageBus;
import com.tidewaysystems.bus.MessageHandler;
import com.tidewaysystems.message.Command;
import com.tidewaysystems.message.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives registered {@link SagaDefinition}s from the events on a {@link MessageBus}.
 *
 * <p>Instances are keyed by saga name and correlation id. Each transition is saved to the
 * {@link SagaStateStore} before the next command is issued. State changes for one instance
 * are serialized by a per-instance lock that is never held while publishing, so a command
 * handler that synchronously publishes the step's outcome re-enters the orchestrator safely.
 *
 * <p>When a step fails, the committed steps are compensated one at a time, most recent first.
 * If a compensating command fails the instance becomes {@link SagaStatus#FAILED} and nothing
 * further is attempted.
 */
public class SagaOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(SagaOrchestrator.class);

    private final MessageBus bus;
    private final SagaStateStore stateStore;
    private final Map<String, SagaDefinition> definitions = new ConcurrentHashMap<>();
    // one monitor per live instance, dropped once the instance is terminal
    private final Map<String, Object> locks = new ConcurrentHashMap<>();
    private final Set<String> compensating = ConcurrentHashMap.newKeySet();

    public SagaOrchestrator(MessageBus bus, SagaStateStore stateStore) {
        this.bus = Objects.requireNonNull(bus, "bus cannot be null");
        this.stateStore = Objects.requireNonNull(stateStore, "stateStore cannot be null");
    }

    /**
     * Registers a definition and subscribes to its trigger and step events.
     *
     * @throws IllegalArgumentException if a definition with the same name is registered
     */
    public void register(SagaDefinition definition) {
        if (definitions.putIfAbsent(definition.name(), definition) != null) {
            throw new IllegalArgumentException("Saga '" + definition.name() + "' is already registered");
        }
        listen(definition.startedBy(), definition.name() + ".start", event -> start(definition, event));
        for (Class<? extends Event> type : definition.stepEventTypes()) {
            listen(type, definition.name() + "." + type.getSimpleName(), event -> advance(definition, event));
        }
        logger.info("Registered saga '{}' with {} step(s), started by {}",
            definition.name(), definition.steps().size(), definition.startedBy().getSimpleName());
    }

    private <E extends Event> void listen(Class<E> type, String handlerName, MessageHandler<E> handler) {
        bus.subscribe(type, handlerName, handler);
    }

    public Optional<SagaInstance> instance(String sagaName, String correlationId) {
        return stateStore.find(sagaName, correlationId);
    }

    private void start(SagaDefinition definition, Event trigger) {
        String correlationId = trigger.correlationId();
        SagaInstance started;
        synchronized (lockFor(definition.name(), correlationId)) {
            Optional<SagaInstance> existing = stateStore.find(definition.name(), correlationId);
            if (existing.isPresent()) {
                logger.warn("Saga '{}' already exists for correlation {}, ignoring duplicate {}",
                    definition.name(), correlationId, trigger.getClass().getSimpleName());
                releaseIfTerminal(existing.get());
                return;
            }
            started = SagaInstance.start(definition.name(), trigger);
            stateStore.save(started);
        }
        logger.info("Started saga '{}' ({}) for correlation {}", definition.name(), started.sagaId(), correlationId);
        issueStep(definition, started, 0, trigger);
    }

    private void advance(SagaDefinition definition, Event event) {
        String correlationId = event.correlationId();
        SagaInstance updated;
        int nextStep = -1;
        boolean compensate = false;
        if (stateStore.find(definition.name(), correlationId)
                .filter(instance -> instance.status() == SagaStatus.RUNNING).isEmpty()) {
            logger.debug("Saga '{}' has no running instance for correlation {}, ignoring {}",
                definition.name(), correlationId, event.getClass().getSimpleName());
            return;
        }
        synchronized (lockFor(definition.name(), correlationId)) {
            Optional<SagaInstance> found = stateStore.find(definition.name(), correlationId);
            if (found.isEmpty() || found.get().status() != SagaStatus.RUNNING) {
                logger.debug("Saga '{}' has no running instance for correlation {}, ignoring {}",
                    definition.name(), correlationId, event.getClass().getSimpleName());
                found.ifPresent(this::releaseIfTerminal);
                return;
            }
            SagaInstance instance = found.get();
            int index = instance.nextStepIndex();
            SagaStep step = definition.step(index);
            if (step.completedBy().equals(event.getClass())) {
                updated = instance.withStepCommitted(SagaStepRecord.committed(index, step.name(), event));
                if (index + 1 == definition.steps().size()) {
                    updated = updated.withStatus(SagaStatus.COMPLETED, null);
                } else {
                    nextStep = index + 1;
                }
            } else if (step.failedBy().contains(event.getClass())) {
                updated = instance.withStatus(SagaStatus.COMPENSATING,
                    "Step '" + step.name() + "' failed with " + event.getClass().getSimpleName());
                compensate = true;
            } else {
                logger.debug("Saga '{}' ({}) is waiting on step '{}', ignoring {}",
                    definition.name(), correlationId, step.name(), event.getClass().getSimpleName());
                return;
            }
            stateStore.save(updated);
            releaseIfTerminal(updated);
        }

        if (nextStep >= 0) {
            issueStep(definition, updated, nextStep, event);
        } else if (compensate) {
            logger.warn("Saga '{}' ({}) compensating: {}", definition.name(), correlationId, updated.failureReason());
            runCompensations(definition, correlationId);
        } else {
            logger.info("Saga '{}' ({}) completed", definition.name(), correlationId);
        }
    }

    private void issueStep(SagaDefinition definition, SagaInstance instance, int index, Event cause) {
        SagaStep step = definition.step(index);
        try {
            Command command = step.command().create(instance, cause);
            if (!instance.correlationId().equals(command.correlationId())) {
                throw new IllegalStateException(String.format(
                    "Command %s of step '%s' has correlation %s instead of %s",
                    command.getClass().getSimpleName(), step.name(), command.correlationId(),
                    instance.correlationId()));
            }
            logger.debug("Saga '{}' ({}) issuing {} for step '{}'", definition.name(),
                instance.correlationId(), command.getClass().getSimpleName(), step.name());
            bus.publish(command);
        } catch (RuntimeException e) {
            logger.warn("Saga '{}' ({}) step '{}' could not be issued", definition.name(),
                instance.correlationId(), step.name(), e);
            failStep(definition, instance.correlationId(), index,
                "Step '" + step.name() + "' could not be issued: " + e.getMessage());
        }
    }

    private void failStep(SagaDefinition definition, String correlationId, int index, String reason) {
        synchronized (lockFor(definition.name(), correlationId)) {
            Optional<SagaInstance> found = stateStore.find(definition.name(), correlationId);
            // the step may already have been settled by events published during the failed dispatch
            if (found.isEmpty() || found.get().status() != SagaStatus.RUNNING
                || found.get().nextStepIndex() != index) {
                return;
            }
            stateStore.save(found.get().withStatus(SagaStatus.COMPENSATING, reason));
        }
        runCompensations(definition, correlationId);
    }

    private void runCompensations(SagaDefinition definition, String correlationId) {
        String key = key(definition.name(), correlationId);
        if (!compensating.add(key)) {
            return;
        }
        try {
            while (true) {
                SagaInstance instance;
                SagaStepRecord owed;
                SagaStep step;
                synchronized (lockFor(definition.name(), correlationId)) {
                    instance = stateStore.find(definition.name(), correlationId).orElseThrow();
                    if (instance.status() != SagaStatus.COMPENSATING) {
                        releaseIfTerminal(instance);
                        return;
                    }
                    Optional<SagaStepRecord> next = instance.nextCompensation();
                    if (next.isEmpty()) {
                        SagaInstance compensated = instance.withStatus(SagaStatus.COMPENSATED, null);
                        stateStore.save(compensated);
                        releaseIfTerminal(compensated);
                        logger.info("Saga '{}' ({}) compensated", definition.name(), correlationId);
                        return;
                    }
                    owed = next.get();
                    step = definition.step(owed.stepIndex());
                    if (!step.hasCompensation()) {
                        stateStore.save(instance.withStepCompensated(owed.stepIndex()));
                        continue;
                    }
                }

                try {
                    Command compensation = step.compensation().create(instance, owed);
                    logger.debug("Saga '{}' ({}) compensating step '{}' with {}", definition.name(),
                        correlationId, step.name(), compensation.getClass().getSimpleName());
                    bus.publish(compensation);
                } catch (RuntimeException e) {
                    String reason = "Compensation of step '" + step.name() + "' failed: " + e.getMessage();
                    synchronized (lockFor(definition.name(), correlationId)) {
                        SagaInstance current = stateStore.find(definition.name(), correlationId).orElseThrow();
                        SagaInstance failed = current.withStatus(SagaStatus.FAILED, reason);
                        stateStore.save(failed);
                        releaseIfTerminal(failed);
                    }
                    logger.error("Saga '{}' ({}) FAILED, operator intervention required: {}",
                        definition.name(), correlationId, reason, e);
                    return;
                }

                synchronized (lockFor(definition.name(), correlationId)) {
                    SagaInstance current = stateStore.find(definition.name(), correlationId).orElseThrow();
                    stateStore.save(current.withStepCompensated(owed.stepIndex()));
                }
            }
        } finally {
            compensating.remove(key);
        }
    }

    /**
     * Continues a saga from its persisted state, e.g. after a restart.
     * A RUNNING instance re-issues the command of its pending step, so step handlers must
     * tolerate duplicates. A COMPENSATING instance continues compensating. Terminal instances
     * are left alone.
     *
     * @return the instance state after resuming, empty if there is none
     */
    public Optional<SagaInstance> resume(String sagaName, String correlationId) {
        SagaDefinition definition = definitions.get(sagaName);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown saga '" + sagaName + "'");
        }
        Optional<SagaInstance> found = stateStore.find(sagaName, correlationId);
        if (found.isEmpty()) {
            return found;
        }
        SagaInstance instance = found.get();
        logger.info("Resuming saga '{}' ({}) in status {}", sagaName, correlationId, instance.status());
        if (instance.status() == SagaStatus.RUNNING) {
            issueStep(definition, instance, instance.nextStepIndex(), instance.lastEvent());
        } else if (instance.status() == SagaStatus.COMPENSATING) {
            runCompensations(definition, correlationId);
        }
        return stateStore.find(sagaName, correlationId);
    }

    /**
     * Resumes every registered saga that has an instance with this correlation id.
     */
    public List<SagaInstance> resume(String correlationId) {
        List<SagaInstance> resumed = new ArrayList<>();
        for (String sagaName : definitions.keySet()) {
            resume(sagaName, correlationId).ifPresent(resumed::add);
        }
        return resumed;
    }

    /**
     * Resumes every RUNNING or COMPENSATING instance of a registered saga.
     *
     * @return the number of instances resumed
     */
    public int resumeAll() {
        int count = 0;
        for (SagaStatus status : List.of(SagaStatus.RUNNING, SagaStatus.COMPENSATING)) {
            for (SagaInstance instance : stateStore.findByStatus(status)) {
                if (definitions.containsKey(instance.sagaName())) {
                    resume(instance.sagaName(), instance.correlationId());
                    count++;
                }
            }
        }
        return count;
    }

    public Set<String> registeredSagas() {
        return Set.copyOf(definitions.keySet());
    }

    private Object lockFor(String sagaName, String correlationId) {
        return locks.computeIfAbsent(key(sagaName, correlationId), k -> new Object());
    }

    /**
     * Drops the monitor of a finished instance. Called while holding it; a thread already
     * waiting on the old monitor only observes the terminal status and backs off.
     */
    private void releaseIfTerminal(SagaInstance instance) {
        if (instance.status().isTerminal()) {
            locks.remove(key(instance.sagaName(), instance.correlationId()));
        }
    }

    int activeLockCount() {
        return locks.size();
    }

    private static String key(String sagaName, String correlationId) {
        return sagaName + "/" + correlationId;
    }
}
