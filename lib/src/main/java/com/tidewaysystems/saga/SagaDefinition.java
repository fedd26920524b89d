package com.tidewaysystems.saga;

import com.tidewaysystems.message.Event;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named sequence of {@link SagaStep}s started by one event type.
 */
public final class SagaDefinition {

    private final String name;
    private final Class<? extends Event> startedBy;
    private final List<SagaStep> steps;

    private SagaDefinition(String name, Class<? extends Event> startedBy, List<SagaStep> steps) {
        this.name = name;
        this.startedBy = startedBy;
        this.steps = List.copyOf(steps);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public Class<? extends Event> startedBy() {
        return startedBy;
    }

    public List<SagaStep> steps() {
        return steps;
    }

    public SagaStep step(int index) {
        return steps.get(index);
    }

    /**
     * Gets every completion and failure event type, each once, in step order.
     */
    public Set<Class<? extends Event>> stepEventTypes() {
        Set<Class<? extends Event>> types = new LinkedHashSet<>();
        for (SagaStep step : steps) {
            types.add(step.completedBy());
            types.addAll(step.failedBy());
        }
        return types;
    }

    public static final class Builder {
        private final String name;
        private Class<? extends Event> startedBy;
        private final List<SagaStep> steps = new ArrayList<>();

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Saga name cannot be null or blank");
            }
            this.name = name;
        }

        public Builder startedBy(Class<? extends Event> triggerType) {
            this.startedBy = triggerType;
            return this;
        }

        public Builder step(SagaStep step) {
            this.steps.add(Objects.requireNonNull(step, "step cannot be null"));
            return this;
        }

        public SagaDefinition build() {
            Objects.requireNonNull(startedBy, "saga '" + name + "' needs a trigger event type");
            if (steps.isEmpty()) {
                throw new IllegalArgumentException("Saga '" + name + "' needs at least one step");
            }
            Set<String> names = new HashSet<>();
            for (SagaStep step : steps) {
                if (!names.add(step.name())) {
                    throw new IllegalArgumentException("Duplicate step name '" + step.name() + "' in saga " + name);
                }
                if (step.completedBy().equals(startedBy) || step.failedBy().contains(startedBy)) {
                    throw new IllegalArgumentException(
                        "Trigger " + startedBy.getSimpleName() + " cannot also be a step event in saga " + name);
                }
            }
            return new SagaDefinition(name, startedBy, steps);
        }
    }
}
