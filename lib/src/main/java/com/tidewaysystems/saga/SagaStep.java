package com.tidewaysystems.saga;

import com.tidewaysystems.message.Command;
import com.tidewaysystems.message.Event;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One step of a saga: the command it issues, the event that commits it, the events
 * that fail it and the optional command that undoes it.
 *
 * <pre>{@code
 * SagaStep reserve = SagaStep.named("reserve-stock")
 *     .issues((saga, cause) -> new ReserveStock(MessageMetadata.causedBy(cause), orderId(saga)))
 *     .completedBy(StockReserved.class)
 *     .failedBy(StockReserveFailed.class)
 *     .compensatedBy((saga, step) -> new ReleaseStock(MessageMetadata.causedBy(step.completionEvent()), orderId(saga)))
 *     .build();
 * }</pre>
 */
public final class SagaStep {

    /**
     * Builds the command a step issues. The command must carry the saga's correlation id,
     * which {@link com.tidewaysystems.message.MessageMetadata#causedBy} does.
     */
    @FunctionalInterface
    public interface CommandFactory {
        Command create(SagaInstance saga, Event cause);
    }

    /**
     * Builds the command undoing a committed step.
     */
    @FunctionalInterface
    public interface CompensationFactory {
        Command create(SagaInstance saga, SagaStepRecord step);
    }

    private final String name;
    private final CommandFactory command;
    private final Class<? extends Event> completedBy;
    private final Set<Class<? extends Event>> failedBy;
    private final CompensationFactory compensation;

    private SagaStep(Builder builder) {
        this.name = builder.name;
        this.command = Objects.requireNonNull(builder.command, "step '" + name + "' needs a command");
        this.completedBy = Objects.requireNonNull(builder.completedBy,
            "step '" + name + "' needs a completion event");
        this.failedBy = Set.copyOf(builder.failedBy);
        this.compensation = builder.compensation;
        if (failedBy.contains(completedBy)) {
            throw new IllegalArgumentException(
                "Step '" + name + "' uses " + completedBy.getSimpleName() + " for completion and failure");
        }
    }

    public static Builder named(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public CommandFactory command() {
        return command;
    }

    public Class<? extends Event> completedBy() {
        return completedBy;
    }

    public Set<Class<? extends Event>> failedBy() {
        return failedBy;
    }

    public boolean hasCompensation() {
        return compensation != null;
    }

    public CompensationFactory compensation() {
        return compensation;
    }

    public static final class Builder {
        private final String name;
        private CommandFactory command;
        private Class<? extends Event> completedBy;
        private final Set<Class<? extends Event>> failedBy = new LinkedHashSet<>();
        private CompensationFactory compensation;

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Step name cannot be null or blank");
            }
            this.name = name;
        }

        public Builder issues(CommandFactory command) {
            this.command = command;
            return this;
        }

        public Builder completedBy(Class<? extends Event> eventType) {
            this.completedBy = eventType;
            return this;
        }

        @SafeVarargs
        public final Builder failedBy(Class<? extends Event>... eventTypes) {
            this.failedBy.addAll(Arrays.asList(eventTypes));
            return this;
        }

        public Builder compensatedBy(CompensationFactory compensation) {
            this.compensation = compensation;
            return this;
        }

        public SagaStep build() {
            return new SagaStep(this);
        }
    }
}
