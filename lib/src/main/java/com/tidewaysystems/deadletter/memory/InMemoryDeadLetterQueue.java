package com.tidewaysystems.deadletter.memory;

import com.tidewaysystems.deadletter.DeadLetterQueue;
import com.tidewaysystems.deadletter.DeadLetteredMessage;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class InMemoryDeadLetterQueue implements DeadLetterQueue {

    private final List<DeadLetteredMessage> messages = new CopyOnWriteArrayList<>();

    @Override
    public void enqueue(DeadLetteredMessage deadLettered) {
        messages.add(Objects.requireNonNull(deadLettered, "deadLettered cannot be null"));
    }

    @Override
    public List<DeadLetteredMessage> dequeueAll() {
        return List.copyOf(messages);
    }

    @Override
    public Optional<DeadLetteredMessage> findByMessageId(UUID messageId) {
        return messages.stream()
            .filter(d -> d.message().messageId().equals(messageId))
            .findFirst();
    }

    @Override
    public List<DeadLetteredMessage> findByReason(String reason) {
        return messages.stream()
            .filter(d -> d.reason().equals(reason))
            .collect(Collectors.toList());
    }

    @Override
    public int count() {
        return messages.size();
    }

    @Override
    public void clear() {
        messages.clear();
    }
}
