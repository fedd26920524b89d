package com.tidewaysystems.eventstore;

import com.tidewaysystems.message.Event;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Events of one stream, oldest first.
 *
 * <p>Backed by an immutable list of records taken when the stream was loaded. Events are
 * deserialized lazily while iterating, and every iteration starts again from the first
 * record, so the stream can be replayed any number of times. Appends made after loading
 * are not visible.
 */
public final class EventStream implements Iterable<Event> {

    private final String streamId;
    private final List<StoredEvent> records;
    private final EventSerializer serializer;

    public EventStream(String streamId, List<StoredEvent> records, EventSerializer serializer) {
        this.streamId = Objects.requireNonNull(streamId, "streamId cannot be null");
        this.records = List.copyOf(records);
        this.serializer = Objects.requireNonNull(serializer, "serializer cannot be null");
    }

    public static EventStream empty(String streamId, EventSerializer serializer) {
        return new EventStream(streamId, List.of(), serializer);
    }

    @Override
    public Iterator<Event> iterator() {
        return new Iterator<>() {
            private int position;

            @Override
            public boolean hasNext() {
                return position < records.size();
            }

            @Override
            public Event next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return serializer.toEvent(records.get(position++));
            }
        };
    }

    public Stream<Event> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Deserializes every event eagerly.
     */
    public List<Event> toList() {
        return stream().collect(Collectors.toUnmodifiableList());
    }

    public String streamId() {
        return streamId;
    }

    public List<StoredEvent> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Gets the version of the newest event in this stream.
     *
     * @return the last version, or 0 when empty
     */
    public long lastVersion() {
        return records.isEmpty() ? 0 : records.get(records.size() - 1).version();
    }
}
