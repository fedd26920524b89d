package com.tidewaysystems.eventstore;

import com.tidewaysystems.bus.HandlerException;
import com.tidewaysystems.bus.HandlerFailure;
import com.tidewaysystems.message.Event;

import java.util.List;

/**
 * Thrown by {@link EventStore#append} when the append is durable but publishing
 * one or more of the new events failed. The append is not rolled back.
 */
public class EventPublicationException extends HandlerException {

    private static final long serialVersionUID = 1L;

    private final String streamId;
    private final long committedVersion;

    public EventPublicationException(String streamId, long committedVersion, Event firstFailed,
                                     List<HandlerFailure> failures) {
        super(String.format("Events committed to '%s' at version %d but publication failed: %s",
            streamId, committedVersion, failures), firstFailed, failures);
        this.streamId = streamId;
        this.committedVersion = committedVersion;
    }

    public String getStreamId() {
        return streamId;
    }

    /**
     * Gets the stream version the append committed.
     *
     * @return the new highest version of the stream
     */
    public long getCommittedVersion() {
        return committedVersion;
    }
}
