package com.tidewaysystems.eventstore.upcast;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Transforms the JSON payload of one event type from schema version N to N+1.
 * Runs on a copy of the stored payload; the stored record is never modified.
 */
@FunctionalInterface
public interface Upcaster {

    /**
     * Upcasts a payload by exactly one schema version.
     *
     * @param payload the payload at the source version, owned by the caller
     * @return the payload at the next version, may be {@code payload} modified in place
     */
    ObjectNode upcast(ObjectNode payload);
}
